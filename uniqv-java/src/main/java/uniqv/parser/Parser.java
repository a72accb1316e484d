package uniqv.parser;

import uniqv.ast.Program;
import uniqv.ast.decl.ClassDecl;
import uniqv.ast.decl.ConstructorDecl;
import uniqv.ast.decl.FieldDecl;
import uniqv.ast.decl.FunctionDecl;
import uniqv.ast.decl.MethodDecl;
import uniqv.ast.decl.ParamTuple;
import uniqv.ast.expr.*;
import uniqv.ast.pattern.DiscardPattern;
import uniqv.ast.pattern.NamePattern;
import uniqv.ast.pattern.Pattern;
import uniqv.ast.pattern.TuplePattern;
import uniqv.ast.stmt.*;
import uniqv.ast.type.ArrayTypeRef;
import uniqv.ast.type.NamedTypeRef;
import uniqv.ast.type.PrimitiveTypeRef;
import uniqv.ast.type.TypeRef;
import uniqv.lexer.Token;
import uniqv.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

public final class Parser {
    private static final String DISCARD = "_";

    private final List<Token> tokens;
    private int pos = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    // ---------- entry ----------
    public Program parseProgram() {
        List<FunctionDecl> functions = new ArrayList<>();
        List<ClassDecl> classes = new ArrayList<>();

        while (!check(TokenType.EOF)) {
            if (match(TokenType.FNC)) functions.add(parseFunctionDecl());
            else if (match(TokenType.CLASS)) classes.add(parseClassDecl());
            else throw error(peek(), "Expected 'fnc' or 'class' at top-level");
        }
        consume(TokenType.EOF, "Expected EOF");
        return new Program(functions, classes);
    }

    // ---------- function ----------
    private FunctionDecl parseFunctionDecl() {
        Token name = consume(TokenType.IDENTIFIER, "Expected function name");
        consume(TokenType.COLON, "Expected ':' after function name");
        TypeRef retType = parseTypeRef();

        ParamTuple.Tuple params = parseParamList();
        BlockStmt body = parseBlock();
        return new FunctionDecl(name.lexeme(), retType, params, body);
    }

    // '(' (param (',' param)*)? ')'
    private ParamTuple.Tuple parseParamList() {
        consume(TokenType.LPAREN, "Expected '(' before parameters");
        if (match(TokenType.RPAREN)) return ParamTuple.empty();

        List<ParamTuple> items = new ArrayList<>();
        do {
            items.add(parseParam());
        } while (match(TokenType.COMMA));
        consume(TokenType.RPAREN, "Expected ')' after parameters");
        return new ParamTuple.Tuple(items);
    }

    private ParamTuple parseParam() {
        if (check(TokenType.LPAREN)) {
            ParamTuple.Tuple nested = parseParamList();
            if (nested.items().isEmpty()) throw error(previous(), "Empty parameter tuple");
            return nested;
        }
        Token n = consume(TokenType.IDENTIFIER, "Expected parameter name");
        consume(TokenType.COLON, "Expected ':' after parameter name");
        TypeRef t = parseTypeRef();
        return new ParamTuple.Item(DISCARD.equals(n.lexeme()) ? null : n.lexeme(), t);
    }

    // ---------- class ----------
    private ClassDecl parseClassDecl() {
        String className = consume(TokenType.IDENTIFIER, "Expected class name").lexeme();
        consume(TokenType.LBRACE, "Expected '{' after class name");

        List<FieldDecl> fields = new ArrayList<>();
        List<MethodDecl> methods = new ArrayList<>();
        List<ConstructorDecl> constructors = new ArrayList<>();

        boolean currentPublic = false; // members are private until a label says otherwise

        while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
            if (match(TokenType.PUBLIC, TokenType.PRIVATE)) {
                currentPublic = previous().type() == TokenType.PUBLIC;
                consume(TokenType.COLON, "Expected ':' after access label");
                continue;
            }

            // constructor: ClassName(params) { ... }
            if (check(TokenType.IDENTIFIER)
                    && peek().lexeme().equals(className)
                    && checkNext(TokenType.LPAREN)) {
                advance();
                ParamTuple.Tuple params = parseParamList();
                constructors.add(new ConstructorDecl(className, params, parseBlock(), currentPublic));
                continue;
            }

            Token memberName = consume(TokenType.IDENTIFIER, "Expected field/method name");
            consume(TokenType.COLON, "Expected ':' after member name");
            TypeRef t = parseTypeRef();

            // method: name : type (params) { ... }
            if (check(TokenType.LPAREN)) {
                ParamTuple.Tuple params = parseParamList();
                methods.add(new MethodDecl(memberName.lexeme(), t, params, parseBlock(), currentPublic));
                continue;
            }

            consume(TokenType.SEMICOLON, "Expected ';' after field declaration");
            fields.add(new FieldDecl(memberName.lexeme(), t, currentPublic));
        }

        consume(TokenType.RBRACE, "Expected '}' after class body");
        return new ClassDecl(className, fields, methods, constructors);
    }

    // ---------- block / statements ----------
    private BlockStmt parseBlock() {
        consume(TokenType.LBRACE, "Expected '{'");
        List<Stmt> stmts = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
            stmts.add(parseStmt());
        }
        consume(TokenType.RBRACE, "Expected '}'");
        return new BlockStmt(stmts);
    }

    private Stmt parseStmt() {
        if (check(TokenType.LBRACE)) return parseBlock();

        if (match(TokenType.IF)) return parseIf();
        if (match(TokenType.WHILE)) return parseWhile();
        if (match(TokenType.FOR)) return parseFor();
        if (match(TokenType.REPEAT)) return parseRepeat();
        if (match(TokenType.SWITCH)) return parseSwitch();
        if (match(TokenType.RETURN)) return parseReturn();

        if (check(TokenType.LET) || check(TokenType.MUT) || isTypedDeclStart()) {
            VarDeclStmt v = parseVarDeclNoSemicolon();
            consume(TokenType.SEMICOLON, "Expected ';' after variable declaration");
            return v;
        }

        Expr e = parseExpr();
        consume(TokenType.SEMICOLON, "Expected ';' after expression");
        return new ExprStmt(e);
    }

    private boolean isTypedDeclStart() {
        return check(TokenType.IDENTIFIER) && checkNext(TokenType.COLON);
    }

    // let p = e | mut p = e | x:type (= e)?
    private VarDeclStmt parseVarDeclNoSemicolon() {
        if (match(TokenType.LET, TokenType.MUT)) {
            boolean mutable = previous().type() == TokenType.MUT;
            Pattern target = parsePattern();
            consume(TokenType.ASSIGN, "Expected '=' in declaration");
            return new VarDeclStmt(target, null, parseExpr(), mutable);
        }

        Token name = consume(TokenType.IDENTIFIER, "Expected variable name");
        consume(TokenType.COLON, "Expected ':' after variable name");
        TypeRef type = parseTypeRef();

        Expr init = null;
        if (match(TokenType.ASSIGN)) {
            init = parseExpr();
        }
        return new VarDeclStmt(namePattern(name), type, init, true);
    }

    private Pattern parsePattern() {
        if (match(TokenType.LPAREN)) {
            List<Pattern> items = new ArrayList<>();
            do {
                items.add(parsePattern());
            } while (match(TokenType.COMMA));
            consume(TokenType.RPAREN, "Expected ')' after tuple pattern");
            return new TuplePattern(items);
        }
        return namePattern(consume(TokenType.IDENTIFIER, "Expected variable name or '_'"));
    }

    private static Pattern namePattern(Token name) {
        return DISCARD.equals(name.lexeme()) ? new DiscardPattern() : new NamePattern(name.lexeme());
    }

    private IfStmt parseIf() {
        List<IfStmt.Branch> branches = new ArrayList<>();
        BlockStmt elseB = null;

        do {
            consume(TokenType.LPAREN, "Expected '(' after if");
            Expr cond = parseExpr();
            consume(TokenType.RPAREN, "Expected ')'");
            branches.add(new IfStmt.Branch(cond, parseBlock()));

            if (!match(TokenType.ELSE)) break;
            if (!match(TokenType.IF)) {
                elseB = parseBlock();
                break;
            }
        } while (true);

        return new IfStmt(branches, elseB);
    }

    private WhileStmt parseWhile() {
        consume(TokenType.LPAREN, "Expected '(' after while");
        Expr cond = parseExpr();
        consume(TokenType.RPAREN, "Expected ')'");
        return new WhileStmt(cond, parseBlock());
    }

    private Stmt parseFor() {
        consume(TokenType.LPAREN, "Expected '(' after for");

        // range-for: for (pattern in expr...expr) block
        if (isRangeHeader()) {
            Pattern var = parsePattern();
            consume(TokenType.IN, "Expected 'in'");
            Expr from = parseExpr();
            consume(TokenType.RANGE, "Expected '...' in range for");
            Expr to = parseExpr();
            consume(TokenType.RPAREN, "Expected ')'");
            return new ForRangeStmt(var, from, to, parseBlock());
        }

        // C-style for: for (init; cond; update) block
        Stmt init = null;
        if (!check(TokenType.SEMICOLON)) {
            init = (check(TokenType.LET) || check(TokenType.MUT) || isTypedDeclStart())
                    ? parseVarDeclNoSemicolon()
                    : new ExprStmt(parseExpr());
        }
        consume(TokenType.SEMICOLON, "Expected ';' after for-init");

        Expr cond = check(TokenType.SEMICOLON) ? null : parseExpr();
        consume(TokenType.SEMICOLON, "Expected ';' after for-condition");

        Expr update = check(TokenType.RPAREN) ? null : parseExpr();
        consume(TokenType.RPAREN, "Expected ')' after for");

        return new ForStmt(init, cond, update, parseBlock());
    }

    // a pattern made of identifiers, commas and parens followed by 'in'
    private boolean isRangeHeader() {
        int depth = 0;
        for (int i = pos; i < tokens.size(); i++) {
            TokenType t = tokens.get(i).type();
            if (t == TokenType.LPAREN) depth++;
            else if (t == TokenType.RPAREN) {
                if (--depth < 0) return false;
            } else if (t == TokenType.IN) {
                return depth == 0 && i > pos;
            } else if (t != TokenType.IDENTIFIER && t != TokenType.COMMA) {
                return false;
            }
        }
        return false;
    }

    private RepeatStmt parseRepeat() {
        BlockStmt body = parseBlock();
        consume(TokenType.UNTIL, "Expected 'until' after repeat block");
        consume(TokenType.LPAREN, "Expected '(' after until");
        Expr cond = parseExpr();
        consume(TokenType.RPAREN, "Expected ')'");

        BlockStmt fixup = match(TokenType.FIXUP) ? parseBlock() : null;
        consume(TokenType.SEMICOLON, "Expected ';' after repeat statement");
        return new RepeatStmt(body, cond, fixup);
    }

    private SwitchStmt parseSwitch() {
        consume(TokenType.LPAREN, "Expected '(' after switch");
        Expr subject = parseExpr();
        consume(TokenType.RPAREN, "Expected ')'");
        consume(TokenType.LBRACE, "Expected '{' after switch subject");

        List<SwitchStmt.Case> cases = new ArrayList<>();
        while (match(TokenType.CASE)) {
            Expr m = parseExpr();
            cases.add(new SwitchStmt.Case(m, parseBlock()));
        }
        BlockStmt defaultBlock = match(TokenType.DEFAULT) ? parseBlock() : null;

        consume(TokenType.RBRACE, "Expected '}' after switch cases");
        return new SwitchStmt(subject, cases, defaultBlock);
    }

    private ReturnStmt parseReturn() {
        if (match(TokenType.SEMICOLON)) {
            return new ReturnStmt(null);
        }
        Expr value = parseExpr();
        consume(TokenType.SEMICOLON, "Expected ';' after return");
        return new ReturnStmt(value);
    }

    // ---------- types ----------
    private TypeRef parseTypeRef() {
        TypeRef base;
        if (match(TokenType.INT, TokenType.FLOAT, TokenType.BOOL, TokenType.STRING, TokenType.VOID)) {
            base = new PrimitiveTypeRef(previous().lexeme());
        } else {
            Token n = consume(TokenType.IDENTIFIER, "Expected type name");
            base = new NamedTypeRef(n.lexeme());
        }

        // array suffix: [] or [N]
        while (match(TokenType.LBRACKET)) {
            Integer size = null;
            if (check(TokenType.INT_LITERAL)) {
                size = intValue(advance());
            }
            consume(TokenType.RBRACKET, "Expected ']'");
            base = new ArrayTypeRef(base, size);
        }
        return base;
    }

    // ---------- expressions (precedence climbing) ----------
    private Expr parseExpr() { return parseAssign(); }

    private Expr parseAssign() {
        Expr left = parseOr();
        if (match(TokenType.ASSIGN)) {
            Expr right = parseAssign(); // right-assoc

            if (!(left instanceof VarExpr
                    || left instanceof FieldAccessExpr
                    || left instanceof ArrayAccessExpr)) {
                throw error(previous(), "Invalid assignment target");
            }
            return new AssignExpr(left, right);
        }
        return left;
    }

    private Expr parseOr() {
        Expr e = parseAnd();
        while (match(TokenType.OR)) {
            e = new BinaryExpr(e, BinaryExpr.Operator.OR, parseAnd());
        }
        return e;
    }

    private Expr parseAnd() {
        Expr e = parseCompare();
        while (match(TokenType.AND)) {
            e = new BinaryExpr(e, BinaryExpr.Operator.AND, parseCompare());
        }
        return e;
    }

    private Expr parseCompare() {
        Expr e = parseAdd();
        while (match(TokenType.LT, TokenType.LE, TokenType.GT, TokenType.GE, TokenType.EQ, TokenType.NEQ)) {
            BinaryExpr.Operator op = toBinOp(previous().type());
            e = new BinaryExpr(e, op, parseAdd());
        }
        return e;
    }

    private Expr parseAdd() {
        Expr e = parseMul();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            BinaryExpr.Operator op = toBinOp(previous().type());
            e = new BinaryExpr(e, op, parseMul());
        }
        return e;
    }

    private Expr parseMul() {
        Expr e = parseUnary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            BinaryExpr.Operator op = toBinOp(previous().type());
            e = new BinaryExpr(e, op, parseUnary());
        }
        return e;
    }

    private Expr parseUnary() {
        if (match(TokenType.NOT)) {
            return new UnaryExpr(UnaryExpr.Operator.NOT, parseUnary());
        }
        if (match(TokenType.MINUS)) {
            return new UnaryExpr(UnaryExpr.Operator.NEG, parseUnary());
        }
        return parsePostfix();
    }

    private Expr parsePostfix() {
        Expr e = parsePrimary();
        while (true) {
            if (match(TokenType.LPAREN)) {
                e = new CallExpr(e, parseExprListUntil(TokenType.RPAREN));
            } else if (match(TokenType.LBRACKET)) {
                Expr idx = parseExpr();
                consume(TokenType.RBRACKET, "Expected ']'");
                e = new ArrayAccessExpr(e, idx);
            } else if (match(TokenType.DOT)) {
                Token name = consume(TokenType.IDENTIFIER, "Expected field name after '.'");
                e = new FieldAccessExpr(e, name.lexeme());
            } else {
                return e;
            }
        }
    }

    // comma-separated, possibly empty; consumes the closing token
    private List<Expr> parseExprListUntil(TokenType close) {
        List<Expr> items = new ArrayList<>();
        if (!check(close)) {
            do { items.add(parseExpr()); } while (match(TokenType.COMMA));
        }
        consume(close, "Expected '" + (close == TokenType.RPAREN ? ")" : "]") + "'");
        return items;
    }

    private Expr parsePrimary() {
        if (match(TokenType.LBRACKET)) return new ArrayLiteralExpr(parseExprListUntil(TokenType.RBRACKET));
        if (match(TokenType.INT_LITERAL)) return new IntLiteral(intValue(previous()));
        if (match(TokenType.FLOAT_LITERAL)) return new FloatLiteral(previous().lexeme());
        if (match(TokenType.STRING_LITERAL)) return new StringLiteral(previous().lexeme());
        if (match(TokenType.BOOL_LITERAL)) return new BoolLiteral("T".equals(previous().lexeme()));
        if (match(TokenType.IDENTIFIER)) return parseIdentifier(previous());
        if (match(TokenType.LPAREN)) {
            Expr e = parseExpr();
            if (!match(TokenType.COMMA)) {
                consume(TokenType.RPAREN, "Expected ')'");
                return e;
            }
            List<Expr> items = new ArrayList<>();
            items.add(e);
            items.addAll(parseExprListUntil(TokenType.RPAREN));
            return new TupleExpr(items);
        }
        throw error(peek(), "Expected expression");
    }

    // name or name::<T, U>
    private Expr parseIdentifier(Token name) {
        if (!match(TokenType.DCOLON)) return new VarExpr(name.lexeme());

        consume(TokenType.LT, "Expected '<' after '::'");
        List<TypeRef> typeArgs = new ArrayList<>();
        do {
            typeArgs.add(parseTypeRef());
        } while (match(TokenType.COMMA));
        consume(TokenType.GT, "Expected '>' after type arguments");
        return new VarExpr(name.lexeme(), typeArgs);
    }

    // ---------- helpers ----------
    private boolean match(TokenType... types) {
        for (TokenType t : types) {
            if (check(t)) { advance(); return true; }
        }
        return false;
    }

    private Token consume(TokenType t, String msg) {
        if (check(t)) return advance();
        throw error(peek(), msg);
    }

    private boolean check(TokenType t) {
        return peek().type() == t;
    }

    private boolean checkNext(TokenType t) {
        if (pos + 1 >= tokens.size()) return false;
        return tokens.get(pos + 1).type() == t;
    }

    private Token advance() {
        if (!check(TokenType.EOF)) pos++;
        return previous();
    }

    private Token peek() { return tokens.get(pos); }
    private Token previous() { return tokens.get(pos - 1); }

    private ParseException error(Token at, String msg) {
        return new ParseException(at, msg);
    }

    private int intValue(Token literal) {
        try {
            return Integer.parseInt(literal.lexeme());
        } catch (NumberFormatException e) {
            throw error(literal, "Integer literal out of range");
        }
    }

    private static BinaryExpr.Operator toBinOp(TokenType t) {
        return switch (t) {
            case PLUS    -> BinaryExpr.Operator.ADD;
            case MINUS   -> BinaryExpr.Operator.SUB;
            case STAR    -> BinaryExpr.Operator.MUL;
            case SLASH   -> BinaryExpr.Operator.DIV;
            case PERCENT -> BinaryExpr.Operator.MOD;

            case EQ  -> BinaryExpr.Operator.EQ;
            case NEQ -> BinaryExpr.Operator.NE;
            case LT  -> BinaryExpr.Operator.LT;
            case GT  -> BinaryExpr.Operator.GT;
            case LE  -> BinaryExpr.Operator.LE;
            case GE  -> BinaryExpr.Operator.GE;

            default -> throw new IllegalArgumentException("Not a binary operator token: " + t);
        };
    }
}
