package uniqv.lexer;

import java.util.*;

public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("fnc", TokenType.FNC),
            Map.entry("class", TokenType.CLASS),
            Map.entry("if", TokenType.IF),
            Map.entry("else", TokenType.ELSE),
            Map.entry("while", TokenType.WHILE),
            Map.entry("for", TokenType.FOR),
            Map.entry("in", TokenType.IN),
            Map.entry("return", TokenType.RETURN),
            Map.entry("public", TokenType.PUBLIC),
            Map.entry("private", TokenType.PRIVATE),
            Map.entry("let", TokenType.LET),
            Map.entry("mut", TokenType.MUT),
            Map.entry("repeat", TokenType.REPEAT),
            Map.entry("until", TokenType.UNTIL),
            Map.entry("fixup", TokenType.FIXUP),
            Map.entry("switch", TokenType.SWITCH),
            Map.entry("case", TokenType.CASE),
            Map.entry("default", TokenType.DEFAULT),
            Map.entry("int", TokenType.INT),
            Map.entry("float", TokenType.FLOAT),
            Map.entry("bool", TokenType.BOOL),
            Map.entry("string", TokenType.STRING),
            Map.entry("void", TokenType.VOID),
            Map.entry("T", TokenType.BOOL_LITERAL),
            Map.entry("F", TokenType.BOOL_LITERAL)
    );

    // characters that always form a token on their own
    private static final Map<Character, TokenType> PUNCTUATION = Map.ofEntries(
            Map.entry('+', TokenType.PLUS),
            Map.entry('-', TokenType.MINUS),
            Map.entry('*', TokenType.STAR),
            Map.entry('%', TokenType.PERCENT),
            Map.entry('(', TokenType.LPAREN),
            Map.entry(')', TokenType.RPAREN),
            Map.entry('{', TokenType.LBRACE),
            Map.entry('}', TokenType.RBRACE),
            Map.entry('[', TokenType.LBRACKET),
            Map.entry(']', TokenType.RBRACKET),
            Map.entry(';', TokenType.SEMICOLON),
            Map.entry(',', TokenType.COMMA)
    );

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int pos = 0;
    private int line = 1;
    private int col = 1;

    private int tokenLine;
    private int tokenCol;

    public Lexer(String source) {
        this.source = source;
    }

    public static boolean isKeyword(String text) {
        return KEYWORDS.containsKey(text);
    }

    public List<Token> tokenize() {
        while (true) {
            skipTrivia();
            if (isAtEnd()) break;

            tokenLine = line;
            tokenCol = col;
            char c = advance();

            TokenType single = PUNCTUATION.get(c);
            if (single != null) {
                emit(single, String.valueOf(c));
                continue;
            }

            switch (c) {
                case '=' -> either('=', TokenType.EQ, TokenType.ASSIGN);
                case '!' -> either('=', TokenType.NEQ, TokenType.NOT);
                case '<' -> either('=', TokenType.LE, TokenType.LT);
                case '>' -> either('=', TokenType.GE, TokenType.GT);
                case ':' -> either(':', TokenType.DCOLON, TokenType.COLON);
                case '&' -> doubled('&', TokenType.AND);
                case '|' -> doubled('|', TokenType.OR);
                case '/' -> emit(TokenType.SLASH, "/");
                case '.' -> dotOrRange();
                case '"' -> stringLiteral();
                default -> {
                    if (isDigit(c)) numberLiteral();
                    else if (isIdentStart(c)) identifierOrKeyword();
                    else error("Unexpected character: " + c);
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", line, col));
        return tokens;
    }

    // ---------- token shapes ----------

    private void either(char second, TokenType twoChar, TokenType oneChar) {
        char first = source.charAt(pos - 1);
        if (match(second)) emit(twoChar, "" + first + second);
        else emit(oneChar, String.valueOf(first));
    }

    private void doubled(char c, TokenType type) {
        if (!match(c)) error("Unexpected '" + c + "'");
        emit(type, "" + c + c);
    }

    private void dotOrRange() {
        if (peek() == '.' && peekAt(1) == '.') {
            advance();
            advance();
            emit(TokenType.RANGE, "...");
        } else {
            emit(TokenType.DOT, ".");
        }
    }

    private void numberLiteral() {
        int start = pos - 1;
        while (isDigit(peek())) advance();

        TokenType type = TokenType.INT_LITERAL;
        // "1...n" is a range, not a float
        if (peek() == '.' && isDigit(peekAt(1))) {
            type = TokenType.FLOAT_LITERAL;
            advance();
            while (isDigit(peek())) advance();
        }
        emit(type, source.substring(start, pos));
    }

    private void identifierOrKeyword() {
        int start = pos - 1;
        while (isIdentPart(peek())) advance();

        String text = source.substring(start, pos);
        emit(KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER), text);
    }

    private void stringLiteral() {
        int start = pos;
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\n') error("Unterminated string");
            advance();
        }
        if (isAtEnd()) error("Unterminated string");

        String text = source.substring(start, pos);
        advance(); // closing quote
        emit(TokenType.STRING_LITERAL, text);
    }

    // whitespace and // comments
    private void skipTrivia() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\n') {
                advance();
                line++;
                col = 1;
            } else if (c == ' ' || c == '\t' || c == '\r') {
                advance();
            } else if (c == '/' && peekAt(1) == '/') {
                while (!isAtEnd() && peek() != '\n') advance();
            } else {
                return;
            }
        }
    }

    // ---------- cursor ----------

    private boolean match(char expected) {
        if (peek() != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        col++;
        return source.charAt(pos++);
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekAt(int offset) {
        int i = pos + offset;
        return i < source.length() ? source.charAt(i) : '\0';
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return isIdentStart(c) || isDigit(c);
    }

    private void emit(TokenType type, String lexeme) {
        tokens.add(new Token(type, lexeme, tokenLine, tokenCol));
    }

    private void error(String message) {
        throw new LexerException("[" + line + ":" + col + "] " + message);
    }
}
