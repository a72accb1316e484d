package uniqv.parser;

import org.junit.jupiter.api.Test;
import uniqv.ast.Program;
import uniqv.ast.decl.FunctionDecl;
import uniqv.ast.decl.ParamTuple;
import uniqv.ast.expr.*;
import uniqv.ast.pattern.DiscardPattern;
import uniqv.ast.pattern.NamePattern;
import uniqv.ast.pattern.TuplePattern;
import uniqv.ast.stmt.*;
import uniqv.ast.type.ArrayTypeRef;
import uniqv.ast.type.NamedTypeRef;
import uniqv.ast.type.PrimitiveTypeRef;
import uniqv.lexer.Lexer;
import uniqv.lexer.TokenType;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static Program parse(String src) {
        var tokens = new Lexer(src).tokenize();
        return new Parser(tokens).parseProgram();
    }

    private static FunctionDecl firstFn(Program p) {
        return p.functions().get(0);
    }

    private static Stmt firstStmt(String body) {
        return firstFn(parse("fnc f : void() {" + body + "}")).body().statements().get(0);
    }

    @Test
    void parse_program_with_function_and_class() {
        var p = parse("""
            class A { public: x: int; }
            fnc main : void() { return; }
            """);
        assertEquals(1, p.classes().size());
        assertEquals(1, p.functions().size());
        assertTrue(p.classes().get(0).fields().get(0).isPublic());
    }

    @Test
    void parse_class_members() {
        var p = parse("""
            class Counter {
              n: int;
            public:
              Counter(start: int) { n = start; }
              next : int() { n = n + 1; return n; }
            }
            """);
        var c = p.classes().get(0);
        assertFalse(c.fields().get(0).isPublic());
        assertEquals(1, c.constructors().size());
        assertEquals("Counter", c.constructors().get(0).name());
        assertEquals("next", c.methods().get(0).name());
        assertTrue(c.methods().get(0).isPublic());
    }

    @Test
    void parse_function_params_and_return_type() {
        var f = firstFn(parse("""
            fnc f : int(a:int, b:float) { return 1; }
            """));
        assertEquals("f", f.name());
        assertTrue(f.returnType() instanceof PrimitiveTypeRef);
        assertEquals(2, f.params().items().size());
    }

    @Test
    void parse_nested_and_unnamed_params() {
        var f = firstFn(parse("""
            fnc f : void(a:int, (b:int, (c:bool)), _:string) { return; }
            """));
        var items = f.params().items();
        assertEquals("a", ((ParamTuple.Item) items.get(0)).name());

        var nested = (ParamTuple.Tuple) items.get(1);
        assertEquals("b", ((ParamTuple.Item) nested.items().get(0)).name());
        assertTrue(nested.items().get(1) instanceof ParamTuple.Tuple);

        var unnamed = (ParamTuple.Item) items.get(2);
        assertFalse(unnamed.isNamed());
        assertEquals(new PrimitiveTypeRef("string"), unnamed.type());
    }

    @Test
    void parse_empty_param_tuple_throws() {
        assertThrows(ParseException.class, () -> parse("fnc f : void(a:int, ()) { }"));
    }

    @Test
    void parse_type_arrays_and_named() {
        var f = firstFn(parse("""
            fnc f : void(a:int[3], b:int[], c:Point) { return; }
            """));
        var p0 = (ParamTuple.Item) f.params().items().get(0);
        var p1 = (ParamTuple.Item) f.params().items().get(1);
        var p2 = (ParamTuple.Item) f.params().items().get(2);

        assertEquals(3, ((ArrayTypeRef) p0.type()).size());
        assertNull(((ArrayTypeRef) p1.type()).size());
        assertEquals(new NamedTypeRef("Point"), p2.type());
    }

    @Test
    void parse_typed_var_decl_with_init_and_without() {
        var stmts = firstFn(parse("""
            fnc f : void() {
              x:int;
              y:int = 10;
              return;
            }
            """)).body().statements();
        var x = (VarDeclStmt) stmts.get(0);
        var y = (VarDeclStmt) stmts.get(1);
        assertEquals(new NamePattern("x"), x.target());
        assertNull(x.initializer());
        assertTrue(x.mutable());
        assertNotNull(y.initializer());
    }

    @Test
    void parse_let_and_mut_with_patterns() {
        var let = (VarDeclStmt) firstStmt("let (a, (b, _)) = (1, (2, 3));");
        assertFalse(let.mutable());
        assertNull(let.type());
        assertEquals(new TuplePattern(List.of(
                new NamePattern("a"),
                new TuplePattern(List.of(new NamePattern("b"), new DiscardPattern())))), let.target());
        assertTrue(let.initializer() instanceof TupleExpr);

        var mut = (VarDeclStmt) firstStmt("mut x = 0;");
        assertTrue(mut.mutable());
        assertEquals(new NamePattern("x"), mut.target());
    }

    @Test
    void parse_if_else_if_chain() {
        var ifs = (IfStmt) firstStmt("if (T) { } else if (F) { } else { }");
        assertEquals(2, ifs.branches().size());
        assertNotNull(ifs.elseBlock());
    }

    @Test
    void parse_while_stmt() {
        assertTrue(firstStmt("while (T) { }") instanceof WhileStmt);
    }

    @Test
    void parse_for_range_stmt() {
        var fr = (ForRangeStmt) firstStmt("for (i in 0...10) { }");
        assertEquals(new NamePattern("i"), fr.variable());
        assertTrue(fr.from() instanceof IntLiteral);
        assertTrue(fr.to() instanceof IntLiteral);
    }

    @Test
    void parse_for_range_with_tuple_pattern() {
        var fr = (ForRangeStmt) firstStmt("for ((i, _) in a...b) { }");
        assertTrue(fr.variable() instanceof TuplePattern);
    }

    @Test
    void parse_for_c_style_full_parts() {
        var fs = (ForStmt) firstStmt("for (i:int = 0; i < 10; i = i + 1) { }");
        assertTrue(fs.init() instanceof VarDeclStmt);
        assertTrue(fs.condition() instanceof BinaryExpr);
        assertTrue(fs.update() instanceof AssignExpr);
    }

    @Test
    void parse_for_c_style_with_let_init() {
        var fs = (ForStmt) firstStmt("for (mut i = 0; i < 3; i = i + 1) { }");
        assertEquals(new NamePattern("i"), ((VarDeclStmt) fs.init()).target());
    }

    @Test
    void parse_for_c_style_empty_parts() {
        var fs = (ForStmt) firstStmt("for (; ; ) { }");
        assertNull(fs.init());
        assertNull(fs.condition());
        assertNull(fs.update());
    }

    @Test
    void parse_repeat_until_with_and_without_fixup() {
        var plain = (RepeatStmt) firstStmt("repeat { let y = 1; } until (y > 0);");
        assertEquals(1, plain.body().statements().size());
        assertTrue(plain.condition() instanceof BinaryExpr);
        assertNull(plain.fixup());

        var withFixup = (RepeatStmt) firstStmt("repeat { } until (done) fixup { retry(); };");
        assertNotNull(withFixup.fixup());
    }

    @Test
    void parse_repeat_requires_semicolon() {
        assertThrows(ParseException.class, () -> parse("fnc f : void() { repeat { } until (T) }"));
    }

    @Test
    void parse_switch_cases_and_default() {
        var sw = (SwitchStmt) firstStmt("switch (x) { case 1 { } case 2 { return; } default { } }");
        assertTrue(sw.subject() instanceof VarExpr);
        assertEquals(2, sw.cases().size());
        assertNotNull(sw.defaultBlock());
    }

    @Test
    void parse_return_with_and_without_value() {
        var p = parse("""
            fnc f : void() { return; }
            fnc g : int() { return 1; }
            """);
        assertNull(((ReturnStmt) p.functions().get(0).body().statements().get(0)).value());
        assertNotNull(((ReturnStmt) p.functions().get(1).body().statements().get(0)).value());
    }

    @Test
    void parse_expr_precedence_and_assign_unary() {
        var s = (ExprStmt) firstStmt("x = -1 + 2 * 3;");
        var asg = (AssignExpr) s.expr();
        assertTrue(asg.target() instanceof VarExpr);

        var add = (BinaryExpr) asg.value();
        assertEquals(BinaryExpr.Operator.ADD, add.op());
        assertTrue(add.left() instanceof UnaryExpr);
        assertEquals(BinaryExpr.Operator.MUL, ((BinaryExpr) add.right()).op());
    }

    @Test
    void parse_postfix_chain_call_index_field() {
        var stmt = (ExprStmt) firstStmt("a.b(1,2)[3].c;");
        var fa = (FieldAccessExpr) stmt.expr();
        assertEquals("c", fa.field());
        assertTrue(fa.target() instanceof ArrayAccessExpr);
    }

    @Test
    void parse_type_arguments_on_identifier() {
        var call = (CallExpr) ((ExprStmt) firstStmt("id::<int, bool[]>(x);")).expr();
        var callee = (VarExpr) call.callee();
        assertEquals("id", callee.name());
        assertEquals(List.of(new PrimitiveTypeRef("int"), new ArrayTypeRef(new PrimitiveTypeRef("bool"), null)),
                callee.typeArgs());
    }

    @Test
    void parse_paren_is_grouping_and_comma_makes_tuple() {
        var grouped = ((ReturnStmt) firstStmt("return (x);")).value();
        assertEquals(new VarExpr("x"), grouped);

        var tuple = (TupleExpr) ((ReturnStmt) firstStmt("return (x, 1);")).value();
        assertEquals(2, tuple.items().size());
    }

    @Test
    void parse_invalid_assignment_target_throws() {
        assertThrows(ParseException.class, () -> parse("""
            fnc f : void() { (1) = 2; }
            """));
    }

    @Test
    void parse_missing_semicolon_throws_with_position() {
        var ex = assertThrows(ParseException.class, () -> parse("""
            fnc f : void() { x:int = 1 }
            """));
        assertEquals(TokenType.RBRACE, ex.token().type());
        assertTrue(ex.getMessage().startsWith("[1:28]"), ex.getMessage());
    }

    @Test
    void parse_int_literal_bounds() {
        var decl = (VarDeclStmt) firstStmt("let x = 2147483647;");
        assertEquals(new IntLiteral(Integer.MAX_VALUE), decl.initializer());

        var ex = assertThrows(ParseException.class, () -> parse("""
            fnc f : int() { let x = 2147483648; return x; }
            """));
        assertEquals(TokenType.INT_LITERAL, ex.token().type());
        assertTrue(ex.getMessage().startsWith("[1:25] Integer literal out of range"), ex.getMessage());
    }

    @Test
    void parse_array_size_out_of_range_throws() {
        assertThrows(ParseException.class, () -> parse("fnc f : void() { a: int[99999999999]; }"));
    }
}
