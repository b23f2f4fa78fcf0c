package bytebeat.sema;

import bytebeat.ast.Program;
import bytebeat.ast.expr.Expr;
import bytebeat.ast.expr.FunctionCall;
import bytebeat.ast.expr.Value;
import bytebeat.lexer.Lexer;
import bytebeat.parser.Parser;
import bytebeat.types.PrimitiveType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TypeCheckerTest {

    private static Program check(String src) {
        return Program.parse(src);
    }

    private static List<String> messages(Program p) {
        return p.typeErrors().stream().map(TypeError::message).toList();
    }

    private static Expr expression(String src) {
        return new Parser(new Lexer(src).tokenize()).parseExpression();
    }

    @ParameterizedTest
    @CsvSource(delimiterString = "=>", value = {
            "t * 2                 => INT",
            "t_f * 2.0             => FLOAT",
            "1 < 2                 => BOOL",
            "true && false         => BOOL",
            "1.5 == 2.5            => BOOL",
            "t > 1 ? 1 : 2         => INT",
            "float(t) / 2.0        => FLOAT",
            "int(t_f)              => INT",
            "bool(1)               => BOOL",
            "(a = 1.5, a)          => FLOAT",
            "x                     => INT",
            "-t_f                  => FLOAT",
            "~t                    => INT",
            "!true                 => BOOL",
            "t | 1                 => INT",
            "true || false         => BOOL"
    })
    void type_well_typed_expression(String src, PrimitiveType expected) {
        var result = expression(src).type(new TypeContext());
        assertEquals(List.of(), result.errors());
        assertEquals(expected, result.type());
    }

    @ParameterizedTest
    @CsvSource(delimiterString = "=>", value = {
            "t_f * 2.0             => int(t_f * 2.0)",
            "1 < 2                 => int(1 < 2)",
            "(a = 1.5, a)          => int((a = 1.5, a))",
            "float f = 1.; f       => int(f)",
            "t * 2                 => t * 2",
            "int(t_f)              => int(t_f)"
    })
    void type_output_is_coerced_to_int(String src, String expected) {
        var p = check(src);
        assertEquals(List.of(), p.typeErrors());
        assertEquals(PrimitiveType.INT, p.exprType().type());
        assertEquals(expected, p.expr().toString());
    }

    @Test
    void type_ill_typed_output_is_not_coerced() {
        var p = check("true + 1.5");
        assertTrue(p.exprType().isErr());
        assertFalse(p.expr() instanceof FunctionCall);
    }

    @Test
    void type_mismatch_after_bool_declaration() {
        var p = check("bool b = true; b + 1");
        assertEquals(1, p.typeErrors().size());
        assertEquals("Operator '+' expects matching operands, got bool and int", p.typeErrors().get(0).message());
        assertTrue(p.exprType().isErr());
    }

    @Test
    void type_operand_class_errors() {
        assertEquals(List.of("Operator '<<' expects int operands, got float"), messages(check("1.5 << 2.0")));
        assertEquals(List.of("Operator '&&' expects bool operands, got int"), messages(check("1 && 2")));
        assertEquals(List.of("Unary '!' expects bool, got int"), messages(check("!1")));
        assertEquals(List.of("Unary '-' expects int or float, got bool"), messages(check("-true")));
    }

    @Test
    void type_ternary_rules() {
        assertEquals(List.of("Ternary condition must be bool, got int"), messages(check("t ? 1 : 2")));
        assertEquals(List.of("Ternary branches differ: int and float"), messages(check("true ? 1 : 2.0")));
    }

    @Test
    void type_assignment_under_type_keyword_takes_value_type() {
        var p = check("float x = 1; x");
        assertEquals(List.of(), p.typeErrors());
        assertEquals(PrimitiveType.INT, p.typeContext().lookup("x"));
        assertTrue(p.typeContext().bindings().get("x").explicitlyDeclared());

        var q = check("int a = 1.5; a");
        assertEquals(List.of(), q.typeErrors());
        assertEquals(PrimitiveType.FLOAT, q.typeContext().lookup("a"));
        assertEquals(PrimitiveType.INT, q.exprType().type());
    }

    @Test
    void type_bare_name_under_type_keyword_takes_keyword_type() {
        var p = check("float x = 1, y; y");
        assertEquals(PrimitiveType.INT, p.typeContext().lookup("x"));
        assertEquals(PrimitiveType.FLOAT, p.typeContext().lookup("y"));
    }

    @Test
    void type_implicit_assignment_takes_value_type() {
        var p = check("a = 1.5; a");
        assertEquals(List.of(), p.typeErrors());
        assertEquals(PrimitiveType.FLOAT, p.typeContext().lookup("a"));
        assertFalse(p.typeContext().bindings().get("a").explicitlyDeclared());
    }

    @Test
    void type_reassignment_keeps_first_type() {
        var p = check("a = 1; a = 2.0; a");
        assertEquals(List.of("Cannot assign float to 'a' of type int"), messages(p));
    }

    @Test
    void type_redeclaration_at_other_type() {
        assertEquals(List.of("'a' is already declared as int"), messages(check("int a; float a; a")));
        // same type is fine
        assertEquals(List.of(), messages(check("int a; int a; a")));
    }

    @Test
    void type_declared_float_does_not_mix_with_int() {
        assertEquals(1, check("float f; f + 1").typeErrors().size());
        assertEquals(List.of(), check("float f; f + 1.0").typeErrors());
    }

    @Test
    void type_calls() {
        assertEquals(List.of("int(...) expects exactly one argument, got 2"), messages(check("int(1, 2)")));
        // only the type keywords parse as calls
        var call = new FunctionCall("sin", List.of(Value.ident("t")));
        var result = call.type(new TypeContext());
        assertTrue(result.isErr());
        assertEquals("Unknown function 'sin'", result.errors().get(0).message());
    }

    @Test
    void type_errors_accumulate_without_throwing() {
        var p = check("!1; !2; 0");
        assertEquals(2, p.typeErrors().size());
        assertEquals(PrimitiveType.INT, p.exprType().type());
    }

    @Test
    void type_error_location_prints_the_node() {
        var p = check("true + 1");
        assertEquals("Operator '+' expects matching operands, got bool and int in `true + 1`",
                p.typeErrors().get(0).toString());
    }

    @Test
    void type_bindings_in_declaration_order() {
        var p = check("b = 1; a = 2; int c; a + b");
        assertEquals(List.of("b", "a", "c"), List.copyOf(p.typeContext().bindings().keySet()));
        assertTrue(p.typeContext().bindings().get("c").explicitlyDeclared());
    }

    @Test
    void type_builtins_are_not_bound() {
        var p = check("t + sx + mx_f * 0.0 > 1.0 ? t : ky");
        assertEquals(1, p.typeErrors().size());
        assertTrue(p.typeContext().bindings().isEmpty());
        assertTrue(TypeContext.isBuiltin("kx_f"));
        assertFalse(TypeContext.isBuiltin("u"));
    }

    @Test
    void type_of_unknown_identifier_in_fresh_context() {
        var ctx = new TypeContext();
        assertEquals(PrimitiveType.INT, Value.ident("q").type(ctx).type());
        assertEquals(PrimitiveType.INT, ctx.lookup("q"));
    }

    @Test
    void type_context_copy_is_independent() {
        var ctx = new TypeContext();
        ctx.declare("a", PrimitiveType.FLOAT);
        var copy = ctx.copy();
        copy.declare("b", PrimitiveType.INT);
        assertNull(ctx.lookup("b"));
        assertEquals(PrimitiveType.FLOAT, copy.lookup("a"));
    }
}
