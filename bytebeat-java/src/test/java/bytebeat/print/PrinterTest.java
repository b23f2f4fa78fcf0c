package bytebeat.print;

import bytebeat.ast.Program;
import bytebeat.ast.expr.UnaryExpr;
import bytebeat.ast.expr.Value;
import bytebeat.lexer.Lexer;
import bytebeat.parser.Parser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class PrinterTest {

    private static String pretty(String src) {
        return new Parser(new Lexer(src).tokenize()).parseExpression().toString(PrintStyle.PRETTY);
    }

    @ParameterizedTest
    @CsvSource(delimiterString = "=>", value = {
            "a - (b - c)        => a - (b - c)",
            "(a + b) + c        => a + b + c",
            "a + (b + c)        => a + b + c",
            "(a - b) - c        => a - b - c",
            "a * (b / c)        => a * (b / c)",
            "a / (b * c)        => a / (b * c)",
            "(a + b) * c        => (a + b) * c",
            "a + (b * c)        => a + b * c",
            "(a << 1) + 2       => (a << 1) + 2",
            "(a == b) == c      => a == b == c",
            "a == (b == c)      => a == b == c",
            "a != (b != c)      => a != (b != c)"
    })
    void print_binary_parentheses(String src, String expected) {
        assertEquals(expected, pretty(src));
    }

    @ParameterizedTest
    @CsvSource(delimiterString = "=>", value = {
            "-(a + b)     => -(a + b)",
            "-(-a)        => -(-a)",
            "+(+a)        => +(+a)",
            "-(+a)        => -+a",
            "!(!b)        => !!b",
            "~(~a)        => ~~a",
            "!(a > 3)     => !(a > 3)",
            "-a * b       => -a * b"
    })
    void print_unary_parentheses(String src, String expected) {
        assertEquals(expected, pretty(src));
    }

    @Test
    void print_negative_literal_under_negation() {
        var e = new UnaryExpr(UnaryExpr.Operator.NEG, Value.of(-3));
        assertEquals("-(-3)", e.toString(PrintStyle.MINIMAL));
    }

    @ParameterizedTest
    @CsvSource(delimiterString = "=>", value = {
            "(a ? b : c) ? d : e      => (a ? b : c) ? d : e",
            "(x = 1) ? 2 : 3          => (x = 1) ? 2 : 3",
            "a ? (b, c) : d           => a ? (b, c) : d",
            "a ? b = 1 : c            => a ? b = 1 : c",
            "a ? b : c ? d : e        => a ? b : c ? d : e",
            "(a ? b : c) + 1          => (a ? b : c) + 1",
            "a > 0 ? b : c            => a > 0 ? b : c"
    })
    void print_ternary_parentheses(String src, String expected) {
        assertEquals(expected, pretty(src));
    }

    @Test
    void print_assignment_and_lists() {
        assertEquals("a = (b = c)", pretty("a = (b = c)"));
        assertEquals("a = b ? c : d", pretty("a = b ? c : d"));
        assertEquals("(a, b) + 1", pretty("(a, b) + 1"));
        assertEquals("a, (b, c)", pretty("(a, (b, c))"));
        assertEquals("int(t) + float(t_f)", pretty("int(t) + float(t_f)"));
    }

    @Test
    void print_floats_always_have_a_point() {
        assertEquals("1.0", Value.of(1.0).toString());
        assertEquals("0.1", Value.of(0.1).toString());
        assertEquals("100000000000000000000.0", Value.of(1e20).toString());
        assertEquals("0.00000025", Value.of(2.5e-7).toString());
        assertEquals("1.0", pretty("1."));
    }

    @Test
    void print_negative_zero_keeps_its_sign() {
        assertEquals("-0.0", Value.of(-0.0).toString());
        assertEquals("0.0", Value.of(0.0).toString());
        assertEquals("-(-0.0)", new UnaryExpr(UnaryExpr.Operator.NEG, Value.of(-0.0)).toString());
    }

    @Test
    void print_program_pretty_and_minimal() {
        var p = Program.parse("int a=1,b;a>0?b:t");
        assertEquals("int a = 1, b;\na > 0 ? b : t", p.toString());
        assertEquals("int a=1,b;a>0?b:t", p.toString(PrintStyle.MINIMAL));
    }

    @Test
    void print_program_declares_implicit_names() {
        var p = Program.parse("x + y");
        assertEquals("int x;int y;x+y", p.toString(PrintStyle.MINIMAL));
        assertEquals("int x;\nint y;\nx + y", p.toString(PrintStyle.PRETTY));
        assertEquals("float f;int(f)", Program.parse("float f; f").toString(PrintStyle.MINIMAL));
        assertEquals("t*2", Program.parse("t * 2").toString(PrintStyle.MINIMAL));
    }

    @Test
    void print_statement_starting_with_cast_is_wrapped() {
        var p = Program.parse("(int(t)); t");
        assertEquals("(int(t));t", p.toString(PrintStyle.MINIMAL));
        assertEquals("(int(t), 1);\nt", Program.parse("(int(t), 1); t").toString());
    }

    @Test
    void print_trailing_list_in_parentheses() {
        assertEquals("(t,1)", Program.parse("(t, 1)").toString(PrintStyle.MINIMAL));
        assertEquals("int((t,1.5))", Program.parse("(t, 1.5)").toString(PrintStyle.MINIMAL));
    }

    @Test
    void print_long_flat_chain() {
        String src = "t" + "+t".repeat(500);
        assertEquals(src, Program.parse(src).toString(PrintStyle.MINIMAL));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "t*(t>>5|t>>8)",
            "a - (b - c)",
            "(a = 1, b = a) ? 1 : 2",
            "-(-t) + ~~t",
            "(x = 1) ? 2 : 3",
            "a ? (b, c) : d",
            "int(t) + float(t_f)",
            "t_f < 1.5 && !(t > 3)",
            "(int(t), 1); t",
            "a = (b = c); a",
            "bool b = true; b + 1",
            "float f = 1.; f * -2.5 - f",
            "(t, 1.5)",
            "1 < 2 || t == 3"
    })
    void print_minimal_round_trips(String src) {
        var first = Program.parse(src);
        String printed = first.toString(PrintStyle.MINIMAL);
        var again = Program.parse(printed);
        assertEquals(first.expr(), again.expr());
        assertEquals(printed, again.toString(PrintStyle.MINIMAL));
        assertEquals(first.typeErrors().size(), again.typeErrors().size());
    }

    @ParameterizedTest
    @ValueSource(strings = {"t*(t>>5|t>>8)", "a = (b = c); a", "(int(t), 1); t"})
    void print_pretty_round_trips(String src) {
        var first = Program.parse(src);
        var again = Program.parse(first.toString());
        assertEquals(first.expr(), again.expr());
        assertEquals(first.toString(), again.toString());
    }
}
