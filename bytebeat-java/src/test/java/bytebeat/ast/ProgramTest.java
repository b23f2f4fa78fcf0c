package bytebeat.ast;

import bytebeat.lexer.LexerException;
import bytebeat.parser.ParseException;
import bytebeat.print.PrintStyle;
import bytebeat.sema.UbInfo;
import bytebeat.types.PrimitiveType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

public class ProgramTest {

    @Test
    void program_simplify_identity_with_statement() {
        var p = Program.parse("a+0;a").simplify();
        assertEquals("int a;a;a", p.toString(PrintStyle.MINIMAL));
        assertEquals(List.of(), p.typeErrors());
    }

    @Test
    void program_literal_division_by_zero_folds_to_zero() {
        assertEquals("0", Program.parse("5/0").simplify().toString(PrintStyle.MINIMAL));
        assertEquals("0", Program.parse("5%0").simplify().toString(PrintStyle.MINIMAL));
    }

    @Test
    void program_reports_ub_and_types() {
        var p = Program.parse("x/0;x");
        assertEquals(UbInfo.Kind.DIVIDE_BY_ZERO, p.ubInfo().orElseThrow().kind());
        assertEquals(PrimitiveType.INT, p.typeContext().lookup("x"));
        assertEquals(PrimitiveType.INT, p.exprType().type());
    }

    @Test
    void program_with_type_error_still_prints() {
        var p = Program.parse("bool b = true; b + 1");
        assertEquals(1, p.typeErrors().size());
        assertEquals("bool b = true;\nb + 1", p.toString());
    }

    @Test
    void program_output_is_cast_to_int() {
        var p = Program.parse("t_f");
        assertEquals("int(t_f)", p.toString());
        assertEquals(PrimitiveType.INT, p.exprType().type());

        var cmp = Program.parse("1 < 2");
        assertEquals("int(1 < 2)", cmp.toString());
        assertEquals("1", cmp.simplify().toString(PrintStyle.MINIMAL));
        // an int output and an ill-typed one are left alone
        assertEquals("t", Program.parse("t").toString());
        assertEquals("true + 1", Program.parse("true + 1").toString());
    }

    @Test
    void program_ub_found_under_output_cast() {
        var p = Program.parse("t_f / 0.0");
        assertEquals("int(t_f / 0.0)", p.toString());
        assertEquals(UbInfo.Kind.DIVIDE_BY_ZERO, p.ubInfo().orElseThrow().kind());
    }

    @Test
    void program_exposes_parts() {
        var p = Program.parse("int a = 1; float b; a");
        assertEquals(2, p.statements().size());
        assertEquals(PrimitiveType.FLOAT, p.statements().get(1).explicitType());
        assertEquals("a", p.expr().toString());
        assertThrows(UnsupportedOperationException.class, () -> p.statements().clear());
    }

    @Test
    void program_propagates_front_end_failures() {
        assertThrows(LexerException.class, () -> Program.parse("t $ 2"));
        assertThrows(ParseException.class, () -> Program.parse("t +"));
    }

    @Test
    void program_simplified_program_is_checked_again() {
        // "b" only shows up through the ternary branch that survives
        var p = Program.parse("false ? a : b").simplify();
        assertEquals("b", p.expr().toString());
        assertEquals(List.of("b"), List.copyOf(p.typeContext().bindings().keySet()));
    }

    @Test
    void program_independent_programs_in_parallel() {
        List<String> out = IntStream.range(0, 64).parallel()
                .mapToObj(i -> Program.parse("t*" + i + "+0").simplify().toString(PrintStyle.MINIMAL))
                .toList();
        for (int i = 0; i < 64; i++) {
            String expected = i == 0 ? "0" : i == 1 ? "t" : "t*" + i;
            assertEquals(expected, out.get(i));
        }
    }
}
