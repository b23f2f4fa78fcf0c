package bytebeat.ast;

import bytebeat.ast.expr.Expr;
import bytebeat.print.PrintStyle;
import bytebeat.print.Printer;
import bytebeat.types.PrimitiveType;

/** {@code type? expr_list ;}, where {@code explicitType} is null when no keyword was given. */
public record Statement(
        PrimitiveType explicitType,
        Expr expr
) {
    public String toString(PrintStyle style) {
        return Printer.print(this, style);
    }

    @Override
    public String toString() {
        return toString(PrintStyle.PRETTY);
    }
}
