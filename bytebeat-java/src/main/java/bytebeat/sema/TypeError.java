package bytebeat.sema;

import bytebeat.ast.expr.Expr;
import bytebeat.print.PrintStyle;

public record TypeError(String message, Expr location) {
    @Override
    public String toString() {
        return message + " in `" + location.toString(PrintStyle.PRETTY) + "`";
    }
}
