package bytebeat.sema;

import bytebeat.ast.expr.Expr;
import bytebeat.print.PrintStyle;

/** Undefined behavior that is certain at run time, and the node that causes it. */
public record UbInfo(Expr location, Kind kind) {

    public enum Kind {
        DIVIDE_BY_ZERO("divide by zero"),
        OVERWIDE_LEFT_SHIFT("overwide left shift");

        private final String description;

        Kind(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    @Override
    public String toString() {
        return kind.description() + " in `" + location.toString(PrintStyle.PRETTY) + "`";
    }
}
