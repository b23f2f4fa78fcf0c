package bytebeat.ast.expr;

import bytebeat.print.PrintStyle;

public record UnaryExpr(
        Operator op,
        Expr operand
) implements Expr {

    public enum Operator {
        PLUS("+"), NEG("-"), BIT_NOT("~"), NOT("!");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        /** {@code +} and {@code -} print ambiguously when doubled. */
        public boolean isSign() {
            return this == PLUS || this == NEG;
        }
    }

    @Override
    public int precedence() {
        return Precedence.UNARY;
    }

    @Override
    public String toString() {
        return toString(PrintStyle.PRETTY);
    }
}
