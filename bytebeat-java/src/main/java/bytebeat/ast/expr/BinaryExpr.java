package bytebeat.ast.expr;

import bytebeat.print.PrintStyle;

public record BinaryExpr(
        Expr left,
        Operator op,
        Expr right
) implements Expr {

    public enum Operator {
        MUL("*", 4, true), DIV("/", 4, false), MOD("%", 4, false),
        ADD("+", 5, true), SUB("-", 5, false),
        SHR(">>", 6, false), SHL("<<", 6, false),
        GT(">", 7, false), LT("<", 7, false), GE(">=", 7, false), LE("<=", 7, false),
        EQ("==", 8, true), NE("!=", 8, false),
        BIT_AND("&", 9, true),
        BIT_XOR("^", 10, true),
        BIT_OR("|", 11, true),
        AND("&&", 12, true),
        XOR("^^", 13, true),
        OR("||", 14, true);

        private final String symbol;
        private final int precedence;
        private final boolean associative;

        Operator(String symbol, int precedence, boolean associative) {
            this.symbol = symbol;
            this.precedence = precedence;
            this.associative = associative;
        }

        public String symbol() {
            return symbol;
        }

        public int precedence() {
            return precedence;
        }

        /** {@code (a op b) op c == a op (b op c)} for all values. */
        public boolean isMathematicallyAssociative() {
            return associative;
        }

        public static Operator fromSymbol(String symbol) {
            for (Operator op : values()) {
                if (op.symbol.equals(symbol)) return op;
            }
            throw new IllegalArgumentException("Not a binary operator: " + symbol);
        }
    }

    @Override
    public int precedence() {
        return op.precedence();
    }

    @Override
    public String toString() {
        return toString(PrintStyle.PRETTY);
    }
}
