package bytebeat.ast.expr;

import bytebeat.print.PrintStyle;

public record Value(Operand operand) implements Expr {

    public static Value of(int value) {
        return new Value(new IntLiteral(value));
    }

    public static Value of(double value) {
        return new Value(new FloatLiteral(value));
    }

    public static Value of(boolean value) {
        return new Value(new BoolLiteral(value));
    }

    public static Value of(Literal literal) {
        return new Value(literal);
    }

    public static Value ident(String name) {
        return new Value(new Identifier(name));
    }

    /** The literal held by this leaf, or null for an identifier. */
    public Literal literal() {
        return operand instanceof Literal l ? l : null;
    }

    /** The identifier held by this leaf, or null for a literal. */
    public Identifier identifier() {
        return operand instanceof Identifier i ? i : null;
    }

    @Override
    public int precedence() {
        return Precedence.ATOM;
    }

    @Override
    public String toString() {
        return toString(PrintStyle.PRETTY);
    }
}
