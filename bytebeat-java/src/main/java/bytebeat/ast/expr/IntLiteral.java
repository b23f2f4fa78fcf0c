package bytebeat.ast.expr;

import bytebeat.types.PrimitiveType;

public record IntLiteral(int value) implements Literal {

    @Override
    public PrimitiveType type() {
        return PrimitiveType.INT;
    }

    @Override
    public boolean isNumber(int n) {
        return value == n;
    }

    @Override
    public Literal withNumber(int n) {
        return new IntLiteral(n);
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
