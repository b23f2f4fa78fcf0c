package bytebeat.ast.expr;

import bytebeat.types.PrimitiveType;

public record BoolLiteral(boolean value) implements Literal {

    @Override
    public PrimitiveType type() {
        return PrimitiveType.BOOL;
    }

    @Override
    public boolean isNumber(int n) {
        return false;
    }

    @Override
    public Literal withNumber(int n) {
        return null;
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
