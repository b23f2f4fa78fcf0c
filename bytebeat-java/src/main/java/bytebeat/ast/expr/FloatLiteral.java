package bytebeat.ast.expr;

import bytebeat.types.PrimitiveType;

import java.math.BigDecimal;

public record FloatLiteral(double value) implements Literal {

    public FloatLiteral {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("float literal must be finite: " + value);
        }
    }

    @Override
    public PrimitiveType type() {
        return PrimitiveType.FLOAT;
    }

    @Override
    public boolean isNumber(int n) {
        return value == n;
    }

    @Override
    public Literal withNumber(int n) {
        return new FloatLiteral(n);
    }

    // plain decimal with a '.', so the lexer reads it back as a float
    @Override
    public String toString() {
        // BigDecimal has no negative zero
        if (value == 0 && Double.doubleToRawLongBits(value) != 0L) return "-0.0";
        String plain = BigDecimal.valueOf(value).toPlainString();
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }
}
