package bytebeat.ast.expr;

import bytebeat.types.PrimitiveType;

public sealed interface Literal extends Operand permits IntLiteral, FloatLiteral, BoolLiteral {

    PrimitiveType type();

    /** True for a numeric literal whose value equals {@code n}. */
    boolean isNumber(int n);

    /** A numeric literal of this literal's kind, or null for bool. */
    Literal withNumber(int n);
}
