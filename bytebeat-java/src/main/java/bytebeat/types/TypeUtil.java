package bytebeat.types;

import bytebeat.ast.expr.BinaryExpr;
import bytebeat.ast.expr.UnaryExpr;

import java.util.EnumSet;
import java.util.Set;

public final class TypeUtil {
    private TypeUtil() {}

    private static final Set<PrimitiveType> NUMERIC = EnumSet.of(PrimitiveType.INT, PrimitiveType.FLOAT);
    private static final Set<PrimitiveType> INTEGER = EnumSet.of(PrimitiveType.INT);
    private static final Set<PrimitiveType> BOOLEAN = EnumSet.of(PrimitiveType.BOOL);
    private static final Set<PrimitiveType> ANY = EnumSet.allOf(PrimitiveType.class);

    public static Set<PrimitiveType> operandTypes(UnaryExpr.Operator op) {
        return switch (op) {
            case PLUS, NEG -> NUMERIC;
            case BIT_NOT -> INTEGER;
            case NOT -> BOOLEAN;
        };
    }

    public static Set<PrimitiveType> operandTypes(BinaryExpr.Operator op) {
        return switch (op) {
            case ADD, SUB, MUL, DIV, MOD, GT, LT, GE, LE -> NUMERIC;
            case SHL, SHR, BIT_AND, BIT_XOR, BIT_OR -> INTEGER;
            case EQ, NE -> ANY;
            case AND, XOR, OR -> BOOLEAN;
        };
    }

    /** Result type of a binary operator applied to two operands of {@code operand} type. */
    public static PrimitiveType resultType(BinaryExpr.Operator op, PrimitiveType operand) {
        return switch (op) {
            case ADD, SUB, MUL, DIV, MOD, SHL, SHR, BIT_AND, BIT_XOR, BIT_OR -> operand;
            case GT, LT, GE, LE, EQ, NE, AND, XOR, OR -> PrimitiveType.BOOL;
        };
    }

    public static String describe(Set<PrimitiveType> types) {
        if (types.equals(NUMERIC)) return "int or float";
        if (types.equals(ANY)) return "int, float or bool";
        return types.iterator().next().keyword();
    }
}
