package bytebeat.simplify;

import bytebeat.ast.expr.*;
import bytebeat.types.PrimitiveType;

import java.util.Optional;

/**
 * Folds operators over literals. An empty result means the operation is
 * ill-typed or would produce a non-finite float; callers keep the node unfolded.
 * Ints are 32-bit two's complement; {@code /} and {@code %} truncate toward zero
 * and yield 0 for a zero divisor.
 */
public final class Evaluator {
    private Evaluator() {}

    public static Optional<Literal> evaluate(UnaryExpr.Operator op, Literal a) {
        if (a instanceof IntLiteral i) {
            int x = i.value();
            return Optional.ofNullable(switch (op) {
                case PLUS -> new IntLiteral(x);
                case NEG -> new IntLiteral(-x);
                case BIT_NOT -> new IntLiteral(~x);
                case NOT -> null;
            });
        }
        if (a instanceof FloatLiteral f) {
            return switch (op) {
                case PLUS -> Optional.of(f);
                case NEG -> Optional.of(new FloatLiteral(-f.value()));
                case BIT_NOT, NOT -> Optional.empty();
            };
        }
        if (a instanceof BoolLiteral b && op == UnaryExpr.Operator.NOT) {
            return Optional.of(new BoolLiteral(!b.value()));
        }
        return Optional.empty();
    }

    public static Optional<Literal> evaluate(BinaryExpr.Operator op, Literal a, Literal b) {
        if (a instanceof IntLiteral x && b instanceof IntLiteral y) return Optional.ofNullable(ints(op, x.value(), y.value()));
        if (a instanceof FloatLiteral x && b instanceof FloatLiteral y) return floats(op, x.value(), y.value());
        if (a instanceof BoolLiteral x && b instanceof BoolLiteral y) return Optional.ofNullable(bools(op, x.value(), y.value()));
        return Optional.empty();
    }

    /** {@code int(...)}, {@code float(...)} and {@code bool(...)} applied to a literal. */
    public static Literal cast(PrimitiveType to, Literal a) {
        return switch (to) {
            case INT -> {
                if (a instanceof FloatLiteral f) yield new IntLiteral((int) f.value());
                if (a instanceof BoolLiteral b) yield new IntLiteral(b.value() ? 1 : 0);
                yield a;
            }
            case FLOAT -> {
                if (a instanceof IntLiteral i) yield new FloatLiteral(i.value());
                if (a instanceof BoolLiteral b) yield new FloatLiteral(b.value() ? 1.0 : 0.0);
                yield a;
            }
            case BOOL -> {
                if (a instanceof IntLiteral i) yield new BoolLiteral(i.value() != 0);
                if (a instanceof FloatLiteral f) yield new BoolLiteral(f.value() != 0.0);
                yield a;
            }
        };
    }

    private static Literal ints(BinaryExpr.Operator op, int x, int y) {
        return switch (op) {
            case ADD -> new IntLiteral(x + y);
            case SUB -> new IntLiteral(x - y);
            case MUL -> new IntLiteral(x * y);
            case DIV -> new IntLiteral(y == 0 ? 0 : x / y);
            case MOD -> new IntLiteral(y == 0 ? 0 : x % y);
            case SHL -> new IntLiteral(x << y);
            case SHR -> new IntLiteral(x >> y);
            case BIT_AND -> new IntLiteral(x & y);
            case BIT_XOR -> new IntLiteral(x ^ y);
            case BIT_OR -> new IntLiteral(x | y);
            case GT -> new BoolLiteral(x > y);
            case LT -> new BoolLiteral(x < y);
            case GE -> new BoolLiteral(x >= y);
            case LE -> new BoolLiteral(x <= y);
            case EQ -> new BoolLiteral(x == y);
            case NE -> new BoolLiteral(x != y);
            case AND, XOR, OR -> null;
        };
    }

    private static Optional<Literal> floats(BinaryExpr.Operator op, double x, double y) {
        return switch (op) {
            case ADD -> finite(x + y);
            case SUB -> finite(x - y);
            case MUL -> finite(x * y);
            case DIV -> finite(y == 0 ? 0 : truncate(x / y));
            case MOD -> finite(y == 0 ? 0 : x % y);
            case GT -> Optional.of(new BoolLiteral(x > y));
            case LT -> Optional.of(new BoolLiteral(x < y));
            case GE -> Optional.of(new BoolLiteral(x >= y));
            case LE -> Optional.of(new BoolLiteral(x <= y));
            case EQ -> Optional.of(new BoolLiteral(x == y));
            case NE -> Optional.of(new BoolLiteral(x != y));
            default -> Optional.empty();
        };
    }

    private static Optional<Literal> finite(double d) {
        return Double.isFinite(d) ? Optional.of(new FloatLiteral(d)) : Optional.empty();
    }

    private static Literal bools(BinaryExpr.Operator op, boolean x, boolean y) {
        return switch (op) {
            case AND -> new BoolLiteral(x && y);
            case OR -> new BoolLiteral(x || y);
            case XOR, NE -> new BoolLiteral(x != y);
            case EQ -> new BoolLiteral(x == y);
            default -> null;
        };
    }

    private static double truncate(double d) {
        return d < 0 ? Math.ceil(d) : Math.floor(d);
    }
}
