package bytebeat.simplify;

import bytebeat.ast.expr.BinaryExpr;
import bytebeat.ast.expr.Expr;
import bytebeat.ast.expr.Literal;
import bytebeat.ast.expr.Value;
import bytebeat.types.PrimitiveType;

import java.util.List;
import java.util.function.Function;

import static bytebeat.ast.expr.BinaryExpr.Operator.*;

/**
 * A rewrite {@code (left op right) -> result} that holds for every value bound
 * to the wildcard {@code ?a}.
 */
public record IdentityRule(Slot left, BinaryExpr.Operator op, Slot right, Slot result, boolean commutative) {

    public sealed interface Slot permits Wildcard, Constant {}

    /** {@code ?a}: matches any operand; two wildcards must match equal operands. */
    public record Wildcard() implements Slot {
        @Override
        public String toString() {
            return "?a";
        }
    }

    public record Constant(int value) implements Slot {
        @Override
        public String toString() {
            return Integer.toString(value);
        }
    }

    private static final Slot A = new Wildcard();

    /** Tried top to bottom; the first match wins. */
    public static final List<IdentityRule> TABLE = List.of(
            // constant identities
            commutative(A, ADD, k(0), A),
            rule(A, SUB, k(0), A),
            commutative(A, MUL, k(0), k(0)),
            commutative(A, MUL, k(1), A),
            rule(A, DIV, k(1), A),
            rule(k(0), DIV, A, k(0)),
            // modulo
            rule(A, MOD, k(-1), k(0)),
            rule(A, MOD, k(0), k(0)),
            rule(A, MOD, k(1), k(0)),
            // reflexive
            rule(A, SUB, A, k(0)),
            rule(A, DIV, A, k(1)),
            rule(A, BIT_XOR, A, k(0)),
            rule(A, MOD, A, k(0)),
            rule(A, BIT_AND, A, A),
            rule(A, BIT_OR, A, A),
            // bitwise with zero
            commutative(A, BIT_AND, k(0), k(0)),
            commutative(A, BIT_OR, k(0), A),
            commutative(A, BIT_XOR, k(0), A),
            // shifts with zero
            rule(A, SHR, k(0), A),
            rule(A, SHL, k(0), A),
            rule(k(0), SHR, A, k(0)),
            rule(k(0), SHL, A, k(0))
    );

    public IdentityRule {
        if (result instanceof Wildcard && !(left instanceof Wildcard) && !(right instanceof Wildcard)) {
            throw new IllegalArgumentException("Rule result ?a is not bound: " + left + " " + op.symbol() + " " + right);
        }
    }

    private static IdentityRule rule(Slot left, BinaryExpr.Operator op, Slot right, Slot result) {
        return new IdentityRule(left, op, right, result, false);
    }

    private static IdentityRule commutative(Slot left, BinaryExpr.Operator op, Slot right, Slot result) {
        return new IdentityRule(left, op, right, result, true);
    }

    private static Slot k(int value) {
        return new Constant(value);
    }

    /**
     * Applies this rule to {@code left op right}, both already simplified.
     *
     * @param types static type of an operand, used to give reflexive results the operand's kind
     * @return the rewritten expression, or null when the rule does not match
     */
    public Expr apply(Expr left, BinaryExpr.Operator actual, Expr right, Function<Expr, PrimitiveType> types) {
        if (actual != op) return null;
        Expr applied = match(left, right, types);
        if (applied == null && commutative) {
            applied = match(right, left, types);
        }
        return applied;
    }

    private Expr match(Expr l, Expr r, Function<Expr, PrimitiveType> types) {
        boolean wildLeft = left instanceof Wildcard;
        boolean wildRight = right instanceof Wildcard;

        boolean matches = wildLeft && wildRight
                ? StructuralEquality.equal(l, r)
                : (wildLeft || matchesConstant(left, l)) && (wildRight || matchesConstant(right, r));
        if (!matches) return null;

        if (result instanceof Wildcard) return wildLeft ? l : r;

        int value = ((Constant) result).value();
        Literal kind = !wildLeft ? literal(l) : !wildRight ? literal(r) : null;
        if (kind != null) return Value.of(kind.withNumber(value));
        return types.apply(l) == PrimitiveType.FLOAT ? Value.of((double) value) : Value.of(value);
    }

    private static boolean matchesConstant(Slot slot, Expr e) {
        Literal literal = literal(e);
        return literal != null && literal.isNumber(((Constant) slot).value());
    }

    private static Literal literal(Expr e) {
        return e instanceof Value v ? v.literal() : null;
    }

    @Override
    public String toString() {
        return left + " " + op.symbol() + " " + right + " -> " + result + (commutative ? " (commutative)" : "");
    }
}
