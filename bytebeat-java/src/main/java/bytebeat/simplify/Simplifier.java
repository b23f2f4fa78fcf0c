package bytebeat.simplify;

import bytebeat.ast.Statement;
import bytebeat.ast.expr.*;
import bytebeat.sema.TypeChecker;
import bytebeat.sema.TypeContext;
import bytebeat.types.PrimitiveType;
import bytebeat.types.TypeResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Bottom-up constant folding and identity rewriting. Never mutates its input:
 * every changed node is rebuilt, unchanged subtrees are shared.
 */
public final class Simplifier {

    private final TypeContext types;

    public Simplifier() {
        this(new TypeContext());
    }

    /** @param types bindings used to type operands of reflexive rules; only read */
    public Simplifier(TypeContext types) {
        this.types = types;
    }

    public Statement simplify(Statement s) {
        return new Statement(s.explicitType(), simplify(s.expr()));
    }

    public Expr simplify(Expr e) {
        if (e instanceof Value) return e;
        if (e instanceof UnaryExpr u) return simplifyUnary(u);
        if (e instanceof BinaryExpr b) return rewrite(simplify(b.left()), b.op(), simplify(b.right()));
        if (e instanceof AssignExpr a) return new AssignExpr(a.target(), simplify(a.value()));
        if (e instanceof TernaryExpr t) return simplifyTernary(t);
        if (e instanceof ExprList l) return new ExprList(simplifyAll(l.exprs()));
        if (e instanceof FunctionCall f) return simplifyCall(f);
        throw new IllegalStateException("Unknown expression: " + e);
    }

    private Expr simplifyUnary(UnaryExpr u) {
        Expr operand = simplify(u.operand());

        Literal literal = literal(operand);
        if (literal != null) {
            Optional<Literal> folded = Evaluator.evaluate(u.op(), literal);
            if (folded.isPresent()) return Value.of(folded.get());
        }

        if (u.op() == UnaryExpr.Operator.PLUS) return operand;
        // - -x, ~~x and !!x
        if (operand instanceof UnaryExpr inner && inner.op() == u.op()) return inner.operand();

        return new UnaryExpr(u.op(), operand);
    }

    // left and right are already simplified
    private Expr rewrite(Expr left, BinaryExpr.Operator op, Expr right) {
        Literal l = literal(left);
        Literal r = literal(right);
        if (l != null && r != null) {
            Optional<Literal> folded = Evaluator.evaluate(op, l, r);
            if (folded.isPresent()) return Value.of(folded.get());
        }

        for (IdentityRule rule : IdentityRule.TABLE) {
            Expr applied = rule.apply(left, op, right, this::staticType);
            if (applied != null) return applied;
        }

        if (op == BinaryExpr.Operator.SUB) {
            if (right instanceof UnaryExpr u && u.op() == UnaryExpr.Operator.NEG) {
                return rewrite(left, BinaryExpr.Operator.ADD, u.operand());
            }
            if (r != null && isNegative(r)) {
                Literal negated = Evaluator.evaluate(UnaryExpr.Operator.NEG, r).orElseThrow();
                return rewrite(left, BinaryExpr.Operator.ADD, Value.of(negated));
            }
        }

        return new BinaryExpr(left, op, right);
    }

    private Expr simplifyTernary(TernaryExpr t) {
        Expr condition = simplify(t.condition());
        if (literal(condition) instanceof BoolLiteral b) {
            return simplify(b.value() ? t.whenTrue() : t.whenFalse());
        }
        return new TernaryExpr(condition, simplify(t.whenTrue()), simplify(t.whenFalse()));
    }

    private Expr simplifyCall(FunctionCall f) {
        List<Expr> args = simplifyAll(f.args());
        PrimitiveType cast = f.castType();
        if (cast != null) {
            Literal arg = literal(args.get(0));
            if (arg != null) return Value.of(Evaluator.cast(cast, arg));
        }
        return new FunctionCall(f.name(), args);
    }

    private List<Expr> simplifyAll(List<Expr> exprs) {
        List<Expr> out = new ArrayList<>(exprs.size());
        for (Expr e : exprs) out.add(simplify(e));
        return out;
    }

    private PrimitiveType staticType(Expr e) {
        TypeResult result = new TypeChecker(types.copy()).typeOf(e);
        return result.isErr() ? PrimitiveType.INT : result.type();
    }

    private static Literal literal(Expr e) {
        return e instanceof Value v ? v.literal() : null;
    }

    private static boolean isNegative(Literal literal) {
        if (literal instanceof IntLiteral i) return i.value() < 0;
        if (literal instanceof FloatLiteral f) return f.value() < 0;
        return false;
    }
}
