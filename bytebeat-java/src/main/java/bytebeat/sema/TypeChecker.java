package bytebeat.sema;

import bytebeat.ast.Statement;
import bytebeat.ast.expr.*;
import bytebeat.types.PrimitiveType;
import bytebeat.types.TypeResult;
import bytebeat.types.TypeUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Types expressions against a {@link TypeContext}. Errors are returned inside the
 * {@link TypeResult}, never thrown, so checking always continues.
 */
public final class TypeChecker {

    private final TypeContext ctx;

    public TypeChecker(TypeContext ctx) {
        this.ctx = ctx;
    }

    public TypeResult checkStatement(Statement s) {
        PrimitiveType oldDefault = ctx.defaultType();
        boolean oldExplicit = ctx.isExplicitlyTyped();
        if (s.explicitType() != null) {
            ctx.setDefaultType(s.explicitType());
            ctx.setExplicitlyTyped(true);
        }
        try {
            return s.expr() instanceof ExprList list ? typeList(list) : typeElement(s.expr());
        } finally {
            ctx.setDefaultType(oldDefault);
            ctx.setExplicitlyTyped(oldExplicit);
        }
    }

    public TypeResult typeOf(Expr e) {
        if (e instanceof Value v) return typeValue(v);
        if (e instanceof UnaryExpr u) return typeUnary(u);
        if (e instanceof BinaryExpr b) return typeBinary(b);
        if (e instanceof AssignExpr a) return typeAssign(a);
        if (e instanceof TernaryExpr t) return typeTernary(t);
        if (e instanceof ExprList l) return typeList(l);
        if (e instanceof FunctionCall f) return typeCall(f);
        throw new IllegalStateException("Unknown expression: " + e);
    }

    private TypeResult typeValue(Value v) {
        Literal literal = v.literal();
        if (literal != null) return TypeResult.ok(literal.type());

        String name = v.identifier().name();
        PrimitiveType known = ctx.lookup(name);
        if (known != null) return TypeResult.ok(known);

        // first sighting: implicitly declared at the statement's default type
        ctx.declare(name, ctx.defaultType());
        return TypeResult.ok(ctx.defaultType());
    }

    private TypeResult typeUnary(UnaryExpr u) {
        TypeResult operand = typeOf(u.operand());
        if (operand.isErr()) return operand;

        Set<PrimitiveType> allowed = TypeUtil.operandTypes(u.op());
        if (!allowed.contains(operand.type())) {
            return TypeResult.err("Unary '" + u.op().symbol() + "' expects " + TypeUtil.describe(allowed)
                    + ", got " + operand.type(), u);
        }
        return operand;
    }

    private TypeResult typeBinary(BinaryExpr b) {
        TypeResult l = typeOf(b.left());
        TypeResult r = typeOf(b.right());
        if (l.isErr() || r.isErr()) return TypeResult.err(TypeResult.causes(l, r));

        String op = "'" + b.op().symbol() + "'";
        if (l.type() != r.type()) {
            return TypeResult.err("Operator " + op + " expects matching operands, got "
                    + l.type() + " and " + r.type(), b);
        }
        Set<PrimitiveType> allowed = TypeUtil.operandTypes(b.op());
        if (!allowed.contains(l.type())) {
            return TypeResult.err("Operator " + op + " expects " + TypeUtil.describe(allowed)
                    + " operands, got " + l.type(), b);
        }
        return TypeResult.ok(TypeUtil.resultType(b.op(), l.type()));
    }

    private TypeResult typeAssign(AssignExpr a) {
        TypeResult value = typeOf(a.value());
        if (value.isErr()) return value;

        String name = a.target().name();
        PrimitiveType bound = ctx.lookup(name);
        if (bound == null) {
            // a new name takes the value's type, even under a type keyword
            ctx.declare(name, value.type());
            return value;
        }
        if (bound != value.type()) {
            return TypeResult.err("Cannot assign " + value.type() + " to '" + name + "' of type " + bound, a);
        }
        return value;
    }

    private TypeResult typeTernary(TernaryExpr t) {
        TypeResult cond = typeOf(t.condition());
        TypeResult whenTrue = typeOf(t.whenTrue());
        TypeResult whenFalse = typeOf(t.whenFalse());
        if (cond.isErr() || whenTrue.isErr() || whenFalse.isErr()) {
            return TypeResult.err(TypeResult.causes(cond, whenTrue, whenFalse));
        }

        if (!cond.is(PrimitiveType.BOOL)) {
            return TypeResult.err("Ternary condition must be bool, got " + cond.type(), t);
        }
        if (whenTrue.type() != whenFalse.type()) {
            return TypeResult.err("Ternary branches differ: " + whenTrue.type() + " and " + whenFalse.type(), t);
        }
        return whenTrue;
    }

    private TypeResult typeList(ExprList list) {
        List<TypeError> errors = new ArrayList<>();
        TypeResult last = null;
        for (Expr e : list.exprs()) {
            last = typeElement(e);
            errors.addAll(last.errors());
        }
        return errors.isEmpty() ? last : TypeResult.err(errors);
    }

    // a bare identifier in a statement or list declares it
    private TypeResult typeElement(Expr e) {
        if (!(e instanceof Value v) || v.identifier() == null) return typeOf(e);

        String name = v.identifier().name();
        PrimitiveType existing = ctx.declare(name, ctx.defaultType());
        if (existing == null) return TypeResult.ok(ctx.defaultType());
        if (ctx.isExplicitlyTyped() && existing != ctx.defaultType()) {
            return TypeResult.err("'" + name + "' is already declared as " + existing, e);
        }
        return TypeResult.ok(existing);
    }

    private TypeResult typeCall(FunctionCall f) {
        List<TypeResult> args = new ArrayList<>();
        for (Expr arg : f.args()) args.add(typeOf(arg));
        List<TypeError> causes = TypeResult.causes(args.toArray(new TypeResult[0]));
        if (!causes.isEmpty()) return TypeResult.err(causes);

        PrimitiveType cast = f.castType();
        if (cast != null) return TypeResult.ok(cast);
        if (PrimitiveType.fromKeyword(f.name()) != null) {
            return TypeResult.err(f.name() + "(...) expects exactly one argument, got " + f.args().size(), f);
        }
        return TypeResult.err("Unknown function '" + f.name() + "'", f);
    }
}
