package bytebeat.types;

import bytebeat.ast.expr.Expr;
import bytebeat.sema.TypeError;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of typing an expression: either a concrete type or an error marker
 * carrying every {@link TypeError} that caused it.
 */
public record TypeResult(PrimitiveType type, List<TypeError> errors) {

    public TypeResult {
        errors = List.copyOf(errors);
    }

    public static TypeResult ok(PrimitiveType type) {
        return new TypeResult(type, List.of());
    }

    public static TypeResult err(String message, Expr location) {
        return new TypeResult(null, List.of(new TypeError(message, location)));
    }

    public static TypeResult err(List<TypeError> errors) {
        if (errors.isEmpty()) throw new IllegalArgumentException("error result without causes");
        return new TypeResult(null, errors);
    }

    public boolean isErr() {
        return type == null;
    }

    public boolean is(PrimitiveType expected) {
        return type == expected;
    }

    /** Errors of several results, in order. */
    public static List<TypeError> causes(TypeResult... results) {
        List<TypeError> all = new ArrayList<>();
        for (TypeResult r : results) all.addAll(r.errors());
        return all;
    }

    @Override
    public String toString() {
        return isErr() ? "error" + errors : type.keyword();
    }
}
