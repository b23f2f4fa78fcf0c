package bytebeat.ast.expr;

import bytebeat.print.PrintStyle;
import bytebeat.types.PrimitiveType;

import java.util.List;

public record FunctionCall(
        String name,
        List<Expr> args
) implements Expr {

    public FunctionCall {
        args = List.copyOf(args);
    }

    public static FunctionCall cast(PrimitiveType type, Expr arg) {
        return new FunctionCall(type.keyword(), List.of(arg));
    }

    /** The target type when this is a one-argument {@code int}/{@code float}/{@code bool} cast, else null. */
    public PrimitiveType castType() {
        return args.size() == 1 ? PrimitiveType.fromKeyword(name) : null;
    }

    @Override
    public int precedence() {
        return Precedence.ATOM;
    }

    @Override
    public String toString() {
        return toString(PrintStyle.PRETTY);
    }
}
