package bytebeat.ast.expr;

/** What a {@link Value} leaf holds: a name or a constant. */
public sealed interface Operand permits Identifier, Literal {}
