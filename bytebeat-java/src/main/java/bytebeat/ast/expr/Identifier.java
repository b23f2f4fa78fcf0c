package bytebeat.ast.expr;

public record Identifier(String name) implements Operand {
    @Override
    public String toString() {
        return name;
    }
}
