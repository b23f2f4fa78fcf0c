package bytebeat.ast.expr;

public final class Precedence {
    private Precedence() {}

    public static final int ATOM = 0;
    public static final int UNARY = 3;
    public static final int TERNARY = 15;
    public static final int ASSIGN = 16;
    public static final int LIST = 17;

    public static final int MAX = LIST;

    public enum Associativity { LEFT, RIGHT }

    public static Associativity associativity(int precedence) {
        return precedence == ASSIGN ? Associativity.RIGHT : Associativity.LEFT;
    }
}
