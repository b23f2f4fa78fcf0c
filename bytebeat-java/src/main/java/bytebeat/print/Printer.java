package bytebeat.print;

import bytebeat.ast.Program;
import bytebeat.ast.Statement;
import bytebeat.ast.expr.*;
import bytebeat.sema.TypeContext;

import java.util.List;
import java.util.Map;

/**
 * Renders trees back to source. Parentheses are emitted only where dropping
 * them would change how the text parses.
 */
public final class Printer {

    private enum Side { LEFT, RIGHT }

    private final PrintStyle style;
    private final StringBuilder out = new StringBuilder();

    private Printer(PrintStyle style) {
        this.style = style;
    }

    public static String print(Expr e, PrintStyle style) {
        Printer p = new Printer(style);
        p.expr(e);
        return p.out.toString();
    }

    public static String print(Statement s, PrintStyle style) {
        Printer p = new Printer(style);
        p.statement(s);
        return p.out.toString();
    }

    public static String print(Program program, PrintStyle style) {
        Printer p = new Printer(style);
        for (Map.Entry<String, TypeContext.Binding> e : program.typeContext().bindings().entrySet()) {
            if (e.getValue().explicitlyDeclared()) continue;
            p.out.append(e.getValue().type().keyword()).append(' ').append(e.getKey()).append(';');
            p.newline();
        }
        for (Statement s : program.statements()) {
            p.statement(s);
        }
        p.wrapped(program.expr(), program.expr() instanceof ExprList);
        return p.out.toString();
    }

    // ---------- statements ----------

    private void statement(Statement s) {
        if (s.explicitType() != null) {
            out.append(s.explicitType().keyword()).append(' ');
            topLevel(s.expr());
        } else {
            // "int(x);" would read as a declaration
            Printer p = new Printer(style);
            p.topLevel(s.expr());
            String text = p.out.toString();
            if (startsWithCast(text)) out.append('(').append(text).append(')');
            else out.append(text);
        }
        out.append(';');
        newline();
    }

    private static boolean startsWithCast(String text) {
        for (String keyword : new String[] {"int(", "float(", "bool("}) {
            if (text.startsWith(keyword)) return true;
        }
        return false;
    }

    // a statement's list is printed bare
    private void topLevel(Expr e) {
        if (e instanceof ExprList list) elements(list.exprs());
        else expr(e);
    }

    // ---------- expressions ----------

    private void expr(Expr e) {
        if (e instanceof Value v) {
            out.append(v.operand());
        } else if (e instanceof UnaryExpr u) {
            out.append(u.op().symbol());
            wrapped(u.operand(), unaryNeedsParens(u, u.operand()));
        } else if (e instanceof BinaryExpr b) {
            wrapped(b.left(), binaryNeedsParens(b, b.left(), Side.LEFT));
            operator(b.op().symbol());
            wrapped(b.right(), binaryNeedsParens(b, b.right(), Side.RIGHT));
        } else if (e instanceof AssignExpr a) {
            out.append(a.target().name());
            operator("=");
            Expr value = a.value();
            wrapped(value, value instanceof AssignExpr || value instanceof ExprList);
        } else if (e instanceof TernaryExpr t) {
            Expr cond = t.condition();
            wrapped(cond, cond.precedence() >= Precedence.TERNARY);
            operator("?");
            wrapped(t.whenTrue(), t.whenTrue() instanceof ExprList);
            operator(":");
            wrapped(t.whenFalse(), t.whenFalse() instanceof ExprList);
        } else if (e instanceof ExprList l) {
            elements(l.exprs());
        } else if (e instanceof FunctionCall f) {
            out.append(f.name()).append('(');
            elements(f.args());
            out.append(')');
        } else {
            throw new IllegalStateException("Unknown expression: " + e);
        }
    }

    private void elements(List<Expr> exprs) {
        for (int i = 0; i < exprs.size(); i++) {
            if (i > 0) out.append(style == PrintStyle.PRETTY ? ", " : ",");
            Expr e = exprs.get(i);
            wrapped(e, e instanceof ExprList);
        }
    }

    private void wrapped(Expr e, boolean parens) {
        if (parens) out.append('(');
        expr(e);
        if (parens) out.append(')');
    }

    private void operator(String symbol) {
        if (style == PrintStyle.PRETTY) out.append(' ').append(symbol).append(' ');
        else out.append(symbol);
    }

    private void newline() {
        if (style == PrintStyle.PRETTY) out.append('\n');
    }

    // ================= parenthesization =================

    private static boolean unaryNeedsParens(UnaryExpr parent, Expr child) {
        if (child.isAtomic()) {
            // -(-3) rather than --3
            return parent.op() == UnaryExpr.Operator.NEG && isNegativeLiteral(child);
        }
        if (child.precedence() > parent.precedence()) return true;
        return child instanceof UnaryExpr u && u.op().isSign() && u.op() == parent.op();
    }

    private static boolean binaryNeedsParens(BinaryExpr parent, Expr child, Side side) {
        if (child.isAtomic()) return false;
        if (child instanceof ExprList) return true;
        if (child.precedence() != parent.precedence()) return child.precedence() > parent.precedence();

        Precedence.Associativity assoc = Precedence.associativity(parent.precedence());
        boolean opposite = assoc == Precedence.Associativity.LEFT ? side == Side.RIGHT : side == Side.LEFT;
        if (!opposite) return false;
        return !(child instanceof BinaryExpr b && b.op() == parent.op() && b.op().isMathematicallyAssociative());
    }

    private static boolean isNegativeLiteral(Expr e) {
        Literal literal = e instanceof Value v ? v.literal() : null;
        if (literal instanceof IntLiteral i) return i.value() < 0;
        if (literal instanceof FloatLiteral f) return Double.compare(f.value(), 0.0) < 0;
        return false;
    }
}
