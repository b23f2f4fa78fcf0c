package bytebeat.parser;

import bytebeat.ast.Program;
import bytebeat.ast.Statement;
import bytebeat.ast.expr.*;
import bytebeat.lexer.Token;
import bytebeat.lexer.TokenType;
import bytebeat.types.PrimitiveType;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Backtracking recursive-descent parser. Every rule takes a {@link Cursor} and
 * returns a {@link Parsed}; a failed rule never moves its caller's cursor.
 */
public final class Parser {
    /** Deepest nesting of parentheses, unary operators and ternaries. */
    public static final int MAX_DEPTH = 256;
    /** Deepest tree a single term stream may fold into, counting the terms inside it. */
    public static final int MAX_TREE_DEPTH = 1024;

    private final Cursor start;

    public Parser(List<Token> tokens) {
        this.start = Cursor.start(tokens);
    }

    // ---------- entry ----------
    public Program parseProgram() {
        Cursor c = start;
        List<Statement> statements = new ArrayList<>();
        ParseError lastStatement = null;

        while (true) {
            Parsed<Statement> s = statement(c);
            if (!s.isOk()) {
                lastStatement = s.error();
                break;
            }
            statements.add(s.value());
            c = s.rest();
        }

        Parsed<Expr> e = expr(c, 0);
        if (!e.isOk()) {
            throw e.error().wrap("program", c, "Expected the output expression").toException();
        }
        requireEnd(e.rest(), lastStatement);
        return new Program(statements, e.value());
    }

    /** Parses the whole input as a single expression. */
    public Expr parseExpression() {
        Parsed<Expr> e = expr(start, 0);
        if (!e.isOk()) throw e.error().toException();
        requireEnd(e.rest(), null);
        return e.value();
    }

    private static void requireEnd(Cursor c, ParseError cause) {
        if (!c.atEnd()) {
            throw new ParseError("program", c.index(), "Unconsumed input starting at " + c.peek(), cause)
                    .toException();
        }
    }

    // ---------- statements ----------
    private Parsed<Statement> statement(Cursor c) {
        Cursor cur = c;
        PrimitiveType type = null;
        if (cur.peek().type().isType()) {
            type = PrimitiveType.fromKeyword(cur.peek().lexeme());
            cur = cur.advance();
        }

        Parsed<Expr> list = exprList(cur, 0);
        if (!list.isOk()) {
            return Parsed.fail(list.error().wrap("statement", c, "Expected an expression list"));
        }
        Cursor after = list.rest();
        if (!after.check(TokenType.SEMICOLON)) {
            return Parsed.fail(ParseError.of("statement", after, "Expected ';', got " + after.peek()));
        }
        return Parsed.ok(new Statement(type, list.value()), after.advance());
    }

    // ---------- expressions ----------
    private Parsed<Expr> exprList(Cursor c, int depth) {
        Parsed<List<Expr>> items = commaSeparated(c, depth);
        if (!items.isOk()) return Parsed.fail(items.error());
        List<Expr> exprs = items.value();
        return Parsed.ok(exprs.size() == 1 ? exprs.get(0) : new ExprList(exprs), items.rest());
    }

    private Parsed<List<Expr>> commaSeparated(Cursor c, int depth) {
        Parsed<Expr> first = expr(c, depth);
        if (!first.isOk()) {
            return Parsed.fail(first.error().wrap("expr_list", c, "Expected an expression"));
        }

        List<Expr> exprs = new ArrayList<>();
        exprs.add(first.value());
        Cursor cur = first.rest();
        while (cur.check(TokenType.COMMA)) {
            Parsed<Expr> next = expr(cur.advance(), depth);
            if (!next.isOk()) {
                return Parsed.fail(next.error().wrap("expr_list", cur, "Expected an expression after ','"));
            }
            exprs.add(next.value());
            cur = next.rest();
        }
        return Parsed.ok(exprs, cur);
    }

    private Parsed<Expr> expr(Cursor c, int depth) {
        Parsed<Expr> assignment = assignment(c, depth);
        if (assignment.isOk()) return assignment;

        Parsed<Expr> simple = simpleExpr(c, depth);
        if (simple.isOk()) return simple;
        return Parsed.fail(simple.error().wrap("expr", c, "Expected an assignment or expression"));
    }

    private Parsed<Expr> assignment(Cursor c, int depth) {
        Token name = c.peek();
        if (name.type() != TokenType.IDENTIFIER) {
            return Parsed.fail(ParseError.of("assignment", c, "Expected an identifier, got " + name));
        }
        if (!c.advance().check(TokenType.ASSIGN)) {
            return Parsed.fail(ParseError.of("assignment", c, "Expected '=' after " + name.lexeme()));
        }

        Parsed<Expr> value = simpleExpr(c.advance().advance(), depth);
        if (!value.isOk()) {
            return Parsed.fail(value.error().wrap("assignment", c, "Expected a value for " + name.lexeme()));
        }
        return Parsed.ok(new AssignExpr(new Identifier(name.lexeme()), value.value()), value.rest());
    }

    private Parsed<Expr> simpleExpr(Cursor c, int depth) {
        Parsed<Expr> stream = termStream(c, depth);
        if (!stream.isOk()) {
            return Parsed.fail(stream.error().wrap("simple", c, "Expected a term stream"));
        }

        // an incomplete ternary suffix is not an error: the term stream stands alone
        Cursor cur = stream.rest();
        if (!cur.check(TokenType.QUESTION)) return stream;
        int level = deeper(depth, cur);

        Parsed<Expr> whenTrue = expr(cur.advance(), level);
        if (!whenTrue.isOk()) return stream;
        cur = whenTrue.rest();
        if (!cur.check(TokenType.COLON)) return stream;

        Parsed<Expr> whenFalse = expr(cur.advance(), level);
        if (!whenFalse.isOk()) return stream;
        return Parsed.ok(new TernaryExpr(stream.value(), whenTrue.value(), whenFalse.value()), whenFalse.rest());
    }

    private Parsed<Expr> termStream(Cursor c, int depth) {
        Parsed<Expr> first = term(c, depth);
        if (!first.isOk()) {
            return Parsed.fail(first.error().wrap("term_stream", c, "Expected a term"));
        }

        List<Expr> terms = new ArrayList<>();
        List<BinaryExpr.Operator> ops = new ArrayList<>();
        terms.add(first.value());

        Cursor cur = first.rest();
        while (isBinaryOperator(cur.peek().type())) {
            BinaryExpr.Operator op = toBinOp(cur.peek().type());
            Parsed<Expr> next = term(cur.advance(), depth);
            if (!next.isOk()) {
                return Parsed.fail(next.error().wrap("term_stream", cur, "Expected a term after '" + op.symbol() + "'"));
            }
            ops.add(op);
            terms.add(next.value());
            cur = next.rest();
        }
        if (ops.isEmpty()) return Parsed.ok(first.value(), cur);

        Expr folded = fold(terms, ops);
        if (deeperThan(folded, MAX_TREE_DEPTH)) throw new NestingTooDeepException(MAX_TREE_DEPTH, c);
        return Parsed.ok(folded, cur);
    }

    /**
     * Folds {@code t0 op0 t1 op1 ... tn} into one tree: for each precedence level,
     * tightest first, operators of that level are bound left to right. Every
     * operator reaching this fold is left-associative; assignment has its own rule.
     */
    static Expr fold(List<Expr> terms, List<BinaryExpr.Operator> ops) {
        if (terms.size() != ops.size() + 1) {
            throw new IllegalArgumentException("Expected " + (ops.size() + 1) + " terms, got " + terms.size());
        }
        List<Expr> ts = new ArrayList<>(terms);
        List<BinaryExpr.Operator> os = new ArrayList<>(ops);

        for (int level = 0; level <= Precedence.MAX && ts.size() > 1; level++) {
            int i = 0;
            while (i < os.size()) {
                if (os.get(i).precedence() == level) {
                    // stay at i afterwards: the next operator shifts into this slot
                    Expr bound = new BinaryExpr(ts.get(i), os.get(i), ts.get(i + 1));
                    os.remove(i);
                    ts.remove(i + 1);
                    ts.set(i, bound);
                } else {
                    i++;
                }
            }
        }

        if (ts.size() != 1) {
            throw new IllegalStateException("Did not fold term stream: " + ts + " " + os);
        }
        return ts.get(0);
    }

    private Parsed<Expr> term(Cursor c, int depth) {
        int level = deeper(depth, c);
        Token t = c.peek();

        if (t.type() == TokenType.LPAREN) {
            return parenthesized("term", c.advance(), level);
        }

        if (t.type().isType() && c.peekNext().type() == TokenType.LPAREN) {
            // int(a, b) has two arguments, int((a, b)) has one list argument
            Cursor open = c.advance().advance();
            Parsed<List<Expr>> args = commaSeparated(open, level);
            if (!args.isOk()) {
                return Parsed.fail(args.error().wrap("cast", open, "Expected an expression after '('"));
            }
            if (!args.rest().check(TokenType.RPAREN)) {
                return Parsed.fail(ParseError.of("cast", args.rest(), "Expected ')', got " + args.rest().peek()));
            }
            return Parsed.ok(new FunctionCall(t.lexeme(), args.value()), args.rest().advance());
        }

        if (isUnaryOperator(t.type())) {
            Parsed<Expr> operand = term(c.advance(), level);
            if (!operand.isOk()) {
                return Parsed.fail(operand.error().wrap("term", c, "Expected a term after '" + t.lexeme() + "'"));
            }
            return Parsed.ok(new UnaryExpr(toUnaryOp(t.type()), operand.value()), operand.rest());
        }

        return value(c);
    }

    // expr_list ")" after an already consumed "("
    private Parsed<Expr> parenthesized(String rule, Cursor c, int depth) {
        Parsed<Expr> inner = exprList(c, depth);
        if (!inner.isOk()) {
            return Parsed.fail(inner.error().wrap(rule, c, "Expected an expression after '('"));
        }
        if (!inner.rest().check(TokenType.RPAREN)) {
            return Parsed.fail(ParseError.of(rule, inner.rest(), "Expected ')', got " + inner.rest().peek()));
        }
        return Parsed.ok(inner.value(), inner.rest().advance());
    }

    private Parsed<Expr> value(Cursor c) {
        Token t = c.peek();
        return switch (t.type()) {
            // wraps to 32 bits like every other int operation
            case INT_LITERAL -> Parsed.ok(Value.of(new BigInteger(t.lexeme()).intValue()), c.advance());
            case FLOAT_LITERAL -> {
                double d = Double.parseDouble(t.lexeme());
                if (!Double.isFinite(d)) {
                    yield Parsed.fail(ParseError.of("value", c, "Float literal out of range: " + t.lexeme()));
                }
                yield Parsed.ok(Value.of(d), c.advance());
            }
            case BOOL_LITERAL -> Parsed.ok(Value.of("true".equals(t.lexeme())), c.advance());
            case IDENTIFIER -> Parsed.ok(Value.ident(t.lexeme()), c.advance());
            default -> Parsed.fail(ParseError.of("value", c, "Expected literal or identifier, got " + t));
        };
    }

    // ---------- helpers ----------
    private static int deeper(int depth, Cursor at) {
        if (depth >= MAX_DEPTH) throw new NestingTooDeepException(MAX_DEPTH, at);
        return depth + 1;
    }

    // walks at most limit levels down, so a degenerate tree cannot overflow the stack here
    static boolean deeperThan(Expr e, int limit) {
        if (limit < 1) return true;
        for (Expr child : children(e)) {
            if (deeperThan(child, limit - 1)) return true;
        }
        return false;
    }

    private static List<Expr> children(Expr e) {
        if (e instanceof UnaryExpr u) return List.of(u.operand());
        if (e instanceof BinaryExpr b) return List.of(b.left(), b.right());
        if (e instanceof AssignExpr a) return List.of(a.value());
        if (e instanceof TernaryExpr t) return List.of(t.condition(), t.whenTrue(), t.whenFalse());
        if (e instanceof ExprList l) return l.exprs();
        if (e instanceof FunctionCall f) return f.args();
        return List.of();
    }

    private static boolean isUnaryOperator(TokenType t) {
        return t == TokenType.PLUS || t == TokenType.MINUS || t == TokenType.TILDE || t == TokenType.NOT;
    }

    private static boolean isBinaryOperator(TokenType t) {
        return toBinOpOrNull(t) != null;
    }

    private static UnaryExpr.Operator toUnaryOp(TokenType t) {
        return switch (t) {
            case PLUS  -> UnaryExpr.Operator.PLUS;
            case MINUS -> UnaryExpr.Operator.NEG;
            case TILDE -> UnaryExpr.Operator.BIT_NOT;
            case NOT   -> UnaryExpr.Operator.NOT;
            default -> throw new IllegalArgumentException("Not a unary operator token: " + t);
        };
    }

    private static BinaryExpr.Operator toBinOp(TokenType t) {
        BinaryExpr.Operator op = toBinOpOrNull(t);
        if (op == null) throw new IllegalArgumentException("Not a binary operator token: " + t);
        return op;
    }

    private static BinaryExpr.Operator toBinOpOrNull(TokenType t) {
        return switch (t) {
            case PLUS    -> BinaryExpr.Operator.ADD;
            case MINUS   -> BinaryExpr.Operator.SUB;
            case STAR    -> BinaryExpr.Operator.MUL;
            case SLASH   -> BinaryExpr.Operator.DIV;
            case PERCENT -> BinaryExpr.Operator.MOD;

            case SHL -> BinaryExpr.Operator.SHL;
            case SHR -> BinaryExpr.Operator.SHR;

            case AMP   -> BinaryExpr.Operator.BIT_AND;
            case CARET -> BinaryExpr.Operator.BIT_XOR;
            case PIPE  -> BinaryExpr.Operator.BIT_OR;

            case GT  -> BinaryExpr.Operator.GT;
            case LT  -> BinaryExpr.Operator.LT;
            case GE  -> BinaryExpr.Operator.GE;
            case LE  -> BinaryExpr.Operator.LE;
            case EQ  -> BinaryExpr.Operator.EQ;
            case NEQ -> BinaryExpr.Operator.NE;

            case AND -> BinaryExpr.Operator.AND;
            case XOR -> BinaryExpr.Operator.XOR;
            case OR  -> BinaryExpr.Operator.OR;

            default -> null;
        };
    }
}
