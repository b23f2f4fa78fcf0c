package bytebeat.parser;

/** Thrown instead of overflowing the stack on pathologically nested input. Never backtracked. */
public class NestingTooDeepException extends ParseException {
    public NestingTooDeepException(int limit, Cursor at) {
        super("term", at.index(), "Nesting deeper than " + limit + " levels at " + at.peek());
    }
}
