package bytebeat.parser;

/**
 * A failed rule: its name, the token index it started at, and the failure of the
 * sub-rule that caused it (if any).
 */
public record ParseError(String rule, int position, String message, ParseError cause) {

    public static ParseError of(String rule, Cursor at, String message) {
        return new ParseError(rule, at.index(), message, null);
    }

    /** Wraps this error as the cause of a failure of {@code rule}. */
    public ParseError wrap(String rule, Cursor at, String message) {
        return new ParseError(rule, at.index(), message, this);
    }

    public ParseException toException() {
        return new ParseException(this, cause == null ? null : cause.toException());
    }

    @Override
    public String toString() {
        return rule + " @ " + position + ": " + message;
    }
}
