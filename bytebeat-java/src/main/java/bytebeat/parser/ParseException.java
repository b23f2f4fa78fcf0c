package bytebeat.parser;

public class ParseException extends RuntimeException {
    private final String rule;
    private final int position;

    public ParseException(ParseError error, ParseException cause) {
        super(error.toString(), cause);
        this.rule = error.rule();
        this.position = error.position();
    }

    protected ParseException(String rule, int position, String message) {
        super(rule + " @ " + position + ": " + message);
        this.rule = rule;
        this.position = position;
    }

    public String rule() {
        return rule;
    }

    /** Token index where the failing rule started. */
    public int position() {
        return position;
    }
}
