package bytebeat.print;

public enum PrintStyle {
    /** Spaces around operators, one statement per line. */
    PRETTY,
    /** Only the whitespace the lexer needs to split tokens. */
    MINIMAL
}
