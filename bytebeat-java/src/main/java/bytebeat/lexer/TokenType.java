package bytebeat.lexer;

public enum TokenType {

    // literals
    IDENTIFIER,
    INT_LITERAL,
    FLOAT_LITERAL,
    BOOL_LITERAL,

    // types
    INT,
    FLOAT,
    BOOL,

    // operators
    PLUS, MINUS, STAR, SLASH, PERCENT,
    SHL, SHR,
    AMP, CARET, PIPE,
    GT, LT, GE, LE,
    EQ, NEQ,
    AND, XOR, OR,
    TILDE, NOT,
    ASSIGN,

    // symbols
    LPAREN, RPAREN,
    SEMICOLON, COLON, QUESTION, COMMA,

    EOF;

    public boolean isType() {
        return this == INT || this == FLOAT || this == BOOL;
    }
}
