package bytebeat.parser;

import bytebeat.lexer.Token;
import bytebeat.lexer.TokenType;

import java.util.List;

/**
 * Immutable position in a token list. Advancing returns a new cursor, so a rule
 * that fails leaves its caller's position untouched.
 */
public record Cursor(List<Token> tokens, int index) {

    public Cursor {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
    }

    public static Cursor start(List<Token> tokens) {
        return new Cursor(List.copyOf(tokens), 0);
    }

    public Token peek() {
        return tokens.get(Math.min(index, tokens.size() - 1));
    }

    public Token peekNext() {
        return tokens.get(Math.min(index + 1, tokens.size() - 1));
    }

    public boolean check(TokenType type) {
        return peek().type() == type;
    }

    public boolean atEnd() {
        return check(TokenType.EOF);
    }

    public Cursor advance() {
        return atEnd() ? this : new Cursor(tokens, index + 1);
    }
}
