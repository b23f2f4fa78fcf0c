package bytebeat.lexer;

import java.util.*;

public class Lexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int pos = 0;
    private int line = 1;
    private int col = 1;

    private static final Map<String, TokenType> keywords = Map.ofEntries(
            Map.entry("int", TokenType.INT),
            Map.entry("float", TokenType.FLOAT),
            Map.entry("bool", TokenType.BOOL),
            Map.entry("true", TokenType.BOOL_LITERAL),
            Map.entry("false", TokenType.BOOL_LITERAL)
    );

    // longest first, so ">>" wins over ">" and "&&" over "&"
    private static final List<Map.Entry<String, TokenType>> symbols = sortedByLength(Map.ofEntries(
            Map.entry("(", TokenType.LPAREN),
            Map.entry(")", TokenType.RPAREN),
            Map.entry(";", TokenType.SEMICOLON),
            Map.entry(":", TokenType.COLON),
            Map.entry("?", TokenType.QUESTION),
            Map.entry(",", TokenType.COMMA),
            Map.entry("=", TokenType.ASSIGN),
            Map.entry("+", TokenType.PLUS),
            Map.entry("-", TokenType.MINUS),
            Map.entry("*", TokenType.STAR),
            Map.entry("/", TokenType.SLASH),
            Map.entry("%", TokenType.PERCENT),
            Map.entry("<<", TokenType.SHL),
            Map.entry(">>", TokenType.SHR),
            Map.entry("&", TokenType.AMP),
            Map.entry("^", TokenType.CARET),
            Map.entry("|", TokenType.PIPE),
            Map.entry(">", TokenType.GT),
            Map.entry("<", TokenType.LT),
            Map.entry(">=", TokenType.GE),
            Map.entry("<=", TokenType.LE),
            Map.entry("==", TokenType.EQ),
            Map.entry("!=", TokenType.NEQ),
            Map.entry("&&", TokenType.AND),
            Map.entry("^^", TokenType.XOR),
            Map.entry("||", TokenType.OR),
            Map.entry("~", TokenType.TILDE),
            Map.entry("!", TokenType.NOT)
    ));

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            skipWhitespace();
            if (isAtEnd()) break;

            int startLine = line;
            int startCol = col;
            char c = peek();

            if (isDigit(c)) {
                numberLiteral(startLine, startCol);
            } else if (isIdentifierStart(c)) {
                identifier(startLine, startCol);
            } else if (!symbol(startLine, startCol)) {
                throw new LexerException("Unrecognized character: '" + c + "'", startLine, startCol);
            }
        }

        tokens.add(new Token(TokenType.EOF, "", line, col));
        return tokens;
    }

    // ================= helpers =================

    private boolean symbol(int line, int col) {
        for (Map.Entry<String, TokenType> entry : symbols) {
            String text = entry.getKey();
            if (source.startsWith(text, pos)) {
                pos += text.length();
                this.col += text.length();
                tokens.add(new Token(entry.getValue(), text, line, col));
                return true;
            }
        }
        return false;
    }

    // digits, optionally followed by '.' and more digits; "1." is a float
    private void numberLiteral(int line, int col) {
        int begin = pos;
        skipDigits();
        boolean isFloat = peek() == '.';
        if (isFloat) {
            advance();
            skipDigits();
        }
        tokens.add(new Token(isFloat ? TokenType.FLOAT_LITERAL : TokenType.INT_LITERAL,
                source.substring(begin, pos), line, col));
    }

    private void identifier(int line, int col) {
        int begin = pos;
        while (isIdentifierStart(peek()) || isDigit(peek())) advance();

        String text = source.substring(begin, pos);
        tokens.add(new Token(keywords.getOrDefault(text, TokenType.IDENTIFIER), text, line, col));
    }

    private void skipDigits() {
        while (isDigit(peek())) advance();
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            switch (c) {
                case ' ', '\t', '\r' -> advance();
                case '\n' -> {
                    advance();
                    line++;
                    col = 1;
                }
                default -> { return; }
            }
        }
    }

    private void advance() {
        pos++;
        col++;
    }

    // '\0' past the end, which no character class accepts
    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    // ASCII only: identifiers are [A-Za-z_][A-Za-z0-9_]*
    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static List<Map.Entry<String, TokenType>> sortedByLength(Map<String, TokenType> table) {
        List<Map.Entry<String, TokenType>> entries = new ArrayList<>(table.entrySet());
        entries.sort(Comparator.comparingInt((Map.Entry<String, TokenType> e) -> e.getKey().length()).reversed());
        return List.copyOf(entries);
    }
}
