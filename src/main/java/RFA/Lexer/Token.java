package RFA.Lexer;

import java.util.List;

/**
 * Immutable lexical unit of a regex. Only {@link TokenType#SYMBOL} tokens carry a symbol.
 */
public record Token(TokenType type, char symbol) {
    public static final Token EPSILON = new Token(TokenType.EPSILON, '\0');
    public static final Token CONCAT = new Token(TokenType.CONCAT, '\0');
    public static final Token UNION = new Token(TokenType.UNION, '\0');
    public static final Token KLEENE_STAR = new Token(TokenType.KLEENE_STAR, '\0');
    public static final Token LPAREN = new Token(TokenType.LPAREN, '\0');
    public static final Token RPAREN = new Token(TokenType.RPAREN, '\0');

    public static Token symbol(char symbol) {
        return new Token(TokenType.SYMBOL, symbol);
    }

    public static Token operator(TokenType type) {
        return switch (type) {
            case SYMBOL -> throw new IllegalArgumentException("Symbol tokens need a symbol");
            case EPSILON -> EPSILON;
            case CONCAT -> CONCAT;
            case UNION -> UNION;
            case KLEENE_STAR -> KLEENE_STAR;
            case LPAREN -> LPAREN;
            case RPAREN -> RPAREN;
        };
    }

    /**
     * Joins tokens into their surface text, separated by spaces, e.g. {@code "a b . c ."}.
     */
    public static String toString(List<Token> tokens) {
        final StringBuilder sb = new StringBuilder();
        for (Token t : tokens) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(t);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.valueOf(type == TokenType.SYMBOL ? symbol : type.getText());
    }
}
