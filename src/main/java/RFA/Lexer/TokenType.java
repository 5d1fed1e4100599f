package RFA.Lexer;

public enum TokenType {
    SYMBOL,
    EPSILON('1'),
    CONCAT('.'),
    UNION('+'),
    KLEENE_STAR('*'),
    LPAREN('('),
    RPAREN(')');

    private final char text;

    TokenType() {
        this('\0');
    }

    TokenType(char text) {
        this.text = text;
    }

    /**
     * Surface character of this type, or {@code '\0'} for {@link #SYMBOL}, whose text is the symbol itself.
     */
    public char getText() {
        return text;
    }

    /**
     * Whether a token of this type can end a complete sub-expression.
     */
    boolean endsOperand() {
        return this == SYMBOL || this == RPAREN || this == KLEENE_STAR || this == EPSILON;
    }

    /**
     * Whether a token of this type can start a new sub-expression.
     */
    boolean startsOperand() {
        return this == SYMBOL || this == LPAREN || this == EPSILON;
    }
}
