package RFA.Lexer;

import java.util.regex.PatternSyntaxException;

/**
 * Failure to turn regex text or a postfix token stream into an automaton.
 * The index is a character index for {@link Kind#LEXICAL} errors and a token index otherwise.
 */
public class RegexSyntaxException extends PatternSyntaxException {
    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** Unrecognized character. */
        LEXICAL,
        /** Mismatched parentheses. */
        SYNTAX,
        /** Operator arity or leftover operands in a postfix stream. */
        STRUCTURAL
    }

    private final Kind kind;

    public RegexSyntaxException(Kind kind, String desc, String regex, int index) {
        super(desc, regex, index);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
