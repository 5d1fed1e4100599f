package RFA.Lexer;

import java.util.ArrayList;
import java.util.List;

public class Lexer {
    /**
     * Tokenize regex text, one token per non-whitespace character.
     * @param regex - regex text, e.g. "(a+b)*.c"
     * @return tokens in input order, without implicit concatenation
     * @throws RegexSyntaxException (LEXICAL) on a character outside the grammar
     */
    public static List<Token> tokenize(String regex) {
        final List<Token> tokens = new ArrayList<>(regex.length());
        for (int i = 0; i < regex.length(); i++) {
            final char c = regex.charAt(i);
            if (Character.isWhitespace(c)) {
                continue;
            }
            if (isSymbol(c)) {
                tokens.add(Token.symbol(c));
                continue;
            }
            tokens.add(switch (c) {
                case '+' -> Token.UNION;
                case '*' -> Token.KLEENE_STAR;
                case '.' -> Token.CONCAT;
                case '(' -> Token.LPAREN;
                case ')' -> Token.RPAREN;
                case '1' -> Token.EPSILON;
                default -> throw new RegexSyntaxException(
                    RegexSyntaxException.Kind.LEXICAL, "Unexpected character: " + c, regex, i);
            });
        }
        return tokens;
    }

    /**
     * ASCII letters only; everything else is either an operator or a lexical error.
     */
    public static boolean isSymbol(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    /**
     * Insert a CONCAT token between two adjacent tokens whenever the first ends a sub-expression
     * and the second starts one, so that "ab" reads as "a.b".
     */
    public static List<Token> addConcatenationOperators(List<Token> tokens) {
        final List<Token> result = new ArrayList<>(tokens.size() * 2);
        for (int i = 0; i < tokens.size(); i++) {
            final Token current = tokens.get(i);
            result.add(current);
            if (i + 1 < tokens.size() && needsConcat(current.type(), tokens.get(i + 1).type())) {
                result.add(Token.CONCAT);
            }
        }
        return result;
    }

    static boolean needsConcat(TokenType first, TokenType second) {
        return first.endsOperand() && second.startsOperand();
    }
}
