package RFA.Lexer;

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class LexerTest {

    @Test
    void testTokenizeExplicitConcatenation() {
        List<Token> tokens = Lexer.tokenize("a.b.c");
        Assertions.assertEquals(5, tokens.size());
        Assertions.assertEquals(Token.symbol('a'), tokens.get(0));
        Assertions.assertEquals(Token.CONCAT, tokens.get(1));
        Assertions.assertEquals(Token.symbol('c'), tokens.get(4));
    }

    @Test
    void testTokenizeStarredGroup() {
        List<Token> tokens = Lexer.tokenize("(a+b+c)*");
        Assertions.assertEquals(8, tokens.size());
        Assertions.assertEquals(TokenType.LPAREN, tokens.get(0).type());
        Assertions.assertEquals(TokenType.RPAREN, tokens.get(6).type());
        Assertions.assertEquals(TokenType.KLEENE_STAR, tokens.get(7).type());

        Assertions.assertEquals(9, Lexer.tokenize("(a+b+c*)*").size());
    }

    @Test
    void testTokenizeSkipsWhitespaceAndReadsEpsilon() {
        List<Token> tokens = Lexer.tokenize(" a +\t1 ");
        Assertions.assertEquals(List.of(Token.symbol('a'), Token.UNION, Token.EPSILON), tokens);
    }

    @Test
    void testUnexpectedCharacter() {
        RegexSyntaxException e = Assertions.assertThrows(RegexSyntaxException.class, () -> Lexer.tokenize("a#b"));
        Assertions.assertEquals(RegexSyntaxException.Kind.LEXICAL, e.getKind());
        Assertions.assertEquals("Unexpected character: #", e.getDescription());
        Assertions.assertEquals(1, e.getIndex());
        Assertions.assertEquals("a#b", e.getPattern());

        // only 1 is a digit of the grammar
        Assertions.assertThrows(RegexSyntaxException.class, () -> Lexer.tokenize("0"));
    }

    @Test
    void testImplicitConcatenation() {
        List<Token> tokens = Lexer.addConcatenationOperators(Lexer.tokenize("a(b+c)"));
        Assertions.assertEquals(7, tokens.size());
        Assertions.assertEquals(Token.CONCAT, tokens.get(1));

        Assertions.assertEquals("a . b", concatenated("ab"));
        Assertions.assertEquals("a * . b", concatenated("a*b"));
        Assertions.assertEquals("( a ) . ( b )", concatenated("(a)(b)"));
        Assertions.assertEquals("1 . a", concatenated("1a"));
        Assertions.assertEquals("a + b", concatenated("a+b"));
        Assertions.assertEquals("a . b", concatenated("a.b"));
    }

    @Test
    void testNeedsConcat() {
        Assertions.assertTrue(Lexer.needsConcat(TokenType.RPAREN, TokenType.LPAREN));
        Assertions.assertTrue(Lexer.needsConcat(TokenType.KLEENE_STAR, TokenType.SYMBOL));
        Assertions.assertFalse(Lexer.needsConcat(TokenType.SYMBOL, TokenType.KLEENE_STAR));
        Assertions.assertFalse(Lexer.needsConcat(TokenType.LPAREN, TokenType.SYMBOL));
        Assertions.assertFalse(Lexer.needsConcat(TokenType.UNION, TokenType.SYMBOL));
    }

    @Test
    void testOperatorTokens() {
        Assertions.assertSame(Token.UNION, Token.operator(TokenType.UNION));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Token.operator(TokenType.SYMBOL));
        Assertions.assertEquals("*", Token.KLEENE_STAR.toString());
    }

    private static String concatenated(String regex) {
        return Token.toString(Lexer.addConcatenationOperators(Lexer.tokenize(regex)));
    }
}
