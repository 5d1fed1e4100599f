package RFA;

import java.util.List;

import RFA.Lexer.RegexSyntaxException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class AutomatonFactoryTest {
    private static final List<String> REGEXES =
        List.of("a", "1", "ab", "a+b", "a*", "(a+b)*c", "a(b+c)*", "(a*b*)*", "((a))", "1+a.b");

    @Test
    void testSymbolFragment() {
        Automaton a = AutomatonFactory.symbol('a');
        Assertions.assertEquals(2, a.size());
        Assertions.assertEquals(0, a.getStart());
        Assertions.assertEquals(1, a.getEnd());
        Assertions.assertEquals(1, a.getState(0).getTarget(Label.symbol('a')));
        Assertions.assertFalse(a.isAccepting(0));
        Assertions.assertTrue(a.isAccepting(1));
    }

    @Test
    void testFragmentShape() {
        for (String regex : REGEXES) {
            Automaton a = Automaton.fromRegex(regex);
            Assertions.assertEquals(1, a.countAccepting(), regex);
            Assertions.assertTrue(a.isAccepting(a.getEnd()), regex);
            Assertions.assertNotEquals(a.getStart(), a.getEnd(), regex);
            Assertions.assertTrue(a.getTransitions(a.getEnd()).isEmpty(), regex);
        }
    }

    @Test
    void testFragmentSizes() {
        Assertions.assertEquals(2, Automaton.fromRegex("a").size());
        Assertions.assertEquals(2, Automaton.fromRegex("1").size());
        Assertions.assertEquals(4, Automaton.fromRegex("ab").size());
        Assertions.assertEquals(6, Automaton.fromRegex("a+b").size());
        Assertions.assertEquals(4, Automaton.fromRegex("a*").size());
    }

    @Test
    void testAlphabet() {
        Assertions.assertEquals(List.of('a', 'b', 'c'), List.copyOf(Automaton.fromRegex("(a+b)*c").getAlphabet()));
        Assertions.assertTrue(Automaton.fromRegex("1").getAlphabet().isEmpty());
    }

    @Test
    void testOperandsUntouched() {
        Automaton a = AutomatonFactory.symbol('a');
        Automaton b = AutomatonFactory.symbol('b');
        Automaton ab = AutomatonFactory.concat(a, b);
        Assertions.assertEquals(4, ab.size());
        Assertions.assertEquals(2, a.size());
        Assertions.assertEquals(1, a.countAccepting());
        Assertions.assertTrue(a.isAccepting(1));

        Automaton star = AutomatonFactory.kleeneStar(ab);
        Assertions.assertEquals(6, star.size());
        Assertions.assertEquals(4, ab.size());
        Assertions.assertTrue(star.accepts(""));
        Assertions.assertTrue(star.accepts("abab"));
        Assertions.assertFalse(ab.accepts(""));
    }

    @Test
    void testPostfix() {
        Automaton union = Automaton.fromPostfix("ab+");
        Assertions.assertEquals(1, union.containsPrefix("abacb"));
        Assertions.assertTrue(Automaton.fromPostfix("ab.").accepts("ab"));
        Assertions.assertTrue(Automaton.fromPostfix("ab+*c.").accepts("abbac"));
    }

    @Test
    void testInsufficientOperands() {
        assertStructural(".", "Insufficient operands for concatenation");
        assertStructural("a+", "Insufficient operands for union");
        assertStructural("*", "Insufficient operands for Kleene star");
    }

    @Test
    void testLeftoverOperands() {
        assertStructural("ab", "Invalid regex expression: stack has 2 elements");
        assertStructural("", "Invalid regex expression: stack has 0 elements");
    }

    @Test
    void testParenthesisInPostfix() {
        assertStructural("(a)", "Unexpected token in postfix expression: (");
    }

    @Test
    void testInfixErrors() {
        RegexSyntaxException e = Assertions.assertThrows(RegexSyntaxException.class, () -> Automaton.fromRegex("a+"));
        Assertions.assertEquals("Insufficient operands for union", e.getDescription());

        e = Assertions.assertThrows(RegexSyntaxException.class, () -> Automaton.fromRegex("*a"));
        Assertions.assertEquals("Insufficient operands for Kleene star", e.getDescription());

        e = Assertions.assertThrows(RegexSyntaxException.class, () -> Automaton.fromRegex(""));
        Assertions.assertEquals(RegexSyntaxException.Kind.STRUCTURAL, e.getKind());

        e = Assertions.assertThrows(RegexSyntaxException.class, () -> Automaton.fromRegex("(a+b"));
        Assertions.assertEquals(RegexSyntaxException.Kind.SYNTAX, e.getKind());
    }

    private static void assertStructural(String postfix, String description) {
        RegexSyntaxException e = Assertions.assertThrows(RegexSyntaxException.class, () -> Automaton.fromPostfix(postfix));
        Assertions.assertEquals(RegexSyntaxException.Kind.STRUCTURAL, e.getKind());
        Assertions.assertEquals(description, e.getDescription());
    }
}
