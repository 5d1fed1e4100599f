package RFA;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class DFACompletionTest {

    @Test
    void testCompleteAddsSink() {
        Automaton dfa = Automaton.fromRegex("a+b").getDFA();
        Assertions.assertFalse(DFACompletion.isComplete(dfa));
        int size = dfa.size();

        Automaton complete = DFACompletion.complete(dfa);
        Assertions.assertEquals(size + 1, complete.size());
        Assertions.assertTrue(DFACompletion.isComplete(complete));
        Assertions.assertTrue(complete.isDeterministic());
        Assertions.assertEquals(size, dfa.size());

        int sink = size;
        Assertions.assertFalse(complete.isAccepting(sink));
        Assertions.assertEquals(sink, complete.getState(sink).getTarget(Label.symbol('a')));
        Assertions.assertEquals(sink, complete.getState(sink).getTarget(Label.symbol('b')));
        Assertions.assertTrue(complete.isEquivalent(dfa));
    }

    @Test
    void testAlreadyComplete() {
        Automaton dfa = Automaton.fromRegex("(a+b)*").getDFA();
        Assertions.assertSame(dfa, DFACompletion.complete(dfa));

        // empty alphabet is trivially complete
        Automaton epsilon = Automaton.fromRegex("1").getDFA();
        Assertions.assertSame(epsilon, DFACompletion.complete(epsilon));
    }

    @Test
    void testComplement() {
        Automaton complete = DFACompletion.complete(Automaton.fromRegex("a").getDFA());
        Automaton complement = DFACompletion.complement(complete);
        Assertions.assertNotSame(complete, complement);
        Assertions.assertTrue(complement.accepts(""));
        Assertions.assertTrue(complement.accepts("aa"));
        Assertions.assertFalse(complement.accepts("a"));
        Assertions.assertTrue(complete.accepts("a"));
        Assertions.assertTrue(complement.isAccepting(complement.getEnd()));
    }
}
