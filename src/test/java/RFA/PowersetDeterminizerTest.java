package RFA;

import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.fsa.NFAs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class PowersetDeterminizerTest {

    @Test
    void testAgainstAutomataLib() {
        for (int size = 1; size < 10; size++) {
            for (int seed = 0; seed < 50; seed++) {
                String debug = seed + "; " + size;
                CompactNFA<Character> nfa = TabakovVardiRandomAutomaton.getRandomNFA(seed, size);
                Alphabet<Character> alphabet = nfa.getInputAlphabet();
                Automaton dfa = PowersetDeterminizer.determinize(CompactConversions.fromCompactNFA(nfa));
                Assertions.assertTrue(dfa.isDeterministic(), debug);

                CompactDFA<Character> expected = NFAs.determinize(nfa, alphabet, false, false);
                Assertions.assertTrue(
                    Automata.testEquivalence(expected, CompactConversions.toCompactDFA(dfa, alphabet), alphabet), debug);
            }
        }
    }

    @Test
    void testStatesAreDistinctSubsets() {
        // (a+b)*abb: the textbook subset construction has 5 states
        Automaton dfa = PowersetDeterminizer.determinize(Automaton.fromRegex("(a+b)*abb"));
        Assertions.assertEquals(5, dfa.size());
        Assertions.assertEquals(0, dfa.getStart());
        Assertions.assertEquals(1, dfa.countAccepting());
        Assertions.assertTrue(dfa.isAccepting(dfa.getEnd()));
    }

    @Test
    void testEmptyClosureGivesSingleRejectingState() {
        Automaton dfa = PowersetDeterminizer.determinize(new Automaton());
        Assertions.assertEquals(1, dfa.size());
        Assertions.assertFalse(dfa.isAccepting(dfa.getStart()));
    }

    @Test
    void testPartialResult() {
        Automaton dfa = PowersetDeterminizer.determinize(Automaton.fromRegex("ab"));
        Assertions.assertEquals(3, dfa.size());
        Assertions.assertEquals(Automaton.NONE, dfa.getState(dfa.getStart()).getTarget(Label.symbol('b')));
        Assertions.assertFalse(DFACompletion.isComplete(dfa));
    }
}
