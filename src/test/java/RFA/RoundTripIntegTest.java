package RFA;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("IntegTest")
public class RoundTripIntegTest {
    @Test
    void testRandomRegexes() {
        for (int seed = 0; seed < 300; seed++) {
            RandomRegex generator = new RandomRegex(seed, "abc");
            String regex = generator.next(4);
            String debug = seed + "; " + regex;

            Automaton nfa = Automaton.fromRegex(regex);
            Automaton minimal = nfa.getMinimal();
            Assertions.assertTrue(minimal.isDeterministic(), debug);
            Assertions.assertTrue(minimal.size() <= nfa.getDFA().size(), debug);
            Assertions.assertTrue(minimal.isEquivalent(nfa), debug);

            String regenerated = minimal.toRegex();
            Assertions.assertTrue(Automaton.fromRegex(regenerated).isEquivalent(nfa), debug + " -> " + regenerated);
            Assertions.assertTrue(nfa.getComplement().getComplement().isEquivalent(nfa), debug);
        }
    }

    @Test
    void testRandomAutomata() {
        for (int size = 2; size < 8; size++) {
            for (int seed = 0; seed < 100; seed++) {
                String debug = seed + "; " + size;
                Automaton a = TabakovVardiRandomAutomaton.getRandomAutomaton(seed, size);
                Automaton minimal = a.getMinimal();
                Assertions.assertTrue(minimal.isEquivalent(a), debug);
                // minimizing again finds nothing to merge
                Assertions.assertEquals(minimal.size(), minimal.getMinimal().size(), debug);

                String regex = a.toRegex();
                if (!regex.equals("0")) {
                    Assertions.assertTrue(Automaton.fromRegex(regex).isEquivalent(a), debug + " -> " + regex);
                }
            }
        }
    }
}
