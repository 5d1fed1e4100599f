package RFA;

import java.util.BitSet;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class EpsilonClosureTest {

    @Test
    void testClosureIncludesSeeds() {
        Automaton a = Automaton.fromRegex("(a+1)b");
        EpsilonClosure closure = new EpsilonClosure(a);
        BitSet seeds = new BitSet();
        seeds.set(a.getStart());
        BitSet result = closure.closure(seeds);
        Assertions.assertTrue(result.get(a.getStart()));
        BitSet b = closure.step(result, Label.symbol('b'));
        Assertions.assertFalse(b.isEmpty());
        Assertions.assertTrue(closure.containsAccepting(closure.closure(b)));
    }

    @Test
    void testEpsilonCycle() {
        Automaton a = new Automaton();
        a.addInitialState(false);
        a.addState(false);
        a.addState(true);
        a.addEpsilonTransition(0, 1);
        a.addEpsilonTransition(1, 0);
        a.addEpsilonTransition(1, 2);

        BitSet seeds = new BitSet();
        seeds.set(1);
        Assertions.assertEquals(3, new EpsilonClosure(a).closure(seeds).cardinality());
        Assertions.assertTrue(a.accepts(""));
    }

    @Test
    void testLargeAutomatonUsesBoundedCache() {
        int size = 2 * EpsilonClosure.CACHE_THRESHOLD;
        Automaton chain = new Automaton();
        chain.addInitialState(false);
        for (int i = 1; i < size; i++) {
            chain.addState(i == size - 1);
            chain.addEpsilonTransition(i - 1, i);
        }
        EpsilonClosure closure = new EpsilonClosure(chain);
        BitSet seeds = new BitSet();
        seeds.set(size / 2);
        Assertions.assertEquals(size - size / 2, closure.closure(seeds).cardinality());
        Assertions.assertTrue(chain.accepts(""));
        Assertions.assertEquals(1, chain.getMinimal().size());
    }
}
