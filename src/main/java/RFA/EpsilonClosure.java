package RFA;

import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Epsilon closures and one-step successors over state sets of a fixed automaton.
 * Per-state closures are memoized; the automaton must not change while an instance is in use.
 */
final class EpsilonClosure {
    static final int CACHE_THRESHOLD = 1000;
    private static final int MAX_CACHE_SIZE = 100_000;

    private final Automaton automaton;
    private final Map<Integer, BitSet> closures;

    EpsilonClosure(Automaton automaton) {
        this.automaton = automaton;
        if (automaton.size() < CACHE_THRESHOLD) {
            this.closures = new HashMap<>();
        } else {
            // bounded, so that very large automata don't hold every closure at once
            final Cache<Integer, BitSet> cache = Caffeine.newBuilder()
                .initialCapacity(CACHE_THRESHOLD)
                .maximumSize(MAX_CACHE_SIZE)
                .build();
            this.closures = cache.asMap();
        }
    }

    /**
     * All states reachable from {@code states} through epsilon transitions only, {@code states} included.
     */
    BitSet closure(BitSet states) {
        final BitSet result = new BitSet();
        for (int i = states.nextSetBit(0); i >= 0; i = states.nextSetBit(i + 1)) {
            result.or(closureOf(i));
        }
        return result;
    }

    /**
     * Union of the targets of {@code label} over all members of {@code states}.
     */
    BitSet step(BitSet states, Label label) {
        final BitSet result = new BitSet();
        for (int i = states.nextSetBit(0); i >= 0; i = states.nextSetBit(i + 1)) {
            final IntList targets = automaton.getState(i).getTargets(label);
            for (int k = 0; k < targets.size(); k++) {
                result.set(targets.getInt(k));
            }
        }
        return result;
    }

    boolean containsAccepting(BitSet states) {
        return automaton.containsAccepting(states);
    }

    private BitSet closureOf(int state) {
        BitSet closure = closures.get(state);
        if (closure == null) {
            closure = breadthFirst(state);
            closures.put(state, closure);
        }
        return closure;
    }

    private BitSet breadthFirst(int seed) {
        final BitSet closure = new BitSet();
        final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        closure.set(seed);
        queue.enqueue(seed);
        while (!queue.isEmpty()) {
            final IntList targets = automaton.getState(queue.dequeueInt()).getTargets(Label.EPSILON);
            for (int k = 0; k < targets.size(); k++) {
                final int next = targets.getInt(k);
                if (!closure.get(next)) {
                    closure.set(next);
                    queue.enqueue(next);
                }
            }
        }
        return closure;
    }
}
