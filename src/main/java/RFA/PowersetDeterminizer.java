package RFA;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;

import RFA.Model.DeterminizeRecord;
import RFA.Model.StateSetRegistry;

public class PowersetDeterminizer {
    /**
     * Subset construction, breadth-first from the epsilon closure of the start state.
     * Empty successor sets are skipped, so the result may be partial. The visible alphabet is carried over.
     * @param nfa - original automaton, not modified
     * @return a new deterministic automaton with states numbered in discovery order
     */
    public static Automaton determinize(Automaton nfa) {
        final Automaton dfa = new Automaton();
        dfa.addSymbols(nfa.getAlphabet());

        final EpsilonClosure closure = new EpsilonClosure(nfa);
        final BitSet init = new BitSet();
        if (nfa.getStart() != Automaton.NONE) {
            init.set(nfa.getStart());
        }
        final BitSet initClosure = closure.closure(init);
        if (initClosure.isEmpty()) {
            dfa.addInitialState(false);
            dfa.resetEnd();
            return dfa;
        }

        final StateSetRegistry registry = new StateSetRegistry();
        final Deque<DeterminizeRecord> queue = new ArrayDeque<>();

        final int initOut = dfa.addInitialState(closure.containsAccepting(initClosure));
        registry.put(initClosure, initOut);
        queue.add(new DeterminizeRecord(initClosure, initOut));

        while (!queue.isEmpty()) {
            final DeterminizeRecord curr = queue.poll();
            for (char c : nfa.getAlphabet()) {
                final Label symbol = Label.symbol(c);
                final BitSet succ = closure.closure(closure.step(curr.stateSet(), symbol));
                if (succ.isEmpty()) {
                    continue;
                }
                int outSucc = registry.get(succ);
                if (outSucc == StateSetRegistry.MISSING_ELEMENT) {
                    // add new state to DFA and to queue
                    outSucc = dfa.addState(closure.containsAccepting(succ));
                    registry.put(succ, outSucc);
                    queue.add(new DeterminizeRecord(succ, outSucc));
                }
                dfa.addTransition(curr.dfaState(), symbol, outSucc);
            }
        }
        dfa.resetEnd();

        if (Automaton.DEBUG) {
            System.out.println("DEBUG: Determinized " + nfa.size() + " states into " + dfa.size() + " states");
        }
        return dfa;
    }
}
