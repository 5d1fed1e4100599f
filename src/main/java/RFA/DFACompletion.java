package RFA;

import java.util.ArrayList;
import java.util.List;

/**
 * Completion and complementation of deterministic automata.
 */
public class DFACompletion {

    /**
     * Whether every state has a transition on every alphabet symbol.
     */
    public static boolean isComplete(Automaton dfa) {
        for (State s : dfa.getStates()) {
            for (char c : dfa.getAlphabet()) {
                if (!s.hasTransition(Label.symbol(c))) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Route every missing transition to one new non-accepting sink with a self-loop on every symbol.
     * @param dfa - deterministic automaton, not modified
     * @return {@code dfa} itself if it is already complete, otherwise a completed copy
     */
    public static Automaton complete(Automaton dfa) {
        if (isComplete(dfa)) {
            return dfa;
        }
        final Automaton result = new Automaton(dfa);
        final List<Character> alphabet = new ArrayList<>(result.getAlphabet());
        final int sink = result.addState(false);
        for (char c : alphabet) {
            result.addTransition(sink, c, sink);
        }
        for (int q = 0; q < sink; q++) {
            final State s = result.getState(q);
            for (char c : alphabet) {
                if (!s.hasTransition(Label.symbol(c))) {
                    result.addTransition(q, c, sink);
                }
            }
        }
        return result;
    }

    /**
     * Flip every accepting flag. Only a language complement if {@code dfa} is complete.
     * @param dfa - complete deterministic automaton, not modified
     * @return a new automaton
     */
    public static Automaton complement(Automaton dfa) {
        final Automaton result = new Automaton(dfa);
        for (int q = 0; q < result.size(); q++) {
            result.setAccepting(q, !result.isAccepting(q));
        }
        result.resetEnd();
        return result;
    }
}
