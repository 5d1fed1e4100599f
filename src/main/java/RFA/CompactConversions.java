package RFA;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import RFA.Lexer.Lexer;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.Automata;

/**
 * Conversions between {@link Automaton} and AutomataLib's compact automata.
 */
public class CompactConversions {

    public static CompactDFA<Character> toCompactDFA(Automaton automaton) {
        return toCompactDFA(automaton, Alphabets.fromCollection(automaton.getAlphabet()));
    }

    /**
     * Determinize a copy and export it as a complete DFA over {@code alphabet}.
     * Missing transitions, including those on symbols outside the automaton's own alphabet,
     * go to one added sink state.
     */
    public static CompactDFA<Character> toCompactDFA(Automaton automaton, Alphabet<Character> alphabet) {
        final Automaton dfa = automaton.getDFA();
        final CompactDFA<Character> out = new CompactDFA<>(alphabet, dfa.size() + 1);
        for (State s : dfa.getStates()) {
            if (s.getId() == dfa.getStart()) {
                out.addInitialState(s.isAccepting());
            } else {
                out.addState(s.isAccepting());
            }
        }

        int sink = -1;
        final int symbolNum = alphabet.size();
        for (State s : dfa.getStates()) {
            for (int a = 0; a < symbolNum; a++) {
                int target = s.getTarget(Label.symbol(alphabet.getSymbol(a)));
                if (target == Automaton.NONE) {
                    if (sink < 0) {
                        sink = addSink(out, symbolNum);
                    }
                    target = sink;
                }
                out.setTransition(s.getId(), a, target);
            }
        }
        return out;
    }

    /**
     * Import an NFA whose inputs print as single ASCII letters. Several initial states get a fresh
     * start state with epsilon edges to each of them.
     * @throws IllegalArgumentException on any other input symbol
     */
    public static <I> Automaton fromCompactNFA(CompactNFA<I> nfa) {
        final Alphabet<I> alphabet = nfa.getInputAlphabet();
        final Automaton result = new Automaton();
        final List<Character> symbols = new ArrayList<>(alphabet.size());
        for (I input : alphabet) {
            symbols.add(symbolOf(input));
        }
        result.addSymbols(symbols);

        final int states = nfa.size();
        for (int i = 0; i < states; i++) {
            result.addState(nfa.isAccepting(i));
        }
        for (int i = 0; i < states; i++) {
            for (int a = 0; a < alphabet.size(); a++) {
                for (int t : nfa.getTransitions(i, alphabet.getSymbol(a))) {
                    result.addTransition(i, symbols.get(a), t);
                }
            }
        }

        final Set<Integer> initialStates = nfa.getInitialStates();
        if (initialStates.size() == 1) {
            result.setStart(initialStates.iterator().next());
        } else if (initialStates.size() > 1) {
            final int start = result.addInitialState(false);
            for (int init : initialStates) {
                result.addEpsilonTransition(start, init);
            }
        }
        result.resetEnd();
        return result;
    }

    /**
     * Language equivalence over the union of both alphabets.
     */
    public static boolean testEquivalence(Automaton first, Automaton second) {
        final SortedSet<Character> symbols = new TreeSet<>(first.getAlphabet());
        symbols.addAll(second.getAlphabet());
        final Alphabet<Character> alphabet = Alphabets.fromCollection(symbols);
        return Automata.testEquivalence(toCompactDFA(first, alphabet), toCompactDFA(second, alphabet), alphabet);
    }

    private static int addSink(CompactDFA<Character> out, int symbolNum) {
        final int sink = out.addState(false);
        for (int a = 0; a < symbolNum; a++) {
            out.setTransition(sink, a, sink);
        }
        return sink;
    }

    private static Character symbolOf(Object input) {
        final String text = String.valueOf(input);
        if (text.length() != 1 || !Lexer.isSymbol(text.charAt(0))) {
            throw new IllegalArgumentException("Not a single-letter symbol: " + text);
        }
        return text.charAt(0);
    }
}
