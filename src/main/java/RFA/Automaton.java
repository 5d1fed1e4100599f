package RFA;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import RFA.Lexer.Token;
import RFA.Regenerate.StateElimination;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Finite automaton over single-character symbols, with epsilon transitions.
 * <p>
 * States live in an arena: a state's identity is its index, assigned in creation order and never reused.
 * Transformations ({@link #toDFA()}, {@link #toMinimal()}, {@link #toComplete()}, {@link #toComplement()})
 * build a new graph and swap it in; the {@code get*} counterparts work on a private copy.
 */
public class Automaton {
    public static boolean DEBUG = false;

    /** Marker for "no state". */
    public static final int NONE = -1;

    private List<State> states;
    private int start;
    private int end;
    private SortedSet<Character> alphabet;

    public Automaton() {
        this.states = new ArrayList<>();
        this.start = NONE;
        this.end = NONE;
        this.alphabet = new TreeSet<>();
    }

    /**
     * Deep copy. Identities are preserved.
     */
    public Automaton(Automaton other) {
        this.states = new ArrayList<>(other.states.size());
        for (State s : other.states) {
            this.states.add(new State(s));
        }
        this.start = other.start;
        this.end = other.end;
        this.alphabet = new TreeSet<>(other.alphabet);
    }

    /**
     * Build from infix regex text, e.g. "(a+b)*c".
     */
    public static Automaton fromRegex(String regex) {
        return AutomatonFactory.fromRegex(regex);
    }

    /**
     * Build from postfix regex text with explicit concatenation, e.g. "ab+c.".
     */
    public static Automaton fromPostfix(String postfix) {
        return AutomatonFactory.fromPostfix(postfix);
    }

    public static Automaton fromPostfix(List<Token> postfix) {
        return AutomatonFactory.fromPostfix(postfix);
    }

    // ---- graph construction

    public int addState(boolean accepting) {
        final int id = states.size();
        states.add(new State(id, accepting));
        return id;
    }

    public int addInitialState(boolean accepting) {
        final int id = addState(accepting);
        start = id;
        return id;
    }

    public void setStart(int id) {
        checkState(id);
        start = id;
    }

    public void setEnd(int id) {
        if (id != NONE) {
            checkState(id);
        }
        end = id;
    }

    public void setAccepting(int id, boolean accepting) {
        getState(id).setAccepting(accepting);
    }

    public void addTransition(int from, Label label, int to) {
        checkState(to);
        getState(from).addTarget(label, to);
        if (!label.isEpsilon()) {
            alphabet.add(label.getSymbol());
        }
    }

    public void addTransition(int from, char symbol, int to) {
        addTransition(from, Label.symbol(symbol), to);
    }

    public void addEpsilonTransition(int from, int to) {
        addTransition(from, Label.EPSILON, to);
    }

    /**
     * Extend the visible alphabet without adding transitions.
     */
    public void addSymbols(Collection<Character> symbols) {
        alphabet.addAll(symbols);
    }

    // ---- read-only accessors

    public int size() {
        return states.size();
    }

    public int getStart() {
        return start;
    }

    /**
     * Informational marker of one accepting state. Acceptance is decided by each state's own flag.
     */
    public int getEnd() {
        return end;
    }

    public State getState(int id) {
        checkState(id);
        return states.get(id);
    }

    public List<State> getStates() {
        return Collections.unmodifiableList(states);
    }

    public boolean isAccepting(int id) {
        return getState(id).isAccepting();
    }

    public Map<Label, IntList> getTransitions(int id) {
        return getState(id).getTransitions();
    }

    /**
     * Visible alphabet in ascending order. Never contains epsilon.
     */
    public SortedSet<Character> getAlphabet() {
        return Collections.unmodifiableSortedSet(alphabet);
    }

    public int countAccepting() {
        int count = 0;
        for (State s : states) {
            if (s.isAccepting()) {
                count++;
            }
        }
        return count;
    }

    /**
     * No epsilon transitions and at most one target per symbol.
     */
    public boolean isDeterministic() {
        for (State s : states) {
            for (Map.Entry<Label, IntList> e : s.getTransitions().entrySet()) {
                if (e.getKey().isEpsilon() || e.getValue().size() > 1) {
                    return false;
                }
            }
        }
        return true;
    }

    // ---- closure queries

    public BitSet epsilonClosure(BitSet stateSet) {
        return new EpsilonClosure(this).closure(stateSet);
    }

    public BitSet findReachableInOneStep(BitSet stateSet, char symbol) {
        return new EpsilonClosure(this).step(stateSet, Label.symbol(symbol));
    }

    public boolean containsAccepting(BitSet stateSet) {
        for (int i = stateSet.nextSetBit(0); i >= 0; i = stateSet.nextSetBit(i + 1)) {
            if (i < states.size() && states.get(i).isAccepting()) {
                return true;
            }
        }
        return false;
    }

    // ---- in-place transformations

    public void toDFA() {
        replaceWith(PowersetDeterminizer.determinize(this));
    }

    public void toMinimal() {
        toDFA();
        if (states.size() <= 1) {
            return;
        }
        replaceWith(MyhillNerodeMinimizer.minimize(this));
    }

    public void toComplete() {
        toDFA();
        replaceWith(DFACompletion.complete(this));
    }

    public void toComplement() {
        toComplete();
        replaceWith(DFACompletion.complement(this));
    }

    public Automaton getDFA() {
        final Automaton result = new Automaton(this);
        result.toDFA();
        return result;
    }

    public Automaton getMinimal() {
        final Automaton result = new Automaton(this);
        result.toMinimal();
        return result;
    }

    public Automaton getComplete() {
        final Automaton result = new Automaton(this);
        result.toComplete();
        return result;
    }

    public Automaton getComplement() {
        final Automaton result = new Automaton(this);
        result.toComplement();
        return result;
    }

    // ---- queries

    /**
     * Longest prefix of {@code text} in the language.
     * @return prefix length, 0 if only the empty prefix is accepted, -1 if no prefix is accepted
     */
    public int containsPrefix(String text) {
        final EpsilonClosure closure = new EpsilonClosure(this);
        BitSet current = initialSet(closure);
        int longest = containsAccepting(current) ? 0 : -1;

        for (int i = 0; i < text.length() && !current.isEmpty(); i++) {
            final BitSet next = closure.closure(closure.step(current, Label.symbol(text.charAt(i))));
            if (next.isEmpty()) {
                break;
            }
            current = next;
            if (containsAccepting(current)) {
                longest = i + 1;
            }
        }
        return longest;
    }

    /**
     * Whole-word membership.
     */
    public boolean accepts(String word) {
        final EpsilonClosure closure = new EpsilonClosure(this);
        BitSet current = initialSet(closure);
        for (int i = 0; i < word.length() && !current.isEmpty(); i++) {
            current = closure.closure(closure.step(current, Label.symbol(word.charAt(i))));
        }
        return containsAccepting(current);
    }

    public String toRegex() {
        return StateElimination.toRegex(this);
    }

    /**
     * Language equivalence over the union of both alphabets.
     */
    public boolean isEquivalent(Automaton other) {
        return CompactConversions.testEquivalence(this, other);
    }

    // ---- internals

    private BitSet initialSet(EpsilonClosure closure) {
        final BitSet init = new BitSet();
        if (start != NONE) {
            init.set(start);
        }
        return closure.closure(init);
    }

    /**
     * Point the end marker at the lowest accepting state, else the start state.
     */
    void resetEnd() {
        end = start;
        for (State s : states) {
            if (s.isAccepting()) {
                end = s.getId();
                break;
            }
        }
    }

    /**
     * Swap in a freshly built graph. A no-op if handed this automaton.
     */
    private void replaceWith(Automaton other) {
        if (other == this) {
            return;
        }
        this.states = other.states;
        this.start = other.start;
        this.end = other.end;
        this.alphabet = other.alphabet;
    }

    private void checkState(int id) {
        if (id < 0 || id >= states.size()) {
            throw new IllegalArgumentException("No such state: " + id);
        }
    }

    @Override
    public String toString() {
        return "Automaton[states=" + states.size() + ", start=" + start + ", accepting=" + countAccepting()
            + ", alphabet=" + alphabet + "]";
    }
}
