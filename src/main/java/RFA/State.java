package RFA;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/**
 * A state owned by exactly one {@link Automaton}. Its identity is its index in the owner.
 * Targets per label are kept in insertion order without duplicates.
 */
public final class State {
    private final int id;
    private boolean accepting;
    private final TreeMap<Label, IntArrayList> transitions = new TreeMap<>();
    // unmodifiable wrappers over the same target lists, kept in step with transitions
    private final TreeMap<Label, IntList> readOnly = new TreeMap<>();
    private final Map<Label, IntList> view = Collections.unmodifiableMap(readOnly);

    State(int id, boolean accepting) {
        this.id = id;
        this.accepting = accepting;
    }

    State(State other) {
        this(other.id, other.accepting);
        for (Map.Entry<Label, IntArrayList> e : other.transitions.entrySet()) {
            targetsFor(e.getKey()).addAll(e.getValue());
        }
    }

    public int getId() {
        return id;
    }

    public boolean isAccepting() {
        return accepting;
    }

    void setAccepting(boolean accepting) {
        this.accepting = accepting;
    }

    /**
     * Read-only live view of the outgoing transitions, ordered by label.
     */
    public Map<Label, IntList> getTransitions() {
        return view;
    }

    /**
     * Targets under a label, in insertion order; empty if there are none.
     */
    public IntList getTargets(Label label) {
        final IntList targets = readOnly.get(label);
        return targets == null ? IntLists.EMPTY_LIST : targets;
    }

    /**
     * First target under a label, or {@link Automaton#NONE}. On a deterministic automaton this is the only one.
     */
    public int getTarget(Label label) {
        final IntArrayList targets = transitions.get(label);
        return targets == null || targets.isEmpty() ? Automaton.NONE : targets.getInt(0);
    }

    boolean hasTransition(Label label) {
        final IntArrayList targets = transitions.get(label);
        return targets != null && !targets.isEmpty();
    }

    void addTarget(Label label, int target) {
        final IntArrayList targets = targetsFor(label);
        if (!targets.contains(target)) {
            targets.add(target);
        }
    }

    private IntArrayList targetsFor(Label label) {
        IntArrayList targets = transitions.get(label);
        if (targets == null) {
            targets = new IntArrayList(1);
            transitions.put(label, targets);
            readOnly.put(label, IntLists.unmodifiable(targets));
        }
        return targets;
    }

    @Override
    public String toString() {
        return id + (accepting ? " (f)" : "") + ": " + transitions;
    }
}
