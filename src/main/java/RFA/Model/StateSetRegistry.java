package RFA.Model;

import java.util.BitSet;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Maps sets of original states to the DFA state allocated for them.
 * Keys are compared by content, so keys must not be mutated after {@link #put}.
 */
public class StateSetRegistry {
    public static final int MISSING_ELEMENT = -1;

    private final Object2IntMap<BitSet> set2State;

    public StateSetRegistry() {
        this.set2State = new Object2IntOpenHashMap<>();
        this.set2State.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
    }

    /**
     * @return the DFA state for the set, or MISSING_ELEMENT
     */
    public int get(BitSet stateSet) {
        return set2State.getInt(stateSet);
    }

    public void put(BitSet stateSet, int dfaState) {
        set2State.put(stateSet, dfaState);
    }

    public int size() {
        return set2State.size();
    }
}
