package RFA.Model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

/**
 * Ordered collection of disjoint, non-empty classes of state identities.
 */
public final class Partition {
    public static final int NO_CLASS = -1;

    private final List<BitSet> classes;
    private final int[] classOf;

    /**
     * @param classes - disjoint, non-empty classes, in order
     * @param nStates - number of states the identities range over
     */
    public Partition(List<BitSet> classes, int nStates) {
        this.classes = new ArrayList<>(classes);
        this.classOf = new int[nStates];
        Arrays.fill(classOf, NO_CLASS);
        for (int c = 0; c < this.classes.size(); c++) {
            final BitSet block = this.classes.get(c);
            for (int s = block.nextSetBit(0); s >= 0; s = block.nextSetBit(s + 1)) {
                classOf[s] = c;
            }
        }
    }

    public int size() {
        return classes.size();
    }

    public BitSet get(int index) {
        return classes.get(index);
    }

    public List<BitSet> classes() {
        return Collections.unmodifiableList(classes);
    }

    /**
     * @return index of the class containing {@code state}, or NO_CLASS
     */
    public int classOf(int state) {
        return state >= 0 && state < classOf.length ? classOf[state] : NO_CLASS;
    }

    /**
     * Minimum-identity member of a class.
     */
    public int representative(int index) {
        return classes.get(index).nextSetBit(0);
    }

    @Override
    public String toString() {
        return classes.toString();
    }
}
