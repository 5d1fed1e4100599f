package RFA.Model;

import java.util.BitSet;

/**
 * A subset-construction work item: a set of original states and the DFA state allocated for it.
 */
public record DeterminizeRecord(BitSet stateSet, int dfaState) {

  @Override
  public String toString() {
    return dfaState + ": " + stateSet;
  }
}
