package RFA;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.TreeMap;

import RFA.Model.Partition;
import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Partition-refinement (Moore / Myhill-Nerode) minimization of a deterministic automaton.
 * <p>
 * Only the first target per symbol is inspected, so the input must already be deterministic; callers
 * determinize first. Missing transitions get their own signature entry and are not treated as a sink.
 * <p>
 * Tie-breaks, which only fix the numbering of the result: initial classes are accepting-first, split classes
 * are ordered by signature, and each class reads its outgoing transitions from its minimum-identity member.
 */
public class MyhillNerodeMinimizer {

    public static Automaton minimize(Automaton dfa) {
        final List<Label> symbols = symbols(dfa);
        Partition partition = initialPartition(dfa);

        int pass = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            final List<BitSet> refined = new ArrayList<>(partition.size());

            for (BitSet block : partition.classes()) {
                if (block.cardinality() <= 1) {
                    refined.add(block);
                    continue;
                }
                final TreeMap<IntArrayList, BitSet> groups = new TreeMap<>();
                for (int s = block.nextSetBit(0); s >= 0; s = block.nextSetBit(s + 1)) {
                    groups.computeIfAbsent(signature(dfa, s, symbols, partition), k -> new BitSet()).set(s);
                }
                refined.addAll(groups.values());
                if (groups.size() > 1) {
                    changed = true;
                }
            }

            if (refined.size() != partition.size()) {
                changed = true;
            }
            partition = new Partition(refined, dfa.size());
            pass++;
        }

        if (Automaton.DEBUG) {
            System.out.println("DEBUG: Minimized " + dfa.size() + " states into " + partition.size()
                + " classes after " + pass + " refinement passes");
        }
        return quotient(dfa, partition, symbols);
    }

    /**
     * Accepting states, then non-accepting states; an empty side is omitted.
     */
    static Partition initialPartition(Automaton dfa) {
        final BitSet accepting = new BitSet();
        final BitSet rejecting = new BitSet();
        for (State s : dfa.getStates()) {
            (s.isAccepting() ? accepting : rejecting).set(s.getId());
        }
        final List<BitSet> classes = new ArrayList<>(2);
        if (!accepting.isEmpty()) {
            classes.add(accepting);
        }
        if (!rejecting.isEmpty()) {
            classes.add(rejecting);
        }
        return new Partition(classes, dfa.size());
    }

    /**
     * Per symbol, in alphabet order: class index of the successor, or NO_CLASS without a transition.
     */
    static IntArrayList signature(Automaton dfa, int state, List<Label> symbols, Partition partition) {
        final IntArrayList signature = new IntArrayList(symbols.size());
        final State s = dfa.getState(state);
        for (Label symbol : symbols) {
            final int target = s.getTarget(symbol);
            signature.add(target == Automaton.NONE ? Partition.NO_CLASS : partition.classOf(target));
        }
        return signature;
    }

    private static Automaton quotient(Automaton dfa, Partition partition, List<Label> symbols) {
        final Automaton result = new Automaton();
        result.addSymbols(dfa.getAlphabet());

        // state i of the result is class i
        for (int c = 0; c < partition.size(); c++) {
            final BitSet block = partition.get(c);
            boolean accepting = false;
            for (int s = block.nextSetBit(0); s >= 0; s = block.nextSetBit(s + 1)) {
                accepting |= dfa.isAccepting(s);
            }
            result.addState(accepting);
            if (block.get(dfa.getStart())) {
                result.setStart(c);
            }
        }

        for (int c = 0; c < partition.size(); c++) {
            final State rep = dfa.getState(partition.representative(c));
            for (Label symbol : symbols) {
                final int target = rep.getTarget(symbol);
                if (target != Automaton.NONE) {
                    result.addTransition(c, symbol, partition.classOf(target));
                }
            }
        }
        result.resetEnd();
        return result;
    }

    private static List<Label> symbols(Automaton dfa) {
        final List<Label> symbols = new ArrayList<>(dfa.getAlphabet().size());
        for (char c : dfa.getAlphabet()) {
            symbols.add(Label.symbol(c));
        }
        return symbols;
    }
}
