package RFA.Regenerate;

import static RFA.Regenerate.RegexAlgebra.EMPTY_LANGUAGE;
import static RFA.Regenerate.RegexAlgebra.EPSILON;

import java.util.Arrays;
import java.util.Map;

import RFA.Automaton;
import RFA.Label;
import RFA.State;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Automaton to regex by state elimination (Kleene's algorithm).
 * <p>
 * Works on an (n+2)x(n+2) matrix of regex cells: the n original states plus a synthetic start and a
 * synthetic accept node, which are never eliminated.
 */
public class StateElimination {

    /**
     * @param automaton - any automaton, epsilon transitions allowed; not modified
     * @return a regex for the automaton's language, or {@link RegexAlgebra#EMPTY_LANGUAGE}
     */
    public static String toRegex(Automaton automaton) {
        final int n = automaton.size();
        if (n == 0 || automaton.getStart() == Automaton.NONE) {
            return EMPTY_LANGUAGE;
        }
        final String[][] g = initialMatrix(automaton);
        final int newStart = n;
        final int newAccept = n + 1;

        for (int k = 0; k < n; k++) {
            eliminate(g, k);
            if (Automaton.DEBUG) {
                System.out.println("DEBUG: Eliminated state " + k + " of " + n);
            }
        }
        return RegexSimplifier.simplify(g[newStart][newAccept]);
    }

    /**
     * cell[i][j] is the union of the labels on i->j (epsilon as 1), with 1-edges from the synthetic start to
     * the start state and from every accepting state to the synthetic accept.
     */
    static String[][] initialMatrix(Automaton automaton) {
        final int n = automaton.size();
        final int size = n + 2;
        final String[][] g = new String[size][size];
        for (String[] row : g) {
            Arrays.fill(row, EMPTY_LANGUAGE);
        }

        for (State s : automaton.getStates()) {
            final int i = s.getId();
            for (Map.Entry<Label, IntList> e : s.getTransitions().entrySet()) {
                final Label label = e.getKey();
                final String text = label.isEpsilon() ? EPSILON : String.valueOf(label.getSymbol());
                final IntList targets = e.getValue();
                for (int t = 0; t < targets.size(); t++) {
                    final int j = targets.getInt(t);
                    g[i][j] = RegexAlgebra.union(g[i][j], text);
                }
            }
            if (s.isAccepting()) {
                g[i][n + 1] = RegexAlgebra.union(g[i][n + 1], EPSILON);
            }
        }
        final int start = automaton.getStart();
        g[n][start] = RegexAlgebra.union(g[n][start], EPSILON);
        return g;
    }

    /**
     * Route every i->k->j path around k, then drop k's row and column.
     */
    static void eliminate(String[][] g, int k) {
        final int size = g.length;
        final String loop = RegexAlgebra.star(g[k][k]);

        for (int i = 0; i < size; i++) {
            if (i == k || RegexAlgebra.isEmptyLanguage(g[i][k])) {
                continue;
            }
            for (int j = 0; j < size; j++) {
                if (j == k || RegexAlgebra.isEmptyLanguage(g[k][j])) {
                    continue;
                }
                final String via = RegexAlgebra.concat(g[i][k], RegexAlgebra.concat(loop, g[k][j]));
                g[i][j] = RegexAlgebra.union(g[i][j], via);
            }
        }

        for (int i = 0; i < size; i++) {
            g[i][k] = EMPTY_LANGUAGE;
            g[k][i] = EMPTY_LANGUAGE;
        }
    }
}
