package RFA.Regenerate;

import static RFA.Regenerate.RegexAlgebra.EMPTY_LANGUAGE;
import static RFA.Regenerate.RegexAlgebra.EPSILON;

/**
 * Textual clean-up of regenerated regexes. Every rewrite preserves the language.
 */
public final class RegexSimplifier {
    static final int MAX_PASSES = 6;

    private static final String[] EPSILON_STARS = {
        "(" + EMPTY_LANGUAGE + ")*", "(" + EPSILON + ")*", EMPTY_LANGUAGE + "*", EPSILON + "*"
    };

    private RegexSimplifier() {
    }

    /**
     * Repeat until a pass changes nothing, at most MAX_PASSES times: drop one pair of redundant outer
     * parentheses, turn starred 0/1 into 1, and drop 1s that sit next to a concatenation.
     */
    public static String simplify(String regex) {
        String cur = regex;
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            final String prev = cur;
            cur = stripOuterParensOnce(cur);
            cur = collapseEpsilonStars(cur);
            cur = elideEpsilonConcats(cur);
            if (cur.equals(prev)) {
                break;
            }
        }
        return cur;
    }

    public static String stripOuterParensOnce(String s) {
        return RegexAlgebra.isFullyParenthesized(s) ? s.substring(1, s.length() - 1) : s;
    }

    static String collapseEpsilonStars(String s) {
        final StringBuilder out = new StringBuilder(s.length());
        int i = 0;
        outer:
        while (i < s.length()) {
            for (String pattern : EPSILON_STARS) {
                if (s.startsWith(pattern, i)) {
                    out.append(EPSILON);
                    i += pattern.length();
                    continue outer;
                }
            }
            out.append(s.charAt(i++));
        }
        return out.toString();
    }

    /**
     * "1x", "1(" and "x1", ")1" lose the 1, where x is a symbol. A 1 next to an operator or inside
     * an alternation such as "(1+a)" is kept.
     */
    static String elideEpsilonConcats(String s) {
        final StringBuilder out = new StringBuilder(s.length());
        int i = 0;
        while (i < s.length()) {
            final char c = s.charAt(i);
            final boolean hasNext = i + 1 < s.length();
            if (c == '1' && hasNext && startsTerm(s.charAt(i + 1))) {
                i++;
                continue;
            }
            if (hasNext && s.charAt(i + 1) == '1' && endsTerm(c)) {
                out.append(c);
                i += 2;
                continue;
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    private static boolean startsTerm(char c) {
        return Character.isLetter(c) || c == '(';
    }

    private static boolean endsTerm(char c) {
        return Character.isLetter(c) || c == ')';
    }
}
