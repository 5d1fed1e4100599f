package RFA.Regenerate;

/**
 * Regex-building helpers that apply the Kleene algebra identities for the empty language ({@code 0})
 * and the empty string ({@code 1}) instead of concatenating text blindly.
 * Top-level unions are always parenthesized, so every operand is a single term.
 */
public final class RegexAlgebra {
    /** The empty language. Output only; the lexer does not accept it. */
    public static final String EMPTY_LANGUAGE = "0";
    /** The empty string. */
    public static final String EPSILON = "1";

    private RegexAlgebra() {
    }

    public static boolean isEmptyLanguage(String r) {
        return EMPTY_LANGUAGE.equals(r);
    }

    public static boolean isEpsilon(String r) {
        return EPSILON.equals(r);
    }

    /**
     * a+b. Idempotent; the empty language is the identity.
     */
    public static String union(String a, String b) {
        if (a.equals(b)) {
            return a;
        }
        if (isEmptyLanguage(a)) {
            return b;
        }
        if (isEmptyLanguage(b)) {
            return a;
        }
        return "(" + a + "+" + b + ")";
    }

    /**
     * ab. The empty language absorbs; the empty string is the identity.
     */
    public static String concat(String a, String b) {
        if (isEmptyLanguage(a) || isEmptyLanguage(b)) {
            return EMPTY_LANGUAGE;
        }
        if (isEpsilon(a)) {
            return b;
        }
        if (isEpsilon(b)) {
            return a;
        }
        return wrapIfNeeded(a) + wrapIfNeeded(b);
    }

    /**
     * r*. 0* and 1* are 1; an expression that is already a star is returned as is.
     */
    public static String star(String r) {
        if (isEmptyLanguage(r) || isEpsilon(r)) {
            return EPSILON;
        }
        if (isStar(r)) {
            return r;
        }
        if (isAtom(r)) {
            return r + "*";
        }
        return wrapIfNeeded(r) + "*";
    }

    /**
     * Parenthesize unless {@code r} is a single symbol or literal, or is already one parenthesized group.
     */
    public static String wrapIfNeeded(String r) {
        if (r.isEmpty()) {
            return EPSILON;
        }
        if (isAtom(r) || isFullyParenthesized(r)) {
            return r;
        }
        return "(" + r + ")";
    }

    /**
     * Whether the outermost parentheses enclose the whole of {@code s}, e.g. "(a+b)" but not "(a)(b)".
     */
    public static boolean isFullyParenthesized(String s) {
        if (s.length() < 2 || s.charAt(0) != '(' || s.charAt(s.length() - 1) != ')') {
            return false;
        }
        int balance = 0;
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            if (c == '(') {
                balance++;
            } else if (c == ')') {
                balance--;
            }
            if (balance == 0 && i + 1 < s.length()) {
                return false;
            }
        }
        return true;
    }

    static boolean isAtom(String r) {
        return r.length() == 1 && Character.isLetterOrDigit(r.charAt(0));
    }

    // "x*" or "(...)*", not "ab*"
    static boolean isStar(String r) {
        if (r.length() < 2 || r.charAt(r.length() - 1) != '*') {
            return false;
        }
        final String body = r.substring(0, r.length() - 1);
        return isAtom(body) || isFullyParenthesized(body);
    }
}
