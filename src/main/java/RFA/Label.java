package RFA;

/**
 * Transition label: either epsilon or a visible alphabet symbol.
 * Epsilon sorts before every symbol, symbols sort by character.
 */
public final class Label implements Comparable<Label> {
    public static final Label EPSILON = new Label(true, '\0');

    private static final Label[] ASCII = new Label[128];

    private final boolean epsilon;
    private final char symbol;

    private Label(boolean epsilon, char symbol) {
        this.epsilon = epsilon;
        this.symbol = symbol;
    }

    public static Label symbol(char symbol) {
        if (symbol < ASCII.length) {
            Label label = ASCII[symbol];
            if (label == null) {
                label = ASCII[symbol] = new Label(false, symbol);
            }
            return label;
        }
        return new Label(false, symbol);
    }

    public boolean isEpsilon() {
        return epsilon;
    }

    public char getSymbol() {
        if (epsilon) {
            throw new IllegalStateException("Epsilon has no symbol");
        }
        return symbol;
    }

    @Override
    public int compareTo(Label o) {
        if (epsilon || o.epsilon) {
            return Boolean.compare(o.epsilon, epsilon);
        }
        return Character.compare(symbol, o.symbol);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Label)) {
            return false;
        }
        final Label other = (Label) o;
        return epsilon == other.epsilon && symbol == other.symbol;
    }

    @Override
    public int hashCode() {
        return epsilon ? -1 : symbol;
    }

    @Override
    public String toString() {
        return epsilon ? "eps" : "'" + symbol + "'";
    }
}
