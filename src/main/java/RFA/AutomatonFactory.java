package RFA;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import RFA.Lexer.InfixToPostfixConverter;
import RFA.Lexer.Lexer;
import RFA.Lexer.RegexSyntaxException;
import RFA.Lexer.Token;

/**
 * Thompson construction.
 * <p>
 * Every automaton returned here is a fragment: one start state ({@link Automaton#getStart()}) and exactly one
 * accepting state ({@link Automaton#getEnd()}). The combinators copy their operands into a fresh automaton
 * and leave the operands untouched; the operands' accepting states are unmarked in the copy.
 */
public class AutomatonFactory {

    public static Automaton fromRegex(String regex) {
        final List<Token> tokens = Lexer.addConcatenationOperators(Lexer.tokenize(regex));
        return fromPostfix(InfixToPostfixConverter.convert(tokens));
    }

    public static Automaton fromPostfix(String postfix) {
        return fromPostfix(Lexer.tokenize(postfix));
    }

    /**
     * Evaluate postfix tokens with a stack of fragments.
     * @throws RegexSyntaxException (STRUCTURAL) on missing operands, leftover operands or parentheses
     */
    public static Automaton fromPostfix(List<Token> postfix) {
        final Deque<Automaton> stack = new ArrayDeque<>();

        for (int i = 0; i < postfix.size(); i++) {
            final Token token = postfix.get(i);
            switch (token.type()) {
                case SYMBOL -> stack.push(symbol(token.symbol()));
                case EPSILON -> stack.push(epsilon());
                case CONCAT -> {
                    requireOperands(stack, 2, "concatenation", postfix, i);
                    final Automaton right = stack.pop();
                    final Automaton left = stack.pop();
                    stack.push(concat(left, right));
                }
                case UNION -> {
                    requireOperands(stack, 2, "union", postfix, i);
                    final Automaton right = stack.pop();
                    final Automaton left = stack.pop();
                    stack.push(union(left, right));
                }
                case KLEENE_STAR -> {
                    requireOperands(stack, 1, "Kleene star", postfix, i);
                    stack.push(kleeneStar(stack.pop()));
                }
                case LPAREN, RPAREN -> throw structural(
                    "Unexpected token in postfix expression: " + token, postfix, i);
            }
        }

        if (stack.size() != 1) {
            throw structural("Invalid regex expression: stack has " + stack.size() + " elements",
                postfix, postfix.size());
        }
        return stack.pop();
    }

    public static Automaton symbol(char symbol) {
        return primitive(Label.symbol(symbol));
    }

    public static Automaton epsilon() {
        return primitive(Label.EPSILON);
    }

    /**
     * L·R: L's accepting state gets an epsilon edge to R's start.
     */
    public static Automaton concat(Automaton left, Automaton right) {
        final Automaton result = new Automaton();
        final int l = copyStates(left, result);
        final int r = copyStates(right, result);

        result.setStart(left.getStart() + l);
        result.setEnd(right.getEnd() + r);
        result.addEpsilonTransition(left.getEnd() + l, right.getStart() + r);
        result.setAccepting(left.getEnd() + l, false);
        return result;
    }

    /**
     * L+R: a new start branches to both operands, both operands join in a new accepting state.
     */
    public static Automaton union(Automaton left, Automaton right) {
        final Automaton result = new Automaton();
        final int newStart = result.addInitialState(false);
        final int newEnd = result.addState(true);
        final int l = copyStates(left, result);
        final int r = copyStates(right, result);

        result.setEnd(newEnd);
        result.addEpsilonTransition(newStart, left.getStart() + l);
        result.addEpsilonTransition(newStart, right.getStart() + r);
        result.addEpsilonTransition(left.getEnd() + l, newEnd);
        result.addEpsilonTransition(right.getEnd() + r, newEnd);
        result.setAccepting(left.getEnd() + l, false);
        result.setAccepting(right.getEnd() + r, false);
        return result;
    }

    /**
     * X*: skip edge from the new start to the new end, loop edge from X's end back to X's start.
     */
    public static Automaton kleeneStar(Automaton inner) {
        final Automaton result = new Automaton();
        final int newStart = result.addInitialState(false);
        final int newEnd = result.addState(true);
        final int x = copyStates(inner, result);

        result.setEnd(newEnd);
        result.addEpsilonTransition(newStart, inner.getStart() + x);
        result.addEpsilonTransition(newStart, newEnd);
        result.addEpsilonTransition(inner.getEnd() + x, inner.getStart() + x);
        result.addEpsilonTransition(inner.getEnd() + x, newEnd);
        result.setAccepting(inner.getEnd() + x, false);
        return result;
    }

    private static Automaton primitive(Label label) {
        final Automaton result = new Automaton();
        final int start = result.addInitialState(false);
        final int end = result.addState(true);
        result.setEnd(end);
        result.addTransition(start, label, end);
        return result;
    }

    /**
     * Append copies of all of {@code from}'s states and transitions to {@code into}.
     * @return the identity offset: state {@code s} of {@code from} is state {@code s + offset} of {@code into}
     */
    static int copyStates(Automaton from, Automaton into) {
        final int offset = into.size();
        for (State s : from.getStates()) {
            into.addState(s.isAccepting());
        }
        for (State s : from.getStates()) {
            s.getTransitions().forEach((label, targets) -> {
                for (int k = 0; k < targets.size(); k++) {
                    into.addTransition(s.getId() + offset, label, targets.getInt(k) + offset);
                }
            });
        }
        into.addSymbols(from.getAlphabet());
        return offset;
    }

    private static void requireOperands(Deque<Automaton> stack, int needed, String operator,
                                        List<Token> postfix, int index) {
        if (stack.size() < needed) {
            throw structural("Insufficient operands for " + operator, postfix, index);
        }
    }

    private static RegexSyntaxException structural(String desc, List<Token> postfix, int index) {
        return new RegexSyntaxException(RegexSyntaxException.Kind.STRUCTURAL, desc, Token.toString(postfix), index);
    }
}
