package RFA.Lexer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Shunting-yard conversion of infix tokens to postfix order.
 * All binary operators are left-associative; parentheses are never emitted.
 */
public class InfixToPostfixConverter {

    public static List<Token> convert(List<Token> tokens) {
        final List<Token> postfix = new ArrayList<>(tokens.size());
        final Deque<Token> stack = new ArrayDeque<>();

        for (int i = 0; i < tokens.size(); i++) {
            final Token token = tokens.get(i);
            switch (token.type()) {
                case SYMBOL, EPSILON -> postfix.add(token);
                case LPAREN -> stack.push(token);
                case RPAREN -> {
                    while (!stack.isEmpty() && stack.peek().type() != TokenType.LPAREN) {
                        postfix.add(stack.pop());
                    }
                    if (stack.isEmpty()) {
                        throw mismatched(tokens, i);
                    }
                    stack.pop(); // matching '('
                }
                case CONCAT, UNION, KLEENE_STAR -> {
                    // ties pop the stacked operator first
                    while (!stack.isEmpty() && precedence(stack.peek().type()) >= precedence(token.type())) {
                        postfix.add(stack.pop());
                    }
                    stack.push(token);
                }
            }
        }

        while (!stack.isEmpty()) {
            final Token top = stack.pop();
            if (top.type() == TokenType.LPAREN) {
                throw mismatched(tokens, tokens.size());
            }
            postfix.add(top);
        }
        return postfix;
    }

    static int precedence(TokenType type) {
        return switch (type) {
            case UNION -> 1;
            case CONCAT -> 2;
            case KLEENE_STAR -> 3;
            case SYMBOL, EPSILON, LPAREN, RPAREN -> 0;
        };
    }

    private static RegexSyntaxException mismatched(List<Token> tokens, int index) {
        return new RegexSyntaxException(
            RegexSyntaxException.Kind.SYNTAX, "Mismatched parentheses", Token.toString(tokens), index);
    }
}
