package subexpr.parse;

import com.google.common.base.Preconditions;
import subexpr.exception.InvalidExpressionException;
import subexpr.expr.Application;
import subexpr.expr.Expr;
import subexpr.expr.Variable;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Top-down parser, one character of lookahead, no backtracking.
 * <p>
 * <pre>
 * EXPR: NAME [ "(" EXPR "," EXPR ")" ]
 * NAME: LETTER*
 * </pre>
 * The separator and the closing parenthesis are consumed without being checked, as long as there is a
 * character there to consume. Running out of input at any of those points is an error. A name may come out
 * empty (no letters where one was expected); that is not an error. Anything following a complete expression
 * is ignored.
 */
public class Parse {
    private static class Input {
        private final String line;
        private int offset = 0;

        Input(String line) {
            this.line = line;
        }

        boolean atEnd() {
            return offset >= line.length();
        }

        char peek() {
            return line.charAt(offset);
        }

        /** Consume one character of whatever kind, failing only if there is none. */
        char consume(String expected) throws InvalidExpressionException {
            if (atEnd()) {
                throw new InvalidExpressionException("Parse error: Expected " + expected
                        + " but reached end of input at character index: " + offset, offset);
            }
            return line.charAt(offset++);
        }
    }

    public static Expr parseExpression(String line) throws InvalidExpressionException {
        Preconditions.checkNotNull(line, "line");
        return parseExpression(new Input(line));
    }

    /**
     * Number of characters a complete parse of {@code line} consumes. Anything beyond that is ignored by
     * {@link #parseExpression(String)}.
     */
    public static int consumedLength(String line) throws InvalidExpressionException {
        Preconditions.checkNotNull(line, "line");
        Input input = new Input(line);
        parseExpression(input);
        return input.offset;
    }

    // An application whose left operand is still being parsed (left == null) or whose right one is
    private static class Pending {
        final String name;
        Expr left;

        Pending(String name) {
            this.name = name;
        }
    }

    // Nesting depth is only bounded by the line length, so the grammar is driven by an explicit stack
    private static Expr parseExpression(Input input) throws InvalidExpressionException {
        Deque<Pending> stack = new ArrayDeque<>();
        while (true) {
            String name = parseName(input);
            if (!input.atEnd() && input.peek() == '(') {
                input.consume("'('");
                stack.push(new Pending(name));
                continue;
            }

            Expr done = new Variable(name);
            while (true) {
                Pending top = stack.peek();
                if (top == null) {
                    return done;
                }
                if (top.left == null) {
                    top.left = done;
                    input.consume("','");
                    break;
                }
                stack.pop();
                input.consume("')'");
                done = new Application(top.name, top.left, done);
            }
        }
    }

    private static String parseName(Input input) {
        int start = input.offset;
        while (!input.atEnd() && Letters.isLetter(input.peek())) {
            input.offset++;
        }
        return input.line.substring(start, input.offset);
    }
}
