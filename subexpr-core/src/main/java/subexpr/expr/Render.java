package subexpr.expr;

import subexpr.exception.SubexprRuntimeException;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Renders an expression tree back to text. For trees without substitutions this is the inverse of
 * {@link subexpr.parse.Parse#parseExpression(String)}:
 * <pre>
 *     f(a,g(b,c))
 * </pre>
 * A {@link Substitution} is rendered as its id.
 */
public class Render {
    public static String render(Expr expr) {
        StringBuilder sb = new StringBuilder();
        // Holds nodes still to render and the punctuation between them, front is next
        Deque<Object> pending = new ArrayDeque<>();
        pending.push(expr);
        while (!pending.isEmpty()) {
            Object item = pending.pop();
            if (item instanceof Character c) {
                sb.append(c.charValue());
            } else if (item instanceof Application app) {
                sb.append(app.name()).append('(');
                pending.push(')');
                pending.push(app.right());
                pending.push(',');
                pending.push(app.left());
            } else if (item instanceof Variable variable) {
                sb.append(variable.name());
            } else if (item instanceof Substitution sub) {
                sb.append(sub.id());
            } else {
                throw new SubexprRuntimeException("Unknown expression: " + item.getClass()); // Should not be reachable. This is a bug.
            }
        }
        return sb.toString();
    }
}
