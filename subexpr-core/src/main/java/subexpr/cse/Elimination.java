package subexpr.cse;

import com.google.common.base.Preconditions;
import subexpr.exception.SubexprRuntimeException;
import subexpr.expr.Application;
import subexpr.expr.Expr;
import subexpr.expr.Substitution;
import subexpr.expr.Variable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Common subexpression elimination.
 * <p>
 * The tree is walked in pre-order (a node before its operands, left before right). The first time a
 * subtree shape is seen it is given the next replacement id, starting at 1, and kept. Every later subtree
 * equal to it is replaced, as a whole, by a {@link Substitution} carrying that id. Nothing inside a
 * replaced subtree is visited, so repeats never use up ids.
 * <p>
 * For example {@code f(f(a,b),f(a,b))} becomes {@code f(f(a,b),2)}: the root is 1, the left {@code f(a,b)}
 * is 2, {@code a} is 3 and {@code b} is 4.
 */
public class Elimination {

    /**
     * Ids handed out so far, keyed by the subtree as parsed (not as rewritten). One instance per
     * expression; not thread safe.
     */
    public static class State {
        private final Map<Expr, Integer> ids = new HashMap<>();
        private int nextId = 1;

        public int nextId() {
            return nextId;
        }

        public int size() {
            return ids.size();
        }

        /** The id assigned to a subtree equal to {@code expr}, or null if none has been seen. */
        public Integer idOf(Expr expr) {
            return ids.get(expr);
        }

        private int assign(Expr expr) {
            int id = nextId++;
            ids.put(expr, id);
            return id;
        }
    }

    public static Expr eliminate(Expr tree) {
        return eliminate(tree, new State());
    }

    /**
     * Rewrite {@code tree} against an existing {@code state}. Subtrees already registered in the state are
     * replaced even on their first occurrence in {@code tree}.
     */
    public static Expr eliminate(Expr tree, State state) {
        Preconditions.checkNotNull(tree, "tree");
        Preconditions.checkNotNull(state, "state");
        return rewrite(tree, state);
    }

    // A kept application whose left operand is being rewritten (left == null) or whose right one is
    private static class Pending {
        final Application original;
        Expr left;

        Pending(Application original) {
            this.original = original;
        }
    }

    private static Expr rewrite(Expr tree, State state) {
        Deque<Pending> stack = new ArrayDeque<>();
        Expr expr = tree;
        while (true) {
            Expr done;
            if (expr instanceof Substitution) {
                throw new SubexprRuntimeException("Substitution in input to elimination: " + expr); // Should not be reachable. This is a bug.
            }

            Integer seen = state.idOf(expr);
            if (seen != null) {
                done = new Substitution(seen);
            } else {
                state.assign(expr);
                if (expr instanceof Application app) {
                    stack.push(new Pending(app));
                    expr = app.left();
                    continue;
                } else if (expr instanceof Variable variable) {
                    done = new Variable(variable.name());
                } else {
                    throw new SubexprRuntimeException("Unknown expression: " + expr.getClass()); // Should not be reachable. This is a bug.
                }
            }

            while (true) {
                Pending top = stack.peek();
                if (top == null) {
                    return done;
                }
                if (top.left == null) {
                    top.left = done;
                    expr = top.original.right();
                    break;
                }
                stack.pop();
                done = new Application(top.original.name(), top.left, done);
            }
        }
    }
}
