package subexpr.expr;

/**
 * An expression tree node. Exactly three kinds exist:
 * <ul>
 *     <li>{@link Application} - a named node with a left and a right operand</li>
 *     <li>{@link Variable} - a named leaf</li>
 *     <li>{@link Substitution} - a reference to an earlier, identical subtree. Only found in rewritten trees.</li>
 * </ul>
 * <p>
 * {@link #equals(Object)} is structural and deep. {@link #hashCode()} is computed once, when the node is
 * built, from the name and the hashes of the operands. It is only ever used to speed up lookups; two nodes
 * with the same hash are not considered equal unless {@code equals} says so.
 * <p>
 * Nodes are immutable.
 */
public sealed interface Expr permits Application, Variable, Substitution {

    /** Same as {@link Render#render(Expr)}. */
    String toString();
}
