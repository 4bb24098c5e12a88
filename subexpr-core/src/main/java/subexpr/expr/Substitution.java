package subexpr.expr;

import com.google.common.base.Preconditions;

/**
 * Stands in for a subtree identical to one visited earlier, referring to it by its replacement id.
 */
public final class Substitution implements Expr {
    private final int id;

    public Substitution(int id) {
        Preconditions.checkArgument(id > 0, "Replacement ids are positive, got %s", id);
        this.id = id;
    }

    public int id() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Substitution other)) return false;
        return id == other.id;
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return Integer.toString(id);
    }
}
