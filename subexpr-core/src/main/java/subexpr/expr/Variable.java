package subexpr.expr;

import com.google.common.base.Preconditions;

/**
 * A named leaf. The name may be empty; the parser produces an empty name rather than failing when no
 * letters are found where a name is expected.
 */
public final class Variable implements Expr {
    private final String name;
    private final int hash;

    public Variable(String name) {
        this.name = Preconditions.checkNotNull(name, "name");
        this.hash = name.hashCode();
    }

    public String name() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Variable other)) return false;
        return name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return name;
    }
}
