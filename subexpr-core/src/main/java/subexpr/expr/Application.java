package subexpr.expr;

import com.google.common.base.Preconditions;

import java.util.ArrayDeque;
import java.util.Deque;

public final class Application implements Expr {
    private final String name;
    private final Expr left;
    private final Expr right;
    private final int hash;

    public Application(String name, Expr left, Expr right) {
        this.name = Preconditions.checkNotNull(name, "name");
        this.left = Preconditions.checkNotNull(left, "left");
        this.right = Preconditions.checkNotNull(right, "right");
        // int addition wraps on overflow
        this.hash = name.hashCode() + left.hashCode() + right.hashCode();
    }

    public String name() {
        return name;
    }

    public Expr left() {
        return left;
    }

    public Expr right() {
        return right;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Application)) return false;

        // Pairs of operands left to compare, without recursion since trees may be arbitrarily deep
        Deque<Expr> pending = new ArrayDeque<>();
        pending.push(this);
        pending.push((Application) o);
        while (!pending.isEmpty()) {
            Expr b = pending.pop();
            Expr a = pending.pop();
            if (a == b) {
                continue;
            }
            if (a instanceof Application x) {
                if (!(b instanceof Application y) || !x.name.equals(y.name)) {
                    return false;
                }
                pending.push(x.left);
                pending.push(y.left);
                pending.push(x.right);
                pending.push(y.right);
            } else if (!a.equals(b)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return Render.render(this);
    }
}
