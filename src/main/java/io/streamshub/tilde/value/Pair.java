package io.streamshub.tilde.value;

/**
 * A mutable cons cell. Chains of pairs form lists; because both fields can be
 * reassigned after construction, a chain may be improper or cyclic.
 */
public final class Pair {

    private Object car;
    private Object cdr;

    public Pair(Object car, Object cdr) {
        this.car = car;
        this.cdr = cdr;
    }

    public Object car() {
        return car;
    }

    public Object cdr() {
        return cdr;
    }

    public void setCar(Object car) {
        this.car = car;
    }

    public void setCdr(Object cdr) {
        this.cdr = cdr;
    }

    /**
     * Identity-based; two structurally equal lists are still distinct nodes.
     */
    @Override
    public boolean equals(Object o) {
        return this == o;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }

    @Override
    public String toString() {
        return "Pair@" + Integer.toHexString(hashCode());
    }
}
