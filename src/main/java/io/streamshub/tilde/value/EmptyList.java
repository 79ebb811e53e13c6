package io.streamshub.tilde.value;

/**
 * The empty list, terminating every proper {@link Pair} chain.
 */
public enum EmptyList {
    INSTANCE;

    @Override
    public String toString() {
        return "()";
    }
}
