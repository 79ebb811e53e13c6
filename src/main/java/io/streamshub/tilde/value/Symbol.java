package io.streamshub.tilde.value;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * An interned symbol. Two symbols with the same name are the same instance.
 */
public final class Symbol {

    private static final ConcurrentMap<String, Symbol> TABLE = new ConcurrentHashMap<>();

    private final String name;

    private Symbol(String name) {
        this.name = name;
    }

    public static Symbol of(String name) {
        Objects.requireNonNull(name, "Symbol name cannot be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Symbol name cannot be empty");
        }
        return TABLE.computeIfAbsent(name, Symbol::new);
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
