package io.streamshub.tilde.value;

/**
 * Turns a value into its textual form. The interpreter uses one instance for
 * human-readable output ({@code ~a}) and another for machine-readable output
 * ({@code ~s}, and the atoms of {@code ~w} and {@code ~y}).
 */
@FunctionalInterface
public interface ValueRenderer {

    String render(Object value);
}
