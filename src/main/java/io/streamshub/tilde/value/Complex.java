package io.streamshub.tilde.value;

/**
 * An inexact complex number in rectangular form.
 */
public record Complex(double real, double imag) {

    public boolean isReal() {
        return imag == 0.0;
    }
}
