package io.streamshub.tilde.config;

import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import io.streamshub.tilde.format.TildeFormat;

@ApplicationScoped
public class TildeSettings {

    @ConfigProperty(name = "tilde.pretty-print.line-width", defaultValue = "79")
    int lineWidth;

    @ConfigProperty(name = "tilde.arguments.default-syntax", defaultValue = "datum")
    String defaultSyntax;

    public int lineWidth() {
        return lineWidth;
    }

    public ArgumentSyntax defaultSyntax() {
        try {
            return ArgumentSyntax.parse(defaultSyntax);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid tilde.arguments.default-syntax: " + e.getMessage(), e);
        }
    }

    /**
     * A formatter using the configured settings, with an optional line width override.
     */
    public TildeFormat formatter(Integer lineWidthOverride) {
        return TildeFormat.builder()
                .lineWidth(lineWidthOverride != null ? lineWidthOverride : lineWidth)
                .build();
    }
}
