package io.streamshub.tilde.format;

/**
 * Marker interface for tokens in a scanned template.
 * A template consists of literal text and directives.
 */
public sealed interface FormatToken permits LiteralToken, DirectiveToken {
}
