package io.streamshub.tilde.format;

/**
 * The text emitted by {@code ~h}, generated from {@link DirectiveType}.
 */
final class HelpText {

    private static final String USAGE =
            "(format [destination] template [arg...]) -- destination is #t, #f or a stream\n";

    private static final String TEXT = build();

    private HelpText() {
        // Static utility class
    }

    static String text() {
        return TEXT;
    }

    private static String build() {
        StringBuilder text = new StringBuilder(USAGE);
        appendRow(text, "OPTION", "[MNEMONIC]", "DESCRIPTION");

        for (DirectiveType type : DirectiveType.values()) {
            appendRow(text, type.synopsis(), "[" + type.mnemonic() + "]", type.description());
        }

        return text.toString();
    }

    private static void appendRow(StringBuilder text, String option, String mnemonic, String description) {
        text.append(option).append(" ".repeat(Math.max(1, 8 - option.length())))
                .append(mnemonic).append(" ".repeat(Math.max(1, 17 - mnemonic.length())))
                .append(description)
                .append('\n');
    }
}
