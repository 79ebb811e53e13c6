package io.streamshub.tilde.format;

import java.util.List;

/**
 * Forward-only cursor over the arguments of one template. Every argument must
 * be consumed exactly once: too few raise an underflow when a directive asks
 * for more, too many raise an overflow from {@link #finish()}.
 */
final class ArgumentCursor {

    private final List<Object> arguments;
    private int index;

    ArgumentCursor(List<Object> arguments) {
        this.arguments = arguments;
    }

    Object next(DirectiveType directive) {
        if (index >= arguments.size()) {
            throw new ArgumentUnderflowException(directive, arguments.size());
        }
        return arguments.get(index++);
    }

    void finish() {
        if (index < arguments.size()) {
            throw new ArgumentOverflowException(index, arguments.size());
        }
    }

    int consumed() {
        return index;
    }

    int size() {
        return arguments.size();
    }
}
