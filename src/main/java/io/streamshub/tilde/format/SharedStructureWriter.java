package io.streamshub.tilde.format;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.streamshub.tilde.value.EmptyList;
import io.streamshub.tilde.value.Pair;
import io.streamshub.tilde.value.ValueRenderer;
import io.streamshub.tilde.value.Values;

/**
 * Machine-readable writer that labels shared and cyclic structure.
 *
 * A first pass walks the value depth-first and records, by identity, every
 * pair, vector or list reached more than once; labels are numbered from 1 in
 * the order the repeats are found. The second pass writes the value, emitting
 * {@code #n=} before the first occurrence of a labelled node and {@code #n#}
 * for every later one, so a cyclic value produces finite output:
 *
 * <pre>
 * #1=(a b c . #1#)
 * </pre>
 *
 * Atoms are never labelled; they are written by the machine renderer.
 */
public final class SharedStructureWriter {

    private final ValueRenderer atoms;

    public SharedStructureWriter(ValueRenderer atoms) {
        this.atoms = atoms;
    }

    public String write(Object value) {
        Map<Object, Integer> labels = findSharedNodes(value);
        Emitter emitter = new Emitter(labels);
        emitter.emit(value);
        return emitter.out.toString();
    }

    /**
     * Find the compound nodes reachable more than once from {@code root}.
     *
     * @return labels by node identity, numbered in the order of detection
     */
    static Map<Object, Integer> findSharedNodes(Object root) {
        Map<Object, Integer> labels = new IdentityHashMap<>();
        Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Object> pending = new ArrayDeque<>();

        // ArrayDeque rejects nulls, and null is an atom anyway
        if (Values.isCompound(root)) {
            pending.push(root);
        }

        while (!pending.isEmpty()) {
            Object node = pending.pop();

            if (!seen.add(node)) {
                labels.putIfAbsent(node, labels.size() + 1);
                continue;
            }

            // Children pushed in reverse so they are visited left to right
            List<Object> children = children(node);
            for (int i = children.size() - 1; i >= 0; i--) {
                Object child = children.get(i);
                if (Values.isCompound(child)) {
                    pending.push(child);
                }
            }
        }

        return labels;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> children(Object node) {
        if (node instanceof Pair pair) {
            return Arrays.asList(pair.car(), pair.cdr());
        }
        if (node instanceof Object[] vector) {
            return Arrays.asList(vector);
        }
        return (List<Object>) node;
    }

    private final class Emitter {
        private final Map<Object, Integer> labels;
        private final Set<Object> emitted = Collections.newSetFromMap(new IdentityHashMap<>());
        private final StringBuilder out = new StringBuilder();

        Emitter(Map<Object, Integer> labels) {
            this.labels = labels;
        }

        void emit(Object value) {
            if (!Values.isCompound(value)) {
                out.append(atoms.render(value));
                return;
            }

            Integer label = labels.get(value);
            if (label != null) {
                if (!emitted.add(value)) {
                    out.append('#').append(label).append('#');
                    return;
                }
                out.append('#').append(label).append('=');
            }

            if (value instanceof Pair pair) {
                emitList(pair);
            } else if (value instanceof Object[] vector) {
                emitElements("#(", Arrays.asList(vector));
            } else {
                emitElements("(", children(value));
            }
        }

        private void emitList(Pair pair) {
            out.append('(');
            emit(pair.car());
            Object tail = pair.cdr();

            // A labelled pair in the tail must be written in dotted form to carry its label
            while (tail instanceof Pair next && !labels.containsKey(next)) {
                out.append(' ');
                emit(next.car());
                tail = next.cdr();
            }

            if (tail != EmptyList.INSTANCE) {
                out.append(" . ");
                emit(tail);
            }
            out.append(')');
        }

        private void emitElements(String open, List<Object> elements) {
            out.append(open);
            for (int i = 0; i < elements.size(); i++) {
                if (i > 0) {
                    out.append(' ');
                }
                emit(elements.get(i));
            }
            out.append(')');
        }
    }
}
