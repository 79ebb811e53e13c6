package io.streamshub.tilde.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import io.streamshub.tilde.value.DatumReader;
import io.streamshub.tilde.value.EmptyList;
import io.streamshub.tilde.value.Symbol;
import io.streamshub.tilde.value.Values;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Turns command-line text and argument files into template arguments.
 *
 * YAML (and therefore JSON) nodes map as follows:
 * - sequences become lists
 * - integers become Long or BigInteger, floats become Double
 * - booleans become Boolean, null becomes the empty list
 * - strings become String, except 'name which becomes the symbol name
 */
@ApplicationScoped
public class ArgumentLoader {

    private final ObjectMapper yamlMapper;

    public ArgumentLoader() {
        this.yamlMapper = new ObjectMapper(YAMLFactory.builder().build());
    }

    /**
     * Load the arguments held in a YAML or JSON file. The document must be a
     * sequence; an empty document yields no arguments.
     */
    public List<Object> load(Path path) {
        JsonNode root;

        try {
            root = yamlMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load argument file: " + path, e);
        }

        if (root == null || root.isMissingNode() || root.isNull()) {
            return List.of();
        }
        if (!root.isArray()) {
            throw new IllegalArgumentException("Argument file must contain a sequence: " + path);
        }

        List<Object> arguments = new ArrayList<>(root.size());
        root.forEach(node -> arguments.add(toValue(node)));
        return arguments;
    }

    /**
     * Parse a single argument in the given syntax.
     *
     * @throws IllegalArgumentException if the text is not a valid value
     */
    public Object parse(String text, ArgumentSyntax syntax) {
        return switch (syntax) {
            case DATUM -> DatumReader.read(text);
            case YAML -> {
                try {
                    yield toValue(yamlMapper.readTree(text));
                } catch (IOException e) {
                    throw new IllegalArgumentException("Invalid YAML value: " + text, e);
                }
            }
        };
    }

    private Object toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return EmptyList.INSTANCE;
        }
        if (node.isArray()) {
            List<Object> elements = new ArrayList<>(node.size());
            node.forEach(element -> elements.add(toValue(element)));
            return Values.list(elements.toArray());
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isBigInteger()) {
            return node.bigIntegerValue();
        }
        if (node.isIntegralNumber()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            String text = node.textValue();
            if (text.length() > 1 && text.charAt(0) == '\'') {
                return Symbol.of(text.substring(1));
            }
            return text;
        }
        throw new IllegalArgumentException("Unsupported argument value (mappings are not allowed): " + node);
    }
}
