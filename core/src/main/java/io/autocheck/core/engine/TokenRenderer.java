package io.autocheck.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.autocheck.core.model.Node;
import java.math.BigDecimal;
import java.util.stream.Collectors;

/**
 * Renders node values as text, both for command arguments and for the offending token of an
 * error message. Lists are rendered element by element so that a nested structure is never
 * interpolated raw.
 */
public final class TokenRenderer {

    private static final ObjectMapper JSON = new ObjectMapper();

    private TokenRenderer() {
        // utility class
    }

    /**
     * Renders a node.
     *
     * <ul>
     * <li>strings verbatim, numbers and booleans in their natural form, nil as {@code nil}
     * <li>identifiers by name
     * <li>lists as {@code [a, b]}, pairs as {@code key: value}
     * <li>statements (directives, calls, blocks, assignments) as a JSON structural dump
     * </ul>
     */
    public static String render(Node node) {
        if (node == null) {
            return "nil";
        }
        if (node instanceof Node.Literal literal) {
            return renderScalar(literal.value());
        }
        if (node instanceof Node.Identifier identifier) {
            return identifier.name();
        }
        if (node instanceof Node.ListNode list) {
            return list.elements().stream().map(TokenRenderer::render).collect(Collectors.joining(", ", "[", "]"));
        }
        if (node instanceof Node.Pair pair) {
            return pair.key() + ": " + render(pair.value());
        }
        return dump(node);
    }

    private static String renderScalar(Object value) {
        if (value == null) {
            return "nil";
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return value.toString();
    }

    private static String dump(Node node) {
        try {
            return JSON.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render node " + node.getClass().getSimpleName(), e);
        }
    }
}
