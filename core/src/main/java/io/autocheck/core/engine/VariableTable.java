package io.autocheck.core.engine;

import io.autocheck.core.model.Node;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable name → value bindings made by assignment statements. {@link #bind} returns a new
 * table; the last binding of a name wins and bindings are never removed.
 *
 * <p>
 * Values are stored as written. Resolution is a single pass: an identifier resolves to its bound
 * node as-is, and a placeholder inside a string is replaced by the textual form of the bound
 * node without re-scanning the result.
 */
public final class VariableTable {

    private static final Pattern PLACEHOLDER = Pattern.compile("%(\\w+)");
    private static final VariableTable EMPTY = new VariableTable(Map.of());

    private final Map<String, Node> bindings;

    private VariableTable(Map<String, Node> bindings) {
        this.bindings = bindings;
    }

    public static VariableTable empty() {
        return EMPTY;
    }

    /** Returns a table with {@code name} bound to {@code value}. */
    public VariableTable bind(String name, Node value) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Map<String, Node> copy = new LinkedHashMap<>(bindings);
        copy.put(name, value);
        return new VariableTable(Collections.unmodifiableMap(copy));
    }

    /** Returns the bound value, or {@code null} if {@code name} is unbound. */
    public Node lookup(String name) {
        return bindings.get(name);
    }

    public boolean isBound(String name) {
        return bindings.containsKey(name);
    }

    public int size() {
        return bindings.size();
    }

    /**
     * Resolves a value against this table.
     *
     * <ul>
     * <li>identifier: the bound node, or a nil literal on the same line when unbound
     * <li>string literal: {@code %name} placeholders substituted once; unbound placeholders are
     * kept including the {@code %}
     * <li>list: element-wise; pair: its value
     * <li>anything else: unchanged
     * </ul>
     */
    public Node resolve(Node value) {
        if (value instanceof Node.Identifier identifier) {
            Node bound = bindings.get(identifier.name());
            return bound != null ? bound : Node.Literal.nil(identifier.line());
        }
        if (value instanceof Node.Literal literal && literal.value() instanceof String text) {
            return Node.Literal.of(substitute(text), literal.line());
        }
        if (value instanceof Node.ListNode list) {
            return new Node.ListNode(resolveAll(list.elements()), list.line());
        }
        if (value instanceof Node.Pair pair) {
            return new Node.Pair(pair.key(), resolve(pair.value()), pair.line());
        }
        return value;
    }

    /** Resolves every value, keeping order. */
    public List<Node> resolveAll(List<Node> values) {
        return values.stream().map(this::resolve).toList();
    }

    /** Replaces {@code %name} placeholders bound in this table. */
    public String substitute(String text) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            Node bound = bindings.get(matcher.group(1));
            String replacement = bound != null ? TokenRenderer.render(bound) : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    @Override
    public String toString() {
        return "VariableTable" + bindings.keySet();
    }
}
