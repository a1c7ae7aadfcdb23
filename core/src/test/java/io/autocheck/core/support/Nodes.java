package io.autocheck.core.support;

import io.autocheck.core.model.Node;
import java.util.List;

/** Shorthand constructors for statement trees used across tests. */
public final class Nodes {

    private Nodes() {}

    public static Node.Literal lit(Object value) {
        return new Node.Literal(value, 0);
    }

    public static Node.Identifier ident(String name) {
        return new Node.Identifier(name, 0);
    }

    public static Node.ListNode list(Node... elements) {
        return new Node.ListNode(List.of(elements), 0);
    }

    public static Node.Pair pair(String key, Node value) {
        return new Node.Pair(key, value, 0);
    }

    public static Node.Pair version(Object version) {
        return pair("version", lit(version));
    }

    public static Node.Directive directive(String name, int line, Node... args) {
        return new Node.Directive(name, line, List.of(args));
    }

    /** {@code @env "<name>", params...}; without params the keyword list is omitted. */
    public static Node.Directive env(int line, String name, Node... params) {
        return params.length == 0
                ? directive("env", line, lit(name))
                : directive("env", line, lit(name), list(params));
    }

    /** {@code @env "elixir", version: "1.7"} on line 1. */
    public static Node.Directive elixirEnv() {
        return env(1, "elixir", version("1.7"));
    }

    public static Node.Assignment assign(String name, Node value) {
        return new Node.Assignment(name, 0, value);
    }

    public static Node.Block step(String name, int line, Node... children) {
        return Node.Block.step(name, line, List.of(children));
    }

    public static Node.Call call(String name, int line, Node... args) {
        return new Node.Call(name, line, List.of(args));
    }
}
