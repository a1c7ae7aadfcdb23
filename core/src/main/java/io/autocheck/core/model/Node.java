package io.autocheck.core.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * Generic expression tree node produced by the external tree producer and consumed by
 * {@code ConfigurationCompiler}. Closed set of shapes; every node carries the source line it was
 * read from so that errors can be attributed.
 *
 * <p>
 * Immutable and thread-safe.
 */
public sealed interface Node
        permits Node.Directive,
                Node.Assignment,
                Node.Block,
                Node.Call,
                Node.Literal,
                Node.Identifier,
                Node.ListNode,
                Node.Pair {

    /** Source line of this node, {@code 0} if unknown. */
    int line();

    /**
     * Attribute statement {@code @name args}, setting one top-level configuration field.
     *
     * @param name directive name without the {@code @} marker
     * @param line source line
     * @param args arguments in source order, possibly empty
     */
    record Directive(String name, int line, List<Node> args) implements Node {
        public Directive {
            Objects.requireNonNull(name, "name must not be null");
            args = args == null ? List.of() : List.copyOf(args);
        }
    }

    /** Variable binding {@code name = value}. */
    record Assignment(String name, int line, Node value) implements Node {
        public Assignment {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /**
     * Named block {@code keyword "name" do ... end}. A block with keyword {@link #STEP} declares a
     * step; any other keyword is reported as an incorrect keyword.
     */
    record Block(String keyword, String name, int line, List<Node> children) implements Node {

        /** Keyword of a step block. */
        public static final String STEP = "step";

        public Block {
            Objects.requireNonNull(keyword, "keyword must not be null");
            Objects.requireNonNull(name, "name must not be null");
            children = children == null ? List.of() : List.copyOf(children);
        }

        /** Creates a {@code step} block. */
        public static Block step(String name, int line, List<Node> children) {
            return new Block(STEP, name, line, children);
        }
    }

    /** Function call {@code name arg, ...}. Inside a step this is one command. */
    record Call(String name, int line, List<Node> args) implements Node {
        public Call {
            Objects.requireNonNull(name, "name must not be null");
            args = args == null ? List.of() : List.copyOf(args);
        }
    }

    /**
     * Scalar literal. {@code value} is a {@link String}, a {@link Number}, a {@link Boolean}, or
     * {@code null} for the nil literal.
     */
    record Literal(Object value, int line) implements Node {
        public Literal {
            if (value != null
                    && !(value instanceof String)
                    && !(value instanceof Boolean)
                    && !(value instanceof Long)
                    && !(value instanceof Integer)
                    && !(value instanceof Double)
                    && !(value instanceof BigDecimal)
                    && !(value instanceof BigInteger)) {
                throw new IllegalArgumentException(
                        "Unsupported literal type: " + value.getClass().getName());
            }
        }

        public static Literal of(String value, int line) {
            return new Literal(Objects.requireNonNull(value, "value must not be null"), line);
        }

        public static Literal of(Number value, int line) {
            return new Literal(Objects.requireNonNull(value, "value must not be null"), line);
        }

        public static Literal of(boolean value, int line) {
            return new Literal(value, line);
        }

        public static Literal nil(int line) {
            return new Literal(null, line);
        }
    }

    /** Bare name; resolved through the variable table where a value is expected. */
    record Identifier(String name, int line) implements Node {
        public Identifier {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /** Literal list, e.g. the keyword parameter list of {@code @env}. */
    record ListNode(List<Node> elements, int line) implements Node {
        public ListNode {
            elements = elements == null ? List.of() : List.copyOf(elements);
        }
    }

    /** Keyword argument {@code key: value}. */
    record Pair(String key, Node value, int line) implements Node {
        public Pair {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }
}
