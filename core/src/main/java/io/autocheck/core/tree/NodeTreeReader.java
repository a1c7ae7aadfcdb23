package io.autocheck.core.tree;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.autocheck.core.error.NodeTreeException;
import io.autocheck.core.model.Node;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the generic statement tree handed over by the script tree producer, encoded as YAML or
 * JSON, into {@link Node} values. The document is validated against
 * {@code schemas/node-tree.schema.json} before conversion.
 *
 * <p>
 * Document shape: a list of nodes, where a node is a scalar (a literal) or one of:
 *
 * <pre>
 * {directive: env, line: 1, args: ["custom", {list: [{pair: image, value: {ident: i}}]}]}
 * {assign: g, line: 2, value: 0.5}
 * {block: step, name: "Test 1", line: 3, body: [{call: run, args: ["date"]}]}
 * {ident: help}
 * </pre>
 *
 * A missing {@code line} is inherited from the enclosing node (top level: 1).
 *
 * <p>
 * Thread-safe.
 */
public final class NodeTreeReader {

    private static final Logger LOG = LoggerFactory.getLogger(NodeTreeReader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final String SCHEMA_RESOURCE = "/schemas/node-tree.schema.json";
    private static final JsonSchema TREE_SCHEMA = loadSchema();
    private static final int TOP_LEVEL_LINE = 1;

    /**
     * Reads a document held in memory.
     *
     * @throws NodeTreeException if the document is not valid YAML/JSON or not a node tree
     */
    public List<Node> read(String document) {
        return read(document, "<inline>");
    }

    /**
     * Reads a document held in memory.
     *
     * @param document YAML or JSON text
     * @param source   name used in error messages
     * @throws NodeTreeException if the document is not valid YAML/JSON or not a node tree
     */
    public List<Node> read(String document, String source) {
        Objects.requireNonNull(document, "document must not be null");
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(document);
        } catch (JsonProcessingException e) {
            throw new NodeTreeException("Failed to parse node tree: " + e.getOriginalMessage(), e, source, lineOf(e));
        }
        return toStatements(root, source);
    }

    /**
     * Reads a document from a file.
     *
     * @throws NodeTreeException if the file cannot be read or is not a node tree
     */
    public List<Node> read(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            int line = e instanceof JsonProcessingException parseFailure ? lineOf(parseFailure) : 0;
            throw new NodeTreeException("Failed to read or parse node tree: " + e.getMessage(), e, source, line);
        }
        return toStatements(root, source);
    }

    private List<Node> toStatements(JsonNode root, String source) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return List.of();
        }
        Set<ValidationMessage> violations = TREE_SCHEMA.validate(root);
        if (!violations.isEmpty()) {
            String detail = violations.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new NodeTreeException("Invalid node tree: " + detail, source);
        }
        List<Node> statements = toNodes(root, TOP_LEVEL_LINE);
        LOG.debug("Read node tree: source={}, statements={}", source, statements.size());
        return statements;
    }

    private List<Node> toNodes(JsonNode array, int line) {
        if (array == null || !array.isArray()) {
            return List.of();
        }
        List<Node> nodes = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            nodes.add(toNode(element, line));
        }
        return nodes;
    }

    private Node toNode(JsonNode json, int enclosingLine) {
        if (!json.isObject()) {
            return toLiteral(json, enclosingLine);
        }
        int line = json.path("line").asInt(enclosingLine);
        if (json.has("directive")) {
            return new Node.Directive(json.get("directive").asText(), line, toNodes(json.get("args"), line));
        }
        if (json.has("assign")) {
            return new Node.Assignment(json.get("assign").asText(), line, toNode(json.get("value"), line));
        }
        if (json.has("block")) {
            return new Node.Block(
                    json.get("block").asText(), json.get("name").asText(), line, toNodes(json.get("body"), line));
        }
        if (json.has("call")) {
            return new Node.Call(json.get("call").asText(), line, toNodes(json.get("args"), line));
        }
        if (json.has("ident")) {
            return new Node.Identifier(json.get("ident").asText(), line);
        }
        if (json.has("list")) {
            return new Node.ListNode(toNodes(json.get("list"), line), line);
        }
        if (json.has("pair")) {
            return new Node.Pair(json.get("pair").asText(), toNode(json.get("value"), line), line);
        }
        // Unreachable for schema-valid documents
        throw new IllegalStateException("Unrecognized node: " + json);
    }

    private Node.Literal toLiteral(JsonNode json, int line) {
        if (json.isNull()) {
            return Node.Literal.nil(line);
        }
        if (json.isTextual()) {
            return Node.Literal.of(json.asText(), line);
        }
        if (json.isBoolean()) {
            return Node.Literal.of(json.booleanValue(), line);
        }
        if (json.isIntegralNumber()) {
            return json.canConvertToLong()
                    ? Node.Literal.of(json.longValue(), line)
                    : Node.Literal.of(json.bigIntegerValue(), line);
        }
        if (json.isBigDecimal()) {
            return Node.Literal.of(json.decimalValue(), line);
        }
        return Node.Literal.of(json.doubleValue(), line);
    }

    private static int lineOf(JsonProcessingException e) {
        return e.getLocation() == null ? 0 : e.getLocation().getLineNr();
    }

    private static JsonSchema loadSchema() {
        try (InputStream in = NodeTreeReader.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SCHEMA_RESOURCE);
            }
            JsonNode schema = JSON_MAPPER.readTree(in);
            return JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012).getSchema(schema);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + SCHEMA_RESOURCE, e);
        }
    }
}
