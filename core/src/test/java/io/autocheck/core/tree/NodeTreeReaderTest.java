package io.autocheck.core.tree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.autocheck.core.engine.ConfigurationCompiler;
import io.autocheck.core.error.NodeTreeException;
import io.autocheck.core.model.Command;
import io.autocheck.core.model.CompileError;
import io.autocheck.core.model.CompileResult;
import io.autocheck.core.model.Configuration;
import io.autocheck.core.model.Node;
import io.autocheck.core.model.Step;
import java.math.BigInteger;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link NodeTreeReader} and compiling the node tree fixtures under {@code /trees}. */
class NodeTreeReaderTest {

    private final NodeTreeReader reader = new NodeTreeReader();
    private final ConfigurationCompiler compiler = new ConfigurationCompiler();

    private static Path fixture(String name) throws URISyntaxException {
        return Path.of(NodeTreeReaderTest.class.getResource("/trees/" + name).toURI());
    }

    @Nested
    @DisplayName("Reading")
    class Reading {

        @Test
        void readsEveryNodeShape() {
            List<Node> nodes = reader.read("""
                    - {assign: x, line: 2, value: {list: [1, 2.5, true, null, {ident: y}]}}
                    - {directive: env, line: 3, args: [custom, {list: [{pair: image, value: x}]}]}
                    - block: step
                      name: s
                      line: 4
                      body:
                        - {call: run, args: [make]}
                    """);

            assertThat(nodes).hasSize(3);
            assertThat(nodes.get(0))
                    .isEqualTo(new Node.Assignment(
                            "x",
                            2,
                            new Node.ListNode(
                                    List.of(
                                            Node.Literal.of(1L, 2),
                                            Node.Literal.of(2.5, 2),
                                            Node.Literal.of(true, 2),
                                            Node.Literal.nil(2),
                                            new Node.Identifier("y", 2)),
                                    2)));
            assertThat(nodes.get(1))
                    .isEqualTo(new Node.Directive(
                            "env",
                            3,
                            List.of(
                                    Node.Literal.of("custom", 3),
                                    new Node.ListNode(
                                            List.of(new Node.Pair("image", Node.Literal.of("x", 3), 3)), 3))));
            assertThat(nodes.get(2))
                    .isEqualTo(Node.Block.step(
                            "s", 4, List.of(new Node.Call("run", 4, List.of(Node.Literal.of("make", 4))))));
        }

        @Test
        void topLevelLineDefaultsToOne() {
            assertThat(reader.read("- {directive: grade, args: [1]}").get(0).line()).isEqualTo(1);
        }

        @Test
        void hugeIntegerBecomesBigInteger() {
            Node.Directive grade = (Node.Directive) reader.read("[{\"directive\": \"grade\", \"args\": [99999999999999999999]}]")
                    .get(0);
            assertThat(((Node.Literal) grade.args().get(0)).value()).isEqualTo(new BigInteger("99999999999999999999"));
        }

        @Test
        void emptyDocumentHasNoStatements() {
            assertThat(reader.read("")).isEmpty();
        }

        @Test
        void schemaViolationIsRejected() throws Exception {
            Path path = fixture("not-a-tree.yaml");
            assertThatThrownBy(() -> reader.read(path))
                    .isInstanceOf(NodeTreeException.class)
                    .hasMessageStartingWith("Invalid node tree: ")
                    .satisfies(e -> assertThat(((NodeTreeException) e).source()).isEqualTo(path.toString()));
        }

        @Test
        void unknownKeyIsRejected() {
            assertThatThrownBy(() -> reader.read("- {call: run, args: [make], extra: 1}"))
                    .isInstanceOf(NodeTreeException.class)
                    .hasMessageStartingWith("Invalid node tree: ");
        }

        @Test
        void malformedYamlIsRejected() {
            assertThatThrownBy(() -> reader.read("- {call: run, args: [make", "broken.yaml"))
                    .isInstanceOf(NodeTreeException.class)
                    .hasMessageStartingWith("Failed to parse node tree: ")
                    .satisfies(e -> assertThat(((NodeTreeException) e).source()).isEqualTo("broken.yaml"));
        }

        @Test
        void parseFailureKeepsParserLine() {
            assertThatThrownBy(() -> reader.read("- {directive: grade, args: [1]}\n- {call: run, args: [make\n"))
                    .isInstanceOfSatisfying(
                            NodeTreeException.class, e -> assertThat(e.line()).isPositive());
        }

        @Test
        void lineBeyondIntRangeIsRejected() {
            assertThatThrownBy(() -> reader.read("- {directive: grade, line: 2147483648, args: [1]}"))
                    .isInstanceOf(NodeTreeException.class)
                    .hasMessageStartingWith("Invalid node tree: ");
        }

        @Test
        void missingFileIsRejected(@TempDir Path dir) {
            assertThatThrownBy(() -> reader.read(dir.resolve("absent.yaml")))
                    .isInstanceOf(NodeTreeException.class)
                    .hasMessageStartingWith("Failed to read or parse node tree: ");
        }
    }

    @Nested
    @DisplayName("Compiling fixtures")
    class Fixtures {

        @Test
        void variablesFixture() throws Exception {
            Configuration configuration = compiler.compileOrFail(reader.read(fixture("variables.yaml")));

            assertThat(configuration.image()).isEqualTo("haskell");
            assertThat(configuration.environmentId()).isEqualTo("custom");
            assertThat(configuration.grade()).isEqualTo(0.5);
            assertThat(configuration.steps())
                    .containsExactly(new Step("random", List.of(Command.run("cat Lab1.hs"))));
        }

        @Test
        void elixirLabFixture() throws Exception {
            Configuration configuration = compiler.compileOrFail(Files.readString(fixture("elixir-lab.json")));

            assertThat(configuration.image()).isEqualTo("elixir:1.7-alpine");
            assertThat(configuration.requiredFiles()).containsExactly("lib/lab.ex", "test/lab_test.exs");
            assertThat(configuration.allowedFileExtensions()).containsExactly(".ex", ".exs");
            assertThat(configuration.networkAccess()).isFalse();
            assertThat(configuration.grade()).isEqualTo(1.0);
            assertThat(configuration.step("Setup").commands())
                    .containsExactly(
                            Command.run("mix new lab\nrm lab/lib/*.ex lab/test/*_test.ex\n"), Command.run("mix help"));
            assertThat(configuration.step("Test").commands())
                    .containsExactly(
                            Command.run("mix format lib/lab.ex"),
                            Command.run("cd lab\nmix test\n"),
                            new Command("print", List.of("done")));
        }

        @Test
        void manyErrorsFixtureReportsEveryError() throws Exception {
            CompileResult result = compiler.compile(Files.readString(fixture("many-errors.yaml")));

            assertThat(result.isError()).isTrue();
            assertThat(result.errors())
                    .containsExactly(
                            new CompileError(1, "environment is not defined: ", "elxir", "Did you mean elixir?"),
                            new CompileError(2, "incorrect field: ", "gradee", "Did you mean grade?"),
                            CompileError.of(3, "grade must be a value between 0 and 1"),
                            new CompileError(
                                    4, "Invalid file extension: ", "exs", fileExtensionAdvice()),
                            new CompileError(
                                    4, "Invalid file extension: ", "[.a, .b]", fileExtensionAdvice()),
                            new CompileError(5, "incorrect keyword: ", "stepp", "Did you mean step?"),
                            new CompileError(8, "undefined function: ", "format", ""),
                            new CompileError(11, "the step name has already been defined: ", "build", ""));
        }

        @Test
        void invalidDocumentBecomesLineZeroError() throws Exception {
            CompileResult result = compiler.compile(Files.readString(fixture("not-a-tree.yaml")));

            assertThat(result.errors()).hasSize(1);
            assertThat(result.errors().get(0).line()).isZero();
            assertThat(result.errors().get(0).description()).startsWith("Invalid node tree: ");
        }

        @Test
        void unparsableDocumentIsReportedOnParserLine() {
            CompileResult result = compiler.compile("- {directive: grade, args: [1]}\n- {call: run, args: [make\n");

            assertThat(result.errors()).hasSize(1);
            assertThat(result.errors().get(0).line()).isPositive();
            assertThat(result.errors().get(0).description()).startsWith("Failed to parse node tree: ");
        }

        private String fileExtensionAdvice() {
            return "A file extension must start with a dot and not contain any special characters.";
        }
    }
}
