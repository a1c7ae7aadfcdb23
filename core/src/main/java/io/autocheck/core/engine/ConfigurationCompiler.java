package io.autocheck.core.engine;

import io.autocheck.core.config.CompilerSettings;
import io.autocheck.core.error.ConfigurationCompileException;
import io.autocheck.core.error.NodeTreeException;
import io.autocheck.core.model.Command;
import io.autocheck.core.model.CompileError;
import io.autocheck.core.model.CompileResult;
import io.autocheck.core.model.Configuration;
import io.autocheck.core.model.Node;
import io.autocheck.core.model.Step;
import io.autocheck.core.spi.EnvironmentProvider;
import io.autocheck.core.spi.ProviderResult;
import io.autocheck.core.tree.NodeTreeReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a configuration script, given as its statement tree, into a {@link Configuration}.
 *
 * <p>
 * Statements are folded in document order over a {@link CompileState}; a statement only sees the
 * variables and environment declared before it. Errors never stop the fold, so a result carries
 * every error of the script.
 *
 * <p>
 * Thread-safe: holds no per-compile state.
 */
public final class ConfigurationCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationCompiler.class);

    /** Directive names, in suggestion order. */
    public static final List<String> FIELDS =
            List.of("env", "required_files", "allowed_file_extensions", "grade", "network_access");

    /** Top-level statement keywords, in suggestion order. */
    public static final List<String> KEYWORDS = List.of("@", Node.Block.STEP);

    static final String FILE_EXTENSION_ADVICE =
            "A file extension must start with a dot and not contain any special characters.";

    private static final Pattern FILE_EXTENSION = Pattern.compile("^(\\.\\w+)+$");
    private static final String SYNTAX_ERROR = "syntax error";

    private final ProviderRegistry registry;
    private final SuggestionEngine suggestions;
    private final CommandResolver commands;
    private final NodeTreeReader treeReader = new NodeTreeReader();

    /** Creates a compiler with default settings and every built-in provider. */
    public ConfigurationCompiler() {
        this(CompilerSettings.defaults());
    }

    public ConfigurationCompiler(CompilerSettings settings) {
        this(ProviderRegistry.fromSettings(settings), settings);
    }

    /**
     * Creates a compiler backed by the given provider registry.
     *
     * @param registry registry resolving {@code @env} names
     * @param settings compiler tunables
     */
    public ConfigurationCompiler(ProviderRegistry registry, CompilerSettings settings) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        this.suggestions = new SuggestionEngine(settings.suggestionThreshold());
        this.commands = new CommandResolver(suggestions);
    }

    /**
     * Compiles a statement sequence.
     *
     * @param statements top-level statements in document order
     * @return SUCCESS with the configuration, or ERROR with every error found
     */
    public CompileResult compile(List<Node> statements) {
        Objects.requireNonNull(statements, "statements must not be null");
        CompileState state = CompileState.initial();
        for (Node statement : statements) {
            state = dispatch(state, statement);
        }
        LOG.info(
                "Compiled configuration: statements={}, steps={}, errors={}",
                statements.size(),
                state.configuration().steps().size(),
                state.errors().size());
        return state.errors().isEmpty()
                ? CompileResult.success(state.configuration())
                : CompileResult.error(state.errors());
    }

    /**
     * Reads a node tree document (YAML or JSON) and compiles it. A document that cannot be read
     * yields an ERROR result with a single error, on the line the parser stopped at when known and
     * on line 0 otherwise.
     */
    public CompileResult compile(String document) {
        List<Node> statements;
        try {
            statements = treeReader.read(document);
        } catch (NodeTreeException e) {
            LOG.debug("Node tree rejected: {}", e.getMessage());
            return CompileResult.error(List.of(CompileError.of(e.line(), e.getMessage())));
        }
        return compile(statements);
    }

    /**
     * Compiles a statement sequence, failing on any error.
     *
     * @throws ConfigurationCompileException listing every error, one per line
     */
    public Configuration compileOrFail(List<Node> statements) {
        return orFail(compile(statements));
    }

    /**
     * Reads and compiles a node tree document, failing on any error.
     *
     * @throws ConfigurationCompileException listing every error, one per line
     */
    public Configuration compileOrFail(String document) {
        return orFail(compile(document));
    }

    private static Configuration orFail(CompileResult result) {
        if (result.isError()) {
            throw new ConfigurationCompileException(result.errors());
        }
        return result.configuration();
    }

    // --- Statement dispatch ---

    CompileState dispatch(CompileState state, Node statement) {
        LOG.debug("Dispatching {} at line {}", statement.getClass().getSimpleName(), statement.line());
        if (statement instanceof Node.Directive directive) {
            return directive(state, directive);
        }
        if (statement instanceof Node.Assignment assignment) {
            LOG.debug("Binding variable: {}", assignment.name());
            return state.bind(assignment.name(), assignment.value());
        }
        if (statement instanceof Node.Block block) {
            return Node.Block.STEP.equals(block.keyword())
                    ? step(state, block)
                    : incorrectKeyword(state, block.keyword(), block.line());
        }
        if (statement instanceof Node.Call call) {
            return incorrectKeyword(state, call.name(), call.line());
        }
        if (statement instanceof Node.Identifier identifier) {
            return incorrectKeyword(state, identifier.name(), identifier.line());
        }
        return state.withError(CompileError.of(statement.line(), SYNTAX_ERROR));
    }

    private CompileState incorrectKeyword(CompileState state, String keyword, int line) {
        return state.withError(
                new CompileError(line, "incorrect keyword: ", keyword, suggestions.suggest(keyword, KEYWORDS)));
    }

    private CompileState directive(CompileState state, Node.Directive directive) {
        return switch (directive.name()) {
            case "env" -> environment(state, directive);
            case "required_files" -> requiredFiles(state, directive);
            case "allowed_file_extensions" -> allowedFileExtensions(state, directive);
            case "grade" -> grade(state, directive);
            case "network_access" -> networkAccess(state, directive);
            default -> state.withError(new CompileError(
                    directive.line(),
                    "incorrect field: ",
                    directive.name(),
                    suggestions.suggest(directive.name(), FIELDS)));
        };
    }

    // --- Directives ---

    private CompileState environment(CompileState state, Node.Directive directive) {
        List<Node> args = directive.args();
        int line = directive.line();
        if (args.isEmpty()) {
            return state.withError(CompileError.of(line, "missing environment name"));
        }
        List<Node> params;
        if (args.size() == 1) {
            params = List.of();
        } else if (args.size() == 2 && args.get(1) instanceof Node.ListNode list) {
            params = list.elements();
        } else {
            return state.withError(CompileError.of(line, SYNTAX_ERROR));
        }

        Node name = state.variables().resolve(args.get(0));
        String renderedName = TokenRenderer.render(name);
        Optional<ProviderRegistry.Registration> registration =
                name instanceof Node.Literal literal && literal.value() instanceof String id
                        ? registry.getRegistration(id)
                        : Optional.empty();
        if (registration.isEmpty()) {
            return state.withError(new CompileError(
                    line,
                    "environment is not defined: ",
                    renderedName,
                    suggestions.suggest(renderedName, registry.providerIds())));
        }

        EnvironmentProvider provider = registration.get().provider();
        if (params.size() != provider.imageArity()) {
            return state.withError(
                    new CompileError(line, "incorrect number of parameters for env: ", renderedName, ""));
        }
        ProviderResult<String> image = provider.image(state.variables().resolveAll(params));
        if (!image.isOk()) {
            return state.withError(
                    new CompileError(line, image.description(), TokenRenderer.render(image.token()), ""));
        }
        LOG.debug("Environment declared: id={}, image={}", provider.id(), image.value());
        return state.withEnvironment(registration.get(), image.value());
    }

    private CompileState requiredFiles(CompileState state, Node.Directive directive) {
        List<Node> entries = listEntries(directive);
        if (entries.isEmpty()) {
            return state.withError(
                    new CompileError(directive.line(), "list can not be empty: ", directive.name(), ""));
        }
        return state.withRequiredFiles(
                entries.stream().map(TokenRenderer::render).toList());
    }

    private CompileState allowedFileExtensions(CompileState state, Node.Directive directive) {
        List<Node> entries = listEntries(directive);
        if (entries.isEmpty()) {
            return state.withError(
                    new CompileError(directive.line(), "list can not be empty: ", directive.name(), ""));
        }
        List<String> valid = new ArrayList<>();
        List<CompileError> errors = new ArrayList<>();
        for (Node entry : entries) {
            if (entry instanceof Node.Literal literal
                    && literal.value() instanceof String extension
                    && FILE_EXTENSION.matcher(extension).matches()) {
                valid.add(extension);
            } else {
                errors.add(new CompileError(
                        directive.line(), "Invalid file extension: ", TokenRenderer.render(entry), FILE_EXTENSION_ADVICE));
            }
        }
        return state.withErrors(errors).withAllowedFileExtensions(valid);
    }

    private CompileState grade(CompileState state, Node.Directive directive) {
        if (directive.args().size() != 1) {
            return state.withError(CompileError.of(directive.line(), SYNTAX_ERROR));
        }
        Node value = resolveIdentifier(state, directive.args().get(0));
        if (value instanceof Node.Literal literal && literal.value() instanceof Number number) {
            double grade = number.doubleValue();
            if (!(grade >= 0 && grade <= 1)) {
                return state.withError(CompileError.of(directive.line(), "grade must be a value between 0 and 1"));
            }
            return state.withGrade(grade);
        }
        return state.withError(
                new CompileError(directive.line(), "grade must be a number: ", TokenRenderer.render(value), ""));
    }

    private CompileState networkAccess(CompileState state, Node.Directive directive) {
        if (directive.args().size() != 1) {
            return state.withError(CompileError.of(directive.line(), SYNTAX_ERROR));
        }
        Node value = resolveIdentifier(state, directive.args().get(0));
        if (value instanceof Node.Literal literal && literal.value() instanceof Boolean allowed) {
            return state.withNetworkAccess(allowed);
        }
        return state.withError(
                CompileError.of(directive.line(), "network_access must be a boolean true or false"));
    }

    /** Arguments of a list directive; a single list argument stands for its elements. */
    private static List<Node> listEntries(Node.Directive directive) {
        List<Node> args = directive.args();
        if (args.size() == 1 && args.get(0) instanceof Node.ListNode list) {
            return list.elements();
        }
        return args;
    }

    private static Node resolveIdentifier(CompileState state, Node value) {
        return value instanceof Node.Identifier ? state.variables().resolve(value) : value;
    }

    // --- Steps ---

    private CompileState step(CompileState state, Node.Block block) {
        if (state.hasStep(block.name())) {
            return state.withError(
                    new CompileError(block.line(), "the step name has already been defined: ", block.name(), ""));
        }
        List<Command> resolved = new ArrayList<>();
        List<CompileError> errors = new ArrayList<>();
        for (Node child : block.children()) {
            Node.Call call = asCall(child);
            if (call == null) {
                errors.add(CompileError.of(child.line(), SYNTAX_ERROR));
                continue;
            }
            CommandResolver.Resolution resolution = commands.resolve(call, state.variables(), state.environment());
            if (resolution.isOk()) {
                resolved.add(resolution.command());
            } else {
                errors.add(resolution.error());
            }
        }
        LOG.debug(
                "Step '{}' resolved: commands={}, rejected={}", block.name(), resolved.size(), errors.size());
        return state.withErrors(errors).withStep(new Step(block.name(), resolved));
    }

    /** A bare identifier inside a step is a call without arguments. */
    private static Node.Call asCall(Node child) {
        if (child instanceof Node.Call call) {
            return call;
        }
        if (child instanceof Node.Identifier identifier) {
            return new Node.Call(identifier.name(), identifier.line(), List.of());
        }
        return null;
    }
}
