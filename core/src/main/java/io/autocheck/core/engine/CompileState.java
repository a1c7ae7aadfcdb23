package io.autocheck.core.engine;

import io.autocheck.core.model.CompileError;
import io.autocheck.core.model.Configuration;
import io.autocheck.core.model.Node;
import io.autocheck.core.model.Step;
import java.util.ArrayList;
import java.util.List;

/**
 * Accumulator threaded through the statement fold: the partial configuration, the declared
 * environment, the variable table and the errors found so far. Immutable; every transition
 * returns a new state.
 */
public final class CompileState {

    private static final CompileState INITIAL =
            new CompileState(Configuration.empty(), null, VariableTable.empty(), List.of());

    private final Configuration configuration;
    private final ProviderRegistry.Registration environment;
    private final VariableTable variables;
    private final List<CompileError> errors;

    private CompileState(
            Configuration configuration,
            ProviderRegistry.Registration environment,
            VariableTable variables,
            List<CompileError> errors) {
        this.configuration = configuration;
        this.environment = environment;
        this.variables = variables;
        this.errors = errors;
    }

    public static CompileState initial() {
        return INITIAL;
    }

    public Configuration configuration() {
        return configuration;
    }

    /** The declared environment, or {@code null} if none was declared yet. */
    public ProviderRegistry.Registration environment() {
        return environment;
    }

    public VariableTable variables() {
        return variables;
    }

    public List<CompileError> errors() {
        return errors;
    }

    public boolean hasStep(String name) {
        return configuration.step(name) != null;
    }

    CompileState bind(String name, Node value) {
        return new CompileState(configuration, environment, variables.bind(name, value), errors);
    }

    CompileState withError(CompileError error) {
        return withErrors(List.of(error));
    }

    CompileState withErrors(List<CompileError> more) {
        if (more.isEmpty()) {
            return this;
        }
        List<CompileError> all = new ArrayList<>(errors);
        all.addAll(more);
        return new CompileState(configuration, environment, variables, List.copyOf(all));
    }

    CompileState withEnvironment(ProviderRegistry.Registration registration, String image) {
        Configuration c = configuration;
        return withConfiguration(
                new Configuration(
                        image,
                        registration.id(),
                        c.requiredFiles(),
                        c.allowedFileExtensions(),
                        c.grade(),
                        c.networkAccess(),
                        c.steps()),
                registration);
    }

    CompileState withRequiredFiles(List<String> requiredFiles) {
        Configuration c = configuration;
        return withConfiguration(new Configuration(
                c.image(),
                c.environmentId(),
                requiredFiles,
                c.allowedFileExtensions(),
                c.grade(),
                c.networkAccess(),
                c.steps()));
    }

    CompileState withAllowedFileExtensions(List<String> allowedFileExtensions) {
        Configuration c = configuration;
        return withConfiguration(new Configuration(
                c.image(),
                c.environmentId(),
                c.requiredFiles(),
                allowedFileExtensions,
                c.grade(),
                c.networkAccess(),
                c.steps()));
    }

    CompileState withGrade(double grade) {
        Configuration c = configuration;
        return withConfiguration(new Configuration(
                c.image(),
                c.environmentId(),
                c.requiredFiles(),
                c.allowedFileExtensions(),
                grade,
                c.networkAccess(),
                c.steps()));
    }

    CompileState withNetworkAccess(boolean networkAccess) {
        Configuration c = configuration;
        return withConfiguration(new Configuration(
                c.image(),
                c.environmentId(),
                c.requiredFiles(),
                c.allowedFileExtensions(),
                c.grade(),
                networkAccess,
                c.steps()));
    }

    CompileState withStep(Step step) {
        Configuration c = configuration;
        List<Step> steps = new ArrayList<>(c.steps());
        steps.add(step);
        return withConfiguration(new Configuration(
                c.image(),
                c.environmentId(),
                c.requiredFiles(),
                c.allowedFileExtensions(),
                c.grade(),
                c.networkAccess(),
                steps));
    }

    private CompileState withConfiguration(Configuration updated) {
        return withConfiguration(updated, environment);
    }

    private CompileState withConfiguration(Configuration updated, ProviderRegistry.Registration registration) {
        return new CompileState(updated, registration, variables, errors);
    }
}
