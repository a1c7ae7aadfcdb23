package io.autocheck.core.engine.provider;

import io.autocheck.core.model.Command;
import io.autocheck.core.spi.Capability;
import io.autocheck.core.spi.ProviderResult;
import java.util.List;

/**
 * Elixir runtime: {@code @env "elixir", version: "1.7"} selects {@code elixir:1.7-alpine}.
 *
 * <p>
 * Adds mix-based functions to steps; each expands to a {@code run} command:
 * <ul>
 * <li>{@code format file}
 * <li>{@code help}
 * <li>{@code create_project name}: generates a project and strips the generated sources
 * <li>{@code test project}
 * </ul>
 */
public final class ElixirEnvironment extends VersionedImageProvider {

    public static final String ID = "elixir";

    private static final List<Capability> CAPABILITIES = List.of(
            new Capability("format", 1, args -> run("mix format " + args.get(0))),
            new Capability("help", 0, args -> run("mix help")),
            new Capability("create_project", 1, args -> {
                String name = args.get(0);
                return run("mix new " + name + "\nrm " + name + "/lib/*.ex " + name + "/test/*_test.ex\n");
            }),
            new Capability("test", 1, args -> run("cd " + args.get(0) + "\nmix test\n")));

    @Override
    public String id() {
        return ID;
    }

    @Override
    protected String imageFor(String version) {
        return "elixir:" + version + "-alpine";
    }

    @Override
    public List<Capability> capabilities() {
        return CAPABILITIES;
    }

    private static ProviderResult<Command> run(String script) {
        return ProviderResult.ok(Command.run(script));
    }
}
