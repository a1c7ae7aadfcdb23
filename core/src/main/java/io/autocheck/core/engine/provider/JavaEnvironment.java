package io.autocheck.core.engine.provider;

/** OpenJDK runtime: {@code @env "java", version: "17"} selects {@code openjdk:17-slim}. */
public final class JavaEnvironment extends VersionedImageProvider {

    public static final String ID = "java";

    @Override
    public String id() {
        return ID;
    }

    @Override
    protected String imageFor(String version) {
        return "openjdk:" + version + "-slim";
    }
}
