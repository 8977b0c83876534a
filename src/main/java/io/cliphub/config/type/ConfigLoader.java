package io.cliphub.config.type;

import io.cliphub.config.impl.HubConfig;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;
import java.util.function.Function;

public final class ConfigLoader {

    /** Bundled defaults, used when no config file is given. */
    public static final String DEFAULT_RESOURCE = "cliphub.yaml";

    private ConfigLoader() {
    }

    /**
     * Loads hub configuration from a YAML file and applies {@code CLIPHUB_*} environment overrides.
     *
     * @param path the path to the hub YAML configuration file
     * @throws IOException if the file cannot be read or parsed
     */
    public static HubConfig load(final String path) throws IOException {
        return load(path, System::getenv);
    }

    public static HubConfig load(final String path, final Function<String, String> env) throws IOException {
        try (final InputStream in = Files.newInputStream(Paths.get(path))) {
            return parse(in, path, env);
        }
    }

    /**
     * Loads the bundled {@value #DEFAULT_RESOURCE}; falls back to built-in defaults if it is absent.
     */
    public static HubConfig loadDefault(final Function<String, String> env) throws IOException {
        try (final InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) return HubConfig.from(Map.of(), env);
            return parse(in, DEFAULT_RESOURCE, env);
        }
    }

    private static HubConfig parse(final InputStream in, final String origin, final Function<String, String> env)
            throws IOException {
        final Object root;
        try {
            root = new Yaml().load(in);
        } catch (final YAMLException e) {
            throw new IOException("Cannot parse " + origin, e);
        }
        if (root != null && !(root instanceof Map)) {
            throw new IOException(origin + " must contain a YAML mapping");
        }

        @SuppressWarnings("unchecked") final Map<String, Object> m = (Map<String, Object>) root;
        return HubConfig.from(m, env);
    }
}
