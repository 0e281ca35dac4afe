package io.surfworks.arraybind.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Loads and saves {@link CompilerConfig} as JSON.
 *
 * <p>Recognised keys: {@code maxStatementArguments}, {@code excludedArrayTypes},
 * {@code verbosity}. Missing keys keep their defaults; unknown keys are ignored.
 * CLI arguments are handled by the caller and merged into the config.
 */
public final class CompilerConfigLoader {

    private static final Logger LOG = Logger.getLogger(CompilerConfigLoader.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    private CompilerConfigLoader() {
    }

    /**
     * Loads configuration from the default config file, or defaults if it doesn't exist.
     *
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public static CompilerConfig load() throws IOException {
        Path configFile = CompilerConfig.configFile();
        if (!Files.exists(configFile)) {
            return CompilerConfig.defaults();
        }
        return load(configFile);
    }

    /**
     * Loads configuration from a specific file.
     *
     * @param configFile path to the config file
     * @return the loaded configuration
     * @throws IOException if the file cannot be read or is not a JSON object
     * @throws IllegalArgumentException if a value is out of range
     */
    public static CompilerConfig load(Path configFile) throws IOException {
        JsonNode root = JSON.readTree(configFile.toFile());
        if (root == null || !root.isObject()) {
            throw new IOException("Config file " + configFile + " does not contain a JSON object");
        }

        CompilerConfig config = CompilerConfig.defaults();

        if (root.has("maxStatementArguments")) {
            config = config.withMaxStatementArguments(requireInt(root, "maxStatementArguments", configFile));
        }

        if (root.has("excludedArrayTypes")) {
            JsonNode excluded = root.get("excludedArrayTypes");
            if (!excluded.isArray()) {
                throw new IOException("'excludedArrayTypes' in " + configFile + " must be an array");
            }
            List<String> tokens = new ArrayList<>();
            for (JsonNode token : excluded) {
                tokens.add(token.asText());
            }
            config = config.withExcludedArrayTypes(tokens);
        }

        if (root.has("verbosity")) {
            config = config.withVerbosity(requireInt(root, "verbosity", configFile));
        }

        LOG.fine("Loaded configuration from " + configFile + ": " + config);
        return config;
    }

    /**
     * Saves configuration to a specific file.
     *
     * @throws IOException if saving fails
     */
    public static void save(CompilerConfig config, Path configFile) throws IOException {
        if (configFile.getParent() != null) {
            Files.createDirectories(configFile.getParent());
        }

        ObjectNode root = JSON.createObjectNode();
        root.put("maxStatementArguments", config.maxStatementArguments());
        ArrayNode excluded = root.putArray("excludedArrayTypes");
        for (String token : config.excludedArrayTypes()) {
            excluded.add(token);
        }
        root.put("verbosity", config.verbosity());

        JSON.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), root);
    }

    private static int requireInt(JsonNode node, String field, Path configFile) throws IOException {
        JsonNode value = node.get(field);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new IOException("'" + field + "' in " + configFile + " must be an integer");
        }
        return value.asInt();
    }
}
