package io.surfworks.arraybind.config;

import io.surfworks.arraybind.model.TypeCatalog;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Configuration threaded through one compilation.
 *
 * <p>Configuration is resolved in order of precedence:
 * <ol>
 *   <li>CLI arguments (highest priority)</li>
 *   <li>Config file ({@code ~/.config/arraybind/arraybind.json})</li>
 *   <li>Defaults (lowest priority)</li>
 * </ol>
 *
 * @param maxStatementArguments upper bound on the arguments of one DSL statement
 * @param excludedArrayTypes    array type tokens unavailable to this compilation
 * @param verbosity             console verbosity: &lt;0 silent, 0 errors, 1 normal, 2 verbose, 3+ debug
 */
public record CompilerConfig(
        int maxStatementArguments,
        List<String> excludedArrayTypes,
        int verbosity
) {

    /** Default statement argument bound */
    public static final int DEFAULT_MAX_STATEMENT_ARGUMENTS = 64;

    /** Default verbosity (normal) */
    public static final int DEFAULT_VERBOSITY = 1;

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "arraybind"
    );

    /** Config file name */
    public static final String CONFIG_FILE = "arraybind.json";

    public CompilerConfig {
        Objects.requireNonNull(excludedArrayTypes, "excludedArrayTypes cannot be null");
        excludedArrayTypes = List.copyOf(excludedArrayTypes);

        if (maxStatementArguments < 1) {
            throw new IllegalArgumentException("maxStatementArguments must be positive, got " + maxStatementArguments);
        }
        // Fails fast on unknown tokens
        TypeCatalog.excluding(excludedArrayTypes);
    }

    public static CompilerConfig defaults() {
        return new CompilerConfig(DEFAULT_MAX_STATEMENT_ARGUMENTS, List.of(), DEFAULT_VERBOSITY);
    }

    public static Path configFile() {
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    /**
     * The catalog of array types enabled by this configuration.
     */
    public TypeCatalog typeCatalog() {
        return excludedArrayTypes.isEmpty() ? TypeCatalog.standard() : TypeCatalog.excluding(excludedArrayTypes);
    }

    public CompilerConfig withMaxStatementArguments(int max) {
        return new CompilerConfig(max, excludedArrayTypes, verbosity);
    }

    public CompilerConfig withExcludedArrayTypes(List<String> excluded) {
        return new CompilerConfig(maxStatementArguments, excluded, verbosity);
    }

    public CompilerConfig withVerbosity(int level) {
        return new CompilerConfig(maxStatementArguments, excludedArrayTypes, level);
    }
}
