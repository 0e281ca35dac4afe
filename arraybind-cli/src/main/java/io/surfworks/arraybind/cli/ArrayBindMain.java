package io.surfworks.arraybind.cli;

import io.surfworks.arraybind.codegen.BindingCompiler;
import io.surfworks.arraybind.codegen.BindingCompiler.Compilation;
import io.surfworks.arraybind.config.CompilerConfig;
import io.surfworks.arraybind.config.CompilerConfigLoader;
import io.surfworks.arraybind.dsl.BindingException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Command line entry point: compiles one binding description into a C++ source file.
 */
public final class ArrayBindMain {

    private static final Logger LOG = Logger.getLogger(ArrayBindMain.class.getName());

    static final String VERSION = "0.1.0";
    static final String DEFAULT_OUTPUT = "a.out";

    static final int EXIT_OK = 0;
    static final int EXIT_COMPILE_ERROR = 1;
    static final int EXIT_USAGE = 2;

    /**
     * Parsed command line.
     */
    record Options(Path input, Path output, Integer verbosity, Path configFile,
                   Integer maxArgs, List<String> excludedTypes, Path reportFile) {}

    /** Thrown for malformed command lines. */
    static final class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }

    private ArrayBindMain() {
    }

    public static void main(String[] args) {
        int exitCode = run(args, System.out, System.err);
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    /**
     * Runs the compiler and returns the process exit status.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            printUsage(err);
            return EXIT_USAGE;
        }
        if (hasFlag(args, "--help") || hasFlag(args, "-h")) {
            printUsage(out);
            return EXIT_OK;
        }
        if (hasFlag(args, "--version")) {
            out.println("arraybind " + VERSION);
            return EXIT_OK;
        }

        Options options;
        CompilerConfig config;
        try {
            options = parseOptions(args);
            config = resolveConfig(options);
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }

        ConsoleLogging.configure(config.verbosity(), err);

        if (!Files.isRegularFile(options.input())) {
            err.println("Error: File not found: " + options.input());
            return EXIT_USAGE;
        }

        try {
            BindingCompiler compiler = new BindingCompiler(config);
            Compilation compilation = compiler.compileFile(options.input(), options.output());
            if (options.reportFile() != null) {
                compilation.report().write(options.reportFile());
                LOG.info("Wrote report " + options.reportFile());
            }
            LOG.fine("Compiled " + compilation.binding().name() + " with "
                    + compilation.output().branchCount() + " dispatch branches");
            return EXIT_OK;
        } catch (BindingException e) {
            if (config.verbosity() >= 0) {
                err.println(e.kind().displayName() + ": " + e.getMessage());
            }
            return EXIT_COMPILE_ERROR;
        } catch (IOException e) {
            if (config.verbosity() >= 0) {
                err.println("Error: " + e.getMessage());
            }
            return EXIT_COMPILE_ERROR;
        }
    }

    static Options parseOptions(String[] args) throws UsageException {
        Path input = null;
        Path output = Path.of(DEFAULT_OUTPUT);
        Integer verbosity = null;
        Path configFile = null;
        Integer maxArgs = null;
        List<String> excluded = new ArrayList<>();
        Path report = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-o", "--output" -> output = Path.of(requireValue(args, ++i, arg));
                case "-v", "--verbosity" -> verbosity = parseInt(requireValue(args, ++i, arg), arg);
                case "--config" -> configFile = Path.of(requireValue(args, ++i, arg));
                case "--max-args" -> maxArgs = parseInt(requireValue(args, ++i, arg), arg);
                case "--exclude-type" -> excluded.add(requireValue(args, ++i, arg));
                case "--report" -> report = Path.of(requireValue(args, ++i, arg));
                default -> {
                    if (arg.startsWith("-") && arg.length() > 1) {
                        throw new UsageException("Unknown option: " + arg);
                    }
                    if (input != null) {
                        throw new UsageException("Only one input file is supported, got " + input + " and " + arg);
                    }
                    input = Path.of(arg);
                }
            }
        }

        if (input == null) {
            throw new UsageException("Missing input file");
        }
        return new Options(input, output, verbosity, configFile, maxArgs, List.copyOf(excluded), report);
    }

    /**
     * Config file values, overridden by command line flags.
     */
    static CompilerConfig resolveConfig(Options options) throws IOException {
        CompilerConfig config = options.configFile() != null
                ? CompilerConfigLoader.load(options.configFile())
                : CompilerConfigLoader.load();

        if (options.maxArgs() != null) {
            config = config.withMaxStatementArguments(options.maxArgs());
        }
        if (!options.excludedTypes().isEmpty()) {
            Set<String> excluded = new LinkedHashSet<>(config.excludedArrayTypes());
            excluded.addAll(options.excludedTypes());
            config = config.withExcludedArrayTypes(new ArrayList<>(excluded));
        }
        if (options.verbosity() != null) {
            config = config.withVerbosity(options.verbosity());
        }
        return config;
    }

    private static String requireValue(String[] args, int index, String flag) throws UsageException {
        if (index >= args.length) {
            throw new UsageException(flag + " requires a value");
        }
        return args[index];
    }

    private static int parseInt(String value, String flag) throws UsageException {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new UsageException(flag + " expects an integer, got " + value);
        }
    }

    private static boolean hasFlag(String[] args, String flag) {
        for (String arg : args) {
            if (arg.equals(flag)) {
                return true;
            }
        }
        return false;
    }

    private static void printUsage(PrintStream out) {
        out.println("ArrayBind - NumPy/Eigen binding compiler");
        out.println();
        out.println("Usage: arraybind <input> [options]");
        out.println();
        out.println("Options:");
        out.println("  -o, --output FILE        Output C++ file (default: " + DEFAULT_OUTPUT + ")");
        out.println("  -v, --verbosity N        <0 silent, 0 errors only, 1 normal, 2 verbose, 3+ debug");
        out.println("  --config FILE            Config file (default: " + CompilerConfig.configFile() + ")");
        out.println("  --max-args N             Maximum arguments per statement (default: "
                + CompilerConfig.DEFAULT_MAX_STATEMENT_ARGUMENTS + ")");
        out.println("  --exclude-type TOKEN     Disable an array type, e.g. dense_f128 (repeatable)");
        out.println("  --report FILE            Write a JSON report of the analyzed binding");
        out.println("  --version                Print the version");
        out.println("  --help, -h               Print this help message");
    }
}
