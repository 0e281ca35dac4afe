package io.surfworks.arraybind.codegen;

import io.surfworks.arraybind.codegen.BindingCodeGenerator.GeneratedSource;
import io.surfworks.arraybind.config.CompilerConfig;
import io.surfworks.arraybind.dsl.BindingParser;
import io.surfworks.arraybind.model.Binding;
import io.surfworks.arraybind.semantic.BindingAnalyzer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Runs the whole pipeline: parse, analyze, generate.
 *
 * <p>Any {@link io.surfworks.arraybind.dsl.BindingException} aborts the
 * compilation before output is written.
 */
public final class BindingCompiler {

    private static final Logger LOG = Logger.getLogger(BindingCompiler.class.getName());

    /**
     * Result of compiling one input.
     *
     * @param binding the analyzed binding
     * @param output  the generated source
     */
    public record Compilation(Binding binding, GeneratedSource output) {

        public BindingReport report() {
            return BindingReport.of(binding, output.unitName());
        }
    }

    private final CompilerConfig config;

    public BindingCompiler() {
        this(CompilerConfig.defaults());
    }

    public BindingCompiler(CompilerConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    public CompilerConfig config() {
        return config;
    }

    /**
     * Compiles source text held in memory.
     */
    public Compilation compile(String source, String unitName) {
        Binding binding = BindingParser.parse(source, config);
        new BindingAnalyzer().analyze(binding);
        GeneratedSource output = new BindingCodeGenerator().generate(binding, unitName);
        LOG.fine("Generated " + output.branchCount() + " dispatch branches for " + binding.name());
        return new Compilation(binding, output);
    }

    /**
     * Compiles {@code input} into {@code output}. The output is written to a
     * sibling temp file first and moved into place, so a failed compilation
     * leaves no partial file behind.
     */
    public Compilation compileFile(Path input, Path output) throws IOException {
        String source = Files.readString(input, StandardCharsets.UTF_8);
        Compilation compilation = compile(source, unitNameFor(input));

        Path target = output.toAbsolutePath();
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tempFile = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.writeString(tempFile, compilation.output().text(), StandardCharsets.UTF_8);
            Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tempFile);
        }

        LOG.info("Wrote " + target);
        return compilation;
    }

    /**
     * Derives the registration function suffix from a file name:
     * {@code dir/my-fn.cpp} becomes {@code my_fn_cpp}.
     */
    public static String unitNameFor(Path input) {
        Path fileName = input.getFileName();
        if (fileName == null) {
            throw new IllegalArgumentException("input has no file name: " + input);
        }
        return unitNameFor(fileName.toString());
    }

    /**
     * Same as {@link #unitNameFor(Path)} for a bare file name.
     */
    public static String unitNameFor(String fileName) {
        StringBuilder unit = new StringBuilder();
        for (char c : fileName.toCharArray()) {
            unit.append(c < 128 && (Character.isLetterOrDigit(c) || c == '_') ? c : '_');
        }
        if (unit.length() > 0 && Character.isDigit(unit.charAt(0))) {
            unit.insert(0, '_');
        }
        return unit.toString();
    }
}
