package io.surfworks.arraybind.dsl;

import io.surfworks.arraybind.config.CompilerConfig;
import io.surfworks.arraybind.model.Argument;
import io.surfworks.arraybind.model.ArgumentKind;
import io.surfworks.arraybind.model.Binding;
import io.surfworks.arraybind.semantic.TypeResolver;
import io.surfworks.arraybind.semantic.TypeResolver.Resolution;
import io.surfworks.arraybind.semantic.TypeResolver.ResolvedGroups;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Structural parser for binding description files.
 *
 * <p>The input is consumed line by line in three phases:
 * <ol>
 *   <li>seeking: everything before {@code npe_function(name)} becomes the preamble</li>
 *   <li>declaring: {@code npe_arg}, {@code npe_default_arg} and at most one
 *       {@code npe_doc}, closed by {@code npe_begin_code()}</li>
 *   <li>body: lines are copied verbatim until {@code npe_end_code()}</li>
 * </ol>
 * Type tokens are resolved as each argument statement is read; the returned
 * binding still has to go through {@link io.surfworks.arraybind.semantic.BindingAnalyzer}.
 */
public final class BindingParser {

    private static final Logger LOG = Logger.getLogger(BindingParser.class.getName());

    private record Statement(StatementKind kind, String text, int line) {
        String keyword() {
            return kind.keyword();
        }
    }

    private record Declaration(String name, int line, List<String> typeTokens,
                               Resolution resolution, String defaultValue) {
    }

    private final List<String> lines;
    private final StatementTokenizer tokenizer;
    private final TypeResolver resolver;
    private int pos;

    private final StringBuilder preamble = new StringBuilder();
    private final List<Declaration> declarations = new ArrayList<>();
    private final Set<String> declaredNames = new HashSet<>();
    private String bindingName;
    private int bindingLine;
    private String doc;

    public BindingParser(String source, CompilerConfig config) {
        this.lines = splitLines(source);
        this.tokenizer = new StatementTokenizer(config.maxStatementArguments());
        this.resolver = new TypeResolver(config.typeCatalog(), tokenizer);
        this.pos = 0;
    }

    public static Binding parse(String source) {
        return parse(source, CompilerConfig.defaults());
    }

    public static Binding parse(String source, CompilerConfig config) {
        return new BindingParser(source, config).parseBinding();
    }

    /**
     * Parses the whole input into one binding.
     *
     * @throws TokenizationException if a statement is malformed
     * @throws StructuralException   if a statement is out of place or the input ends early
     * @throws io.surfworks.arraybind.semantic.SemanticException if an argument's type tokens are invalid
     */
    public Binding parseBinding() {
        if (bindingName != null) {
            throw new IllegalStateException("parser already consumed its input");
        }
        seekDeclaration();
        declareArguments();
        String body = captureBody();

        ResolvedGroups groups = resolver.freeze();
        List<Argument> arguments = new ArrayList<>();
        for (Declaration decl : declarations) {
            Resolution resolution = decl.resolution();
            if (resolution.kind() == ArgumentKind.SCALAR) {
                arguments.add(Argument.scalar(decl.name(), decl.line(), resolution.scalarType(), decl.defaultValue()));
            } else {
                arguments.add(Argument.array(decl.name(), decl.line(), decl.typeTokens(),
                        resolution.matchesName(), decl.defaultValue(), groups.indexOf(decl.name())));
            }
        }

        return new Binding(bindingName, bindingLine, preamble.toString(), arguments, groups.groups(), body, doc);
    }

    // ==================== Seeking ====================

    private void seekDeclaration() {
        while (pos < lines.size()) {
            String line = lines.get(pos);
            if (line.isBlank()) {
                pos++;
                continue;
            }

            Optional<StatementKind> kind = StatementKind.recognize(line);
            if (kind.isEmpty()) {
                preamble.append(line);
                pos++;
                continue;
            }
            if (kind.get() != StatementKind.FUNCTION) {
                throw new StructuralException("Got `" + kind.get().keyword() + "` statement before `"
                        + StatementKind.FUNCTION.keyword() + "`", lineNumber());
            }

            Statement stmt = collectStatement(kind.get());
            List<String> tokens = tokenizer.tokenize(stmt.keyword(), stmt.text(), stmt.line());
            if (tokens.size() != 1) {
                throw new StructuralException("`" + stmt.keyword() + "` expects exactly one argument, the name of "
                        + "the function, got " + tokens.size(), stmt.line());
            }
            bindingName = Identifiers.require(tokens.get(0), "function name", stmt.line());
            bindingLine = stmt.line();
            LOG.fine("Function: " + bindingName);
            return;
        }
        throw new StructuralException("Invalid binding file: must contain "
                + StatementKind.FUNCTION.keyword() + "(<function_name>)", lastLine());
    }

    // ==================== Declaring ====================

    private void declareArguments() {
        StringBuilder pendingDoc = null;
        int docLine = 0;

        while (pos < lines.size()) {
            String line = lines.get(pos);
            Optional<StatementKind> kind = StatementKind.recognize(line);

            if (kind.isEmpty()) {
                if (pendingDoc != null) {
                    pendingDoc.append(line);
                } else if (!line.isBlank() && !StatementKind.isComment(line)) {
                    throw new StructuralException("Unexpected tokens `" + line.strip() + "`", lineNumber());
                }
                pos++;
                continue;
            }

            // A recognised statement ends any documentation being accumulated
            if (pendingDoc != null) {
                doc = parseDoc(pendingDoc.toString(), docLine);
                pendingDoc = null;
            }

            switch (kind.get()) {
                case ARG, DEFAULT_ARG -> declareArgument(collectStatement(kind.get()));
                case DOC -> {
                    if (doc != null) {
                        throw new StructuralException("Multiple `" + StatementKind.DOC.keyword()
                                + "` statements for one function", lineNumber());
                    }
                    pendingDoc = new StringBuilder(line);
                    docLine = lineNumber();
                    pos++;
                }
                case BEGIN_CODE -> {
                    expectNoArguments(StatementKind.BEGIN_CODE, line, lineNumber());
                    pos++;
                    return;
                }
                default -> throw new StructuralException("Got `" + kind.get().keyword()
                        + "` statement before `" + StatementKind.BEGIN_CODE.keyword() + "`", lineNumber());
            }
        }
        throw new StructuralException("Unexpected end of input: missing "
                + StatementKind.BEGIN_CODE.keyword() + "()", lastLine());
    }

    private void declareArgument(Statement stmt) {
        List<String> tokens = tokenizer.tokenize(stmt.keyword(), stmt.text(), stmt.line());
        if (tokens.isEmpty()) {
            throw new StructuralException("`" + stmt.keyword() + "` statement is missing the argument name",
                    stmt.line());
        }

        String name = Identifiers.require(tokens.get(0), "argument name", stmt.line());
        if (!declaredNames.add(name)) {
            throw new StructuralException("Duplicate argument `" + name + "`", stmt.line());
        }

        List<String> typeTokens = new ArrayList<>(tokens.subList(1, tokens.size()));
        String defaultValue = null;
        if (stmt.kind() == StatementKind.DEFAULT_ARG) {
            if (typeTokens.isEmpty()) {
                throw new StructuralException("`" + stmt.keyword() + "` statement for `" + name
                        + "` is missing its default value", stmt.line());
            }
            defaultValue = typeTokens.remove(typeTokens.size() - 1);
        }

        Resolution resolution = resolver.resolve(name, typeTokens, stmt.line());
        declarations.add(new Declaration(name, stmt.line(), typeTokens, resolution, defaultValue));

        if (defaultValue != null) {
            LOG.fine("Default Arg: " + name + " - " + typeTokens + " - " + defaultValue);
        } else {
            LOG.fine("Arg: " + name + " - " + typeTokens);
        }
    }

    private String parseDoc(String text, int line) {
        List<String> tokens = tokenizer.tokenize(StatementKind.DOC.keyword(), text, line);
        if (tokens.isEmpty()) {
            throw new StructuralException("Got `" + StatementKind.DOC.keyword()
                    + "` statement but no documentation string", line);
        }
        if (tokens.size() > 1) {
            throw new StructuralException("Got more than one documentation token in `" + StatementKind.DOC.keyword()
                    + "` statement. Did you forget quotes around the docstring?", line);
        }
        LOG.fine("Docstring - " + tokens.get(0));
        return tokens.get(0);
    }

    // ==================== Body ====================

    private String captureBody() {
        StringBuilder body = new StringBuilder();
        while (pos < lines.size()) {
            String line = lines.get(pos);
            if (StatementKind.END_CODE.startsLine(line)) {
                expectNoArguments(StatementKind.END_CODE, line, lineNumber());
                pos++;
                expectEndOfInput();
                return body.toString();
            }
            body.append(line);
            pos++;
        }
        throw new StructuralException("Unexpected end of input: binding must end with "
                + StatementKind.END_CODE.keyword() + "()", lastLine());
    }

    private void expectEndOfInput() {
        while (pos < lines.size()) {
            String line = lines.get(pos);
            if (!line.isBlank()) {
                throw new StructuralException("Expected end of input after " + StatementKind.END_CODE.keyword()
                        + "(), got `" + line.strip() + "`", lineNumber());
            }
            pos++;
        }
    }

    // ==================== Helpers ====================

    /**
     * Reads a statement that may continue over several physical lines.
     */
    private Statement collectStatement(StatementKind kind) {
        int start = lineNumber();
        StringBuilder text = new StringBuilder(lines.get(pos));
        pos++;
        while (!tokenizer.isComplete(kind.keyword(), text.toString(), start)) {
            if (pos >= lines.size()) {
                // Reports the unterminated statement
                tokenizer.tokenize(kind.keyword(), text.toString(), start);
            }
            text.append(lines.get(pos));
            pos++;
        }
        return new Statement(kind, text.toString(), start);
    }

    private void expectNoArguments(StatementKind kind, String line, int lineNumber) {
        List<String> tokens = tokenizer.tokenize(kind.keyword(), line, lineNumber);
        if (!tokens.isEmpty()) {
            throw new StructuralException("`" + kind.keyword() + "` takes no arguments, got " + tokens.size(),
                    lineNumber);
        }
        if (!line.strip().endsWith(")")) {
            throw new StructuralException("`" + kind.keyword() + "()` must be on a line by itself, got `"
                    + line.strip() + "`", lineNumber);
        }
    }

    private int lineNumber() {
        return pos + 1;
    }

    private int lastLine() {
        return Math.max(1, lines.size());
    }

    /**
     * Splits text into lines, each keeping its terminator.
     */
    static List<String> splitLines(String source) {
        List<String> result = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                result.add(source.substring(start, i + 1));
                start = i + 1;
            }
        }
        if (start < source.length()) {
            result.add(source.substring(start));
        }
        return result;
    }
}
