package io.surfworks.arraybind.dsl;

import io.surfworks.arraybind.config.CompilerConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one DSL statement of the form {@code NAME(arg0, arg1, ..., argN)}
 * into its trimmed argument strings.
 *
 * <p>The rules follow what a C preprocessor does with a variadic macro call:
 * <ul>
 *   <li>only parentheses nest; a comma inside {@code ( )} belongs to the
 *       argument, commas inside {@code [] {} <>} still separate arguments</li>
 *   <li>{@code "..."}, {@code '...'} and raw {@code R"d(...)d"} literals are
 *       opaque and may span lines</li>
 *   <li>{@code //} and block comments outside literals count as whitespace</li>
 *   <li>a trailing comma adds no argument; an interior empty argument is kept</li>
 *   <li>only whitespace and comments may follow the closing parenthesis</li>
 * </ul>
 *
 * <p>The statement may span several physical lines. Errors are reported
 * against the line the statement starts on.
 */
public final class StatementTokenizer {

    private final int maxArguments;

    public StatementTokenizer() {
        this(CompilerConfig.DEFAULT_MAX_STATEMENT_ARGUMENTS);
    }

    /**
     * @param maxArguments statements with more arguments than this are rejected
     */
    public StatementTokenizer(int maxArguments) {
        if (maxArguments < 1) {
            throw new IllegalArgumentException("maxArguments must be positive, got " + maxArguments);
        }
        this.maxArguments = maxArguments;
    }

    /**
     * Tokenizes a complete statement.
     *
     * @param statementName the expected leading name, e.g. {@code npe_arg}
     * @param text          the statement text, possibly spanning lines
     * @param line          line the statement starts on, for error reporting
     * @return the arguments in order, each stripped of surrounding whitespace
     * @throws TokenizationException if the statement is malformed or unterminated
     */
    public List<String> tokenize(String statementName, String text, int line) {
        Scan scan = new Scanner(statementName, text, line).run();
        if (!scan.complete()) {
            throw new TokenizationException(
                    "Unterminated `" + statementName + "` statement (unbalanced parentheses or literal)", line);
        }
        return scan.arguments();
    }

    /**
     * Returns true once {@code text} holds the whole statement, i.e. its
     * opening parenthesis has been matched. Used to join the physical lines
     * of a multi-line statement.
     *
     * @throws TokenizationException if the text is already known to be malformed
     */
    public boolean isComplete(String statementName, String text, int line) {
        return new Scanner(statementName, text, line).run().complete();
    }

    private record Scan(boolean complete, List<String> arguments) {
        static Scan incomplete() {
            return new Scan(false, List.of());
        }
    }

    private final class Scanner {

        private final String name;
        private final String input;
        private final int line;
        private int pos;

        private final List<String> arguments = new ArrayList<>();
        private final StringBuilder current = new StringBuilder();

        Scanner(String name, String input, int line) {
            this.name = name;
            this.input = input;
            this.line = line;
            this.pos = 0;
        }

        Scan run() {
            if (!skipBlank()) {
                return Scan.incomplete();
            }
            if (!input.startsWith(name, pos)) {
                throw error("Expected `" + name + "` statement");
            }
            pos += name.length();

            if (!skipBlank()) {
                return Scan.incomplete();
            }
            if (pos >= input.length() || input.charAt(pos) != '(') {
                throw error("Missing '(' after `" + name + "`");
            }
            pos++;

            int depth = 1;
            while (pos < input.length() && depth > 0) {
                char c = input.charAt(pos);

                if (c == '"' || c == '\'') {
                    if (!scanQuoted(c)) {
                        return Scan.incomplete();
                    }
                } else if (c == 'R' && startsRawString()) {
                    if (!scanRawString()) {
                        return Scan.incomplete();
                    }
                } else if (c == '/' && peek(1) == '/') {
                    skipLineComment();
                    current.append(' ');
                } else if (c == '/' && peek(1) == '*') {
                    if (!skipBlockComment()) {
                        return Scan.incomplete();
                    }
                    current.append(' ');
                } else if (c == '(') {
                    depth++;
                    current.append(c);
                    pos++;
                } else if (c == ')') {
                    depth--;
                    pos++;
                    if (depth > 0) {
                        current.append(c);
                    }
                } else if (c == ',' && depth == 1) {
                    addArgument(current.toString().strip());
                    current.setLength(0);
                    pos++;
                } else {
                    current.append(c);
                    pos++;
                }
            }

            if (depth > 0) {
                return Scan.incomplete();
            }

            // Trailing comma (or empty list) adds no argument
            String last = current.toString().strip();
            if (!last.isEmpty()) {
                addArgument(last);
            }

            if (!skipBlank()) {
                return Scan.incomplete();
            }
            if (pos < input.length()) {
                throw error("Extra tokens after `" + name + "` statement");
            }
            return new Scan(true, List.copyOf(arguments));
        }

        private void addArgument(String argument) {
            arguments.add(argument);
            if (arguments.size() > maxArguments) {
                throw error("`" + name + "` statement exceeds the maximum of " + maxArguments + " arguments");
            }
        }

        /**
         * Skips whitespace and comments. Returns false inside an unterminated block comment.
         */
        private boolean skipBlank() {
            while (pos < input.length()) {
                char c = input.charAt(pos);
                if (Character.isWhitespace(c)) {
                    pos++;
                } else if (c == '/' && peek(1) == '/') {
                    skipLineComment();
                } else if (c == '/' && peek(1) == '*') {
                    if (!skipBlockComment()) {
                        return false;
                    }
                } else {
                    break;
                }
            }
            return true;
        }

        private void skipLineComment() {
            while (pos < input.length() && input.charAt(pos) != '\n') {
                pos++;
            }
        }

        private boolean skipBlockComment() {
            int end = input.indexOf("*/", pos + 2);
            if (end < 0) {
                return false;
            }
            pos = end + 2;
            return true;
        }

        private boolean scanQuoted(char quote) {
            int start = pos;
            pos++; // opening quote
            while (pos < input.length()) {
                char c = input.charAt(pos);
                if (c == '\\') {
                    pos += 2;
                    continue;
                }
                pos++;
                if (c == quote) {
                    current.append(input, start, pos);
                    return true;
                }
            }
            return false;
        }

        private boolean startsRawString() {
            if (peek(1) != '"') {
                return false;
            }
            if (pos > 0) {
                char prev = input.charAt(pos - 1);
                if (Character.isLetterOrDigit(prev) || prev == '_') {
                    return false;
                }
            }
            // An unfinished delimiter still counts, so the caller waits for more input
            int open = input.indexOf('(', pos + 2);
            String delimiter = open < 0 ? input.substring(pos + 2) : input.substring(pos + 2, open);
            return isRawDelimiter(delimiter);
        }

        private boolean scanRawString() {
            int open = input.indexOf('(', pos + 2);
            if (open < 0) {
                return false;
            }
            String closing = ")" + input.substring(pos + 2, open) + "\"";
            int end = input.indexOf(closing, open + 1);
            if (end < 0) {
                return false;
            }
            int stop = end + closing.length();
            current.append(input, pos, stop);
            pos = stop;
            return true;
        }

        private char peek(int offset) {
            int i = pos + offset;
            return i < input.length() ? input.charAt(i) : '\0';
        }

        private TokenizationException error(String message) {
            return new TokenizationException(message, line);
        }
    }

    private static boolean isRawDelimiter(String delimiter) {
        if (delimiter.length() > 16) {
            return false;
        }
        for (int i = 0; i < delimiter.length(); i++) {
            char c = delimiter.charAt(i);
            if (Character.isWhitespace(c) || c == '\\' || c == ')' || c == '"') {
                return false;
            }
        }
        return true;
    }
}
