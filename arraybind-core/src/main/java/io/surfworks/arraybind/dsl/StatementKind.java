package io.surfworks.arraybind.dsl;

import java.util.Optional;

/**
 * Statements of the binding description language.
 */
public enum StatementKind {
    FUNCTION("npe_function"),
    ARG("npe_arg"),
    DEFAULT_ARG("npe_default_arg"),
    DOC("npe_doc"),
    BEGIN_CODE("npe_begin_code"),
    END_CODE("npe_end_code"),
    /** Reserved: recognised only so that it can be rejected. */
    DTYPE("npe_dtype");

    /** Type token deferring to another argument's type group. */
    public static final String MATCHES_TOKEN = "npe_matches";

    /** Marks a comment line. */
    public static final String COMMENT_MARKER = "//";

    private final String keyword;

    StatementKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Returns true if the line starts this statement: the keyword, optional
     * whitespace, then {@code (}. Leading whitespace is ignored.
     */
    public boolean startsLine(String line) {
        String stripped = line.strip();
        if (!stripped.startsWith(keyword)) {
            return false;
        }
        return stripped.substring(keyword.length()).stripLeading().startsWith("(");
    }

    /**
     * Finds the statement a line starts, if any.
     */
    public static Optional<StatementKind> recognize(String line) {
        for (StatementKind kind : values()) {
            if (kind.startsLine(line)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public static boolean isComment(String line) {
        return line.strip().startsWith(COMMENT_MARKER);
    }
}
