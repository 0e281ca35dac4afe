package io.surfworks.arraybind.dsl;

/**
 * Base class for every error that aborts the compilation of a binding file.
 *
 * <p>All errors are fatal and carry the physical line (1-based) of the
 * statement that caused them. The message has the form
 * {@code "<detail> at line <n>"}; {@link #getDetail()} returns the bare detail.
 */
public abstract class BindingException extends RuntimeException {

    /**
     * The three classes of compile error.
     */
    public enum ErrorKind {
        TOKENIZATION("Tokenization error"),
        STRUCTURAL("Structural error"),
        SEMANTIC("Semantic error");

        private final String displayName;

        ErrorKind(String displayName) {
            this.displayName = displayName;
        }

        public String displayName() {
            return displayName;
        }
    }

    private final int line;
    private final String detail;

    protected BindingException(String detail, int line) {
        super(String.format("%s at line %d", detail, line));
        this.line = line;
        this.detail = detail;
    }

    public abstract ErrorKind kind();

    public int getLine() {
        return line;
    }

    public String getDetail() {
        return detail;
    }
}
