package io.surfworks.arraybind.dsl;

/**
 * Malformed statement syntax: unbalanced parentheses, an unterminated
 * statement or literal, too many arguments, or text after the closing parenthesis.
 */
public class TokenizationException extends BindingException {

    public TokenizationException(String detail, int line) {
        super(detail, line);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TOKENIZATION;
    }
}
