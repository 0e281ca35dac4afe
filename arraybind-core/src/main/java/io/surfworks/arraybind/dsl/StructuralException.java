package io.surfworks.arraybind.dsl;

/**
 * A statement in the wrong phase, a missing phase terminator, a repeated
 * documentation statement, or input that ends before the body terminator.
 */
public class StructuralException extends BindingException {

    public StructuralException(String detail, int line) {
        super(detail, line);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.STRUCTURAL;
    }
}
