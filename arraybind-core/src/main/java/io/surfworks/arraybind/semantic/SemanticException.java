package io.surfworks.arraybind.semantic;

import io.surfworks.arraybind.dsl.BindingException;

/**
 * Invalid argument typing: unknown or disabled array types, sparse and dense
 * types mixed in one group, or an {@code npe_matches} reference that never
 * resolves to an array type.
 */
public class SemanticException extends BindingException {

    public SemanticException(String detail, int line) {
        super(detail, line);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SEMANTIC;
    }
}
