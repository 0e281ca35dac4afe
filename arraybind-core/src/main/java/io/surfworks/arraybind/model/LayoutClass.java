package io.surfworks.arraybind.model;

/**
 * Whether an argument is bound as a dense array or a sparse matrix.
 * Scalars, and array arguments not yet analyzed, stay {@code UNRESOLVED}.
 */
public enum LayoutClass {
    DENSE,
    SPARSE,
    UNRESOLVED
}
