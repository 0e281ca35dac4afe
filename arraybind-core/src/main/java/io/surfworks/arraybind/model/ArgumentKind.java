package io.surfworks.arraybind.model;

public enum ArgumentKind {
    /** Plain C++ value passed through with its declared type. */
    SCALAR,
    /** Dense or sparse array dispatched on at call time. */
    NUMERIC_ARRAY
}
