package io.surfworks.arraybind.model;

/**
 * Memory layouts a runtime array can be detected in, in branch emission order.
 */
public enum Layout {
    COLUMN_MAJOR("_cm", "ColMajor", true),
    ROW_MAJOR("_rm", "RowMajor", true),
    UNORDERED("_x", "NoOrder", false);

    private final String suffix;
    private final String storageOrder;
    private final boolean aligned;

    Layout(String suffix, String storageOrder, boolean aligned) {
        this.suffix = suffix;
        this.storageOrder = storageOrder;
        this.aligned = aligned;
    }

    /**
     * Suffix appended to an array type token to form a runtime type id,
     * e.g. {@code dense_f32_cm}.
     */
    public String suffix() {
        return suffix;
    }

    /**
     * Name of the matching {@code StorageOrder} enumerator.
     */
    public String storageOrder() {
        return storageOrder;
    }

    public boolean isAligned() {
        return aligned;
    }
}
