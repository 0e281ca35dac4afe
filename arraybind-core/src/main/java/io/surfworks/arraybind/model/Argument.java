package io.surfworks.arraybind.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One declared argument of a binding.
 *
 * <p>Everything except {@link #layoutClass()} is fixed when the binding is
 * built. The layout class of an array argument is assigned once by semantic
 * analysis; after the owning binding is marked analyzed it can no longer change.
 */
public final class Argument {

    private final String name;
    private final int line;
    private final ArgumentKind kind;
    private final List<String> typeTokens;
    private final String scalarType;
    private final String matchesName;
    private final String defaultValue;
    private final int groupIndex;

    private LayoutClass layoutClass = LayoutClass.UNRESOLVED;
    private boolean frozen;

    private Argument(String name, int line, ArgumentKind kind, List<String> typeTokens,
                     String scalarType, String matchesName, String defaultValue, int groupIndex) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.line = line;
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.typeTokens = List.copyOf(typeTokens);
        this.scalarType = scalarType;
        this.matchesName = matchesName;
        this.defaultValue = defaultValue;
        this.groupIndex = groupIndex;
    }

    /**
     * A scalar argument whose declared type text is passed through verbatim.
     */
    public static Argument scalar(String name, int line, String scalarType, String defaultValue) {
        Objects.requireNonNull(scalarType, "scalarType cannot be null");
        return new Argument(name, line, ArgumentKind.SCALAR, List.of(scalarType),
                scalarType, null, defaultValue, -1);
    }

    /**
     * An array argument that belongs to the type group at {@code groupIndex}.
     *
     * @param matchesName the argument named in {@code npe_matches(...)}, or null
     *                    if the argument listed its own array types
     */
    public static Argument array(String name, int line, List<String> typeTokens,
                                 String matchesName, String defaultValue, int groupIndex) {
        if (groupIndex < 0) {
            throw new IllegalArgumentException("array argument " + name + " needs a type group");
        }
        return new Argument(name, line, ArgumentKind.NUMERIC_ARRAY, typeTokens,
                null, matchesName, defaultValue, groupIndex);
    }

    public String name() {
        return name;
    }

    /**
     * Source line of the declaring statement.
     */
    public int line() {
        return line;
    }

    public ArgumentKind kind() {
        return kind;
    }

    public boolean isArray() {
        return kind == ArgumentKind.NUMERIC_ARRAY;
    }

    /**
     * Type tokens exactly as declared (after tokenization).
     */
    public List<String> typeTokens() {
        return typeTokens;
    }

    /**
     * Declared C++ type of a scalar argument; null for arrays.
     */
    public String scalarType() {
        return scalarType;
    }

    public boolean isMatches() {
        return matchesName != null;
    }

    public Optional<String> matchesName() {
        return Optional.ofNullable(matchesName);
    }

    public boolean isDefault() {
        return defaultValue != null;
    }

    /**
     * Unevaluated default-value expression of an {@code npe_default_arg}.
     */
    public Optional<String> defaultValue() {
        return Optional.ofNullable(defaultValue);
    }

    /**
     * Index of the owning type group in {@link Binding#groups()}, or -1 for scalars.
     */
    public int groupIndex() {
        return groupIndex;
    }

    public LayoutClass layoutClass() {
        return layoutClass;
    }

    public boolean isSparse() {
        return layoutClass == LayoutClass.SPARSE;
    }

    public boolean isDense() {
        return layoutClass == LayoutClass.DENSE;
    }

    /**
     * Records the dense/sparse classification found by analysis.
     *
     * @throws IllegalStateException if the binding was already marked analyzed
     */
    public void assignLayoutClass(LayoutClass layoutClass) {
        if (frozen) {
            throw new IllegalStateException("argument " + name + " belongs to an analyzed binding");
        }
        if (kind == ArgumentKind.SCALAR && layoutClass != LayoutClass.UNRESOLVED) {
            throw new IllegalStateException("scalar argument " + name + " has no layout class");
        }
        this.layoutClass = Objects.requireNonNull(layoutClass);
    }

    void freeze() {
        frozen = true;
    }

    @Override
    public String toString() {
        return String.format("Argument[%s %s %s line=%d]", name, kind, typeTokens, line);
    }
}
