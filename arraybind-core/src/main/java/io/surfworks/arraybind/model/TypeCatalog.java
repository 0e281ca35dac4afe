package io.surfworks.arraybind.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The array types available to one compilation.
 *
 * <p>{@link #standard()} enables every {@link ArrayType}. Toolchains that lack
 * {@code __float128} exclude the {@code f128}/{@code c256} types through
 * configuration; argument statements naming an excluded type are rejected.
 */
public final class TypeCatalog {

    private static final TypeCatalog STANDARD = new TypeCatalog(EnumSet.allOf(ArrayType.class));

    private final Set<ArrayType> enabled;

    private TypeCatalog(Set<ArrayType> enabled) {
        this.enabled = Collections.unmodifiableSet(enabled);
    }

    public static TypeCatalog standard() {
        return STANDARD;
    }

    /**
     * Returns a catalog without the named tokens.
     *
     * @throws IllegalArgumentException if a token is not an array type
     */
    public static TypeCatalog excluding(Collection<String> tokens) {
        EnumSet<ArrayType> types = EnumSet.allOf(ArrayType.class);
        for (String token : tokens) {
            ArrayType type = ArrayType.fromToken(token)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown array type: " + token));
            types.remove(type);
        }
        return new TypeCatalog(types);
    }

    public boolean isEnabled(ArrayType type) {
        return enabled.contains(Objects.requireNonNull(type));
    }

    public Set<ArrayType> enabledTypes() {
        return enabled;
    }

    /**
     * Tokens of the enabled types, in catalog order.
     */
    public List<String> tokens() {
        return enabled.stream().map(ArrayType::token).collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeCatalog that)) return false;
        return enabled.equals(that.enabled);
    }

    @Override
    public int hashCode() {
        return enabled.hashCode();
    }

    @Override
    public String toString() {
        return "TypeCatalog" + tokens();
    }
}
