package io.surfworks.arraybind.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Array type identifiers accepted in argument statements.
 *
 * <p>Each element kind exists in a dense (NumPy array) and a sparse
 * (SciPy CSC/CSR matrix) flavour. An entry carries:
 * <ul>
 *   <li>the DSL token, e.g. {@code dense_f64}</li>
 *   <li>the C++ scalar type emitted for it, e.g. {@code double}</li>
 *   <li>the short code used by the runtime type-char enum, e.g. {@code f64}</li>
 *   <li>the NumPy dtype name shown in error messages, e.g. {@code float64}</li>
 * </ul>
 */
public enum ArrayType {

    // Dense types
    DENSE_F32("float", "f32", "float32", false),
    DENSE_F64("double", "f64", "float64", false),
    DENSE_F128("__float128", "f128", "float128", false),
    DENSE_I8("std::int8_t", "i8", "int8", false),
    DENSE_I16("std::int16_t", "i16", "int16", false),
    DENSE_I32("std::int32_t", "i32", "int32", false),
    DENSE_I64("std::int64_t", "i64", "int64", false),
    DENSE_U8("std::uint8_t", "u8", "uint8", false),
    DENSE_U16("std::uint16_t", "u16", "uint16", false),
    DENSE_U32("std::uint32_t", "u32", "uint32", false),
    DENSE_U64("std::uint64_t", "u64", "uint64", false),
    DENSE_C64("std::complex<float>", "c64", "complex64", false),
    DENSE_C128("std::complex<double>", "c128", "complex128", false),
    DENSE_C256("std::complex<__float128>", "c256", "complex256", false),

    // Sparse types
    SPARSE_F32("float", "f32", "float32", true),
    SPARSE_F64("double", "f64", "float64", true),
    SPARSE_F128("__float128", "f128", "float128", true),
    SPARSE_I8("std::int8_t", "i8", "int8", true),
    SPARSE_I16("std::int16_t", "i16", "int16", true),
    SPARSE_I32("std::int32_t", "i32", "int32", true),
    SPARSE_I64("std::int64_t", "i64", "int64", true),
    SPARSE_U8("std::uint8_t", "u8", "uint8", true),
    SPARSE_U16("std::uint16_t", "u16", "uint16", true),
    SPARSE_U32("std::uint32_t", "u32", "uint32", true),
    SPARSE_U64("std::uint64_t", "u64", "uint64", true),
    SPARSE_C64("std::complex<float>", "c64", "complex64", true),
    SPARSE_C128("std::complex<double>", "c128", "complex128", true),
    SPARSE_C256("std::complex<__float128>", "c256", "complex256", true);

    private final String scalarType;
    private final String code;
    private final String numpyName;
    private final boolean sparse;

    ArrayType(String scalarType, String code, String numpyName, boolean sparse) {
        this.scalarType = scalarType;
        this.code = code;
        this.numpyName = numpyName;
        this.sparse = sparse;
    }

    /**
     * The DSL token, e.g. {@code sparse_i32}.
     */
    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * C++ scalar type of one element.
     */
    public String scalarType() {
        return scalarType;
    }

    public String code() {
        return code;
    }

    public String numpyName() {
        return numpyName;
    }

    public boolean isSparse() {
        return sparse;
    }

    public boolean isDense() {
        return !sparse;
    }

    public LayoutClass layoutClass() {
        return sparse ? LayoutClass.SPARSE : LayoutClass.DENSE;
    }

    /**
     * Layouts an argument of this type can arrive in. Sparse matrices are
     * either CSC or CSR, so they never take the unordered layout.
     */
    public boolean supports(Layout layout) {
        return !(sparse && layout == Layout.UNORDERED);
    }

    /**
     * Looks up a DSL token, ignoring case.
     */
    public static Optional<ArrayType> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String upper = token.trim().toUpperCase(Locale.ROOT);
        for (ArrayType type : values()) {
            if (type.name().equals(upper)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
