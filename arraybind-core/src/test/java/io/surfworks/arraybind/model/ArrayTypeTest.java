package io.surfworks.arraybind.model;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArrayTypeTest {

    @Nested
    class Catalog {

        @Test
        void fourteenElementKindsInTwoFlavours() {
            assertEquals(28, ArrayType.values().length);
            long sparse = List.of(ArrayType.values()).stream().filter(ArrayType::isSparse).count();
            assertEquals(14, sparse);
        }

        @Test
        void denseF64() {
            ArrayType t = ArrayType.DENSE_F64;
            assertEquals("dense_f64", t.token());
            assertEquals("double", t.scalarType());
            assertEquals("f64", t.code());
            assertEquals("float64", t.numpyName());
            assertTrue(t.isDense());
            assertEquals(LayoutClass.DENSE, t.layoutClass());
        }

        @Test
        void sparseC128() {
            ArrayType t = ArrayType.SPARSE_C128;
            assertEquals("sparse_c128", t.token());
            assertEquals("std::complex<double>", t.scalarType());
            assertEquals("complex128", t.numpyName());
            assertEquals(LayoutClass.SPARSE, t.layoutClass());
        }

        @ParameterizedTest
        @EnumSource(ArrayType.class)
        void tokenRoundTrips(ArrayType type) {
            assertEquals(type, ArrayType.fromToken(type.token()).orElseThrow());
            assertEquals(type.isSparse(), type.token().startsWith("sparse_"));
        }

        @ParameterizedTest
        @EnumSource(ArrayType.class)
        void denseAndSparseTwinsShareScalarType(ArrayType type) {
            String twin = type.isSparse()
                    ? type.token().replace("sparse_", "dense_")
                    : type.token().replace("dense_", "sparse_");
            assertEquals(type.scalarType(), ArrayType.fromToken(twin).orElseThrow().scalarType());
        }
    }

    @Nested
    class Lookup {

        @Test
        void ignoresCase() {
            assertEquals(ArrayType.SPARSE_I32, ArrayType.fromToken("Sparse_I32").orElseThrow());
        }

        @ParameterizedTest
        @ValueSource(strings = {"int", "double", "dense", "dense_f16", "npe_matches(a)", ""})
        void unknownTokens(String token) {
            assertTrue(ArrayType.fromToken(token).isEmpty());
        }

        @Test
        void nullToken() {
            assertTrue(ArrayType.fromToken(null).isEmpty());
        }
    }

    @Nested
    class Layouts {

        @Test
        void sparseNeverUnordered() {
            assertTrue(ArrayType.SPARSE_F32.supports(Layout.COLUMN_MAJOR));
            assertTrue(ArrayType.SPARSE_F32.supports(Layout.ROW_MAJOR));
            assertFalse(ArrayType.SPARSE_F32.supports(Layout.UNORDERED));
        }

        @ParameterizedTest
        @EnumSource(Layout.class)
        void denseTakesEveryLayout(Layout layout) {
            assertTrue(ArrayType.DENSE_U16.supports(layout));
        }

        @Test
        void layoutOrderAndSuffixes() {
            assertEquals(List.of(Layout.COLUMN_MAJOR, Layout.ROW_MAJOR, Layout.UNORDERED), List.of(Layout.values()));
            assertEquals("_cm", Layout.COLUMN_MAJOR.suffix());
            assertEquals("RowMajor", Layout.ROW_MAJOR.storageOrder());
            assertFalse(Layout.UNORDERED.isAligned());
        }
    }
}
