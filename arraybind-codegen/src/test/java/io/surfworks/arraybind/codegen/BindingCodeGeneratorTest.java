package io.surfworks.arraybind.codegen;

import io.surfworks.arraybind.codegen.BindingCodeGenerator.GeneratedSource;
import io.surfworks.arraybind.dsl.BindingParser;
import io.surfworks.arraybind.model.Binding;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.surfworks.arraybind.codegen.TestBindings.analyzed;
import static io.surfworks.arraybind.codegen.TestBindings.function;
import static org.junit.jupiter.api.Assertions.*;

class BindingCodeGeneratorTest {

    private static final String SCALE = """
            npe_function(scale)
            npe_arg(a, dense_f32)
            npe_arg(k, double)
            npe_begin_code()
                return a * k;
            npe_end_code()
            """;

    private static final String SCALE_EXPECTED = """
            #define __NPE_FOR_REAL__
            #include <npe.h>

            template <typename npe_Map_a, typename npe_Matrix_a, typename npe_Scalar_a>
            static auto callit_scale(npe_Map_a a, double k) {
                return a * k;
            }

            void pybind_output_fun_scale_cpp(pybind11::module& m) {
                m.def("scale", [](pybind11::array a, double k) {
                    const char _NPE_PY_BINDING_a_type_s = a.dtype().type();
                    ssize_t _NPE_PY_BINDING_a_shape_0 = 0;
                    ssize_t _NPE_PY_BINDING_a_shape_1 = 0;
                    if (a.ndim() == 1) {
                        _NPE_PY_BINDING_a_shape_0 = a.shape()[0];
                        _NPE_PY_BINDING_a_shape_1 = a.shape()[0] == 0 ? 0 : 1;
                    } else if (a.ndim() == 2) {
                        _NPE_PY_BINDING_a_shape_0 = a.shape()[0];
                        _NPE_PY_BINDING_a_shape_1 = a.shape()[1];
                    } else if (a.ndim() > 2) {
                        throw std::invalid_argument("Argument a has invalid number of dimensions. Must be 1 or 2.");
                    }
                    const npe::detail::StorageOrder _NPE_PY_BINDING_a_so = (a.flags() & NPY_ARRAY_F_CONTIGUOUS) ? npe::detail::ColMajor : (a.flags() & NPY_ARRAY_C_CONTIGUOUS ? npe::detail::RowMajor : npe::detail::NoOrder);
                    const int _NPE_PY_BINDING_a_t_id = npe::detail::get_type_id(npe::detail::is_sparse<decltype(a)>::value, _NPE_PY_BINDING_a_type_s, _NPE_PY_BINDING_a_so);
                    if (_NPE_PY_BINDING_a_type_s != npe::detail::NumpyTypeChar::char_f32) {
                        std::string err_msg = std::string("Invalid type (") + npe::detail::type_to_str(_NPE_PY_BINDING_a_type_s) + std::string(") for argument 'a'. Expected one of [float32].");
                        throw std::invalid_argument(err_msg);
                    }
                    if (_NPE_PY_BINDING_a_t_id == npe::detail::TypeId::dense_f32_cm) {
                        typedef float Scalar_a;
                        typedef Eigen::Matrix<float, Eigen::Dynamic, Eigen::Dynamic, npe::detail::StorageOrder::ColMajor> Matrix_a;
                        typedef Eigen::Map<Eigen::Matrix<float, Eigen::Dynamic, Eigen::Dynamic, npe::detail::StorageOrder::ColMajor>, npe::detail::Alignment::Aligned> Map_a;
                        return callit_scale<Map_a, Matrix_a, Scalar_a>(Map_a((Scalar_a*) a.data(), _NPE_PY_BINDING_a_shape_0, _NPE_PY_BINDING_a_shape_1), k);
                    } else if (_NPE_PY_BINDING_a_t_id == npe::detail::TypeId::dense_f32_rm) {
                        typedef float Scalar_a;
                        typedef Eigen::Matrix<float, Eigen::Dynamic, Eigen::Dynamic, npe::detail::StorageOrder::RowMajor> Matrix_a;
                        typedef Eigen::Map<Eigen::Matrix<float, Eigen::Dynamic, Eigen::Dynamic, npe::detail::StorageOrder::RowMajor>, npe::detail::Alignment::Aligned> Map_a;
                        return callit_scale<Map_a, Matrix_a, Scalar_a>(Map_a((Scalar_a*) a.data(), _NPE_PY_BINDING_a_shape_0, _NPE_PY_BINDING_a_shape_1), k);
                    } else if (_NPE_PY_BINDING_a_t_id == npe::detail::TypeId::dense_f32_x) {
                        typedef float Scalar_a;
                        typedef Eigen::Matrix<float, Eigen::Dynamic, Eigen::Dynamic, npe::detail::StorageOrder::NoOrder> Matrix_a;
                        typedef Eigen::Map<Eigen::Matrix<float, Eigen::Dynamic, Eigen::Dynamic, npe::detail::StorageOrder::NoOrder>, npe::detail::Alignment::Unaligned> Map_a;
                        return callit_scale<Map_a, Matrix_a, Scalar_a>(Map_a((Scalar_a*) a.data(), _NPE_PY_BINDING_a_shape_0, _NPE_PY_BINDING_a_shape_1), k);
                    } else {
                        throw std::invalid_argument("No dispatch branch matched the argument types of scale. This should never happen.");
                    }
                }, pybind11::arg("a"), pybind11::arg("k"));
            }
            """;

    private static final String SHARED_ADD = """
            npe_function(add)
            npe_arg(a, dense_f32, dense_f64)
            npe_arg(b, npe_matches(a))
            npe_begin_code()
                return a + b;
            npe_end_code()
            """;

    private static GeneratedSource generate(Binding binding) {
        return new BindingCodeGenerator().generate(binding, "unit");
    }

    private static int count(String text, String needle) {
        int n = 0;
        for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + needle.length())) {
            n++;
        }
        return n;
    }

    private static List<String> all(String text, String regex) {
        List<String> found = new ArrayList<>();
        Matcher m = Pattern.compile(regex).matcher(text);
        while (m.find()) {
            found.add(m.group(1));
        }
        return found;
    }

    @Nested
    class Golden {

        @Test
        void singleDenseArgumentAndScalar() {
            GeneratedSource source = new BindingCodeGenerator().generate(analyzed(SCALE), "scale_cpp");

            assertEquals(SCALE_EXPECTED, source.text());
            assertEquals(3, source.branchCount());
            assertEquals("scale_cpp", source.unitName());
        }

        @Test
        void outputIsDeterministic() {
            String first = generate(analyzed(SHARED_ADD)).text();
            String second = generate(analyzed(SHARED_ADD)).text();
            assertEquals(first, second);

            BindingCodeGenerator reused = new BindingCodeGenerator();
            Binding binding = analyzed(SHARED_ADD);
            assertEquals(reused.generate(binding, "unit").text(), reused.generate(binding, "unit").text());
        }
    }

    @Nested
    class Dispatch {

        @Test
        void sharedGroupHasSixBranchesOnTheRepresentative() {
            GeneratedSource source = generate(analyzed(SHARED_ADD));

            assertEquals(6, source.branchCount());
            List<String> tested = all(source.text(), "if \\((_NPE_PY_BINDING_\\w+_t_id) == npe::detail::TypeId::");
            assertEquals(6, tested.size());
            assertTrue(tested.stream().allMatch("_NPE_PY_BINDING_a_t_id"::equals));
            assertEquals(List.of("dense_f32_cm", "dense_f32_rm", "dense_f32_x", "dense_f64_cm", "dense_f64_rm", "dense_f64_x"),
                    all(source.text(), "TypeId::(\\w+)\\)"));
        }

        @Test
        void groupMembersShareTypeAndLayoutInEveryBranch() {
            String text = generate(analyzed(SHARED_ADD)).text();

            List<String> scalarsA = all(text, "typedef (.+) Scalar_a;");
            List<String> scalarsB = all(text, "typedef (.+) Scalar_b;");
            List<String> matricesA = all(text, "typedef (.+) Matrix_a;");
            List<String> matricesB = all(text, "typedef (.+) Matrix_b;");
            assertEquals(6, scalarsA.size());
            assertEquals(scalarsA, scalarsB);
            assertEquals(matricesA, matricesB);
        }

        @Test
        void memberGuardComparesTypeIds() {
            String text = generate(analyzed(SHARED_ADD)).text();

            assertTrue(text.contains("if (_NPE_PY_BINDING_a_t_id != _NPE_PY_BINDING_b_t_id) {"));
            assertTrue(text.contains("for argument 'b'. Expected it to match argument 'a' which is of type \")"));
            assertTrue(text.contains("Expected one of [float32, float64]."));
        }

        @Test
        void everyNonRepresentativeMemberIsGuarded() {
            String text = generate(function("npe_arg(a, dense_f32)\nnpe_arg(b, npe_matches(a))\nnpe_arg(c, npe_matches(a))\n")).text();

            assertTrue(text.contains("if (_NPE_PY_BINDING_a_t_id != _NPE_PY_BINDING_b_t_id) {"));
            assertTrue(text.contains("if (_NPE_PY_BINDING_a_t_id != _NPE_PY_BINDING_c_t_id) {"));
        }

        @Test
        void independentGroupsAreTestedTogether() {
            String text = generate(function("npe_arg(x, dense_f64)\nnpe_arg(s, sparse_i32)\n")).text();

            assertTrue(text.contains("if (_NPE_PY_BINDING_x_t_id == npe::detail::TypeId::dense_f64_cm && "
                    + "_NPE_PY_BINDING_s_t_id == npe::detail::TypeId::sparse_i32_cm) {"));
            assertEquals(6, count(text, "_NPE_PY_BINDING_x_t_id == npe::detail::TypeId::"));
        }

        @Test
        void finalElseReportsUnreachableBranch() {
            String text = generate(analyzed(SHARED_ADD)).text();
            assertTrue(text.contains("} else {\n            throw std::invalid_argument(\"No dispatch branch matched"));
        }
    }

    @Nested
    class Sparse {

        @Test
        void sparseArgumentsUseSparseTypes() {
            GeneratedSource source = generate(function("npe_arg(s, sparse_f64)\n"));
            String text = source.text();

            assertEquals(2, source.branchCount());
            assertTrue(text.contains("[](npe::sparse_array s)"));
            assertFalse(text.contains("sparse_f64_x"));
            assertTrue(text.contains("typedef Eigen::SparseMatrix<double, npe::detail::StorageOrder::ColMajor, int> Matrix_s;"));
            assertTrue(text.contains("\n#if EIGEN_WORLD_VERSION == 3 && EIGEN_MAJOR_VERSION <= 2\n"));
            assertTrue(text.contains("typedef Eigen::MappedSparseMatrix<double, npe::detail::StorageOrder::RowMajor, int> Map_s;"));
            assertTrue(text.contains("typedef Eigen::Map<Matrix_s> Map_s;"));
            assertTrue(text.contains("\n#endif\n"));
            assertTrue(text.contains("return callit_f<Map_s, Matrix_s, Scalar_s>(s.as_eigen<Matrix_s>());"));
        }
    }

    @Nested
    class Signatures {

        private static final String MIXED = """
                npe_function(mixed)
                npe_arg(a, dense_f32)
                npe_arg(n, int)
                npe_arg(s, sparse_f32)
                npe_default_arg(tol, double, 1e-6)
                npe_arg(b, npe_matches(a))
                npe_doc("Mixed arguments")
                npe_begin_code()
                    return n;
                npe_end_code()
                """;

        @Test
        void declarationOrderIsPreservedEverywhere() {
            String text = generate(analyzed(MIXED)).text();

            assertTrue(text.contains("template <typename npe_Map_a, typename npe_Matrix_a, typename npe_Scalar_a, "
                    + "typename npe_Map_s, typename npe_Matrix_s, typename npe_Scalar_s, "
                    + "typename npe_Map_b, typename npe_Matrix_b, typename npe_Scalar_b>"));
            assertTrue(text.contains("static auto callit_mixed(npe_Map_a a, int n, npe_Map_s s, double tol, npe_Map_b b) {"));
            assertTrue(text.contains("m.def(\"mixed\", [](pybind11::array a, int n, npe::sparse_array s, double tol, pybind11::array b) {"));
            assertTrue(text.contains("(Map_a((Scalar_a*) a.data(), _NPE_PY_BINDING_a_shape_0, _NPE_PY_BINDING_a_shape_1), n, "
                    + "s.as_eigen<Matrix_s>(), tol, Map_b((Scalar_b*) b.data(), _NPE_PY_BINDING_b_shape_0, _NPE_PY_BINDING_b_shape_1));"));
            assertTrue(text.contains("}, \"Mixed arguments\", pybind11::arg(\"a\"), pybind11::arg(\"n\"), pybind11::arg(\"s\"), "
                    + "pybind11::arg(\"tol\")=1e-6, pybind11::arg(\"b\"));"));
        }

        @Test
        void scalarOnlyBindingHasSingleUnguardedCall() {
            GeneratedSource source = generate(function("npe_arg(n, int)\n"));
            String text = source.text();

            assertEquals(1, source.branchCount());
            assertFalse(text.contains("template <"));
            assertTrue(text.contains("static auto callit_f(int n) {"));
            assertTrue(text.contains("[](int n) {"));
            assertTrue(text.contains("return callit_f(n);"));
            assertFalse(text.contains("TypeId::"));
            assertFalse(text.contains("This should never happen"));
        }

        @Test
        void defaultExpressionIsCopiedUnevaluated() {
            String text = generate(function("npe_default_arg(tol, double, 1e-6)\n")).text();

            assertTrue(text.contains("[](double tol) {"));
            assertTrue(text.contains("pybind11::arg(\"tol\")=1e-6);"));
        }

        @Test
        void noArguments() {
            String text = generate(function("")).text();

            assertTrue(text.contains("static auto callit_f() {"));
            assertTrue(text.contains("m.def(\"f\", []() {"));
            assertTrue(text.contains("return callit_f();"));
            assertTrue(text.contains("    });\n}\n"));
        }
    }

    @Nested
    class Passthrough {

        @Test
        void preambleAndBodyAreVerbatim() {
            String source = """
                    #include <Eigen/Core>
                    // keep me
                    npe_function(f)
                    npe_arg(a, dense_f32, dense_i32)
                    npe_begin_code()
                      auto r = a.eval();   // two-space indent
                      return r;
                    npe_end_code()
                    """;
            String text = generate(analyzed(source)).text();

            assertTrue(text.startsWith("#define __NPE_FOR_REAL__\n#include <npe.h>\n#include <Eigen/Core>\n// keep me\n\n"));
            assertTrue(text.contains(") {\n  auto r = a.eval();   // two-space indent\n  return r;\n}\n"));
            assertEquals(1, count(text, "auto r = a.eval();"));
        }

        @Test
        void registrationFunctionUsesUnitName() {
            String text = new BindingCodeGenerator().generate(function(""), "my_binding_cpp").text();
            assertTrue(text.contains("void pybind_output_fun_my_binding_cpp(pybind11::module& m) {"));
        }
    }

    @Nested
    class Contract {

        @Test
        void rejectsUnanalyzedBinding() {
            Binding binding = BindingParser.parse("npe_function(f)\nnpe_begin_code()\nnpe_end_code()\n");
            assertThrows(IllegalStateException.class, () -> generate(binding));
        }

        @Test
        void rejectsBadUnitName() {
            Binding binding = function("");
            assertThrows(IllegalArgumentException.class,
                    () -> new BindingCodeGenerator().generate(binding, "my-file.cpp"));
        }
    }
}
