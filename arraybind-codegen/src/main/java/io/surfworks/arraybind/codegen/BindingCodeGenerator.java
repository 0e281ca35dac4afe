package io.surfworks.arraybind.codegen;

import io.surfworks.arraybind.codegen.DispatchBranch.GroupChoice;
import io.surfworks.arraybind.model.Argument;
import io.surfworks.arraybind.model.ArrayType;
import io.surfworks.arraybind.model.Binding;
import io.surfworks.arraybind.model.Layout;
import io.surfworks.arraybind.model.TypeGroup;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Emits the C++ pybind11 extension source for an analyzed binding.
 *
 * <p>The output contains, in order:
 * <ul>
 *   <li>the {@code npe.h} prelude and the binding's preamble, verbatim</li>
 *   <li>{@code callit_<name>}, a template over the Eigen map, matrix and
 *       scalar type of each array argument, holding the body text</li>
 *   <li>{@code pybind_output_fun_<unit>}, registering a lambda that probes every
 *       array argument, checks each type group, then dispatches to one
 *       instantiation of {@code callit_<name>} per {@link DispatchBranch}</li>
 * </ul>
 * The generated text only depends on the binding and the unit name.
 */
public final class BindingCodeGenerator {

    /**
     * Result of generating one binding.
     *
     * @param unitName    suffix of the registration function name
     * @param text        the generated C++ source
     * @param branchCount number of dispatch branches emitted
     */
    public record GeneratedSource(String unitName, String text, int branchCount) {}

    static final String FOR_REAL_DEFINE = "__NPE_FOR_REAL__";
    static final String PRIVATE_PREFIX = "_NPE_PY_BINDING_";
    static final String NS = "npe::detail";

    private static final Pattern UNIT_NAME = Pattern.compile("[A-Za-z0-9_]+");

    private final StringBuilder sb = new StringBuilder();
    private int indent = 0;

    public BindingCodeGenerator() {}

    /**
     * Generates the extension source.
     *
     * @param unitName identifier fragment naming the registration function,
     *                 usually derived from the input file name
     * @throws IllegalStateException    if the binding has not been analyzed
     * @throws IllegalArgumentException if {@code unitName} is not an identifier fragment
     */
    public GeneratedSource generate(Binding binding, String unitName) {
        if (!binding.isAnalyzed()) {
            throw new IllegalStateException("binding " + binding.name() + " has not been analyzed");
        }
        if (!UNIT_NAME.matcher(unitName).matches()) {
            throw new IllegalArgumentException("unit name must match " + UNIT_NAME.pattern() + ", got " + unitName);
        }

        sb.setLength(0);
        indent = 0;

        List<DispatchBranch> branches = BranchEnumerator.enumerate(binding);

        emitLine("#define %s", FOR_REAL_DEFINE);
        emitLine("#include <npe.h>");
        sb.append(binding.preamble());
        emitLine("");

        emitGenericEntryPoint(binding);
        emitLine("");

        emitLine("void pybind_output_fun_%s(pybind11::module& m) {", unitName);
        indent++;
        emitLine("m.def(\"%s\", [](%s) {", binding.name(), lambdaParameters(binding));
        indent++;

        if (binding.hasArrayArguments()) {
            for (Argument arg : binding.arrayArguments()) {
                emitProbe(arg);
            }
            for (TypeGroup group : binding.groups()) {
                emitGroupGuards(group);
            }
            emitDispatch(binding, branches);
        } else {
            emitLine("{");
            indent++;
            emitLine("return %s(%s);", entryPointName(binding), callArguments(binding));
            indent--;
            emitLine("}");
        }

        indent--;
        emitLine("}%s);", registrationTail(binding));
        indent--;
        emitLine("}");

        return new GeneratedSource(unitName, sb.toString(), branches.size());
    }

    // ==================== Generic entry point ====================

    private void emitGenericEntryPoint(Binding binding) {
        if (binding.hasArrayArguments()) {
            List<String> params = new ArrayList<>();
            for (Argument arg : binding.arrayArguments()) {
                params.add("typename npe_Map_" + arg.name());
                params.add("typename npe_Matrix_" + arg.name());
                params.add("typename npe_Scalar_" + arg.name());
            }
            emitLine("template <%s>", String.join(", ", params));
        }

        List<String> params = new ArrayList<>();
        for (Argument arg : binding.arguments()) {
            String type = arg.isArray() ? "npe_Map_" + arg.name() : arg.scalarType();
            params.add(type + " " + arg.name());
        }
        emitLine("static auto %s(%s) {", entryPointName(binding), String.join(", ", params));
        // Body is copied without re-indentation
        sb.append(binding.body());
        emitLine("}");
    }

    // ==================== Probing and guards ====================

    private void emitProbe(Argument arg) {
        String name = arg.name();
        emitLine("const char %s = %s.dtype().type();", typeCharVar(name), name);
        emitLine("ssize_t %s = 0;", shapeVar(name, 0));
        emitLine("ssize_t %s = 0;", shapeVar(name, 1));
        emitLine("if (%s.ndim() == 1) {", name);
        indent++;
        emitLine("%s = %s.shape()[0];", shapeVar(name, 0), name);
        emitLine("%s = %s.shape()[0] == 0 ? 0 : 1;", shapeVar(name, 1), name);
        indent--;
        emitLine("} else if (%s.ndim() == 2) {", name);
        indent++;
        emitLine("%s = %s.shape()[0];", shapeVar(name, 0), name);
        emitLine("%s = %s.shape()[1];", shapeVar(name, 1), name);
        indent--;
        emitLine("} else if (%s.ndim() > 2) {", name);
        indent++;
        emitLine("throw std::invalid_argument(\"Argument %s has invalid number of dimensions. Must be 1 or 2.\");",
                name);
        indent--;
        emitLine("}");
        emitLine("const %s::StorageOrder %s = (%s.flags() & NPY_ARRAY_F_CONTIGUOUS) ? %s::ColMajor : "
                        + "(%s.flags() & NPY_ARRAY_C_CONTIGUOUS ? %s::RowMajor : %s::NoOrder);",
                NS, storageOrderVar(name), name, NS, name, NS, NS);
        emitLine("const int %s = %s::get_type_id(%s::is_sparse<decltype(%s)>::value, %s, %s);",
                typeIdVar(name), NS, NS, name, typeCharVar(name), storageOrderVar(name));
    }

    private void emitGroupGuards(TypeGroup group) {
        String rep = group.representative();

        List<String> mismatches = new ArrayList<>();
        for (ArrayType type : group.candidateTypes()) {
            String check = typeCharVar(rep) + " != " + NS + "::NumpyTypeChar::char_" + type.code();
            if (!mismatches.contains(check)) {
                mismatches.add(check);
            }
        }
        String allowed = group.candidateTypes().stream()
                .map(ArrayType::numpyName)
                .distinct()
                .collect(Collectors.joining(", "));

        emitLine("if (%s) {", String.join(" && ", mismatches));
        indent++;
        emitLine("std::string err_msg = std::string(\"Invalid type (\") + %s::type_to_str(%s) + "
                        + "std::string(\") for argument '%s'. Expected one of [%s].\");",
                NS, typeCharVar(rep), rep, allowed);
        emitLine("throw std::invalid_argument(err_msg);");
        indent--;
        emitLine("}");

        for (String member : group.members().subList(1, group.members().size())) {
            emitLine("if (%s != %s) {", typeIdVar(rep), typeIdVar(member));
            indent++;
            emitLine("std::string err_msg = std::string(\"Invalid type (\") + %s::type_to_str(%s) + "
                            + "std::string(\") for argument '%s'. Expected it to match argument '%s' which is of type \") + "
                            + "%s::type_to_str(%s) + std::string(\".\");",
                    NS, typeCharVar(member), member, rep, NS, typeCharVar(rep));
            emitLine("throw std::invalid_argument(err_msg);");
            indent--;
            emitLine("}");
        }
    }

    // ==================== Dispatch ====================

    private void emitDispatch(Binding binding, List<DispatchBranch> branches) {
        for (DispatchBranch branch : branches) {
            String condition = branch.choices().stream()
                    .map(c -> typeIdVar(c.group().representative()) + " == " + NS + "::TypeId::" + c.typeIdName())
                    .collect(Collectors.joining(" && "));
            emitLine("%sif (%s) {", branch.index() == 0 ? "" : "} else ", condition);
            indent++;
            emitBranchBody(binding, branch);
            indent--;
        }
        emitLine("} else {");
        indent++;
        emitLine("throw std::invalid_argument(\"No dispatch branch matched the argument types of %s. "
                + "This should never happen.\");", binding.name());
        indent--;
        emitLine("}");
    }

    private void emitBranchBody(Binding binding, DispatchBranch branch) {
        for (Argument arg : binding.arrayArguments()) {
            GroupChoice choice = branch.choiceFor(binding.groupOf(arg));
            emitTypedefs(arg.name(), choice.type(), choice.layout());
        }

        List<String> templateArgs = new ArrayList<>();
        for (Argument arg : binding.arrayArguments()) {
            templateArgs.add("Map_" + arg.name());
            templateArgs.add("Matrix_" + arg.name());
            templateArgs.add("Scalar_" + arg.name());
        }
        emitLine("return %s<%s>(%s);", entryPointName(binding), String.join(", ", templateArgs),
                callArguments(binding));
    }

    private void emitTypedefs(String name, ArrayType type, Layout layout) {
        String scalar = type.scalarType();
        String order = NS + "::StorageOrder::" + layout.storageOrder();

        emitLine("typedef %s Scalar_%s;", scalar, name);
        if (type.isSparse()) {
            emitLine("typedef Eigen::SparseMatrix<%s, %s, int> Matrix_%s;", scalar, order, name);
            emitRaw("#if EIGEN_WORLD_VERSION == 3 && EIGEN_MAJOR_VERSION <= 2");
            emitLine("typedef Eigen::MappedSparseMatrix<%s, %s, int> Map_%s;", scalar, order, name);
            emitRaw("#elif (EIGEN_WORLD_VERSION == 3 && EIGEN_MAJOR_VERSION > 2) || (EIGEN_WORLD_VERSION > 3)");
            emitLine("typedef Eigen::Map<Matrix_%s> Map_%s;", name, name);
            emitRaw("#endif");
        } else {
            String matrix = "Eigen::Matrix<" + scalar + ", Eigen::Dynamic, Eigen::Dynamic, " + order + ">";
            String alignment = NS + "::Alignment::" + (layout.isAligned() ? "Aligned" : "Unaligned");
            emitLine("typedef %s Matrix_%s;", matrix, name);
            emitLine("typedef Eigen::Map<%s, %s> Map_%s;", matrix, alignment, name);
        }
    }

    // ==================== Signatures ====================

    private static String lambdaParameters(Binding binding) {
        List<String> params = new ArrayList<>();
        for (Argument arg : binding.arguments()) {
            String type;
            if (arg.isSparse()) {
                type = "npe::sparse_array";
            } else if (arg.isDense()) {
                type = "pybind11::array";
            } else {
                type = arg.scalarType();
            }
            params.add(type + " " + arg.name());
        }
        return String.join(", ", params);
    }

    private static String callArguments(Binding binding) {
        List<String> values = new ArrayList<>();
        for (Argument arg : binding.arguments()) {
            String name = arg.name();
            if (arg.isSparse()) {
                values.add(name + ".as_eigen<Matrix_" + name + ">()");
            } else if (arg.isDense()) {
                values.add("Map_" + name + "((Scalar_" + name + "*) " + name + ".data(), "
                        + shapeVar(name, 0) + ", " + shapeVar(name, 1) + ")");
            } else {
                values.add(name);
            }
        }
        return String.join(", ", values);
    }

    private static String registrationTail(Binding binding) {
        StringBuilder tail = new StringBuilder();
        binding.doc().ifPresent(doc -> tail.append(", ").append(doc));
        for (Argument arg : binding.arguments()) {
            tail.append(", pybind11::arg(\"").append(arg.name()).append("\")");
            arg.defaultValue().ifPresent(value -> tail.append("=").append(value));
        }
        return tail.toString();
    }

    static String entryPointName(Binding binding) {
        return "callit_" + binding.name();
    }

    static String typeCharVar(String argument) {
        return PRIVATE_PREFIX + argument + "_type_s";
    }

    static String storageOrderVar(String argument) {
        return PRIVATE_PREFIX + argument + "_so";
    }

    static String typeIdVar(String argument) {
        return PRIVATE_PREFIX + argument + "_t_id";
    }

    static String shapeVar(String argument, int dim) {
        return PRIVATE_PREFIX + argument + "_shape_" + dim;
    }

    // ==================== Output ====================

    private void emitLine(String format, Object... args) {
        String line = args.length == 0 ? format : String.format(format, args);
        if (!line.isEmpty()) {
            for (int i = 0; i < indent; i++) {
                sb.append("    ");
            }
        }
        sb.append(line).append("\n");
    }

    /**
     * Preprocessor lines always start in column 0.
     */
    private void emitRaw(String line) {
        sb.append(line).append("\n");
    }
}
