package io.surfworks.arraybind.codegen;

import io.surfworks.arraybind.codegen.DispatchBranch.GroupChoice;
import io.surfworks.arraybind.model.Argument;
import io.surfworks.arraybind.model.ArrayType;
import io.surfworks.arraybind.model.Binding;
import io.surfworks.arraybind.model.TypeGroup;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON description of an analyzed binding: its arguments, type groups and
 * dispatch branches.
 *
 * <p>Layout:
 * <pre>
 * {
 *   "function": "name",
 *   "unit": "unit",
 *   "arguments": [{"name", "line", "kind", "type" | "layoutClass" + "group", "matches", "default"}],
 *   "groups": [{"index", "members", "types"}],
 *   "branchCount": n,
 *   "branches": [["dense_f32_cm", ...], ...]
 * }
 * </pre>
 * Optional argument fields are omitted when absent.
 */
public final class BindingReport {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    private final JsonObject root;

    private BindingReport(JsonObject root) {
        this.root = root;
    }

    /**
     * @throws IllegalStateException if the binding has not been analyzed
     */
    public static BindingReport of(Binding binding, String unitName) {
        JsonObject root = new JsonObject();
        root.addProperty("function", binding.name());
        root.addProperty("unit", unitName);

        JsonArray arguments = new JsonArray();
        for (Argument arg : binding.arguments()) {
            arguments.add(describe(arg));
        }
        root.add("arguments", arguments);

        JsonArray groups = new JsonArray();
        for (TypeGroup group : binding.groups()) {
            JsonObject g = new JsonObject();
            g.addProperty("index", group.index());
            g.add("members", GSON.toJsonTree(group.members()));
            JsonArray types = new JsonArray();
            for (ArrayType type : group.candidateTypes()) {
                types.add(type.token());
            }
            g.add("types", types);
            groups.add(g);
        }
        root.add("groups", groups);

        JsonArray branches = new JsonArray();
        for (DispatchBranch branch : BranchEnumerator.enumerate(binding)) {
            JsonArray choices = new JsonArray();
            for (GroupChoice choice : branch.choices()) {
                choices.add(choice.typeIdName());
            }
            branches.add(choices);
        }
        root.addProperty("branchCount", branches.size());
        root.add("branches", branches);

        return new BindingReport(root);
    }

    private static JsonObject describe(Argument arg) {
        JsonObject a = new JsonObject();
        a.addProperty("name", arg.name());
        a.addProperty("line", arg.line());
        a.addProperty("kind", arg.kind().name());
        if (arg.isArray()) {
            a.addProperty("layoutClass", arg.layoutClass().name());
            a.addProperty("group", arg.groupIndex());
        } else {
            a.addProperty("type", arg.scalarType());
        }
        arg.matchesName().ifPresent(m -> a.addProperty("matches", m));
        arg.defaultValue().ifPresent(d -> a.addProperty("default", d));
        return a;
    }

    public JsonObject toJsonObject() {
        return root.deepCopy();
    }

    public String toJson() {
        return GSON.toJson(root);
    }

    public void write(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, toJson() + "\n", StandardCharsets.UTF_8);
    }
}
