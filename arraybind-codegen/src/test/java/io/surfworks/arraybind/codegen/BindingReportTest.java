package io.surfworks.arraybind.codegen;

import io.surfworks.arraybind.dsl.BindingParser;
import io.surfworks.arraybind.model.Binding;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static io.surfworks.arraybind.codegen.TestBindings.function;
import static org.junit.jupiter.api.Assertions.*;

class BindingReportTest {

    @TempDir
    Path tempDir;

    private static JsonObject report(String declarations) {
        return BindingReport.of(function(declarations), "unit_cpp").toJsonObject();
    }

    @Test
    void topLevelFields() {
        JsonObject root = report("npe_arg(a, dense_f32, dense_f64)\nnpe_arg(b, npe_matches(a))\n");

        assertEquals("f", root.get("function").getAsString());
        assertEquals("unit_cpp", root.get("unit").getAsString());
        assertEquals(6, root.get("branchCount").getAsInt());
        assertEquals(6, root.getAsJsonArray("branches").size());
    }

    @Test
    void arrayArgumentFields() {
        JsonArray arguments = report("npe_arg(a, dense_f32)\nnpe_arg(b, npe_matches(a))\n").getAsJsonArray("arguments");

        JsonObject a = arguments.get(0).getAsJsonObject();
        assertEquals("a", a.get("name").getAsString());
        assertEquals(2, a.get("line").getAsInt());
        assertEquals("NUMERIC_ARRAY", a.get("kind").getAsString());
        assertEquals("DENSE", a.get("layoutClass").getAsString());
        assertEquals(0, a.get("group").getAsInt());
        assertFalse(a.has("matches"));
        assertFalse(a.has("type"));

        JsonObject b = arguments.get(1).getAsJsonObject();
        assertEquals("a", b.get("matches").getAsString());
        assertEquals(0, b.get("group").getAsInt());
    }

    @Test
    void scalarArgumentFields() {
        JsonObject tol = report("npe_default_arg(tol, double, 1e-6)\n")
                .getAsJsonArray("arguments").get(0).getAsJsonObject();

        assertEquals("SCALAR", tol.get("kind").getAsString());
        assertEquals("double", tol.get("type").getAsString());
        assertEquals("1e-6", tol.get("default").getAsString());
        assertFalse(tol.has("layoutClass"));
        assertFalse(tol.has("group"));
    }

    @Test
    void groupsListMembersAndTypes() {
        JsonObject group = report("npe_arg(s, sparse_f32, sparse_f64)\nnpe_arg(t, npe_matches(s))\n")
                .getAsJsonArray("groups").get(0).getAsJsonObject();

        assertEquals(0, group.get("index").getAsInt());
        assertEquals("[\"s\",\"t\"]", group.getAsJsonArray("members").toString());
        assertEquals("[\"sparse_f32\",\"sparse_f64\"]", group.getAsJsonArray("types").toString());
    }

    @Test
    void branchesListTypeIdsInDispatchOrder() {
        JsonArray branches = report("npe_arg(s, sparse_f32)\n").getAsJsonArray("branches");

        assertEquals("[[\"sparse_f32_cm\"],[\"sparse_f32_rm\"]]", branches.toString());
    }

    @Test
    void scalarOnlyBindingHasOneEmptyBranch() {
        JsonObject root = report("npe_arg(n, int)\n");

        assertEquals(0, root.getAsJsonArray("groups").size());
        assertEquals(1, root.get("branchCount").getAsInt());
        assertEquals(0, root.getAsJsonArray("branches").get(0).getAsJsonArray().size());
    }

    @Test
    void toJsonObjectReturnsCopy() {
        BindingReport report = BindingReport.of(function("npe_arg(n, int)\n"), "u");
        report.toJsonObject().addProperty("function", "changed");

        assertEquals("f", report.toJsonObject().get("function").getAsString());
    }

    @Test
    void writeCreatesParentDirectories() throws IOException {
        BindingReport report = BindingReport.of(function("npe_arg(a, dense_i8)\n"), "u");
        Path file = tempDir.resolve("reports").resolve("f.json");

        report.write(file);

        String text = Files.readString(file);
        assertTrue(text.endsWith("\n"));
        assertEquals(report.toJsonObject(), JsonParser.parseString(text));
    }

    @Test
    void rejectsUnanalyzedBinding() {
        Binding binding = BindingParser.parse("npe_function(f)\nnpe_arg(a, dense_f32)\nnpe_begin_code()\nnpe_end_code()\n");
        assertThrows(IllegalStateException.class, () -> BindingReport.of(binding, "u"));
    }
}
