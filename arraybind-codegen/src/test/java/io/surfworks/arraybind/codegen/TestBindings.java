package io.surfworks.arraybind.codegen;

import io.surfworks.arraybind.dsl.BindingParser;
import io.surfworks.arraybind.model.Binding;
import io.surfworks.arraybind.semantic.BindingAnalyzer;

/**
 * Builds analyzed bindings for generator tests.
 */
final class TestBindings {

    private TestBindings() {
    }

    static Binding analyzed(String source) {
        Binding binding = BindingParser.parse(source);
        new BindingAnalyzer().analyze(binding);
        return binding;
    }

    /**
     * A binding named {@code f} with the given declarations and a one-line body.
     */
    static Binding function(String declarations) {
        return analyzed("npe_function(f)\n" + declarations + "npe_begin_code()\n    return 0;\nnpe_end_code()\n");
    }
}
