package io.surfworks.arraybind.semantic;

import io.surfworks.arraybind.model.Argument;
import io.surfworks.arraybind.model.ArrayType;
import io.surfworks.arraybind.model.Binding;
import io.surfworks.arraybind.model.TypeGroup;

import java.util.logging.Logger;

/**
 * Final validation pass over a parsed binding.
 *
 * <p>Performs, in order:
 * <ul>
 *   <li>Homogeneity: the array types an argument lists must be all dense or all sparse</li>
 *   <li>Resolution: every {@code npe_matches} argument's group must have candidate types</li>
 *   <li>Classification: each array argument is marked dense or sparse</li>
 * </ul>
 * and then marks the binding analyzed. Fails on the first error.
 */
public final class BindingAnalyzer {

    private static final Logger LOG = Logger.getLogger(BindingAnalyzer.class.getName());

    public BindingAnalyzer() {}

    /**
     * Validates the binding and assigns layout classes.
     *
     * @throws SemanticException     on the first invalid argument
     * @throws IllegalStateException if the binding was already analyzed
     */
    public void analyze(Binding binding) {
        if (binding.isAnalyzed()) {
            throw new IllegalStateException("binding " + binding.name() + " was already analyzed");
        }

        for (Argument arg : binding.arguments()) {
            if (arg.isArray() && !arg.isMatches()) {
                checkHomogeneous(arg, binding.groupOf(arg));
            }
        }

        for (Argument arg : binding.arguments()) {
            if (!arg.isArray()) {
                continue;
            }
            TypeGroup group = binding.groupOf(arg);
            if (!group.isResolved()) {
                throw new SemanticException("Input argument `" + arg.name() + "` was declared with type "
                        + arg.typeTokens().get(0) + " but was unmatched with an array type", arg.line());
            }
            arg.assignLayoutClass(group.candidateTypes().get(0).layoutClass());
        }

        binding.markAnalyzed();
        LOG.fine("Analyzed binding " + binding.name() + ": " + binding.arguments().size() + " arguments, "
                + binding.groups().size() + " type groups");
    }

    private static void checkHomogeneous(Argument arg, TypeGroup group) {
        boolean sparse = group.isSparse();
        for (ArrayType type : group.candidateTypes()) {
            if (type.isSparse() != sparse) {
                throw new SemanticException("Input argument `" + arg.name()
                        + "` has a mix of sparse and dense types", arg.line());
            }
        }
    }
}
