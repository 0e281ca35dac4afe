package io.surfworks.arraybind.codegen;

import io.surfworks.arraybind.codegen.DispatchBranch.GroupChoice;
import io.surfworks.arraybind.model.ArrayType;
import io.surfworks.arraybind.model.Binding;
import io.surfworks.arraybind.model.Layout;
import io.surfworks.arraybind.model.TypeGroup;

import java.util.ArrayList;
import java.util.List;

/**
 * Expands the type groups of an analyzed binding into dispatch branches.
 *
 * <p>Each group contributes the product of its candidate types and the three
 * layouts, minus sparse × unordered. Groups choose independently, so the
 * branches are the Cartesian product over groups. Order: the first group
 * varies slowest; within a group, candidate type order first, then
 * column-major, row-major, unordered.
 */
public final class BranchEnumerator {

    private BranchEnumerator() {
    }

    /**
     * All branches in emission order. A binding without array arguments has
     * exactly one branch with no choices.
     *
     * @throws IllegalStateException if the binding has not been analyzed
     */
    public static List<DispatchBranch> enumerate(Binding binding) {
        requireAnalyzed(binding);

        List<List<GroupChoice>> perGroup = new ArrayList<>();
        for (TypeGroup group : binding.groups()) {
            perGroup.add(choicesFor(group));
        }

        List<DispatchBranch> branches = new ArrayList<>();
        collect(perGroup, 0, new ArrayList<>(), branches);
        return List.copyOf(branches);
    }

    /**
     * Number of branches {@link #enumerate} yields: the product over groups of
     * {@code 3 * types - sparseTypes}.
     */
    public static long branchCount(Binding binding) {
        requireAnalyzed(binding);
        long count = 1;
        for (TypeGroup group : binding.groups()) {
            count *= 3L * group.candidateTypes().size() - group.sparseTypeCount();
        }
        return count;
    }

    static List<GroupChoice> choicesFor(TypeGroup group) {
        List<GroupChoice> choices = new ArrayList<>();
        for (ArrayType type : group.candidateTypes()) {
            for (Layout layout : Layout.values()) {
                if (type.supports(layout)) {
                    choices.add(new GroupChoice(group, type, layout));
                }
            }
        }
        return choices;
    }

    private static void collect(List<List<GroupChoice>> perGroup, int depth,
                                List<GroupChoice> prefix, List<DispatchBranch> out) {
        if (depth == perGroup.size()) {
            out.add(new DispatchBranch(out.size(), prefix));
            return;
        }
        for (GroupChoice choice : perGroup.get(depth)) {
            prefix.add(choice);
            collect(perGroup, depth + 1, prefix, out);
            prefix.remove(prefix.size() - 1);
        }
    }

    private static void requireAnalyzed(Binding binding) {
        if (!binding.isAnalyzed()) {
            throw new IllegalStateException("binding " + binding.name() + " has not been analyzed");
        }
    }
}
