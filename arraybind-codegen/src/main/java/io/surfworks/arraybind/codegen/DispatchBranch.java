package io.surfworks.arraybind.codegen;

import io.surfworks.arraybind.model.ArrayType;
import io.surfworks.arraybind.model.Layout;
import io.surfworks.arraybind.model.TypeGroup;

import java.util.List;

/**
 * One concretely-typed dispatch path: a fixed (type, layout) choice for every type group.
 *
 * @param index   position in emission order, starting at 0
 * @param choices one choice per group, in group order
 */
public record DispatchBranch(int index, List<GroupChoice> choices) {

    public DispatchBranch {
        choices = List.copyOf(choices);
    }

    /**
     * The element type and layout chosen for one group.
     */
    public record GroupChoice(TypeGroup group, ArrayType type, Layout layout) {

        public GroupChoice {
            if (!type.supports(layout)) {
                throw new IllegalArgumentException(type.token() + " cannot take layout " + layout);
            }
        }

        /**
         * Name of the runtime type-id enumerator, e.g. {@code dense_f32_cm}.
         */
        public String typeIdName() {
            return type.token() + layout.suffix();
        }
    }

    public GroupChoice choiceFor(TypeGroup group) {
        return choices.get(group.index());
    }
}
