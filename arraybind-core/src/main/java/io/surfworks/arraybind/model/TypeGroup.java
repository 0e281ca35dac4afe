package io.surfworks.arraybind.model;

import java.util.List;

/**
 * Arguments that share one element type and one layout at call time.
 *
 * @param index          position in {@link Binding#groups()}
 * @param members        member argument names in join order; the first is the
 *                       representative tested by dispatch guards
 * @param candidateTypes array types the group may take, in declaration order
 */
public record TypeGroup(int index, List<String> members, List<ArrayType> candidateTypes) {

    public TypeGroup {
        members = List.copyOf(members);
        candidateTypes = List.copyOf(candidateTypes);
        if (members.isEmpty()) {
            throw new IllegalArgumentException("type group " + index + " has no members");
        }
    }

    public String representative() {
        return members.get(0);
    }

    public boolean isResolved() {
        return !candidateTypes.isEmpty();
    }

    public boolean isSparse() {
        return isResolved() && candidateTypes.get(0).isSparse();
    }

    public long sparseTypeCount() {
        return candidateTypes.stream().filter(ArrayType::isSparse).count();
    }
}
