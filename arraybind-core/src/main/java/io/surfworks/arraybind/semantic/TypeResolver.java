package io.surfworks.arraybind.semantic;

import io.surfworks.arraybind.dsl.Identifiers;
import io.surfworks.arraybind.dsl.StatementKind;
import io.surfworks.arraybind.dsl.StatementTokenizer;
import io.surfworks.arraybind.model.ArgumentKind;
import io.surfworks.arraybind.model.ArrayType;
import io.surfworks.arraybind.model.TypeCatalog;
import io.surfworks.arraybind.model.TypeGroup;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the type tokens of each argument statement as it is parsed and
 * maintains the type-group arena.
 *
 * <p>Groups are keyed by argument name. An {@code npe_matches(other)} token
 * that names an argument not seen yet allocates a placeholder group under
 * both names; the placeholder receives its candidate types when
 * {@code other}'s own statement lists them. Whether every placeholder was
 * filled is checked afterwards by {@link BindingAnalyzer}.
 */
public final class TypeResolver {

    /**
     * Outcome of resolving one argument statement.
     *
     * @param kind        scalar or array
     * @param scalarType  declared C++ type text of a scalar, else null
     * @param matchesName argument named by {@code npe_matches}, else null
     * @param arrayTypes  array types listed by the statement itself (empty for scalars and matches)
     */
    public record Resolution(ArgumentKind kind, String scalarType, String matchesName, List<ArrayType> arrayTypes) {
        public Resolution {
            arrayTypes = List.copyOf(arrayTypes);
        }
    }

    /**
     * The frozen groups, with the group index of every declared array argument.
     */
    public record ResolvedGroups(List<TypeGroup> groups, Map<String, Integer> groupIndexByArgument) {
        public int indexOf(String argumentName) {
            Integer index = groupIndexByArgument.get(argumentName);
            if (index == null) {
                throw new IllegalArgumentException("argument " + argumentName + " has no type group");
            }
            return index;
        }
    }

    private static final class GroupSlot {
        final List<String> members = new ArrayList<>();
        final List<ArrayType> types = new ArrayList<>();
    }

    private final TypeCatalog catalog;
    private final StatementTokenizer tokenizer;
    private final List<GroupSlot> slots = new ArrayList<>();
    private final Map<String, GroupSlot> groupByName = new HashMap<>();

    public TypeResolver(TypeCatalog catalog, StatementTokenizer tokenizer) {
        this.catalog = Objects.requireNonNull(catalog, "catalog cannot be null");
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer cannot be null");
    }

    /**
     * Resolves the type tokens of argument {@code name} declared at {@code line}.
     *
     * @throws SemanticException if there are no type tokens, an array type is unknown
     *                           or disabled, or an {@code npe_matches} token is malformed
     */
    public Resolution resolve(String name, List<String> typeTokens, int line) {
        if (typeTokens.isEmpty()) {
            throw new SemanticException("Argument `" + name + "` got no type arguments", line);
        }

        if (typeTokens.size() == 1) {
            String token = typeTokens.get(0);
            if (isMatchesToken(token)) {
                String other = parseMatchesTarget(name, token, line);
                joinGroupOf(name, other);
                return new Resolution(ArgumentKind.NUMERIC_ARRAY, null, other, List.of());
            }
            if (ArrayType.fromToken(token).isEmpty()) {
                return new Resolution(ArgumentKind.SCALAR, token, null, List.of());
            }
        }

        List<ArrayType> types = new ArrayList<>();
        for (String token : typeTokens) {
            Optional<ArrayType> type = ArrayType.fromToken(token);
            if (type.isEmpty()) {
                throw new SemanticException("Got invalid type `" + token + "` for argument `" + name
                        + "`. If multiple types are specified, they must be one of " + catalog.tokens(), line);
            }
            if (!catalog.isEnabled(type.get())) {
                throw new SemanticException("Array type `" + type.get().token() + "` for argument `" + name
                        + "` is disabled by configuration", line);
            }
            types.add(type.get());
        }
        declareGroup(name, types);
        return new Resolution(ArgumentKind.NUMERIC_ARRAY, null, null, types);
    }

    /**
     * Freezes the arena into indexed groups, in group creation order.
     */
    public ResolvedGroups freeze() {
        List<TypeGroup> groups = new ArrayList<>();
        Map<String, Integer> indexByArgument = new HashMap<>();
        for (GroupSlot slot : slots) {
            int index = groups.size();
            groups.add(new TypeGroup(index, slot.members, slot.types));
            for (String member : slot.members) {
                indexByArgument.put(member, index);
            }
        }
        return new ResolvedGroups(List.copyOf(groups), Map.copyOf(indexByArgument));
    }

    private void declareGroup(String name, List<ArrayType> types) {
        GroupSlot slot = groupByName.get(name);
        if (slot == null) {
            slot = newSlot();
            groupByName.put(name, slot);
        } else if (!slot.types.isEmpty()) {
            throw new IllegalStateException("type group of " + name + " already has candidate types");
        }
        slot.types.addAll(types);
        slot.members.add(name);
    }

    private void joinGroupOf(String name, String other) {
        GroupSlot own = groupByName.get(name);
        GroupSlot existing = groupByName.get(other);
        GroupSlot target;

        if (existing == null) {
            // Forward reference: reuse the placeholder others already share with us, or start one
            target = own != null ? own : newSlot();
            groupByName.put(other, target);
        } else {
            target = existing;
            if (own != null && own != existing) {
                existing.members.addAll(own.members);
                groupByName.replaceAll((key, slot) -> slot == own ? existing : slot);
                slots.remove(own);
            }
        }

        target.members.add(name);
        groupByName.put(name, target);
    }

    private GroupSlot newSlot() {
        GroupSlot slot = new GroupSlot();
        slots.add(slot);
        return slot;
    }

    private static boolean isMatchesToken(String token) {
        return token.startsWith(StatementKind.MATCHES_TOKEN)
                && token.substring(StatementKind.MATCHES_TOKEN.length()).stripLeading().startsWith("(");
    }

    private String parseMatchesTarget(String name, String token, int line) {
        List<String> targets = tokenizer.tokenize(StatementKind.MATCHES_TOKEN, token, line);
        if (targets.size() != 1 || !Identifiers.isValid(targets.get(0))) {
            throw new SemanticException("Malformed `" + token + "` for argument `" + name
                    + "`: expected " + StatementKind.MATCHES_TOKEN + "(<argument name>)", line);
        }
        return targets.get(0);
    }
}
