package io.surfworks.arraybind.model;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One function binding, from {@code npe_function} to {@code npe_end_code}.
 *
 * <p>Argument order is the declaration order and fixes both the generated
 * parameter order and the registration order. Type groups are owned here;
 * arguments refer to them by index.
 */
public final class Binding {

    private final String name;
    private final int line;
    private final String preamble;
    private final List<Argument> arguments;
    private final Map<String, Argument> argumentsByName;
    private final List<TypeGroup> groups;
    private final String body;
    private final String doc;
    private boolean analyzed;

    public Binding(String name, int line, String preamble, List<Argument> arguments,
                   List<TypeGroup> groups, String body, String doc) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.line = line;
        this.preamble = Objects.requireNonNull(preamble, "preamble cannot be null");
        this.arguments = List.copyOf(arguments);
        this.groups = List.copyOf(groups);
        this.body = Objects.requireNonNull(body, "body cannot be null");
        this.doc = doc;

        this.argumentsByName = new LinkedHashMap<>();
        for (Argument arg : this.arguments) {
            if (argumentsByName.put(arg.name(), arg) != null) {
                throw new IllegalArgumentException("duplicate argument name: " + arg.name());
            }
        }
        checkGroups();
    }

    private void checkGroups() {
        Set<String> grouped = new HashSet<>();
        for (int i = 0; i < groups.size(); i++) {
            TypeGroup group = groups.get(i);
            if (group.index() != i) {
                throw new IllegalArgumentException("type group " + group.index() + " stored at position " + i);
            }
            for (String member : group.members()) {
                Argument arg = argumentsByName.get(member);
                if (arg == null || arg.groupIndex() != i) {
                    throw new IllegalArgumentException("type group " + i + " lists foreign member " + member);
                }
                grouped.add(member);
            }
        }
        for (Argument arg : arguments) {
            if (arg.isArray() && !grouped.contains(arg.name())) {
                throw new IllegalArgumentException("array argument " + arg.name() + " has no type group");
            }
        }
    }

    public String name() {
        return name;
    }

    /**
     * Line of the {@code npe_function} statement.
     */
    public int line() {
        return line;
    }

    /**
     * Text preceding the binding declaration, copied through unmodified.
     */
    public String preamble() {
        return preamble;
    }

    public List<Argument> arguments() {
        return arguments;
    }

    public List<Argument> arrayArguments() {
        return arguments.stream().filter(Argument::isArray).collect(Collectors.toList());
    }

    public boolean hasArrayArguments() {
        return arguments.stream().anyMatch(Argument::isArray);
    }

    public Optional<Argument> argument(String argumentName) {
        return Optional.ofNullable(argumentsByName.get(argumentName));
    }

    public List<TypeGroup> groups() {
        return groups;
    }

    public TypeGroup group(int index) {
        return groups.get(index);
    }

    /**
     * The group of an array argument.
     *
     * @throws IllegalArgumentException for scalar arguments
     */
    public TypeGroup groupOf(Argument argument) {
        if (!argument.isArray()) {
            throw new IllegalArgumentException("scalar argument " + argument.name() + " has no type group");
        }
        return groups.get(argument.groupIndex());
    }

    /**
     * The user's function body, never interpreted.
     */
    public String body() {
        return body;
    }

    public Optional<String> doc() {
        return Optional.ofNullable(doc);
    }

    public boolean isAnalyzed() {
        return analyzed;
    }

    /**
     * Freezes the layout classification of every argument.
     */
    public void markAnalyzed() {
        for (Argument arg : arguments) {
            arg.freeze();
        }
        analyzed = true;
    }
}
