package io.surfworks.arraybind.dsl;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Identifier rules for binding and argument names.
 *
 * <p>Names end up as C++ identifiers in the generated code, so they must be
 * ASCII identifiers ({@code [A-Za-z_][A-Za-z0-9_]*}) and not C++ keywords.
 */
public final class Identifiers {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final Set<String> CPP_KEYWORDS = Set.of(
            "alignas", "alignof", "and", "and_eq", "asm", "auto", "bitand", "bitor", "bool", "break",
            "case", "catch", "char", "char8_t", "char16_t", "char32_t", "class", "compl", "concept",
            "const", "consteval", "constexpr", "constinit", "const_cast", "continue", "co_await",
            "co_return", "co_yield", "decltype", "default", "delete", "do", "double", "dynamic_cast",
            "else", "enum", "explicit", "export", "extern", "false", "float", "for", "friend", "goto",
            "if", "inline", "int", "long", "mutable", "namespace", "new", "noexcept", "not", "not_eq",
            "nullptr", "operator", "or", "or_eq", "private", "protected", "public", "register",
            "reinterpret_cast", "requires", "return", "short", "signed", "sizeof", "static",
            "static_assert", "static_cast", "struct", "switch", "template", "this", "thread_local",
            "throw", "true", "try", "typedef", "typeid", "typename", "union", "unsigned", "using",
            "virtual", "void", "volatile", "wchar_t", "while", "xor", "xor_eq");

    private Identifiers() {
    }

    public static boolean isValid(String name) {
        return name != null && IDENTIFIER.matcher(name).matches() && !CPP_KEYWORDS.contains(name);
    }

    /**
     * @throws StructuralException if {@code name} is not a valid identifier
     */
    public static String require(String name, String what, int line) {
        if (!isValid(name)) {
            throw new StructuralException("Invalid " + what + " `" + name
                    + "`: expected an ASCII identifier that is not a C++ keyword", line);
        }
        return name;
    }
}
