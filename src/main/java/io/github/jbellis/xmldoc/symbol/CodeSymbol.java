package io.github.jbellis.xmldoc.symbol;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Host-neutral description of a declared symbol that a reference tag resolved to.
 *
 * @param kind              what sort of declaration this is
 * @param namespace         dotted namespace, empty for the global namespace
 * @param containingTypes   enclosing type names, outermost first; for members this ends with the declaring type
 * @param name              simple name; for constructors the declaring type's name
 * @param typeParameters    generic parameter names declared on this symbol
 * @param parameterTypes    fully qualified parameter type names, for methods and constructors
 * @param explicitInterface interface this member explicitly implements, or null
 */
public record CodeSymbol(SymbolKind kind,
                         String namespace,
                         List<String> containingTypes,
                         String name,
                         List<String> typeParameters,
                         List<String> parameterTypes,
                         @Nullable String explicitInterface) {

    public CodeSymbol {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name cannot be empty");
        }
        containingTypes = List.copyOf(containingTypes);
        typeParameters = List.copyOf(typeParameters);
        parameterTypes = List.copyOf(parameterTypes);
    }

    public static CodeSymbol namespace(String qualifiedName) {
        int lastDot = qualifiedName.lastIndexOf('.');
        var parent = lastDot < 0 ? "" : qualifiedName.substring(0, lastDot);
        return new CodeSymbol(SymbolKind.NAMESPACE, parent, List.of(), qualifiedName.substring(lastDot + 1),
                              List.of(), List.of(), null);
    }

    public static CodeSymbol type(String namespace, String name, String... typeParameters) {
        return new CodeSymbol(SymbolKind.TYPE, namespace, List.of(), name, Arrays.asList(typeParameters),
                              List.of(), null);
    }

    public static CodeSymbol nestedType(CodeSymbol outer, String name, String... typeParameters) {
        requireType(outer);
        return new CodeSymbol(SymbolKind.TYPE, outer.namespace(), outer.typeChain(), name,
                              Arrays.asList(typeParameters), List.of(), null);
    }

    public static CodeSymbol constructor(CodeSymbol type, String... parameterTypes) {
        requireType(type);
        return new CodeSymbol(SymbolKind.CONSTRUCTOR, type.namespace(), type.typeChain(), type.name(),
                              List.of(), Arrays.asList(parameterTypes), null);
    }

    public static CodeSymbol method(CodeSymbol type, String name, String... parameterTypes) {
        requireType(type);
        return new CodeSymbol(SymbolKind.METHOD, type.namespace(), type.typeChain(), name,
                              List.of(), Arrays.asList(parameterTypes), null);
    }

    /**
     * A field, property or event declared on {@code type}.
     */
    public static CodeSymbol member(SymbolKind kind, CodeSymbol type, String name) {
        if (kind != SymbolKind.FIELD && kind != SymbolKind.PROPERTY && kind != SymbolKind.EVENT) {
            throw new IllegalArgumentException("Not a field, property or event kind: " + kind);
        }
        requireType(type);
        return new CodeSymbol(kind, type.namespace(), type.typeChain(), name, List.of(), List.of(), null);
    }

    public static CodeSymbol parameter(String name) {
        return new CodeSymbol(SymbolKind.PARAMETER, "", List.of(), name, List.of(), List.of(), null);
    }

    public static CodeSymbol typeParameter(String name) {
        return new CodeSymbol(SymbolKind.TYPE_PARAMETER, "", List.of(), name, List.of(), List.of(), null);
    }

    public CodeSymbol withTypeParameters(String... names) {
        return new CodeSymbol(kind, namespace, containingTypes, name, Arrays.asList(names), parameterTypes,
                              explicitInterface);
    }

    public CodeSymbol withExplicitInterface(String interfaceName) {
        return new CodeSymbol(kind, namespace, containingTypes, name, typeParameters, parameterTypes,
                              interfaceName);
    }

    public boolean isConstructor() {
        return kind == SymbolKind.CONSTRUCTOR;
    }

    /**
     * Namespace, enclosing types and name joined with dots.
     */
    public String qualifiedName() {
        return Stream.concat(Stream.of(namespace).filter(s -> !s.isEmpty()),
                             Stream.concat(containingTypes.stream(), Stream.of(name)))
                .collect(Collectors.joining("."));
    }

    /**
     * The documentation ID for this symbol, e.g. {@code T:My.List`1} or
     * {@code M:My.Type.#ctor(System.Int32)}. Parameters and type parameters have none.
     */
    public @Nullable String documentationId() {
        var prefix = kind.documentationIdPrefix();
        if (prefix == null) {
            return null;
        }

        var sb = new StringBuilder().append(prefix).append(':');
        var container = Stream.concat(Stream.of(namespace).filter(s -> !s.isEmpty()), containingTypes.stream())
                .collect(Collectors.joining("."));
        if (!container.isEmpty()) {
            sb.append(container).append('.');
        }
        switch (kind) {
            case CONSTRUCTOR -> sb.append("#ctor");
            case TYPE -> {
                sb.append(name);
                if (!typeParameters.isEmpty()) {
                    sb.append('`').append(typeParameters.size());
                }
            }
            case METHOD -> {
                sb.append(name);
                if (!typeParameters.isEmpty()) {
                    sb.append("``").append(typeParameters.size());
                }
            }
            default -> sb.append(name);
        }
        if ((kind == SymbolKind.CONSTRUCTOR || kind == SymbolKind.METHOD) && !parameterTypes.isEmpty()) {
            sb.append('(').append(String.join(",", parameterTypes)).append(')');
        }
        return sb.toString();
    }

    private List<String> typeChain() {
        var chain = new ArrayList<String>(containingTypes.size() + 1);
        chain.addAll(containingTypes);
        chain.add(name);
        return chain;
    }

    private static void requireType(CodeSymbol symbol) {
        if (symbol.kind() != SymbolKind.TYPE) {
            throw new IllegalArgumentException("Expected a type symbol but got " + symbol.kind());
        }
    }
}
