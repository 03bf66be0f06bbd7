package io.github.jbellis.xmldoc.symbol;

import org.jetbrains.annotations.Nullable;

public enum SymbolKind {
    NAMESPACE('N'),
    TYPE('T'),
    CONSTRUCTOR('M'),
    METHOD('M'),
    PROPERTY('P'),
    FIELD('F'),
    EVENT('E'),
    PARAMETER(null),
    TYPE_PARAMETER(null);

    private final @Nullable Character documentationIdPrefix;

    SymbolKind(@Nullable Character documentationIdPrefix) {
        this.documentationIdPrefix = documentationIdPrefix;
    }

    /**
     * The letter that starts a documentation ID for this kind ({@code T} in {@code T:My.Type}),
     * or null for kinds that have no declaration ID of their own.
     */
    public @Nullable Character documentationIdPrefix() {
        return documentationIdPrefix;
    }

    public boolean isMember() {
        return switch (this) {
            case CONSTRUCTOR, METHOD, PROPERTY, FIELD, EVENT -> true;
            default -> false;
        };
    }
}
