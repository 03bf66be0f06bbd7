package io.github.jbellis.xmldoc.symbol;

import java.util.Objects;

/**
 * A compilation plus a source position, used to render symbols with the minimal qualification
 * that is unambiguous at that position.
 */
public record SemanticContext(Compilation compilation, int position) {
    public SemanticContext {
        Objects.requireNonNull(compilation, "compilation");
        if (position < 0) {
            throw new IllegalArgumentException("position cannot be negative: " + position);
        }
    }
}
