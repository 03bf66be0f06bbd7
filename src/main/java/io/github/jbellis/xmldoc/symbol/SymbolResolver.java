package io.github.jbellis.xmldoc.symbol;

import java.util.Optional;

/**
 * Maps a declaration reference (usually a documentation ID such as {@code T:My.Type}) to the first
 * symbol it names in a compilation. Implementations must be side-effect free.
 */
@FunctionalInterface
public interface SymbolResolver {

    /**
     * Resolver that never finds anything, so every reference falls back to its literal text.
     */
    SymbolResolver NONE = (declarationId, compilation) -> Optional.empty();

    Optional<CodeSymbol> resolve(String declarationId, Compilation compilation);
}
