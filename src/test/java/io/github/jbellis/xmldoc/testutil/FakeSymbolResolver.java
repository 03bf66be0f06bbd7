package io.github.jbellis.xmldoc.testutil;

import io.github.jbellis.xmldoc.symbol.CodeSymbol;
import io.github.jbellis.xmldoc.symbol.Compilation;
import io.github.jbellis.xmldoc.symbol.SymbolResolver;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory resolver keyed by documentation ID, plus explicit aliases for bare names such as
 * parameter names. Remembers every identifier it was asked about.
 */
public final class FakeSymbolResolver implements SymbolResolver {
    private final Map<String, CodeSymbol> symbols = new HashMap<>();
    private final List<String> requests = new ArrayList<>();

    public static FakeSymbolResolver of(CodeSymbol... declared) {
        var resolver = new FakeSymbolResolver();
        for (var symbol : declared) {
            resolver.symbols.put(Objects.requireNonNull(symbol.documentationId()), symbol);
        }
        return resolver;
    }

    public FakeSymbolResolver withAlias(String identifier, CodeSymbol symbol) {
        symbols.put(identifier, symbol);
        return this;
    }

    @Override
    public synchronized Optional<CodeSymbol> resolve(String declarationId, Compilation compilation) {
        requests.add(declarationId);
        return Optional.ofNullable(symbols.get(declarationId));
    }

    public synchronized List<String> getRequests() {
        return List.copyOf(requests);
    }
}
