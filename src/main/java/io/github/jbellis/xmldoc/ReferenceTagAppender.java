package io.github.jbellis.xmldoc;

import io.github.jbellis.xmldoc.symbol.SymbolResolver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.nodes.Element;

import java.util.Objects;

/**
 * Appends the output of a symbol reference tag: the rendered symbol when the identifier resolves,
 * otherwise the identifier itself without its documentation-ID prefix.
 */
final class ReferenceTagAppender {
    private static final Logger logger = LogManager.getLogger(ReferenceTagAppender.class);

    static final String ATTR_CREF = "cref";
    static final String ATTR_NAME = "name";

    private final SymbolResolver resolver;
    private final boolean resolveReferences;

    ReferenceTagAppender(SymbolResolver resolver, boolean resolveReferences) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.resolveReferences = resolveReferences;
    }

    /**
     * Handles {@code <see>}/{@code <seealso>}.
     */
    void appendSeeTag(FormatterState state, Element element) {
        appendReference(state, element, ATTR_CREF);
    }

    /**
     * Handles {@code <paramref>}/{@code <typeparamref>}.
     */
    void appendNameReference(FormatterState state, Element element) {
        appendReference(state, element, ATTR_NAME);
    }

    private void appendReference(FormatterState state, Element element, String attributeName) {
        var attributes = element.attributes();
        if (!attributes.hasKey(attributeName)) {
            return;
        }

        var value = attributes.get(attributeName);
        var compilation = state.compilation();
        if (resolveReferences && compilation != null
                && state.tryAppendSymbol(resolver.resolve(value, compilation).orElse(null))) {
            return;
        }

        var assembly = compilation == null ? "(no compilation)" : compilation.assemblyName();
        logger.trace("<{}> reference '{}' not resolved in {}; using literal text", element.tagName(), value, assembly);
        state.appendString(trimDocumentationIdPrefix(value));
    }

    /**
     * Strips a leading kind marker such as {@code T:} or {@code M:}.
     */
    static String trimDocumentationIdPrefix(String value) {
        if (value.length() >= 2 && value.charAt(1) == ':' && Character.isLetter(value.charAt(0))) {
            return value.substring(2);
        }
        return value;
    }
}
