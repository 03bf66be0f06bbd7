package io.github.jbellis.xmldoc;

import io.github.jbellis.xmldoc.display.BasicSymbolRenderer;
import io.github.jbellis.xmldoc.display.DisplayFormat;
import io.github.jbellis.xmldoc.display.DisplayRun;
import io.github.jbellis.xmldoc.display.SymbolRenderer;
import io.github.jbellis.xmldoc.symbol.Compilation;
import io.github.jbellis.xmldoc.symbol.SemanticContext;
import io.github.jbellis.xmldoc.symbol.SymbolResolver;
import io.github.jbellis.xmldoc.xml.XmlFragmentReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jsoup.nodes.Element;

import javax.xml.stream.XMLStreamException;
import java.util.List;
import java.util.Objects;

/**
 * Formats XML documentation comments such as
 * {@code Returns <see cref="T:My.Type"/>.<para>Details.</para>}
 * into normalized text or display runs.
 * <p>
 * Instances hold only the injected resolver and renderer and are safe to share between threads when
 * those are. Each call uses its own {@link FormatterState}.
 *
 * <h3>Configuration</h3>
 * <ul>
 *   <li>{@code xmldoc.resolve.crefs} - Resolve {@code cref}/{@code name} references through the
 *   {@link SymbolResolver} (default: true). When false every reference renders as its literal identifier.</li>
 * </ul>
 *
 * Example: {@code -Dxmldoc.resolve.crefs=false}
 */
public final class DocCommentFormatter implements DocCommentFormattingService {
    private static final Logger logger = LogManager.getLogger(DocCommentFormatter.class);

    static final boolean RESOLVE_REFERENCES = Boolean.parseBoolean(
            System.getProperty("xmldoc.resolve.crefs", "true"));

    private static final String WRAPPER_TAG = "root";

    private final SymbolResolver resolver;
    private final SymbolRenderer renderer;
    private final boolean resolveReferences;

    public DocCommentFormatter(SymbolResolver resolver, SymbolRenderer renderer) {
        this(resolver, renderer, RESOLVE_REFERENCES);
    }

    public DocCommentFormatter(SymbolResolver resolver) {
        this(resolver, BasicSymbolRenderer.INSTANCE);
    }

    DocCommentFormatter(SymbolResolver resolver, SymbolRenderer renderer, boolean resolveReferences) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.resolveReferences = resolveReferences;
    }

    /**
     * Formatter that never resolves references; every {@code cref} renders literally.
     */
    public static DocCommentFormatter literal() {
        return new DocCommentFormatter(SymbolResolver.NONE, BasicSymbolRenderer.INSTANCE, false);
    }

    @Override
    public @Nullable String format(@Nullable String rawXmlText, @Nullable Compilation compilation) {
        if (rawXmlText == null) {
            return null;
        }

        var state = FormatterState.forText(renderer, compilation);
        walk(state, parseFragment(rawXmlText));
        return state.getText();
    }

    @Override
    public @Nullable List<DisplayRun> formatRuns(@Nullable String rawXmlText,
                                                 SemanticContext context,
                                                 @Nullable DisplayFormat format) {
        if (rawXmlText == null) {
            return null;
        }

        var state = FormatterState.forRuns(renderer, context, format);
        walk(state, parseFragment(rawXmlText));
        return state.getRuns();
    }

    private void walk(FormatterState state, Element root) {
        new DocCommentWalker(state, new ReferenceTagAppender(resolver, resolveReferences)).walk(root);
        logger.trace("Formatted documentation comment into {} runs", state.getRuns().size());
    }

    /**
     * Wraps the fragment in a synthetic root so that multiple top-level nodes parse.
     */
    private static Element parseFragment(String rawXmlText) {
        var inputString = "<" + WRAPPER_TAG + ">" + rawXmlText + "</" + WRAPPER_TAG + ">";
        try {
            return XmlFragmentReader.read(inputString);
        } catch (XMLStreamException e) {
            logger.debug("Could not parse documentation comment: {}", e.getMessage());
            throw new MalformedDocCommentException(rawXmlText, e);
        }
    }
}
