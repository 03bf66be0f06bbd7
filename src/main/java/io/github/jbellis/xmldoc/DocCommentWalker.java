package io.github.jbellis.xmldoc;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.Objects;

/**
 * Depth-first walk over a parsed comment fragment, feeding a {@link FormatterState}.
 * Reference tags are handled as leaves; {@code <para>} marks a paragraph boundary on both sides;
 * every other element is transparent.
 */
final class DocCommentWalker {
    static final String TAG_SEE = "see";
    static final String TAG_SEEALSO = "seealso";
    static final String TAG_PARAMREF = "paramref";
    static final String TAG_TYPEPARAMREF = "typeparamref";
    static final String TAG_PARA = "para";

    private final FormatterState state;
    private final ReferenceTagAppender references;

    DocCommentWalker(FormatterState state, ReferenceTagAppender references) {
        this.state = Objects.requireNonNull(state, "state");
        this.references = Objects.requireNonNull(references, "references");
    }

    void walk(Node node) {
        if (node instanceof TextNode textNode) {
            TextNormalizer.appendTextNode(state, textNode.getWholeText());
            return;
        }
        if (!(node instanceof Element element)) {
            return;
        }

        var name = element.tagName();
        switch (name) {
            case TAG_SEE, TAG_SEEALSO -> {
                references.appendSeeTag(state, element);
                return;
            }
            case TAG_PARAMREF, TAG_TYPEPARAMREF -> {
                references.appendNameReference(state, element);
                return;
            }
            default -> {
            }
        }

        var paragraph = TAG_PARA.equals(name) ? state.beginPara() : null;

        for (var child : element.childNodes()) {
            walk(child);
        }

        if (paragraph != null) {
            state.endPara(paragraph);
        }
    }
}
