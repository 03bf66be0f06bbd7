package io.github.jbellis.xmldoc;

import io.github.jbellis.xmldoc.display.DisplayFormat;
import io.github.jbellis.xmldoc.display.DisplayRun;
import io.github.jbellis.xmldoc.symbol.Compilation;
import io.github.jbellis.xmldoc.symbol.SemanticContext;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Converts XML documentation comment fragments into readable text or display runs.
 */
public interface DocCommentFormattingService {

    /**
     * Formats a comment fragment as plain text. Paragraphs are separated by a blank line.
     *
     * @param rawXmlText  the comment body, possibly several sibling nodes; may be null
     * @param compilation used to resolve {@code cref}/{@code name} references, or null for literal output
     * @return the formatted text, or null when {@code rawXmlText} is null
     * @throws MalformedDocCommentException if the fragment is not well-formed XML
     */
    @Nullable String format(@Nullable String rawXmlText, @Nullable Compilation compilation);

    default @Nullable String format(@Nullable String rawXmlText) {
        return format(rawXmlText, null);
    }

    /**
     * Formats a comment fragment as display runs for rich presentation. Resolved references are
     * rendered with the minimal qualification valid at the context's position.
     *
     * @param rawXmlText the comment body; may be null
     * @param context    compilation and position for resolution and rendering
     * @param format     display options for resolved symbols, or null for {@link DisplayFormat#DEFAULT}
     * @return an unmodifiable run list, or null when {@code rawXmlText} is null
     * @throws MalformedDocCommentException if the fragment is not well-formed XML
     */
    @Nullable List<DisplayRun> formatRuns(@Nullable String rawXmlText,
                                          SemanticContext context,
                                          @Nullable DisplayFormat format);
}
