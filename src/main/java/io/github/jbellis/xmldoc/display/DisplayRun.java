package io.github.jbellis.xmldoc.display;

import io.github.jbellis.xmldoc.symbol.CodeSymbol;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * One atomic unit of formatted output. The formatter itself only produces {@link Kind#TEXT},
 * {@link Kind#SPACE} and {@link Kind#LINE_BREAK} runs; symbol renderers may use the richer
 * classification kinds so a presentation layer can color them, and may attach the symbol a run names.
 */
public record DisplayRun(Kind kind, String text, @Nullable CodeSymbol symbol) {

    public static final String LINE_BREAK_TEXT = "\r\n";

    public static final DisplayRun SPACE = new DisplayRun(Kind.SPACE, " ");
    public static final DisplayRun LINE_BREAK = new DisplayRun(Kind.LINE_BREAK, LINE_BREAK_TEXT);

    public enum Kind {
        TEXT,
        SPACE,
        LINE_BREAK,
        KEYWORD,
        PUNCTUATION,
        NAMESPACE_NAME,
        TYPE_NAME,
        METHOD_NAME,
        MEMBER_NAME,
        PARAMETER_NAME,
        TYPE_PARAMETER_NAME;

        public boolean isWhitespace() {
            return this == SPACE || this == LINE_BREAK;
        }
    }

    public DisplayRun {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
    }

    public DisplayRun(Kind kind, String text) {
        this(kind, text, null);
    }

    public static DisplayRun text(String text) {
        return new DisplayRun(Kind.TEXT, text);
    }

    /**
     * Concatenates the text of every run, in order.
     */
    public static String toText(List<DisplayRun> runs) {
        var sb = new StringBuilder();
        for (var run : runs) {
            sb.append(run.text());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return text;
    }
}
