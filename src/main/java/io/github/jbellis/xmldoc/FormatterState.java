package io.github.jbellis.xmldoc;

import io.github.jbellis.xmldoc.display.DisplayFormat;
import io.github.jbellis.xmldoc.display.DisplayFormat.MemberOption;
import io.github.jbellis.xmldoc.display.DisplayRun;
import io.github.jbellis.xmldoc.display.SymbolRenderer;
import io.github.jbellis.xmldoc.symbol.CodeSymbol;
import io.github.jbellis.xmldoc.symbol.Compilation;
import io.github.jbellis.xmldoc.symbol.SemanticContext;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Run accumulator for a single formatting call.
 * <p>
 * Whitespace and paragraph breaks are recorded as pending intent and only emitted when the next real
 * content arrives, so the output never starts or ends with whitespace and empty paragraphs vanish.
 * All emission goes through {@link #emitPendingChars()}.
 */
final class FormatterState {
    private final List<DisplayRun> runs = new ArrayList<>();

    private final SymbolRenderer renderer;
    private final @Nullable Compilation compilation;
    private final @Nullable SemanticContext semanticContext;
    private final DisplayFormat format;

    private boolean anyNonWhitespaceSinceLastPara;
    private boolean pendingParagraphBreak;
    private boolean pendingSingleSpace;

    private FormatterState(SymbolRenderer renderer,
                           @Nullable Compilation compilation,
                           @Nullable SemanticContext semanticContext,
                           DisplayFormat format) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.compilation = compilation;
        this.semanticContext = semanticContext;
        this.format = Objects.requireNonNull(format, "format");
    }

    /**
     * State for plain-text output: symbols render with the default format and no position.
     */
    static FormatterState forText(SymbolRenderer renderer, @Nullable Compilation compilation) {
        return new FormatterState(renderer, compilation, null, DisplayFormat.DEFAULT);
    }

    /**
     * State for run output: symbols render minimally qualified at the context's position.
     */
    static FormatterState forRuns(SymbolRenderer renderer, SemanticContext context, @Nullable DisplayFormat format) {
        Objects.requireNonNull(context, "context");
        return new FormatterState(renderer, context.compilation(), context,
                                  format == null ? DisplayFormat.DEFAULT : format);
    }

    /**
     * The compilation references resolve against, or null if resolution is unavailable.
     */
    @Nullable Compilation compilation() {
        return compilation;
    }

    boolean atBeginning() {
        return runs.isEmpty();
    }

    void appendSingleSpace() {
        pendingSingleSpace = true;
    }

    void appendString(String s) {
        emitPendingChars();
        runs.add(DisplayRun.text(s));
        anyNonWhitespaceSinceLastPara = true;
    }

    void appendRuns(List<DisplayRun> parts) {
        emitPendingChars();
        runs.addAll(parts);
        anyNonWhitespaceSinceLastPara = true;
    }

    /**
     * Renders and appends {@code symbol}. Constructors always show their parameter list.
     *
     * @return false if there was no symbol to append
     */
    boolean tryAppendSymbol(@Nullable CodeSymbol symbol) {
        if (symbol == null) {
            return false;
        }

        var symbolFormat = format;
        if (symbol.isConstructor()) {
            symbolFormat = format.withMemberOptions(MemberOption.INCLUDE_PARAMETERS,
                                                    MemberOption.INCLUDE_EXPLICIT_INTERFACE);
        }

        appendRuns(renderer.render(symbol, symbolFormat, semanticContext));
        return true;
    }

    /**
     * Where a {@code <para>} opened: whether opening it queued a break, and how many runs existed then.
     */
    record ParagraphMark(boolean queuedBreak, int runCount) {}

    /**
     * Called on entering a {@code <para>}. A boundary with nothing written since the previous one is dropped.
     */
    ParagraphMark beginPara() {
        return new ParagraphMark(markBeginOrEndPara(), runs.size());
    }

    /**
     * Called on leaving a {@code <para>}. If nothing was written inside it, the break queued by
     * {@link #beginPara()} is withdrawn so the empty paragraph leaves no trace.
     */
    void endPara(ParagraphMark mark) {
        if (mark.queuedBreak() && runs.size() == mark.runCount()) {
            pendingParagraphBreak = false;
            anyNonWhitespaceSinceLastPara = true;
            return;
        }
        markBeginOrEndPara();
    }

    private boolean markBeginOrEndPara() {
        if (!anyNonWhitespaceSinceLastPara) {
            return false;
        }

        pendingParagraphBreak = true;
        anyNonWhitespaceSinceLastPara = false;
        return true;
    }

    List<DisplayRun> getRuns() {
        return Collections.unmodifiableList(runs);
    }

    String getText() {
        return DisplayRun.toText(runs);
    }

    private void emitPendingChars() {
        if (pendingParagraphBreak) {
            runs.add(DisplayRun.LINE_BREAK);
            runs.add(DisplayRun.LINE_BREAK);
        } else if (pendingSingleSpace) {
            runs.add(DisplayRun.SPACE);
        }

        pendingParagraphBreak = false;
        pendingSingleSpace = false;
    }
}
