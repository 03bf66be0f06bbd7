package io.github.jbellis.xmldoc.display;

import io.github.jbellis.xmldoc.symbol.CodeSymbol;
import io.github.jbellis.xmldoc.symbol.SemanticContext;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Turns a resolved symbol into display runs. Implementations must be side-effect free.
 */
@FunctionalInterface
public interface SymbolRenderer {

    /**
     * @param symbol  the symbol to render
     * @param format  display options
     * @param context when present, names may be shortened to what is unambiguous at that position
     */
    List<DisplayRun> render(CodeSymbol symbol, DisplayFormat format, @Nullable SemanticContext context);
}
