package io.github.jbellis.xmldoc.symbol;

/**
 * Handle on the host's compilation. The formatter hands it back to the {@link SymbolResolver} and,
 * wrapped in a {@link SemanticContext}, to the renderer; it only reads the assembly name for logging.
 */
public interface Compilation {
    /**
     * Name of the assembly being compiled, used to identify the compilation in log output.
     */
    String assemblyName();
}
