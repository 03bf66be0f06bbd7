package io.github.jbellis.xmldoc;

/**
 * Collapses the whitespace of one XML text node into single spaces.
 */
final class TextNormalizer {

    private TextNormalizer() {}

    /**
     * Appends {@code rawText} to {@code state}. Each run of whitespace becomes one space, except that
     * whitespace at the very start of the whole output is dropped. Spaces at the node's edges are
     * deferred to the state so that a neighbouring node or paragraph break can absorb them.
     */
    static void appendTextNode(FormatterState state, String rawText) {
        var builder = new StringBuilder(rawText.length());

        var pendingWhitespace = false;
        var hadAnyNonWhitespace = false;
        for (int i = 0; i < rawText.length(); i++) {
            char c = rawText.charAt(i);
            if (isWhitespace(c)) {
                // only leading whitespace of the entire output is discarded
                if (!state.atBeginning() || hadAnyNonWhitespace) {
                    pendingWhitespace = true;
                }
                continue;
            }

            if (pendingWhitespace) {
                if (builder.length() == 0) {
                    state.appendSingleSpace();
                } else {
                    builder.append(' ');
                }
                pendingWhitespace = false;
            }

            builder.append(c);
            hadAnyNonWhitespace = true;
        }

        if (builder.length() > 0) {
            state.appendString(builder.toString());
        }

        if (pendingWhitespace) {
            state.appendSingleSpace();
        }
    }

    /**
     * Unicode whitespace, including the no-break spaces and NEL that {@link Character#isWhitespace} excludes.
     */
    static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\u0085';
    }
}
