package io.github.jbellis.xmldoc;

import io.github.jbellis.xmldoc.display.BasicSymbolRenderer;
import io.github.jbellis.xmldoc.display.DisplayRun;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TextNormalizerTest {

    private static FormatterState newState() {
        return FormatterState.forText(BasicSymbolRenderer.INSTANCE, null);
    }

    @Test
    public void testInteriorWhitespaceStaysInOneRun() {
        var state = newState();
        TextNormalizer.appendTextNode(state, "  a \n\t b  ");
        assertEquals(List.of(DisplayRun.text("a b")), state.getRuns());
    }

    @Test
    public void testWhitespaceOnlyNodeAtBeginningIsDropped() {
        var state = newState();
        TextNormalizer.appendTextNode(state, " \r\n ");
        TextNormalizer.appendTextNode(state, "a");
        assertEquals(List.of(DisplayRun.text("a")), state.getRuns());
    }

    @Test
    public void testLeadingWhitespaceOfLaterNodeIsDeferred() {
        var state = newState();
        state.appendString("x");
        TextNormalizer.appendTextNode(state, "   y");
        assertEquals(List.of(DisplayRun.text("x"), DisplayRun.SPACE, DisplayRun.text("y")), state.getRuns());
    }

    @Test
    public void testTrailingWhitespaceMergesWithNextNode() {
        var state = newState();
        TextNormalizer.appendTextNode(state, "x  ");
        TextNormalizer.appendTextNode(state, "  ");
        TextNormalizer.appendTextNode(state, " y");
        assertEquals("x y", state.getText());
    }

    @Test
    public void testNoBreakSpacesCollapse() {
        var state = newState();
        TextNormalizer.appendTextNode(state, "a\u00A0\u00A0b\u2007c");
        assertEquals("a b c", state.getText());
    }

    @Test
    public void testIsWhitespace() {
        assertTrue(TextNormalizer.isWhitespace(' '));
        assertTrue(TextNormalizer.isWhitespace('\t'));
        assertTrue(TextNormalizer.isWhitespace('\u00A0'));
        assertTrue(TextNormalizer.isWhitespace('\u0085'));
        assertFalse(TextNormalizer.isWhitespace('a'));
        assertFalse(TextNormalizer.isWhitespace('.'));
    }
}
