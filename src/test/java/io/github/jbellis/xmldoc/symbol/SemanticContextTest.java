package io.github.jbellis.xmldoc.symbol;

import io.github.jbellis.xmldoc.testutil.TestCompilation;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SemanticContextTest {

    @Test
    public void testValidation() {
        assertThrows(NullPointerException.class, () -> new SemanticContext(null, 0));
        assertThrows(IllegalArgumentException.class, () -> new SemanticContext(TestCompilation.DEFAULT, -1));
        assertEquals(7, new SemanticContext(TestCompilation.DEFAULT, 7).position());
    }

    @Test
    public void testNoneResolverFindsNothing() {
        assertTrue(SymbolResolver.NONE.resolve("T:My.Type", TestCompilation.DEFAULT).isEmpty());
    }
}
