package io.github.jbellis.xmldoc.display;

import io.github.jbellis.xmldoc.display.DisplayFormat.MemberOption;
import io.github.jbellis.xmldoc.display.DisplayFormat.Qualification;
import io.github.jbellis.xmldoc.symbol.CodeSymbol;
import io.github.jbellis.xmldoc.symbol.SemanticContext;
import io.github.jbellis.xmldoc.testutil.TestCompilation;
import io.github.jbellis.xmldoc.testutil.TestSymbols;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BasicSymbolRendererTest {

    private static final SemanticContext CONTEXT = new SemanticContext(TestCompilation.DEFAULT, 0);
    private static final DisplayFormat FULLY_QUALIFIED =
            DisplayFormat.DEFAULT.withQualification(Qualification.FULLY_QUALIFIED);

    private static String render(CodeSymbol symbol, DisplayFormat format) {
        return DisplayRun.toText(BasicSymbolRenderer.INSTANCE.render(symbol, format, null));
    }

    @Test
    public void testGenericTypeRuns() {
        var runs = BasicSymbolRenderer.INSTANCE.render(TestSymbols.LIST, DisplayFormat.DEFAULT, null);
        assertEquals("List<T>", DisplayRun.toText(runs));
        assertEquals(List.of(DisplayRun.Kind.TYPE_NAME, DisplayRun.Kind.PUNCTUATION,
                             DisplayRun.Kind.TYPE_PARAMETER_NAME, DisplayRun.Kind.PUNCTUATION),
                     runs.stream().map(DisplayRun::kind).toList());
        assertSame(TestSymbols.LIST, runs.get(0).symbol(), "Name run should link back to the symbol");
    }

    @Test
    public void testTypeQualification() {
        assertEquals("System.Collections.Generic.List<T>", render(TestSymbols.LIST, FULLY_QUALIFIED));
        assertEquals("List", render(TestSymbols.LIST, DisplayFormat.SHORT));
        assertEquals("Outer.Inner", render(TestSymbols.INNER, DisplayFormat.DEFAULT));
        assertEquals("My.Outer.Inner", render(TestSymbols.INNER, FULLY_QUALIFIED));
        assertEquals("Inner", render(TestSymbols.INNER, DisplayFormat.SHORT));
    }

    @Test
    public void testContextDropsNamespaces() {
        var runs = BasicSymbolRenderer.INSTANCE.render(TestSymbols.INNER, FULLY_QUALIFIED, CONTEXT);
        assertEquals("Outer.Inner", DisplayRun.toText(runs));
    }

    @Test
    public void testMethodSignature() {
        assertEquals("Type.Parse(string, IFormatProvider)", render(TestSymbols.MY_TYPE_PARSE, DisplayFormat.DEFAULT));
        assertEquals("My.Type.Parse(string, System.IFormatProvider)",
                     render(TestSymbols.MY_TYPE_PARSE, FULLY_QUALIFIED));
        assertEquals("Parse", render(TestSymbols.MY_TYPE_PARSE, DisplayFormat.SHORT));
        assertEquals("Type.Parse",
                     render(TestSymbols.MY_TYPE_PARSE, DisplayFormat.SHORT.withMemberOptions(MemberOption.INCLUDE_CONTAINING_TYPE)));
    }

    @Test
    public void testParameterRunKinds() {
        var runs = BasicSymbolRenderer.INSTANCE.render(TestSymbols.MY_TYPE_CTOR,
                DisplayFormat.SHORT.withMemberOptions(MemberOption.INCLUDE_PARAMETERS), null);
        assertEquals("Type(int)", DisplayRun.toText(runs));
        assertEquals(DisplayRun.Kind.TYPE_NAME, runs.get(0).kind());
        assertEquals(new DisplayRun(DisplayRun.Kind.KEYWORD, "int"), runs.get(2));
    }

    @Test
    public void testParameterlessMethodShowsEmptyParens() {
        var dispose = CodeSymbol.method(TestSymbols.MY_TYPE, "Dispose");
        assertEquals("Type.Dispose()", render(dispose, DisplayFormat.DEFAULT));
    }

    @Test
    public void testExplicitInterface() {
        var dispose = CodeSymbol.method(TestSymbols.MY_TYPE, "Dispose").withExplicitInterface("System.IDisposable");
        var format = DisplayFormat.DEFAULT.withMemberOptions(MemberOption.INCLUDE_EXPLICIT_INTERFACE,
                                                             MemberOption.INCLUDE_PARAMETERS);
        assertEquals("IDisposable.Dispose()", render(dispose, format));
        assertEquals("Type.Dispose()", render(dispose, DisplayFormat.DEFAULT),
                     "Explicit interface is hidden unless requested");
    }

    @Test
    public void testGenericMethodTypeParameters() {
        var cast = CodeSymbol.method(TestSymbols.MY_TYPE, "Cast").withTypeParameters("TResult");
        assertEquals("Type.Cast<TResult>()", render(cast, DisplayFormat.DEFAULT));
    }

    @Test
    public void testPropertyAndNamespace() {
        assertEquals("Type.Count", render(TestSymbols.MY_TYPE_COUNT, DisplayFormat.DEFAULT));
        assertEquals("Type.Count", render(TestSymbols.MY_TYPE_COUNT, DisplayFormat.SHORT
                .withMemberOptions(MemberOption.INCLUDE_CONTAINING_TYPE)));

        var ns = CodeSymbol.namespace("System.Collections");
        assertEquals("System.Collections", render(ns, DisplayFormat.DEFAULT));
        assertEquals("Collections", render(ns, DisplayFormat.SHORT));
    }

    @Test
    public void testParametersAndTypeParameters() {
        var runs = BasicSymbolRenderer.INSTANCE.render(CodeSymbol.parameter("value"), DisplayFormat.DEFAULT, CONTEXT);
        assertEquals(1, runs.size());
        assertEquals(DisplayRun.Kind.PARAMETER_NAME, runs.get(0).kind());
        assertEquals("value", runs.get(0).text());

        assertEquals("T", render(CodeSymbol.typeParameter("T"), DisplayFormat.DEFAULT));
    }
}
