package io.github.jbellis.xmldoc.display;

import io.github.jbellis.xmldoc.display.DisplayFormat.MemberOption;
import io.github.jbellis.xmldoc.display.DisplayFormat.Qualification;
import io.github.jbellis.xmldoc.symbol.CodeSymbol;
import io.github.jbellis.xmldoc.symbol.SemanticContext;
import io.github.jbellis.xmldoc.symbol.SymbolKind;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders {@link CodeSymbol}s in C#-like surface syntax, honouring {@link DisplayFormat}.
 * <p>
 * Given a {@link SemanticContext}, namespaces are assumed to be in scope and
 * {@link Qualification#FULLY_QUALIFIED} is treated as {@link Qualification#NAME_AND_CONTAINING_TYPES}.
 * Well-known framework types in parameter lists are shown by their keyword alias ({@code System.Int32}
 * becomes {@code int}).
 */
public final class BasicSymbolRenderer implements SymbolRenderer {

    public static final BasicSymbolRenderer INSTANCE = new BasicSymbolRenderer();

    private static final Map<String, String> KEYWORD_ALIASES = Map.ofEntries(
            Map.entry("System.Boolean", "bool"),
            Map.entry("System.Byte", "byte"),
            Map.entry("System.SByte", "sbyte"),
            Map.entry("System.Char", "char"),
            Map.entry("System.Decimal", "decimal"),
            Map.entry("System.Double", "double"),
            Map.entry("System.Single", "float"),
            Map.entry("System.Int16", "short"),
            Map.entry("System.UInt16", "ushort"),
            Map.entry("System.Int32", "int"),
            Map.entry("System.UInt32", "uint"),
            Map.entry("System.Int64", "long"),
            Map.entry("System.UInt64", "ulong"),
            Map.entry("System.Object", "object"),
            Map.entry("System.String", "string"),
            Map.entry("System.Void", "void"));

    private BasicSymbolRenderer() {}

    @Override
    public List<DisplayRun> render(CodeSymbol symbol, DisplayFormat format, @Nullable SemanticContext context) {
        var qualification = format.qualification();
        if (context != null && qualification == Qualification.FULLY_QUALIFIED) {
            qualification = Qualification.NAME_AND_CONTAINING_TYPES;
        }

        var runs = new ArrayList<DisplayRun>();
        switch (symbol.kind()) {
            case NAMESPACE -> appendNamespace(runs, symbol, qualification);
            case TYPE -> {
                appendQualifier(runs, symbol, qualification);
                runs.add(new DisplayRun(DisplayRun.Kind.TYPE_NAME, symbol.name(), symbol));
                appendTypeParameters(runs, symbol, format);
            }
            case PARAMETER -> runs.add(new DisplayRun(DisplayRun.Kind.PARAMETER_NAME, symbol.name(), symbol));
            case TYPE_PARAMETER ->
                    runs.add(new DisplayRun(DisplayRun.Kind.TYPE_PARAMETER_NAME, symbol.name(), symbol));
            default -> appendMember(runs, symbol, format, qualification);
        }
        return List.copyOf(runs);
    }

    private static void appendMember(List<DisplayRun> runs,
                                     CodeSymbol symbol,
                                     DisplayFormat format,
                                     Qualification qualification) {
        if (format.has(MemberOption.INCLUDE_CONTAINING_TYPE) && !symbol.containingTypes().isEmpty()) {
            appendQualifier(runs, symbol, qualification);
        }
        var explicitInterface = symbol.explicitInterface();
        if (format.has(MemberOption.INCLUDE_EXPLICIT_INTERFACE) && explicitInterface != null) {
            runs.add(new DisplayRun(DisplayRun.Kind.TYPE_NAME, typeName(explicitInterface, qualification)));
            runs.add(punctuation("."));
        }

        var nameKind = switch (symbol.kind()) {
            case CONSTRUCTOR -> DisplayRun.Kind.TYPE_NAME;
            case METHOD -> DisplayRun.Kind.METHOD_NAME;
            default -> DisplayRun.Kind.MEMBER_NAME;
        };
        runs.add(new DisplayRun(nameKind, symbol.name(), symbol));
        appendTypeParameters(runs, symbol, format);

        boolean callable = symbol.kind() == SymbolKind.CONSTRUCTOR || symbol.kind() == SymbolKind.METHOD;
        if (callable && format.has(MemberOption.INCLUDE_PARAMETERS)) {
            runs.add(punctuation("("));
            var parameterTypes = symbol.parameterTypes();
            for (int i = 0; i < parameterTypes.size(); i++) {
                if (i > 0) {
                    runs.add(punctuation(","));
                    runs.add(DisplayRun.SPACE);
                }
                runs.add(parameterType(parameterTypes.get(i), qualification));
            }
            runs.add(punctuation(")"));
        }
    }

    /**
     * Appends the namespace and/or enclosing types, each followed by a dot.
     */
    private static void appendQualifier(List<DisplayRun> runs, CodeSymbol symbol, Qualification qualification) {
        if (qualification == Qualification.FULLY_QUALIFIED && !symbol.namespace().isEmpty()) {
            for (var part : symbol.namespace().split("\\.")) {
                runs.add(new DisplayRun(DisplayRun.Kind.NAMESPACE_NAME, part));
                runs.add(punctuation("."));
            }
        }

        var containing = symbol.containingTypes();
        if (containing.isEmpty()) {
            return;
        }
        if (qualification == Qualification.NAME_ONLY) {
            // members still show their declaring type; nested types show nothing
            if (symbol.kind().isMember()) {
                runs.add(new DisplayRun(DisplayRun.Kind.TYPE_NAME, containing.get(containing.size() - 1)));
                runs.add(punctuation("."));
            }
            return;
        }
        for (var type : containing) {
            runs.add(new DisplayRun(DisplayRun.Kind.TYPE_NAME, type));
            runs.add(punctuation("."));
        }
    }

    private static void appendNamespace(List<DisplayRun> runs, CodeSymbol symbol, Qualification qualification) {
        if (qualification != Qualification.NAME_ONLY && !symbol.namespace().isEmpty()) {
            for (var part : symbol.namespace().split("\\.")) {
                runs.add(new DisplayRun(DisplayRun.Kind.NAMESPACE_NAME, part));
                runs.add(punctuation("."));
            }
        }
        runs.add(new DisplayRun(DisplayRun.Kind.NAMESPACE_NAME, symbol.name(), symbol));
    }

    private static void appendTypeParameters(List<DisplayRun> runs, CodeSymbol symbol, DisplayFormat format) {
        var typeParameters = symbol.typeParameters();
        if (typeParameters.isEmpty() || !format.has(MemberOption.INCLUDE_TYPE_PARAMETERS)) {
            return;
        }
        runs.add(punctuation("<"));
        for (int i = 0; i < typeParameters.size(); i++) {
            if (i > 0) {
                runs.add(punctuation(","));
                runs.add(DisplayRun.SPACE);
            }
            runs.add(new DisplayRun(DisplayRun.Kind.TYPE_PARAMETER_NAME, typeParameters.get(i)));
        }
        runs.add(punctuation(">"));
    }

    private static DisplayRun parameterType(String qualifiedType, Qualification qualification) {
        var alias = KEYWORD_ALIASES.get(qualifiedType);
        if (alias != null) {
            return new DisplayRun(DisplayRun.Kind.KEYWORD, alias);
        }
        return new DisplayRun(DisplayRun.Kind.TYPE_NAME, typeName(qualifiedType, qualification));
    }

    private static String typeName(String qualifiedType, Qualification qualification) {
        if (qualification == Qualification.FULLY_QUALIFIED) {
            return qualifiedType;
        }
        return qualifiedType.substring(qualifiedType.lastIndexOf('.') + 1);
    }

    private static DisplayRun punctuation(String text) {
        return new DisplayRun(DisplayRun.Kind.PUNCTUATION, text);
    }
}
