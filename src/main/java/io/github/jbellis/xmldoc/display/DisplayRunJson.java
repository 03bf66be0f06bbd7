package io.github.jbellis.xmldoc.display;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.github.jbellis.xmldoc.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;

/**
 * Serializes display runs for web-based presentation layers, e.g.
 * {@code [{"kind":"type_name","text":"List","symbol":"T:System.Collections.Generic.List`1"}]}.
 * The symbol is written as its documentation ID and omitted when absent.
 */
public final class DisplayRunJson {

    record RunDto(String kind, String text, @Nullable String symbol) {}

    private DisplayRunJson() {}

    public static String toJson(List<DisplayRun> runs) {
        var dtos = runs.stream().map(DisplayRunJson::toDto).toList();
        try {
            return Json.mapper.writeValueAsString(dtos);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static RunDto toDto(DisplayRun run) {
        var symbol = run.symbol();
        return new RunDto(run.kind().name().toLowerCase(Locale.ROOT),
                          run.text(),
                          symbol == null ? null : symbol.documentationId());
    }
}
