package io.github.jbellis.xmldoc.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Jackson {@link ObjectMapper} shared by the JSON exporters such as
 * {@link io.github.jbellis.xmldoc.display.DisplayRunJson}. Configured with {@code NON_NULL} inclusion,
 * so a run without a symbol serializes without a {@code symbol} key.
 */
public final class Json {
    public static final ObjectMapper mapper;

    static {
        mapper = new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    private Json() {}   // no instances
}
