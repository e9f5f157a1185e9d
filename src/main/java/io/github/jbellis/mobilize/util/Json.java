package io.github.jbellis.mobilize.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

/**
 * Single, centrally-configured Jackson {@link ObjectMapper}.
 *
 * *  Registers the JDK 8 module so {@code Optional} fields bind as absent values
 * *  Binds scalars strictly: no float-to-integer truncation and no coercion
 *    from quoted strings, so {@code "conversionId": 4.7} is an error
 *
 * Callers just import {@code Json.mapper}.
 */
public final class Json {
    public static final ObjectMapper mapper;

    static {
        mapper = JsonMapper.builder()
                .addModule(new Jdk8Module())
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
                .build();
    }

    private Json() {}   // no instances
}
