package com.autotax.mapper;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static utility for reading the bundled rule and rate documents.
 *
 * <p>The shared ObjectMapper reads unknown enum tags as null so a rule document naming a
 * variant this build does not know still loads; the engine treats the null as an unknown
 * variant. Unknown properties are ignored for the same reason.
 */
public final class JsonHelper {

    private static final Logger log = LoggerFactory.getLogger(JsonHelper.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    static {
        OBJECT_MAPPER.findAndRegisterModules();
        OBJECT_MAPPER.enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL);
        OBJECT_MAPPER.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private JsonHelper() {}

    /**
     * Deserialize a document from a stream.
     *
     * @param source description of the stream (file name or URL) used in error messages
     */
    public static <T> T fromJson(InputStream in, Class<T> type, String source) {
        try {
            return OBJECT_MAPPER.readValue(in, type);
        } catch (IOException e) {
            log.error("Failed to read {} from {}", type.getSimpleName(), source, e);
            throw new IllegalStateException("Unreadable JSON document: " + source, e);
        }
    }
}
