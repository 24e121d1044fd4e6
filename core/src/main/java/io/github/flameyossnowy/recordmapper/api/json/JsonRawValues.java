package io.github.flameyossnowy.recordmapper.api.json;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.flameyossnowy.recordmapper.api.exceptions.RawValueParseException;
import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads JSON objects into raw value maps suitable for materialization.
 * <p>
 * Numbers keep Jackson's natural types ({@code Integer} when they fit, then {@code Long},
 * {@code Double} for fractions), objects become insertion-ordered maps and arrays become lists.
 */
public class JsonRawValues {
    private static final TypeReference<LinkedHashMap<String, Object>> RAW_MAP = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public JsonRawValues() {
        this(new ObjectMapper());
    }

    public JsonRawValues(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public @NotNull Map<String, Object> read(@NotNull String json) {
        try {
            LinkedHashMap<String, Object> values = mapper.readValue(json, RAW_MAP);
            if (values == null) {
                throw new RawValueParseException("Expected a JSON object, got null", 1, 1, null);
            }
            return values;
        } catch (JsonProcessingException e) {
            JsonLocation location = e.getLocation();
            throw new RawValueParseException(e.getOriginalMessage(),
                location == null ? -1 : location.getLineNr(),
                location == null ? -1 : location.getColumnNr(),
                e);
        }
    }
}
