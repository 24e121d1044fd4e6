package io.github.flameyossnowy.recordmapper.mongodb.codec;

import com.mongodb.MongoClientSettings;
import org.bson.BsonDocument;
import org.bson.BsonDocumentReader;
import org.bson.BsonValue;
import org.bson.Document;
import org.bson.codecs.DecoderContext;
import org.bson.codecs.DocumentCodec;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns BSON trees into the plain maps, lists and Java values that
 * {@link io.github.flameyossnowy.recordmapper.api.RecordMapper#materialize} expects.
 * <p>
 * BSON values are converted by the driver's {@link DocumentCodec} over the default registry,
 * the same conversion {@link RecordCodec} applies, so dates come back as {@code java.util.Date},
 * binaries as {@code Binary} or {@code UUID}, and so on.
 */
public final class MongoDocumentBridge {
    private static final DocumentCodec DOCUMENT_CODEC = new DocumentCodec(MongoClientSettings.getDefaultCodecRegistry());

    private MongoDocumentBridge() {
        throw new AssertionError("No instances");
    }

    /**
     * Parses (Extended) JSON text describing one document.
     */
    public static @NotNull Map<String, Object> jsonToRawMap(@NotNull String json) {
        return toRawMap(BsonDocument.parse(json));
    }

    public static @NotNull Map<String, Object> toRawMap(@NotNull BsonDocument document) {
        Document decoded = DOCUMENT_CODEC.decode(new BsonDocumentReader(document), DecoderContext.builder().build());
        return toRawMap(decoded);
    }

    /**
     * Copies a driver {@link Document}, replacing nested documents with plain maps.
     */
    public static @NotNull Map<String, Object> toRawMap(@NotNull Document document) {
        Map<String, Object> out = new LinkedHashMap<>(document.size() * 2);
        for (Map.Entry<String, Object> entry : document.entrySet()) {
            out.put(entry.getKey(), javaValue(entry.getValue()));
        }
        return out;
    }

    public static @Nullable Object bsonValueToJava(@Nullable BsonValue value) {
        if (value == null) return null;

        // Wrap to reuse the document conversion for non-document values.
        return toRawMap(new BsonDocument("v", value)).get("v");
    }

    private static Object javaValue(Object value) {
        if (value instanceof Document nested) {
            return toRawMap(nested);
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object element : list) {
                out.add(javaValue(element));
            }
            return out;
        }
        return value;
    }
}
