package io.github.flameyossnowy.recordmapper.mongodb.codec;

import io.github.flameyossnowy.recordmapper.api.RecordMapper;
import io.github.flameyossnowy.recordmapper.api.exceptions.RecordMappingException;
import io.github.flameyossnowy.recordmapper.api.meta.FieldDescriptor;
import io.github.flameyossnowy.recordmapper.api.meta.RecordTypeDescriptor;
import org.bson.BsonReader;
import org.bson.BsonWriter;
import org.bson.Document;
import org.bson.codecs.Codec;
import org.bson.codecs.DecoderContext;
import org.bson.codecs.EncoderContext;
import org.bson.codecs.configuration.CodecRegistry;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Encodes a record as a BSON document keyed by external field names and decodes it back
 * through {@link MongoDocumentBridge} and {@link RecordMapper#materialize}.
 * <p>
 * Enums are written by name, collections as arrays and maps as sub-documents. Every other
 * value, nested records included, goes through the registry.
 */
public final class RecordCodec<T> implements Codec<T> {
    private final Class<T> type;
    private final RecordMapper mapper;
    private final MongoCodecConfig config;
    private final CodecRegistry registry;
    private final RecordTypeDescriptor descriptor;

    public RecordCodec(@NotNull Class<T> type, @NotNull RecordMapper mapper,
                       @NotNull MongoCodecConfig config, @NotNull CodecRegistry registry) {
        this.type = type;
        this.mapper = mapper;
        this.config = config;
        this.registry = registry;
        this.descriptor = mapper.descriptor(type);
    }

    @Override
    public void encode(BsonWriter writer, T value, EncoderContext encoderContext) {
        writer.writeStartDocument();
        for (FieldDescriptor field : descriptor.fields()) {
            Object fieldValue = read(field, value);

            if (field.optional()) {
                Optional<?> optional = (Optional<?>) fieldValue;
                if (optional == null || optional.isEmpty()) {
                    if (config.noneHandling() == NoneHandling.ENCODE) {
                        writer.writeName(field.externalName());
                        writer.writeNull();
                    }
                    continue;
                }
                fieldValue = optional.get();
            }

            writer.writeName(field.externalName());
            writeValue(writer, fieldValue, encoderContext);
        }
        writer.writeEndDocument();
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private void writeValue(BsonWriter writer, Object value, EncoderContext encoderContext) {
        if (value == null) {
            writer.writeNull();
        } else if (value instanceof Enum<?> constant) {
            writer.writeString(constant.name());
        } else if (value instanceof Collection<?> collection) {
            writer.writeStartArray();
            for (Object element : collection) {
                writeValue(writer, element, encoderContext);
            }
            writer.writeEndArray();
        } else if (value instanceof Map<?, ?> map) {
            writer.writeStartDocument();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                writer.writeName(String.valueOf(entry.getKey()));
                writeValue(writer, entry.getValue(), encoderContext);
            }
            writer.writeEndDocument();
        } else {
            Codec codec = registry.get(value.getClass());
            encoderContext.encodeWithChildContext(codec, writer, value);
        }
    }

    private Object read(FieldDescriptor field, T value) {
        Method accessor = field.accessor();
        if (accessor == null) {
            throw new RecordMappingException("Field '" + field.name() + "' of " + type.getName() + " has no accessor to encode from");
        }
        try {
            return accessor.invoke(value);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new RecordMappingException("Failed to read field '" + field.name() + "' of " + type.getName(), e);
        }
    }

    @Override
    public T decode(BsonReader reader, DecoderContext decoderContext) {
        Document document = registry.get(Document.class).decode(reader, decoderContext);
        return mapper.materialize(type, MongoDocumentBridge.toRawMap(document));
    }

    @Override
    public Class<T> getEncoderClass() {
        return type;
    }
}
