import io.github.flameyossnowy.recordmapper.mongodb.MongoRecordMapping;
import io.github.flameyossnowy.recordmapper.mongodb.codec.MongoCodecConfig;
import io.github.flameyossnowy.recordmapper.mongodb.codec.NoneHandling;
import io.github.flameyossnowy.recordmapper.mongodb.codec.RecordCodec;
import org.bson.BsonDocument;
import org.bson.BsonDocumentReader;
import org.bson.BsonDocumentWriter;
import org.bson.Document;
import org.bson.codecs.Codec;
import org.bson.codecs.DecoderContext;
import org.bson.codecs.EncoderContext;
import org.bson.codecs.configuration.CodecRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RecordCodecTest {
    private static final Account ACCOUNT = new Account(
        "a-1",
        "Flow",
        21,
        Optional.of(new Address("5th Avenue", "NY", 10001)),
        Optional.empty(),
        List.of("admin", "dev"),
        Map.of("logins", 12L),
        Tier.SILVER
    );

    private static BsonDocument encode(CodecRegistry registry, Account account) {
        BsonDocument document = new BsonDocument();
        registry.get(Account.class).encode(new BsonDocumentWriter(document), account, EncoderContext.builder().build());
        return document;
    }

    @Test
    void registry_provides_record_codecs() {
        CodecRegistry registry = MongoRecordMapping.create().codecRegistry();
        assertInstanceOf(RecordCodec.class, registry.get(Account.class));
        assertEquals(Account.class, registry.get(Account.class).getEncoderClass());
        assertFalse(registry.get(Document.class) instanceof RecordCodec);
    }

    @Test
    void encode_uses_external_names() {
        BsonDocument document = encode(MongoRecordMapping.create().codecRegistry(), ACCOUNT);

        assertEquals("a-1", document.getString("_id").getValue());
        assertEquals("Flow", document.getString("n").getValue());
        assertEquals(21, document.getInt32("age").getValue());
        assertEquals("SILVER", document.getString("tier").getValue());
        assertEquals(2, document.getArray("roles").size());
        assertEquals(12L, document.getDocument("counters").getInt64("logins").getValue());

        BsonDocument address = document.getDocument("address");
        assertEquals("NY", address.getString("c").getValue());
        assertEquals(10001, address.getInt32("zip").getValue());
        assertFalse(document.containsKey("id"));
    }

    @Test
    void empty_optional_is_written_as_null_by_default() {
        BsonDocument document = encode(MongoRecordMapping.create().codecRegistry(), ACCOUNT);
        assertTrue(document.containsKey("nickname"));
        assertTrue(document.get("nickname").isNull());
    }

    @Test
    void empty_optional_can_be_omitted() {
        MongoRecordMapping mapping = MongoRecordMapping.create(MongoCodecConfig.defaults().withIgnoreNone());
        assertEquals(NoneHandling.IGNORE, mapping.config().noneHandling());

        BsonDocument document = encode(mapping.codecRegistry(), ACCOUNT);
        assertFalse(document.containsKey("nickname"));
    }

    @Test
    void round_trip_restores_the_record() {
        CodecRegistry registry = MongoRecordMapping.create().codecRegistry();
        BsonDocument document = encode(registry, ACCOUNT);

        Codec<Account> codec = registry.get(Account.class);
        Account decoded = codec.decode(new BsonDocumentReader(document), DecoderContext.builder().build());
        assertEquals(ACCOUNT, decoded);
    }

    @Test
    void round_trip_without_none_values() {
        CodecRegistry registry = MongoRecordMapping.create(MongoCodecConfig.defaults().withIgnoreNone()).codecRegistry();
        Account account = new Account("a-2", "Kai", 40, Optional.empty(), Optional.of("k"), List.of(), Map.of(), Tier.GOLD);

        Account decoded = registry.get(Account.class)
            .decode(new BsonDocumentReader(encode(registry, account)), DecoderContext.builder().build());
        assertEquals(account, decoded);
    }

    @Test
    void config_switches_back_to_encoding_none() {
        MongoCodecConfig config = MongoCodecConfig.defaults().withIgnoreNone().withEncodeNone();
        assertEquals(MongoCodecConfig.defaults(), config);
        assertEquals(NoneHandling.ENCODE, config.noneHandling());
    }
}
