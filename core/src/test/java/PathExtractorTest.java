import io.github.flameyossnowy.recordmapper.api.MapperSettings;
import io.github.flameyossnowy.recordmapper.api.RecordMapper;
import io.github.flameyossnowy.recordmapper.api.annotations.DocumentField;
import io.github.flameyossnowy.recordmapper.api.path.FieldPathMapping;
import io.github.flameyossnowy.recordmapper.api.path.PathExpression;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PathExtractorTest {
    record TreeNode(String label, Optional<TreeNode> parent) {}

    record Wrapper(Optional<Tier> tier, Optional<List<String>> aliases) {}

    record Office(@DocumentField("t") String title, Address address, int floor) {}

    @SuppressWarnings("unchecked")
    private static Map<String, Object> unflatten(Map<String, Object> flat) {
        Map<String, Object> root = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : flat.entrySet()) {
            String[] segments = entry.getKey().split("\\.");
            Map<String, Object> current = root;
            for (int i = 0; i < segments.length - 1; i++) {
                current = (Map<String, Object>) current.computeIfAbsent(segments[i], key -> new LinkedHashMap<>());
            }
            current.put(segments[segments.length - 1], entry.getValue());
        }
        return root;
    }

    private final RecordMapper mapper = RecordMapper.defaults();

    private static List<String> sources(List<FieldPathMapping> mappings) {
        return mappings.stream().map(FieldPathMapping::source).toList();
    }

    @Test
    void flat_record_yields_one_pair_per_field() {
        List<FieldPathMapping> mappings = mapper.extractPaths(Address.class);
        assertEquals(List.of("street", "c", "zip"), sources(mappings));
    }

    @Test
    void pairs_are_identity_mappings() {
        for (FieldPathMapping mapping : mapper.extractPaths(Customer.class)) {
            assertEquals(mapping.source(), mapping.target());
        }
    }

    @Test
    void customer_paths_follow_declaration_order() {
        assertEquals(List.of(
            "n",
            "age",
            "address.street",
            "address.c",
            "address.zip",
            "billing.street",
            "billing.c",
            "billing.zip",
            "nickname.value",
            "tags",
            "scores",
            "tier"
        ), sources(mapper.extractPaths(Customer.class)));
    }

    @Test
    void collections_of_records_are_skipped() {
        assertTrue(sources(mapper.extractPaths(Customer.class)).stream().noneMatch(path -> path.startsWith("skills")));
    }

    @Test
    void optional_value_segment_can_be_disabled() {
        RecordMapper plain = RecordMapper.builder()
            .settings(MapperSettings.defaults().withoutOptionalScalarValueSegment())
            .build();

        List<String> paths = sources(plain.extractPaths(Customer.class));
        assertTrue(paths.contains("nickname"));
        assertFalse(paths.contains("nickname.value"));
        assertTrue(paths.contains("billing.zip"));
    }

    @Test
    void optional_enums_and_collections_get_the_value_segment() {
        assertEquals(List.of("tier.value", "aliases.value"), sources(mapper.extractPaths(Wrapper.class)));
    }

    @Test
    void recursive_types_stop_at_the_repeated_field() {
        assertEquals(List.of("label", "parent"), sources(mapper.extractPaths(TreeNode.class)));
    }

    @Test
    void extraction_is_idempotent() {
        assertEquals(mapper.extractPaths(Customer.class), mapper.extractPaths(Customer.class));
    }

    @Test
    void extracted_record_paths_match_resolution() {
        // Every extracted path without the legacy value segment resolves back to itself.
        RecordMapper plain = RecordMapper.builder()
            .settings(MapperSettings.defaults().withoutOptionalScalarValueSegment())
            .build();

        assertEquals("address.zip", plain.resolvePath(Customer.class, PathExpression.parse("address.zipCode")));
        assertTrue(sources(plain.extractPaths(Customer.class)).contains("address.zip"));
        assertEquals("billing.c", plain.resolvePath(Customer.class, "billing", "city"));
        assertTrue(sources(plain.extractPaths(Customer.class)).contains("billing.c"));
    }

    @Test
    void field_map_preserves_order() {
        Map<String, String> fieldMap = mapper.fieldMap(Address.class);
        assertEquals(List.of("street", "c", "zip"), List.copyOf(fieldMap.keySet()));
        assertEquals("c", fieldMap.get("c"));
        assertThrows(UnsupportedOperationException.class, () -> fieldMap.put("x", "y"));
    }

    @Test
    void result_list_is_immutable() {
        List<FieldPathMapping> mappings = mapper.extractPaths(Address.class);
        assertThrows(UnsupportedOperationException.class, () -> mappings.add(FieldPathMapping.identity("x")));
    }

    @Test
    void values_placed_under_extracted_paths_materialize_back() {
        Map<String, Object> samples = new LinkedHashMap<>();
        samples.put("t", "HQ");
        samples.put("address.street", "Main");
        samples.put("address.c", "NY");
        samples.put("address.zip", 10001);
        samples.put("floor", 3);

        Map<String, Object> flat = new LinkedHashMap<>();
        for (FieldPathMapping mapping : mapper.extractPaths(Office.class)) {
            assertTrue(samples.containsKey(mapping.target()), mapping.target());
            flat.put(mapping.target(), samples.get(mapping.target()));
        }
        assertEquals(samples.keySet(), flat.keySet());

        Office office = mapper.materialize(Office.class, unflatten(flat));
        assertEquals("HQ", office.title());
        assertEquals("Main", office.address().street());
        assertEquals("NY", office.address().city());
        assertEquals(10001, office.address().zipCode());
        assertEquals(3, office.floor());
    }
}
