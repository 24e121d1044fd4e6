import io.github.flameyossnowy.recordmapper.api.RecordMapper;
import io.github.flameyossnowy.recordmapper.api.annotations.DefaultValue;
import io.github.flameyossnowy.recordmapper.api.annotations.DocumentField;
import io.github.flameyossnowy.recordmapper.api.annotations.EnumCode;
import io.github.flameyossnowy.recordmapper.api.exceptions.DescriptorException;
import io.github.flameyossnowy.recordmapper.api.meta.DescriptorRegistry;
import io.github.flameyossnowy.recordmapper.api.meta.ExternalNameResolver;
import io.github.flameyossnowy.recordmapper.api.meta.FieldDescriptor;
import io.github.flameyossnowy.recordmapper.api.meta.FieldShape;
import io.github.flameyossnowy.recordmapper.api.meta.RecordComponentMetadataProvider;
import io.github.flameyossnowy.recordmapper.api.meta.RecordTypeDescriptor;
import io.github.flameyossnowy.recordmapper.api.meta.TypeMetadataProvider;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DescriptorRegistryTest {
    record Clashing(@DocumentField("x") String first, @DocumentField("x") String second) {}

    record Dotted(@DocumentField("a.b") String value) {}

    record BadDefault(@DefaultValue("not-a-number") int count) {}

    record CodeOnString(@EnumCode("code") String status) {}

    record MissingAccessor(@EnumCode("label") Status status) {}

    static final class NotARecord {}

    @Test
    void descriptor_lists_fields_in_declaration_order() {
        RecordTypeDescriptor descriptor = RecordMapper.defaults().descriptor(Customer.class);

        List<String> names = descriptor.fields().stream().map(FieldDescriptor::name).toList();
        assertEquals(List.of("name", "age", "address", "billing", "nickname", "tags", "scores", "skills", "tier"), names);
        assertEquals(9, descriptor.size());
        assertSame(descriptor.field("name"), descriptor.fieldByExternalName("n"));
    }

    @Test
    void fields_are_classified() {
        RecordTypeDescriptor descriptor = RecordMapper.defaults().descriptor(Customer.class);

        FieldDescriptor billing = descriptor.field("billing");
        assertTrue(billing.optional());
        assertEquals(FieldShape.RECORD, billing.shape());
        assertEquals(Address.class, billing.navigableType());

        FieldDescriptor scores = descriptor.field("scores");
        assertEquals(FieldShape.MAP, scores.shape());
        assertEquals(String.class, scores.keyType());
        assertEquals(Integer.class, scores.elementType());

        FieldDescriptor skills = descriptor.field("skills");
        assertTrue(skills.hasRecordElements());
        assertEquals(Skill.class, skills.navigableType());

        FieldDescriptor tier = descriptor.field("tier");
        assertEquals(FieldShape.ENUM, tier.shape());
        assertEquals(List.of("BRONZE", "SILVER", "GOLD"), tier.enumConstants());
        assertTrue(tier.hasDefault());
        assertEquals(Tier.BRONZE, tier.defaultValue().get());

        assertNull(descriptor.field("age").navigableType());
    }

    @Test
    void provider_is_called_once_per_type() {
        TypeMetadataProvider provider = spy(new RecordComponentMetadataProvider());
        DescriptorRegistry registry = new DescriptorRegistry(provider);

        assertFalse(registry.isCached(Address.class));
        RecordTypeDescriptor first = registry.describe(Address.class);
        RecordTypeDescriptor second = registry.describe(Address.class);

        assertSame(first, second);
        assertTrue(registry.isCached(Address.class));
        verify(provider, times(1)).describe(Address.class);
    }

    @Test
    void nested_types_are_described_lazily() {
        TypeMetadataProvider provider = spy(new RecordComponentMetadataProvider());
        DescriptorRegistry registry = new DescriptorRegistry(provider);

        registry.describe(Customer.class);
        verify(provider, never()).describe(Address.class);
        assertFalse(registry.isCached(Address.class));
    }

    @Test
    void concurrent_lookups_share_one_descriptor() throws Exception {
        TypeMetadataProvider provider = spy(new RecordComponentMetadataProvider());
        DescriptorRegistry registry = new DescriptorRegistry(provider);

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<RecordTypeDescriptor>> tasks = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                tasks.add(() -> registry.describe(Customer.class));
            }

            RecordTypeDescriptor expected = null;
            for (Future<RecordTypeDescriptor> future : executor.invokeAll(tasks)) {
                RecordTypeDescriptor descriptor = future.get();
                if (expected == null) {
                    expected = descriptor;
                }
                assertSame(expected, descriptor);
            }
        } finally {
            executor.shutdownNow();
        }

        verify(provider, times(1)).describe(Customer.class);
    }

    @Test
    void custom_provider_is_used_by_the_mapper() {
        TypeMetadataProvider provider = mock(TypeMetadataProvider.class);
        RecordTypeDescriptor descriptor = new RecordComponentMetadataProvider().describe(Address.class);
        when(provider.describe(Address.class)).thenReturn(descriptor);

        RecordMapper mapper = RecordMapper.builder().provider(provider).build();
        assertEquals("c", mapper.resolvePath(Address.class, "city"));
        verify(provider).describe(Address.class);
    }

    @Test
    void name_resolver_can_disable_renames() {
        RecordMapper mapper = RecordMapper.builder().nameResolver(ExternalNameResolver.none()).build();

        assertEquals("city", mapper.resolvePath(Address.class, "city"));
        assertEquals(new Address("Main", "Paris", 75001),
            mapper.materialize(Address.class, Map.of("street", "Main", "city", "Paris", "zipCode", 75001)));
    }

    @Test
    void first_resolver_with_an_override_wins() {
        ExternalNameResolver upper = component -> component.getName().equals("street") ? "STREET" : null;
        RecordMapper mapper = RecordMapper.builder()
            .nameResolver(ExternalNameResolver.firstOf(upper, ExternalNameResolver.documentField()))
            .build();

        assertEquals("STREET", mapper.resolvePath(Address.class, "street"));
        assertEquals("c", mapper.resolvePath(Address.class, "city"));
    }

    @Test
    void provider_and_name_resolver_are_exclusive() {
        RecordMapper.Builder builder = RecordMapper.builder()
            .provider(new RecordComponentMetadataProvider())
            .nameResolver(ExternalNameResolver.none());
        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void duplicate_external_names_are_rejected() {
        DescriptorException e = assertThrows(DescriptorException.class,
            () -> RecordMapper.defaults().descriptor(Clashing.class));
        assertEquals(Clashing.class, e.getType());
    }

    @Test
    void dotted_external_names_are_rejected() {
        assertThrows(DescriptorException.class, () -> RecordMapper.defaults().descriptor(Dotted.class));
    }

    @Test
    void invalid_default_literal_is_rejected() {
        assertThrows(DescriptorException.class, () -> RecordMapper.defaults().descriptor(BadDefault.class));
    }

    @Test
    void enum_code_is_validated() {
        assertThrows(DescriptorException.class, () -> RecordMapper.defaults().descriptor(CodeOnString.class));
        assertThrows(DescriptorException.class, () -> RecordMapper.defaults().descriptor(MissingAccessor.class));
    }

    @Test
    void non_records_are_not_describable() {
        DescriptorRegistry registry = DescriptorRegistry.global();
        assertFalse(registry.isDescribable(NotARecord.class));
        assertTrue(registry.isDescribable(Address.class));
        assertThrows(DescriptorException.class, () -> registry.describe(NotARecord.class));
    }
}
