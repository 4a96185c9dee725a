package io.mongomemory.core.relationship;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RelationshipDescriptorTest {

    @Test
    void parsesTypeWithoutProperties() {
        RelationshipDescriptor descriptor = RelationshipDescriptor.parse("works_for");

        assertThat(descriptor.type()).isEqualTo("works_for");
        assertThat(descriptor.properties()).isEmpty();
        assertThat(descriptor.hasProperties()).isFalse();
    }

    @Test
    void trailingColonMeansNoProperties() {
        assertThat(RelationshipDescriptor.parse("works_for:").properties()).isEmpty();
        assertThat(RelationshipDescriptor.parse("works_for:   ").properties()).isEmpty();
    }

    @Test
    void parsesPropertiesInOrderAndTrimsThem() {
        RelationshipDescriptor descriptor = RelationshipDescriptor.parse(" works_for : since = 2020 , role=engineer ");

        assertThat(descriptor.type()).isEqualTo("works_for");
        assertThat(descriptor.properties()).containsExactly(
            Map.entry("since", "2020"),
            Map.entry("role", "engineer")
        );
    }

    @Test
    void splitsOnFirstColonAndFirstEquals() {
        RelationshipDescriptor descriptor = RelationshipDescriptor.parse("links:url=http://x.io/a=b");

        assertThat(descriptor.type()).isEqualTo("links");
        assertThat(descriptor.properties()).containsEntry("url", "http://x.io/a=b");
    }

    @Test
    void allowsEmptyValues() {
        assertThat(RelationshipDescriptor.parse("knows:note=").properties()).containsEntry("note", "");
    }

    @Test
    void rejectsMalformedDescriptors() {
        assertThatThrownBy(() -> RelationshipDescriptor.parse("knows:since"))
            .isInstanceOf(DescriptorFormatException.class)
            .hasMessageContaining("key=value");
        assertThatThrownBy(() -> RelationshipDescriptor.parse("knows:a=1,"))
            .isInstanceOf(DescriptorFormatException.class);
        assertThatThrownBy(() -> RelationshipDescriptor.parse("knows:=1"))
            .isInstanceOf(DescriptorFormatException.class)
            .hasMessageContaining("key must not be blank");
        assertThatThrownBy(() -> RelationshipDescriptor.parse(":a=1"))
            .isInstanceOf(DescriptorFormatException.class)
            .hasMessageContaining("type must not be blank");
        assertThatThrownBy(() -> RelationshipDescriptor.parse("  "))
            .isInstanceOf(DescriptorFormatException.class);
    }

    @Test
    void exceptionKeepsTheOffendingDescriptor() {
        assertThatThrownBy(() -> RelationshipDescriptor.parse("knows:since"))
            .isInstanceOfSatisfying(DescriptorFormatException.class,
                e -> assertThat(e.descriptor()).isEqualTo("knows:since"));
    }

    @Test
    void formatIsTheCanonicalDescriptor() {
        assertThat(RelationshipDescriptor.parse(" knows : since=2020 ").format()).isEqualTo("knows:since=2020");
        assertThat(RelationshipDescriptor.parse("knows").toString()).isEqualTo("knows");
    }

    @Test
    void formattedDescriptorParsesBackToItself() {
        Map<String, String> properties = new LinkedHashMap<>();
        properties.put("url", "http://x.io/a=b");
        properties.put("scope:team", "core team");
        properties.put("note", "");
        RelationshipDescriptor descriptor = new RelationshipDescriptor("works, part time", properties);

        assertThat(RelationshipDescriptor.parse(descriptor.format())).isEqualTo(descriptor);
        assertThat(RelationshipDescriptor.parse(new RelationshipDescriptor("knows", Map.of()).format()))
            .isEqualTo(new RelationshipDescriptor("knows", Map.of()));
    }

    @Test
    void constructorRejectsPartsThatCannotBeFormatted() {
        assertThatThrownBy(() -> new RelationshipDescriptor("tagged", Map.of("tags", "a,b")))
            .isInstanceOf(DescriptorFormatException.class)
            .hasMessageContaining("must not contain ','");
        assertThatThrownBy(() -> new RelationshipDescriptor("knows", Map.of("note", " x ")))
            .isInstanceOf(DescriptorFormatException.class)
            .hasMessageContaining("surrounding whitespace");
        assertThatThrownBy(() -> new RelationshipDescriptor("a:b", Map.of()))
            .isInstanceOf(DescriptorFormatException.class)
            .hasMessageContaining("must not contain ':'");
        assertThatThrownBy(() -> new RelationshipDescriptor("knows", Map.of("a=b", "1")))
            .isInstanceOf(DescriptorFormatException.class)
            .hasMessageContaining("must not contain '='");
        assertThatThrownBy(() -> new RelationshipDescriptor(" knows", Map.of()))
            .isInstanceOf(DescriptorFormatException.class);
        assertThatThrownBy(() -> new RelationshipDescriptor("", Map.of()))
            .isInstanceOf(DescriptorFormatException.class)
            .hasMessageContaining("type must not be blank");
    }
}
