package com.edwardjones.personnelsync.service.logic;

import com.edwardjones.personnelsync.model.domain.AttributeMapping;
import com.edwardjones.personnelsync.model.domain.Person;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AttributeProjector Tests")
class AttributeProjectorTest {

    private final AttributeProjector projector = new AttributeProjector();

    private final List<AttributeMapping> mapping = List.of(
            AttributeMapping.required("email", "email"),
            AttributeMapping.required("first_name", "givenName"),
            AttributeMapping.optional("phone", "phoneNumber"));

    @Test
    @DisplayName("Should keep only mapped attributes under destination keys")
    void shouldRemapToDestinationKeys() {
        // Given
        Person source = Person.of("john_doe@example.com", Map.of(
                "email", "john_doe@example.com",
                "first_name", "John",
                "phone", "555-1212",
                "department", "IT"));

        // When
        List<Person> projected = projector.project(List.of(source), mapping);

        // Then
        assertThat(projected).hasSize(1);
        Person person = projected.get(0);
        assertThat(person.compareKey()).isEqualTo("john_doe@example.com");
        assertThat(person.changesDisabled()).isFalse();
        assertThat(person.attributes()).containsExactlyInAnyOrderEntriesOf(Map.of(
                "email", "john_doe@example.com",
                "givenName", "John",
                "phoneNumber", "555-1212"));
    }

    @Test
    @DisplayName("Should omit missing optional attributes")
    void shouldOmitMissingOptionalAttribute() {
        Person source = Person.of("jane@example.com", Map.of("email", "jane@example.com", "first_name", "Jane"));

        Person person = projector.project(List.of(source), mapping).get(0);

        assertThat(person.changesDisabled()).isFalse();
        assertThat(person.attributes()).doesNotContainKey("phoneNumber");
    }

    @Test
    @DisplayName("Should disable changes when a required attribute is missing")
    void shouldDisableChangesForMissingRequiredAttribute() {
        // Given
        Person missingName = Person.of("bob@example.com", Map.of("email", "bob@example.com"));
        Person complete = Person.of("ann@example.com", Map.of("email", "ann@example.com", "first_name", "Ann"));

        // When
        List<Person> projected = projector.project(List.of(missingName, complete), mapping);

        // Then
        assertThat(projected).extracting(Person::compareKey).containsExactly("bob@example.com", "ann@example.com");
        assertThat(projected.get(0).changesDisabled()).isTrue();
        assertThat(projected.get(0).attributes()).containsOnlyKeys("email");
        assertThat(projected.get(1).changesDisabled()).isFalse();
    }

    @Test
    @DisplayName("Should not carry the source system id into the projected record")
    void shouldDropSourceExternalId() {
        // Given
        Person fromHr = new Person("a@x.com", "HR-777", Map.of("email", "a@x.com", "first_name", "A"), false);

        // When
        Person projected = projector.project(List.of(fromHr), mapping).get(0);
        List<Person> toCreate = new DiffEngine().diff(List.of(projected), List.of()).toCreate();

        // Then
        assertThat(projected.externalId()).isNull();
        assertThat(toCreate).singleElement().extracting(Person::externalId).isNull();
    }

    @Test
    @DisplayName("Should expose source and destination keys in mapping order")
    void shouldListMappingKeys() {
        assertThat(AttributeProjector.sourceKeys(mapping)).containsExactly("email", "first_name", "phone");
        assertThat(AttributeProjector.destinationKeys(mapping)).containsExactly("email", "givenName", "phoneNumber");
    }
}
