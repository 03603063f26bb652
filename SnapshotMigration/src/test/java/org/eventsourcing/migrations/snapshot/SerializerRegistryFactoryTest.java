package org.eventsourcing.migrations.snapshot;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;

import org.eventsourcing.migrations.snapshot.pipeline.codec.JsonSnapshotSerializer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SerializerRegistryFactoryTest {

    public record Cart(String owner, int items) {}

    @Test
    void builtInSerializersAreAlwaysRegistered() {
        var registry = SerializerRegistryFactory.create(MigrationConfig.builder().defaultSerializerId(20).build());

        assertEquals(Set.of(4, 20, 30), registry.registeredIds());
        assertEquals(20, registry.getDefaultSerializerId());
    }

    @Test
    void typedJsonSerializersAreRegisteredPerManifest() {
        var config = MigrationConfig.builder()
            .jsonSerializers(List.of(JsonSerializerConfig.builder()
                .identifier(JsonSnapshotSerializer.DEFAULT_IDENTIFIER)
                .manifest("Cart")
                .type(Cart.class.getName())
                .build()))
            .build();

        var registry = SerializerRegistryFactory.create(config);
        var value = registry.resolve(30, "Cart")
            .fromBinary("{\"owner\":\"ann\",\"items\":2}".getBytes(StandardCharsets.UTF_8), "Cart");

        assertEquals(new Cart("ann", 2), value);
        assertInstanceOf(JsonNode.class,
            registry.resolve(30, "Other").fromBinary("{}".getBytes(StandardCharsets.UTF_8), "Other"));
    }

    @Test
    void unknownTypeIsAConfigurationError() {
        var config = MigrationConfig.builder()
            .jsonSerializers(List.of(JsonSerializerConfig.builder().identifier(31).type("com.example.Missing").build()))
            .build();

        assertThrows(InvalidConfigurationException.class, () -> SerializerRegistryFactory.create(config));
    }

    @Test
    void clashingIdIsAConfigurationError() {
        var config = MigrationConfig.builder()
            .jsonSerializers(List.of(JsonSerializerConfig.builder().identifier(20).type(Cart.class.getName()).build()))
            .build();

        assertThrows(InvalidConfigurationException.class, () -> SerializerRegistryFactory.create(config));
    }
}
