package org.eventsourcing.migrations.snapshot.pipeline.codec;

import org.eventsourcing.migrations.snapshot.pipeline.error.DeserializationException;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SerializerRegistryTest {

    @Test
    void resolvesRegisteredSerializerById() {
        var registry = SerializerRegistry.defaults();

        assertInstanceOf(StringSnapshotSerializer.class, registry.resolve(StringSnapshotSerializer.IDENTIFIER, ""));
        assertInstanceOf(JsonSnapshotSerializer.class, registry.resolve(JsonSnapshotSerializer.DEFAULT_IDENTIFIER, "x"));
    }

    @Test
    void missingSerializerIdFallsBackToTheDefault() {
        var registry = SerializerRegistry.builder()
            .register(new ByteArraySnapshotSerializer())
            .register(new StringSnapshotSerializer())
            .defaultSerializerId(StringSnapshotSerializer.IDENTIFIER)
            .build();

        assertInstanceOf(StringSnapshotSerializer.class, registry.resolve(null, null));
        assertEquals(StringSnapshotSerializer.IDENTIFIER, registry.getDefaultSerializerId());
    }

    @Test
    void exactManifestTakesPrecedenceOverAnyManifest() {
        var generic = JsonSnapshotSerializer.tree();
        var account = JsonSnapshotSerializer.typed(JsonSnapshotSerializer.DEFAULT_IDENTIFIER, Account.class, "account");
        var registry = SerializerRegistry.builder()
            .register(generic)
            .register("account", account)
            .build();

        assertSame(account, registry.resolve(JsonSnapshotSerializer.DEFAULT_IDENTIFIER, "account"));
        assertSame(generic, registry.resolve(JsonSnapshotSerializer.DEFAULT_IDENTIFIER, "order"));
        assertSame(generic, registry.resolve(JsonSnapshotSerializer.DEFAULT_IDENTIFIER, null));
    }

    @Test
    void manifestOnlyRegistrationDoesNotMatchOtherManifests() {
        var registry = SerializerRegistry.builder()
            .register("account", JsonSnapshotSerializer.typed(42, Account.class, "account"))
            .build();

        assertNotNull(registry.resolve(42, "account"));
        var error = assertThrows(DeserializationException.class, () -> registry.resolve(42, "order"));
        assertTrue(error.getMessage().contains("42"));
    }

    @Test
    void unregisteredIdIsADeserializationError() {
        var registry = SerializerRegistry.defaults();

        assertThrows(DeserializationException.class, () -> registry.resolve(77, ""));
    }

    @Test
    void registeringAnIdTwiceIsRejected() {
        var builder = SerializerRegistry.builder().register(new StringSnapshotSerializer());

        assertThrows(IllegalArgumentException.class, () -> builder.register(new StringSnapshotSerializer()));
    }

    @Test
    void registeredIdsIncludeManifestRegistrations() {
        var registry = SerializerRegistry.builder()
            .register(new ByteArraySnapshotSerializer())
            .register("account", JsonSnapshotSerializer.typed(42, Account.class, "account"))
            .build();

        assertEquals(java.util.Set.of(ByteArraySnapshotSerializer.IDENTIFIER, 42), registry.registeredIds());
    }

    public record Account(String owner, long balance) {}
}
