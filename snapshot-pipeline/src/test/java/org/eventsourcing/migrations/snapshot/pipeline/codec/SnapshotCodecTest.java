package org.eventsourcing.migrations.snapshot.pipeline.codec;

import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.databind.JsonNode;

import org.eventsourcing.migrations.snapshot.pipeline.error.DeserializationException;
import org.eventsourcing.migrations.snapshot.pipeline.ir.LegacySnapshotRow;
import org.eventsourcing.migrations.snapshot.pipeline.ir.SnapshotMetadata;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotCodecTest {

    private static final int ACCOUNT_SERIALIZER = 31;

    private final SnapshotCodec codec = new SnapshotCodec(SerializerRegistry.builder()
        .register(new ByteArraySnapshotSerializer())
        .register(new StringSnapshotSerializer())
        .register(JsonSnapshotSerializer.tree())
        .register("account.v1", JsonSnapshotSerializer.typed(ACCOUNT_SERIALIZER, Account.class, "account.v1"))
        .build());

    private static LegacySnapshotRow row(byte[] payload, Integer serializerId, String manifest) {
        return new LegacySnapshotRow("account-17", 12, 1_700_000_000_000L, payload, serializerId, manifest);
    }

    private static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void decodeCarriesMetadataAlongsideThePayload() {
        var decoded = codec.decode(row(utf8("state"), StringSnapshotSerializer.IDENTIFIER, null));

        assertEquals(new SnapshotMetadata("account-17", 12, 1_700_000_000_000L), decoded.metadata());
        assertEquals("state", decoded.payload().value());
    }

    @Test
    void rowWithoutSerializerIdIsDecodedAsRawBytes() {
        var bytes = new byte[] { (byte) 0xCA, (byte) 0xFE };

        var decoded = codec.decode(row(bytes, null, null));

        assertArrayEquals(bytes, (byte[]) decoded.payload().value());
        var encoded = codec.encode(decoded.payload());
        assertEquals(ByteArraySnapshotSerializer.IDENTIFIER, encoded.serializerId());
        assertEquals("", encoded.manifest());
        assertArrayEquals(bytes, encoded.bytes());
    }

    @Test
    void typedJsonPayloadIsBoundToItsRegisteredClass() {
        var decoded = codec.decode(row(utf8("{\"owner\":\"ada\",\"balance\":42}"), ACCOUNT_SERIALIZER, "account.v1"));

        assertEquals(new Account("ada", 42), decoded.payload().value());
        var encoded = codec.encode(decoded.payload());
        assertEquals(ACCOUNT_SERIALIZER, encoded.serializerId());
        assertEquals("account.v1", encoded.manifest());
        assertEquals(decoded.payload().value(),
            codec.decode(row(encoded.bytes(), encoded.serializerId(), encoded.manifest())).payload().value());
    }

    @Test
    void jsonTreeSurvivesReencoding() {
        var decoded = codec.decode(row(utf8("{ \"a\" : [1, 2] }"), JsonSnapshotSerializer.DEFAULT_IDENTIFIER, ""));

        var tree = (JsonNode) decoded.payload().value();
        assertEquals(2, tree.get("a").size());
        assertEquals("{\"a\":[1,2]}", new String(codec.encode(decoded.payload()).bytes(), StandardCharsets.UTF_8));
    }

    @Test
    void storedManifestIsWrittenBackUnchanged() {
        var json = codec.decode(row(utf8("{\"items\":3}"), JsonSnapshotSerializer.DEFAULT_IDENTIFIER, "com.acme.Cart"));
        var bytes = codec.decode(row(new byte[] { 7 }, ByteArraySnapshotSerializer.IDENTIFIER, "v2"));
        var text = codec.decode(row(utf8("state"), StringSnapshotSerializer.IDENTIFIER, "cart-state"));

        assertEquals("com.acme.Cart", codec.encode(json.payload()).manifest());
        assertEquals("v2", codec.encode(bytes.payload()).manifest());
        assertEquals("cart-state", codec.encode(text.payload()).manifest());
    }

    @Test
    void nullManifestIsWrittenAsEmpty() {
        var decoded = codec.decode(row(utf8("{}"), JsonSnapshotSerializer.DEFAULT_IDENTIFIER, null));

        assertEquals("", codec.encode(decoded.payload()).manifest());
    }

    @Test
    void jsonDecimalsKeepTheirExactDigits() {
        var json = "{\"amount\":12345678901234567.89,\"rate\":1.10,"
            + "\"count\":123456789012345678901234567890}";

        var decoded = codec.decode(row(utf8(json), JsonSnapshotSerializer.DEFAULT_IDENTIFIER, ""));

        assertEquals(json, new String(codec.encode(decoded.payload()).bytes(), StandardCharsets.UTF_8));
    }

    @Test
    void malformedUtf8IsRejected() {
        var error = assertThrows(DeserializationException.class,
            () -> codec.decode(row(new byte[] { (byte) 0xC3, (byte) 0x28 }, StringSnapshotSerializer.IDENTIFIER, "")));

        assertTrue(error.getMessage().contains("account-17"));
        assertTrue(error.getMessage().contains("12"));
    }

    @Test
    void malformedJsonIsRejected() {
        assertThrows(DeserializationException.class,
            () -> codec.decode(row(utf8("{\"owner\":"), JsonSnapshotSerializer.DEFAULT_IDENTIFIER, "")));
        assertThrows(DeserializationException.class,
            () -> codec.decode(row(utf8("{} {}"), JsonSnapshotSerializer.DEFAULT_IDENTIFIER, "")));
        assertThrows(DeserializationException.class,
            () -> codec.decode(row(new byte[0], JsonSnapshotSerializer.DEFAULT_IDENTIFIER, "")));
    }

    @Test
    void jsonNotMatchingTheRegisteredClassIsRejected() {
        assertThrows(DeserializationException.class,
            () -> codec.decode(row(utf8("{\"owner\":\"ada\",\"color\":\"red\"}"), ACCOUNT_SERIALIZER, "account.v1")));
    }

    @Test
    void unregisteredSerializerIsRejected() {
        var error = assertThrows(DeserializationException.class,
            () -> codec.decode(row(utf8("x"), 5, "")));

        assertTrue(error.getMessage().contains("No serializer registered for id 5"));
    }

    @Test
    void rowWithoutPayloadIsRejected() {
        assertThrows(DeserializationException.class,
            () -> codec.decode(row(null, StringSnapshotSerializer.IDENTIFIER, "")));
    }

    public record Account(String owner, long balance) {}
}
