package org.eventsourcing.migrations.snapshot.pipeline.codec;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

import org.eventsourcing.migrations.snapshot.pipeline.error.DeserializationException;

/**
 * UTF-8 text payloads. Malformed input is rejected rather than replaced.
 */
public class StringSnapshotSerializer implements SnapshotSerializer<String> {
    public static final int IDENTIFIER = 20;

    @Override
    public int identifier() {
        return IDENTIFIER;
    }

    @Override
    public String fromBinary(byte[] bytes, String manifest) {
        var decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            throw new DeserializationException("Payload is not valid UTF-8", e);
        }
    }

    @Override
    public byte[] toBinary(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
