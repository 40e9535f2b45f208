package dev.idbroker.transport;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class EnvelopeCodecTest {

    private static final String SILENT_REQUEST =
        "{\"acquireTokenSilently\":[\"0.1\",\"corr-123\",\"{\\\"scope\\\":\\\"x\\\"}\"]}";

    private final EnvelopeCodec codec = new EnvelopeCodec();

    @Test
    void decodesSilentTokenRequest() {
        Optional<Envelope> envelope = decode(SILENT_REQUEST);

        assertTrue(envelope.isPresent());
        assertEquals(Operation.ACQUIRE_TOKEN_SILENTLY, envelope.get().operation());
        assertEquals("0.1", envelope.get().protocolVersion());
        assertEquals("corr-123", envelope.get().correlationId());
        assertEquals("{\"scope\":\"x\"}", envelope.get().requestJson());
    }

    @Test
    void encodedEnvelopeDecodesToSameFields() throws Exception {
        Envelope original = new Envelope(Operation.GENERATE_SIGNED_HTTP_REQUEST, "1.0", "c-é中",
            "{\"nested\":[1,2,\"\\\"q\\\"\"]}");

        byte[] bytes = codec.encode(original);
        Optional<Envelope> decoded = codec.decode(bytes, 0, bytes.length);

        assertEquals(Optional.of(original), decoded);
    }

    @Test
    void encodesSingleKeyObject() throws Exception {
        Envelope envelope = new Envelope(Operation.GET_ACCOUNTS, "0.1", "c1", "{}");

        String json = new String(codec.encode(envelope), StandardCharsets.UTF_8);

        assertEquals("{\"getAccounts\":[\"0.1\",\"c1\",\"{}\"]}", json);
    }

    @Test
    void incompleteInputStaysBuffered() {
        InboundBuffer buffer = new InboundBuffer();
        byte[] bytes = SILENT_REQUEST.getBytes(StandardCharsets.UTF_8);
        int split = bytes.length / 2;

        buffer.append(ByteBuffer.wrap(bytes, 0, split));
        assertTrue(codec.decode(buffer).isEmpty());
        assertEquals(split, buffer.length());

        buffer.append(ByteBuffer.wrap(bytes, split, bytes.length - split));
        assertTrue(codec.decode(buffer).isPresent());
        assertTrue(buffer.isEmpty());
    }

    @Test
    void trailingBytesPreventDecoding() {
        InboundBuffer buffer = new InboundBuffer();
        byte[] bytes = (SILENT_REQUEST + "{").getBytes(StandardCharsets.UTF_8);
        buffer.append(bytes, 0, bytes.length);

        assertTrue(codec.decode(buffer).isEmpty());
        assertEquals(bytes.length, buffer.length());
    }

    @Test
    void rejectsUnknownOperation() {
        assertTrue(decode("{\"deleteEverything\":[\"0.1\",\"c\",\"{}\"]}").isEmpty());
    }

    @Test
    void rejectsWrongArity() {
        assertTrue(decode("{\"getAccounts\":[\"0.1\",\"c\"]}").isEmpty());
        assertTrue(decode("{\"getAccounts\":[\"0.1\",\"c\",\"{}\",\"extra\"]}").isEmpty());
    }

    @Test
    void rejectsNonStringFields() {
        assertTrue(decode("{\"getAccounts\":[\"0.1\",\"c\",{}]}").isEmpty());
        assertTrue(decode("{\"getAccounts\":[0.1,\"c\",\"{}\"]}").isEmpty());
    }

    @Test
    void rejectsMoreThanOneOperation() {
        assertTrue(decode("{\"getAccounts\":[\"0.1\",\"c\",\"{}\"],"
            + "\"removeAccount\":[\"0.1\",\"c\",\"{}\"]}").isEmpty());
    }

    @Test
    void rejectsNonObjectDocuments() {
        assertTrue(decode("[\"getAccounts\"]").isEmpty());
        assertTrue(decode("\"getAccounts\"").isEmpty());
        assertTrue(codec.decode(new byte[0], 0, 0).isEmpty());
    }

    @Test
    void responseIsRawUtf8() {
        byte[] bytes = codec.encodeResponse("{\"token\":\"abc\"}");

        assertArrayEquals("{\"token\":\"abc\"}".getBytes(StandardCharsets.UTF_8), bytes);
        assertEquals("{\"token\":\"abc\"}", codec.decodeResponse(bytes, bytes.length));
    }

    private Optional<Envelope> decode(String json) {
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        return codec.decode(bytes, 0, bytes.length);
    }
}
