package dev.idbroker.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Codec for the stream-socket protocol. A request is a single UTF-8 JSON object whose only key
 * is the operation wire name and whose value is a three element string array:
 *
 * <pre>{"acquireTokenSilently":["0.1","corr-123","{\"scope\":\"x\"}"]}</pre>
 *
 * <p>There is no length prefix. A buffer decodes only when it holds exactly one complete document;
 * anything else means "no message yet", so only one request may be in flight per connection.
 * Each arrival re-parses the whole buffer, so callers cap how much they accumulate.
 * Responses are the raw UTF-8 bytes of the result string with no terminator.
 */
public final class EnvelopeCodec {

    private static final int FIELD_COUNT = 3;

    private final ObjectMapper mapper;
    private final ObjectReader reader;

    public EnvelopeCodec() {
        this(new ObjectMapper());
    }

    public EnvelopeCodec(ObjectMapper mapper) {
        this.mapper = mapper;
        this.reader = mapper.readerFor(JsonNode.class).with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public byte[] encode(Envelope envelope) throws JsonProcessingException {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode fields = root.putArray(envelope.operation().wireName());
        fields.add(envelope.protocolVersion());
        fields.add(envelope.correlationId());
        fields.add(envelope.requestJson());
        return mapper.writeValueAsBytes(root);
    }

    /**
     * Attempt to decode the whole buffer. On success the buffer is cleared; otherwise it is left
     * untouched so that later arrivals can complete the document.
     */
    public Optional<Envelope> decode(InboundBuffer buffer) {
        Optional<Envelope> envelope = decode(buffer.array(), 0, buffer.length());
        if (envelope.isPresent()) {
            buffer.clear();
        }
        return envelope;
    }

    public Optional<Envelope> decode(byte[] data, int offset, int length) {
        if (length == 0) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = reader.readValue(data, offset, length);
        } catch (IOException incomplete) {
            return Optional.empty();
        }
        return toEnvelope(root);
    }

    public byte[] encodeResponse(String result) {
        return result.getBytes(StandardCharsets.UTF_8);
    }

    public String decodeResponse(byte[] data, int length) {
        return new String(data, 0, length, StandardCharsets.UTF_8);
    }

    private Optional<Envelope> toEnvelope(JsonNode root) {
        if (root == null || !root.isObject() || root.size() != 1) {
            return Optional.empty();
        }
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        Map.Entry<String, JsonNode> entry = fields.next();
        Optional<Operation> operation = Operation.fromWireName(entry.getKey());
        JsonNode values = entry.getValue();
        if (operation.isEmpty() || !values.isArray() || values.size() != FIELD_COUNT) {
            return Optional.empty();
        }
        for (JsonNode value : values) {
            if (!value.isTextual()) {
                return Optional.empty();
            }
        }
        return Optional.of(new Envelope(operation.get(),
            values.get(0).asText(),
            values.get(1).asText(),
            values.get(2).asText()));
    }
}
