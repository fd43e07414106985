package com.rms.possync.core.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * JSON codec between wire frames and {@link SyncMessage} records.
 *
 * <h2>Decoding</h2>
 * <ul>
 *   <li>Frame must parse as a JSON object carrying a non-blank textual {@code type}.</li>
 *   <li>{@code type} is resolved through {@link MessageType}; unknown tokens raise
 *       {@link UnknownMessageTypeException}.</li>
 *   <li>Extra fields are tolerated; a field whose shape does not fit the record raises
 *       {@link MalformedFrameException}.</li>
 * </ul>
 *
 * <h2>Encoding</h2>
 * {@code type} is written first, followed by the non-null record components.
 *
 * <p>Stateless and thread-safe as long as the supplied {@link ObjectMapper} is not reconfigured.</p>
 */
public class SyncMessageCodec {

    private static final String TYPE_FIELD = "type";

    private final ObjectMapper mapper;

    public SyncMessageCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public SyncMessage decode(String frame) {
        if (frame == null) {
            throw new MalformedFrameException("Frame is null");
        }
        JsonNode root;
        try {
            root = mapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("Frame is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedFrameException("Frame is not a JSON object");
        }

        JsonNode typeNode = root.get(TYPE_FIELD);
        if (typeNode == null || !typeNode.isTextual() || typeNode.asText().isBlank()) {
            throw new MalformedFrameException("Frame has no type");
        }
        String wire = typeNode.asText();
        MessageType type = MessageType.fromWire(wire)
                .orElseThrow(() -> new UnknownMessageTypeException(wire));

        ObjectNode body = ((ObjectNode) root).deepCopy();
        body.remove(TYPE_FIELD);
        try {
            return mapper.treeToValue(body, type.messageClass());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedFrameException("Frame of type " + wire + " has an invalid payload", e);
        }
    }

    public String encode(SyncMessage message) {
        ObjectNode node = mapper.createObjectNode();
        node.put(TYPE_FIELD, message.messageType().wire());
        if (message.getClass().getRecordComponents().length > 0) {
            JsonNode fields = mapper.valueToTree(message);
            if (fields instanceof ObjectNode obj) {
                node.setAll(obj);
            }
        }
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to encode " + message.messageType().wire(), e);
        }
    }
}
