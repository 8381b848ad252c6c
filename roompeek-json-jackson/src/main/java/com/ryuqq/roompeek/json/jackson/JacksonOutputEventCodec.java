package com.ryuqq.roompeek.json.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.roompeek.core.event.OutputEvent;
import com.ryuqq.roompeek.core.event.OutputEventType;
import com.ryuqq.roompeek.core.event.OutputNewPeek;

import java.util.Objects;

/**
 * Encodes output events as single-line JSON objects.
 *
 * <p>Wire shape, with the payload field named after the event type:</p>
 * <pre>
 * {"type":"new_peek","new_peek":{"room_id":"!r:s","user_id":"@u:s","device_id":"D"}}
 * </pre>
 */
public final class JacksonOutputEventCodec {

    private static final String TYPE = "type";
    private static final String ROOM_ID = "room_id";
    private static final String USER_ID = "user_id";
    private static final String DEVICE_ID = "device_id";

    private final ObjectMapper mapper;

    public JacksonOutputEventCodec() {
        this(new ObjectMapper());
    }

    public JacksonOutputEventCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Encodes an event to a JSON string without line breaks.
     *
     * @param event the event
     * @return JSON text
     * @throws OutputEventCodecException if serialization fails
     */
    public String encode(OutputEvent event) {
        Objects.requireNonNull(event, "event");
        ObjectNode root = mapper.createObjectNode();
        root.put(TYPE, event.type().wireName());
        if (event.type() == OutputEventType.NEW_PEEK) {
            OutputNewPeek peek = event.newPeek();
            root.putObject(OutputEventType.NEW_PEEK.wireName())
                .put(ROOM_ID, peek.roomId())
                .put(USER_ID, peek.userId())
                .put(DEVICE_ID, peek.deviceId());
        }
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new OutputEventCodecException("Failed to serialize output event " + event.type(), e);
        }
    }

    /**
     * Decodes an event from its JSON form.
     *
     * @param json JSON text
     * @return the event
     * @throws OutputEventCodecException if the JSON is malformed or the type is unknown
     */
    public OutputEvent decode(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new OutputEventCodecException("Failed to parse output event: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new OutputEventCodecException("Output event must be a JSON object");
        }
        String typeName = root.path(TYPE).asText("");
        OutputEventType type = OutputEventType.fromWireName(typeName)
            .orElseThrow(() -> new OutputEventCodecException("Unknown output event type: " + typeName));

        JsonNode payload = root.path(type.wireName());
        if (!payload.isObject()) {
            throw new OutputEventCodecException("Missing " + type.wireName() + " payload");
        }
        try {
            return OutputEvent.newPeek(
                payload.path(ROOM_ID).asText(null),
                payload.path(USER_ID).asText(null),
                payload.path(DEVICE_ID).asText(""));
        } catch (IllegalArgumentException e) {
            throw new OutputEventCodecException("Invalid " + type.wireName() + " payload: " + e.getMessage(), e);
        }
    }
}
