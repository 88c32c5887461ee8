package com.questrail.relaybridge.protocol.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.relaybridge.protocol.model.ControlEnvelope;
import com.questrail.relaybridge.protocol.model.ControlEvent;
import com.questrail.relaybridge.protocol.model.RelayEnvelope;
import com.questrail.relaybridge.protocol.model.RequestEnvelope;
import com.questrail.relaybridge.protocol.model.ResponseEnvelope;

import java.util.Objects;

/**
 * RelayEnvelopeCodec
 * =============================================================================
 * JSON text codec for relay envelopes.
 *
 * <h2>Classification on decode</h2>
 * <pre>
 *   {"kind":"system", ...}             → ControlEnvelope
 *   {"type":..., no result/error}      → RequestEnvelope
 *   anything else that is an object    → ResponseEnvelope (id may be absent)
 * </pre>
 *
 * <p>The broker does not use this codec on forwarded traffic: application
 * text is relayed byte-for-byte. Only envelopes the broker itself originates
 * go through {@link #encode(RelayEnvelope)}.</p>
 *
 * <p>Absent optional fields are omitted from the encoded form rather than
 * written as {@code null}.</p>
 */
public final class RelayEnvelopeCodec
{
    static final String KIND = "kind";
    static final String SYSTEM = "system";

    private final ObjectMapper mapper;

    public RelayEnvelopeCodec()
    {
        this(Jsons.mapper());
    }

    public RelayEnvelopeCodec(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public String encode(RelayEnvelope envelope)
    {
        Objects.requireNonNull(envelope, "envelope");

        ObjectNode node = mapper.createObjectNode();
        if (envelope instanceof ControlEnvelope control) {
            node.put(KIND, SYSTEM);
            node.put("event", control.event().wireName());
            putIfPresent(node, "channel", control.channel());
            if (control.executorPresent() != null) {
                node.put("figmaExecutorPresent", control.executorPresent().booleanValue());
            }
            putIfPresent(node, "error", control.error());
            putIfPresent(node, "sessionId", control.sessionId());
        }
        else if (envelope instanceof RequestEnvelope request) {
            node.put("type", request.type());
            putIfPresent(node, "id", request.id());
            if (request.payload() != null) {
                node.set("payload", request.payload());
            }
            putIfPresent(node, "sessionId", request.sessionId());
        }
        else if (envelope instanceof ResponseEnvelope response) {
            putIfPresent(node, "id", response.id());
            if (response.result() != null) {
                node.set("result", response.result());
            }
            putIfPresent(node, "error", response.error());
            putIfPresent(node, "sessionId", response.sessionId());
        }
        return Jsons.toJson(node);
    }

    public RelayEnvelope decode(String text)
    {
        Objects.requireNonNull(text, "text");

        final JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new RelayDecodeException("Envelope is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new RelayDecodeException("Envelope must be a JSON object");
        }

        if (SYSTEM.equals(textOrNull(root, KIND))) {
            return decodeControl(root);
        }

        String sessionId = textOrNull(root, "sessionId");
        String id = textOrNull(root, "id");
        boolean answers = root.has("result") || root.has("error");
        String type = textOrNull(root, "type");

        if (type != null && !answers) {
            return new RequestEnvelope(id, type, root.get("payload"), sessionId);
        }
        return new ResponseEnvelope(id, root.get("result"), errorText(root.get("error")), sessionId);
    }

    private static ControlEnvelope decodeControl(JsonNode root)
    {
        String eventName = textOrNull(root, "event");
        ControlEvent event = ControlEvent.fromWire(eventName)
                .orElseThrow(() -> new RelayDecodeException("Unknown control event: " + eventName));

        JsonNode presentNode = root.get("figmaExecutorPresent");
        Boolean present = null;
        if (presentNode != null && !presentNode.isNull()) {
            if (!presentNode.isBoolean()) {
                throw new RelayDecodeException("figmaExecutorPresent must be a boolean");
            }
            present = presentNode.booleanValue();
        }

        return new ControlEnvelope(
                event,
                textOrNull(root, "channel"),
                present,
                errorText(root.get("error")),
                textOrNull(root, "sessionId"));
    }

    // Executors sometimes report errors as objects; keep the text form.
    private static String errorText(JsonNode error)
    {
        if (error == null || error.isNull()) {
            return null;
        }
        if (error.isTextual()) {
            return error.textValue();
        }
        JsonNode message = error.get("message");
        if (message != null && message.isTextual()) {
            return message.textValue();
        }
        return error.toString();
    }

    private static String textOrNull(JsonNode root, String field)
    {
        JsonNode value = root.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isValueNode()) {
            throw new RelayDecodeException("Field '" + field + "' must be a scalar");
        }
        return value.asText();
    }

    private static void putIfPresent(ObjectNode node, String field, String value)
    {
        if (value != null) {
            node.put(field, value);
        }
    }
}
