package com.questrail.relaybridge.protocol.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.relaybridge.protocol.model.ControlEnvelope;
import com.questrail.relaybridge.protocol.model.ControlEvent;
import com.questrail.relaybridge.protocol.model.RelayEnvelope;
import com.questrail.relaybridge.protocol.model.RequestEnvelope;
import com.questrail.relaybridge.protocol.model.ResponseEnvelope;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RelayEnvelopeCodecTest
{
    private final RelayEnvelopeCodec codec = new RelayEnvelopeCodec();

    private static JsonNode tree(String text) throws Exception {
        return Jsons.mapper().readTree(text);
    }

    // ---------------------------------------------------------------------
    // Encode
    // ---------------------------------------------------------------------

    /**
     * The caller welcome always states executor presence, even when false.
     */
    @Test
    void callerWelcomeCarriesPresenceFlag() throws Exception {
        JsonNode node = tree(codec.encode(ControlEnvelope.callerWelcome("ROOM", false, null)));

        assertEquals("system", node.get("kind").asText());
        assertEquals("connected", node.get("event").asText());
        assertEquals("ROOM", node.get("channel").asText());
        assertFalse(node.get("figmaExecutorPresent").asBoolean());
        assertFalse(node.has("sessionId"));
        assertFalse(node.has("error"));
    }

    @Test
    void executorWelcomeOmitsPresenceFlag() throws Exception {
        JsonNode node = tree(codec.encode(ControlEnvelope.executorWelcome("ROOM", "s1")));

        assertFalse(node.has("figmaExecutorPresent"));
        assertEquals("s1", node.get("sessionId").asText());
    }

    @Test
    void requestEncodesIdTypeAndPayload() throws Exception {
        JsonNode payload = Jsons.mapper().createObjectNode().put("nodeId", "1:2");
        JsonNode node = tree(codec.encode(RequestEnvelope.of("r1", "get_node", payload)));

        assertEquals("r1", node.get("id").asText());
        assertEquals("get_node", node.get("type").asText());
        assertEquals("1:2", node.get("payload").get("nodeId").asText());
        assertFalse(node.has("kind"));
    }

    // ---------------------------------------------------------------------
    // Decode classification
    // ---------------------------------------------------------------------

    @Test
    void systemKindDecodesAsControl() {
        RelayEnvelope envelope = codec.decode(
                "{\"kind\":\"system\",\"event\":\"executor_disconnected\",\"channel\":\"ROOM\",\"sessionId\":\"s9\"}");

        ControlEnvelope control = assertInstanceOf(ControlEnvelope.class, envelope);
        assertEquals(ControlEvent.EXECUTOR_DISCONNECTED, control.event());
        assertEquals("ROOM", control.channel());
        assertNull(control.executorPresent());
        assertEquals("s9", control.sessionTag().orElseThrow());
    }

    @Test
    void typeWithoutResultDecodesAsRequest() {
        RelayEnvelope envelope = codec.decode("{\"id\":\"r1\",\"type\":\"ping\"}");

        RequestEnvelope request = assertInstanceOf(RequestEnvelope.class, envelope);
        assertEquals("r1", request.id());
        assertEquals("ping", request.type());
        assertNull(request.payload());
    }

    @Test
    void resultDecodesAsResponse() {
        RelayEnvelope envelope = codec.decode("{\"id\":\"r1\",\"type\":\"ping\",\"result\":{\"ok\":true}}");

        ResponseEnvelope response = assertInstanceOf(ResponseEnvelope.class, envelope);
        assertEquals("r1", response.id());
        assertTrue(response.result().get("ok").asBoolean());
        assertFalse(response.isError());
    }

    @Test
    void objectErrorIsReducedToItsMessage() {
        ResponseEnvelope response = (ResponseEnvelope) codec.decode(
                "{\"id\":\"r1\",\"error\":{\"message\":\"boom\",\"code\":7}}");

        assertTrue(response.isError());
        assertEquals("boom", response.error());
    }

    @Test
    void emptySessionIdCountsAsUntagged() {
        ResponseEnvelope response = (ResponseEnvelope) codec.decode("{\"id\":\"r1\",\"result\":1,\"sessionId\":\"\"}");

        assertTrue(response.sessionTag().isEmpty());
    }

    // ---------------------------------------------------------------------
    // Malformed input
    // ---------------------------------------------------------------------

    @Test
    void nonJsonIsRejected() {
        RelayDecodeException e = assertThrows(RelayDecodeException.class, () -> codec.decode("hello"));
        assertNotNull(e.getCause());
    }

    @Test
    void nonObjectIsRejected() {
        assertThrows(RelayDecodeException.class, () -> codec.decode("[1,2,3]"));
    }

    @Test
    void unknownControlEventIsRejected() {
        RelayDecodeException e = assertThrows(RelayDecodeException.class,
                () -> codec.decode("{\"kind\":\"system\",\"event\":\"reboot\"}"));
        assertTrue(e.getMessage().contains("reboot"));
    }

    @Test
    void nonBooleanPresenceIsRejected() {
        assertThrows(RelayDecodeException.class,
                () -> codec.decode("{\"kind\":\"system\",\"event\":\"connected\",\"figmaExecutorPresent\":\"yes\"}"));
    }
}
