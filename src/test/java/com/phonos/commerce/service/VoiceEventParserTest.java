package com.phonos.commerce.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonos.commerce.model.CallEndedEvent;
import com.phonos.commerce.model.CallStatusEvent;
import com.phonos.commerce.model.StoreCallStatus;
import com.phonos.commerce.model.VoiceEvent;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class VoiceEventParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final VoiceEventParser parser = new VoiceEventParser();

    @Test
    void parsesStatusUpdate() throws Exception {
        Optional<VoiceEvent> event = parser.parse(json(
                "{\"message\": {\"type\": \"status-update\", \"status\": \"ringing\", \"call\": {\"id\": \"call-1\"}}}"));

        assertThat(event).containsInstanceOf(CallStatusEvent.class);
        CallStatusEvent status = (CallStatusEvent) event.get();
        assertThat(status.providerCallId()).isEqualTo("call-1");
        assertThat(status.targetStatus()).isEqualTo(StoreCallStatus.DIALING);
        assertThat(status.eventId()).isEqualTo("status-update:call-1:ringing");
    }

    @Test
    void endedStatusUpdateCarriesNoTarget() throws Exception {
        CallStatusEvent status = (CallStatusEvent) parser.parse(json(
                "{\"message\": {\"id\": \"m-9\", \"type\": \"status-update\", \"status\": \"ended\", \"call\": {\"id\": \"call-1\"}}}"))
                .orElseThrow();

        assertThat(status.targetStatus()).isNull();
        assertThat(status.eventId()).isEqualTo("m-9");
    }

    @Test
    void parsesEndOfCallReportWithArtifactTranscript() throws Exception {
        Optional<VoiceEvent> event = parser.parse(json("{\"message\": {\"type\": \"end-of-call-report\", "
                + "\"endedReason\": \"customer-ended-call\", \"call\": {\"id\": \"call-2\"}, "
                + "\"artifact\": {\"transcript\": \"AI: Do you have it? User: Yes, 1499.\"}}}"));

        assertThat(event).containsInstanceOf(CallEndedEvent.class);
        CallEndedEvent ended = (CallEndedEvent) event.get();
        assertThat(ended.endedReason()).isEqualTo("customer-ended-call");
        assertThat(ended.transcript()).contains("1499");
        assertThat(ended.eventId()).isEqualTo("end-of-call-report:call-2:customer-ended-call");
    }

    @Test
    void unknownTypesAndMissingCallIdsAreIgnored() throws Exception {
        assertThat(parser.parse(json("{\"message\": {\"type\": \"speech-update\", \"call\": {\"id\": \"call-3\"}}}"))).isEmpty();
        assertThat(parser.parse(json("{\"message\": {\"type\": \"status-update\", \"status\": \"ringing\"}}"))).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
    }

    private JsonNode json(String body) throws Exception {
        return objectMapper.readTree(body);
    }
}
