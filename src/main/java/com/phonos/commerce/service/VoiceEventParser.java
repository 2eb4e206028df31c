package com.phonos.commerce.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.phonos.commerce.model.CallEndedEvent;
import com.phonos.commerce.model.CallStatusEvent;
import com.phonos.commerce.model.StoreCallStatus;
import com.phonos.commerce.model.VoiceEvent;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns a raw VAPI webhook body into a typed event. Types the service does not act on
 * (speech updates, transcripts in progress, tool calls) parse to empty.
 */
@Component
public class VoiceEventParser {

    public Optional<VoiceEvent> parse(JsonNode body) {
        if (body == null) {
            return Optional.empty();
        }
        JsonNode message = body.has("message") ? body.path("message") : body;
        String type = JsonNodes.textOrNull(message.path("type"));
        String callId = JsonNodes.textOrNull(message.path("call").path("id"));
        if (callId == null) {
            callId = JsonNodes.textOrNull(body.path("call").path("id"));
        }
        if (type == null || callId == null) {
            return Optional.empty();
        }
        String messageId = JsonNodes.textOrNull(message.path("id"));

        if ("status-update".equals(type)) {
            String status = JsonNodes.textOrNull(message.path("status"));
            if (status == null) {
                return Optional.empty();
            }
            String eventId = messageId != null ? messageId : type + ":" + callId + ":" + status;
            return Optional.of(new CallStatusEvent(eventId, callId, status, mapStatus(status)));
        }
        if ("end-of-call-report".equals(type)) {
            String endedReason = JsonNodes.textOrNull(message.path("endedReason"));
            if (endedReason == null) {
                endedReason = JsonNodes.textOrNull(body.path("endedReason"));
            }
            String transcript = JsonNodes.textOrNull(message.path("transcript"));
            if (transcript == null) {
                transcript = JsonNodes.textOrNull(message.path("artifact").path("transcript"));
            }
            String eventId = messageId != null ? messageId
                    : type + ":" + callId + ":" + (endedReason != null ? endedReason : "unknown");
            return Optional.of(new CallEndedEvent(eventId, callId, endedReason, transcript));
        }
        return Optional.empty();
    }

    static StoreCallStatus mapStatus(String providerStatus) {
        switch (providerStatus) {
            case "queued":
            case "ringing":
                return StoreCallStatus.DIALING;
            case "in-progress":
                return StoreCallStatus.IN_PROGRESS;
            default:
                return null;
        }
    }
}
