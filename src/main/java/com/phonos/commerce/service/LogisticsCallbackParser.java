package com.phonos.commerce.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.phonos.commerce.model.LogisticsCallbackEvent;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads a ProRouting order callback. The provider sends either a flat body or one with the
 * order nested under {@code order}; both shapes are accepted.
 */
@Component
public class LogisticsCallbackParser {

    public Optional<LogisticsCallbackEvent> parse(JsonNode body) {
        if (body == null) {
            return Optional.empty();
        }
        JsonNode order = body.path("order");
        String orderId = firstText(body.path("order_id"), order.path("id"));
        String state = firstText(body.path("state"), order.path("state"), body.path("order_state"));
        if (orderId == null || state == null) {
            return Optional.empty();
        }

        JsonNode rider = order.path("rider").isObject() ? order.path("rider") : body.path("agent");
        String riderName = JsonNodes.textOrNull(rider.path("name"));
        String riderPhone = JsonNodes.textOrNull(rider.path("phone"));
        String trackingUrl = firstText(order.path("tracking_url"), body.path("tracking_url"));

        JsonNode cancellation = order.path("cancellation");
        String cancelledBy = JsonNodes.textOrNull(cancellation.path("cancelled_by"));
        String lspId = JsonNodes.textOrNull(order.path("lsp").path("id"));
        boolean cancelledByPartner = cancelledBy != null && cancelledBy.equals(lspId);
        String reason = JsonNodes.textOrNull(cancellation.path("reason_desc"));

        String callbackId = JsonNodes.textOrNull(body.path("id"));
        String eventId = callbackId != null ? callbackId
                : orderId + ":" + state + ":" + firstText(body.path("updated_at"), order.path("updated_at"));
        return Optional.of(new LogisticsCallbackEvent(eventId, orderId, state, riderName, riderPhone,
                trackingUrl, cancelledByPartner, reason));
    }

    private static String firstText(JsonNode... candidates) {
        for (JsonNode candidate : candidates) {
            String text = JsonNodes.textOrNull(candidate);
            if (text != null) {
                return text;
            }
        }
        return null;
    }
}
