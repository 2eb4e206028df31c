package com.phonos.commerce.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phonos.commerce.exception.ErrorCode;
import com.phonos.commerce.exception.UpstreamProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Places outbound phone calls through VAPI. Call progress comes back on the store webhook.
 */
@Component
public class VapiVoiceClient {

    private static final Logger logger = LoggerFactory.getLogger(VapiVoiceClient.class);

    private final RestClient voiceRestClient;
    private final ObjectMapper objectMapper;
    private final String phoneNumberId;
    private final String serverUrl;
    private final String modelProvider;
    private final String model;
    private final String voiceProvider;
    private final String voiceId;

    public VapiVoiceClient(@Qualifier("voiceRestClient") RestClient voiceRestClient,
                           ObjectMapper objectMapper,
                           @Value("${app.voice.phone-number-id:}") String phoneNumberId,
                           @Value("${app.voice.server-url:}") String serverUrl,
                           @Value("${app.voice.model-provider:openai}") String modelProvider,
                           @Value("${app.voice.model:gpt-4o-mini}") String model,
                           @Value("${app.voice.voice-provider:}") String voiceProvider,
                           @Value("${app.voice.voice-id:jennifer-playht}") String voiceId) {
        this.voiceRestClient = voiceRestClient;
        this.objectMapper = objectMapper;
        this.phoneNumberId = phoneNumberId;
        this.serverUrl = serverUrl;
        this.modelProvider = modelProvider;
        this.model = model;
        this.voiceProvider = voiceProvider;
        this.voiceId = voiceId;
    }

    /**
     * Starts a call to a store.
     *
     * @return the provider's call id
     * @throws ResourceAccessException   on transport errors; callers may retry
     * @throws UpstreamProviderException when the provider rejects the request
     */
    public String placeStoreCall(String phoneNumber, String systemPrompt, String firstMessage) {
        if (!StringUtils.hasText(phoneNumberId)) {
            throw new UpstreamProviderException(ErrorCode.VOICE_ERROR, "app.voice.phone-number-id is not configured");
        }
        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("assistant", buildAssistant(systemPrompt, firstMessage));
        payload.put("phoneNumberId", phoneNumberId);
        payload.putObject("customer").put("number", phoneNumber);

        JsonNode response;
        try {
            response = voiceRestClient.post()
                    .uri("/call/phone")
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException e) {
            throw new UpstreamProviderException(ErrorCode.VOICE_ERROR,
                    "VAPI returned " + e.getStatusCode().value() + ": " + e.getResponseBodyAsString(), e);
        }
        String callId = response != null ? JsonNodes.textOrNull(response.path("id")) : null;
        if (callId == null) {
            throw new UpstreamProviderException(ErrorCode.VOICE_ERROR, "VAPI response carried no call id");
        }
        logger.info("VAPI call {} created for {}", callId, phoneNumber);
        return callId;
    }

    private ObjectNode buildAssistant(String systemPrompt, String firstMessage) {
        ObjectNode assistant = objectMapper.createObjectNode();
        assistant.put("firstMessage", firstMessage);
        ObjectNode modelNode = assistant.putObject("model");
        modelNode.put("provider", modelProvider);
        modelNode.put("model", model);
        ObjectNode system = modelNode.putArray("messages").addObject();
        system.put("role", "system");
        system.put("content", systemPrompt);
        if (StringUtils.hasText(voiceProvider)) {
            ObjectNode voice = assistant.putObject("voice");
            voice.put("provider", voiceProvider);
            voice.put("voiceId", voiceId);
        } else {
            assistant.put("voice", voiceId);
        }
        if (StringUtils.hasText(serverUrl)) {
            assistant.put("serverUrl", serverUrl.replaceAll("/+$", "") + "/api/vapi/store-webhook");
        } else {
            logger.warn("app.voice.server-url is not set; call events will not reach this service");
        }
        return assistant;
    }
}
