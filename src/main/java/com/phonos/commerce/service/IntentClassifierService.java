package com.phonos.commerce.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.phonos.commerce.model.Intent;
import com.phonos.commerce.model.IntentClassification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Decides whether a request is a product order. Only orders become tickets.
 */
@Service
public class IntentClassifierService {

    private static final Logger log = LoggerFactory.getLogger(IntentClassifierService.class);

    private static final String FALLBACK_PROMPT = "Classify the user's request into one intent: "
            + "order_product (they want to buy or source a physical product), "
            + "wake_up_call (they want to be called at a time), or other.\n"
            + "Return only JSON: {\"intent\": \"...\", \"message\": \"one sentence for the user\"}\n\n"
            + "Request:\n{query}";

    private final BedrockChatService bedrockChatService;
    private final PromptTemplateLoader promptTemplateLoader;

    public IntentClassifierService(BedrockChatService bedrockChatService,
                                   PromptTemplateLoader promptTemplateLoader) {
        this.bedrockChatService = bedrockChatService;
        this.promptTemplateLoader = promptTemplateLoader;
    }

    /**
     * Classifies the request. Any model failure, throttling included, falls back to
     * {@link Intent#ORDER_PRODUCT} so that a flaky model never blocks a genuine order.
     */
    public IntentClassification classify(String query) {
        String prompt = promptTemplateLoader.render("intent_classifier", FALLBACK_PROMPT, Map.of("query", query));
        try {
            JsonNode root = bedrockChatService.invokeForJson(prompt, 200);
            Intent intent = Intent.fromLabel(JsonNodes.textOrNull(root.path("intent")));
            String message = JsonNodes.textOrNull(root.path("message"));
            return new IntentClassification(intent, message != null ? message : defaultMessage(intent));
        } catch (RuntimeException e) {
            log.warn("Intent classification failed, treating request as an order: {}", e.getMessage());
            return new IntentClassification(Intent.ORDER_PRODUCT, defaultMessage(Intent.ORDER_PRODUCT));
        }
    }

    private String defaultMessage(Intent intent) {
        switch (intent) {
            case ORDER_PRODUCT:
                return "Request accepted. Finding stores and checking availability.";
            case WAKE_UP_CALL:
                return "Wake-up calls are not supported here. Please submit a product request.";
            default:
                return "This service only handles product orders. Please describe the product you need.";
        }
    }
}
