package com.phonos.commerce.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.phonos.commerce.model.QueryAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

@Service
public class QueryAnalyzerService {

    private static final Logger log = LoggerFactory.getLogger(QueryAnalyzerService.class);

    private static final String FALLBACK_PROMPT = "Analyze this shopping request. Return only JSON with keys "
            + "query_type (specific_product | category | specific_store), product_category, brand_preference, "
            + "budget_max (number or null), urgency (low | normal | high), specific_store (store name or null), "
            + "key_specs (array of strings), search_hint.\n\n"
            + "Request: {query}\nLocation: {location}";

    private final BedrockChatService bedrockChatService;
    private final PromptTemplateLoader promptTemplateLoader;

    public QueryAnalyzerService(BedrockChatService bedrockChatService,
                                PromptTemplateLoader promptTemplateLoader) {
        this.bedrockChatService = bedrockChatService;
        this.promptTemplateLoader = promptTemplateLoader;
    }

    /**
     * @return the analysis, or empty when the model failed; research proceeds without it
     */
    public Optional<QueryAnalysis> analyze(String query, String location) {
        String prompt = promptTemplateLoader.render("query_analyzer", FALLBACK_PROMPT,
                Map.of("query", query, "location", location));
        try {
            JsonNode root = bedrockChatService.invokeForJson(prompt, 400);
            if (!root.isObject()) {
                return Optional.empty();
            }
            return Optional.of(new QueryAnalysis(
                    JsonNodes.textOrNull(root.path("query_type")),
                    JsonNodes.textOrNull(root.path("product_category")),
                    JsonNodes.textOrNull(root.path("brand_preference")),
                    JsonNodes.decimalOrNull(root.path("budget_max")),
                    JsonNodes.textOrNull(root.path("urgency")),
                    JsonNodes.textOrNull(root.path("specific_store")),
                    JsonNodes.readArray(root.path("key_specs")),
                    JsonNodes.textOrNull(root.path("search_hint"))));
        } catch (RuntimeException e) {
            log.warn("Query analysis failed, continuing without it: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
