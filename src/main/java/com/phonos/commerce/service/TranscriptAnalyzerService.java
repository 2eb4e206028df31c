package com.phonos.commerce.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonos.commerce.model.MatchType;
import com.phonos.commerce.model.Product;
import com.phonos.commerce.model.TranscriptAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads a store call transcript and extracts availability, price and delivery terms.
 */
@Service
public class TranscriptAnalyzerService {

    private static final Logger log = LoggerFactory.getLogger(TranscriptAnalyzerService.class);

    private static final String FALLBACK_PROMPT = "A shopping assistant phoned a store about: {product}\n"
            + "Wanted specs: {specs}\n\nTranscript:\n{transcript}\n\n"
            + "Return only JSON with keys: call_connected (bool), product_available (bool), matched_product, "
            + "price (number, rupees), product_match_type (exact | close | alternative | none), "
            + "delivery_available (bool), delivery_eta, delivery_charge (number), delivery_mode, "
            + "specs_gathered (object), specs_match_score (0..1), data_quality_score (0..1), call_summary, notes.";

    private final BedrockChatService bedrockChatService;
    private final PromptTemplateLoader promptTemplateLoader;
    private final ObjectMapper objectMapper;

    public TranscriptAnalyzerService(BedrockChatService bedrockChatService,
                                     PromptTemplateLoader promptTemplateLoader,
                                     ObjectMapper objectMapper) {
        this.bedrockChatService = bedrockChatService;
        this.promptTemplateLoader = promptTemplateLoader;
        this.objectMapper = objectMapper;
    }

    /**
     * Never throws: blank transcripts, model failures and unusable replies all yield
     * {@link TranscriptAnalysis#unanalyzable(String)}.
     */
    public TranscriptAnalysis analyze(String transcript, Product product) {
        if (!StringUtils.hasText(transcript)) {
            return TranscriptAnalysis.unanalyzable("empty transcript");
        }
        String productName = product != null ? product.getProductName() : "the requested product";
        String specs = product != null && product.getSpecs() != null ? product.getSpecs().toString() : "{}";
        String prompt = promptTemplateLoader.render("transcript_analyzer", FALLBACK_PROMPT, Map.of(
                "product", productName,
                "specs", specs,
                "transcript", transcript));

        JsonNode root;
        try {
            root = bedrockChatService.invokeForJson(prompt, 800);
        } catch (RuntimeException e) {
            log.warn("Transcript analysis failed: {}", e.getMessage());
            return TranscriptAnalysis.unanalyzable("analysis failed: " + e.getMessage());
        }
        if (root == null || !root.isObject() || !root.has("product_available")) {
            return TranscriptAnalysis.unanalyzable("analysis reply missing product_available");
        }
        return toAnalysis(root);
    }

    private TranscriptAnalysis toAnalysis(JsonNode root) {
        @SuppressWarnings("unchecked")
        Map<String, Object> raw = new LinkedHashMap<>(objectMapper.convertValue(root, Map.class));
        MatchType matchType = MatchType.fromAnalysis(JsonNodes.textOrNull(root.path("product_match_type")));
        raw.put("product_match_type", matchType.wireName());
        boolean available = Boolean.TRUE.equals(JsonNodes.booleanOrNull(root.path("product_available")));
        return new TranscriptAnalysis(
                true,
                available,
                JsonNodes.textOrNull(root.path("matched_product")),
                JsonNodes.decimalOrNull(root.path("price")),
                matchType,
                JsonNodes.booleanOrNull(root.path("delivery_available")),
                JsonNodes.textOrNull(root.path("delivery_eta")),
                JsonNodes.decimalOrNull(root.path("delivery_charge")),
                JsonNodes.textOrNull(root.path("delivery_mode")),
                JsonNodes.textOrNull(root.path("call_summary")),
                JsonNodes.textOrNull(root.path("notes")),
                raw);
    }
}
