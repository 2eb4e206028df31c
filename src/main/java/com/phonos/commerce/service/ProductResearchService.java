package com.phonos.commerce.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonos.commerce.exception.ErrorCode;
import com.phonos.commerce.exception.UpstreamProviderException;
import com.phonos.commerce.model.ProductAlternative;
import com.phonos.commerce.model.ProductResearch;
import com.phonos.commerce.model.QueryAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a request into a concrete product: name, specs, a typical online price, alternatives,
 * and the text to search the maps provider with.
 */
@Service
public class ProductResearchService {

    private static final Logger log = LoggerFactory.getLogger(ProductResearchService.class);

    private static final String FALLBACK_PROMPT = "You research products for a local shopping assistant.\n"
            + "Request: {query}\nLocation: {location}\nPrior analysis: {analysis}\n\n"
            + "Return only JSON with keys: product_name, product_category, specs (object), "
            + "alternatives (array of {name, avg_price, reason}), avg_price_online (number), "
            + "store_search_query (what to type into a maps search to find shops selling it), "
            + "search_queries (array of web search strings), specific_store (boolean).";

    private final BedrockChatService bedrockChatService;
    private final PromptTemplateLoader promptTemplateLoader;
    private final ObjectMapper objectMapper;
    private final int maxAlternatives;

    public ProductResearchService(BedrockChatService bedrockChatService,
                                  PromptTemplateLoader promptTemplateLoader,
                                  ObjectMapper objectMapper,
                                  @Value("${app.product.max-alternatives:3}") int maxAlternatives) {
        this.bedrockChatService = bedrockChatService;
        this.promptTemplateLoader = promptTemplateLoader;
        this.objectMapper = objectMapper;
        this.maxAlternatives = Math.max(0, maxAlternatives);
    }

    /**
     * @throws UpstreamProviderException when the model fails or names no product
     */
    public ProductResearch research(String query, String location, Optional<QueryAnalysis> analysis) {
        String analysisJson = analysis.map(this::toJson).orElse("none");
        String prompt = promptTemplateLoader.render("product_research", FALLBACK_PROMPT,
                Map.of("query", query, "location", location, "analysis", analysisJson));

        JsonNode root = bedrockChatService.invokeForJson(prompt, 1200);
        String productName = JsonNodes.textOrNull(root.path("product_name"));
        if (!StringUtils.hasText(productName)) {
            throw new UpstreamProviderException(ErrorCode.LLM_ERROR, "Product research returned no product name");
        }

        String storeSearchQuery = JsonNodes.textOrNull(root.path("store_search_query"));
        if (storeSearchQuery == null) {
            String category = JsonNodes.textOrNull(root.path("product_category"));
            storeSearchQuery = (category != null ? category : productName) + " store";
        }

        boolean specificStore = Boolean.TRUE.equals(JsonNodes.booleanOrNull(root.path("specific_store")))
                || analysis.map(a -> "specific_store".equalsIgnoreCase(a.queryType())).orElse(false);

        ProductResearch research = new ProductResearch(
                productName,
                JsonNodes.textOrNull(root.path("product_category")),
                readSpecs(root.path("specs")),
                readAlternatives(root.path("alternatives")),
                JsonNodes.decimalOrNull(root.path("avg_price_online")),
                storeSearchQuery,
                JsonNodes.readArray(root.path("search_queries")),
                specificStore);
        log.info("Researched product '{}' (search: '{}', {} alternatives)",
                research.productName(), research.storeSearchQuery(), research.alternatives().size());
        return research;
    }

    private Map<String, Object> readSpecs(JsonNode node) {
        Map<String, Object> specs = new LinkedHashMap<>();
        if (node != null && node.isObject()) {
            node.fields().forEachRemaining(field -> {
                JsonNode value = field.getValue();
                if (value.isValueNode()) {
                    specs.put(field.getKey(), value.isNumber() ? value.numberValue() : value.asText());
                } else {
                    specs.put(field.getKey(), objectMapper.convertValue(value, Object.class));
                }
            });
        }
        return specs;
    }

    private List<ProductAlternative> readAlternatives(JsonNode node) {
        List<ProductAlternative> alternatives = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return alternatives;
        }
        for (JsonNode item : node) {
            if (alternatives.size() >= maxAlternatives) {
                break;
            }
            String name = JsonNodes.textOrNull(item.path("name"));
            if (name == null) {
                continue;
            }
            alternatives.add(new ProductAlternative(name,
                    JsonNodes.decimalOrNull(item.path("avg_price")),
                    JsonNodes.textOrNull(item.path("reason"))));
        }
        return alternatives;
    }

    private String toJson(QueryAnalysis analysis) {
        try {
            return objectMapper.writeValueAsString(analysis);
        } catch (JsonProcessingException e) {
            log.debug("Could not serialize query analysis: {}", e.getMessage());
            return "none";
        }
    }
}
