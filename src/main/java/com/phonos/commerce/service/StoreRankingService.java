package com.phonos.commerce.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.phonos.commerce.model.ProductResearch;
import com.phonos.commerce.model.Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orders stores by how likely they are to stock the product and assigns call priorities
 * starting at 1. The model's ordering is used when it is a valid permutation prefix; any store
 * it leaves out is appended in fallback order.
 */
@Service
public class StoreRankingService {

    private static final Logger log = LoggerFactory.getLogger(StoreRankingService.class);

    static final Comparator<Store> FALLBACK_ORDER = Comparator
            .comparing((Store s) -> s.getRating() != null ? s.getRating() : 0.0, Comparator.reverseOrder())
            .thenComparing(s -> s.getTotalRatings() != null ? s.getTotalRatings() : 0, Comparator.reverseOrder())
            .thenComparing(Store::getDiscoveryOrder);

    private static final String FALLBACK_PROMPT = "Rank these stores by how likely they are to have the product "
            + "in stock right now.\nProduct: {product} ({category})\nStores:\n{stores}\n\n"
            + "Return only JSON: {\"order\": [store numbers, most likely first]}";

    private final BedrockChatService bedrockChatService;
    private final PromptTemplateLoader promptTemplateLoader;

    public StoreRankingService(BedrockChatService bedrockChatService,
                               PromptTemplateLoader promptTemplateLoader) {
        this.bedrockChatService = bedrockChatService;
        this.promptTemplateLoader = promptTemplateLoader;
    }

    public List<Store> rank(List<Store> stores, ProductResearch product) {
        List<Integer> fallback = new ArrayList<>();
        for (int i = 0; i < stores.size(); i++) {
            fallback.add(i);
        }
        fallback.sort(Comparator.comparing(stores::get, FALLBACK_ORDER));

        List<Integer> order = fallback;
        if (stores.size() > 1) {
            try {
                order = rankWithModel(stores, product, fallback);
            } catch (RuntimeException e) {
                log.warn("Store ranking by model failed, using rating order: {}", e.getMessage());
            }
        }

        List<Store> ranked = new ArrayList<>(stores.size());
        for (int i = 0; i < order.size(); i++) {
            Store store = stores.get(order.get(i));
            store.setPriority(i + 1);
            ranked.add(store);
        }
        return ranked;
    }

    private List<Integer> rankWithModel(List<Store> stores, ProductResearch product, List<Integer> fallback) {
        StringBuilder listing = new StringBuilder();
        for (int i = 0; i < stores.size(); i++) {
            Store store = stores.get(i);
            listing.append(i + 1).append(". ").append(store.getName())
                    .append(" | ").append(store.getAddress() != null ? store.getAddress() : "")
                    .append(" | rating ").append(store.getRating() != null ? store.getRating() : "n/a")
                    .append(" (").append(store.getTotalRatings() != null ? store.getTotalRatings() : 0).append(" reviews)")
                    .append('\n');
        }
        String prompt = promptTemplateLoader.render("store_ranking", FALLBACK_PROMPT, Map.of(
                "product", product.productName(),
                "category", product.productCategory() != null ? product.productCategory() : "unknown",
                "stores", listing.toString()));

        JsonNode root = bedrockChatService.invokeForJson(prompt, 200);
        JsonNode order = root.isArray() ? root : root.path("order");
        Set<Integer> ordered = new LinkedHashSet<>();
        for (JsonNode item : order) {
            int index = item.asInt(-1) - 1;
            if (index >= 0 && index < stores.size()) {
                ordered.add(index);
            }
        }
        ordered.addAll(fallback);
        return new ArrayList<>(ordered);
    }
}
