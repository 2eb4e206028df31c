package com.phonos.commerce.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.phonos.commerce.dto.OptionView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes the short human-facing message that accompanies the ranked options.
 */
@Service
public class OptionsSummaryService {

    private static final Logger log = LoggerFactory.getLogger(OptionsSummaryService.class);

    private static final String FALLBACK_PROMPT = "A customer asked for: {query}\nProduct: {product}\n"
            + "Ranked options (best first):\n{options}\n\n"
            + "Return only JSON: {\"message\": \"2-3 friendly sentences\", \"quick_verdict\": \"one line naming the best pick\"}";

    private final BedrockChatService bedrockChatService;
    private final PromptTemplateLoader promptTemplateLoader;

    public OptionsSummaryService(BedrockChatService bedrockChatService,
                                 PromptTemplateLoader promptTemplateLoader) {
        this.bedrockChatService = bedrockChatService;
        this.promptTemplateLoader = promptTemplateLoader;
    }

    public Summary summarize(String query, String requestedProduct, List<OptionView> options) {
        String productName = requestedProduct != null ? requestedProduct : query;
        if (options.isEmpty()) {
            return fallback(productName, options);
        }
        String listing = options.stream().map(this::describe).collect(Collectors.joining("\n"));
        String prompt = promptTemplateLoader.render("options_summary", FALLBACK_PROMPT,
                Map.of("query", query, "product", productName, "options", listing));
        try {
            JsonNode root = bedrockChatService.invokeForJson(prompt, 300);
            String message = JsonNodes.textOrNull(root.path("message"));
            String verdict = JsonNodes.textOrNull(root.path("quick_verdict"));
            if (message == null) {
                return fallback(productName, options);
            }
            return new Summary(message, verdict != null ? verdict : fallback(productName, options).quickVerdict());
        } catch (RuntimeException e) {
            log.warn("Options summary failed, using plain text: {}", e.getMessage());
            return fallback(productName, options);
        }
    }

    Summary fallback(String productName, List<OptionView> options) {
        long stores = options.stream().filter(OptionView::isCanConfirm).count();
        long deals = options.size() - stores;
        if (options.isEmpty()) {
            return new Summary("No store near you confirmed " + productName + " and no online listing was found.",
                    "No options available");
        }
        OptionView best = options.get(0);
        String bestName = best.getStoreName() != null ? best.getStoreName() : best.getPlatform();
        String price = best.getPrice() != null ? " at Rs. " + best.getPrice().toPlainString() : "";
        String message = stores > 0
                ? stores + " store(s) have " + productName + " available" + (deals > 0 ? " and " + deals + " online listing(s) were found." : ".")
                : "No store confirmed " + productName + ", but " + deals + " online listing(s) were found.";
        return new Summary(message, "Best pick: " + bestName + price);
    }

    private String describe(OptionView option) {
        return option.getRank() + ". " + (option.getStoreName() != null ? option.getStoreName() : option.getPlatform())
                + " | " + option.getSource()
                + " | " + (option.getMatchType() != null ? option.getMatchType() : "")
                + " | " + (option.getPrice() != null ? "Rs. " + option.getPrice().toPlainString() : "price unknown")
                + (option.getDeliveryEta() != null ? " | delivery " + option.getDeliveryEta() : "");
    }

    public record Summary(String message, String quickVerdict) {
    }
}
