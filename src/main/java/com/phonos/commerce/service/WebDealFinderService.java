package com.phonos.commerce.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.phonos.commerce.model.ProductResearch;
import com.phonos.commerce.model.WebDeal;
import com.phonos.commerce.model.WebDealResult;
import com.phonos.commerce.model.WebDealStatus;
import com.phonos.commerce.repository.WebDealResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Looks for the product online while the stores are being called. One model lookup runs per
 * search angle; results are merged, priced deals only, de-duplicated and stored as soon as the
 * branch finishes. Failure or timeout is recorded and never touches the ticket.
 */
@Service
public class WebDealFinderService {

    private static final Logger log = LoggerFactory.getLogger(WebDealFinderService.class);

    static final List<String> ANGLES = List.of("price_compare", "deals_offers", "quick_commerce", "niche_surprise");

    private static final Map<String, String> ANGLE_GUIDANCE = Map.of(
            "price_compare", "Compare prices on major marketplaces (Amazon, Flipkart, Croma, Reliance Digital).",
            "deals_offers", "Look for current discounts, coupons and bank offers.",
            "quick_commerce", "Check quick-delivery apps (Blinkit, Zepto, Swiggy Instamart) that deliver to the location.",
            "niche_surprise", "Check brand stores and specialist sellers the big marketplaces miss.");

    private static final String FALLBACK_PROMPT = "Find online listings for: {product}\nSpecs: {specs}\n"
            + "Delivery location: {location}\nSearch hints: {queries}\nFocus: {guidance}\n\n"
            + "Return only JSON: {\"summary\": \"...\", \"deals\": [{\"platform\", \"product_title\", \"price\", "
            + "\"original_price\", \"discount_percent\", \"url\", \"confidence\" (high|medium|low), \"delivery_estimate\"}]}";

    private final BedrockChatService bedrockChatService;
    private final PromptTemplateLoader promptTemplateLoader;
    private final WebDealResultRepository webDealResultRepository;
    private final Executor analysisExecutor;
    private final long timeoutSeconds;

    public WebDealFinderService(BedrockChatService bedrockChatService,
                                PromptTemplateLoader promptTemplateLoader,
                                WebDealResultRepository webDealResultRepository,
                                @Qualifier("analysisExecutor") Executor analysisExecutor,
                                @Value("${app.web-deals.timeout-seconds:90}") long timeoutSeconds) {
        this.bedrockChatService = bedrockChatService;
        this.promptTemplateLoader = promptTemplateLoader;
        this.webDealResultRepository = webDealResultRepository;
        this.analysisExecutor = analysisExecutor;
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * Starts the branch. The returned future always completes normally with the stored result.
     */
    public CompletableFuture<WebDealResult> start(UUID ticketId, ProductResearch product, String location) {
        List<CompletableFuture<AngleResult>> lookups = ANGLES.stream()
                .map(angle -> CompletableFuture.supplyAsync(() -> lookup(angle, product, location), analysisExecutor))
                .collect(Collectors.toList());

        return CompletableFuture.allOf(lookups.toArray(new CompletableFuture[0]))
                .thenApply(v -> merge(ticketId, lookups.stream().map(CompletableFuture::join).collect(Collectors.toList())))
                .orTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .exceptionally(ex -> {
                    boolean timedOut = ex instanceof TimeoutException || ex.getCause() instanceof TimeoutException;
                    log.warn("Web deal search for ticket {} {}", ticketId, timedOut ? "timed out" : "failed: " + ex.getMessage());
                    return emptyResult(ticketId, timedOut ? WebDealStatus.TIMED_OUT : WebDealStatus.FAILED, null);
                })
                .thenApply(this::persist);
    }

    private AngleResult lookup(String angle, ProductResearch product, String location) {
        String prompt = promptTemplateLoader.render("web_deals", FALLBACK_PROMPT, Map.of(
                "product", product.productName(),
                "specs", product.specs() != null ? product.specs().toString() : "{}",
                "location", location,
                "queries", String.join("; ", product.searchQueries() != null ? product.searchQueries() : List.of()),
                "guidance", ANGLE_GUIDANCE.get(angle)));
        try {
            JsonNode root = bedrockChatService.invokeForJson(prompt, 1200);
            List<WebDeal> deals = new ArrayList<>();
            for (JsonNode item : root.path("deals")) {
                deals.add(new WebDeal(
                        JsonNodes.textOrNull(item.path("platform")),
                        JsonNodes.textOrNull(item.path("product_title")),
                        JsonNodes.decimalOrNull(item.path("price")),
                        JsonNodes.decimalOrNull(item.path("original_price")),
                        JsonNodes.intOrNull(item.path("discount_percent")),
                        JsonNodes.textOrNull(item.path("url")),
                        JsonNodes.textOrNull(item.path("confidence")),
                        JsonNodes.textOrNull(item.path("delivery_estimate")),
                        angle));
            }
            return new AngleResult(angle, true, JsonNodes.textOrNull(root.path("summary")), deals);
        } catch (RuntimeException e) {
            log.warn("Web deal lookup '{}' failed: {}", angle, e.getMessage());
            return new AngleResult(angle, false, null, List.of());
        }
    }

    WebDealResult merge(UUID ticketId, List<AngleResult> results) {
        if (results.stream().noneMatch(AngleResult::succeeded)) {
            return emptyResult(ticketId, WebDealStatus.FAILED, "All web searches failed");
        }
        List<WebDeal> deals = dedupe(results.stream().flatMap(r -> r.deals().stream()).collect(Collectors.toList()));
        String summary = results.stream()
                .map(AngleResult::summary)
                .filter(s -> s != null && !s.isBlank())
                .findFirst()
                .orElse(deals.isEmpty() ? "No online listings found" : deals.size() + " online listings found");
        return WebDealResult.builder()
                .ticketId(ticketId)
                .status(deals.isEmpty() ? WebDealStatus.EMPTY : WebDealStatus.FOUND)
                .searchSummary(summary)
                .deals(deals)
                .completedAt(OffsetDateTime.now())
                .build();
    }

    /**
     * Drops deals without a positive price, keeps the cheapest listing per URL (or per
     * platform and title when there is no URL) and sorts by ascending price.
     */
    static List<WebDeal> dedupe(List<WebDeal> deals) {
        List<WebDeal> priced = deals.stream()
                .filter(d -> d.price() != null && d.price().compareTo(BigDecimal.ZERO) > 0)
                .sorted(Comparator.comparing(WebDeal::price))
                .collect(Collectors.toList());
        Set<String> seen = new HashSet<>();
        List<WebDeal> unique = new ArrayList<>();
        for (WebDeal deal : priced) {
            if (seen.add(dedupeKey(deal))) {
                unique.add(deal);
            }
        }
        return unique;
    }

    private static String dedupeKey(WebDeal deal) {
        if (deal.url() != null && !deal.url().isBlank()) {
            return "url:" + deal.url().trim().toLowerCase(Locale.ROOT).replaceAll("/+$", "");
        }
        return "title:" + normalize(deal.platform()) + "|" + normalize(deal.productTitle());
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    private WebDealResult emptyResult(UUID ticketId, WebDealStatus status, String summary) {
        return WebDealResult.builder()
                .ticketId(ticketId)
                .status(status)
                .searchSummary(summary)
                .deals(List.of())
                .completedAt(OffsetDateTime.now())
                .build();
    }

    private WebDealResult persist(WebDealResult result) {
        try {
            WebDealResult saved = webDealResultRepository.save(result);
            log.info("Web deals for ticket {}: {} ({} deals)", result.getTicketId(), result.getStatus().wireName(),
                    result.getDeals().size());
            return saved;
        } catch (RuntimeException e) {
            log.error("Could not store web deals for ticket {}", result.getTicketId(), e);
            return result;
        }
    }

    record AngleResult(String angle, boolean succeeded, String summary, List<WebDeal> deals) {
    }
}
