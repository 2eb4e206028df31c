package com.phonos.commerce.service;

import com.phonos.commerce.dto.OptionView;
import com.phonos.commerce.dto.OptionsResponse;
import com.phonos.commerce.model.MatchType;
import com.phonos.commerce.model.Store;
import com.phonos.commerce.model.StoreCall;
import com.phonos.commerce.model.WebDeal;
import com.phonos.commerce.model.WebDealResult;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Builds the ranked option list for a completed ticket.
 *
 * <p>Phone options come first, ordered by match tier (exact, alternative, none), then
 * ascending price with unknown prices last, then descending store rating, then the order the
 * store was discovered in. Online deals follow by ascending price and cannot be confirmed.
 */
@Service
public class OptionsAggregatorService {

    static final Comparator<RankedCall> PHONE_ORDER = Comparator
            .comparing((RankedCall r) -> r.call().getMatchType() != null ? r.call().getMatchType() : MatchType.NONE)
            .thenComparing(r -> r.call().getPrice(), Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(r -> r.store() != null && r.store().getRating() != null ? r.store().getRating() : 0.0,
                    Comparator.reverseOrder())
            .thenComparing(r -> r.store() != null && r.store().getDiscoveryOrder() != null
                    ? r.store().getDiscoveryOrder() : Integer.MAX_VALUE);

    private final OptionsSummaryService optionsSummaryService;

    public OptionsAggregatorService(OptionsSummaryService optionsSummaryService) {
        this.optionsSummaryService = optionsSummaryService;
    }

    public OptionsResponse aggregate(UUID ticketId, String query, String productName,
                                     List<StoreCall> calls, Map<Long, Store> storesById,
                                     Optional<WebDealResult> webDeals) {
        List<OptionView> options = rank(calls, storesById, webDeals);
        boolean canConfirm = options.stream().anyMatch(OptionView::isCanConfirm);
        OptionsSummaryService.Summary summary = optionsSummaryService.summarize(query, productName, options);

        String status = canConfirm ? "options_ready" : "rejected";
        String reason = null;
        if (!canConfirm) {
            reason = options.isEmpty() ? "no_options" : "web_deals_only";
        }
        return OptionsResponse.builder()
                .ticketId(ticketId)
                .status(status)
                .reason(reason)
                .canConfirm(canConfirm)
                .productName(productName)
                .message(summary.message())
                .quickVerdict(summary.quickVerdict())
                .options(options)
                .build();
    }

    /**
     * Ranked options without any prose. Ranks start at 1.
     */
    public List<OptionView> rank(List<StoreCall> calls, Map<Long, Store> storesById, Optional<WebDealResult> webDeals) {
        List<RankedCall> available = calls.stream()
                .filter(StoreCall::isAvailableOption)
                .map(call -> new RankedCall(call, storesById.get(call.getStoreId())))
                .sorted(PHONE_ORDER)
                .collect(Collectors.toList());

        List<OptionView> options = new ArrayList<>();
        for (RankedCall rankedCall : available) {
            options.add(fromCall(options.size() + 1, rankedCall.call(), rankedCall.store()));
        }

        List<WebDeal> deals = webDeals.map(WebDealResult::getDeals).orElse(List.of()).stream()
                .filter(d -> d.price() != null && d.price().compareTo(BigDecimal.ZERO) > 0)
                .sorted(Comparator.comparing(WebDeal::price))
                .collect(Collectors.toList());
        for (WebDeal deal : deals) {
            options.add(fromDeal(options.size() + 1, deal));
        }
        return options;
    }

    static OptionView fromDeal(int rank, WebDeal deal) {
        return OptionView.builder()
                .rank(rank)
                .source("web_deal")
                .canConfirm(false)
                .platform(deal.platform())
                .matchedProduct(deal.productTitle())
                .price(deal.price())
                .url(deal.url())
                .confidence(deal.confidence())
                .deliveryEta(deal.deliveryEstimate())
                .build();
    }

    private OptionView fromCall(int rank, StoreCall call, Store store) {
        MatchType matchType = call.getMatchType() != null ? call.getMatchType() : MatchType.NONE;
        OptionView.OptionViewBuilder builder = OptionView.builder()
                .rank(rank)
                .source("store_call")
                .canConfirm(true)
                .storeCallId(call.getId())
                .storeId(call.getStoreId())
                .price(call.getPrice())
                .matchType(matchType.wireName())
                .matchedProduct(call.getMatchedProduct())
                .deliveryAvailable(call.getDeliveryAvailable())
                .deliveryEta(call.getDeliveryEta())
                .deliveryCharge(call.getDeliveryCharge())
                .deliveryMode(call.getDeliveryMode())
                .summary(call.getSummary());
        if (store != null) {
            builder.storeName(store.getName())
                    .address(store.getAddress())
                    .phoneNumber(store.getPhoneNumber())
                    .rating(store.getRating());
        }
        return builder.build();
    }

    record RankedCall(StoreCall call, Store store) {
    }
}
