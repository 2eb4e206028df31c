package com.phonos.commerce.service;

import com.phonos.commerce.dto.OptionView;
import com.phonos.commerce.exception.CommerceException;
import com.phonos.commerce.model.ProductResearch;
import com.phonos.commerce.model.QueryAnalysis;
import com.phonos.commerce.model.Store;
import com.phonos.commerce.model.StoreCall;
import com.phonos.commerce.model.StoreCallStatus;
import com.phonos.commerce.model.StoreCandidate;
import com.phonos.commerce.model.Ticket;
import com.phonos.commerce.model.TicketStatus;
import com.phonos.commerce.repository.ProductRepository;
import com.phonos.commerce.repository.StoreCallRepository;
import com.phonos.commerce.repository.StoreRepository;
import com.phonos.commerce.repository.TicketRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Drives one ticket from {@link TicketStatus#RECEIVED} to a terminal status.
 *
 * <p>Each stage writes its status before doing any work. The web deal branch starts once
 * research is done and runs alongside store discovery and calling; it persists its own result
 * and never decides the ticket's outcome. Waiting for calls never
 * holds a thread: completion of the call batch schedules the final step back onto the
 * pipeline executor.
 */
@Service
public class TicketPipelineService {

    private static final Logger logger = LoggerFactory.getLogger(TicketPipelineService.class);

    private final TicketRepository ticketRepository;
    private final ProductRepository productRepository;
    private final StoreRepository storeRepository;
    private final StoreCallRepository storeCallRepository;
    private final TicketStateService ticketStateService;
    private final QueryAnalyzerService queryAnalyzerService;
    private final ProductResearchService productResearchService;
    private final StoreFinderService storeFinderService;
    private final StoreRankingService storeRankingService;
    private final StoreCallerService storeCallerService;
    private final WebDealFinderService webDealFinderService;
    private final OptionsAggregatorService optionsAggregatorService;
    private final Executor ticketPipelineExecutor;

    public TicketPipelineService(TicketRepository ticketRepository,
                                 ProductRepository productRepository,
                                 StoreRepository storeRepository,
                                 StoreCallRepository storeCallRepository,
                                 TicketStateService ticketStateService,
                                 QueryAnalyzerService queryAnalyzerService,
                                 ProductResearchService productResearchService,
                                 StoreFinderService storeFinderService,
                                 StoreRankingService storeRankingService,
                                 StoreCallerService storeCallerService,
                                 WebDealFinderService webDealFinderService,
                                 OptionsAggregatorService optionsAggregatorService,
                                 @Qualifier("ticketPipelineExecutor") Executor ticketPipelineExecutor) {
        this.ticketRepository = ticketRepository;
        this.productRepository = productRepository;
        this.storeRepository = storeRepository;
        this.storeCallRepository = storeCallRepository;
        this.ticketStateService = ticketStateService;
        this.queryAnalyzerService = queryAnalyzerService;
        this.productResearchService = productResearchService;
        this.storeFinderService = storeFinderService;
        this.storeRankingService = storeRankingService;
        this.storeCallerService = storeCallerService;
        this.webDealFinderService = webDealFinderService;
        this.optionsAggregatorService = optionsAggregatorService;
        this.ticketPipelineExecutor = ticketPipelineExecutor;
    }

    public void run(UUID ticketId) {
        try {
            runStages(ticketId);
        } catch (Exception e) {
            logger.error("Pipeline for ticket {} failed unexpectedly", ticketId, e);
            ticketStateService.fail(ticketId, "Processing error: " + e.getMessage());
        }
    }

    private void runStages(UUID ticketId) {
        Optional<Ticket> found = ticketRepository.findById(ticketId);
        if (found.isEmpty()) {
            logger.warn("Pipeline started for missing ticket {}", ticketId);
            return;
        }
        Ticket ticket = found.get();

        // Intent was classified synchronously at creation; the stage is recorded for pollers.
        if (!ticketStateService.transition(ticketId, TicketStatus.CLASSIFYING)) {
            return;
        }

        if (!ticketStateService.transition(ticketId, TicketStatus.ANALYZING)) {
            return;
        }
        Optional<QueryAnalysis> analysis = queryAnalyzerService.analyze(ticket.getQuery(), ticket.getLocation());

        if (!ticketStateService.transition(ticketId, TicketStatus.RESEARCHING)) {
            return;
        }
        ProductResearch research;
        try {
            research = productResearchService.research(ticket.getQuery(), ticket.getLocation(), analysis);
        } catch (CommerceException e) {
            ticketStateService.fail(ticketId, "Product research failed: " + e.getMessage());
            return;
        }
        productRepository.save(research.toProduct(ticketId));
        logger.info("Ticket {}: researched '{}'", ticketId, research.productName());

        webDealFinderService.start(ticketId, research, ticket.getLocation());

        if (!ticketStateService.transition(ticketId, TicketStatus.FINDING_STORES)) {
            return;
        }
        String searchQuery = StringUtils.hasText(research.storeSearchQuery())
                ? research.storeSearchQuery() : research.productName();
        List<StoreCandidate> candidates = storeFinderService.findStores(searchQuery, ticket.getLocation());
        if (candidates.isEmpty()) {
            ticketStateService.fail(ticketId, "No stores with a phone number found for '" + searchQuery
                    + "' near " + ticket.getLocation());
            return;
        }
        List<Store> stores = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            stores.add(candidates.get(i).toStore(ticketId, i + 1));
        }
        List<Store> ranked = storeRepository.saveAll(storeRankingService.rank(storeRepository.saveAll(stores), research));

        if (!ticketStateService.transition(ticketId, TicketStatus.CALLING_STORES)) {
            return;
        }
        storeCallerService.callStores(ticketId, research, ranked, ticket.getMaxStores())
                .whenCompleteAsync((outcomes, ex) -> {
                    if (ex != null) {
                        logger.error("Call batch for ticket {} failed", ticketId, ex);
                        ticketStateService.fail(ticketId, "Store calls failed: " + ex.getMessage());
                        return;
                    }
                    finish(ticketId, research, outcomes);
                }, ticketPipelineExecutor);
    }

    void finish(UUID ticketId, ProductResearch research, List<CallOutcome> outcomes) {
        try {
            if (outcomes.stream().noneMatch(CallOutcome::dialed)) {
                ticketStateService.fail(ticketId, "Could not place a call to any of the " + outcomes.size() + " stores");
                return;
            }
            List<StoreCall> calls = storeCallRepository.findByTicketIdOrderByIdAsc(ticketId);
            Map<Long, Store> storesById = storeRepository.findByTicketIdOrderByPriorityAscDiscoveryOrderAsc(ticketId)
                    .stream().collect(Collectors.toMap(Store::getId, Function.identity()));
            ticketStateService.complete(ticketId, callResult(research, calls, storesById));
        } catch (Exception e) {
            logger.error("Finishing ticket {} failed", ticketId, e);
            ticketStateService.fail(ticketId, "Processing error: " + e.getMessage());
        }
    }

    Map<String, Object> callResult(ProductResearch research, List<StoreCall> calls, Map<Long, Store> storesById) {
        long connected = calls.stream()
                .filter(c -> c.getStatus() == StoreCallStatus.ANALYZED || c.getStatus() == StoreCallStatus.UNANALYZABLE)
                .count();
        long failed = calls.stream().filter(c -> c.getStatus() == StoreCallStatus.FAILED).count();
        List<OptionView> options = optionsAggregatorService.rank(calls, storesById, Optional.empty());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", options.isEmpty() ? "no_availability" : "found");
        result.put("product_name", research.productName());
        result.put("stores_contacted", calls.size());
        result.put("stores_connected", connected);
        result.put("stores_failed", failed);
        result.put("stores_available", options.size());
        if (!options.isEmpty()) {
            OptionView best = options.get(0);
            Map<String, Object> bestOption = new LinkedHashMap<>();
            bestOption.put("store_call_id", best.getStoreCallId());
            bestOption.put("store_name", best.getStoreName());
            bestOption.put("price", best.getPrice());
            bestOption.put("match_type", best.getMatchType());
            bestOption.put("matched_product", best.getMatchedProduct());
            result.put("best_option", bestOption);
        }
        return result;
    }
}
