package com.phonos.commerce.service;

import com.phonos.commerce.exception.UpstreamProviderException;
import com.phonos.commerce.model.StoreCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds callable stores near the requester. Stores without a phone number are dropped and
 * duplicates (same place id or same phone number) are collapsed, keeping the first hit.
 */
@Service
public class StoreFinderService {

    private static final Logger log = LoggerFactory.getLogger(StoreFinderService.class);

    private final GoogleMapsClient googleMapsClient;
    private final int maxCandidates;

    public StoreFinderService(GoogleMapsClient googleMapsClient,
                              @Value("${app.maps.max-candidates:10}") int maxCandidates) {
        this.googleMapsClient = googleMapsClient;
        this.maxCandidates = Math.max(1, maxCandidates);
    }

    /**
     * @return candidates in the maps provider's order; empty when nothing callable was found
     *         or the provider failed
     */
    public List<StoreCandidate> findStores(String storeSearchQuery, String location) {
        String searchText = storeSearchQuery + " near " + location;
        List<StoreCandidate> raw;
        try {
            raw = googleMapsClient.searchStores(searchText, maxCandidates);
        } catch (UpstreamProviderException e) {
            log.warn("Store search failed for '{}': {}", searchText, e.getMessage());
            return List.of();
        }

        List<StoreCandidate> callable = new ArrayList<>();
        Set<String> seenPlaces = new HashSet<>();
        Set<String> seenPhones = new HashSet<>();
        for (StoreCandidate candidate : raw) {
            if (!StringUtils.hasText(candidate.phoneNumber())) {
                continue;
            }
            String phoneKey = normalizePhone(candidate.phoneNumber());
            if (candidate.placeId() != null && !seenPlaces.add(candidate.placeId())) {
                continue;
            }
            if (!seenPhones.add(phoneKey)) {
                continue;
            }
            callable.add(candidate);
        }
        log.info("Store search '{}' returned {} results, {} callable", searchText, raw.size(), callable.size());
        return callable;
    }

    static String normalizePhone(String phone) {
        String digits = phone.replaceAll("\\D", "");
        return digits.length() > 10 ? digits.substring(digits.length() - 10) : digits;
    }
}
