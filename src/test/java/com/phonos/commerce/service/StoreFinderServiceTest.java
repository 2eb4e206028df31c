package com.phonos.commerce.service;

import com.phonos.commerce.exception.ErrorCode;
import com.phonos.commerce.exception.UpstreamProviderException;
import com.phonos.commerce.model.StoreCandidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StoreFinderServiceTest {

    @Mock
    private GoogleMapsClient googleMapsClient;

    private StoreFinderService storeFinderService;

    @BeforeEach
    void setUp() {
        storeFinderService = new StoreFinderService(googleMapsClient, 10);
    }

    @Test
    void dropsStoresWithoutPhoneAndCollapsesDuplicates() {
        when(googleMapsClient.searchStores("mobile accessories near HSR Layout", 10)).thenReturn(List.of(
                candidate("p1", "Alpha Mobiles", "+91 98450 12345"),
                candidate("p2", "No Phone Traders", null),
                candidate("p1", "Alpha Mobiles (dup place)", "+91 98450 99999"),
                candidate("p3", "Alpha Mobiles Branch", "098450 12345"),
                candidate("p4", "Beta Electronics", "080-4123-4567")));

        List<StoreCandidate> stores = storeFinderService.findStores("mobile accessories", "HSR Layout");

        assertThat(stores).extracting(StoreCandidate::placeId).containsExactly("p1", "p4");
    }

    @Test
    void providerFailureMeansNoStores() {
        when(googleMapsClient.searchStores(anyString(), anyInt()))
                .thenThrow(new UpstreamProviderException(ErrorCode.MAPS_ERROR, "REQUEST_DENIED"));

        assertThat(storeFinderService.findStores("charger", "Indiranagar")).isEmpty();
    }

    @Test
    void phoneNumbersCompareOnTheLastTenDigits() {
        assertThat(StoreFinderService.normalizePhone("+91 98450-12345")).isEqualTo("9845012345");
        assertThat(StoreFinderService.normalizePhone("098450 12345")).isEqualTo("9845012345");
        assertThat(StoreFinderService.normalizePhone("4123 4567")).isEqualTo("41234567");
    }

    private static StoreCandidate candidate(String placeId, String name, String phone) {
        return new StoreCandidate(placeId, name, "12th Main, HSR Layout, Bengaluru 560102", phone,
                4.2, 120, 12.91, 77.64);
    }
}
