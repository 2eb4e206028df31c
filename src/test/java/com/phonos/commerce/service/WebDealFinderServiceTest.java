package com.phonos.commerce.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonos.commerce.exception.ErrorCode;
import com.phonos.commerce.exception.UpstreamProviderException;
import com.phonos.commerce.model.ProductResearch;
import com.phonos.commerce.model.WebDeal;
import com.phonos.commerce.model.WebDealResult;
import com.phonos.commerce.model.WebDealStatus;
import com.phonos.commerce.repository.WebDealResultRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebDealFinderServiceTest {

    private static final UUID TICKET_ID = UUID.randomUUID();

    @Mock
    private BedrockChatService bedrockChatService;

    @Mock
    private WebDealResultRepository webDealResultRepository;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final ProductResearch product = new ProductResearch("20W USB-C charger", "electronics",
            Map.of(), List.of(), null, "mobile accessories", List.of("20W usb c charger price"), false);

    private WebDealFinderService webDealFinderService;

    @BeforeEach
    void setUp() {
        webDealFinderService = new WebDealFinderService(bedrockChatService, new PromptTemplateLoader(),
                webDealResultRepository, Runnable::run, 30);
    }

    @Test
    void dedupeDropsUnpricedListingsAndKeepsCheapestPerUrl() {
        List<WebDeal> deals = WebDealFinderService.dedupe(List.of(
                deal("Amazon", "Anker 20W", "1299", "https://amazon.in/dp/A1"),
                deal("Amazon", "Anker 20W", "1199", "https://amazon.in/dp/A1/"),
                deal("Flipkart", "Anker 20W", "0", "https://flipkart.com/p/1"),
                deal("Croma", "Anker 20W", null, null),
                deal("Blinkit", "Anker 20W Charger", "1349", null),
                deal("blinkit", "anker 20w  charger", "1399", null)));

        assertThat(deals).extracting(WebDeal::platform).containsExactly("Amazon", "Blinkit");
        assertThat(deals.get(0).price()).isEqualByComparingTo("1199");
    }

    @Test
    void mergedListingsFromAllAnglesArePersisted() throws Exception {
        when(bedrockChatService.invokeForJson(anyString(), anyInt())).thenReturn(objectMapper.readTree(
                "{\"summary\": \"Widely available\", \"deals\": ["
                        + "{\"platform\": \"Amazon\", \"product_title\": \"Anker 20W\", \"price\": 1199, \"url\": \"https://amazon.in/dp/A1\"},"
                        + "{\"platform\": \"Meesho\", \"product_title\": \"Generic 20W\", \"price\": \"Rs. 499\", \"url\": \"https://meesho.com/x\"}]}"));
        when(webDealResultRepository.save(any(WebDealResult.class))).thenAnswer(invocation -> invocation.getArgument(0));

        WebDealResult result = webDealFinderService.start(TICKET_ID, product, "HSR Layout").get(5, TimeUnit.SECONDS);

        assertThat(result.getStatus()).isEqualTo(WebDealStatus.FOUND);
        assertThat(result.getSearchSummary()).isEqualTo("Widely available");
        assertThat(result.getDeals()).extracting(WebDeal::platform).containsExactly("Meesho", "Amazon");
        verify(webDealResultRepository).save(result);
    }

    @Test
    void allAnglesFailingIsRecordedAsFailed() throws Exception {
        when(bedrockChatService.invokeForJson(anyString(), anyInt()))
                .thenThrow(new UpstreamProviderException(ErrorCode.LLM_ERROR, "throttled"));
        when(webDealResultRepository.save(any(WebDealResult.class))).thenAnswer(invocation -> invocation.getArgument(0));

        WebDealResult result = webDealFinderService.start(TICKET_ID, product, "HSR Layout").get(5, TimeUnit.SECONDS);

        assertThat(result.getStatus()).isEqualTo(WebDealStatus.FAILED);
        assertThat(result.getDeals()).isEmpty();
    }

    @Test
    void someAnglesSucceedingWithNoListingsIsEmpty() {
        WebDealResult result = webDealFinderService.merge(TICKET_ID, List.of(
                new WebDealFinderService.AngleResult("price_compare", true, null, List.of()),
                new WebDealFinderService.AngleResult("deals_offers", false, null, List.of())));

        assertThat(result.getStatus()).isEqualTo(WebDealStatus.EMPTY);
    }

    private static WebDeal deal(String platform, String title, String price, String url) {
        return new WebDeal(platform, title, price != null ? new BigDecimal(price) : null, null, null, url,
                "medium", null, "price_compare");
    }
}
