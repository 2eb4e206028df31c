package com.phonos.commerce.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonos.commerce.exception.ErrorCode;
import com.phonos.commerce.exception.UpstreamProviderException;
import com.phonos.commerce.model.MatchType;
import com.phonos.commerce.model.Product;
import com.phonos.commerce.model.TranscriptAnalysis;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TranscriptAnalyzerServiceTest {

    @Mock
    private BedrockChatService bedrockChatService;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private TranscriptAnalyzerService transcriptAnalyzerService;

    private final Product product = Product.builder()
            .productName("20W USB-C charger")
            .specs(Map.of("wattage", "20W"))
            .build();

    @BeforeEach
    void setUp() {
        transcriptAnalyzerService = new TranscriptAnalyzerService(bedrockChatService, new PromptTemplateLoader(), objectMapper);
    }

    @Test
    void blankTranscriptIsUnanalyzableWithoutCallingTheModel() {
        TranscriptAnalysis analysis = transcriptAnalyzerService.analyze("   ", product);

        assertThat(analysis.analyzable()).isFalse();
        verifyNoInteractions(bedrockChatService);
    }

    @Test
    void modelFailureIsUnanalyzable() {
        when(bedrockChatService.invokeForJson(anyString(), anyInt()))
                .thenThrow(new UpstreamProviderException(ErrorCode.LLM_ERROR, "model unavailable"));

        TranscriptAnalysis analysis = transcriptAnalyzerService.analyze("AI: hello? User: yes we have it", product);

        assertThat(analysis.analyzable()).isFalse();
        assertThat(analysis.productAvailable()).isFalse();
    }

    @Test
    void replyWithoutAvailabilityIsUnanalyzable() throws Exception {
        when(bedrockChatService.invokeForJson(anyString(), anyInt()))
                .thenReturn(objectMapper.readTree("{\"call_summary\": \"line was noisy\"}"));

        assertThat(transcriptAnalyzerService.analyze("AI: hello? User: ...", product).analyzable()).isFalse();
    }

    @Test
    void extractsOfferFromReply() throws Exception {
        when(bedrockChatService.invokeForJson(anyString(), anyInt())).thenReturn(objectMapper.readTree("{"
                + "\"call_connected\": true, \"product_available\": \"yes\", \"matched_product\": \"Anker 20W\", "
                + "\"price\": \"Rs. 1,499\", \"product_match_type\": \"close\", \"delivery_available\": true, "
                + "\"delivery_eta\": \"2 hours\", \"delivery_charge\": 50, \"call_summary\": \"They have it.\", "
                + "\"data_quality_score\": 0.9}"));

        TranscriptAnalysis analysis = transcriptAnalyzerService.analyze("AI: ... User: Anker 20W, 1499 rupees", product);

        assertThat(analysis.analyzable()).isTrue();
        assertThat(analysis.productAvailable()).isTrue();
        assertThat(analysis.price()).isEqualByComparingTo("1499");
        assertThat(analysis.matchType()).isEqualTo(MatchType.ALTERNATIVE);
        assertThat(analysis.deliveryCharge()).isEqualByComparingTo("50");
        assertThat(analysis.raw()).containsEntry("product_match_type", "alternative");
        assertThat(analysis.raw()).containsKey("data_quality_score");
    }
}
