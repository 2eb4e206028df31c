package com.phonos.commerce.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.util.concurrent.RateLimiter;
import com.phonos.commerce.exception.ErrorCode;
import com.phonos.commerce.exception.UpstreamProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.BedrockRuntimeException;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Sends prompts to an Anthropic model on Amazon Bedrock and returns the first text block.
 * Every LLM-backed component in the pipeline goes through here.
 */
@Service
public class BedrockChatService {

    private static final Logger logger = LoggerFactory.getLogger(BedrockChatService.class);
    private static final int MAX_ATTEMPTS = 6;
    private static final long BASE_BACKOFF_MS = 800L;

    private final BedrockRuntimeClient bedrockClient;
    private final ObjectMapper objectMapper;
    private final RateLimiter bedrockRateLimiter;
    private final String bedrockModelId;
    private final int bedrockMaxTokens;

    public BedrockChatService(BedrockRuntimeClient bedrockClient,
                              ObjectMapper objectMapper,
                              @Qualifier("bedrockRateLimiter") RateLimiter bedrockRateLimiter,
                              @Value("${aws.bedrock.modelId}") String modelId,
                              @Value("${app.bedrock.maxTokens:1024}") int bedrockMaxTokens) {
        this.bedrockClient = bedrockClient;
        this.objectMapper = objectMapper;
        this.bedrockRateLimiter = bedrockRateLimiter;
        this.bedrockModelId = modelId;
        this.bedrockMaxTokens = Math.max(128, bedrockMaxTokens);
        logger.info("BedrockChatService initialized with model ID: {}", this.bedrockModelId);
    }

    /**
     * Calls Bedrock chat completion and returns the first text block with any code fences removed.
     *
     * @throws ThrottledException        when Bedrock is still throttling after all retries
     * @throws UpstreamProviderException on any other Bedrock error or an empty response
     */
    public String invokeChatForText(String content, Integer overrideMaxTokens) {
        int maxTokens = overrideMaxTokens != null ? Math.max(64, overrideMaxTokens) : this.bedrockMaxTokens;
        try {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("anthropic_version", "bedrock-2023-05-31");
            payload.put("max_tokens", maxTokens);
            ArrayNode messages = payload.putArray("messages");
            ObjectNode userMessage = messages.addObject();
            userMessage.put("role", "user");
            userMessage.put("content", content);

            InvokeModelRequest request = InvokeModelRequest.builder()
                    .modelId(bedrockModelId)
                    .contentType("application/json")
                    .accept("application/json")
                    .body(SdkBytes.fromUtf8String(objectMapper.writeValueAsString(payload)))
                    .build();

            InvokeModelResponse response = invokeWithRetry(request);
            JsonNode responseJson = objectMapper.readTree(response.body().asUtf8String());
            JsonNode contentBlock = responseJson.path("content");

            if (contentBlock.isArray() && contentBlock.size() > 0) {
                return stripFences(contentBlock.get(0).path("text").asText("").trim());
            }
            throw new UpstreamProviderException(ErrorCode.LLM_ERROR, "Bedrock response missing content block");
        } catch (ThrottledException | UpstreamProviderException e) {
            throw e;
        } catch (BedrockRuntimeException e) {
            String detail = e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();
            logger.error("Bedrock API error during chat invoke for model {}: {}", bedrockModelId, detail, e);
            throw new UpstreamProviderException(ErrorCode.LLM_ERROR, "Bedrock API error: " + detail, e);
        } catch (JsonProcessingException e) {
            throw new UpstreamProviderException(ErrorCode.LLM_ERROR, "Bedrock response was not valid JSON", e);
        }
    }

    /**
     * Like {@link #invokeChatForText} but parses the reply as a JSON object or array.
     * Prose before or after the JSON is tolerated.
     */
    public JsonNode invokeForJson(String content, Integer overrideMaxTokens) {
        String text = invokeChatForText(content, overrideMaxTokens);
        String json = extractJson(text);
        if (json == null) {
            throw new UpstreamProviderException(ErrorCode.LLM_ERROR, "Model reply contained no JSON: " + abbreviate(text));
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new UpstreamProviderException(ErrorCode.LLM_ERROR, "Model reply was not valid JSON: " + abbreviate(text), e);
        }
    }

    static String stripFences(String textContent) {
        if (textContent.startsWith("```json")) {
            textContent = textContent.substring(7).trim();
            if (textContent.endsWith("```")) {
                textContent = textContent.substring(0, textContent.length() - 3).trim();
            }
        } else if (textContent.startsWith("```") && textContent.endsWith("```") && textContent.length() >= 6) {
            textContent = textContent.substring(3, textContent.length() - 3).trim();
        }
        return textContent;
    }

    static String extractJson(String text) {
        if (text == null) {
            return null;
        }
        int objectStart = text.indexOf('{');
        int arrayStart = text.indexOf('[');
        int start;
        char close;
        if (objectStart >= 0 && (arrayStart < 0 || objectStart < arrayStart)) {
            start = objectStart;
            close = '}';
        } else if (arrayStart >= 0) {
            start = arrayStart;
            close = ']';
        } else {
            return null;
        }
        int end = text.lastIndexOf(close);
        return end > start ? text.substring(start, end + 1) : null;
    }

    private InvokeModelResponse invokeWithRetry(InvokeModelRequest request) {
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            bedrockRateLimiter.acquire();
            try {
                return bedrockClient.invokeModel(request);
            } catch (BedrockRuntimeException e) {
                int statusCode = e.statusCode();
                String code = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
                boolean throttled = statusCode == 429
                        || "ThrottlingException".equalsIgnoreCase(code)
                        || "TooManyRequestsException".equalsIgnoreCase(code)
                        || "ProvisionedThroughputExceededException".equalsIgnoreCase(code);

                if (!throttled) {
                    throw e;
                }

                if (attempt == MAX_ATTEMPTS) {
                    logger.warn("Bedrock throttled after {} attempts; surfacing throttling.", MAX_ATTEMPTS);
                    throw new ThrottledException("Bedrock throttling after retries", e);
                }

                long jitter = ThreadLocalRandom.current().nextLong(50, 200);
                long sleepMs = (long) Math.min(10_000, BASE_BACKOFF_MS * Math.pow(2, attempt - 1) + jitter);
                logger.warn("Bedrock throttled (attempt {}/{}). Backing off for {} ms.", attempt, MAX_ATTEMPTS, sleepMs);
                try {
                    Thread.sleep(sleepMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ThrottledException("Interrupted during backoff", ie);
                }
            }
        }
        throw new IllegalStateException("Unreachable");
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
