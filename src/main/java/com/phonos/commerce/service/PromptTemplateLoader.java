package com.phonos.commerce.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads prompt templates from {@code classpath:prompts/} and fills {@code {placeholder}} slots.
 */
@Component
public class PromptTemplateLoader {

    private static final Logger log = LoggerFactory.getLogger(PromptTemplateLoader.class);

    private final Map<String, String> cache = new ConcurrentHashMap<>();

    public String load(String name, String fallback) {
        return cache.computeIfAbsent(name, key -> read(key, fallback));
    }

    public String render(String name, String fallback, Map<String, String> values) {
        String rendered = load(name, fallback);
        for (Map.Entry<String, String> entry : values.entrySet()) {
            String value = entry.getValue() == null ? "" : entry.getValue();
            rendered = rendered.replace("{" + entry.getKey() + "}", value);
        }
        return rendered;
    }

    private String read(String name, String fallback) {
        ClassPathResource resource = new ClassPathResource("prompts/" + name + ".txt");
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Failed to load prompt template {}: {}", name, e.getMessage());
            return fallback;
        }
    }
}
