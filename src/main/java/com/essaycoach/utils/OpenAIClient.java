package com.essaycoach.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for OpenAI-compatible chat-completion and embedding endpoints
 */
public class OpenAIClient {
    private static final Logger logger = LoggerFactory.getLogger(OpenAIClient.class);

    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String baseUrl;

    public OpenAIClient(String apiKey, String baseUrl) {
        this(apiKey, baseUrl, Duration.ofSeconds(60), Duration.ofSeconds(60));
    }

    /**
     * @param callTimeout bound on a whole request, from connect to the last byte of the body
     */
    public OpenAIClient(String apiKey, String baseUrl, Duration readTimeout, Duration callTimeout) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.objectMapper = new ObjectMapper();
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(30))
                .readTimeout(readTimeout)
                .writeTimeout(Duration.ofSeconds(30))
                .callTimeout(callTimeout)
                .build();
    }

    /**
     * Send a single user message and return the assistant's reply text.
     */
    public String chatCompletion(String model, String systemPrompt, String userPrompt, int maxTokens) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", List.of(
            Map.of("role", "system", "content", systemPrompt),
            Map.of("role", "user", "content", userPrompt)));
        body.put("temperature", 0.0);
        body.put("max_tokens", maxTokens);

        JsonNode response = post("/chat/completions", body);
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new IOException("Invalid response format from chat completion endpoint");
        }
        return content.asText();
    }

    /**
     * Embed one input. {@code dimensions} is passed through for models that support shortening.
     */
    public double[] embedding(String model, String input, int dimensions) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("input", input);
        body.put("dimensions", dimensions);

        JsonNode response = post("/embeddings", body);
        JsonNode vector = response.path("data").path(0).path("embedding");
        if (!vector.isArray() || vector.isEmpty()) {
            throw new IOException("Invalid response format from embedding endpoint");
        }
        double[] values = new double[vector.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = vector.get(i).asDouble();
        }
        return values;
    }

    private JsonNode post(String path, Map<String, Object> body) throws IOException {
        Request request = new Request.Builder()
                .url(baseUrl + path)
                .addHeader("Authorization", "Bearer " + apiKey)
                .addHeader("Content-Type", "application/json")
                .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON))
                .build();

        logger.debug("POST {}{}", baseUrl, path);
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("OpenAI API request failed: " + response.code() + " " + response.message());
            }
            ResponseBody responseBody = response.body();
            if (responseBody == null) {
                throw new IOException("OpenAI API returned an empty body");
            }
            return objectMapper.readTree(responseBody.string());
        }
    }
}
