package com.essaycoach.corpus;

import com.essaycoach.errors.EmbeddingException;
import com.essaycoach.utils.OpenAIClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class OpenAIEmbedderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private OpenAIEmbedder embedder;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        OpenAIClient client = new OpenAIClient("test-key", server.url("/v1/").toString());
        embedder = new OpenAIEmbedder(client, "text-embedding-3-small", 3);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private String embeddingBody(List<Double> vector) throws IOException {
        return objectMapper.writeValueAsString(Map.of("data", List.of(Map.of("index", 0, "embedding", vector))));
    }

    @Test
    void testEmbedsThroughEndpoint() throws Exception {
        server.enqueue(new MockResponse().setBody(embeddingBody(List.of(0.1, 0.2, 0.3))));

        assertArrayEquals(new double[]{0.1, 0.2, 0.3}, embedder.embed("my family"));

        RecordedRequest request = server.takeRequest();
        assertEquals("/v1/embeddings", request.getPath());
        assertEquals("Bearer test-key", request.getHeader("Authorization"));
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("text-embedding-3-small", body.path("model").asText());
        assertEquals("my family", body.path("input").asText());
        assertEquals(3, body.path("dimensions").asInt());
    }

    @Test
    void testWrongLengthRejected() throws Exception {
        server.enqueue(new MockResponse().setBody(embeddingBody(List.of(0.1, 0.2))));
        assertThrows(EmbeddingException.class, () -> embedder.embed("my family"));
    }

    @Test
    void testServerErrorBecomesEmbeddingException() {
        server.enqueue(new MockResponse().setResponseCode(500));
        EmbeddingException error = assertThrows(EmbeddingException.class, () -> embedder.embed("my family"));
        assertInstanceOf(IOException.class, error.getCause());
    }
}
