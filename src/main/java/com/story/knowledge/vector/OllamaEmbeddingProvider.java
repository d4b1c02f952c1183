package com.story.knowledge.vector;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.story.knowledge.core.exception.StoreException;
import com.story.knowledge.core.exception.TransientStoreException;
import com.story.knowledge.core.model.StoreSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Embedding provider backed by a local Ollama server.
 *
 * Ollama must be running (default: http://localhost:11434) with the model pulled:
 * {@code ollama pull nomic-embed-text}.
 *
 * <pre>
 * EmbeddingProvider embeddings = OllamaEmbeddingProvider.builder()
 *     .baseUrl("http://localhost:11434")
 *     .model("nomic-embed-text")
 *     .build();
 * </pre>
 */
public class OllamaEmbeddingProvider implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingProvider.class);

    private static final String DEFAULT_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_MODEL = "nomic-embed-text";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String baseUrl;
    private final String model;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private OllamaEmbeddingProvider(Builder builder) {
        this.baseUrl = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.model = builder.model != null ? builder.model : DEFAULT_MODEL;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = builder.httpClient != null ? builder.httpClient : HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public float[] embed(String text, Duration callTimeout) {
        Duration effective = callTimeout.compareTo(timeout) < 0 ? callTimeout : timeout;
        if (effective.isZero() || effective.isNegative()) {
            throw new TransientStoreException("No time left to embed content", StoreSide.VECTOR);
        }
        try {
            String body = objectMapper.writeValueAsString(new EmbeddingRequest(model, text));
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/embeddings"))
                    .timeout(effective)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 500) {
                throw new TransientStoreException("Ollama returned status " + response.statusCode(), StoreSide.VECTOR);
            }
            if (response.statusCode() != 200) {
                throw new StoreException("Ollama returned status " + response.statusCode() + ": " + response.body(),
                        StoreSide.VECTOR);
            }

            EmbeddingResponse parsed = objectMapper.readValue(response.body(), EmbeddingResponse.class);
            if (parsed.embedding() == null || parsed.embedding().length == 0) {
                throw new StoreException("Ollama returned an empty embedding for model " + model, StoreSide.VECTOR);
            }
            log.debug("Embedded {} chars into {} dimensions", text.length(), parsed.embedding().length);
            return parsed.embedding();
        } catch (JsonProcessingException e) {
            throw new StoreException("Unreadable Ollama response: " + e.getMessage(), StoreSide.VECTOR, e);
        } catch (IOException e) {
            throw new TransientStoreException("Ollama unreachable: " + e.getMessage(), StoreSide.VECTOR, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientStoreException("Interrupted while calling Ollama", StoreSide.VECTOR, e);
        }
    }

    @Override
    public String getProviderName() {
        return "Ollama/" + model;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String model;
        private Duration timeout;
        private HttpClient httpClient;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public OllamaEmbeddingProvider build() {
            return new OllamaEmbeddingProvider(this);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingRequest(String model, String prompt) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingResponse(float[] embedding) {}
}
