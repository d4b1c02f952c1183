package com.story.knowledge.vector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.story.knowledge.core.exception.StoreException;
import com.story.knowledge.core.exception.TransientStoreException;
import com.story.knowledge.core.exception.ValidationException;
import com.story.knowledge.core.model.EntityIdentifier;
import com.story.knowledge.core.model.StoreSide;
import com.story.knowledge.graph.InputSanitizer;
import com.story.knowledge.store.Deadline;
import com.story.knowledge.store.StagingToken;
import com.story.knowledge.store.VectorEntry;
import com.story.knowledge.store.VectorStoreAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Vector store adapter backed by the Qdrant REST API.
 *
 * <p>{@link #prepareUpsert} validates the entry, computes its embedding and keeps
 * the resulting point in memory under a fresh token; nothing reaches Qdrant until
 * {@link #commit}, which upserts the point by id with {@code wait=true}. Upserting
 * the same point twice leaves one point.</p>
 *
 * <p>Qdrant only accepts UUIDs and unsigned integers as point ids. Identifiers that
 * are not UUIDs are mapped to a name-based UUID and kept in the point payload
 * under {@code entityId}.</p>
 *
 * <pre>
 * QdrantVectorStoreAdapter vectors = QdrantVectorStoreAdapter.builder()
 *     .baseUrl("http://localhost:6333")
 *     .collection("story_elements")
 *     .embeddingProvider(OllamaEmbeddingProvider.builder().build())
 *     .build();
 * vectors.ensureCollection(768);
 * </pre>
 */
public class QdrantVectorStoreAdapter implements VectorStoreAdapter {
    private static final Logger log = LoggerFactory.getLogger(QdrantVectorStoreAdapter.class);

    private static final String DEFAULT_BASE_URL = "http://localhost:6333";
    private static final String DEFAULT_COLLECTION = "story_elements";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    static final String CONTENT_KEY = "content";
    static final String ENTITY_ID_KEY = "entityId";

    private final String baseUrl;
    private final String collection;
    private final String apiKey;
    private final Duration timeout;
    private final EmbeddingProvider embeddingProvider;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ConcurrentMap<String, Point> staged = new ConcurrentHashMap<>();

    private QdrantVectorStoreAdapter(Builder builder) {
        if (builder.embeddingProvider == null) {
            throw new IllegalStateException("embeddingProvider is required");
        }
        this.baseUrl = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.collection = builder.collection != null ? builder.collection : DEFAULT_COLLECTION;
        this.apiKey = builder.apiKey;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.embeddingProvider = builder.embeddingProvider;
        this.httpClient = builder.httpClient != null ? builder.httpClient : HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Point as sent to Qdrant.
     */
    record Point(String id, float[] vector, Map<String, String> payload) {}

    record UpsertRequest(List<Point> points) {}

    @Override
    public StagingToken prepareUpsert(VectorEntry entry, Deadline deadline) {
        InputSanitizer.validate(entry);
        if (entry.metadata().containsKey(CONTENT_KEY) || entry.metadata().containsKey(ENTITY_ID_KEY)) {
            throw new ValidationException("Metadata keys '" + CONTENT_KEY + "' and '" + ENTITY_ID_KEY
                    + "' are reserved", StoreSide.VECTOR);
        }

        float[] vector = embeddingProvider.embed(entry.content(), deadline.remaining());

        Map<String, String> payload = new LinkedHashMap<>(entry.metadata());
        payload.put(CONTENT_KEY, entry.content());
        payload.put(ENTITY_ID_KEY, entry.id().value());

        StagingToken token = StagingToken.newToken(StoreSide.VECTOR);
        staged.put(token.id(), new Point(pointId(entry.id()), vector, payload));
        log.debug("Staged vector point for {} under token {}", entry.id(), token.id());
        return token;
    }

    @Override
    public void commit(StagingToken token, Deadline deadline) {
        Point point = staged.remove(token.id());
        if (point == null) {
            throw new StoreException("Unknown or already finished vector staging token " + token.id(), StoreSide.VECTOR);
        }
        String body;
        try {
            body = objectMapper.writeValueAsString(new UpsertRequest(List.of(point)));
        } catch (JsonProcessingException e) {
            throw new StoreException("Could not serialize vector point: " + e.getMessage(), StoreSide.VECTOR, e);
        }
        HttpRequest request = request("/collections/" + collection + "/points?wait=true", deadline)
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response = send(request);
        requireSuccess(response, "upsert");
        log.debug("Committed vector point {} for token {}", point.id(), token.id());
    }

    @Override
    public void discard(StagingToken token) {
        if (staged.remove(token.id()) != null) {
            log.debug("Discarded vector staging token {}", token.id());
        }
    }

    @Override
    public Optional<VectorEntry> find(EntityIdentifier id) {
        HttpRequest request = request("/collections/" + collection + "/points/" + pointId(id), Deadline.none())
                .GET()
                .build();
        HttpResponse<String> response = send(request);
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        requireSuccess(response, "retrieve");
        try {
            JsonNode result = objectMapper.readTree(response.body()).path("result");
            if (result.isMissingNode() || result.isNull()) {
                return Optional.empty();
            }
            JsonNode payload = result.path("payload");
            Map<String, String> metadata = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = payload.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!CONTENT_KEY.equals(field.getKey()) && !ENTITY_ID_KEY.equals(field.getKey())) {
                    metadata.put(field.getKey(), field.getValue().asText());
                }
            }
            return Optional.of(new VectorEntry(id, payload.path(CONTENT_KEY).asText(""), metadata));
        } catch (JsonProcessingException e) {
            throw new StoreException("Unreadable Qdrant response: " + e.getMessage(), StoreSide.VECTOR, e);
        }
    }

    /**
     * Creates the collection with cosine distance unless it already exists.
     *
     * @param vectorSize dimensions produced by the embedding provider
     */
    public void ensureCollection(int vectorSize) {
        HttpResponse<String> existing = send(request("/collections/" + collection, Deadline.none()).GET().build());
        if (existing.statusCode() == 200) {
            return;
        }
        String body = "{\"vectors\":{\"size\":" + vectorSize + ",\"distance\":\"Cosine\"}}";
        HttpResponse<String> created = send(request("/collections/" + collection, Deadline.none())
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build());
        requireSuccess(created, "create collection");
        log.info("Created Qdrant collection {} with {} dimensions", collection, vectorSize);
    }

    @Override
    public String getName() {
        return "qdrant:" + collection;
    }

    @Override
    public void close() {
        staged.clear();
    }

    int stagedCount() {
        return staged.size();
    }

    static String pointId(EntityIdentifier id) {
        try {
            return UUID.fromString(id.value()).toString();
        } catch (IllegalArgumentException e) {
            return UUID.nameUUIDFromBytes(id.value().getBytes(StandardCharsets.UTF_8)).toString();
        }
    }

    private HttpRequest.Builder request(String path, Deadline deadline) {
        Duration remaining = deadline.remaining();
        Duration effective = remaining.compareTo(timeout) < 0 ? remaining : timeout;
        if (effective.isZero()) {
            throw new TransientStoreException("No time left for Qdrant call " + path, StoreSide.VECTOR);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(effective);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("api-key", apiKey);
        }
        return builder;
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransientStoreException("Qdrant unreachable: " + e.getMessage(), StoreSide.VECTOR, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientStoreException("Interrupted while calling Qdrant", StoreSide.VECTOR, e);
        }
    }

    private static void requireSuccess(HttpResponse<String> response, String action) {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return;
        }
        String message = "Qdrant " + action + " returned status " + status + ": " + response.body();
        if (status >= 500 || status == 429) {
            throw new TransientStoreException(message, StoreSide.VECTOR);
        }
        throw new StoreException(message, StoreSide.VECTOR);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String collection;
        private String apiKey;
        private Duration timeout;
        private EmbeddingProvider embeddingProvider;
        private HttpClient httpClient;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder collection(String collection) {
            this.collection = collection;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder embeddingProvider(EmbeddingProvider embeddingProvider) {
            this.embeddingProvider = embeddingProvider;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public QdrantVectorStoreAdapter build() {
            return new QdrantVectorStoreAdapter(this);
        }
    }
}
