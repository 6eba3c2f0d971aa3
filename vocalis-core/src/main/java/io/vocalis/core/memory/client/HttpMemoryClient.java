package io.vocalis.core.memory.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vocalis.core.model.CategorySummary;
import io.vocalis.core.model.ConversationTurn;
import io.vocalis.core.model.MemoryScope;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class HttpMemoryClient implements MemoryClient {
    private static final Logger LOG = LoggerFactory.getLogger(HttpMemoryClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    public static final String DEFAULT_API_BASE = "https://api.memu.so/api/v1";

    private final String apiKey;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final CategoryNormalizer normalizer;
    private final int submitMaxAttempts;

    public HttpMemoryClient(String apiKey, String apiBase) {
        this(apiKey, apiBase, 2);
    }

    public HttpMemoryClient(String apiKey, String apiBase, int submitMaxAttempts) {
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.submitMaxAttempts = Math.max(1, submitMaxAttempts);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .readTimeout(Duration.ofSeconds(30))
            .writeTimeout(Duration.ofSeconds(10))
            .build();
        this.mapper = new ObjectMapper();
        this.normalizer = new CategoryNormalizer();
    }

    @Override
    public String submit(MemoryScope scope, List<ConversationTurn> turns) throws MemoryClientException {
        Objects.requireNonNull(scope, "scope must not be null");
        if (turns == null || turns.isEmpty()) {
            throw new IllegalArgumentException("turns must not be empty");
        }
        Request request = new Request.Builder()
            .url(url("memory", "memorize"))
            .post(RequestBody.create(submissionPayload(scope, turns), JSON))
            .build();

        long delayMs = 250;
        for (int attempt = 1; ; attempt++) {
            try {
                JsonNode root = execute(request);
                String taskId = root.path("task_id").asText(root.path("taskId").asText(""));
                if (taskId.isBlank()) {
                    throw new MemoryServiceException("submission response did not include a task id", 200);
                }
                return taskId;
            } catch (MemoryClientException e) {
                if (!e.retryable() || attempt >= submitMaxAttempts) {
                    throw e;
                }
                LOG.debug("Submission attempt {} for user {} failed, retrying: {}", attempt, scope.userId(), e.getMessage());
                sleep(delayMs);
                delayMs = Math.min(delayMs * 2, 2000);
            }
        }
    }

    @Override
    public RemoteTaskStatus status(String taskId) throws MemoryClientException {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId must not be blank");
        }
        Request request = new Request.Builder()
            .url(url("memory", "memorize", "status", taskId))
            .get()
            .build();
        JsonNode root = execute(request);
        String raw = root.path("status").asText(root.path("state").asText(""));
        if (raw.isBlank()) {
            throw new MemoryServiceException("status response for task " + taskId + " did not include a status", 200);
        }
        return RemoteTaskStatus.parse(raw);
    }

    @Override
    public List<CategorySummary> retrieveDefaultCategories(MemoryScope scope) throws MemoryClientException {
        Objects.requireNonNull(scope, "scope must not be null");
        HttpUrl url = url("memory", "retrieve", "default-categories").newBuilder()
            .addQueryParameter("user_id", scope.userId())
            .addQueryParameter("agent_id", scope.agentId())
            .build();
        Request request = new Request.Builder().url(url).get().build();
        return normalizer.normalize(execute(request));
    }

    private JsonNode execute(Request request) throws MemoryClientException {
        Request authorized = request.newBuilder()
            .header("Authorization", "Bearer " + apiKey)
            .header("Accept", "application/json")
            .build();
        try (Response response = client.newCall(authorized).execute()) {
            String body = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                throw new MemoryServiceException(
                    "memory service returned HTTP " + response.code() + " for " + request.url().encodedPath() + ": " + truncate(body),
                    response.code()
                );
            }
            if (body.isBlank()) {
                throw new MemoryServiceException("memory service returned an empty body for " + request.url().encodedPath(), response.code());
            }
            try {
                return mapper.readTree(body);
            } catch (JsonProcessingException e) {
                throw new MemoryServiceException("memory service returned malformed JSON: " + truncate(body), response.code(), e);
            }
        } catch (MemoryClientException e) {
            throw e;
        } catch (IOException e) {
            throw new MemoryTransportException("could not reach memory service at " + request.url().host() + ": " + e.getMessage(), e);
        }
    }

    private String submissionPayload(MemoryScope scope, List<ConversationTurn> turns) throws MemoryClientException {
        List<Map<String, Object>> conversation = new ArrayList<>();
        for (ConversationTurn turn : turns) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", turn.role().wireValue());
            row.put("content", turn.text());
            conversation.add(row);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("user_id", scope.userId());
        payload.put("user_name", scope.userName());
        payload.put("agent_id", scope.agentId());
        payload.put("agent_name", scope.agentName());
        payload.put("conversation", conversation);
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new MemoryClientException("failed to encode submission payload", e);
        }
    }

    private HttpUrl url(String... segments) {
        HttpUrl.Builder builder = apiBase.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    private String truncate(String value) {
        if (value == null) {
            return "";
        }
        if (value.length() <= 300) {
            return value;
        }
        return value.substring(0, 300) + "...";
    }

    private void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
