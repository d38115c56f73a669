package com.acme.autodoist.todoist;

import com.acme.autodoist.config.EventsConfig;
import com.acme.autodoist.core.Jsons;
import com.acme.autodoist.core.TaskApiException;
import com.acme.autodoist.spi.TaskClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MediaType;
import io.micronaut.http.MutableHttpRequest;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.annotation.Client;
import io.micronaut.http.client.exceptions.HttpClientException;
import io.micronaut.http.client.exceptions.HttpClientResponseException;
import io.micronaut.http.uri.UriBuilder;
import jakarta.inject.Singleton;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Todoist REST client on the Micronaut HTTP client configured as service {@code todoist}.
 * Timeouts come from {@code micronaut.http.services.todoist}.
 */
@Singleton
public class HttpTaskClient implements TaskClient {
    private static final Logger LOG = LoggerFactory.getLogger(HttpTaskClient.class);
    static final String API = "/api/v1";
    private static final int MAX_PAGES = 100;

    private final HttpClient http;
    private final String apiToken;

    public HttpTaskClient(@Client(id = "todoist") HttpClient http, EventsConfig config) {
        this.http = http;
        this.apiToken = config.getApiToken();
    }

    @Override
    public Task getTask(String taskId) {
        String body = send(HttpRequest.GET(API + "/tasks/" + taskId));
        return Jsons.fromJson(body, Task.class);
    }

    @Override
    public List<Comment> listCommentsForTask(String taskId) {
        return list(UriBuilder.of(API + "/comments").queryParam("task_id", taskId), Comment.class);
    }

    @Override
    public List<Task> listActiveTasksForProject(String projectId) {
        return list(UriBuilder.of(API + "/tasks").queryParam("project_id", projectId), Task.class);
    }

    @Override
    public List<Task> listAllActiveTasks() {
        return list(UriBuilder.of(API + "/tasks"), Task.class);
    }

    @Override
    public void deleteComment(String commentId) {
        delete(API + "/comments/" + commentId);
    }

    @Override
    public void deleteTask(String taskId) {
        delete(API + "/tasks/" + taskId);
    }

    @Override
    public int postWebhook(String url, Map<String, Object> payload, String bearerToken) {
        MutableHttpRequest<String> request = HttpRequest.POST(url, Jsons.toJson(payload))
            .contentType(MediaType.APPLICATION_JSON_TYPE);
        if (bearerToken != null && !bearerToken.isBlank()) {
            request.bearerAuth(bearerToken);
        }
        return exchange(request, "POST webhook").getStatus().getCode();
    }

    private void delete(String path) {
        MutableHttpRequest<?> request = HttpRequest.DELETE(path).bearerAuth(apiToken);
        try {
            http.toBlocking().exchange(request, String.class);
        } catch (HttpClientResponseException e) {
            if (e.getStatus() == HttpStatus.NOT_FOUND) {
                LOG.info("DELETE {} returned 404, treating as already deleted", path);
                return;
            }
            throw new TaskApiException("DELETE " + path + " failed with " + e.getStatus().getCode(),
                e.getStatus().getCode());
        } catch (HttpClientException e) {
            throw new TaskApiException("DELETE " + path + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Reads a list endpoint that answers with either a bare array or {@code {results, next_cursor}} pages.
     */
    private <T> List<T> list(UriBuilder base, Class<T> type) {
        List<T> out = new ArrayList<>();
        String cursor = null;
        for (int page = 0; page < MAX_PAGES; page++) {
            UriBuilder uri = UriBuilder.of(base.build());
            if (cursor != null) {
                uri.queryParam("cursor", cursor);
            }
            JsonNode root = parse(send(HttpRequest.GET(uri.build().toString())));
            JsonNode items = root.isArray() ? root : root.path("results");
            items.forEach(node -> out.add(Jsons.convert(node, type)));
            cursor = root.isObject() ? Jsons.text(root, "next_cursor") : null;
            if (cursor == null || cursor.isEmpty()) {
                return out;
            }
        }
        throw new TaskApiException("GET " + base.build() + " still had a next_cursor after " + MAX_PAGES + " pages", -1);
    }

    private String send(MutableHttpRequest<?> request) {
        request.bearerAuth(apiToken).accept(MediaType.APPLICATION_JSON_TYPE);
        return exchange(request, request.getMethodName() + " " + request.getPath())
            .getBody()
            .orElse("");
    }

    private HttpResponse<String> exchange(MutableHttpRequest<?> request, String what) {
        try {
            return http.toBlocking().exchange(request, String.class);
        } catch (HttpClientResponseException e) {
            throw new TaskApiException(what + " failed with " + e.getStatus().getCode(), e.getStatus().getCode());
        } catch (HttpClientException e) {
            throw new TaskApiException(what + " failed: " + e.getMessage(), e);
        }
    }

    private static JsonNode parse(String body) {
        try {
            return Jsons.readTree(body.isEmpty() ? "[]" : body);
        } catch (JsonProcessingException e) {
            throw new TaskApiException("Unreadable response from Todoist", e);
        }
    }
}
