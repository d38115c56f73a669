package com.acme.autodoist.web;

import com.acme.autodoist.config.EventsConfig;
import com.acme.autodoist.core.FocusTriggerService;
import com.acme.autodoist.core.Jsons;
import com.acme.autodoist.core.PipelineResult;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpHeaders;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Header;
import io.micronaut.http.annotation.Post;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;

/**
 * Entry point for the external scheduler. Body: {@code {"source": "...", "deliver": true}}, both optional.
 */
@Controller("/internal")
public class InternalTriggerController {

    private final FocusTriggerService trigger;
    private final EventsConfig config;

    public InternalTriggerController(FocusTriggerService trigger, EventsConfig config) {
        this.trigger = trigger;
        this.config = config;
    }

    @Post(value = "/trigger", produces = MediaType.APPLICATION_JSON)
    public HttpResponse<String> trigger(
            @Header(value = HttpHeaders.AUTHORIZATION, defaultValue = "") String authorization,
            @Body @Nullable String payload) {
        if (!isInternal(authorization)) {
            return WebhookController.json(401, Map.of("ok", false, "error", "unauthorized"));
        }
        Map<String, Object> request = Jsons.toMap(payload);
        Object source = request.get("source");
        boolean deliver = Boolean.TRUE.equals(request.get("deliver"));
        PipelineResult result = trigger.trigger(source == null ? null : source.toString(), deliver);
        return WebhookController.json(result.status(), result.body());
    }

    private boolean isInternal(@Nullable String authorization) {
        String token = config.getInternalToken();
        if (token == null || token.isBlank() || authorization == null || authorization.isBlank()) {
            return false;
        }
        byte[] expected = ("Bearer " + token).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, authorization.trim().getBytes(StandardCharsets.UTF_8));
    }
}
