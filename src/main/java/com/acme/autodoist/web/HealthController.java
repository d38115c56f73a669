package com.acme.autodoist.web;

import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import java.util.Map;

@Controller("/health")
public class HealthController {

    @Get(produces = MediaType.APPLICATION_JSON)
    public HttpResponse<String> health() {
        return WebhookController.json(200, Map.of("ok", true));
    }
}
