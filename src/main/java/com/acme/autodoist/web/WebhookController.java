package com.acme.autodoist.web;

import com.acme.autodoist.core.Jsons;
import com.acme.autodoist.core.PipelineResult;
import com.acme.autodoist.core.WebhookDelivery;
import com.acme.autodoist.core.WebhookPipeline;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Header;
import io.micronaut.http.annotation.Post;

@Controller("/hooks")
public class WebhookController {
    static final String SIGNATURE_HEADER = "X-Todoist-Hmac-SHA256";
    static final String DELIVERY_HEADER = "X-Todoist-Delivery-ID";

    private final WebhookPipeline pipeline;

    public WebhookController(WebhookPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Post(value = "/todoist", produces = MediaType.APPLICATION_JSON)
    public HttpResponse<String> todoist(
            @Body @Nullable byte[] payload,
            @Header(value = SIGNATURE_HEADER, defaultValue = "") String signature,
            @Header(value = DELIVERY_HEADER, defaultValue = "") String deliveryId) {

        // signatures are computed over the exact bytes sent, so the body is never decoded here
        byte[] raw = payload == null ? new byte[0] : payload;
        PipelineResult result = pipeline.process(new WebhookDelivery(deliveryId, signature, raw));
        return json(result.status(), result.body());
    }

    static HttpResponse<String> json(int status, Object body) {
        return HttpResponse.<String>status(HttpStatus.valueOf(status))
            .contentType(MediaType.APPLICATION_JSON_TYPE)
            .body(Jsons.toJson(body));
    }
}
