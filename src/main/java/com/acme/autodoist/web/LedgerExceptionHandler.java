package com.acme.autodoist.web;

import com.acme.autodoist.core.LedgerException;
import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Storage failures end the request with a 500 and a short error code, never a stack trace.
 */
@Produces
@Singleton
@Requires(classes = {LedgerException.class, ExceptionHandler.class})
public class LedgerExceptionHandler implements ExceptionHandler<LedgerException, HttpResponse<String>> {
    private static final Logger LOG = LoggerFactory.getLogger(LedgerExceptionHandler.class);

    @Override
    public HttpResponse<String> handle(HttpRequest request, LedgerException exception) {
        LOG.error("Ledger unavailable while handling {} {}", request.getMethodName(), request.getPath(), exception);
        return WebhookController.json(500, Map.of("ok", false, "error", "storage_unavailable"));
    }
}
