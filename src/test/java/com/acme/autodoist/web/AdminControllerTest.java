package com.acme.autodoist.web;

import com.acme.autodoist.core.Jsons;
import com.acme.autodoist.jdbc.JdbcReceiptLedger;
import com.acme.autodoist.spi.ReceiptLedger;
import com.acme.autodoist.spi.ReceiptLedger.Outcome;
import com.acme.autodoist.spi.ReceiptLedger.Receipt;
import com.acme.autodoist.spi.ReceiptStatus;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.annotation.Client;
import io.micronaut.http.client.exceptions.HttpClientResponseException;
import io.micronaut.test.annotation.MockBean;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@MicronautTest(transactional = false)
class AdminControllerTest {

    private static final String ADMIN = "Bearer test-admin-token";

    @Inject
    @Client("/")
    HttpClient client;

    @Inject
    ReceiptLedger ledger;

    @MockBean(JdbcReceiptLedger.class)
    ReceiptLedger mockLedger() {
        return mock(ReceiptLedger.class);
    }

    private static Receipt receipt(String id) {
        return new Receipt(id, Instant.parse("2026-01-05T15:00:00Z"), "item:completed", "u1", null, "task", "t1", "p1",
            ReceiptStatus.PROCESSED, 2, null, Map.of("rules_triggered", 1), "abc");
    }

    @Test
    void testMissingTokenIsUnauthorized() {
        var ex = assertThrows(HttpClientResponseException.class,
            () -> client.toBlocking().exchange(HttpRequest.GET("/api/events"), String.class));
        assertEquals(HttpStatus.UNAUTHORIZED, ex.getStatus());
        verifyNoInteractions(ledger);
    }

    @Test
    void testWrongTokenIsUnauthorized() {
        var request = HttpRequest.GET("/api/events").header("Authorization", "Bearer nope");
        var ex = assertThrows(HttpClientResponseException.class, () -> client.toBlocking().exchange(request, String.class));
        assertEquals(HttpStatus.UNAUTHORIZED, ex.getStatus());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testListReceipts() {
        when(ledger.listReceipts(anyInt())).thenReturn(List.of(receipt("d1")));

        var request = HttpRequest.GET("/api/events?limit=5000").header("Authorization", ADMIN);
        var response = client.toBlocking().exchange(request, String.class);

        assertEquals(HttpStatus.OK, response.getStatus());
        verify(ledger).listReceipts(1000);
        Map<String, Object> json = Jsons.toMap(response.body());
        var items = (List<Map<String, Object>>) json.get("items");
        assertEquals("d1", items.get(0).get("delivery_id"));
        assertEquals("processed", items.get(0).get("status"));
        assertEquals("2026-01-05T15:00:00Z", items.get(0).get("received_at"));
        assertEquals(2, items.get(0).get("attempt_count"));
    }

    @Test
    void testDefaultAndMinimumLimit() {
        when(ledger.listReceipts(anyInt())).thenReturn(List.of());

        client.toBlocking().exchange(HttpRequest.GET("/api/events").header("Authorization", ADMIN), String.class);
        client.toBlocking().exchange(HttpRequest.GET("/api/events?limit=0").header("Authorization", ADMIN), String.class);

        verify(ledger).listReceipts(200);
        verify(ledger).listReceipts(1);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testGetReceiptWithActions() {
        when(ledger.getReceipt("d1")).thenReturn(Optional.of(receipt("d1")));
        when(ledger.listActions("d1")).thenReturn(List.of(
            new Outcome(7, "d1", "recurring_clear_comments_on_completion", "delete_comment", "comment", "c1",
                "success", Map.of("task_id", "t1"))));

        var response = client.toBlocking()
            .exchange(HttpRequest.GET("/api/events/d1").header("Authorization", ADMIN), String.class);

        Map<String, Object> json = Jsons.toMap(response.body());
        assertEquals("d1", ((Map<String, Object>) json.get("receipt")).get("delivery_id"));
        var actions = (List<Map<String, Object>>) json.get("actions");
        assertEquals("delete_comment", actions.get(0).get("action_type"));
        assertEquals("success", actions.get(0).get("result"));
    }

    @Test
    void testUnknownReceiptIs404() {
        when(ledger.getReceipt("nope")).thenReturn(Optional.empty());

        var request = HttpRequest.GET("/api/events/nope").header("Authorization", ADMIN);
        var ex = assertThrows(HttpClientResponseException.class, () -> client.toBlocking().exchange(request, String.class));

        assertEquals(HttpStatus.NOT_FOUND, ex.getStatus());
        assertEquals("not_found", Jsons.toMap(ex.getResponse().getBody(String.class).orElse("")).get("error"));
    }
}
