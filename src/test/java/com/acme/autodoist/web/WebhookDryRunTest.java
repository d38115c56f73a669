package com.acme.autodoist.web;

import com.acme.autodoist.core.Jsons;
import com.acme.autodoist.spi.ReceiptLedger;
import com.acme.autodoist.spi.TaskClient;
import com.acme.autodoist.todoist.HttpTaskClient;
import io.micronaut.context.annotation.Property;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.annotation.Client;
import io.micronaut.test.annotation.MockBean;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import java.util.UUID;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@MicronautTest(transactional = false)
@Property(name = "autodoist.dry-run", value = "true")
class WebhookDryRunTest {

    @Inject
    @Client("/")
    HttpClient client;

    @Inject
    TaskClient tasks;

    @Inject
    ReceiptLedger ledger;

    @MockBean(HttpTaskClient.class)
    TaskClient mockTasks() {
        return mock(TaskClient.class);
    }

    @Test
    void testDryRunRecordsSkippedActions() {
        String deliveryId = "dry-" + UUID.randomUUID();
        WebhookEndToEndTest.stubRecurringTaskWithComments(tasks, "t-dry");

        var response = client.toBlocking()
            .exchange(WebhookEndToEndTest.signed(deliveryId, WebhookEndToEndTest.completed("t-dry")), String.class);

        assertEquals(true, Jsons.toMap(response.body()).get("ok"));
        verify(tasks, never()).deleteComment(anyString());
        var actions = ledger.listActions(deliveryId);
        assertEquals(1, actions.size());
        assertEquals("skipped", actions.get(0).result());
        assertEquals("dry_run", actions.get(0).meta().get("reason"));
    }
}
