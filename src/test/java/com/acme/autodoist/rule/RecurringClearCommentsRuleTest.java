package com.acme.autodoist.rule;

import com.acme.autodoist.config.EventsConfig;
import com.acme.autodoist.event.TodoistWebhookEvent;
import com.acme.autodoist.spi.PolicyEvaluator;
import com.acme.autodoist.spi.ReceiptLedger;
import com.acme.autodoist.spi.TaskClient;
import com.acme.autodoist.todoist.Comment;
import java.time.Clock;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RecurringClearCommentsRuleTest {

    private TaskClient tasks;
    private EventsConfig config;
    private RuleContext ctx;
    private final RecurringClearCommentsRule rule = new RecurringClearCommentsRule();

    @BeforeEach
    void setup() {
        tasks = mock(TaskClient.class);
        config = RuleFixtures.config();
        ctx = new RuleContext(config, mock(ReceiptLedger.class), tasks, mock(PolicyEvaluator.class), Clock.systemUTC());
    }

    @Test
    void testMatchesCompletionsOnly() {
        assertTrue(rule.matches(RuleFixtures.completed("t1", "p1")));
        assertFalse(rule.matches(RuleFixtures.reminder("t1", "r1")));
        assertFalse(rule.matches(new TodoistWebhookEvent("d", "item:completed", null, null, null, null, null, null, null)));
    }

    @Test
    void testDeletesAllButKeepMarkedComments() {
        when(tasks.getTask("t1")).thenReturn(RuleFixtures.recurring("t1", "p1"));
        when(tasks.listCommentsForTask("t1")).thenReturn(List.of(
            new Comment("c1", "[openclaw:plan] keep me"),
            new Comment("c2", "done notes"),
            new Comment("c3", "  [OpenClaw:Plan] mixed case"),
            new Comment("c4", null)));

        RulePlan plan = rule.plan(ctx, RuleFixtures.completed("t1", "p1"));

        assertEquals(List.of("c2", "c4"), plan.actions().stream().map(Action::targetId).toList());
        assertEquals(ActionType.DELETE_COMMENT, plan.actions().get(0).type());
        assertEquals("comment", plan.actions().get(0).targetType());
        assertEquals("t1", plan.actions().get(0).meta().get("task_id"));
        assertEquals(2, plan.meta().get("kept_count"));
        assertEquals(2, plan.meta().get("delete_count"));
        assertEquals(false, plan.meta().get("cap_hit"));
        assertEquals(true, plan.meta().get("is_recurring"));
    }

    @Test
    void testCapLimitsDeletes() {
        config.setMaxDeleteComments(1);
        when(tasks.getTask("t1")).thenReturn(RuleFixtures.recurring("t1", "p1"));
        when(tasks.listCommentsForTask("t1")).thenReturn(List.of(
            new Comment("c1", "a"), new Comment("c2", "b"), new Comment("c3", "c")));

        RulePlan plan = rule.plan(ctx, RuleFixtures.completed("t1", "p1"));

        assertEquals(1, plan.actions().size());
        assertEquals("c1", plan.actions().get(0).targetId());
        assertEquals(true, plan.meta().get("cap_hit"));
        assertEquals(1, plan.meta().get("delete_count"));
    }

    @Test
    void testNonRecurringTaskIsSkipped() {
        when(tasks.getTask("t1")).thenReturn(RuleFixtures.oneOff("t1", "p1"));

        RulePlan plan = rule.plan(ctx, RuleFixtures.completed("t1", "p1"));

        assertTrue(plan.isEmpty());
        assertEquals("not_recurring", plan.meta().get("reason"));
        assertEquals("t1", plan.meta().get("task_id"));
        verify(tasks, never()).listCommentsForTask(anyString());
    }
}
