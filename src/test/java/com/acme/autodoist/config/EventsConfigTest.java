package com.acme.autodoist.config;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EventsConfigTest {

    @Test
    void testDefaults() {
        EventsConfig config = new EventsConfig();
        assertTrue(config.isEnabled());
        assertFalse(config.isDryRun());
        assertTrue(config.isRuleRecurringClearComments());
        assertFalse(config.isRuleRecurringPurgeSubtasks());
        assertFalse(config.isRuleReminderNotify());
        assertEquals(List.of("[openclaw:plan]"), config.getKeepMarkers());
        assertEquals(200, config.getMaxDeleteComments());
        assertEquals(200, config.getMaxDeleteSubtasks());
        assertEquals(60, config.getReminderCooldownMinutes());
        assertEquals("America/Chicago", config.getReminderTimezone());
        assertEquals(9, config.getAllowedHourStart());
        assertEquals(18, config.getAllowedHourEnd());
        assertEquals("discord", config.getReminderChannel());
        assertTrue(config.getAllowedUserIds().isEmpty());
    }

    @Test
    void testIdSetsAreTrimmedAndBlanksDropped() {
        EventsConfig config = new EventsConfig();
        config.setAllowedProjectIds(new LinkedHashSet<>(Arrays.asList(" p1 ", "", "p2", null)));
        assertEquals(new LinkedHashSet<>(List.of("p1", "p2")), config.getAllowedProjectIds());
    }

    @Test
    void testRuleFlags() {
        EventsConfig config = new EventsConfig();
        config.setRuleRecurringClearComments(false);
        config.setRuleReminderNotify(true);

        assertFalse(config.isRuleEnabled("recurring_clear_comments_on_completion"));
        assertFalse(config.isRuleEnabled("recurring_purge_subtasks_on_completion"));
        assertTrue(config.isRuleEnabled("reminder_notify"));
        assertTrue(config.isRuleEnabled("something_else"));
    }

    @Test
    void testLedgerQuerySecondsRoundsUp() {
        TimeoutConfig timeouts = new TimeoutConfig();
        assertEquals(5, timeouts.getLedgerQuerySeconds());
        timeouts.setLedgerQuery(Duration.ofMillis(200));
        assertEquals(1, timeouts.getLedgerQuerySeconds());
        timeouts.setLedgerQuery(Duration.ofMillis(1500));
        assertEquals(2, timeouts.getLedgerQuerySeconds());
        timeouts.setLedgerQuery(Duration.ofSeconds(3));
        assertEquals(3, timeouts.getLedgerQuerySeconds());
    }
}
