package com.acme.autodoist.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EventsConfigValidatorTest {

    private static EventsConfig valid() {
        EventsConfig config = new EventsConfig();
        config.setApiToken("token");
        config.setWebhookSecret("secret");
        return config;
    }

    @Test
    void testValidConfigPasses() {
        assertDoesNotThrow(() -> EventsConfigValidator.validate(valid()));
    }

    @Test
    void testMissingApiTokenFails() {
        EventsConfig config = valid();
        config.setApiToken(" ");
        var ex = assertThrows(IllegalStateException.class, () -> EventsConfigValidator.validate(config));
        assertTrue(ex.getMessage().contains("TODOIST_API_KEY"));
    }

    @Test
    void testMissingWebhookSecretFails() {
        EventsConfig config = valid();
        config.setWebhookSecret(null);
        var ex = assertThrows(IllegalStateException.class, () -> EventsConfigValidator.validate(config));
        assertTrue(ex.getMessage().contains("TODOIST_CLIENT_SECRET"));
    }

    @Test
    void testInvalidTimezoneOnlyWarns() {
        EventsConfig config = valid();
        config.setReminderTimezone("Mars/Olympus");
        config.setRuleReminderNotify(true);
        assertDoesNotThrow(() -> EventsConfigValidator.validate(config));
    }
}
