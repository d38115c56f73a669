package com.acme.autodoist.config;

import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import java.time.DateTimeException;
import java.time.ZoneId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fails startup when the credentials needed to talk to Todoist are missing.
 */
@Singleton
public class EventsConfigValidator implements ApplicationEventListener<StartupEvent> {
    private static final Logger LOG = LoggerFactory.getLogger(EventsConfigValidator.class);

    private final EventsConfig config;

    public EventsConfigValidator(EventsConfig config) {
        this.config = config;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        validate(config);
    }

    static void validate(EventsConfig config) {
        if (isBlank(config.getApiToken())) {
            throw new IllegalStateException("TODOIST_API_KEY (autodoist.api-token) is required");
        }
        if (isBlank(config.getWebhookSecret())) {
            throw new IllegalStateException("TODOIST_CLIENT_SECRET (autodoist.webhook-secret) is required");
        }
        try {
            ZoneId.of(config.getReminderTimezone());
        } catch (DateTimeException | NullPointerException e) {
            LOG.warn("Invalid reminder timezone '{}', falling back to {}",
                config.getReminderTimezone(), EventsConfig.DEFAULT_TIMEZONE);
        }
        if (config.isRuleReminderNotify() && isBlank(config.getReminderWebhookUrl())) {
            LOG.warn("Reminder rule enabled without a webhook url; reminders will be skipped");
        }
        LOG.info("Config loaded: enabled={} dryRun={} rules[clearComments={}, purgeSubtasks={}, reminderNotify={}]",
            config.isEnabled(), config.isDryRun(), config.isRuleRecurringClearComments(),
            config.isRuleRecurringPurgeSubtasks(), config.isRuleReminderNotify());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
