package com.acme.autodoist.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration for webhook ingestion, the automation rules and reminder delivery.
 */
@ConfigurationProperties("autodoist")
public class EventsConfig {

    public static final String DEFAULT_TIMEZONE = "America/Chicago";

    private String apiToken;
    private String webhookSecret;
    private boolean enabled = true;
    private boolean dryRun = false;

    private boolean ruleRecurringClearComments = true;
    private boolean ruleRecurringPurgeSubtasks = false;
    private boolean ruleReminderNotify = false;

    private Set<String> allowedUserIds = new LinkedHashSet<>();
    private Set<String> allowedProjectIds = new LinkedHashSet<>();
    private Set<String> deniedProjectIds = new LinkedHashSet<>();

    private List<String> keepMarkers = List.of("[openclaw:plan]");
    private int maxDeleteComments = 200;
    private int maxDeleteSubtasks = 200;

    private String reminderWebhookUrl;
    private String reminderWebhookToken;
    private boolean reminderRequireFocusLabel = false;
    private int reminderCooldownMinutes = 60;
    private String reminderTimezone = DEFAULT_TIMEZONE;
    private int allowedHourStart = 9;
    private int allowedHourEnd = 18;
    private String reminderChannel = "discord";
    private String reminderTo;

    private String adminToken;
    private String internalToken;

    public String getApiToken() {
        return apiToken;
    }

    public void setApiToken(String apiToken) {
        this.apiToken = apiToken;
    }

    public String getWebhookSecret() {
        return webhookSecret;
    }

    public void setWebhookSecret(String webhookSecret) {
        this.webhookSecret = webhookSecret;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public boolean isRuleRecurringClearComments() {
        return ruleRecurringClearComments;
    }

    public void setRuleRecurringClearComments(boolean ruleRecurringClearComments) {
        this.ruleRecurringClearComments = ruleRecurringClearComments;
    }

    public boolean isRuleRecurringPurgeSubtasks() {
        return ruleRecurringPurgeSubtasks;
    }

    public void setRuleRecurringPurgeSubtasks(boolean ruleRecurringPurgeSubtasks) {
        this.ruleRecurringPurgeSubtasks = ruleRecurringPurgeSubtasks;
    }

    public boolean isRuleReminderNotify() {
        return ruleReminderNotify;
    }

    public void setRuleReminderNotify(boolean ruleReminderNotify) {
        this.ruleReminderNotify = ruleReminderNotify;
    }

    public Set<String> getAllowedUserIds() {
        return allowedUserIds;
    }

    public void setAllowedUserIds(Set<String> allowedUserIds) {
        this.allowedUserIds = trimmed(allowedUserIds);
    }

    public Set<String> getAllowedProjectIds() {
        return allowedProjectIds;
    }

    public void setAllowedProjectIds(Set<String> allowedProjectIds) {
        this.allowedProjectIds = trimmed(allowedProjectIds);
    }

    public Set<String> getDeniedProjectIds() {
        return deniedProjectIds;
    }

    public void setDeniedProjectIds(Set<String> deniedProjectIds) {
        this.deniedProjectIds = trimmed(deniedProjectIds);
    }

    public List<String> getKeepMarkers() {
        return keepMarkers;
    }

    public void setKeepMarkers(List<String> keepMarkers) {
        this.keepMarkers = keepMarkers == null ? List.of() : keepMarkers.stream()
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    public int getMaxDeleteComments() {
        return maxDeleteComments;
    }

    public void setMaxDeleteComments(int maxDeleteComments) {
        this.maxDeleteComments = maxDeleteComments;
    }

    public int getMaxDeleteSubtasks() {
        return maxDeleteSubtasks;
    }

    public void setMaxDeleteSubtasks(int maxDeleteSubtasks) {
        this.maxDeleteSubtasks = maxDeleteSubtasks;
    }

    public String getReminderWebhookUrl() {
        return reminderWebhookUrl;
    }

    public void setReminderWebhookUrl(String reminderWebhookUrl) {
        this.reminderWebhookUrl = reminderWebhookUrl;
    }

    public String getReminderWebhookToken() {
        return reminderWebhookToken;
    }

    public void setReminderWebhookToken(String reminderWebhookToken) {
        this.reminderWebhookToken = reminderWebhookToken;
    }

    public boolean isReminderRequireFocusLabel() {
        return reminderRequireFocusLabel;
    }

    public void setReminderRequireFocusLabel(boolean reminderRequireFocusLabel) {
        this.reminderRequireFocusLabel = reminderRequireFocusLabel;
    }

    public int getReminderCooldownMinutes() {
        return reminderCooldownMinutes;
    }

    public void setReminderCooldownMinutes(int reminderCooldownMinutes) {
        this.reminderCooldownMinutes = reminderCooldownMinutes;
    }

    public String getReminderTimezone() {
        return reminderTimezone;
    }

    public void setReminderTimezone(String reminderTimezone) {
        this.reminderTimezone = reminderTimezone;
    }

    public int getAllowedHourStart() {
        return allowedHourStart;
    }

    public void setAllowedHourStart(int allowedHourStart) {
        this.allowedHourStart = allowedHourStart;
    }

    public int getAllowedHourEnd() {
        return allowedHourEnd;
    }

    public void setAllowedHourEnd(int allowedHourEnd) {
        this.allowedHourEnd = allowedHourEnd;
    }

    public String getReminderChannel() {
        return reminderChannel;
    }

    public void setReminderChannel(String reminderChannel) {
        this.reminderChannel = reminderChannel;
    }

    public String getReminderTo() {
        return reminderTo;
    }

    public void setReminderTo(String reminderTo) {
        this.reminderTo = reminderTo;
    }

    public String getAdminToken() {
        return adminToken;
    }

    public void setAdminToken(String adminToken) {
        this.adminToken = adminToken;
    }

    public String getInternalToken() {
        return internalToken;
    }

    public void setInternalToken(String internalToken) {
        this.internalToken = internalToken;
    }

    /**
     * Whether the rule with the given name may run.
     * Unknown names are enabled.
     */
    public boolean isRuleEnabled(String ruleName) {
        return switch (ruleName) {
            case "recurring_clear_comments_on_completion" -> ruleRecurringClearComments;
            case "recurring_purge_subtasks_on_completion" -> ruleRecurringPurgeSubtasks;
            case "reminder_notify" -> ruleReminderNotify;
            default -> true;
        };
    }

    private static Set<String> trimmed(Set<String> values) {
        var out = new LinkedHashSet<String>();
        if (values != null) {
            for (String v : values) {
                if (v != null && !v.isBlank()) {
                    out.add(v.trim());
                }
            }
        }
        return out;
    }
}
