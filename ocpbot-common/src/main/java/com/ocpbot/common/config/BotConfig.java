package com.ocpbot.common.config;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration type for the bot.
 * Loaded from JSON by {@link ConfigService}; environment variables fill in
 * whatever the file leaves unset.
 */
@Data
public class BotConfig {

    /** Slack credentials and access settings. */
    private SlackConfig slack;

    /** AWS settings consumed by the cloud commands. */
    private AwsConfig aws;

    /** OpenStack settings consumed by the cloud commands. */
    private OpenStackConfig openstack;

    /** Command dispatch settings. */
    private CommandsConfig commands;

    /** Logging settings. */
    private LoggingConfig logging;

    /** Links listed by {@code list-team-links}. */
    private List<TeamLink> teamLinks;

    // --- Nested config types ---

    @Data
    public static class SlackConfig {
        private String botToken;
        private String appToken;
        /** Display name → Slack user id. */
        private Map<String, String> allowedUsers;
        /** When false, only users in {@link #allowedUsers} may run commands. */
        private Boolean allowAllWorkspaceUsers;
        /** Contact shown to users who are not on the allow-list. */
        private String adminContact;
    }

    @Data
    public static class AwsConfig {
        private String defaultRegion;
    }

    @Data
    public static class OpenStackConfig {
        /** OS name → image id. */
        private Map<String, String> osImageMap = new LinkedHashMap<>();
        private String defaultNetwork;
        private String defaultFlavor;
    }

    @Data
    public static class CommandsConfig {
        /** "registry" (default) or "pattern". */
        private String matchMode;
        /** Lower-case the command word before registry lookup. */
        private Boolean caseInsensitive;
        private Integer handlerTimeoutSeconds;
        private Integer workerThreads;
    }

    @Data
    public static class LoggingConfig {
        private String level;
        /** "tools" (default) or "off". */
        private String redactSensitive;
    }

    @Data
    public static class TeamLink {
        private String name;
        private String url;
        private String description;
    }
}
