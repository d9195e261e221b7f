package com.ocpbot.common.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the bot configuration.
 * <p>
 * The JSON file is optional. Values it leaves unset are taken from the
 * environment ({@code SLACK_BOT_TOKEN}, {@code AWS_DEFAULT_REGION},
 * {@code ALLOWED_SLACK_USERS}, ...) and finally from built-in defaults.
 */
@Slf4j
public class ConfigService {

    public static final String DEFAULT_REGION = "us-east-1";
    public static final String DEFAULT_MATCH_MODE = "registry";
    public static final int DEFAULT_HANDLER_TIMEOUT_SECONDS = 120;
    public static final int DEFAULT_WORKER_THREADS = 4;
    public static final String DEFAULT_ADMIN_CONTACT = "ocp-sustaining-admin@redhat.com";

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(5);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, BotConfig> cache;
    private final Path configPath;
    private final Map<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, System.getenv(), DEFAULT_CACHE_TTL);
    }

    public ConfigService(Path configPath, Map<String, String> env) {
        this(configPath, env, DEFAULT_CACHE_TTL);
    }

    public ConfigService(Path configPath, Map<String, String> env, Duration cacheTtl) {
        this.configPath = configPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     *
     * @throws IllegalStateException if the allow-list in the environment is not
     *                               valid JSON
     */
    public BotConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public BotConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    /**
     * Get the config file path.
     */
    public Path getConfigPath() {
        return configPath;
    }

    private BotConfig doLoadConfig() {
        BotConfig config;
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using environment and defaults", configPath);
            config = new BotConfig();
        } else {
            try {
                String raw = Files.readString(configPath);
                raw = substituteEnvVars(raw);
                config = objectMapper.readValue(raw, BotConfig.class);
                log.info("Config loaded from: {}", configPath);
            } catch (IOException e) {
                log.error("Failed to load config from: {}", configPath, e);
                config = new BotConfig();
            }
        }
        applyEnvironment(config);
        return applyDefaults(config);
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Fill unset fields from environment variables.
     */
    void applyEnvironment(BotConfig config) {
        if (config.getSlack() == null) {
            config.setSlack(new BotConfig.SlackConfig());
        }
        if (config.getAws() == null) {
            config.setAws(new BotConfig.AwsConfig());
        }
        if (config.getLogging() == null) {
            config.setLogging(new BotConfig.LoggingConfig());
        }

        BotConfig.SlackConfig slack = config.getSlack();
        if (slack.getBotToken() == null) {
            slack.setBotToken(envTrimmed("SLACK_BOT_TOKEN"));
        }
        if (slack.getAppToken() == null) {
            slack.setAppToken(envTrimmed("SLACK_APP_TOKEN"));
        }
        if (slack.getAllowAllWorkspaceUsers() == null && envTrimmed("ALLOW_ALL_WORKSPACE_USERS") != null) {
            slack.setAllowAllWorkspaceUsers(Boolean.parseBoolean(envTrimmed("ALLOW_ALL_WORKSPACE_USERS")));
        }
        if (slack.getAllowedUsers() == null && envTrimmed("ALLOWED_SLACK_USERS") != null) {
            slack.setAllowedUsers(parseAllowedUsers(envTrimmed("ALLOWED_SLACK_USERS")));
        }
        if (config.getAws().getDefaultRegion() == null) {
            config.getAws().setDefaultRegion(envTrimmed("AWS_DEFAULT_REGION"));
        }
        if (config.getLogging().getLevel() == null) {
            config.getLogging().setLevel(envTrimmed("LOG_LEVEL"));
        }
    }

    /**
     * Parse the {@code ALLOWED_SLACK_USERS} JSON object (name → user id).
     *
     * @throws IllegalStateException if the value is not a JSON object of strings
     */
    Map<String, String> parseAllowedUsers(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, String>>() {
            });
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("ALLOWED_SLACK_USERS must be a valid JSON string.", e);
        }
    }

    /**
     * Apply default values to missing config fields.
     */
    BotConfig applyDefaults(BotConfig config) {
        BotConfig.SlackConfig slack = config.getSlack();
        if (slack.getAllowedUsers() == null) {
            slack.setAllowedUsers(new LinkedHashMap<>());
        }
        if (slack.getAllowAllWorkspaceUsers() == null) {
            slack.setAllowAllWorkspaceUsers(false);
        }
        if (slack.getAdminContact() == null) {
            slack.setAdminContact(DEFAULT_ADMIN_CONTACT);
        }
        if (config.getAws().getDefaultRegion() == null) {
            config.getAws().setDefaultRegion(DEFAULT_REGION);
        }
        if (config.getOpenstack() == null) {
            config.setOpenstack(new BotConfig.OpenStackConfig());
        }
        if (config.getCommands() == null) {
            config.setCommands(new BotConfig.CommandsConfig());
        }
        BotConfig.CommandsConfig commands = config.getCommands();
        if (commands.getMatchMode() == null) {
            commands.setMatchMode(DEFAULT_MATCH_MODE);
        }
        if (commands.getCaseInsensitive() == null) {
            commands.setCaseInsensitive(true);
        }
        if (commands.getHandlerTimeoutSeconds() == null || commands.getHandlerTimeoutSeconds() <= 0) {
            commands.setHandlerTimeoutSeconds(DEFAULT_HANDLER_TIMEOUT_SECONDS);
        }
        if (commands.getWorkerThreads() == null || commands.getWorkerThreads() <= 0) {
            commands.setWorkerThreads(DEFAULT_WORKER_THREADS);
        }
        if (config.getLogging().getLevel() == null) {
            config.getLogging().setLevel("INFO");
        }
        if (config.getTeamLinks() == null) {
            config.setTeamLinks(new ArrayList<>());
        }
        return config;
    }

    private String envTrimmed(String key) {
        String val = env.get(key);
        return val != null && !val.trim().isEmpty() ? val.trim() : null;
    }
}
