package com.ocpbot.common.config;

import java.nio.file.Path;
import java.util.Map;

/**
 * Configuration paths: state directory and config file.
 */
public final class ConfigPaths {

    private ConfigPaths() {
    }

    // =========================================================================
    // Directory / file name constants
    // =========================================================================

    private static final String STATE_DIRNAME = ".ocpbot";
    private static final String CONFIG_FILENAME = "config.json";

    // =========================================================================
    // State directory
    // =========================================================================

    /**
     * State directory for the bot's config and {@code .env} fallback.
     * Can be overridden via OCPBOT_STATE_DIR.
     * Default: ~/.ocpbot
     */
    public static Path resolveStateDir() {
        return resolveStateDir(System.getenv(), homeDir());
    }

    public static Path resolveStateDir(Map<String, String> env, String homedir) {
        String override = envTrimmed(env, "OCPBOT_STATE_DIR");
        if (override != null) {
            return resolveUserPath(override);
        }
        return Path.of(homedir, STATE_DIRNAME);
    }

    // =========================================================================
    // Config file path
    // =========================================================================

    /**
     * Active config path. OCPBOT_CONFIG_PATH wins over the state directory.
     */
    public static Path resolveConfigPath() {
        Map<String, String> env = System.getenv();
        return resolveConfigPath(env, resolveStateDir(env, homeDir()));
    }

    public static Path resolveConfigPath(Map<String, String> env, Path stateDir) {
        String override = envTrimmed(env, "OCPBOT_CONFIG_PATH");
        if (override != null) {
            return resolveUserPath(override);
        }
        return stateDir.resolve(CONFIG_FILENAME);
    }

    /**
     * Expand a leading {@code ~} and normalize.
     */
    public static Path resolveUserPath(String input) {
        if (input == null)
            return Path.of("");
        String trimmed = input.trim();
        if (trimmed.isEmpty())
            return Path.of("");
        if (trimmed.startsWith("~")) {
            String expanded = homeDir() + trimmed.substring(1);
            return Path.of(expanded).toAbsolutePath().normalize();
        }
        return Path.of(trimmed).toAbsolutePath().normalize();
    }

    private static String homeDir() {
        return System.getProperty("user.home");
    }

    private static String envTrimmed(Map<String, String> env, String key) {
        String val = env.get(key);
        return val != null && !val.trim().isEmpty() ? val.trim() : null;
    }
}
