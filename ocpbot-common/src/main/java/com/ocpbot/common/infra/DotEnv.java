package com.ocpbot.common.infra;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads environment variables from .env files: working directory first, then
 * the state directory fallback (~/.ocpbot/.env).
 * Values already present in the target are NOT overridden by the fallback.
 */
public final class DotEnv {

    private DotEnv() {
    }

    private static final Logger log = LoggerFactory.getLogger(DotEnv.class);

    /**
     * Load .env files into {@code target}.
     *
     * @param workDir  directory holding the primary .env (usually user.dir)
     * @param stateDir the bot state directory, may be null
     * @param target   mutable map to populate; callers keep their own overlay
     *                 since {@code System.getenv()} is read-only
     * @return number of variables applied
     */
    public static int loadDotEnv(Path workDir, Path stateDir, Map<String, String> target) {
        int applied = 0;
        if (workDir != null) {
            applied += loadFile(workDir.resolve(".env"), target, true);
        }
        if (stateDir != null) {
            applied += loadFile(stateDir.resolve(".env"), target, false);
        }
        return applied;
    }

    /**
     * Parse a .env file and populate the target map.
     *
     * @param override whether to override existing non-blank values
     * @return number of variables applied
     */
    static int loadFile(Path path, Map<String, String> target, boolean override) {
        if (!Files.exists(path)) {
            return 0;
        }
        Map<String, String> parsed = parseEnvFile(path);
        int applied = 0;
        for (Map.Entry<String, String> entry : parsed.entrySet()) {
            String existing = target.get(entry.getKey());
            if (!override && existing != null && !existing.isBlank()) {
                continue;
            }
            target.put(entry.getKey(), entry.getValue());
            applied++;
        }
        if (applied > 0) {
            log.debug("dotenv: loaded {} vars from {}", applied, path);
        }
        return applied;
    }

    /**
     * Parse a .env file into key-value pairs.
     * Supports: KEY=value, KEY="quoted value", KEY='quoted value', export
     * KEY=value.
     * Lines starting with # are comments.
     */
    public static Map<String, String> parseEnvFile(Path path) {
        Map<String, String> result = new LinkedHashMap<>();
        if (!Files.exists(path)) {
            return result;
        }
        try (BufferedReader reader = Files.newBufferedReader(path)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                if (trimmed.startsWith("export ")) {
                    trimmed = trimmed.substring(7).trim();
                }
                int eq = trimmed.indexOf('=');
                if (eq <= 0) {
                    continue;
                }
                String key = trimmed.substring(0, eq).trim();
                String value = trimmed.substring(eq + 1).trim();
                if (value.length() >= 2) {
                    if ((value.startsWith("\"") && value.endsWith("\""))
                            || (value.startsWith("'") && value.endsWith("'"))) {
                        value = value.substring(1, value.length() - 1);
                    }
                }
                if (!key.isEmpty()) {
                    result.put(key, value);
                }
            }
        } catch (IOException e) {
            log.warn("dotenv: failed to read {}: {}", path, e.getMessage());
        }
        return result;
    }
}
