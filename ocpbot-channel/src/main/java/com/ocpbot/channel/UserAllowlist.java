package com.ocpbot.channel;

import com.ocpbot.channel.normalize.SlackNormalize;
import com.ocpbot.common.config.BotConfig;
import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Slack user allow-list.
 * <p>
 * When the workspace is open ({@code allowAllWorkspaceUsers=true}) every user
 * passes. Otherwise a user passes only if their id is one of the configured
 * values; an empty list then denies everyone.
 */
@Slf4j
public class UserAllowlist {

    public static final String SOURCE_WILDCARD = "wildcard";
    public static final String SOURCE_ID = "id";

    /** Result of an allow-list check. */
    public record Match(boolean allowed, @Nullable String matchKey, @Nullable String matchSource) {

        static Match denied() {
            return new Match(false, null, null);
        }
    }

    private final Map<String, String> users;
    private final boolean allowAll;

    /**
     * @param users    display name → Slack user id
     * @param allowAll true to let every workspace user through
     */
    public UserAllowlist(Map<String, String> users, boolean allowAll) {
        this.users = users == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(users));
        this.allowAll = allowAll;
        this.users.forEach((name, id) -> {
            if (!SlackNormalize.looksLikeUserId(id)) {
                log.warn("Allow-list entry {} has an unusual Slack user id: {}", name, id);
            }
        });
        if (!allowAll && this.users.isEmpty()) {
            log.warn("Allow-list is empty and workspace access is restricted; every user will be denied");
        }
    }

    public static UserAllowlist fromConfig(BotConfig.SlackConfig slack) {
        if (slack == null) {
            return new UserAllowlist(Map.of(), false);
        }
        return new UserAllowlist(slack.getAllowedUsers(), Boolean.TRUE.equals(slack.getAllowAllWorkspaceUsers()));
    }

    public boolean isAllowed(@Nullable String userId) {
        return resolve(userId).allowed();
    }

    /**
     * Check a user and report which entry matched.
     */
    public Match resolve(@Nullable String userId) {
        if (allowAll) {
            return new Match(true, "*", SOURCE_WILDCARD);
        }
        if (userId == null || userId.isBlank()) {
            return Match.denied();
        }
        for (Map.Entry<String, String> entry : users.entrySet()) {
            if (userId.equals(entry.getValue())) {
                return new Match(true, entry.getKey(), SOURCE_ID);
            }
        }
        return Match.denied();
    }

    public boolean isAllowAll() {
        return allowAll;
    }

    public Map<String, String> users() {
        return users;
    }

    /**
     * Format match metadata for logging.
     */
    public static String formatMatchMeta(@Nullable String matchKey, @Nullable String matchSource) {
        return "matchKey=" + (matchKey != null ? matchKey : "none")
                + " matchSource=" + (matchSource != null ? matchSource : "none");
    }
}
