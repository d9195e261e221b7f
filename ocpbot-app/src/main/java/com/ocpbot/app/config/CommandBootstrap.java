package com.ocpbot.app.config;

import com.ocpbot.channel.UserAllowlist;
import com.ocpbot.commands.CommandRegistry;
import com.ocpbot.commands.GeneralHelpCache;
import com.ocpbot.common.config.BotConfig;
import com.ocpbot.common.config.ConfigService;
import com.ocpbot.common.logging.LogRedact;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Startup reporting and help-cache warm-up.
 * <p>
 * The general help listing is built once the context is ready, after every
 * command has been declared.
 */
@Slf4j
@Component
public class CommandBootstrap {

    private final ConfigService configService;
    private final BotConfig botConfig;
    private final CommandRegistry registry;
    private final GeneralHelpCache generalHelp;
    private final UserAllowlist allowlist;

    public CommandBootstrap(ConfigService configService, BotConfig botConfig, CommandRegistry registry,
            GeneralHelpCache generalHelp, UserAllowlist allowlist) {
        this.configService = configService;
        this.botConfig = botConfig;
        this.registry = registry;
        this.generalHelp = generalHelp;
        this.allowlist = allowlist;
    }

    @PostConstruct
    public void init() {
        BotConfig.SlackConfig slack = botConfig.getSlack();
        if (slack.getBotToken() == null) {
            log.warn("SLACK_BOT_TOKEN is not set; the Slack transport will not be able to connect");
        }
        log.info("Config: path={} botToken={} appToken={} region={} matchMode={} timeout={}s",
                configService.getConfigPath(),
                LogRedact.maskToken(slack.getBotToken()),
                LogRedact.maskToken(slack.getAppToken()),
                botConfig.getAws().getDefaultRegion(),
                botConfig.getCommands().getMatchMode(),
                botConfig.getCommands().getHandlerTimeoutSeconds());
        if (allowlist.isAllowAll()) {
            log.info("Access: all workspace users");
        } else {
            log.info("Access: {} allow-listed user(s)", allowlist.users().size());
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        generalHelp.get();
        log.info("Bot ready: {} command(s), {} dispatch key(s)",
                registry.uniqueCommands().size(), registry.size());
    }
}
