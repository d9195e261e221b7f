package com.ocpbot.app.config;

import com.ocpbot.app.cloud.AwsVmService;
import com.ocpbot.app.cloud.OpenStackVmService;
import com.ocpbot.app.commands.BuiltinCommands;
import com.ocpbot.channel.UserAllowlist;
import com.ocpbot.channel.normalize.SlackNormalize;
import com.ocpbot.channel.slack.SlackEventRouter;
import com.ocpbot.commands.CommandDispatcher;
import com.ocpbot.commands.CommandRegistry;
import com.ocpbot.commands.GeneralHelpCache;
import com.ocpbot.commands.HandlerInvoker;
import com.ocpbot.commands.HelpCommand;
import com.ocpbot.commands.HelpFormatter;
import com.ocpbot.commands.MessageDispatcher;
import com.ocpbot.commands.PatternCommandRouter;
import com.ocpbot.common.config.BotConfig;
import com.ocpbot.common.config.ConfigPaths;
import com.ocpbot.common.config.ConfigService;
import com.ocpbot.common.infra.DotEnv;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Spring configuration for the bot beans.
 */
@Slf4j
@Configuration
public class BotBeanConfig {

    static final String MATCH_MODE_PATTERN = "pattern";

    @Value("${ocpbot.config.path:~/.ocpbot/config.json}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        Map<String, String> env = new HashMap<>(System.getenv());
        int loaded = DotEnv.loadDotEnv(Path.of(System.getProperty("user.dir")), ConfigPaths.resolveStateDir(), env);
        log.debug("DotEnv loaded ({} env vars from .env files)", loaded);
        return new ConfigService(ConfigPaths.resolveUserPath(configPath), env);
    }

    /**
     * Loaded eagerly so a malformed allow-list aborts startup.
     */
    @Bean
    public BotConfig botConfig(ConfigService configService) {
        return configService.loadConfig();
    }

    @Bean
    public BuiltinCommands builtinCommands(ConfigService configService, Optional<AwsVmService> aws,
            Optional<OpenStackVmService> openStack) {
        return new BuiltinCommands(configService, aws, openStack);
    }

    /**
     * Registry with every built-in declared, so nothing that reads it sees a
     * partial catalog.
     */
    @Bean
    public CommandRegistry commandRegistry(BuiltinCommands builtinCommands) {
        CommandRegistry registry = new CommandRegistry();
        builtinCommands.registerAll(registry);
        return registry;
    }

    @Bean
    public HelpFormatter helpFormatter(CommandRegistry registry) {
        return new HelpFormatter(registry);
    }

    @Bean
    public GeneralHelpCache generalHelpCache(CommandRegistry registry) {
        return new GeneralHelpCache(registry);
    }

    @Bean
    public HelpCommand helpCommand(CommandRegistry registry, HelpFormatter formatter, GeneralHelpCache generalHelp) {
        return new HelpCommand(registry, formatter, generalHelp);
    }

    @Bean(destroyMethod = "close")
    public HandlerInvoker handlerInvoker(BotConfig botConfig) {
        return new HandlerInvoker(Duration.ofSeconds(botConfig.getCommands().getHandlerTimeoutSeconds()));
    }

    @Bean
    public MessageDispatcher messageDispatcher(BotConfig botConfig, ConfigService configService,
            CommandRegistry registry, HelpCommand helpCommand, HandlerInvoker invoker) {
        Supplier<String> region = () -> configService.loadConfig().getAws().getDefaultRegion();
        BotConfig.CommandsConfig commands = botConfig.getCommands();
        if (MATCH_MODE_PATTERN.equalsIgnoreCase(commands.getMatchMode())) {
            log.info("Using pattern dispatch");
            return patternRouter(registry, helpCommand, invoker, region);
        }
        return new CommandDispatcher(registry, helpCommand, invoker, region, SlackNormalize::isMentionToken,
                Boolean.TRUE.equals(commands.getCaseInsensitive()));
    }

    /**
     * One prefix route per dispatch key, longest key first, behind a
     * {@code help} route.
     */
    static PatternCommandRouter patternRouter(CommandRegistry registry, HelpCommand helpCommand,
            HandlerInvoker invoker, Supplier<String> region) {
        PatternCommandRouter router = new PatternCommandRouter(invoker, region, SlackNormalize::isMentionToken);
        router.route(CommandRegistry.HELP_COMMAND, PatternCommandRouter.MatchKind.PREFIX, CommandRegistry.HELP_COMMAND,
                ctx -> {
                    List<String> rest = ctx.parameters().positional();
                    helpCommand.handle(ctx.output(), ctx.userId(), rest.isEmpty() ? null : String.join(" ", rest));
                });
        registry.allKeys().stream()
                .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
                .forEach(key -> registry.handler(key).ifPresent(
                        handler -> router.route(key, PatternCommandRouter.MatchKind.PREFIX, key, handler)));
        return router;
    }

    @Bean
    public UserAllowlist userAllowlist(BotConfig botConfig) {
        return UserAllowlist.fromConfig(botConfig.getSlack());
    }

    @Bean(destroyMethod = "close")
    public SlackEventRouter slackEventRouter(MessageDispatcher dispatcher, UserAllowlist allowlist,
            BotConfig botConfig) {
        return new SlackEventRouter(dispatcher, allowlist, botConfig.getSlack().getAdminContact(),
                botConfig.getCommands().getWorkerThreads());
    }
}
