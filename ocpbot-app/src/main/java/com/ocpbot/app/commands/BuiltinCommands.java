package com.ocpbot.app.commands;

import com.ocpbot.app.cloud.AwsVmService;
import com.ocpbot.app.cloud.OpenStackVmService;
import com.ocpbot.app.cloud.VmInstance;
import com.ocpbot.commands.ArgumentSpec;
import com.ocpbot.commands.CommandContext;
import com.ocpbot.commands.CommandMetadata;
import com.ocpbot.commands.CommandParameters;
import com.ocpbot.commands.CommandRegistry;
import com.ocpbot.commands.DynamicValue;
import com.ocpbot.common.config.BotConfig;
import com.ocpbot.common.config.ConfigService;
import com.ocpbot.common.logging.LogRedact;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The bot's command catalog.
 * <p>
 * Cloud work is delegated to {@link AwsVmService} and
 * {@link OpenStackVmService}; when no implementation is wired the commands
 * say so instead of failing. Every handler reports its own errors.
 */
@Slf4j
public class BuiltinCommands {

    public static final String NOT_CONFIGURED = " is not configured for this bot. Contact the bot administrator.";

    private final ConfigService configService;
    private final CommandChoices choices;
    private final Optional<AwsVmService> aws;
    private final Optional<OpenStackVmService> openStack;

    public BuiltinCommands(ConfigService configService, Optional<AwsVmService> aws,
            Optional<OpenStackVmService> openStack) {
        this.configService = configService;
        this.choices = new CommandChoices(configService);
        this.aws = aws;
        this.openStack = openStack;
    }

    /**
     * Declare every built-in command on the registry.
     */
    public void registerAll(CommandRegistry registry) {
        registry.declare(CommandMetadata.builder("hello")
                .description("Greet the bot")
                .example("hello")
                .build(), this::hello);

        registry.declare(CommandMetadata.builder("list-team-links")
                .description("List useful team links")
                .example("list-team-links")
                .alias("links")
                .build(), this::listTeamLinks);

        registry.declare(CommandMetadata.builder("list-aws-vms")
                .description("List AWS EC2 instances")
                .argument(ArgumentSpec.builder().name("state")
                        .description("Filter by instance state")
                        .choices(DynamicValue.of(CommandChoices.AWS_INSTANCE_STATES))
                        .defaultValue(DynamicValue.of("running")).build())
                .argument(ArgumentSpec.builder().name("type")
                        .description("Filter by instance type")
                        .choices(DynamicValue.of(CommandChoices.AWS_INSTANCE_TYPES)).build())
                .argument(ArgumentSpec.builder().name("region")
                        .description("AWS region")
                        .defaultValue(DynamicValue.from(this::defaultRegion)).build())
                .example("list-aws-vms")
                .example("list-aws-vms --state=stopped --type=t3.micro")
                .alias("aws-vms")
                .build(), this::listAwsVms);

        registry.declare(CommandMetadata.builder("create-aws-vm")
                .description("Create an AWS EC2 instance")
                .argument(ArgumentSpec.builder().name("os_name").required(true)
                        .description("Operating system of the instance").build())
                .argument(ArgumentSpec.builder().name("instance_type")
                        .description("EC2 instance type")
                        .choices(DynamicValue.of(CommandChoices.AWS_INSTANCE_TYPES))
                        .defaultValue(DynamicValue.of("t2.micro")).build())
                .argument(ArgumentSpec.builder().name("key_pair")
                        .description("SSH key pair name").build())
                .example("create-aws-vm --os_name=linux --instance_type=t3.small --key_pair=my-key")
                .build(), this::createAwsVm);

        registry.declare(CommandMetadata.builder("aws-modify-vm")
                .description("Start, stop or delete an AWS EC2 instance")
                .argument(ArgumentSpec.builder().name("vm-id").required(true)
                        .description("EC2 instance id").build())
                .argument(ArgumentSpec.builder().name("stop").description("Stop the instance").build())
                .argument(ArgumentSpec.builder().name("start").description("Start the instance").build())
                .argument(ArgumentSpec.builder().name("delete").description("Terminate the instance").build())
                .example("aws-modify-vm --vm-id=i-0123456789abcdef0 --stop")
                .build(), this::modifyAwsVm);

        registry.declare(CommandMetadata.builder("create-openstack-vm")
                .description("Create an OpenStack VM")
                .argument(ArgumentSpec.builder().name("name").required(true)
                        .description("Name of the VM").build())
                .argument(ArgumentSpec.builder().name("os_name").required(true)
                        .description("Operating system image")
                        .choices(DynamicValue.from(choices::openStackOsNames)).build())
                .argument(ArgumentSpec.builder().name("flavor").required(true)
                        .description("VM flavor")
                        .choices(DynamicValue.of(CommandChoices.OPENSTACK_FLAVORS)).build())
                .argument(ArgumentSpec.builder().name("network")
                        .description("Network to attach")
                        .defaultValue(DynamicValue.from(
                                () -> Optional.ofNullable(defaultNetwork()).orElse("project default"))).build())
                .argument(ArgumentSpec.builder().name("key_name")
                        .description("SSH key pair name").build())
                .example("create-openstack-vm --name=test-vm --os_name=fedora --flavor=m1.small")
                .build(), this::createOpenStackVm);

        registry.declare(CommandMetadata.builder("list-openstack-vms")
                .description("List OpenStack VMs")
                .argument(ArgumentSpec.builder().name("status")
                        .description("Filter by VM status")
                        .choices(DynamicValue.of(CommandChoices.OPENSTACK_STATUSES))
                        .defaultValue(DynamicValue.of("ACTIVE")).build())
                .argument(ArgumentSpec.builder().name("flavor")
                        .description("Filter by flavor")
                        .choices(DynamicValue.of(CommandChoices.OPENSTACK_FLAVORS)).build())
                .argument(ArgumentSpec.builder().name("name")
                        .description("Filter by name substring").build())
                .example("list-openstack-vms")
                .example("list-openstack-vms --status=SHUTOFF --flavor=m1.small")
                .alias("openstack-vms")
                .build(), this::listOpenStackVms);

        log.info("Registered {} built-in commands", registry.uniqueCommands().size());
    }

    // =========================================================================
    // General
    // =========================================================================

    void hello(CommandContext ctx) {
        ctx.say(ctx.greeting() + "How can I assist you today?");
    }

    void listTeamLinks(CommandContext ctx) {
        try {
            List<BotConfig.TeamLink> links = configService.loadConfig().getTeamLinks();
            if (links == null || links.isEmpty()) {
                ctx.say(ctx.greeting() + "No team links are configured.");
                return;
            }
            StringBuilder sb = new StringBuilder(ctx.greeting()).append("Here are the team links:\n");
            for (BotConfig.TeamLink link : links) {
                sb.append("\n• <").append(link.getUrl()).append('|').append(link.getName()).append('>');
                if (link.getDescription() != null && !link.getDescription().isBlank()) {
                    sb.append(" - ").append(link.getDescription());
                }
            }
            ctx.say(sb.toString());
        } catch (RuntimeException e) {
            log.error("Failed to list team links: {}", e.getMessage(), e);
            ctx.say("An error occurred listing the team links : " + errorText(e));
        }
    }

    // =========================================================================
    // AWS
    // =========================================================================

    void listAwsVms(CommandContext ctx) {
        if (aws.isEmpty()) {
            ctx.say(CommandContext.apology(ctx.userId()) + "AWS" + NOT_CONFIGURED);
            return;
        }
        CommandParameters params = ctx.parameters();
        String state = params.getOrDefault("state", "running");
        String type = params.get("type").orElse(null);
        String region = params.getOrDefault("region", ctx.region());
        if (!checkChoice(ctx, "state", state, CommandChoices.AWS_INSTANCE_STATES)
                || (type != null && !checkChoice(ctx, "type", type, CommandChoices.AWS_INSTANCE_TYPES))) {
            return;
        }
        try {
            List<VmInstance> instances = aws.get().listInstances(region, state, type);
            if (instances.isEmpty()) {
                ctx.say("There are currently no " + state + " EC2 instances to retrieve");
                return;
            }
            ctx.say("*AWS EC2 " + state + " instances in " + region + " (" + instances.size() + "):*");
            for (VmInstance instance : instances) {
                ctx.say("\n*** AWS EC2 VM Details ***\n" + instance.describe() + "\n");
            }
        } catch (RuntimeException e) {
            log.error("Failed to list EC2 instances in {}: {}", region, e.getMessage(), e);
            ctx.say("An error occurred listing the EC2 instances : " + errorText(e));
        }
    }

    void createAwsVm(CommandContext ctx) {
        if (aws.isEmpty()) {
            ctx.say(CommandContext.apology(ctx.userId()) + "AWS" + NOT_CONFIGURED);
            return;
        }
        CommandParameters params = ctx.parameters();
        Optional<String> osName = params.get("os_name");
        if (osName.isEmpty()) {
            missingArgument(ctx, "os_name");
            return;
        }
        String instanceType = params.getOrDefault("instance_type", "t2.micro");
        if (!checkChoice(ctx, "instance_type", instanceType, CommandChoices.AWS_INSTANCE_TYPES)) {
            return;
        }
        try {
            VmInstance created = aws.get().createInstance(ctx.region(),
                    new AwsVmService.CreateRequest(osName.get(), instanceType, params.get("key_pair").orElse(null)));
            if (created == null) {
                ctx.say("Unable to create EC2 instance");
                return;
            }
            ctx.say(ctx.greeting() + "Successfully created EC2 instance: "
                    + (created.getName() != null ? created.getName() : "unknown") + " (" + created.getId() + ")");
        } catch (RuntimeException e) {
            log.error("Failed to create EC2 instance: {}", e.getMessage(), e);
            ctx.say("An error occurred creating the EC2 instance : " + errorText(e));
        }
    }

    void modifyAwsVm(CommandContext ctx) {
        if (aws.isEmpty()) {
            ctx.say(CommandContext.apology(ctx.userId()) + "AWS" + NOT_CONFIGURED);
            return;
        }
        CommandParameters params = ctx.parameters();
        Optional<String> vmId = params.get("vm-id");
        if (vmId.isEmpty()) {
            missingArgument(ctx, "vm-id");
            return;
        }
        List<AwsVmService.Action> actions = new ArrayList<>();
        for (AwsVmService.Action action : AwsVmService.Action.values()) {
            if (params.has(action.name().toLowerCase())) {
                actions.add(action);
            }
        }
        if (actions.size() != 1) {
            ctx.say(CommandContext.apology(ctx.userId())
                    + "specify exactly one of `--start`, `--stop` or `--delete`.");
            return;
        }
        AwsVmService.Action action = actions.get(0);
        try {
            VmInstance result = aws.get().modifyInstance(ctx.region(), vmId.get(), action);
            ctx.say(ctx.greeting() + "Requested " + action.name().toLowerCase() + " of EC2 instance `"
                    + vmId.get() + "`. Current state: " + (result != null ? result.getState() : "unknown"));
        } catch (RuntimeException e) {
            log.error("Failed to {} EC2 instance {}: {}", action, vmId.get(), e.getMessage(), e);
            ctx.say("An error occurred modifying the EC2 instance : " + errorText(e));
        }
    }

    // =========================================================================
    // OpenStack
    // =========================================================================

    void createOpenStackVm(CommandContext ctx) {
        if (openStack.isEmpty()) {
            ctx.say(CommandContext.apology(ctx.userId()) + "OpenStack" + NOT_CONFIGURED);
            return;
        }
        CommandParameters params = ctx.parameters();
        for (String required : List.of("name", "os_name", "flavor")) {
            if (!params.has(required)) {
                missingArgument(ctx, required);
                return;
            }
        }
        try {
            Map<String, String> images = choices.osImageMap();
            String osName = params.get("os_name").orElseThrow();
            String imageId = images.get(osName);
            if (imageId == null) {
                invalidChoice(ctx, "os_name", osName, List.copyOf(images.keySet()));
                return;
            }
            String flavor = params.get("flavor").orElseThrow();
            if (!checkChoice(ctx, "flavor", flavor, CommandChoices.OPENSTACK_FLAVORS)) {
                return;
            }
            String network = params.get("network").orElseGet(this::defaultNetwork);
            VmInstance created = openStack.get().createServer(new OpenStackVmService.CreateRequest(
                    params.get("name").orElseThrow(), imageId, flavor, network, params.get("key_name").orElse(null)));
            ctx.say(ctx.greeting() + "Successfully created OpenStack VM: " + created.getName()
                    + " (" + created.getId() + ")");
        } catch (RuntimeException e) {
            log.error("Failed to create OpenStack VM: {}", e.getMessage(), e);
            ctx.say("An error occurred creating the openstack VM : " + errorText(e));
        }
    }

    void listOpenStackVms(CommandContext ctx) {
        if (openStack.isEmpty()) {
            ctx.say(CommandContext.apology(ctx.userId()) + "OpenStack" + NOT_CONFIGURED);
            return;
        }
        CommandParameters params = ctx.parameters();
        String status = params.getOrDefault("status", "ACTIVE").toUpperCase();
        if (!checkChoice(ctx, "status", status, CommandChoices.OPENSTACK_STATUSES)) {
            return;
        }
        try {
            List<VmInstance> servers = openStack.get().listServers(status, params.get("flavor").orElse(null),
                    params.get("name").orElse(null));
            if (servers.isEmpty()) {
                ctx.say(":no_entry_sign: There are currently *no " + status + " VMs* in OpenStack.");
                return;
            }
            ctx.say("*OpenStack " + status + " VMs (" + servers.size() + "):*");
            ctx.say("```" + servers.stream().map(VmInstance::describe).collect(Collectors.joining("\n\n")) + "```");
        } catch (RuntimeException e) {
            log.error("Failed to list OpenStack VMs: {}", e.getMessage(), e);
            ctx.say(":x: An error occurred while fetching the list of VMs.");
        }
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    /**
     * Exception text for a user-visible reply, with credentials masked.
     */
    private String errorText(RuntimeException e) {
        BotConfig.LoggingConfig logging = configService.loadConfig().getLogging();
        LogRedact.RedactMode mode = LogRedact.RedactMode.normalize(logging != null ? logging.getRedactSensitive() : null);
        return LogRedact.redactSensitiveText(String.valueOf(e.getMessage()), mode);
    }

    private String defaultRegion() {
        return configService.loadConfig().getAws().getDefaultRegion();
    }

    private String defaultNetwork() {
        BotConfig.OpenStackConfig openstack = configService.loadConfig().getOpenstack();
        return openstack != null ? openstack.getDefaultNetwork() : null;
    }

    private static boolean checkChoice(CommandContext ctx, String argument, String value, List<String> valid) {
        if (valid.contains(value)) {
            return true;
        }
        invalidChoice(ctx, argument, value, valid);
        return false;
    }

    private static void invalidChoice(CommandContext ctx, String argument, String value, List<String> valid) {
        ctx.say(CommandContext.apology(ctx.userId()) + "`" + value + "` is not a valid `--" + argument
                + "`. Options: " + String.join(", ", valid));
    }

    private static void missingArgument(CommandContext ctx, String argument) {
        ctx.say(CommandContext.apology(ctx.userId()) + "`--" + argument + "` is required. Use `"
                + ctx.command() + " --help` for usage.");
    }
}
