package com.ocpbot.commands;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link HelpFormatter}.
 */
class HelpFormatterTest {

    private CommandRegistry registry;
    private HelpFormatter formatter;

    @BeforeEach
    void setUp() {
        registry = new CommandRegistry();
        formatter = new HelpFormatter(registry);
    }

    private static List<String> flavors(int count) {
        return IntStream.rangeClosed(1, count).mapToObj(i -> "f" + i).collect(Collectors.toList());
    }

    // =========================================================================
    // Not found / summary
    // =========================================================================

    @Test
    void unknownCommand_returnsNotFoundMessage() {
        assertEquals("Command 'nonexistent' not found.", formatter.formatCommandHelp("nonexistent", true));
        assertEquals("Command 'nonexistent' not found.", formatter.formatCommandHelp("nonexistent", false));
    }

    @Test
    void summary_isOneLine() {
        registry.declare(CommandMetadata.builder("hello").description("Greet the bot").build(), ctx -> {
        });

        assertEquals("`hello` - Greet the bot", formatter.formatCommandHelp("hello", false));
    }

    // =========================================================================
    // Detailed
    // =========================================================================

    @Test
    void detailed_rendersAllSectionsInOrder() {
        registry.declare(CommandMetadata.builder("list-aws-vms")
                .description("List AWS EC2 instances")
                .argument(ArgumentSpec.builder().name("state").description("Instance state filter")
                        .choices(DynamicValue.of(List.of("pending", "running")))
                        .defaultValue(DynamicValue.of("running")).build())
                .argument(ArgumentSpec.builder().name("type").required(true).description("Instance type").build())
                .example("list-aws-vms --state=running")
                .alias("aws-vms")
                .build(), ctx -> {
                });

        String expected = String.join("\n",
                "*list-aws-vms*",
                "_List AWS EC2 instances_",
                "",
                "*Usage:* `list-aws-vms [--state=<state>] --type=<type>`",
                "",
                "*Arguments:*",
                "  `--state` - Instance state filter (Options: pending, running) (Default: running)",
                "  `--type` *(required)* - Instance type",
                "",
                "*Examples:*",
                "  `list-aws-vms --state=running`",
                "",
                "*Aliases:* aws-vms");
        assertEquals(expected, formatter.formatCommandHelp("list-aws-vms", true));
    }

    @Test
    void detailed_emptySectionsAreOmitted() {
        registry.declare(CommandMetadata.builder("hello").description("Greet the bot").build(), ctx -> {
        });

        assertEquals("*hello*\n_Greet the bot_", formatter.formatCommandHelp("hello", true));
    }

    @Test
    void detailed_viaAlias_usesSameMetadata() {
        registry.declare(CommandMetadata.builder("list-team-links").description("Team links")
                .alias("links").build(), ctx -> {
                });

        String viaAlias = formatter.formatCommandHelp("links", true);
        assertTrue(viaAlias.startsWith("*links*\n_Team links_"));
        assertTrue(viaAlias.endsWith("*Aliases:* links"));
    }

    @Test
    void failingChoicesProducer_degradesOnlyThatArgument() {
        registry.declare(CommandMetadata.builder("create-openstack-vm")
                .description("Create an OpenStack VM")
                .argument(ArgumentSpec.builder().name("name").required(true).description("VM name").build())
                .argument(ArgumentSpec.builder().name("os_name").description("Operating system")
                        .choices(DynamicValue.from(() -> {
                            throw new IllegalStateException("OS_IMAGE_MAP missing");
                        })).build())
                .argument(ArgumentSpec.builder().name("flavor").description("Flavor")
                        .choices(DynamicValue.of(List.of("m1.small", "m1.large"))).build())
                .build(), ctx -> {
                });

        String help = assertDoesNotThrow(() -> formatter.formatCommandHelp("create-openstack-vm", true));

        assertTrue(help.contains("*create-openstack-vm*"));
        assertTrue(help.contains("_Create an OpenStack VM_"));
        assertTrue(help.contains("  `--name` *(required)* - VM name"));
        assertTrue(help.contains("  `--os_name` - Operating system (Options: <error getting value>)"));
        assertTrue(help.contains("  `--flavor` - Flavor (Options: m1.small, m1.large)"));
    }

    @Test
    void failingDefaultProducer_rendersSentinel() {
        registry.declare(CommandMetadata.builder("list-openstack-vms")
                .argument(ArgumentSpec.builder().name("status").description("VM status")
                        .defaultValue(DynamicValue.from(() -> {
                            throw new RuntimeException("boom");
                        })).build())
                .build(), ctx -> {
                });

        assertTrue(formatter.formatCommandHelp("list-openstack-vms", true)
                .contains("  `--status` - VM status (Default: <error getting value>)"));
    }

    // =========================================================================
    // Choice truncation
    // =========================================================================

    @Test
    void twelveChoices_showFirstTenAndEllipsis() {
        registry.declare(CommandMetadata.builder("create-openstack-vm")
                .argument(ArgumentSpec.builder().name("flavor").description("Flavor")
                        .choices(DynamicValue.of(flavors(12))).build())
                .build(), ctx -> {
                });

        String help = formatter.formatCommandHelp("create-openstack-vm", true);

        assertTrue(help.contains("(Options: f1, f2, f3, f4, f5, f6, f7, f8, f9, f10, ...)"));
        assertFalse(help.contains("f11"));
    }

    @Test
    void exactlyTenChoices_showAllWithoutEllipsis() {
        registry.declare(CommandMetadata.builder("create-openstack-vm")
                .argument(ArgumentSpec.builder().name("flavor").description("Flavor")
                        .choices(DynamicValue.from(() -> flavors(10))).build())
                .build(), ctx -> {
                });

        String help = formatter.formatCommandHelp("create-openstack-vm", true);

        assertTrue(help.contains("(Options: f1, f2, f3, f4, f5, f6, f7, f8, f9, f10)"));
        assertFalse(help.contains("..."));
    }

    @Test
    void emptyChoices_areNotRendered() {
        registry.declare(CommandMetadata.builder("create-aws-vm")
                .argument(ArgumentSpec.builder().name("os_name").description("OS")
                        .choices(DynamicValue.of(List.of())).build())
                .build(), ctx -> {
                });

        assertFalse(formatter.formatCommandHelp("create-aws-vm", true).contains("Options"));
    }
}
