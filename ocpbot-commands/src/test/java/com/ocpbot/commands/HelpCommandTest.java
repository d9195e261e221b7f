package com.ocpbot.commands;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HelpCommandTest {

    private static final CommandHandler NOOP = ctx -> {
    };

    private CommandRegistry registry;
    private HelpCommand help;
    private RecordingOutput output;

    @BeforeEach
    void setUp() {
        registry = new CommandRegistry();
        registry.declare(CommandMetadata.builder("list-aws-vms").description("List AWS EC2 instances")
                .alias("aws-vms").build(), NOOP);
        registry.declare(CommandMetadata.builder("list-openstack-vms").description("List OpenStack VMs").build(),
                NOOP);
        registry.declare(CommandMetadata.builder("hello").description("Greet the bot").build(), NOOP);
        HelpFormatter formatter = new HelpFormatter(registry);
        help = new HelpCommand(registry, formatter, new GeneralHelpCache(registry));
        output = new RecordingOutput();
    }

    // =========================================================================
    // Request detection
    // =========================================================================

    @Test
    void isHelpRequest_recognisesLeadingHelpAndTrailingFlags() {
        assertTrue(HelpCommand.isHelpRequest("help list-aws-vms"));
        assertTrue(HelpCommand.isHelpRequest("list-aws-vms --help"));
        assertTrue(HelpCommand.isHelpRequest("list-aws-vms -h"));
        assertTrue(HelpCommand.isHelpRequest("list-aws-vms help"));
        assertFalse(HelpCommand.isHelpRequest("help"));
        assertFalse(HelpCommand.isHelpRequest("list-aws-vms --state=running"));
        assertFalse(HelpCommand.isHelpRequest("helpful"));
        assertFalse(HelpCommand.isHelpRequest(null));
    }

    @Test
    void stripHelpTokens_leavesTarget() {
        assertEquals("list-aws-vms", HelpCommand.stripHelpTokens("help list-aws-vms"));
        assertEquals("list-aws-vms", HelpCommand.stripHelpTokens("list-aws-vms --help"));
        assertEquals("list-aws-vms", HelpCommand.stripHelpTokens("help list-aws-vms -h"));
        assertEquals("hello", HelpCommand.stripHelpTokens("hello"));
    }

    // =========================================================================
    // Replies
    // =========================================================================

    @Test
    void noTarget_sendsGeneralListing() {
        help.handle(output, "U1", null);

        String reply = output.last();
        assertTrue(reply.startsWith("Hello <@U1>! Here's what I can help you with:\n\n*Available Commands:*"));
        assertTrue(reply.contains("`list-aws-vms` - List AWS EC2 instances"));
    }

    @Test
    void knownTarget_sendsDetailedHelp() {
        help.handle(output, "U1", "aws-vms");

        assertEquals("Hello <@U1>! Here's help for `aws-vms`:\n\n*aws-vms*\n_List AWS EC2 instances_\n\n"
                + "*Aliases:* aws-vms", output.last());
    }

    @Test
    void unknownTarget_withSuggestions() {
        help.handle(output, null, "list");

        assertEquals("Hello! Command `list` not found. Did you mean: list-aws-vms, list-openstack-vms?",
                output.last());
    }

    @Test
    void unknownTarget_withoutSuggestions() {
        help.handle(output, "U1", "qqqqqqqq");

        assertEquals("Hello <@U1>! Command `qqqqqqqq` not found. Use `help` to see all available commands.",
                output.last());
    }

    @Test
    void failureWhileBuildingHelp_isReportedToUser() {
        CommandRegistry broken = new CommandRegistry();
        HelpCommand failing = new HelpCommand(broken, new HelpFormatter(broken), new GeneralHelpCache(broken) {
            @Override
            public String get() {
                throw new IllegalStateException("cache unavailable");
            }
        });

        failing.handle(output, "U1", null);

        assertEquals(1, output.messages.size());
        assertEquals("Sorry <@U1>, I encountered an error while generating help information.", output.last());
    }
}
