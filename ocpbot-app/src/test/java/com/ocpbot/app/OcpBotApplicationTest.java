package com.ocpbot.app;

import com.ocpbot.channel.slack.EventDisposition;
import com.ocpbot.channel.slack.SlackEventRouter;
import com.ocpbot.commands.CommandDispatcher;
import com.ocpbot.commands.CommandRegistry;
import com.ocpbot.commands.GeneralHelpCache;
import com.ocpbot.commands.MessageDispatcher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the full context against {@code test-config.json} and drives
 * events through the router.
 */
@SpringBootTest(properties = "ocpbot.config.path=src/test/resources/test-config.json")
class OcpBotApplicationTest {

    @Autowired
    private CommandRegistry registry;

    @Autowired
    private MessageDispatcher dispatcher;

    @Autowired
    private GeneralHelpCache generalHelp;

    @Autowired
    private SlackEventRouter router;

    private static Map<String, Object> event(String user, String text, String ts) {
        return Map.of("event", Map.of("type", "app_mention", "user", user, "text", text,
                "channel", "C0TEST", "ts", ts));
    }

    /** Handlers reply from the handler pool; wait for the first reply. */
    private static List<String> awaitReply(List<String> replies) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (replies.isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        return replies;
    }

    @Test
    void contextRegistersBuiltins() {
        assertTrue(registry.contains("hello"));
        assertTrue(registry.contains("list-aws-vms"));
        assertTrue(registry.contains("aws-vms"));
        assertTrue(registry.contains("create-openstack-vm"));
        assertFalse(registry.contains("help"));
        assertInstanceOf(CommandDispatcher.class, dispatcher);
    }

    @Test
    void generalHelpIsWarmAfterStartup() {
        assertTrue(generalHelp.isBuilt());
        assertTrue(generalHelp.get().contains("`list-openstack-vms [status] [flavor] [name]` - List OpenStack VMs"));
    }

    @Test
    void allowListedUser_getsGreeting() throws InterruptedException {
        List<String> replies = new CopyOnWriteArrayList<>();

        EventDisposition disposition = router.onEventSync(event("U0ALICE01", "<@UBOT01> hello", "100.1"),
                replies::add);

        assertEquals(EventDisposition.ACCEPTED, disposition);
        assertEquals(List.of("Hello <@U0ALICE01>! How can I assist you today?"), awaitReply(replies));
    }

    @Test
    void unknownUser_isDenied() {
        List<String> replies = new CopyOnWriteArrayList<>();

        assertEquals(EventDisposition.DENIED, router.onEventSync(event("U0STRANGE", "hello", "100.2"), replies::add));
        assertTrue(replies.get(0).startsWith("Sorry <@U0STRANGE>, you're not authorized to use this bot."));
    }

    @Test
    void commandHelpShowsConfiguredOsNames() {
        List<String> replies = new CopyOnWriteArrayList<>();

        router.onEventSync(event("U0ALICE01", "<@UBOT01> create-openstack-vm --help", "100.3"), replies::add);

        String reply = replies.get(0);
        assertTrue(reply.contains("*Usage:* `create-openstack-vm --name=<name> --os_name=<os_name> --flavor=<flavor>"
                + " [--network=<network>] [--key_name=<key_name>]`"));
        assertTrue(reply.contains("(Options: fedora, rhel)"));
        assertTrue(reply.contains("(Default: provider_net)"));
        assertTrue(reply.contains("(Options: m1.tiny, m1.small, m1.medium, m1.large, m1.xlarge, ci.cpu.small,"
                + " ci.cpu.medium, ci.cpu.large, t2.micro, t2.small, ...)"));
    }

    @Test
    void cloudCommandsWithoutBackend_sayNotConfigured() throws InterruptedException {
        List<String> replies = new CopyOnWriteArrayList<>();

        router.onEventSync(event("U0ALICE01", "list-aws-vms", "100.4"), replies::add);

        assertEquals("Sorry <@U0ALICE01>, AWS is not configured for this bot. Contact the bot administrator.",
                awaitReply(replies).get(0));
    }
}
