package com.ocpbot.channel.slack;

import com.ocpbot.channel.UserAllowlist;
import com.ocpbot.commands.CommandDispatcher;
import com.ocpbot.commands.CommandMetadata;
import com.ocpbot.commands.CommandOutput;
import com.ocpbot.commands.CommandRegistry;
import com.ocpbot.commands.DispatchOutcome;
import com.ocpbot.commands.GeneralHelpCache;
import com.ocpbot.commands.HandlerInvoker;
import com.ocpbot.commands.HelpCommand;
import com.ocpbot.commands.HelpFormatter;
import com.ocpbot.commands.MessageDispatcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SlackEventRouterTest {

    private static final String ADMIN = "ocp-sustaining-admin@redhat.com";

    private final List<String> dispatched = new CopyOnWriteArrayList<>();
    private final List<String> replies = new ArrayList<>();
    private final CommandOutput say = replies::add;
    private MessageDispatcher dispatcher;
    private SlackEventRouter router;

    @BeforeEach
    void setUp() {
        dispatcher = (text, userId, output) -> {
            dispatched.add(userId + ":" + text);
            return DispatchOutcome.DISPATCHED;
        };
        router = new SlackEventRouter(dispatcher, new UserAllowlist(Map.of("alice", "U0ALICE01"), false), ADMIN,
                new EventDedupe(Duration.ofMinutes(1), 100), Executors.newSingleThreadExecutor());
    }

    @AfterEach
    void tearDown() {
        router.close();
    }

    private static Map<String, Object> body(String user, String text, String ts) {
        return Map.of("event", Map.of("type", "message", "user", user, "text", text, "channel", "C01", "ts", ts));
    }

    @Test
    void allowedUser_isDispatched() {
        EventDisposition disposition = router.onEventSync(body("U0ALICE01", "<@UBOT> hello", "1.1"), say);

        assertEquals(EventDisposition.ACCEPTED, disposition);
        assertEquals(List.of("U0ALICE01:<@UBOT> hello"), dispatched);
        assertTrue(replies.isEmpty());
    }

    @Test
    void unlistedUser_isDeniedWithAdminContact() {
        EventDisposition disposition = router.onEventSync(body("U0MALLORY", "hello", "1.2"), say);

        assertEquals(EventDisposition.DENIED, disposition);
        assertTrue(dispatched.isEmpty());
        assertEquals(List.of("Sorry <@U0MALLORY>, you're not authorized to use this bot. Contact "
                + ADMIN + " for assistance."), replies);
    }

    @Test
    void openWorkspace_allowsAnyone() {
        SlackEventRouter open = new SlackEventRouter(dispatcher, new UserAllowlist(Map.of(), true), ADMIN, 1);
        try {
            assertEquals(EventDisposition.ACCEPTED, open.onEventSync(body("U0ANYONE1", "hello", "1.3"), say));
        } finally {
            open.close();
        }
    }

    @Test
    void sameMessageDeliveredTwice_isDispatchedOnce() {
        Map<String, Object> mention = Map.of("event", Map.of("type", "app_mention", "user", "U0ALICE01",
                "text", "<@UBOT> hello", "channel", "C01", "ts", "2.0"));
        Map<String, Object> message = body("U0ALICE01", "<@UBOT> hello", "2.0");

        assertEquals(EventDisposition.ACCEPTED, router.onEventSync(mention, say));
        assertEquals(EventDisposition.DUPLICATE, router.onEventSync(message, say));
        assertEquals(1, dispatched.size());
    }

    @Test
    void botAndEditedMessages_areDropped() {
        Map<String, Object> fromBot = Map.of("event", Map.of("bot_id", "B01", "text", "Hello!", "ts", "3.0"));
        Map<String, Object> edited = Map.of("event", Map.of("subtype", "message_changed", "user", "U0ALICE01",
                "text", "hello", "ts", "3.1"));
        Map<String, Object> anonymous = Map.of("event", Map.of("text", "hello", "ts", "3.2"));

        assertEquals(EventDisposition.DROPPED, router.onEventSync(fromBot, say));
        assertEquals(EventDisposition.DROPPED, router.onEventSync(edited, say));
        assertEquals(EventDisposition.DROPPED, router.onEventSync(anonymous, say));
        assertTrue(dispatched.isEmpty());
        assertTrue(replies.isEmpty());
    }

    @Test
    void onEvent_dispatchesOnWorker() throws InterruptedException {
        CountDownLatch done = new CountDownLatch(1);
        List<String> threads = new CopyOnWriteArrayList<>();
        SlackEventRouter async = new SlackEventRouter((text, userId, output) -> {
            threads.add(Thread.currentThread().getName());
            done.countDown();
            return DispatchOutcome.DISPATCHED;
        }, new UserAllowlist(Map.of(), true), ADMIN, 2);
        try {
            assertEquals(EventDisposition.ACCEPTED, async.onEvent(body("U0ALICE01", "hello", "4.0"), say));
            assertTrue(done.await(5, TimeUnit.SECONDS));
            assertTrue(threads.get(0).startsWith("slack-event-"));
        } finally {
            async.close();
        }
    }

    @Test
    void dispatcherFailure_doesNotEscape() {
        SlackEventRouter failing = new SlackEventRouter((text, userId, output) -> {
            throw new IllegalStateException("boom");
        }, new UserAllowlist(Map.of(), true), ADMIN, 1);
        try {
            assertEquals(EventDisposition.ACCEPTED,
                    assertDoesNotThrow(() -> failing.onEventSync(body("U0ALICE01", "hello", "5.0"), say)));
        } finally {
            failing.close();
        }
    }

    @Test
    void slowHandlersOnEveryWorker_doNotBlockOtherMessages() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch greeted = new CountDownLatch(1);
        List<String> asyncReplies = new CopyOnWriteArrayList<>();
        CommandRegistry registry = new CommandRegistry();
        registry.declare(CommandMetadata.builder("slow").build(), ctx -> {
            try {
                release.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        registry.declare(CommandMetadata.builder("hello").build(), ctx -> {
            ctx.say(ctx.greeting() + "How can I assist you today?");
            greeted.countDown();
        });
        HelpCommand help = new HelpCommand(registry, new HelpFormatter(registry), new GeneralHelpCache(registry));

        try (HandlerInvoker invoker = new HandlerInvoker(Duration.ofSeconds(60));
             SlackEventRouter busy = new SlackEventRouter(new CommandDispatcher(registry, help, invoker,
                     () -> "us-east-1"), new UserAllowlist(Map.of(), true), ADMIN, 4)) {
            for (int i = 0; i < 4; i++) {
                busy.onEvent(body("U0ALICE01", "slow", "6." + i), asyncReplies::add);
            }
            busy.onEvent(body("U0ALICE01", "hello", "6.9"), asyncReplies::add);

            assertTrue(greeted.await(3, TimeUnit.SECONDS), "hello was not answered while 4 slow handlers ran");
            assertEquals(List.of("Hello <@U0ALICE01>! How can I assist you today?"), asyncReplies);
        } finally {
            release.countDown();
        }
    }
}
