package com.ocpbot.channel.slack;

import com.ocpbot.channel.ChannelLogging;
import com.ocpbot.channel.UserAllowlist;
import com.ocpbot.channel.normalize.SlackNormalize;
import com.ocpbot.commands.CommandOutput;
import com.ocpbot.commands.MessageDispatcher;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for Slack {@code message} and {@code app_mention} events.
 * <p>
 * Filters bot traffic and duplicate deliveries, applies the user allow-list,
 * then dispatches the message text on a worker pool. Dispatch only starts the
 * command handler, so a worker is never held by a slow command. The transport that receives events calls
 * {@link #onEvent(Map, CommandOutput)} with the raw callback body and a reply
 * callback bound to the originating channel.
 */
@Slf4j
public class SlackEventRouter implements AutoCloseable {

    static final String CHANNEL = "slack";

    /** Message subtypes that still carry a user-typed command. */
    private static final Set<String> USER_SUBTYPES = Set.of("file_share", "thread_broadcast");

    private final MessageDispatcher dispatcher;
    private final UserAllowlist allowlist;
    private final String adminContact;
    private final EventDedupe dedupe;
    private final ExecutorService workers;

    public SlackEventRouter(MessageDispatcher dispatcher, UserAllowlist allowlist, String adminContact,
            int workerThreads) {
        this(dispatcher, allowlist, adminContact, new EventDedupe(), newWorkerPool(workerThreads));
    }

    public SlackEventRouter(MessageDispatcher dispatcher, UserAllowlist allowlist, String adminContact,
            EventDedupe dedupe, ExecutorService workers) {
        this.dispatcher = dispatcher;
        this.allowlist = allowlist;
        this.adminContact = adminContact;
        this.dedupe = dedupe;
        this.workers = workers;
    }

    private static ExecutorService newWorkerPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "slack-event-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Handle an event callback body; dispatch happens asynchronously.
     */
    public EventDisposition onEvent(Map<String, ?> body, CommandOutput say) {
        SlackEvent event = SlackEvent.fromBody(body);
        EventDisposition disposition = admit(event, say);
        if (disposition != EventDisposition.ACCEPTED) {
            return disposition;
        }
        try {
            workers.submit(() -> dispatch(event, say));
        } catch (RejectedExecutionException e) {
            log.warn("Event router is shut down, dropping message from {}", event.user());
            return EventDisposition.DROPPED;
        }
        return EventDisposition.ACCEPTED;
    }

    /**
     * Same as {@link #onEvent(Map, CommandOutput)} but dispatches on the
     * calling thread. Handler replies may still arrive after this returns.
     */
    public EventDisposition onEventSync(Map<String, ?> body, CommandOutput say) {
        SlackEvent event = SlackEvent.fromBody(body);
        EventDisposition disposition = admit(event, say);
        if (disposition == EventDisposition.ACCEPTED) {
            dispatch(event, say);
        }
        return disposition;
    }

    EventDisposition admit(SlackEvent event, CommandOutput say) {
        if (event.fromBot()) {
            ChannelLogging.logInboundDrop(log::debug, CHANNEL, "bot message", event.channel());
            return EventDisposition.DROPPED;
        }
        if (event.subtype() != null && !USER_SUBTYPES.contains(event.subtype())) {
            ChannelLogging.logInboundDrop(log::debug, CHANNEL, "subtype " + event.subtype(), event.channel());
            return EventDisposition.DROPPED;
        }
        if (event.user() == null) {
            ChannelLogging.logInboundDrop(log::debug, CHANNEL, "no user", event.channel());
            return EventDisposition.DROPPED;
        }
        if (dedupe.isDuplicate(event.dedupeKey())) {
            ChannelLogging.logInboundDrop(log::debug, CHANNEL, "duplicate", event.dedupeKey());
            return EventDisposition.DUPLICATE;
        }

        UserAllowlist.Match match = allowlist.resolve(event.user());
        if (!match.allowed()) {
            ChannelLogging.logAccessDenied(log::info, CHANNEL, event.user(), match);
            say.say(denialMessage(event.user()));
            return EventDisposition.DENIED;
        }
        return EventDisposition.ACCEPTED;
    }

    private void dispatch(SlackEvent event, CommandOutput say) {
        try {
            var outcome = dispatcher.dispatch(event.text(), event.user(), say);
            log.debug("Event from {} in {} -> {}", event.user(), event.channel(), outcome);
        } catch (RuntimeException e) {
            log.error("Dispatch failed for message from {}: {}", event.user(), e.getMessage(), e);
        }
    }

    String denialMessage(String userId) {
        return "Sorry " + SlackNormalize.mentionUser(userId) + ", you're not authorized to use this bot. Contact "
                + adminContact + " for assistance.";
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
