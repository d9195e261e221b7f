package com.ocpbot.commands;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs command handlers with a timeout and turns escaped failures into a
 * reply.
 * <p>
 * {@link #invoke} never waits for the handler: it runs on the handler pool
 * and a timer ends the invocation once the timeout passes. Handlers are
 * expected to report their own errors; anything that still escapes is logged
 * and answered with a generic apology. A handler that outlives the timeout is
 * interrupted, the user is told it timed out, and whatever it says afterwards
 * is dropped.
 */
@Slf4j
public class HandlerInvoker implements AutoCloseable {

    private final Executor handlers;
    private final ScheduledExecutorService timer;
    private final Duration timeout;

    public HandlerInvoker(Duration timeout) {
        this(newHandlerPool(), timeout);
    }

    public HandlerInvoker(Executor handlers, Duration timeout) {
        this.handlers = handlers;
        this.timeout = timeout;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "command-timeout");
            t.setDaemon(true);
            return t;
        });
    }

    private static ExecutorService newHandlerPool() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "command-handler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Start a handler without waiting for it.
     *
     * @return completes with true if the handler finished normally within the
     *         timeout, false once it failed or timed out
     */
    public CompletableFuture<Boolean> invoke(CommandHandler handler, CommandContext ctx) {
        Invocation invocation = new Invocation(ctx);
        try {
            ScheduledFuture<?> deadline = timer.schedule(invocation::timeOut, timeout.toMillis(),
                    TimeUnit.MILLISECONDS);
            invocation.result.whenComplete((ok, err) -> deadline.cancel(false));
            handlers.execute(() -> invocation.run(handler));
        } catch (RejectedExecutionException e) {
            log.warn("Handler pool is shut down, not running {}", ctx.command());
            if (invocation.finish()) {
                invocation.fail(e);
            }
        }
        return invocation.result;
    }

    static String timeoutMessage(CommandContext ctx, Duration timeout) {
        return CommandContext.apology(ctx.userId()) + "`" + ctx.command() + "` timed out after "
                + timeout.toSeconds() + "s.";
    }

    static String failureMessage(CommandContext ctx) {
        return CommandContext.apology(ctx.userId()) + "an error occurred running `" + ctx.command()
                + "`. Please try again or contact the bot administrator.";
    }

    @Override
    public void close() {
        timer.shutdownNow();
        if (handlers instanceof ExecutorService pool) {
            pool.shutdownNow();
        }
    }

    // =========================================================================
    // One handler run; also the guarded output the handler writes through
    // =========================================================================

    private final class Invocation implements CommandOutput {

        private final CommandContext ctx;
        private final CompletableFuture<Boolean> result = new CompletableFuture<>();
        private Thread runner;
        private boolean finished;

        Invocation(CommandContext ctx) {
            this.ctx = ctx;
        }

        @Override
        public synchronized void say(String message) {
            if (finished) {
                log.warn("Dropping reply from {} after the invocation ended", ctx.command());
                return;
            }
            ctx.say(message);
        }

        void run(CommandHandler handler) {
            synchronized (this) {
                if (finished) {
                    return;
                }
                runner = Thread.currentThread();
            }
            try {
                handler.handle(ctx.withOutput(this));
                if (finish()) {
                    result.complete(true);
                }
            } catch (RuntimeException e) {
                if (finish()) {
                    fail(e);
                } else {
                    log.warn("Command {} failed after timing out: {}", ctx.command(), e.getMessage());
                }
            }
        }

        synchronized boolean finish() {
            if (finished) {
                return false;
            }
            finished = true;
            runner = null;
            return true;
        }

        void fail(Exception e) {
            log.error("Command {} failed: {}", ctx.command(), e.getMessage(), e);
            ctx.say(failureMessage(ctx));
            result.complete(false);
        }

        void timeOut() {
            synchronized (this) {
                if (finished) {
                    return;
                }
                finished = true;
                if (runner != null) {
                    runner.interrupt();
                    runner = null;
                }
            }
            log.warn("Command {} timed out after {}s", ctx.command(), timeout.toSeconds());
            ctx.say(timeoutMessage(ctx, timeout));
            result.complete(false);
        }
    }
}
