package com.ocpbot.commands;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Maps every dispatch key (canonical name or alias) to a handler and its
 * metadata.
 * <p>
 * All keys of one command share the same {@link RegisteredCommand} instance.
 * Re-registering a key replaces the previous entry (last write wins, logged at
 * WARN); there is no removal. Reads and writes are guarded by a read-write
 * lock so commands may be registered while messages are being dispatched.
 */
@Slf4j
public class CommandRegistry {

    /** Dispatch key reserved for the help surface. */
    public static final String HELP_COMMAND = "help";

    private final Map<String, RegisteredCommand> commands = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Declare a command: register it under its canonical name and aliases.
     * A command named {@value #HELP_COMMAND} is only registered under its
     * aliases so it cannot shadow the help surface.
     */
    public void declare(CommandMetadata metadata, CommandHandler handler) {
        RegisteredCommand entry = new RegisteredCommand(handler, metadata);
        lock.writeLock().lock();
        try {
            if (!HELP_COMMAND.equals(metadata.name())) {
                put(metadata.name(), entry);
            }
            metadata.aliases().forEach(alias -> put(alias, entry));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Register a handler under an explicit key plus every alias in its
     * metadata. Unlike {@link #declare}, any key is accepted, including
     * {@value #HELP_COMMAND}.
     */
    public void register(String name, CommandHandler handler, CommandMetadata metadata) {
        RegisteredCommand entry = new RegisteredCommand(handler, metadata);
        lock.writeLock().lock();
        try {
            put(name, entry);
            metadata.aliases().forEach(alias -> put(alias, entry));
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void put(String key, RegisteredCommand entry) {
        RegisteredCommand previous = commands.put(key, entry);
        if (previous != null && previous.metadata() != entry.metadata()) {
            log.warn("Overwriting existing command key '{}' ({} -> {})",
                    key, previous.metadata().name(), entry.metadata().name());
        }
        log.debug("Registered command key: {}", key);
    }

    /**
     * Exact, case-sensitive lookup.
     */
    public Optional<RegisteredCommand> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return Optional.ofNullable(commands.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String name) {
        return lookup(name).isPresent();
    }

    /**
     * Handler registered under {@code name}, if any.
     */
    public Optional<CommandHandler> handler(String name) {
        return lookup(name).map(RegisteredCommand::handler);
    }

    /**
     * Every dispatch key, aliases included, in registration order.
     */
    public List<String> allKeys() {
        lock.readLock().lock();
        try {
            return List.copyOf(commands.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * One entry per distinct metadata instance, keyed by the first dispatch
     * key that maps to it in registration order.
     */
    public Map<String, CommandMetadata> uniqueCommands() {
        lock.readLock().lock();
        try {
            Set<CommandMetadata> seen = Collections.newSetFromMap(new IdentityHashMap<>());
            Map<String, CommandMetadata> unique = new LinkedHashMap<>();
            for (Map.Entry<String, RegisteredCommand> entry : commands.entrySet()) {
                CommandMetadata metadata = entry.getValue().metadata();
                if (seen.add(metadata)) {
                    unique.put(entry.getKey(), metadata);
                }
            }
            return unique;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Suggestions for an unknown command, see {@link CommandSuggestions}.
     */
    public List<String> suggest(String text, int limit) {
        return CommandSuggestions.suggest(allKeys(), text, limit);
    }

    public int size() {
        lock.readLock().lock();
        try {
            return commands.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
