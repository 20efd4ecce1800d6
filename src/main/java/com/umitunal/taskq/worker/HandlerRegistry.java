package com.umitunal.taskq.worker;

import com.umitunal.taskq.core.DuplicateRegistrationException;
import com.umitunal.taskq.core.RegistrationPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name-to-handler map owned by a single engine instance.
 *
 * @param <H> the handler type
 */
public class HandlerRegistry<H> {
    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final String kind;
    private final RegistrationPolicy policy;
    private final Map<String, H> handlers = new ConcurrentHashMap<>();

    /**
     * @param kind what is being registered, used in messages ("job handler", "schedule")
     */
    public HandlerRegistry(String kind, RegistrationPolicy policy) {
        this.kind = kind;
        this.policy = policy;
    }

    /**
     * @return the handler this one replaced, or null
     * @throws DuplicateRegistrationException if the name is taken and the policy is REJECT
     */
    public H register(String name, H handler) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(kind + " name must not be blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException(kind + " handler must not be null");
        }

        if (policy == RegistrationPolicy.REJECT) {
            if (handlers.putIfAbsent(name, handler) != null) {
                throw new DuplicateRegistrationException(kind, name);
            }
            return null;
        }
        H previous = handlers.put(name, handler);
        if (previous != null) {
            log.warn("Replaced previously registered {} '{}'", kind, name);
        }
        return previous;
    }

    /**
     * Undo a registration: put {@code previous} back in place of {@code current}, or drop the name
     * if there was no previous handler. Does nothing if {@code current} has been replaced since.
     *
     * @return false if {@code current} was no longer registered under the name
     */
    public boolean revert(String name, H current, H previous) {
        if (previous == null) {
            return handlers.remove(name, current);
        }
        return handlers.replace(name, current, previous);
    }

    public Optional<H> find(String name) {
        return Optional.ofNullable(handlers.get(name));
    }

    public Optional<H> remove(String name) {
        return Optional.ofNullable(handlers.remove(name));
    }

    public boolean contains(String name) {
        return handlers.containsKey(name);
    }

    public Set<String> names() {
        return Set.copyOf(handlers.keySet());
    }

    public Collection<H> handlers() {
        return List.copyOf(handlers.values());
    }
}
