package com.devflow.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Typed in-memory observer channel.
 * <p>
 * Supports per-project subscriptions and global subscriptions that receive every item.
 * Delivery is synchronous and in publish order; a subscriber that throws is logged
 * and does not prevent delivery to the others.
 *
 * @param <T> the item type carried by this channel
 */
public class EventChannel<T> {

    private static final Logger log = LoggerFactory.getLogger(EventChannel.class);

    private final String name;
    private final Function<T, String> projectKey;

    /** Per-project subscribers keyed by project path. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<T>>> projectSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive items from all projects. */
    private final CopyOnWriteArrayList<Consumer<T>> globalSubscribers = new CopyOnWriteArrayList<>();

    /**
     * @param name       channel name used in log output
     * @param projectKey extracts the project path from an item; may return {@code null}
     *                   for items that only global subscribers should see
     */
    public EventChannel(String name, Function<T, String> projectKey) {
        this.name = name;
        this.projectKey = projectKey;
    }

    /**
     * Publish an item to all matching subscribers (project-specific and global).
     */
    public void publish(T item) {
        String project = projectKey.apply(item);
        log.debug("Publishing on {} for project {}", name, project);

        if (project != null) {
            List<Consumer<T>> subs = projectSubscribers.get(project);
            if (subs != null) {
                for (Consumer<T> subscriber : subs) {
                    deliverSafely(subscriber, item);
                }
            }
        }

        for (Consumer<T> subscriber : globalSubscribers) {
            deliverSafely(subscriber, item);
        }
    }

    /**
     * Subscribe to items of a single project.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String projectPath, Consumer<T> consumer) {
        projectSubscribers.computeIfAbsent(projectPath, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<T>> subs = projectSubscribers.get(projectPath);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to items from all projects.
     */
    public Subscription subscribeAll(Consumer<T> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    public int subscriberCount() {
        int count = globalSubscribers.size();
        for (var subs : projectSubscribers.values()) {
            count += subs.size();
        }
        return count;
    }

    /** Drops every subscription. */
    public void clear() {
        projectSubscribers.clear();
        globalSubscribers.clear();
    }

    private void deliverSafely(Consumer<T> subscriber, T item) {
        try {
            subscriber.accept(item);
        } catch (Exception e) {
            log.warn("Subscriber on {} threw exception: {}", name, e.getMessage(), e);
        }
    }
}
