package com.devflow.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventChannel}.
 */
class EventChannelTest {

    record Item(String project, String value) {}

    private EventChannel<Item> channel;

    @BeforeEach
    void setUp() {
        channel = new EventChannel<>("test", Item::project);
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers only to subscribers of the item's project")
        void deliversToProjectSubscriber() {
            List<Item> alpha = new ArrayList<>();
            List<Item> beta = new ArrayList<>();
            channel.subscribe("/alpha", alpha::add);
            channel.subscribe("/beta", beta::add);

            channel.publish(new Item("/alpha", "a1"));

            assertEquals(1, alpha.size());
            assertTrue(beta.isEmpty());
        }

        @Test
        @DisplayName("global subscribers receive every item in publish order")
        void globalSubscriberReceivesAll() {
            List<String> received = new ArrayList<>();
            channel.subscribeAll(item -> received.add(item.value()));

            channel.publish(new Item("/alpha", "1"));
            channel.publish(new Item("/beta", "2"));
            channel.publish(new Item(null, "3"));

            assertEquals(List.of("1", "2", "3"), received);
        }

        @Test
        @DisplayName("items without a project reach only global subscribers")
        void nullProjectGoesToGlobalOnly() {
            List<Item> project = new ArrayList<>();
            List<Item> global = new ArrayList<>();
            channel.subscribe("/alpha", project::add);
            channel.subscribeAll(global::add);

            channel.publish(new Item(null, "x"));

            assertTrue(project.isEmpty());
            assertEquals(1, global.size());
        }
    }

    @Nested
    @DisplayName("subscriber isolation")
    class IsolationTests {

        @Test
        @DisplayName("a throwing subscriber does not block the others")
        void throwingSubscriberIsIsolated() {
            List<Item> received = new ArrayList<>();
            channel.subscribeAll(item -> {
                throw new IllegalStateException("boom");
            });
            channel.subscribeAll(received::add);

            assertDoesNotThrow(() -> channel.publish(new Item("/alpha", "x")));
            assertEquals(1, received.size());
        }
    }

    @Nested
    @DisplayName("unsubscribe and clear")
    class UnsubscribeTests {

        @Test
        @DisplayName("unsubscribed consumer no longer receives items")
        void unsubscribeStopsDelivery() {
            List<Item> received = new ArrayList<>();
            Subscription subscription = channel.subscribe("/alpha", received::add);

            subscription.unsubscribe();
            channel.publish(new Item("/alpha", "x"));

            assertTrue(received.isEmpty());
            assertEquals(0, channel.subscriberCount());
        }

        @Test
        @DisplayName("clear drops every subscription")
        void clearDropsAll() {
            channel.subscribe("/alpha", item -> {});
            channel.subscribeAll(item -> {});
            assertEquals(2, channel.subscriberCount());

            channel.clear();

            assertEquals(0, channel.subscriberCount());
        }
    }
}
