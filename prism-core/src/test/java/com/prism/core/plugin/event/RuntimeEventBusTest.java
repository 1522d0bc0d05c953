package com.prism.core.plugin.event;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RuntimeEventBus 单元测试")
public class RuntimeEventBusTest {

    private RuntimeEventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new RuntimeEventBus("test");
    }

    @Nested
    @DisplayName("订阅和发布")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("订阅后应能收到事件")
        void subscriberShouldReceiveEvent() {
            AtomicReference<RuntimeEvent.PluginLoaded> received = new AtomicReference<>();

            eventBus.subscribe(RuntimeEvent.PluginLoaded.class, received::set);
            eventBus.publish(new RuntimeEvent.PluginLoaded("weather", "1.0.0", false));

            assertNotNull(received.get());
            assertEquals("weather", received.get().pluginName());
            assertEquals("1.0.0", received.get().version());
        }

        @Test
        @DisplayName("不匹配的事件类型不应触发")
        void nonMatchingEventShouldNotTrigger() {
            AtomicInteger count = new AtomicInteger(0);

            eventBus.subscribe(RuntimeEvent.PluginLoaded.class, e -> count.incrementAndGet());
            eventBus.publish(new RuntimeEvent.PluginUnloaded("weather"));

            assertEquals(0, count.get());
        }

        @Test
        @DisplayName("按订阅顺序同步派发")
        void dispatchShouldBeOrdered() {
            List<String> order = new ArrayList<>();

            eventBus.subscribe(RuntimeEvent.RoutesChanged.class, e -> order.add("first"));
            eventBus.subscribe(RuntimeEvent.RoutesChanged.class, e -> order.add("second"));
            eventBus.publish(new RuntimeEvent.RoutesChanged(Set.of("/chat")));

            assertEquals(List.of("first", "second"), order);
        }

        @Test
        @DisplayName("订阅 RuntimeEvent 可收到全部事件")
        void baseTypeShouldReceiveEverything() {
            List<RuntimeEvent> received = new ArrayList<>();

            eventBus.subscribe(RuntimeEvent.class, received::add);
            eventBus.publish(new RuntimeEvent.PluginLoaded("weather", "1.0.0", false));
            eventBus.publish(new RuntimeEvent.RoutesChanged(Set.of()));

            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("监听器中发布的事件排在当前事件之后，所有监听器看到相同顺序")
        void nestedPublishShouldBeQueued() {
            List<String> first = new ArrayList<>();
            List<String> second = new ArrayList<>();

            eventBus.subscribe("first", RuntimeEvent.class, e -> {
                first.add(e.getClass().getSimpleName());
                if (e instanceof RuntimeEvent.PluginUnloaded) {
                    eventBus.publish(new RuntimeEvent.RoutesChanged(Set.of()));
                }
            });
            eventBus.subscribe("second", RuntimeEvent.class, e -> second.add(e.getClass().getSimpleName()));

            eventBus.publish(new RuntimeEvent.PluginUnloaded("weather"));

            assertEquals(List.of("PluginUnloaded", "RoutesChanged"), first);
            assertEquals(first, second);
        }
    }

    @Nested
    @DisplayName("取消订阅")
    class UnsubscribeTests {

        @Test
        @DisplayName("取消订阅后不应收到事件")
        void unsubscribedShouldNotReceive() {
            AtomicInteger count = new AtomicInteger(0);

            RuntimeEventBus.Subscription subscription =
                    eventBus.subscribe(RuntimeEvent.PluginSkipped.class, e -> count.incrementAndGet());

            eventBus.publish(new RuntimeEvent.PluginSkipped("a", "missing lock file"));
            assertEquals(1, count.get());

            subscription.unsubscribe();

            eventBus.publish(new RuntimeEvent.PluginSkipped("b", "missing lock file"));
            assertEquals(1, count.get());
        }

        @Test
        @DisplayName("订阅句柄可用于 try-with-resources")
        void subscriptionShouldCloseWithResources() {
            AtomicInteger count = new AtomicInteger(0);

            try (RuntimeEventBus.Subscription ignored =
                         eventBus.subscribe(RuntimeEvent.PluginLoaded.class, e -> count.incrementAndGet())) {
                eventBus.publish(new RuntimeEvent.PluginLoaded("a", "1.0.0", false));
            }
            eventBus.publish(new RuntimeEvent.PluginLoaded("b", "1.0.0", false));

            assertEquals(1, count.get());
            assertEquals(0, eventBus.getSubscriptionCount());
        }
    }

    @Nested
    @DisplayName("异常处理")
    class ExceptionHandlingTests {

        @Test
        @DisplayName("订阅者抛出异常不应影响其他订阅者")
        void exceptionShouldNotAffectOthers() {
            AtomicInteger count = new AtomicInteger(0);

            eventBus.subscribe(RuntimeEvent.PluginUnloaded.class, e -> {
                throw new RuntimeException("Oops!");
            });
            eventBus.subscribe(RuntimeEvent.PluginUnloaded.class, e -> count.incrementAndGet());

            assertDoesNotThrow(() -> eventBus.publish(new RuntimeEvent.PluginUnloaded("weather")));

            assertEquals(1, count.get());
            assertEquals(1, eventBus.getFailureCount());
        }
    }

    @Nested
    @DisplayName("清理")
    class ClearTests {

        @Test
        @DisplayName("clear 后不应有订阅者")
        void clearShouldRemoveAllSubscriptions() {
            eventBus.subscribe(RuntimeEvent.PluginLoaded.class, e -> {
            });
            eventBus.subscribe(RuntimeEvent.RoutesChanged.class, e -> {
            });

            assertEquals(2, eventBus.getSubscriptionCount());

            eventBus.clear();

            assertEquals(0, eventBus.getSubscriptionCount());
        }
    }
}
