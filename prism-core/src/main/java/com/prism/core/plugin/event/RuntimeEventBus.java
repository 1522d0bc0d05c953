package com.prism.core.plugin.event;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 运行时事件总线：加载器发布插件生命周期，路由表发布路由变更，调用链执行器据此失效缓存
 * <p>
 * 派发规则：
 * <ul>
 *     <li>同步派发，publish 返回时监听器都已执行完毕，缓存失效先于下一次解析</li>
 *     <li>按订阅顺序调用；订阅 {@link RuntimeEvent} 本身可收到全部事件</li>
 *     <li>监听器中再次发布的事件排在当前事件之后，每个监听器看到的先后顺序一致</li>
 *     <li>监听器失败只记录并计数，不影响其余监听器与发布方</li>
 * </ul>
 */
@Slf4j
public class RuntimeEventBus {

    private final String name;
    private final List<Listener<?>> listeners = new CopyOnWriteArrayList<>();
    private final ThreadLocal<Deque<RuntimeEvent>> dispatching = new ThreadLocal<>();
    private final AtomicLong failures = new AtomicLong();

    public RuntimeEventBus(String name) {
        this.name = name;
    }

    public <E extends RuntimeEvent> Subscription subscribe(Class<E> eventType, Consumer<? super E> handler) {
        return subscribe(eventType.getSimpleName() + "-listener", eventType, handler);
    }

    /**
     * @param owner 订阅方名称，出现在失败日志中
     */
    public <E extends RuntimeEvent> Subscription subscribe(String owner, Class<E> eventType,
                                                           Consumer<? super E> handler) {
        Listener<E> listener = new Listener<>(owner, eventType, handler);
        listeners.add(listener);
        log.debug("[{}] {} subscribed to {}", name, owner, eventType.getSimpleName());
        return () -> {
            if (listeners.remove(listener)) {
                log.debug("[{}] {} unsubscribed from {}", name, owner, eventType.getSimpleName());
            }
        };
    }

    public void publish(RuntimeEvent event) {
        Deque<RuntimeEvent> queue = dispatching.get();
        if (queue != null) {
            // 正在派发中：排队，等当前事件派发完
            queue.addLast(event);
            log.debug("[{}] Queued nested event: {}", name, event);
            return;
        }
        queue = new ArrayDeque<>();
        queue.addLast(event);
        dispatching.set(queue);
        try {
            RuntimeEvent next;
            while ((next = queue.pollFirst()) != null) {
                dispatch(next);
            }
        } finally {
            dispatching.remove();
        }
    }

    private void dispatch(RuntimeEvent event) {
        log.debug("[{}] Dispatching {}", name, event);
        for (Listener<?> listener : listeners) {
            if (!listener.eventType().isInstance(event)) {
                continue;
            }
            try {
                listener.deliver(event);
            } catch (RuntimeException e) {
                failures.incrementAndGet();
                log.error("[{}] Listener {} failed on {}: {}", name, listener.owner(), event, e.getMessage(), e);
            }
        }
    }

    public void clear() {
        listeners.clear();
        log.debug("[{}] All subscriptions cleared", name);
    }

    public int getSubscriptionCount() {
        return listeners.size();
    }

    /**
     * 自创建以来监听器抛出异常的次数
     */
    public long getFailureCount() {
        return failures.get();
    }

    /**
     * 订阅句柄，可直接用于 try-with-resources
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {

        void unsubscribe();

        @Override
        default void close() {
            unsubscribe();
        }
    }

    private record Listener<E extends RuntimeEvent>(String owner, Class<E> eventType, Consumer<? super E> handler) {

        void deliver(RuntimeEvent event) {
            handler.accept(eventType.cast(event));
        }
    }
}
