/**
 * EventBroadcaster.java
 *
 * 线程安全的一对多事件广播中心。
 * 维护当前所有已订阅的观察者，把每个发布的事件 (日志行或状态变化) 按发布顺序投递给每个观察者。
 *
 * <p>每个观察者拥有一个有界队列和一个串行投递任务，发布方只需把事件放入队列即可返回，
 * 因此一个慢速或已断开的观察者既不会阻塞发布方 (OutputRelay)，也不会影响其他观察者。
 * 队列已满或投递抛出异常的观察者会被直接移除。
 *
 * <p>它还记录最后一次发布的状态事件，新观察者订阅时首先收到这份状态快照。
 * 观察者集合由本类自己的锁保护，与 ProcessSupervisor 的锁互不相干。
 */
package club.ppmc.recorder.service;

import club.ppmc.recorder.model.RecorderEvent;
import club.ppmc.recorder.model.RecorderSettings;
import club.ppmc.recorder.model.StatusEvent;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class EventBroadcaster implements EventSink {

    private final Object lock = new Object();
    private final Map<String, ObserverChannel> observers = new LinkedHashMap<>();
    private final int queueCapacity;
    private final ExecutorService deliveryExecutor;

    private StatusEvent lastStatus = StatusEvent.stopped();

    @Autowired
    public EventBroadcaster(RecorderSettings settings) {
        this(settings.getObserverQueueCapacity());
    }

    EventBroadcaster(int queueCapacity) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("观察者队列容量必须大于 0: " + queueCapacity);
        }
        this.queueCapacity = queueCapacity;
        var threadCounter = new AtomicInteger();
        this.deliveryExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "observer-delivery-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 订阅事件流。先把当前状态快照放入该观察者的队列，再完成注册，
     * 两步在同一把锁内完成，因此快照之后不会漏掉、也不会重复任何事件。
     * 相同 ID 的旧观察者会被替换。
     *
     * @param observer 新的观察者。
     */
    public void subscribe(EventObserver observer) {
        ObserverChannel replaced;
        synchronized (lock) {
            var channel = new ObserverChannel(observer);
            channel.offer(lastStatus);
            replaced = observers.put(observer.id(), channel);
        }
        if (replaced != null) {
            replaced.close();
            log.info("观察者 {} 重新订阅，旧的投递通道已关闭。", observer.id());
        }
        log.info("观察者 {} 已订阅，当前观察者数量: {}", observer.id(), observerCount());
    }

    /**
     * 取消订阅。对未订阅的 ID 调用是无害的。
     */
    public void unsubscribe(String observerId) {
        ObserverChannel removed;
        synchronized (lock) {
            removed = observers.remove(observerId);
        }
        if (removed != null) {
            removed.close();
            log.info("观察者 {} 已取消订阅，当前观察者数量: {}", observerId, observerCount());
        }
    }

    /**
     * 将事件投递给当前所有观察者。只做入队操作，不会阻塞。
     */
    @Override
    public void publish(RecorderEvent event) {
        List<ObserverChannel> overflowed = new ArrayList<>();
        synchronized (lock) {
            if (event instanceof StatusEvent status) {
                lastStatus = status;
            }
            for (ObserverChannel channel : observers.values()) {
                if (!channel.offer(event)) {
                    overflowed.add(channel);
                }
            }
        }
        for (ObserverChannel channel : overflowed) {
            log.warn("观察者 {} 的事件积压超过 {} 条，将其移除。", channel.observer.id(), queueCapacity);
            detach(channel);
        }
    }

    public int observerCount() {
        synchronized (lock) {
            return observers.size();
        }
    }

    public StatusEvent currentStatus() {
        synchronized (lock) {
            return lastStatus;
        }
    }

    /**
     * 仅当注册表中仍是同一个通道时才移除，避免误删同 ID 的新订阅。
     */
    private void detach(ObserverChannel channel) {
        boolean removed;
        synchronized (lock) {
            removed = observers.remove(channel.observer.id(), channel);
        }
        channel.close();
        if (removed) {
            log.info("观察者 {} 已被移除，当前观察者数量: {}", channel.observer.id(), observerCount());
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("正在关闭 EventBroadcaster...");
        List<ObserverChannel> channels;
        synchronized (lock) {
            channels = new ArrayList<>(observers.values());
            observers.clear();
        }
        channels.forEach(ObserverChannel::close);
        deliveryExecutor.shutdown();
        try {
            if (!deliveryExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
                deliveryExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            deliveryExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 单个观察者的投递通道：有界队列 + 同一时刻至多一个的投递任务，保证该观察者收到的事件顺序与发布顺序一致。
     */
    private final class ObserverChannel {

        private final EventObserver observer;
        private final BlockingQueue<RecorderEvent> queue = new LinkedBlockingQueue<>(queueCapacity);
        private final AtomicBoolean draining = new AtomicBoolean(false);
        private volatile boolean closed;

        private ObserverChannel(EventObserver observer) {
            this.observer = observer;
        }

        boolean offer(RecorderEvent event) {
            if (closed || !queue.offer(event)) {
                return false;
            }
            scheduleDrain();
            return true;
        }

        void close() {
            closed = true;
            queue.clear();
        }

        private void scheduleDrain() {
            if (!draining.compareAndSet(false, true)) {
                return;
            }
            try {
                deliveryExecutor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                draining.set(false);
                log.debug("投递线程池已关闭，丢弃观察者 {} 的事件。", observer.id());
                close();
            }
        }

        private void drain() {
            try {
                RecorderEvent event;
                while (!closed && (event = queue.poll()) != null) {
                    try {
                        observer.deliver(event);
                    } catch (Exception e) {
                        log.warn("向观察者 {} 投递事件失败，将其移除: {}", observer.id(), e.getMessage());
                        detach(this);
                        return;
                    }
                }
            } finally {
                draining.set(false);
            }
            // 释放标记后可能有新事件刚入队而未触发调度
            if (!closed && !queue.isEmpty()) {
                scheduleDrain();
            }
        }
    }
}
