package com.storyloop.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * In-process publish/subscribe hub for run lifecycle events.
 *
 * <p>Subscriptions match event types by glob pattern ({@code story.*}, {@code *}) and are
 * dispatched in descending priority, ties in subscription order. The registry is re-sorted
 * on registration and read lock-free on dispatch. A handler that throws or completes
 * exceptionally is logged and never affects other handlers or the emitter.
 *
 * <p>Instances are explicit; components receive the bus they should use.
 */
public class EventBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    public static final int DEFAULT_HISTORY_CAPACITY = 1000;
    static final String SOURCE = "storyloop";

    private static final Comparator<Subscription> DISPATCH_ORDER = Comparator
            .comparingInt(Subscription::priority).reversed()
            .thenComparingLong(Subscription::sequence);

    private final int historyCapacity;
    private final Clock clock;
    private final ExecutorService executor;

    private final AtomicLong sequence = new AtomicLong();
    private volatile List<Subscription> registry = List.of();

    private final ArrayDeque<LoopEvent> history = new ArrayDeque<>();
    private final ConcurrentHashMap<String, LongAdder> countsByType = new ConcurrentHashMap<>();
    private final LongAdder total = new LongAdder();

    public EventBus() {
        this(DEFAULT_HISTORY_CAPACITY, Clock.systemUTC());
    }

    public EventBus(int historyCapacity, Clock clock) {
        if (historyCapacity < 1) {
            throw new IllegalArgumentException("historyCapacity must be >= 1");
        }
        this.historyCapacity = historyCapacity;
        this.clock = clock;
        this.executor = Executors.newCachedThreadPool(daemonThreads());
    }

    // ══════════════════════════════════════════════════════════════════════════
    // SUBSCRIPTION
    // ══════════════════════════════════════════════════════════════════════════

    public Subscription subscribe(String pattern, Consumer<LoopEvent> handler) {
        return subscribe(pattern, handler, EventPriority.NORMAL.value(), null, null);
    }

    public Subscription subscribe(String pattern, Consumer<LoopEvent> handler, EventPriority priority) {
        return subscribe(pattern, handler, priority.value(), null, null);
    }

    /**
     * @param filter optional per-event gate applied after pattern matching
     * @param name   optional handler name; generated when null
     */
    public Subscription subscribe(String pattern, Consumer<LoopEvent> handler, int priority,
                                  Predicate<LoopEvent> filter, String name) {
        return subscribeAsync(pattern, event -> {
            handler.accept(event);
            return CompletableFuture.completedFuture(null);
        }, priority, filter, name);
    }

    /**
     * Registers a handler that may complete asynchronously. When an emitter waits, it waits
     * for the returned stage.
     */
    public synchronized Subscription subscribeAsync(String pattern, EventHandler handler, int priority,
                                                    Predicate<LoopEvent> filter, String name) {
        long seq = sequence.getAndIncrement();
        Subscription subscription = new Subscription(
                name != null ? name : "handler_" + seq, pattern, priority, filter, handler, seq, this);
        List<Subscription> next = new ArrayList<>(registry);
        next.add(subscription);
        next.sort(DISPATCH_ORDER);
        registry = List.copyOf(next);
        log.debug("Subscribed handler '{}' to '{}' (priority={})", subscription.name(), pattern, priority);
        return subscription;
    }

    /** Removes the first handler with the given name. */
    public synchronized boolean unsubscribe(String name) {
        for (Subscription s : registry) {
            if (s.name().equals(name)) {
                return unsubscribe(s);
            }
        }
        return false;
    }

    public synchronized boolean unsubscribe(Subscription subscription) {
        List<Subscription> next = new ArrayList<>(registry);
        boolean removed = next.remove(subscription);
        if (removed) {
            registry = List.copyOf(next);
            log.debug("Unsubscribed handler '{}'", subscription.name());
        }
        return removed;
    }

    /**
     * Registered handlers in dispatch order, optionally only those whose pattern matches
     * {@code type}.
     */
    public List<Subscription> handlers(String type) {
        if (type == null) {
            return registry;
        }
        return registry.stream().filter(s -> s.matches(type)).toList();
    }

    // ══════════════════════════════════════════════════════════════════════════
    // EMISSION
    // ══════════════════════════════════════════════════════════════════════════

    /** Emits with no correlation ids and waits for all handlers. */
    public LoopEvent emit(String type, Map<String, Object> data) {
        return emit(type, data, null, null, true);
    }

    /**
     * Records the event and dispatches it to every matching handler in priority order.
     *
     * @param wait when true, returns only after every dispatched handler finished; when false,
     *             handlers are started in priority order on the bus executor and the call returns
     *             immediately
     */
    public LoopEvent emit(String type, Map<String, Object> data, String runId, String taskId, boolean wait) {
        LoopEvent event = new LoopEvent(type, data, clock.instant(), SOURCE, runId, taskId);

        synchronized (history) {
            history.addLast(event);
            while (history.size() > historyCapacity) {
                history.removeFirst();
            }
        }
        countsByType.computeIfAbsent(type, k -> new LongAdder()).increment();
        total.increment();

        List<Subscription> matching = new ArrayList<>();
        for (Subscription s : registry) {
            if (s.shouldHandle(event)) {
                matching.add(s);
            }
        }
        if (matching.isEmpty()) {
            log.debug("No handlers for event '{}'", type);
            return event;
        }
        log.debug("Emitting '{}' to {} handler(s)", type, matching.size());

        if (wait) {
            List<CompletableFuture<Void>> pending = new ArrayList<>(matching.size());
            for (Subscription s : matching) {
                pending.add(invokeSafely(s, event));
            }
            CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])).join();
        } else {
            for (Subscription s : matching) {
                try {
                    executor.execute(() -> invokeSafely(s, event));
                } catch (RejectedExecutionException e) {
                    log.warn("Dropped event {} for handler '{}': bus is closed", type, s.name());
                }
            }
        }
        return event;
    }

    private CompletableFuture<Void> invokeSafely(Subscription subscription, LoopEvent event) {
        CompletionStage<?> stage;
        try {
            stage = subscription.handler().handle(event);
        } catch (Exception e) {
            log.warn("Handler '{}' threw exception processing event {}: {}",
                    subscription.name(), event.type(), e.getMessage(), e);
            return CompletableFuture.completedFuture(null);
        }
        if (stage == null) {
            return CompletableFuture.completedFuture(null);
        }
        return stage.toCompletableFuture().handle((result, error) -> {
            if (error != null) {
                log.warn("Handler '{}' failed processing event {}: {}",
                        subscription.name(), event.type(), error.getMessage(), error);
            }
            return null;
        });
    }

    // ══════════════════════════════════════════════════════════════════════════
    // INTROSPECTION
    // ══════════════════════════════════════════════════════════════════════════

    /**
     * @param type  only events of this exact type, or all when null
     * @param limit maximum events returned
     * @return matching events, most recent first
     */
    public List<LoopEvent> history(String type, int limit) {
        List<LoopEvent> result = new ArrayList<>();
        synchronized (history) {
            Iterator<LoopEvent> it = history.descendingIterator();
            while (it.hasNext() && result.size() < limit) {
                LoopEvent e = it.next();
                if (type == null || type.equals(e.type())) {
                    result.add(e);
                }
            }
        }
        return result;
    }

    public EventStats stats() {
        Map<String, Long> byType = new TreeMap<>();
        countsByType.forEach((type, count) -> byType.put(type, count.sum()));
        int historySize;
        synchronized (history) {
            historySize = history.size();
        }
        return new EventStats(total.sum(), byType, registry.size(), historySize);
    }

    public void clearHistory() {
        synchronized (history) {
            history.clear();
        }
    }

    public void resetStats() {
        countsByType.clear();
        total.reset();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Event handlers still running after shutdown; interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    static Pattern globToRegex(String glob) {
        StringBuilder sb = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> sb.append(".*");
                case '?' -> sb.append('.');
                default -> sb.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(sb.toString());
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "event-bus-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * A registered handler. Also usable as the handle to unsubscribe it.
     */
    public static final class Subscription {

        private final String name;
        private final String pattern;
        private final Pattern regex;
        private final int priority;
        private final Predicate<LoopEvent> filter;
        private final EventHandler handler;
        private final long sequence;
        private final EventBus bus;

        private Subscription(String name, String pattern, int priority, Predicate<LoopEvent> filter,
                             EventHandler handler, long sequence, EventBus bus) {
            this.name = name;
            this.pattern = pattern;
            this.regex = globToRegex(pattern);
            this.priority = priority;
            this.filter = filter;
            this.handler = handler;
            this.sequence = sequence;
            this.bus = bus;
        }

        public String name() {
            return name;
        }

        public String pattern() {
            return pattern;
        }

        public int priority() {
            return priority;
        }

        long sequence() {
            return sequence;
        }

        EventHandler handler() {
            return handler;
        }

        public boolean matches(String type) {
            return regex.matcher(type).matches();
        }

        boolean shouldHandle(LoopEvent event) {
            if (!matches(event.type())) {
                return false;
            }
            if (filter == null) {
                return true;
            }
            try {
                return filter.test(event);
            } catch (RuntimeException e) {
                log.warn("Filter of handler '{}' threw on event {}: {}", name, event.type(), e.getMessage(), e);
                return false;
            }
        }

        public boolean unsubscribe() {
            return bus.unsubscribe(this);
        }

        @Override
        public String toString() {
            return "Subscription[" + name + " '" + pattern + "' p=" + priority + "]";
        }
    }
}
