package com.mythosmud.socket.bus;

import com.mythosmud.core.metrics.MetricsNames;
import com.mythosmud.core.msg.RelayMessage;
import com.mythosmud.core.msg.SubjectPattern;
import com.mythosmud.core.util.BytesUtils;
import com.mythosmud.core.util.JitterBackoff;
import com.mythosmud.core.util.JsonUtils;
import com.mythosmud.socket.config.SocketConfig;
import com.mythosmud.socket.metrics.MetricsService;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.BufferOverflowStrategy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Pub/sub over a {@link MessageBroker} with retries and a dead-letter store.
 * <p>
 * <b>Publishing:</b> {@link #publish} only enqueues. Attempts run on the retry scheduler;
 * a failed attempt (broker error, timeout, open circuit) is retried with jittered exponential
 * backoff until {@code maxAttempts} attempts were made, then the message is dead-lettered
 * exactly once and never retried again.
 * </p>
 * <p>
 * <b>Ordering:</b> publishes on one subject form a lane. Only the head of a lane is in flight;
 * the next one starts after the head is delivered or dead-lettered, so the broker sees each
 * subject's messages in publish order. Different subjects do not wait for each other.
 * </p>
 * <p>
 * <b>Consuming:</b> broker messages are matched against subscriptions and the resulting
 * callback invocations are queued in a bounded buffer drained one at a time on the dispatch
 * scheduler. When the buffer is full the oldest invocation is dropped.
 * </p>
 */
public class DistributedEventBus implements IEventBus {
    private static final Logger log = LoggerFactory.getLogger(DistributedEventBus.class);

    private final MessageBroker broker;
    private final DeadLetterStore deadLetterStore;
    private final MetricsService metricsService;
    private final Scheduler retryScheduler;
    private final Scheduler dispatchScheduler;
    private final Clock clock;
    private final CircuitBreaker circuitBreaker;

    private final int maxAttempts;
    private final Duration baseBackoff;
    private final Duration maxBackoff;
    private final Duration jitter;
    private final Duration publishTimeout;
    private final int callbackQueueSize;

    private final List<BusSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicInteger inFlight = new AtomicInteger();
    // subject -> tasks waiting for the broker, head is the one in flight
    private final ConcurrentMap<String, Deque<PublishTask>> lanes = new ConcurrentHashMap<>();
    private volatile Disposable inbound;

    public DistributedEventBus(SocketConfig config,
                               MessageBroker broker,
                               DeadLetterStore deadLetterStore,
                               MetricsService metricsService,
                               Scheduler retryScheduler,
                               Scheduler dispatchScheduler,
                               Clock clock) {
        this.broker = broker;
        this.deadLetterStore = deadLetterStore;
        this.metricsService = metricsService;
        this.retryScheduler = retryScheduler;
        this.dispatchScheduler = dispatchScheduler;
        this.clock = clock;

        this.maxAttempts = Math.max(config.getBusMaxAttempts(), 1);
        this.baseBackoff = Duration.ofMillis(config.getBusBaseBackoffMs());
        this.maxBackoff = Duration.ofMillis(config.getBusMaxBackoffMs());
        this.jitter = Duration.ofMillis(config.getBusJitterMs());
        this.publishTimeout = Duration.ofMillis(config.getBusPublishTimeoutMs());
        this.callbackQueueSize = config.getBusCallbackQueueSize();

        this.circuitBreaker = CircuitBreaker.of("broker-" + config.getNodeId(), CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(5)
            .minimumNumberOfCalls(5)
            .failureRateThreshold(100)
            .waitDurationInOpenState(Duration.ofSeconds(60))
            .permittedNumberOfCallsInHalfOpenState(2)
            .build());
        this.circuitBreaker.getEventPublisher()
            .onStateTransition(event -> log.warn("Broker circuit breaker: {}", event.getStateTransition()));

        metricsService.registerGauge(MetricsNames.BUS_SUBSCRIPTIONS, "Active bus subscriptions", subscriptions::size);
    }

    @Override
    public Mono<Void> start() {
        return Mono.fromRunnable(() -> {
            inbound = broker.messages()
                .doOnNext(message -> metricsService.recordNetworkBrokerInbound(BytesUtils.getBytesLength(message.payload())))
                .concatMapIterable(this::matchSubscriptions)
                .onBackpressureBuffer(callbackQueueSize, this::onCallbackDropped, BufferOverflowStrategy.DROP_OLDEST)
                .publishOn(dispatchScheduler, 1)
                .subscribe(
                    Invocation::run,
                    err -> log.error("Bus inbound stream terminated", err)
                );
            log.info("Event bus consuming broker messages");
        });
    }

    @Override
    public boolean publish(String subject, RelayMessage message) {
        if (closed.get()) {
            log.warn("Rejecting publish on {}: bus is closed", subject);
            return false;
        }
        String payload = JsonUtils.writeValueAsString(message);
        PublishTask task = new PublishTask(UUID.randomUUID().toString(), subject, message, payload);
        inFlight.incrementAndGet();
        enqueue(task);
        return true;
    }

    @Override
    public BusSubscription subscribe(String pattern, Consumer<RelayMessage> callback) {
        SubjectPattern compiled = SubjectPattern.compile(pattern);
        BusSubscription subscription = new BusSubscription(
            UUID.randomUUID().toString(), compiled, callback, subscriptions::remove
        );
        subscriptions.add(subscription);
        log.debug("Subscribed to {}", compiled);
        return subscription;
    }

    @Override
    public Flux<DeadLetterEntry> deadLetters() {
        return deadLetterStore.entries();
    }

    /**
     * Publishes that are neither delivered nor dead-lettered yet.
     */
    public int inFlight() {
        return inFlight.get();
    }

    public CircuitBreaker.State circuitState() {
        return circuitBreaker.getState();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        Disposable current = inbound;
        if (current != null) {
            current.dispose();
        }
        new ArrayList<>(subscriptions).forEach(BusSubscription::dispose);
        log.info("Event bus closed ({} publishes still in flight)", inFlight.get());
    }

    private void enqueue(PublishTask task) {
        AtomicBoolean head = new AtomicBoolean();
        lanes.compute(task.getSubject(), (subject, lane) -> {
            Deque<PublishTask> queue = lane == null ? new ArrayDeque<>() : lane;
            queue.addLast(task);
            head.set(queue.size() == 1);
            return queue;
        });
        if (head.get()) {
            retryScheduler.schedule(() -> attempt(task));
        }
    }

    private void advanceLane(PublishTask finished) {
        AtomicReference<PublishTask> next = new AtomicReference<>();
        lanes.computeIfPresent(finished.getSubject(), (subject, queue) -> {
            if (queue.peekFirst() != finished) {
                return queue;
            }
            queue.pollFirst();
            next.set(queue.peekFirst());
            return queue.isEmpty() ? null : queue;
        });
        PublishTask head = next.get();
        if (head != null) {
            retryScheduler.schedule(() -> attempt(head));
        }
    }

    private void attempt(PublishTask task) {
        if (closed.get() && task.attemptCount() > 0) {
            deadLetter(task, new IllegalStateException("bus closed before retry"));
            return;
        }
        int attempt = task.beginAttempt();
        long startNanos = System.nanoTime();

        Mono.defer(() -> broker.publish(task.getSubject(), task.getPayload()))
            .timeout(publishTimeout, retryScheduler)
            .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
            .subscribe(
                ignored -> {
                },
                err -> onAttemptFailed(task, attempt, err),
                () -> onDelivered(task, startNanos)
            );
    }

    private void onDelivered(PublishTask task, long startNanos) {
        if (!task.finish(PublishTask.DeliveryState.DELIVERED)) {
            return;
        }
        inFlight.decrementAndGet();
        metricsService.recordBusPublishLatency(startNanos);
        metricsService.recordBusPublish("delivered");
        metricsService.recordNetworkBrokerOutbound(BytesUtils.getBytesLength(task.getPayload()));
        if (task.attemptCount() > 1) {
            log.info("Published {} on {} after {} attempts", task.getId(), task.getSubject(), task.attemptCount());
        }
        advanceLane(task);
    }

    private void onAttemptFailed(PublishTask task, int attempt, Throwable error) {
        task.recordFailure(clock.instant(), error);
        if (attempt >= maxAttempts) {
            deadLetter(task, error);
            return;
        }
        Duration delay = JitterBackoff.next(attempt - 1, baseBackoff, maxBackoff, jitter);
        log.warn("Publish {} on {} failed (attempt {}/{}): {}. Retrying in {} ms",
            task.getId(), task.getSubject(), attempt, maxAttempts, error.toString(), delay.toMillis());
        metricsService.recordBusPublish("retried");
        retryScheduler.schedule(() -> attempt(task), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void deadLetter(PublishTask task, Throwable error) {
        task.recordFailure(clock.instant(), error);
        if (!task.finish(PublishTask.DeliveryState.DEAD_LETTERED)) {
            return;
        }
        inFlight.decrementAndGet();
        DeadLetterEntry entry = new DeadLetterEntry(
            task.getId(),
            task.getSubject(),
            task.getMessage(),
            task.attemptCount(),
            task.getLastError(),
            task.getFirstFailedAt(),
            clock.instant()
        );
        log.error("Dead-lettering publish {} on {} after {} attempts: {}",
            task.getId(), task.getSubject(), task.attemptCount(), task.getLastError());
        metricsService.recordBusPublish("dead_lettered");
        deadLetterStore.store(entry).subscribe(
            ignored -> {
            },
            err -> log.error("Failed to store dead letter {}", task.getId(), err)
        );
        advanceLane(task);
    }

    private List<Invocation> matchSubscriptions(BrokerMessage brokerMessage) {
        List<Invocation> invocations = new ArrayList<>(1);
        RelayMessage message = null;
        for (BusSubscription subscription : subscriptions) {
            if (!subscription.accepts(brokerMessage.subject())) {
                continue;
            }
            if (message == null) {
                message = decode(brokerMessage);
                if (message == null) {
                    return invocations;
                }
            }
            invocations.add(new Invocation(subscription, message));
        }
        return invocations;
    }

    private RelayMessage decode(BrokerMessage brokerMessage) {
        try {
            return JsonUtils.readValue(brokerMessage.payload(), RelayMessage.class);
        } catch (IllegalArgumentException e) {
            log.warn("Dropping unreadable message on {}: {}", brokerMessage.subject(), e.getMessage());
            metricsService.recordDrop("malformed_relay");
            return null;
        }
    }

    private void onCallbackDropped(Invocation dropped) {
        log.warn("Bus callback queue full ({}), dropping oldest callback for {} on {}",
            callbackQueueSize, dropped.subscription(), dropped.message().getSubject());
        metricsService.recordDrop("callback_queue_full");
    }

    private record Invocation(BusSubscription subscription, RelayMessage message) {
        void run() {
            try {
                subscription.deliver(message);
            } catch (RuntimeException e) {
                log.error("Bus callback {} failed for {}", subscription, message.getSubject(), e);
            }
        }
    }
}
