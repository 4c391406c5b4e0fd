package com.mythosmud.socket;

import com.mythosmud.core.util.SequenceGenerator;
import com.mythosmud.socket.broadcast.BroadcastContext;
import com.mythosmud.socket.broadcast.BroadcastCoordinator;
import com.mythosmud.socket.broadcast.ChannelBroadcastingStrategyFactory;
import com.mythosmud.socket.bus.DeadLetterStore;
import com.mythosmud.socket.bus.DistributedEventBus;
import com.mythosmud.socket.bus.InMemoryDeadLetterStore;
import com.mythosmud.socket.bus.LocalMessageBroker;
import com.mythosmud.socket.bus.MessageBroker;
import com.mythosmud.socket.bus.RedisDeadLetterStore;
import com.mythosmud.socket.config.SocketConfig;
import com.mythosmud.socket.connection.ConnectionHandleFactory;
import com.mythosmud.socket.connection.ConnectionRegistry;
import com.mythosmud.socket.http.HttpServer;
import com.mythosmud.socket.inbound.GameCommandProcessor;
import com.mythosmud.socket.inbound.InboundMessageHandlerFactory;
import com.mythosmud.socket.kafka.KafkaMessageBroker;
import com.mythosmud.socket.maintenance.StaleConnectionReaper;
import com.mythosmud.socket.metrics.MetricsService;
import com.mythosmud.socket.metrics.PrometheusMetricsExporter;
import com.mythosmud.socket.mute.InMemoryMuteListLookup;
import com.mythosmud.socket.mute.MuteListLookup;
import com.mythosmud.socket.mute.RedisMuteListLookup;
import com.mythosmud.socket.payload.PayloadOptimizer;
import com.mythosmud.socket.redis.RedisService;
import com.mythosmud.socket.stream.StreamHandler;
import com.mythosmud.socket.ws.WebSocketHandler;
import com.mythosmud.socket.ws.WebSocketUpgradeHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main entry point for a socket node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve players over WebSocket at /ws and server-sent events at /stream</li>
 *   <li>Route game events through channel strategies to local connections</li>
 *   <li>Fan out to and receive from other nodes through the message broker</li>
 *   <li>Expose /healthz, /readyz, /metrics and /admin/dead-letters</li>
 * </ul>
 * </p>
 */
public class SocketApp {
    private static final Logger log = LoggerFactory.getLogger(SocketApp.class);

    public static void main(String[] args) {
        SocketConfig config = SocketConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        if (config.isUseVirtualThreads()) {
            System.setProperty("reactor.schedulers.defaultBoundedElasticOnVirtualThreads", "true");
            log.info("reactor.schedulers.defaultBoundedElasticOnVirtualThreads = true");
        }

        log.info("Starting Socket node: {}", config.getNodeId());
        log.info("  Broker: {} ({})", config.getBrokerType(), config.getKafkaBootstrap());
        log.info("  Redis: {} (mutes={}, dead letters={})",
            config.getRedisUrl(), config.getMuteStore(), config.getDeadLetterStore());

        Clock clock = Clock.systemUTC();
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter();
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry(), config);

        RedisService redisService = usesRedis(config) ? new RedisService(config) : null;
        MuteListLookup muteLookup = switch (config.getMuteStore()) {
            case REDIS -> new RedisMuteListLookup(redisService.getCommands());
            case MEMORY -> new InMemoryMuteListLookup();
            case NONE -> MuteListLookup.NONE;
        };
        DeadLetterStore deadLetterStore = config.getDeadLetterStore() == SocketConfig.StoreType.REDIS
            ? new RedisDeadLetterStore(redisService.getCommands(), config.getNodeId(), config.getDeadLetterCapacity())
            : new InMemoryDeadLetterStore(config.getDeadLetterCapacity());

        MessageBroker broker = config.getBrokerType() == SocketConfig.BrokerType.KAFKA
            ? new KafkaMessageBroker(config)
            : new LocalMessageBroker();
        Scheduler dispatchScheduler = Schedulers.newSingle("bus-dispatch");
        DistributedEventBus eventBus = new DistributedEventBus(
            config, broker, deadLetterStore, metricsService, Schedulers.parallel(), dispatchScheduler, clock
        );

        PayloadOptimizer payloadOptimizer = new PayloadOptimizer(config);
        ConnectionRegistry registry = new ConnectionRegistry(payloadOptimizer, metricsService, clock);
        BroadcastContext context = BroadcastContext.builder()
            .nodeId(config.getNodeId())
            .registry(registry)
            .muteLookup(muteLookup)
            .bus(eventBus)
            .metrics(metricsService)
            .clock(clock)
            .build();
        BroadcastCoordinator coordinator = new BroadcastCoordinator(
            new ChannelBroadcastingStrategyFactory(), context, payloadOptimizer, new SequenceGenerator()
        );
        InboundMessageHandlerFactory inboundFactory = new InboundMessageHandlerFactory(
            coordinator, registry, GameCommandProcessor.unavailable(), metricsService
        );

        // Broker first, then bus consumers and subscriptions
        broker.start().block(Duration.ofSeconds(60));
        coordinator.start().block(Duration.ofSeconds(10));

        AtomicBoolean ready = new AtomicBoolean(false);
        ConnectionHandleFactory handleFactory = new ConnectionHandleFactory(config, clock);
        WebSocketHandler wsHandler = new WebSocketHandler(config, registry, handleFactory, inboundFactory, metricsService);
        StreamHandler streamHandler = new StreamHandler(config, registry, handleFactory, inboundFactory, metricsService);
        HttpServer httpServer = new HttpServer(
            config,
            new WebSocketUpgradeHandler(wsHandler),
            streamHandler,
            eventBus,
            metricsExporter,
            ready::get
        );
        httpServer.start();

        Duration maxIdle = Duration.ofSeconds(config.getStaleConnectionSec());
        Disposable reaper = new StaleConnectionReaper(
            registry, maxIdle, Duration.ofSeconds(Math.max(config.getStaleConnectionSec() / 3, 1)), Schedulers.parallel()
        ).start();

        ready.set(true);
        log.info("Socket node {} is ready", config.getNodeId());

        handleShutdown(config, ready, reaper, httpServer, coordinator, eventBus, broker, registry,
            dispatchScheduler, redisService);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static boolean usesRedis(SocketConfig config) {
        return config.getMuteStore() == SocketConfig.StoreType.REDIS
            || config.getDeadLetterStore() == SocketConfig.StoreType.REDIS;
    }

    private static void handleShutdown(SocketConfig config,
                                       AtomicBoolean ready,
                                       Disposable reaper,
                                       HttpServer httpServer,
                                       BroadcastCoordinator coordinator,
                                       DistributedEventBus eventBus,
                                       MessageBroker broker,
                                       ConnectionRegistry registry,
                                       Scheduler dispatchScheduler,
                                       RedisService redisService) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("nodeId", config.getNodeId());
            log.info("Shutdown signal received, initiating graceful shutdown...");
            ready.set(false);

            reaper.dispose();
            coordinator.stop();
            eventBus.close();
            registry.closeAll();
            httpServer.stop();
            broker.stop().block(Duration.ofSeconds(10));
            dispatchScheduler.dispose();

            if (redisService != null) {
                redisService.close();
            }

            log.info("Shutdown complete");
        }));
    }
}
