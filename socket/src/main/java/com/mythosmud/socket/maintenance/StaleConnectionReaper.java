package com.mythosmud.socket.maintenance;

import com.mythosmud.socket.connection.IConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;

/**
 * Periodically removes connections that have not been seen for {@code maxIdle}.
 */
public class StaleConnectionReaper {
    private static final Logger log = LoggerFactory.getLogger(StaleConnectionReaper.class);

    private final IConnectionRegistry registry;
    private final Duration maxIdle;
    private final Duration period;
    private final Scheduler scheduler;

    public StaleConnectionReaper(IConnectionRegistry registry, Duration maxIdle, Duration period, Scheduler scheduler) {
        this.registry = registry;
        this.maxIdle = maxIdle;
        this.period = period;
        this.scheduler = scheduler;
    }

    public Disposable start() {
        log.info("Pruning connections idle for more than {}s every {}s", maxIdle.toSeconds(), period.toSeconds());
        return Flux.interval(period, scheduler)
            .map(tick -> registry.pruneStale(maxIdle))
            .filter(pruned -> pruned > 0)
            .subscribe(
                pruned -> log.info("Pruned {} stale connections", pruned),
                err -> log.error("Stale connection reaper stopped", err)
            );
    }
}
