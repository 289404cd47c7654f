package me.go_gradually.soundrelay.application.relay.usecase;

import me.go_gradually.soundrelay.application.relay.model.RelayInstanceStatus;
import me.go_gradually.soundrelay.application.relay.policy.RelayPolicy;
import me.go_gradually.soundrelay.application.relay.port.RelayInstance;
import me.go_gradually.soundrelay.application.relay.port.RelayInstanceFactory;
import me.go_gradually.soundrelay.application.shared.model.OperatorAlert;
import me.go_gradually.soundrelay.application.shared.port.MetricsPort;
import me.go_gradually.soundrelay.application.shared.port.NotificationPort;
import me.go_gradually.soundrelay.application.shared.port.SchedulerPort;
import me.go_gradually.soundrelay.application.shared.timer.TimerRegistry;
import me.go_gradually.soundrelay.domain.relay.BrowserCookie;
import me.go_gradually.soundrelay.domain.relay.RelayInstanceId;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

public class RelayPool {
    private static final Logger log = Logger.getLogger(RelayPool.class.getName());
    private static final String HEALTH_TIMER = "health";
    private static final String MAINTENANCE_TIMER = "maintenance";
    private final RelayInstanceFactory instanceFactory;
    private final RelaySessionStore sessionStore;
    private final NotificationPort notifier;
    private final SchedulerPort scheduler;
    private final RelayPolicy policy;
    private final MetricsPort metrics;
    private final Map<RelayInstanceId, RelayInstance> instances = new LinkedHashMap<>();
    private final TimerRegistry<String> timers;
    private final AtomicBoolean exhaustionAlerted = new AtomicBoolean();

    public RelayPool(RelayInstanceFactory instanceFactory,
                     RelaySessionStore sessionStore,
                     NotificationPort notifier,
                     SchedulerPort scheduler,
                     RelayPolicy policy,
                     MetricsPort metrics) {
        this.instanceFactory = instanceFactory;
        this.sessionStore = sessionStore;
        this.notifier = notifier;
        this.scheduler = scheduler;
        this.policy = policy;
        this.metrics = metrics;
        this.timers = new TimerRegistry<>(scheduler);
    }

    public CompletableFuture<Void> initialize() {
        List<RelayInstance> created = new ArrayList<>();
        synchronized (this) {
            if (!instances.isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }
            for (int i = 1; i <= policy.poolSize(); i++) {
                RelayInstance instance = instanceFactory.create(RelayInstanceId.ofIndex(i));
                instances.put(instance.id(), instance);
                created.add(instance);
            }
        }
        // 첫 핸드셰이크 전에 저장된 쿠키를 복원해 둔다.
        created.forEach(this::restoreSession);
        CompletableFuture<?>[] connects = created.stream()
                .map(instance -> instance.initialize().exceptionally(error -> {
                    log.log(Level.WARNING, "relay.pool.initialize failure instance=" + instance.id(), error);
                    return null;
                }))
                .toArray(CompletableFuture[]::new);
        timers.repeat(HEALTH_TIMER, policy.healthCheckInterval(), this::performHealthChecks);
        timers.repeat(MAINTENANCE_TIMER, policy.sessionMaintenanceInterval(), this::maintainSessions);
        log.info("relay.pool.initialize size=" + created.size());
        return CompletableFuture.allOf(connects);
    }

    /**
     * 인증된 유휴 인스턴스 중 가장 오래 쓰지 않은 것. 인증된 인스턴스가 하나라도 있으면 빌 때까지 기다린다.
     */
    public CompletableFuture<Optional<RelayInstance>> getHealthyInstance() {
        return find(instance -> true);
    }

    /**
     * {@link #getHealthyInstance()}와 같지만 고른 인스턴스에 영상을 원자적으로 할당한다.
     */
    public CompletableFuture<Optional<RelayInstance>> acquire(String videoUrl) {
        Instant startedAt = scheduler.now();
        return find(instance -> instance.assignVideo(videoUrl))
                .whenComplete((found, error) ->
                        metrics.recordRelayAcquireLatency(Duration.between(startedAt, scheduler.now())));
    }

    /**
     * 인스턴스가 아직 {@code videoUrl}을 재생 중일 때만 해제한다. 그사이 다른 곡에 재할당됐으면 건드리지 않는다.
     */
    public void release(RelayInstanceId instanceId, String videoUrl) {
        getInstanceById(instanceId).ifPresent(instance -> {
            if (instance.releaseVideo(videoUrl)) {
                log.fine(() -> "relay.pool.release instance=" + instanceId + " video=" + videoUrl);
            } else {
                log.fine(() -> "relay.pool.release skipped instance=" + instanceId + " video=" + videoUrl);
            }
        });
    }

    public Optional<RelayInstance> getInstanceById(RelayInstanceId instanceId) {
        synchronized (this) {
            return Optional.ofNullable(instances.get(instanceId));
        }
    }

    public List<RelayInstance> getAllInstances() {
        synchronized (this) {
            return List.copyOf(instances.values());
        }
    }

    public List<RelayInstanceStatus> statuses() {
        return getAllInstances().stream().map(RelayInstanceStatus::of).toList();
    }

    public CompletableFuture<Void> restart(RelayInstanceId instanceId) {
        RelayInstance instance = getInstanceById(instanceId)
                .orElseThrow(() -> new NoSuchElementException("Unknown relay instance: " + instanceId));
        log.info("relay.pool.restart instance=" + instanceId + " reason=operator");
        metrics.incrementRelayRestart();
        return instance.restart();
    }

    public void maintainSessions() {
        for (RelayInstance instance : getAllInstances()) {
            try {
                if (instance.isAuthenticated()) {
                    sessionStore.save(instance.id(), instance.authCookies(), policy.sessionTtl());
                    continue;
                }
                if (!restoreSession(instance)) {
                    log.warning("relay.pool.session missing instance=" + instance.id());
                    notifier.notifyOperator(OperatorAlert.warning(
                            "Relay authentication required",
                            "Relay instance " + instance.id() + " has no valid session. Manual login is required."
                    ));
                }
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "relay.pool.session failure instance=" + instance.id(), e);
            }
        }
    }

    public void performHealthChecks() {
        for (RelayInstance instance : getAllInstances()) {
            instance.healthCheck()
                    .exceptionally(error -> false)
                    .thenAccept(healthy -> {
                        if (healthy) {
                            return;
                        }
                        log.warning("relay.pool.health unhealthy instance=" + instance.id());
                        metrics.incrementRelayRestart();
                        instance.restart().whenComplete((ignored, error) -> {
                            if (error != null) {
                                log.log(Level.WARNING, "relay.pool.restart failure instance=" + instance.id(), error);
                            }
                        });
                    });
        }
    }

    public void shutdown() {
        timers.cancelAll();
        List<RelayInstance> snapshot;
        synchronized (this) {
            snapshot = List.copyOf(instances.values());
            instances.clear();
        }
        for (RelayInstance instance : snapshot) {
            try {
                instance.shutdown();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "relay.pool.shutdown failure instance=" + instance.id(), e);
            }
        }
        log.info("relay.pool.shutdown size=" + snapshot.size());
    }

    private boolean restoreSession(RelayInstance instance) {
        Optional<List<BrowserCookie>> cookies = sessionStore.load(instance.id());
        cookies.ifPresent(instance::restoreSession);
        cookies.ifPresent(restored ->
                log.info("relay.pool.session restored instance=" + instance.id() + " cookies=" + restored.size()));
        return cookies.isPresent();
    }

    private CompletableFuture<Optional<RelayInstance>> find(Predicate<RelayInstance> claim) {
        Optional<RelayInstance> available = claimIdle(claim);
        if (available.isPresent()) {
            exhaustionAlerted.set(false);
            return CompletableFuture.completedFuture(available);
        }
        if (getAllInstances().stream().noneMatch(RelayInstance::isAuthenticated)) {
            log.severe("relay.pool.exhausted reason=no_authenticated_instance");
            metrics.incrementRelayPoolExhausted();
            // 인증된 인스턴스가 다시 보일 때까지 알림은 한 번만 보낸다.
            if (exhaustionAlerted.compareAndSet(false, true)) {
                notifier.notifyOperator(OperatorAlert.critical(
                        "Relay pool requires authentication",
                        "No authenticated relay instance is available. Log in to at least one instance."
                ));
            }
            return CompletableFuture.completedFuture(Optional.empty());
        }
        exhaustionAlerted.set(false);
        CompletableFuture<Optional<RelayInstance>> result = new CompletableFuture<>();
        pollUntil(scheduler.now().plus(policy.acquireTimeout()), claim, result);
        return result;
    }

    private void pollUntil(Instant deadline,
                           Predicate<RelayInstance> claim,
                           CompletableFuture<Optional<RelayInstance>> result) {
        scheduler.schedule(() -> {
            Optional<RelayInstance> available = claimIdle(claim);
            if (available.isPresent()) {
                result.complete(available);
                return;
            }
            if (!scheduler.now().isBefore(deadline)) {
                log.warning("relay.pool.acquire timeout");
                result.complete(Optional.empty());
                return;
            }
            pollUntil(deadline, claim, result);
        }, policy.acquirePollInterval());
    }

    private synchronized Optional<RelayInstance> claimIdle(Predicate<RelayInstance> claim) {
        List<RelayInstance> candidates = instances.values().stream()
                .filter(RelayInstance::isAuthenticated)
                .filter(instance -> instance.currentVideo().isEmpty())
                .sorted(Comparator.comparing(RelayInstance::lastUsedAt))
                .toList();
        for (RelayInstance candidate : candidates) {
            if (claim.test(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
