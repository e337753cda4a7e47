package com.aicli.isolation.monitor;

import com.aicli.isolation.IsolationException;
import com.aicli.isolation.config.IsolationPolicy;
import com.aicli.isolation.config.MonitorOptions;
import com.aicli.isolation.core.logging.MdcContext;
import com.aicli.isolation.core.logging.SecurityAuditLog;
import com.aicli.isolation.core.metrics.IsolationMetrics;
import com.aicli.isolation.core.model.Severity;
import com.aicli.isolation.core.model.WorkspaceMetrics;
import com.aicli.isolation.monitor.detect.AnomalyDetector;
import com.aicli.isolation.monitor.detect.AnomalyFinding;
import com.aicli.isolation.monitor.detect.DetectorKind;
import com.aicli.isolation.resource.ResourceManager;
import com.aicli.isolation.resource.ResourcePreset;
import com.aicli.isolation.resource.ResourceViolation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Background security monitor for workspace containers.
 * <p>
 * While running, a single scheduler thread performs one tick per interval: resource checks, then
 * network, process and (when audit logging is enabled) filesystem detectors. Every finding is
 * turned into a {@link SecurityAlert} that is offered to the bounded {@link AlertChannel} and
 * fanned out to subscribers on a bounded dispatch pool. A full channel drops the alert.
 * <p>
 * The violation history and the subscriber registry are guarded by independent read/write
 * locks; no lock is held while callbacks run.
 */
public class SecurityMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SecurityMonitor.class);

    public static final String WILDCARD = "*";

    static final String PRIVILEGE_ESCALATION_PAUSED = "CRITICAL: Privilege escalation detected - container paused";
    static final String PRIVILEGE_ESCALATION_PAUSE_FAILED =
            "CRITICAL: Privilege escalation detected - container pause failed";

    private final IsolationPolicy policy;
    private final ResourceManager resourceManager;
    private final MonitorOptions options;
    private final WorkspaceMetricsSource metricsSource;
    private final List<AnomalyDetector> detectors;
    private final ContainerRemediator remediator;
    private final SecurityAuditLog auditLog;
    private final IsolationMetrics metrics;

    private final ReadWriteLock violationsLock = new ReentrantReadWriteLock();
    private final Map<String, Deque<ResourceViolation>> violations = new HashMap<>();

    private final ReadWriteLock subscribersLock = new ReentrantReadWriteLock();
    private final Map<String, List<AlertHandler>> subscribers = new HashMap<>();

    private final Map<String, Set<RemediationAction>> heightened = new ConcurrentHashMap<>();

    private final LongAdder totalAlerts = new LongAdder();
    private final LongAdder droppedAlerts = new LongAdder();
    private final Map<Severity, LongAdder> alertsBySeverity = new EnumMap<>(Severity.class);

    private final ThreadPoolExecutor dispatchPool;

    private final Object stateLock = new Object();
    private ScheduledExecutorService scheduler;
    private volatile AlertChannel alertChannel;
    private volatile boolean running;

    public SecurityMonitor(IsolationPolicy policy,
                           ResourceManager resourceManager,
                           MonitorOptions options,
                           WorkspaceMetricsSource metricsSource,
                           List<AnomalyDetector> detectors,
                           ContainerRemediator remediator,
                           SecurityAuditLog auditLog,
                           IsolationMetrics metrics) {
        this.policy = policy;
        this.resourceManager = resourceManager;
        this.options = options;
        this.metricsSource = metricsSource != null ? metricsSource : WorkspaceMetricsSource.NONE;
        this.detectors = detectors != null ? List.copyOf(detectors) : List.of();
        this.remediator = remediator != null ? remediator : ContainerRemediator.NONE;
        this.auditLog = auditLog != null ? auditLog : new SecurityAuditLog();
        this.metrics = metrics;
        for (Severity severity : Severity.values()) {
            alertsBySeverity.put(severity, new LongAdder());
        }
        this.alertChannel = new AlertChannel(options.alertCapacity());
        this.alertChannel.close();
        this.dispatchPool = newDispatchPool(options);
    }

    /** Monitor with defaults and no runtime collaborators, handy for embedding and tests. */
    public SecurityMonitor(IsolationPolicy policy) {
        this(policy, new ResourceManager(policy), MonitorOptions.defaults(),
                WorkspaceMetricsSource.NONE, List.of(), ContainerRemediator.NONE, new SecurityAuditLog(), null);
    }

    private static ThreadPoolExecutor newDispatchPool(MonitorOptions options) {
        AtomicInteger counter = new AtomicInteger();
        var pool = new ThreadPoolExecutor(
                options.dispatchThreads(), options.dispatchThreads(),
                60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(options.dispatchQueueCapacity()),
                r -> {
                    Thread t = new Thread(r, "alert-dispatch-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
        pool.allowCoreThreadTimeOut(true);
        return pool;
    }

    // -- Lifecycle --------------------------------------------------------

    /**
     * Starts the periodic checks. Calling it while running returns the current channel.
     *
     * @return the channel receiving every emitted alert until {@link #stopMonitoring()}
     */
    public AlertChannel startMonitoring() {
        synchronized (stateLock) {
            if (running) {
                return alertChannel;
            }
            alertChannel = new AlertChannel(options.alertCapacity());
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "security-monitor");
                t.setDaemon(true);
                return t;
            });
            long intervalMs = options.interval().toMillis();
            scheduler.scheduleWithFixedDelay(this::performSecurityCheck, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
            running = true;
            log.info("Security monitoring started (interval {})", options.interval());
            return alertChannel;
        }
    }

    /**
     * Stops the periodic checks and closes the alert channel. A no-op when already stopped.
     */
    public void stopMonitoring() {
        ScheduledExecutorService toStop;
        synchronized (stateLock) {
            if (!running) {
                return;
            }
            running = false;
            toStop = scheduler;
            scheduler = null;
            alertChannel.close();
        }
        toStop.shutdownNow();
        log.info("Security monitoring stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /** Stops monitoring and releases the dispatch pool. The monitor cannot be restarted afterwards. */
    @Override
    public void close() {
        stopMonitoring();
        dispatchPool.shutdown();
    }

    // -- Periodic checks ---------------------------------------------------

    /**
     * One monitor tick. Each check is isolated; a failing check is logged and the rest still run.
     */
    void performSecurityCheck() {
        long start = System.nanoTime();
        List<WorkspaceMetrics> samples = collectSamples();

        runCheck("resource", () -> checkResourceUsage(samples));
        runCheck("network", () -> runDetectors(DetectorKind.NETWORK, samples));
        runCheck("process", () -> runDetectors(DetectorKind.PROCESS, samples));
        if (policy.current().enableAuditLog()) {
            runCheck("filesystem", () -> runDetectors(DetectorKind.FILESYSTEM, samples));
        }

        if (metrics != null) {
            metrics.recordMonitorTick(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        }
    }

    private List<WorkspaceMetrics> collectSamples() {
        try {
            List<WorkspaceMetrics> samples = metricsSource.collect();
            return samples != null ? samples : List.of();
        } catch (RuntimeException e) {
            log.warn("Failed to collect workspace metrics: {}", e.getMessage());
            return List.of();
        }
    }

    private void runCheck(String name, Runnable check) {
        MdcContext.setCheck(name);
        try {
            check.run();
        } catch (RuntimeException e) {
            log.warn("Security check '{}' failed: {}", name, e.getMessage(), e);
        } finally {
            MdcContext.clear();
        }
    }

    private void checkResourceUsage(List<WorkspaceMetrics> samples) {
        for (WorkspaceMetrics sample : samples) {
            for (ResourceViolation violation : resourceManager.validateResourceUsage(sample)) {
                reportViolation(sample.workspaceId(), violation);
            }
        }
    }

    private void runDetectors(DetectorKind kind, List<WorkspaceMetrics> samples) {
        for (AnomalyDetector detector : detectors) {
            if (detector.kind() != kind) {
                continue;
            }
            List<AnomalyFinding> findings;
            try {
                findings = detector.detect(samples);
            } catch (RuntimeException e) {
                log.warn("Detector '{}' failed: {}", detector.name(), e.getMessage());
                continue;
            }
            for (AnomalyFinding finding : findings) {
                applyFinding(finding);
            }
        }
    }

    private void applyFinding(AnomalyFinding finding) {
        if (finding.isBreach()) {
            reportSecurityBreach(finding.workspaceId(), SecurityBreach.of(
                    finding.breachType(), finding.message(), finding.evidence(), finding.severity()));
        } else {
            sendAlert(new SecurityAlert(finding.alertType(), finding.workspaceId(), finding.severity(),
                    finding.message(), Instant.now(), finding.evidence()));
        }
    }

    // -- Reporting ---------------------------------------------------------

    /**
     * Records a violation in the workspace history and emits a {@code resource_violation} alert.
     */
    public void reportViolation(String workspaceId, ResourceViolation violation) {
        requireWorkspaceId(workspaceId);
        if (violation == null) {
            throw IsolationException.invalidInput("violation cannot be nil");
        }

        violationsLock.writeLock().lock();
        try {
            Deque<ResourceViolation> history = violations.computeIfAbsent(workspaceId, k -> new ArrayDeque<>());
            history.addLast(violation);
            while (history.size() > options.maxViolationsPerWorkspace()) {
                history.removeFirst();
            }
        } finally {
            violationsLock.writeLock().unlock();
        }

        if (metrics != null) {
            metrics.recordViolation(violation.type());
        }
        sendAlert(new SecurityAlert(AlertType.RESOURCE_VIOLATION, workspaceId, violation.severity(),
                "Resource violation detected: " + violation.description(), Instant.now(), violation));
    }

    /**
     * Emits a {@code security_breach} alert at the breach's risk level, then runs the response.
     */
    public BreachResponse reportSecurityBreach(String workspaceId, SecurityBreach breach) {
        requireWorkspaceId(workspaceId);
        if (breach == null) {
            throw IsolationException.invalidInput("breach cannot be nil");
        }
        sendAlert(new SecurityAlert(AlertType.SECURITY_BREACH, workspaceId, breach.riskLevel(),
                "Security breach detected: " + breach.description(), Instant.now(), breach));
        return handleSecurityBreach(workspaceId, breach);
    }

    /**
     * Runs the response for the breach's type. Enforcement goes through the
     * {@link ContainerRemediator}; enforcement failures are logged and reported in the response.
     */
    public BreachResponse handleSecurityBreach(String workspaceId, SecurityBreach breach) {
        requireWorkspaceId(workspaceId);
        if (breach == null) {
            throw IsolationException.invalidInput("breach cannot be nil");
        }

        BreachType type = breach.breachType();
        Set<RemediationAction> failed = EnumSet.noneOf(RemediationAction.class);
        MdcContext.setBreach(workspaceId, type.value());
        try {
            if (metrics != null) {
                metrics.recordBreach(type.value());
            }
            Set<RemediationAction> actions = switch (type) {
                case PRIVILEGE_ESCALATION -> {
                    enforce(RemediationAction.PAUSE_CONTAINER, failed, () -> remediator.pauseWorkspace(workspaceId));
                    String message = failed.contains(RemediationAction.PAUSE_CONTAINER)
                            ? PRIVILEGE_ESCALATION_PAUSE_FAILED : PRIVILEGE_ESCALATION_PAUSED;
                    sendAlert(new SecurityAlert(AlertType.SECURITY_BREACH, workspaceId, Severity.CRITICAL,
                            message, Instant.now(), breach));
                    audit(workspaceId, "privilege_escalation", breach);
                    yield EnumSet.of(RemediationAction.PAUSE_CONTAINER, RemediationAction.CRITICAL_ALERT,
                            RemediationAction.AUDIT_LOG);
                }
                case SUSPICIOUS_NETWORK_ACTIVITY -> {
                    enforce(RemediationAction.RESTRICT_NETWORK, failed, () -> remediator.restrictNetwork(workspaceId));
                    heighten(workspaceId, RemediationAction.HEIGHTEN_MONITORING);
                    yield EnumSet.of(RemediationAction.RESTRICT_NETWORK, RemediationAction.HEIGHTEN_MONITORING);
                }
                case UNAUTHORIZED_FILE_ACCESS -> {
                    heighten(workspaceId, RemediationAction.HEIGHTEN_FILESYSTEM_AUDIT);
                    audit(workspaceId, "unauthorized_file_access", breach);
                    yield EnumSet.of(RemediationAction.HEIGHTEN_FILESYSTEM_AUDIT, RemediationAction.AUDIT_LOG);
                }
                case RESOURCE_EXHAUSTION -> {
                    enforce(RemediationAction.TIGHTEN_RESOURCE_LIMITS, failed, () -> remediator.applyResourceLimits(
                            workspaceId, resourceManager.getResourceLimitPreset(ResourcePreset.MINIMAL)));
                    heighten(workspaceId, RemediationAction.HEIGHTEN_PROCESS_MONITORING);
                    yield EnumSet.of(RemediationAction.TIGHTEN_RESOURCE_LIMITS,
                            RemediationAction.HEIGHTEN_PROCESS_MONITORING);
                }
                case GENERIC -> {
                    log.warn("Unhandled breach type '{}' for workspace {}: {}",
                            breach.type(), workspaceId, breach.description());
                    heighten(workspaceId, RemediationAction.HEIGHTEN_MONITORING);
                    audit(workspaceId, "security_breach", breach);
                    yield EnumSet.of(RemediationAction.AUDIT_LOG, RemediationAction.HEIGHTEN_MONITORING);
                }
            };
            log.info("Handled {} breach for workspace {}: {}", type.value(), workspaceId, actions);
            return new BreachResponse(workspaceId, type, actions, failed);
        } finally {
            MdcContext.clearBreach();
        }
    }

    private void enforce(RemediationAction action, Set<RemediationAction> failed, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.error("Remediation {} failed: {}", action, e.getMessage(), e);
            failed.add(action);
        }
    }

    private void heighten(String workspaceId, RemediationAction action) {
        heightened.computeIfAbsent(workspaceId, k -> ConcurrentHashMap.newKeySet()).add(action);
    }

    private void audit(String workspaceId, String event, SecurityBreach breach) {
        var details = new LinkedHashMap<String, Object>();
        details.put("type", breach.type());
        details.put("description", breach.description());
        details.put("riskLevel", breach.riskLevel());
        details.put("evidence", breach.evidence());
        auditLog.record(workspaceId, event, details);
    }

    // -- Alert delivery ----------------------------------------------------

    /**
     * Offers the alert to the channel without blocking. Accepted alerts are counted and handed to
     * the subscribers of the workspace and of {@link #WILDCARD}; a full or closed channel drops it.
     */
    void sendAlert(SecurityAlert alert) {
        if (!alertChannel.offer(alert)) {
            droppedAlerts.increment();
            if (metrics != null) {
                metrics.recordAlertDropped("channel_full");
            }
            log.warn("Alert channel full or closed, dropping {} alert for workspace {}",
                    alert.type().value(), alert.workspaceId());
            return;
        }

        totalAlerts.increment();
        alertsBySeverity.get(alert.severity() != null ? alert.severity() : Severity.INFO).increment();
        if (metrics != null) {
            metrics.recordAlert(alert.type().value(),
                    alert.severity() != null ? alert.severity().value() : Severity.INFO.value());
        }
        notifySubscribers(alert);
    }

    private void notifySubscribers(SecurityAlert alert) {
        List<AlertHandler> targets = new ArrayList<>();
        subscribersLock.readLock().lock();
        try {
            targets.addAll(subscribers.getOrDefault(alert.workspaceId(), List.of()));
            targets.addAll(subscribers.getOrDefault(WILDCARD, List.of()));
        } finally {
            subscribersLock.readLock().unlock();
        }

        for (AlertHandler handler : targets) {
            try {
                dispatchPool.execute(() -> deliverSafely(handler, alert));
            } catch (RejectedExecutionException e) {
                if (metrics != null) {
                    metrics.recordAlertDropped("dispatch_rejected");
                }
                log.warn("Alert dispatch queue full, skipping subscriber delivery for workspace {}",
                        alert.workspaceId());
            }
        }
    }

    private void deliverSafely(AlertHandler handler, SecurityAlert alert) {
        try {
            handler.onAlert(alert);
        } catch (Exception e) {
            log.warn("Alert subscriber threw exception for workspace {}: {}",
                    alert.workspaceId(), e.getMessage());
        }
    }

    /**
     * Registers a callback for alerts of one workspace, or of every workspace with {@link #WILDCARD}.
     */
    public void subscribe(String workspaceId, AlertHandler handler) {
        requireWorkspaceId(workspaceId);
        if (handler == null) {
            throw IsolationException.invalidInput("handler cannot be nil");
        }
        subscribersLock.writeLock().lock();
        try {
            subscribers.computeIfAbsent(workspaceId, k -> new ArrayList<>()).add(handler);
        } finally {
            subscribersLock.writeLock().unlock();
        }
        log.debug("Subscribed to alerts for {}", workspaceId);
    }

    /** Removes every callback registered under the key. */
    public void unsubscribe(String workspaceId) {
        subscribersLock.writeLock().lock();
        try {
            subscribers.remove(workspaceId);
        } finally {
            subscribersLock.writeLock().unlock();
        }
    }

    // -- Queries -----------------------------------------------------------

    public SecurityDashboard getSecurityDashboard() {
        Map<String, Integer> summary = new TreeMap<>();
        List<String> active = new ArrayList<>();
        violationsLock.readLock().lock();
        try {
            for (Map.Entry<String, Deque<ResourceViolation>> entry : violations.entrySet()) {
                if (entry.getValue().isEmpty()) {
                    continue;
                }
                active.add(entry.getKey());
                for (ResourceViolation violation : entry.getValue()) {
                    summary.merge(violation.type(), 1, Integer::sum);
                }
            }
        } finally {
            violationsLock.readLock().unlock();
        }
        Collections.sort(active);

        return new SecurityDashboard(
                totalAlerts.sum(),
                alertsBySeverity.get(Severity.CRITICAL).sum(),
                alertsBySeverity.get(Severity.WARNING).sum(),
                droppedAlerts.sum(),
                alertChannel.size(),
                summary,
                Instant.now(),
                running ? "active" : "stopped",
                active);
    }

    /**
     * @return a snapshot of the workspace's violation history, oldest first
     */
    public List<ResourceViolation> getWorkspaceViolations(String workspaceId) {
        violationsLock.readLock().lock();
        try {
            Deque<ResourceViolation> history = violations.get(workspaceId);
            return history == null ? List.of() : List.copyOf(history);
        } finally {
            violationsLock.readLock().unlock();
        }
    }

    /**
     * Clears the history of one workspace, or of all workspaces when the ID is null or empty.
     */
    public void clearViolations(String workspaceId) {
        violationsLock.writeLock().lock();
        try {
            if (workspaceId == null || workspaceId.isEmpty()) {
                violations.clear();
            } else {
                violations.remove(workspaceId);
            }
        } finally {
            violationsLock.writeLock().unlock();
        }
    }

    /**
     * @return workspaces under heightened monitoring and the focus requested for each
     */
    public Map<String, Set<RemediationAction>> getHeightenedWorkspaces() {
        Map<String, Set<RemediationAction>> snapshot = new TreeMap<>();
        heightened.forEach((id, actions) -> snapshot.put(id, Set.copyOf(actions)));
        return snapshot;
    }

    public AlertChannel getAlertChannel() {
        return alertChannel;
    }

    private static void requireWorkspaceId(String workspaceId) {
        if (workspaceId == null || workspaceId.isBlank()) {
            throw IsolationException.invalidInput("workspace ID cannot be empty");
        }
    }
}
