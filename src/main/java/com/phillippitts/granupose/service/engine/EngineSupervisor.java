package com.phillippitts.granupose.service.engine;

import com.phillippitts.granupose.config.engine.EngineProperties;
import com.phillippitts.granupose.config.engine.EngineWatchdogProperties;
import com.phillippitts.granupose.domain.engine.EngineOperationResult;
import com.phillippitts.granupose.domain.engine.EngineRuntime;
import com.phillippitts.granupose.domain.engine.EngineStatus;
import com.phillippitts.granupose.domain.engine.EngineStatusSnapshot;
import com.phillippitts.granupose.domain.engine.LogChannel;
import com.phillippitts.granupose.domain.engine.LogEntry;
import com.phillippitts.granupose.exception.GranuPoseException;
import com.phillippitts.granupose.service.engine.watchdog.EngineWatchdog;
import com.phillippitts.granupose.service.metrics.BridgeMetrics;
import com.phillippitts.granupose.util.ProcessTimeouts;
import com.phillippitts.granupose.util.TimeUtils;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns the lifecycle of the external {@code ec2_headless} engine process.
 *
 * <p>State machine:
 * <pre>
 * STOPPED/ERROR --start--> STARTING --spawned--> RUNNING --stop--> STOPPING --exit--> STOPPED
 *                                                RUNNING --unexpected exit--> ERROR --watchdog--> STARTING
 * </pre>
 *
 * <p>Every transition runs on the injected single-thread executor, so the mutable fields
 * below are confined to that thread. Process exits, watchdog timers and force-kill timers
 * hop onto it before touching state. The latest snapshot is published through a volatile
 * field for lock-free reads and as an {@link EngineStatusChangedEvent}.
 *
 * <p>Spawn failures are reported to the caller and never retried, except when the start was
 * itself triggered by the watchdog: that failure counts against the restart budget.
 */
@Service
public class EngineSupervisor {

    private static final Logger LOG = LogManager.getLogger(EngineSupervisor.class);

    static final String SIGNAL_FAILED = "failed_to_signal_engine_process";

    private static final Map<Integer, String> SIGNAL_NAMES = Map.of(
            1, "SIGHUP", 2, "SIGINT", 3, "SIGQUIT", 6, "SIGABRT", 9, "SIGKILL",
            11, "SIGSEGV", 13, "SIGPIPE", 15, "SIGTERM");

    private final Executor executor;
    private final ProcessFactory processFactory;
    private final EngineRuntimeResolver runtimeResolver;
    private final RestartScheduler scheduler;
    private final EngineLogBuffer logBuffer;
    private final EngineProperties props;
    private final EngineWatchdogProperties watchdogProps;
    private final EngineWatchdog watchdog;
    private final ApplicationEventPublisher publisher;
    private final BridgeMetrics metrics;
    private final Clock clock;
    private final boolean windows;

    private volatile EngineStatusSnapshot snapshot;
    private volatile boolean shuttingDown;
    private volatile Process current;

    // Confined to the supervisor thread
    private Process process;
    private Thread stdoutReader;
    private Thread stderrReader;
    private boolean stopRequested;
    private boolean autoRestartAllowed = true;
    private CompletableFuture<EngineOperationResult> stopFuture;
    private RestartScheduler.Cancellable restartTimer;
    private RestartScheduler.Cancellable killTimer;

    public EngineSupervisor(@Qualifier("engineSupervisorExecutor") Executor executor,
                            ProcessFactory processFactory,
                            EngineRuntimeResolver runtimeResolver,
                            RestartScheduler scheduler,
                            EngineLogBuffer logBuffer,
                            EngineProperties props,
                            EngineWatchdogProperties watchdogProps,
                            ApplicationEventPublisher publisher,
                            BridgeMetrics metrics,
                            Clock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.runtimeResolver = Objects.requireNonNull(runtimeResolver, "runtimeResolver");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.logBuffer = Objects.requireNonNull(logBuffer, "logBuffer");
        this.props = Objects.requireNonNull(props, "props");
        this.watchdogProps = Objects.requireNonNull(watchdogProps, "watchdogProps");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.watchdog = new EngineWatchdog(watchdogProps, clock);
        this.windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
        this.snapshot = EngineStatusSnapshot.initial(props.isAutoStart(), watchdogProps.isAutoRestart(),
                watchdogProps.getRestartMaxAttempts());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!props.isAutoStart()) {
            LOG.info("Engine auto-start disabled (engine.auto-start=false)");
            return;
        }
        start().whenComplete((result, err) -> {
            if (err != null) {
                LOG.error("Engine auto-start failed", err);
            } else if (!result.ok()) {
                LOG.warn("Engine auto-start failed: {}", result.error());
            }
        });
    }

    /**
     * Starts the engine. A no-op returning the current state while starting or running.
     */
    public CompletableFuture<EngineOperationResult> start() {
        return CompletableFuture.supplyAsync(() -> doStart("manual"), executor);
    }

    /**
     * Stops the engine: graceful termination, escalated to a forced kill after
     * {@code engine.stop-grace-ms}. Completes once the process exited.
     *
     * <p>Concurrent calls while stopping share the in-flight outcome; only one termination
     * signal is sent.
     */
    public CompletableFuture<EngineOperationResult> stop(String reason) {
        return CompletableFuture.supplyAsync(() -> doStop(reason), executor)
                .thenCompose(f -> f);
    }

    /**
     * Stops, then starts. If the stop failed while a process is still attached, the stop
     * failure is returned and no start is attempted.
     */
    public CompletableFuture<EngineOperationResult> restart() {
        return stop("restart").thenCompose(result -> {
            if (!result.ok() && result.state().pid() != null) {
                return CompletableFuture.completedFuture(result);
            }
            return CompletableFuture.supplyAsync(() -> doStart("restart"), executor);
        });
    }

    public EngineOperationResult status() {
        return EngineOperationResult.success(snapshot);
    }

    public EngineStatusSnapshot snapshot() {
        return snapshot;
    }

    public List<LogEntry> logs(Integer limit) {
        return logBuffer.entries(limit);
    }

    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        long waitMs = props.getStopGraceMs() + ProcessTimeouts.SHUTDOWN_MARGIN.toMillis();
        try {
            EngineOperationResult result = stop("shutdown").get(waitMs, TimeUnit.MILLISECONDS);
            if (!result.ok()) {
                LOG.warn("Engine stop during shutdown reported: {}", result.error());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while stopping engine during shutdown");
        } catch (ExecutionException | TimeoutException e) {
            LOG.warn("Engine did not stop cleanly during shutdown: {}", e.toString());
        }
        Process leftover = current;
        if (leftover != null && leftover.isAlive()) {
            LOG.warn("Engine still alive after shutdown wait; forcing kill (pid={})", leftover.pid());
            leftover.destroyForcibly();
            try {
                leftover.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    // ---------------------------------------------------------------- supervisor thread

    private EngineOperationResult doStart(String trigger) {
        boolean fromWatchdog = "watchdog".equals(trigger);
        EngineStatus status = snapshot.status();
        if (status == EngineStatus.RUNNING || status == EngineStatus.STARTING) {
            return EngineOperationResult.success(snapshot);
        }
        if (status == EngineStatus.STOPPING) {
            return EngineOperationResult.failure("engine_stopping", snapshot);
        }
        if (shuttingDown) {
            return EngineOperationResult.failure("shutting_down", snapshot);
        }

        cancelRestartTimer();
        autoRestartAllowed = true;
        if (!fromWatchdog) {
            watchdog.reset();
        }

        EngineRuntime runtime;
        try {
            runtime = runtimeResolver.resolve();
        } catch (GranuPoseException e) {
            return startFailed(e.getMessage(), null, List.of(), fromWatchdog);
        }

        long t0 = System.nanoTime();
        Process spawned;
        try {
            spawned = processFactory.start(runtime.command(), runtime.workingDirectory(), runtime.environment());
        } catch (IOException | RuntimeException e) {
            LOG.error("Engine spawn failed for {}", runtime.binary(), e);
            return startFailed("Failed to start engine: " + e.getMessage(), runtime.binary().toString(),
                    runtime.args(), fromWatchdog);
        }

        process = spawned;
        current = spawned;
        stopRequested = false;
        long pid = spawned.pid();
        transition(EngineStatus.STARTING, pid, runtime.binary().toString(), runtime.args(),
                snapshot.startedAtMs(), snapshot.stoppedAtMs(), null);

        stdoutReader = EngineOutputReader.start(spawned.getInputStream(), LogChannel.STDOUT, logBuffer, pid);
        stderrReader = EngineOutputReader.start(spawned.getErrorStream(), LogChannel.STDERR, logBuffer, pid);

        transition(EngineStatus.RUNNING, pid, runtime.binary().toString(), runtime.args(),
                clock.millis(), null, null);
        logBuffer.system("Engine started (pid=" + pid + ") using " + runtime.binary() + " (trigger=" + trigger + ")");
        logBuffer.system("Engine data dir: " + runtime.dataDir());
        if (runtime.samplesDir() != null) {
            logBuffer.system("Engine samples dir: " + runtime.samplesDir());
        } else {
            logBuffer.system("No bundled samples directory resolved; using engine defaults.");
        }
        if (runtime.libDir() != null) {
            logBuffer.system("Engine library dir: " + runtime.libDir());
        }
        LOG.debug("Engine spawn took {} ms", TimeUtils.elapsedMillis(t0));

        spawned.onExit().whenComplete((p, err) -> executor.execute(() -> onProcessExit(spawned)));
        return EngineOperationResult.success(snapshot);
    }

    private EngineOperationResult startFailed(String message, String binaryPath, List<String> args,
                                              boolean fromWatchdog) {
        logBuffer.append(LogChannel.STDERR, message);
        transition(EngineStatus.ERROR, null, binaryPath, args, snapshot.startedAtMs(), clock.millis(), message);
        EngineOperationResult result = EngineOperationResult.failure(message, snapshot);
        if (fromWatchdog) {
            logBuffer.system("Engine restart attempt " + watchdog.attempts() + " failed: " + message);
            scheduleRestart("watchdog start failure: " + message);
        }
        return result;
    }

    private CompletableFuture<EngineOperationResult> doStop(String reason) {
        autoRestartAllowed = false;
        watchdog.reset();
        cancelRestartTimer();

        if (stopFuture != null) {
            return stopFuture;
        }
        Process target = process;
        if (target == null) {
            EngineStatusSnapshot s = snapshot;
            Long stoppedAt = s.status() == EngineStatus.STOPPED ? s.stoppedAtMs() : Long.valueOf(clock.millis());
            transition(EngineStatus.STOPPED, null, s.binaryPath(), s.args(), s.startedAtMs(), stoppedAt,
                    s.lastError());
            return CompletableFuture.completedFuture(EngineOperationResult.success(snapshot));
        }

        logBuffer.system("Stopping engine (reason=" + reason + ")");
        CompletableFuture<EngineOperationResult> result = new CompletableFuture<>();
        stopFuture = result;
        stopRequested = true;
        EngineStatusSnapshot before = snapshot;
        transition(EngineStatus.STOPPING, before.pid(), before.binaryPath(), before.args(),
                before.startedAtMs(), before.stoppedAtMs(), before.lastError());

        killTimer = scheduler.schedule(() -> executor.execute(() -> forceKill(target)),
                Duration.ofMillis(props.getStopGraceMs()));
        try {
            target.destroy();
        } catch (RuntimeException e) {
            LOG.error("Failed to signal engine process (pid={})", before.pid(), e);
            cancelKillTimer();
            stopRequested = false;
            stopFuture = null;
            transition(before.status(), before.pid(), before.binaryPath(), before.args(),
                    before.startedAtMs(), before.stoppedAtMs(), SIGNAL_FAILED);
            EngineOperationResult failure = EngineOperationResult.failure(SIGNAL_FAILED, snapshot);
            result.complete(failure);
        }
        return result;
    }

    private void forceKill(Process target) {
        killTimer = null;
        if (target != process || !target.isAlive()) {
            return;
        }
        logBuffer.system("Engine did not exit after SIGTERM; forcing SIGKILL.");
        target.destroyForcibly();
    }

    private void onProcessExit(Process exited) {
        if (exited != process) {
            return;
        }
        joinQuietly(stdoutReader);
        joinQuietly(stderrReader);
        stdoutReader = null;
        stderrReader = null;
        process = null;
        current = null;
        cancelKillTimer();

        int rawCode = exited.exitValue();
        String signal = signalForExitCode(rawCode, windows);
        Integer code = signal == null ? rawCode : null;
        boolean expected = stopRequested;
        stopRequested = false;
        logBuffer.system("Engine exited (code=" + code + ", signal=" + signal + ", expected=" + expected + ")");

        EngineStatusSnapshot s = snapshot;
        if (expected) {
            transition(EngineStatus.STOPPED, null, s.binaryPath(), s.args(), s.startedAtMs(), clock.millis(), null);
            CompletableFuture<EngineOperationResult> pending = stopFuture;
            stopFuture = null;
            if (pending != null) {
                pending.complete(EngineOperationResult.success(snapshot));
            }
            return;
        }

        String message = "Engine exited unexpectedly (code=" + code + ", signal=" + signal + ")";
        LOG.warn(message);
        metrics.incrementEngineExits();
        transition(EngineStatus.ERROR, null, s.binaryPath(), s.args(), s.startedAtMs(), clock.millis(), message);
        scheduleRestart(message);
    }

    private void scheduleRestart(String reason) {
        if (shuttingDown) {
            return;
        }
        if (!watchdogProps.isAutoRestart()) {
            logBuffer.system("Engine auto-restart skipped (watchdog disabled).");
            return;
        }
        if (!autoRestartAllowed) {
            logBuffer.system("Engine auto-restart skipped (manual stop policy active).");
            return;
        }

        EngineWatchdog.RestartDecision decision = watchdog.onUnexpectedExit();
        if (decision.exhausted()) {
            autoRestartAllowed = false;
            logBuffer.append(LogChannel.STDERR, "Engine restart watchdog exhausted ("
                    + watchdog.maxAttempts() + " attempts). Last exit: " + reason);
            LOG.error("Engine restart watchdog exhausted after {} attempts", watchdog.maxAttempts());
            republish();
            return;
        }

        logBuffer.system("Scheduling engine restart attempt " + decision.attempt() + "/" + watchdog.maxAttempts()
                + " in " + decision.delayMs() + "ms (" + reason + ")");
        republish();
        cancelRestartTimer();
        restartTimer = scheduler.schedule(() -> executor.execute(this::fireRestart),
                Duration.ofMillis(decision.delayMs()));
    }

    private void fireRestart() {
        restartTimer = null;
        if (shuttingDown || !autoRestartAllowed) {
            return;
        }
        logBuffer.system("Executing engine restart attempt " + watchdog.attempts() + "/" + watchdog.maxAttempts() + ".");
        metrics.incrementEngineRestarts();
        doStart("watchdog");
    }

    private void cancelRestartTimer() {
        if (restartTimer != null) {
            restartTimer.cancel();
            restartTimer = null;
        }
    }

    private void cancelKillTimer() {
        if (killTimer != null) {
            killTimer.cancel();
            killTimer = null;
        }
    }

    private void republish() {
        EngineStatusSnapshot s = snapshot;
        transition(s.status(), s.pid(), s.binaryPath(), s.args(), s.startedAtMs(), s.stoppedAtMs(), s.lastError());
    }

    private void transition(EngineStatus status, Long pid, String binaryPath, List<String> args,
                            Long startedAtMs, Long stoppedAtMs, String lastError) {
        EngineStatusSnapshot previous = snapshot;
        EngineStatusSnapshot next = new EngineStatusSnapshot(status, pid, binaryPath, args, startedAtMs,
                stoppedAtMs, props.isAutoStart(), watchdogProps.isAutoRestart() && autoRestartAllowed,
                watchdog.attempts(), watchdog.maxAttempts(), lastError);
        snapshot = next;
        if (previous.status() != status) {
            LOG.info("Engine status {} -> {} (pid={})", previous.status(), status, pid);
        }
        publisher.publishEvent(new EngineStatusChangedEvent(previous, next, clock.millis()));
    }

    private static void joinQuietly(Thread thread) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(ProcessTimeouts.READER_FLUSH_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Unix shells report death-by-signal as {@code 128 + n}; the JDK does the same for
     * {@link Process#exitValue()}. Returns the signal name, or {@code null} for a normal exit.
     */
    static String signalForExitCode(int exitCode, boolean windows) {
        if (windows || exitCode <= 128 || exitCode > 128 + 64) {
            return null;
        }
        return signalName(exitCode - 128);
    }

    static String signalName(int signal) {
        return SIGNAL_NAMES.getOrDefault(signal, "SIG" + signal);
    }
}
