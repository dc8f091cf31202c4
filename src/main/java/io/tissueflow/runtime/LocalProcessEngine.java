package io.tissueflow.runtime;

import io.tissueflow.model.Job;
import io.tissueflow.model.JobPhase;
import io.tissueflow.model.JobState;
import io.tissueflow.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

public final class LocalProcessEngine implements ExecutionEngine, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LocalProcessEngine.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss-SSS");

    private final List<String> launcher;
    private final Path logDir;
    private final Path workingDir;
    private final Clock clock;
    private final Map<Job, Entry> entries = new LinkedHashMap<>();
    private int maxInFlight = JobScheduler.DEFAULT_SUBMIT_CAP;

    public LocalProcessEngine(List<String> launcher, Path logDir, Path workingDir) {
        this(launcher, logDir, workingDir, Clock.systemDefaultZone());
    }

    public LocalProcessEngine(List<String> launcher, Path logDir, Path workingDir, Clock clock) {
        this.launcher = launcher == null ? List.of() : List.copyOf(launcher);
        this.logDir = logDir;
        this.workingDir = workingDir;
        this.clock = clock;
    }

    @Override
    public synchronized void setMaxInFlight(int maxInFlight) {
        if (maxInFlight <= 0) {
            throw new IllegalArgumentException("maxInFlight must be positive: " + maxInFlight);
        }
        this.maxInFlight = maxInFlight;
    }

    @Override
    public synchronized void submit(Job job) {
        if (entries.containsKey(job)) {
            throw new ExecutionEngineException("Job already submitted: " + job.name());
        }
        Entry entry = new Entry(job);
        entry.state = JobState.SUBMITTED;
        entries.put(job, entry);
        log.debug("queued job {}", job.name());
    }

    @Override
    public synchronized void progress() {
        for (Entry entry : entries.values()) {
            if (entry.state == JobState.RUNNING) {
                poll(entry);
            }
        }
        int inFlight = (int) entries.values().stream().filter(e -> e.state == JobState.RUNNING).count();
        Iterator<Entry> pending = entries.values().stream()
                .filter(e -> e.state == JobState.SUBMITTED)
                .toList()
                .iterator();
        while (pending.hasNext() && inFlight < maxInFlight) {
            Entry entry = pending.next();
            if (entry.job.phase() == JobPhase.COLLECT) {
                Barrier barrier = barrierOf(entry.job);
                if (barrier == Barrier.WAIT) {
                    continue;
                }
                if (barrier == Barrier.FAILED) {
                    log.warn("collect job {} not started: run jobs of its submission failed", entry.job.name());
                    entry.state = JobState.STOPPED;
                    continue;
                }
            }
            start(entry);
            if (entry.state == JobState.RUNNING) {
                inFlight++;
            }
        }
    }

    @Override
    public synchronized JobStatus statusOf(Job job) {
        Entry entry = entries.get(job);
        if (entry == null) {
            throw new ExecutionEngineException("Job was never submitted: " + job.name());
        }
        return new JobStatus(
                job.name(),
                job.jobId(),
                job.phase(),
                entry.state,
                entry.exitCode,
                entry.elapsed(clock),
                entry.cpuTime,
                JobStatus.UNKNOWN_MEMORY_MB
        );
    }

    @Override
    public synchronized void close() {
        for (Entry entry : entries.values()) {
            if (entry.process != null && entry.process.isAlive()) {
                entry.process.destroyForcibly();
                entry.state = JobState.STOPPED;
                entry.finishedAt = clock.millis();
            }
        }
    }

    private void start(Entry entry) {
        Job job = entry.job;
        List<String> command = new ArrayList<>(launcher);
        command.addAll(job.command());
        String stamp = LocalDateTime.now(clock).format(TIMESTAMP);
        Path out = logDir.resolve(job.name() + "_" + stamp + ".out");
        Path err = logDir.resolve(job.name() + "_" + stamp + ".err");
        try {
            Files.createDirectories(logDir);
        } catch (IOException e) {
            throw new ExecutionEngineException("Failed to create log directory: " + logDir, e);
        }
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        pb.redirectOutput(out.toFile());
        pb.redirectError(err.toFile());
        entry.startedAt = clock.millis();
        try {
            entry.process = pb.start();
            entry.state = JobState.RUNNING;
            log.info("started job {}: {}", job.name(), String.join(" ", command));
        } catch (IOException e) {
            log.warn("failed to start job {}: {}", job.name(), e.getMessage());
            entry.state = JobState.STOPPED;
            entry.finishedAt = clock.millis();
        }
    }

    private void poll(Entry entry) {
        Process process = entry.process;
        process.info().totalCpuDuration().ifPresent(cpu -> entry.cpuTime = cpu);
        if (!process.isAlive()) {
            entry.exitCode = process.exitValue();
            entry.state = JobState.TERMINATED;
            entry.finishedAt = clock.millis();
            log.debug("job {} terminated with exit code {}", entry.job.name(), entry.exitCode);
            return;
        }
        Duration walltime = entry.job.requestedWalltime();
        if (walltime != null && entry.elapsed(clock).compareTo(walltime) > 0) {
            process.destroyForcibly();
            try {
                process.waitFor(1, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            entry.state = JobState.STOPPED;
            entry.finishedAt = clock.millis();
            log.warn("job {} exceeded its wall time of {} and was killed", entry.job.name(), walltime);
        }
    }

    private Barrier barrierOf(Job collectJob) {
        boolean failed = false;
        for (Entry entry : entries.values()) {
            Job job = entry.job;
            if (job.phase() != JobPhase.RUN || !sameSubmission(job, collectJob)) {
                continue;
            }
            if (!entry.state.isTerminal()) {
                return Barrier.WAIT;
            }
            if (entry.state == JobState.STOPPED || (entry.exitCode != null && entry.exitCode != 0)) {
                failed = true;
            }
        }
        return failed ? Barrier.FAILED : Barrier.OPEN;
    }

    private static boolean sameSubmission(Job a, Job b) {
        if (a.submission() == null || b.submission() == null) {
            return a.submission() == b.submission();
        }
        return a.submission().id() == b.submission().id();
    }

    private enum Barrier {
        WAIT,
        OPEN,
        FAILED
    }

    private static final class Entry {
        private final Job job;
        private JobState state = JobState.CREATED;
        private Process process;
        private Integer exitCode;
        private long startedAt = -1L;
        private long finishedAt = -1L;
        private Duration cpuTime = Duration.ZERO;

        private Entry(Job job) {
            this.job = job;
        }

        private Duration elapsed(Clock clock) {
            if (startedAt < 0) {
                return Duration.ZERO;
            }
            long end = finishedAt < 0 ? clock.millis() : finishedAt;
            return Duration.ofMillis(Math.max(0L, end - startedAt));
        }
    }
}
