package com.eyelevel.documentvault.job;

import com.eyelevel.documentvault.exception.JobExhaustedException;
import com.eyelevel.documentvault.exception.JobRejectedException;
import com.eyelevel.documentvault.exception.JobTimeoutException;
import com.eyelevel.documentvault.job.deadletter.DeadLetterPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Prioritized job queue with a bounded worker pool, per-attempt timeouts, exponential retry backoff and
 * dead-lettering.
 *
 * <p>Every state change is written through the {@link JobStore} before it takes effect in memory, and
 * {@link #initialize()} re-queues whatever the store still holds as unfinished. Jobs left waiting,
 * pending a retry or cut off by {@link #cleanup()} are therefore run again by the next queue instance.
 * Delivery is at least once, so handlers must be idempotent.
 *
 * <p>All bookkeeping (the waiting heap, job states and the counters exposed by {@link #metrics()}) is
 * mutated under a single lock. The active count is the number of occupied worker slots and never
 * exceeds the configured concurrency.
 *
 * <p>The timeout of an attempt starts when its handler starts. If it fires first, the attempt is failed
 * with a {@link JobTimeoutException} and the worker is interrupted, but the slot stays occupied until
 * the handler actually returns, so a handler that ignores interrupts cannot push other jobs past their
 * own timeouts. A late completion from a timed-out worker is ignored.
 */
@Slf4j
public class JobQueue implements JobSubmitter {

    private static final Comparator<Job> DISPATCH_ORDER =
            Comparator.comparingInt(Job::getPriority).reversed().thenComparingLong(Job::getSequence);
    private static final int DURATION_WINDOW = 100;

    private final JobHandlerRegistry handlerRegistry;
    private final JobQueueSettings settings;
    private final DeadLetterPublisher deadLetterPublisher;
    private final JobStore jobStore;
    private final List<JobQueueListener> listeners = new CopyOnWriteArrayList<>();

    private final ReentrantLock lock = new ReentrantLock();
    private final PriorityQueue<Job> waiting = new PriorityQueue<>(DISPATCH_ORDER);
    private final Map<String, Job> liveJobs = new HashMap<>();
    private final Deque<Job> completedArchive = new ArrayDeque<>();
    private final Deque<Job> deadArchive = new ArrayDeque<>();
    private final Deque<Long> recentDurations = new ArrayDeque<>();
    private final AtomicLong sequence = new AtomicLong();

    private long durationSum;
    private int activeCount;
    private int delayedCount;
    private long completedCount;
    private long failedCount;
    private long retryCount;
    private boolean accepting;
    private ThreadPoolTaskExecutor workers;
    private ThreadPoolTaskScheduler timer;

    public JobQueue(JobHandlerRegistry handlerRegistry, JobQueueSettings settings,
                    DeadLetterPublisher deadLetterPublisher, JobStore jobStore) {
        this.handlerRegistry = handlerRegistry;
        this.settings = settings;
        this.deadLetterPublisher = deadLetterPublisher;
        this.jobStore = jobStore;
    }

    public void addListener(JobQueueListener listener) {
        listeners.add(listener);
    }

    /**
     * Starts the worker pool, re-queues unfinished jobs from the store and begins accepting jobs.
     */
    @Override
    public void initialize() {
        int recovered;
        lock.lock();
        try {
            if (accepting) {
                log.warn("Job queue is already initialized.");
                return;
            }
            workers = new ThreadPoolTaskExecutor();
            workers.setCorePoolSize(settings.concurrency());
            workers.setMaxPoolSize(settings.concurrency());
            workers.setThreadNamePrefix("job-worker-");
            workers.setDaemon(true);
            workers.initialize();

            timer = new ThreadPoolTaskScheduler();
            timer.setPoolSize(1);
            timer.setThreadNamePrefix("job-timer-");
            timer.setDaemon(true);
            timer.setRemoveOnCancelPolicy(true);
            timer.initialize();

            recovered = recoverUnfinished();
            accepting = true;
            dispatchAvailable();
        } finally {
            lock.unlock();
        }
        log.info("Job queue started with {} recovered job(s). Concurrency: {}, timeout: {}, max attempts: {}, "
                 + "max queue size: {}", recovered, settings.concurrency(), settings.timeout(),
                 settings.maxAttempts(), settings.maxQueueSize());
    }

    @Override
    public String addJob(JobType type, JobPayload payload, int priority) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        if (handlerRegistry.getHandler(type).isEmpty()) {
            throw new JobRejectedException("No handler registered for job type " + type);
        }

        lock.lock();
        try {
            if (!accepting) {
                throw new JobRejectedException("Job queue is not accepting jobs");
            }
            if (waiting.size() >= settings.maxQueueSize()) {
                throw new JobRejectedException("Job queue is full with " + waiting.size() + " waiting jobs");
            }
            Job job = new Job(UUID.randomUUID().toString(), type, payload, priority, sequence.incrementAndGet(),
                              settings.maxAttempts(), Instant.now());
            try {
                jobStore.save(job);
            } catch (RuntimeException e) {
                throw new JobRejectedException("Failed to record job " + type + " for document "
                                               + payload.documentId(), e);
            }
            liveJobs.put(job.getId(), job);
            waiting.add(job);
            log.info("Queued job {} ({}) for document {} with priority {}.", job.getId(), type, payload.documentId(),
                     priority);
            dispatchAvailable();
            return job.getId();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Job> getJob(String jobId) {
        lock.lock();
        try {
            Job job = liveJobs.get(jobId);
            if (job == null) {
                job = findArchived(jobId);
            }
            return Optional.ofNullable(job).map(Job::snapshot);
        } finally {
            lock.unlock();
        }
    }

    public QueueMetrics metrics() {
        lock.lock();
        try {
            double average = recentDurations.isEmpty() ? 0.0 : (double) durationSum / recentDurations.size();
            return new QueueMetrics(waiting.size(), activeCount, delayedCount, completedCount, failedCount,
                                    retryCount, settings.concurrency(), average, accepting);
        } finally {
            lock.unlock();
        }
    }

    public JobQueueSettings getSettings() {
        return settings;
    }

    public boolean isAccepting() {
        lock.lock();
        try {
            return accepting;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops accepting jobs and waits up to the shutdown grace period for in-flight jobs before
     * interrupting them. Jobs that have not started stay in the store for the next instance.
     */
    @Override
    public void cleanup() {
        ThreadPoolTaskExecutor stoppingWorkers;
        ThreadPoolTaskScheduler stoppingTimer;
        int leftWaiting;
        int inFlight;
        lock.lock();
        try {
            if (workers == null) {
                return;
            }
            accepting = false;
            leftWaiting = waiting.size();
            waiting.forEach(job -> liveJobs.remove(job.getId()));
            waiting.clear();
            inFlight = activeCount;
            stoppingWorkers = workers;
            stoppingTimer = timer;
            workers = null;
            timer = null;
        } finally {
            lock.unlock();
        }

        log.info("Shutting down job queue. {} waiting job(s) left for redelivery, {} in flight.", leftWaiting,
                 inFlight);
        ThreadPoolExecutor executor = stoppingWorkers.getThreadPoolExecutor();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(settings.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Jobs still running after the {} grace period; interrupting them.",
                         settings.shutdownGrace());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        stoppingTimer.shutdown();
        log.info("Job queue stopped.");
    }

    // Called with the lock held.
    private int recoverUnfinished() {
        List<Job> unfinished = jobStore.findUnfinished();
        for (Job job : unfinished) {
            if (handlerRegistry.getHandler(job.getType()).isEmpty()) {
                log.warn("Skipping recovered job {}: no handler registered for {}.", job.getId(), job.getType());
                continue;
            }
            job.markRecovered();
            persist(job);
            sequence.accumulateAndGet(job.getSequence(), Math::max);
            liveJobs.put(job.getId(), job);
            waiting.add(job);
            log.info("Recovered job {} ({}) for document {} after {} attempt(s).", job.getId(), job.getType(),
                     job.getPayload().documentId(), job.getAttempts());
        }
        return waiting.size();
    }

    // Called with the lock held.
    private void dispatchAvailable() {
        while (accepting && activeCount < settings.concurrency() && !waiting.isEmpty()) {
            Job job = waiting.poll();
            job.markActive();
            persist(job);
            activeCount++;
            start(job);
        }
    }

    // Called with the lock held.
    private void start(Job job) {
        JobHandler handler = handlerRegistry.getHandler(job.getType()).orElseThrow(
                () -> new IllegalStateException("No handler registered for job type " + job.getType()));
        Execution execution = new Execution(job, timer);
        log.debug("Starting job {} ({}) attempt {}/{}.", job.getId(), job.getType(), job.getAttempts(),
                  job.getMaxAttempts());
        workers.submit(() -> execute(execution, handler));
    }

    private void execute(Execution execution, JobHandler handler) {
        Throwable failure = null;
        boolean succeeded = false;
        try {
            execution.begin(() -> onTimeout(execution), settings.timeout());
            handler.handle(execution.job, this);
            succeeded = true;
        } catch (Exception e) {
            failure = e;
        } finally {
            execution.finish();
            settle(execution, succeeded ? null
                    : failure != null ? failure : new IllegalStateException("Handler terminated abnormally"));
            releaseSlot();
        }
    }

    private void onTimeout(Execution execution) {
        JobTimeoutException timeout = new JobTimeoutException(
                "Job " + execution.job.getId() + " exceeded its timeout of " + settings.timeout().toMillis() + " ms");
        if (settle(execution, timeout)) {
            execution.interruptWorker();
        }
    }

    private void releaseSlot() {
        lock.lock();
        try {
            activeCount--;
            dispatchAvailable();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records the outcome of an execution. The worker slot is released separately, once the handler has
     * returned.
     *
     * @return {@code false} if the execution had already been settled.
     */
    private boolean settle(Execution execution, Throwable failure) {
        Job job = execution.job;
        Outcome outcome;
        Duration retryDelay = null;
        lock.lock();
        try {
            if (execution.settled) {
                return false;
            }
            execution.settled = true;
            recordDuration((System.nanoTime() - execution.startedNanos) / 1_000_000);

            if (failure == null) {
                job.markCompleted();
                persist(job);
                completedCount++;
                liveJobs.remove(job.getId());
                archive(completedArchive, job, settings.completedRetention());
                outcome = Outcome.COMPLETED;
            } else if (!accepting) {
                // cut off by shutdown: the store still shows it ACTIVE, so the attempt is not counted
                liveJobs.remove(job.getId());
                outcome = Outcome.ABANDONED;
            } else if (job.getAttempts() < job.getMaxAttempts()) {
                job.markRetrying(describe(failure));
                persist(job);
                retryCount++;
                retryDelay = settings.backoffFor(job.getAttempts());
                delayedCount++;
                timer.schedule(() -> requeue(job), Instant.now().plus(retryDelay));
                outcome = Outcome.RETRY;
            } else {
                job.markDead(describe(failure));
                persist(job);
                failedCount++;
                liveJobs.remove(job.getId());
                archive(deadArchive, job, settings.failedRetention());
                outcome = Outcome.DEAD;
            }
        } finally {
            lock.unlock();
        }

        notifyOutcome(job, outcome, failure, retryDelay);
        return true;
    }

    private void requeue(Job job) {
        lock.lock();
        try {
            if (job.getStatus() != JobStatus.FAILED_RETRY) {
                return;
            }
            delayedCount--;
            if (!accepting) {
                liveJobs.remove(job.getId());
                log.warn("Job {} ({}) left for redelivery; the queue shut down before its retry.", job.getId(),
                         job.getType());
                return;
            }
            job.markWaiting();
            persist(job);
            waiting.add(job);
            dispatchAvailable();
        } finally {
            lock.unlock();
        }
    }

    // Called with the lock held. The in-memory state stays authoritative for this instance.
    private void persist(Job job) {
        try {
            jobStore.save(job);
        } catch (RuntimeException e) {
            log.error("Failed to record job {} ({}) as {}.", job.getId(), job.getType(), job.getStatus(), e);
        }
    }

    private void notifyOutcome(Job job, Outcome outcome, Throwable failure, Duration retryDelay) {
        Job snapshot = job.snapshot();
        switch (outcome) {
            case COMPLETED -> {
                log.info("Job {} ({}) completed on attempt {}.", job.getId(), job.getType(), snapshot.getAttempts());
                listeners.forEach(listener -> listener.onJobCompleted(snapshot));
            }
            case RETRY -> {
                log.warn("Job {} ({}) failed attempt {}/{}; retrying in {} ms. Cause: {}", job.getId(), job.getType(),
                         snapshot.getAttempts(), snapshot.getMaxAttempts(), retryDelay.toMillis(),
                         snapshot.getLastError());
                listeners.forEach(listener -> listener.onJobFailed(snapshot, failure, true));
            }
            case ABANDONED -> {
                log.warn("Job {} ({}) interrupted by shutdown on attempt {}; left for redelivery. Cause: {}",
                         job.getId(), job.getType(), snapshot.getAttempts(), describe(failure));
            }
            case DEAD -> {
                log.error("Job {} ({}) failed all {} attempt(s) and is dead. Cause: {}", job.getId(), job.getType(),
                          snapshot.getAttempts(), snapshot.getLastError(), failure);
                deadLetterPublisher.publish(snapshot);
                listeners.forEach(listener -> listener.onJobFailed(snapshot, failure, false));
                JobExhaustedException exhausted = new JobExhaustedException(
                        "Job " + job.getId() + " exhausted " + snapshot.getAttempts() + " attempt(s)", failure);
                listeners.forEach(listener -> listener.onJobDead(snapshot, exhausted));
            }
        }
    }

    private void recordDuration(long durationMillis) {
        recentDurations.addLast(durationMillis);
        durationSum += durationMillis;
        if (recentDurations.size() > DURATION_WINDOW) {
            durationSum -= recentDurations.removeFirst();
        }
    }

    private static void archive(Deque<Job> archive, Job job, int retention) {
        archive.addLast(job);
        while (archive.size() > retention) {
            archive.removeFirst();
        }
    }

    private Job findArchived(String jobId) {
        for (Job job : completedArchive) {
            if (job.getId().equals(jobId)) {
                return job;
            }
        }
        for (Job job : deadArchive) {
            if (job.getId().equals(jobId)) {
                return job;
            }
        }
        return null;
    }

    private static String describe(Throwable failure) {
        return failure.getClass().getSimpleName() + ": " + failure.getMessage();
    }

    private enum Outcome {
        COMPLETED,
        RETRY,
        ABANDONED,
        DEAD
    }

    /**
     * One attempt of a job. {@code settled} is guarded by the queue lock; the worker thread and the
     * timeout task are guarded by the execution's own monitor, so the timeout can never interrupt a
     * thread that has already moved on to another job.
     */
    private static final class Execution {

        private final Job job;
        private final ThreadPoolTaskScheduler timer;
        private long startedNanos = System.nanoTime();
        private boolean settled;

        private Thread worker;
        private ScheduledFuture<?> timeoutTask;
        private boolean finished;

        private Execution(Job job, ThreadPoolTaskScheduler timer) {
            this.job = job;
            this.timer = timer;
        }

        synchronized void begin(Runnable onTimeout, Duration timeout) {
            worker = Thread.currentThread();
            startedNanos = System.nanoTime();
            timeoutTask = timer.schedule(onTimeout, Instant.now().plus(timeout));
        }

        synchronized void finish() {
            finished = true;
            if (timeoutTask != null) {
                timeoutTask.cancel(false);
            }
            // an interrupt from a timeout must not leak into the bookkeeping that follows
            Thread.interrupted();
        }

        synchronized void interruptWorker() {
            if (!finished && worker != null) {
                worker.interrupt();
            }
        }
    }
}
