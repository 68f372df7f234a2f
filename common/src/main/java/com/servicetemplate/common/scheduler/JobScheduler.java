package com.servicetemplate.common.scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.support.CronExpression;

import com.servicetemplate.common.metrics.ServiceMetrics;

/**
 * Runs cron jobs on a daemon scheduler thread. A heartbeat job is always registered first.
 */
public class JobScheduler implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(JobScheduler.class);

    public static final String HEARTBEAT_JOB = "heartbeatjob";
    private static final DateTimeFormatter NEXT_RUN_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final String heartbeatCron;
    private final boolean heartbeatDebug;
    private final ServiceMetrics metrics;
    private final Clock clock;
    private final ScheduledExecutorService executor;

    private final List<CronJob> jobs = new CopyOnWriteArrayList<>();
    private final List<ScheduledJob> running = new CopyOnWriteArrayList<>();

    public JobScheduler(String heartbeatCron, boolean heartbeatDebug, ServiceMetrics metrics) {
        this(heartbeatCron, heartbeatDebug, metrics, Clock.systemDefaultZone());
    }

    public JobScheduler(String heartbeatCron, boolean heartbeatDebug, ServiceMetrics metrics, Clock clock) {
        this.heartbeatCron = Objects.requireNonNull(heartbeatCron, "heartbeatCron");
        this.heartbeatDebug = heartbeatDebug;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "job-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Parses a cron expression, adding a zero seconds field to five-field expressions.
     *
     * @throws IllegalArgumentException if the expression is invalid
     */
    public static CronExpression parse(String expression) {
        String trimmed = expression.trim();
        String[] fields = trimmed.split("\\s+");
        if (fields.length == 5) {
            trimmed = "0 " + trimmed;
        }
        return CronExpression.parse(trimmed);
    }

    /**
     * Registers the heartbeat and {@code extraJobs}, then starts them. Jobs with invalid
     * expressions are logged and skipped.
     */
    public synchronized void start(List<CronJob> extraJobs) {
        logger.debug("InitScheduler: Registering jobs...");
        jobs.clear();
        jobs.add(new CronJob(HEARTBEAT_JOB, heartbeatCron, this::heartbeat, List.of(HEARTBEAT_JOB)));
        if (extraJobs != null) {
            jobs.addAll(extraJobs);
        }

        for (CronJob job : jobs) {
            logger.debug("InitScheduler: Setting cron for {}: {}", job.getName(), job.getCronExpression());
            CronExpression expression;
            try {
                expression = parse(job.getCronExpression());
            } catch (IllegalArgumentException e) {
                logger.error("InitScheduler: Error starting {}: {}", job.getName(), e.getMessage());
                continue;
            }
            ScheduledJob scheduled = new ScheduledJob(job, expression);
            running.add(scheduled);
            scheduled.arm();
            logger.debug("InitScheduler: Started {}", job.getName());
        }
        logger.debug("InitScheduler: Scheduler started with {} job(s)", running.size());
    }

    void heartbeat() {
        if (heartbeatDebug) {
            logger.debug("Sending Heartbeat...");
        }
        metrics.heartbeat();
    }

    /** Jobs that were started, with their next fire time. */
    public List<JobInfo> jobsInfo() {
        List<JobInfo> infos = new ArrayList<>();
        for (ScheduledJob scheduled : running) {
            ZonedDateTime next = scheduled.nextRun;
            infos.add(new JobInfo(scheduled.job.getName(), scheduled.job.getTags(),
                    next == null ? "" : next.format(NEXT_RUN_FORMAT)));
        }
        return infos;
    }

    /** Every registered job, including ones whose expression failed to parse. */
    public List<CronJob> scheduledJobs() {
        return List.copyOf(jobs);
    }

    @Override
    public void close() {
        executor.shutdownNow();
        logger.debug("Scheduler stopped");
    }

    private final class ScheduledJob {
        private final CronJob job;
        private final CronExpression expression;
        private volatile ZonedDateTime nextRun;

        private ScheduledJob(CronJob job, CronExpression expression) {
            this.job = job;
            this.expression = expression;
        }

        private void arm() {
            if (executor.isShutdown()) return;

            ZonedDateTime now = ZonedDateTime.now(clock);
            ZonedDateTime base = nextRun != null && nextRun.isAfter(now) ? nextRun : now;
            ZonedDateTime next = expression.next(base);
            nextRun = next;
            if (next == null) {
                logger.warn("Job {} has no future fire time", job.getName());
                return;
            }
            long delay = Math.max(0, Duration.between(now, next).toMillis());
            executor.schedule(this::fire, delay, TimeUnit.MILLISECONDS);
        }

        private void fire() {
            try {
                job.getTask().run();
            } catch (RuntimeException e) {
                metrics.error();
                logger.error("Job {} failed: {}", job.getName(), e.getMessage(), e);
            } finally {
                arm();
            }
        }
    }
}
