package com.aiops.dataCollector.worker.service;

import com.aiops.dataCollector.collector.model.Job;
import com.aiops.dataCollector.config.CollectorProperties;
import com.aiops.dataCollector.metrics.CollectorMetrics;
import com.aiops.dataCollector.worker.exception.JobRejectedException;
import com.aiops.dataCollector.worker.exception.NoWorkerConfiguredException;
import com.aiops.dataCollector.worker.observability.JobMdcContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Fire-and-forget job dispatch.
 *
 * Each accepted job runs as one task on a bounded worker pool; {@link #dispatch(Job)} returns as
 * soon as the task is queued. When the pool and its queue are full the job is refused instead
 * of starting yet another thread. Task failures are only visible in logs and metrics.
 */
@Slf4j
@Service
public class JobDispatcher implements DisposableBean {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final WorkerRegistry workerRegistry;
    private final CollectorMetrics metrics;
    private final ExecutorService executor;

    @Autowired
    public JobDispatcher(WorkerRegistry workerRegistry, CollectorMetrics metrics, CollectorProperties properties) {
        this(workerRegistry, metrics, newWorkerPool(properties.getDispatch()));
    }

    JobDispatcher(WorkerRegistry workerRegistry, CollectorMetrics metrics, ExecutorService executor) {
        this.workerRegistry = workerRegistry;
        this.metrics = metrics;
        this.executor = executor;
    }

    /**
     * Queues a job for the active worker.
     *
     * @param job Job to run; a source id is generated when it has none
     * @return Source id of the queued job
     * @throws NoWorkerConfiguredException if this deployment has no worker
     * @throws JobRejectedException if the worker pool is saturated
     */
    public String dispatch(Job job) {
        if (job == null || job.destination() == null || job.destination().isBlank()) {
            throw new IllegalArgumentException("Job requires a destination");
        }

        CollectorWorker worker = workerRegistry.activeWorker()
                .orElseThrow(() -> new NoWorkerConfiguredException("No worker set"));
        Job prepared = job.withDefaultSourceId();

        try {
            executor.execute(() -> runJob(worker, prepared));
        } catch (RejectedExecutionException e) {
            log.warn("Worker pool saturated, job rejected - sourceId: {}", prepared.sourceId());
            throw new JobRejectedException("Worker pool is saturated, job " + prepared.sourceId() + " rejected", e);
        }

        metrics.jobInitiated();
        log.info("Job started - sourceId: {}, worker: {}", prepared.sourceId(), worker.type().getConfigName());
        return prepared.sourceId();
    }

    private void runJob(CollectorWorker worker, Job job) {
        try (JobMdcContext mdc = new JobMdcContext(job, worker.type().getConfigName())) {
            log.debug("Worker started - sourceId: {}", job.sourceId());
            try {
                worker.run(job);
                log.debug("Done, exiting - sourceId: {}", job.sourceId());
            } catch (RuntimeException e) {
                metrics.jobFailed();
                log.error("Job failed - sourceId: {}, error: {}", job.sourceId(), e.getMessage(), e);
            }
        }
    }

    @Override
    public void destroy() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not stop within {}s, interrupting running jobs", SHUTDOWN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private static ExecutorService newWorkerPool(CollectorProperties.Dispatch dispatch) {
        return new ThreadPoolExecutor(
                dispatch.getPoolSize(),
                dispatch.getPoolSize(),
                0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(dispatch.getQueueCapacity()),
                new CustomizableThreadFactory("collector-worker-"),
                new ThreadPoolExecutor.AbortPolicy());
    }
}
