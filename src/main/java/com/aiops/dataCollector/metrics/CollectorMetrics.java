package com.aiops.dataCollector.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Counters for the collection pipeline.
 */
@Component
public class CollectorMetrics {

    private final Counter jobsTotal;
    private final Counter jobsDenied;
    private final Counter jobsInitiated;
    private final Counter jobsFailed;
    private final Counter gets;
    private final Counter getSuccesses;
    private final Counter getErrors;
    private final Counter posts;
    private final Counter postSuccesses;
    private final Counter postErrors;

    public CollectorMetrics(MeterRegistry meterRegistry) {
        this.jobsTotal = counter(meterRegistry, "collector.jobs.total", "Total number of collection requests");
        this.jobsDenied = counter(meterRegistry, "collector.jobs.denied", "Requests refused at ingress");
        this.jobsInitiated = counter(meterRegistry, "collector.jobs.initiated", "Jobs handed to the worker pool");
        this.jobsFailed = counter(meterRegistry, "collector.jobs.failed", "Jobs ended by an unhandled error");
        this.gets = counter(meterRegistry, "collector.gets", "Collection fetches attempted");
        this.getSuccesses = counter(meterRegistry, "collector.get.successes", "Collection fetches succeeded");
        this.getErrors = counter(meterRegistry, "collector.get.errors", "Collection fetches failed");
        this.posts = counter(meterRegistry, "collector.posts", "Forward posts attempted");
        this.postSuccesses = counter(meterRegistry, "collector.post.successes", "Forward posts succeeded");
        this.postErrors = counter(meterRegistry, "collector.post.errors", "Forward posts failed");
    }

    private static Counter counter(MeterRegistry meterRegistry, String name, String description) {
        return Counter.builder(name)
                .description(description)
                .register(meterRegistry);
    }

    public void jobReceived() {
        jobsTotal.increment();
    }

    public void jobDenied() {
        jobsDenied.increment();
    }

    public void jobInitiated() {
        jobsInitiated.increment();
    }

    public void jobFailed() {
        jobsFailed.increment();
    }

    public void getAttempted() {
        gets.increment();
    }

    public void getSucceeded() {
        getSuccesses.increment();
    }

    public void getFailed() {
        getErrors.increment();
    }

    public void postAttempted() {
        posts.increment();
    }

    public void postSucceeded() {
        postSuccesses.increment();
    }

    public void postFailed() {
        postErrors.increment();
    }
}
