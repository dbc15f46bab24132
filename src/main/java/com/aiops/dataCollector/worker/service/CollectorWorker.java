package com.aiops.dataCollector.worker.service;

import com.aiops.dataCollector.collector.model.Job;
import com.aiops.dataCollector.worker.model.WorkerType;

/**
 * Runs the fetch, join and forward steps of one job. Called on a pool thread.
 */
public interface CollectorWorker {

    WorkerType type();

    /**
     * Executes the job to completion. Failures surface as runtime exceptions.
     *
     * @param job Job with its source id already set
     */
    void run(Job job);
}
