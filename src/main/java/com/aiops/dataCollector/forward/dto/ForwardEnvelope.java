package com.aiops.dataCollector.forward.dto;

/**
 * Body posted to the downstream service.
 *
 * @param id Source id of the job
 * @param data A single collection, or a map of entity name to collection
 */
public record ForwardEnvelope(String id, Object data) {
}
