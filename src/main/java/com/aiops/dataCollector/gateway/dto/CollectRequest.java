package com.aiops.dataCollector.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for collection jobs.
 * The tenant identity comes from the x-rh-identity header, not from the body.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CollectRequest {

    /**
     * Data source location. Optional for workers that know their sources.
     */
    private String url;

    /**
     * Identifier echoed downstream. Generated when absent.
     */
    @JsonProperty("payload_id")
    private String payloadId;
}
