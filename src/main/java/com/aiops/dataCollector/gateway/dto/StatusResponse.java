package com.aiops.dataCollector.gateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO shared by every collector endpoint.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StatusResponse {

    public static final String API_VERSION = "1.0";

    private String status;
    private String version;
    private String message;

    public static StatusResponse ok(String message) {
        return new StatusResponse("OK", API_VERSION, message);
    }

    public static StatusResponse error(String status, String message) {
        return new StatusResponse(status, API_VERSION, message);
    }

    @JsonIgnore
    public boolean isOk() {
        return "OK".equals(status);
    }
}
