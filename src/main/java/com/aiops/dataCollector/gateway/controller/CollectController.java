package com.aiops.dataCollector.gateway.controller;

import com.aiops.dataCollector.gateway.dto.CollectRequest;
import com.aiops.dataCollector.gateway.dto.StatusResponse;
import com.aiops.dataCollector.gateway.service.GatewayService;
import com.aiops.dataCollector.gateway.service.HealthService;
import com.aiops.dataCollector.identity.IdentityCodec;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * Collector REST controller - thin HTTP layer.
 *
 * Responsibilities:
 * - Accept collection jobs
 * - Expose health and version
 * - Delegate everything else to the gateway services
 */
@RestController
@RequiredArgsConstructor
public class CollectController {

    private final GatewayService gatewayService;
    private final HealthService healthService;

    /**
     * Starts a collection job for the tenant identified by the x-rh-identity header.
     *
     * @param request Optional body with the source url and payload id
     * @param identityHeader Base64 identity of the tenant
     * @return "Job initiated", or "Account processed before" when the account was collected recently
     */
    @PostMapping("/api/v1/collect")
    public ResponseEntity<StatusResponse> collect(
            @RequestBody(required = false) CollectRequest request,
            @RequestHeader(value = IdentityCodec.HEADER, required = false) String identityHeader) {

        return ResponseEntity.ok(gatewayService.collect(request, identityHeader));
    }

    @GetMapping("/")
    public ResponseEntity<StatusResponse> root() {
        StatusResponse health = healthService.check();
        HttpStatus status = health.isOk() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(health);
    }

    @GetMapping("/api/v1/version")
    public ResponseEntity<StatusResponse> version() {
        return ResponseEntity.ok(StatusResponse.ok("Data Collector Version v" + StatusResponse.API_VERSION));
    }
}
