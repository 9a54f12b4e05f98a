package com.bookcatalog.controller;

import com.bookcatalog.config.CatalogProperties;
import com.bookcatalog.dto.response.ServiceStatusResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Tag(name = "Status", description = "Service liveness")
public class StatusController {

    private final CatalogProperties properties;

    @GetMapping("/")
    @Operation(summary = "Service status", description = "Lightweight check that the API is up.")
    public ResponseEntity<ServiceStatusResponse> status() {
        return ResponseEntity.ok(new ServiceStatusResponse(
            properties.title() + " is running", "running", properties.version()));
    }
}
