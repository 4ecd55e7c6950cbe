package com.clinic.prescription_service.controller;

import com.clinic.prescription_service.dto.response.HealthResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import static com.clinic.prescription_service.util.Constants.SERVICE_NAME;

@RestController
public class HealthController {

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse("healthy", SERVICE_NAME));
    }
}
