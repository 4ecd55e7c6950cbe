package com.clinic.prescription_service.controller;

import com.clinic.prescription_service.config.CorrelationIdFilter;
import com.clinic.prescription_service.dto.request.PrescriptionRequest;
import com.clinic.prescription_service.dto.response.PrescriptionResponse;
import com.clinic.prescription_service.service.PrescriptionService;
import com.clinic.prescription_service.util.Constants;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping({"/prescriptions", "/v1/prescriptions"})
@RequiredArgsConstructor
@Validated
public class PrescriptionController {

    private final PrescriptionService prescriptionService;

    @GetMapping
    public ResponseEntity<List<PrescriptionResponse>> getPrescriptions(
            @RequestParam(name = "skip", defaultValue = Constants.DEFAULT_SKIP)
            @Min(value = 0, message = "skip must be greater than or equal to 0") int skip,
            @RequestParam(name = "limit", defaultValue = Constants.DEFAULT_LIMIT)
            @Min(value = 1, message = "limit must be at least 1")
            @Max(value = Constants.MAX_LIMIT, message = "limit must not exceed 100") int limit,
            @RequestParam(name = "patient_id", required = false) Long patientId,
            @RequestParam(name = "appointment_id", required = false) Long appointmentId) {

        List<PrescriptionResponse> prescriptions = prescriptionService.getPrescriptions(
                skip, limit, patientId, appointmentId);
        return ResponseEntity.ok(prescriptions);
    }

    @GetMapping("/{id}")
    public ResponseEntity<PrescriptionResponse> getPrescriptionById(@PathVariable("id") Long id) {
        return ResponseEntity.ok(prescriptionService.getPrescriptionById(id));
    }

    @PostMapping
    public ResponseEntity<PrescriptionResponse> createPrescription(
            @Valid @RequestBody PrescriptionRequest request,
            @RequestAttribute(name = CorrelationIdFilter.CORRELATION_ID_KEY, required = false) String correlationId) {

        PrescriptionResponse prescription = prescriptionService.createPrescription(request, correlationId);
        return ResponseEntity.status(HttpStatus.CREATED).body(prescription);
    }
}
