package com.clinic.prescription_service.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrescriptionResponse {
    private Long prescriptionId;
    private Long appointmentId;
    private Long patientId;
    private Long doctorId;
    private String medication;
    private String dosage;
    private Integer days;
    private Instant issuedAt;
}
