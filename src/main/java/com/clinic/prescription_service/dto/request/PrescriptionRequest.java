package com.clinic.prescription_service.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrescriptionRequest {

    @NotNull(message = "Appointment id is required")
    private Long appointmentId;

    @NotNull(message = "Patient id is required")
    private Long patientId;

    @NotNull(message = "Doctor id is required")
    private Long doctorId;

    @NotBlank(message = "Medication is required")
    @Size(max = 255, message = "Medication must not exceed 255 characters")
    private String medication;

    @NotBlank(message = "Dosage is required")
    @Size(max = 255, message = "Dosage must not exceed 255 characters")
    private String dosage;

    @NotNull(message = "Days is required")
    private Integer days;
}
