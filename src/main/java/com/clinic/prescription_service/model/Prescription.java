package com.clinic.prescription_service.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Entity
@Immutable
@Table(name = "prescriptions", indexes = {
        @Index(name = "idx_prescriptions_appointment_id", columnList = "appointment_id"),
        @Index(name = "idx_prescriptions_patient_id", columnList = "patient_id"),
        @Index(name = "idx_prescriptions_doctor_id", columnList = "doctor_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Prescription {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "prescription_id")
    private Long prescriptionId;

    @Column(name = "appointment_id", nullable = false, updatable = false)
    private Long appointmentId;

    @Column(name = "patient_id", nullable = false, updatable = false)
    private Long patientId;

    @Column(name = "doctor_id", nullable = false, updatable = false)
    private Long doctorId;

    @Column(nullable = false, updatable = false)
    private String medication;

    @Column(nullable = false, updatable = false)
    private String dosage;

    @Column(nullable = false, updatable = false)
    private Integer days;

    @Column(name = "issued_at", nullable = false, updatable = false)
    private Instant issuedAt;

    // Truncated so the value handed back on insert matches what the database returns on read.
    @PrePersist
    void onCreate() {
        issuedAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }
}
