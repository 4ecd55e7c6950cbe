package com.clinic.prescription_service.service;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum VerificationFailure {
    APPOINTMENT_NOT_FOUND(HttpStatus.NOT_FOUND),
    APPOINTMENT_SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    APPOINTMENT_NOT_COMPLETED(HttpStatus.BAD_REQUEST),
    PATIENT_MISMATCH(HttpStatus.BAD_REQUEST),
    DOCTOR_MISMATCH(HttpStatus.BAD_REQUEST);

    private final HttpStatus status;
}
