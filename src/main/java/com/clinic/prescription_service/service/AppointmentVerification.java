package com.clinic.prescription_service.service;

import com.clinic.prescription_service.dto.response.AppointmentResponse;
import com.clinic.prescription_service.exception.AppointmentVerificationException;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Outcome of verifying an appointment: either the verified appointment or exactly one failure.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class AppointmentVerification {

    private final AppointmentResponse appointment;
    private final VerificationFailure failure;
    private final String message;

    public static AppointmentVerification verified(AppointmentResponse appointment) {
        return new AppointmentVerification(appointment, null, null);
    }

    public static AppointmentVerification failed(VerificationFailure failure, String message) {
        return new AppointmentVerification(null, failure, message);
    }

    public boolean isVerified() {
        return failure == null;
    }

    public AppointmentResponse orElseThrow() {
        if (!isVerified()) {
            throw new AppointmentVerificationException(failure, message);
        }
        return appointment;
    }
}
