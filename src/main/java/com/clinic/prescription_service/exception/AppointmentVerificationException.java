package com.clinic.prescription_service.exception;

import com.clinic.prescription_service.service.VerificationFailure;
import lombok.Getter;

/**
 * Raised when a prescription cannot be created because its appointment failed verification.
 */
@Getter
public class AppointmentVerificationException extends ApiException {
    private final VerificationFailure failure;

    public AppointmentVerificationException(VerificationFailure failure, String message) {
        super(message, failure.getStatus(), failure.name());
        this.failure = failure;
    }
}
