package com.clinic.prescription_service.service;

import com.clinic.prescription_service.config.ServiceEndpointsConfig;
import com.clinic.prescription_service.exception.AppointmentVerificationException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AppointmentVerifierTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private AppointmentVerifier verifierRespondingWith(ExchangeFunction exchange) {
        ServiceEndpointsConfig endpoints = new ServiceEndpointsConfig();
        endpoints.getAppointment().setBaseUrl("http://appointments.test");
        endpoints.getAppointment().setTimeout(Duration.ofMillis(200));

        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            lastRequest.set(request);
            return exchange.exchange(request);
        });
        return new AppointmentVerifier(builder, endpoints);
    }

    private AppointmentVerifier verifierReturning(HttpStatus status, String body) {
        return verifierRespondingWith(request -> Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build()));
    }

    private static String appointment(String status, long patientId, long doctorId) {
        return String.format("{\"appointment_id\": 42, \"patient_id\": %d, \"doctor_id\": %d, "
                + "\"status\": \"%s\", \"slot_start\": \"2026-10-19T09:00:00Z\"}", patientId, doctorId, status);
    }

    @Test
    void completedAppointmentWithMatchingIdsIsVerified() {
        AppointmentVerifier verifier = verifierReturning(HttpStatus.OK, appointment("COMPLETED", 5, 7));

        AppointmentVerification result = verifier.verify(42L, 5L, 7L);

        assertThat(result.isVerified()).isTrue();
        assertThat(result.getAppointment().getStatus()).isEqualTo("COMPLETED");
        assertThat(result.getAppointment().getPatientId()).isEqualTo(5L);
        assertThat(lastRequest.get().url().toString()).isEqualTo("http://appointments.test/appointments/42");
    }

    @Test
    void missingAppointmentIsReportedAsNotFound() {
        AppointmentVerifier verifier = verifierReturning(HttpStatus.NOT_FOUND, "{\"detail\": \"Appointment not found\"}");

        AppointmentVerification result = verifier.verify(42L, 5L, 7L);

        assertThat(result.isVerified()).isFalse();
        assertThat(result.getFailure()).isEqualTo(VerificationFailure.APPOINTMENT_NOT_FOUND);
        assertThat(result.getFailure().getStatus()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void upstreamErrorStatusIsReportedAsUnavailable() {
        AppointmentVerifier verifier = verifierReturning(HttpStatus.INTERNAL_SERVER_ERROR, "{}");

        AppointmentVerification result = verifier.verify(42L, 5L, 7L);

        assertThat(result.getFailure()).isEqualTo(VerificationFailure.APPOINTMENT_SERVICE_UNAVAILABLE);
        assertThat(result.getFailure().getStatus()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    void connectionFailureIsReportedAsUnavailable() {
        AppointmentVerifier verifier = verifierRespondingWith(
                request -> Mono.error(new ConnectException("Connection refused")));

        AppointmentVerification result = verifier.verify(42L, 5L, 7L);

        assertThat(result.getFailure()).isEqualTo(VerificationFailure.APPOINTMENT_SERVICE_UNAVAILABLE);
    }

    @Test
    void slowUpstreamIsReportedAsUnavailable() {
        AppointmentVerifier verifier = verifierRespondingWith(request -> Mono.never());

        AppointmentVerification result = verifier.verify(42L, 5L, 7L);

        assertThat(result.getFailure()).isEqualTo(VerificationFailure.APPOINTMENT_SERVICE_UNAVAILABLE);
    }

    @Test
    void emptyBodyIsReportedAsUnavailable() {
        AppointmentVerifier verifier = verifierRespondingWith(request -> Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build()));

        AppointmentVerification result = verifier.verify(42L, 5L, 7L);

        assertThat(result.getFailure()).isEqualTo(VerificationFailure.APPOINTMENT_SERVICE_UNAVAILABLE);
    }

    @Test
    void appointmentNotCompletedReportsObservedStatus() {
        AppointmentVerifier verifier = verifierReturning(HttpStatus.OK, appointment("SCHEDULED", 5, 7));

        AppointmentVerification result = verifier.verify(42L, 5L, 7L);

        assertThat(result.getFailure()).isEqualTo(VerificationFailure.APPOINTMENT_NOT_COMPLETED);
        assertThat(result.getMessage()).contains("SCHEDULED");
    }

    @Test
    void statusCheckIsCaseSensitive() {
        AppointmentVerifier verifier = verifierReturning(HttpStatus.OK, appointment("completed", 5, 7));

        assertThat(verifier.verify(42L, 5L, 7L).getFailure())
                .isEqualTo(VerificationFailure.APPOINTMENT_NOT_COMPLETED);
    }

    @Test
    void statusIsCheckedBeforeIdentities() {
        AppointmentVerifier verifier = verifierReturning(HttpStatus.OK, appointment("CANCELLED", 99, 98));

        assertThat(verifier.verify(42L, 5L, 7L).getFailure())
                .isEqualTo(VerificationFailure.APPOINTMENT_NOT_COMPLETED);
    }

    @Test
    void patientMismatchIsReportedWithBothIds() {
        AppointmentVerifier verifier = verifierReturning(HttpStatus.OK, appointment("COMPLETED", 6, 7));

        AppointmentVerification result = verifier.verify(42L, 5L, 7L);

        assertThat(result.getFailure()).isEqualTo(VerificationFailure.PATIENT_MISMATCH);
        assertThat(result.getMessage()).contains("6").contains("5");
    }

    @Test
    void patientIsCheckedBeforeDoctor() {
        AppointmentVerifier verifier = verifierReturning(HttpStatus.OK, appointment("COMPLETED", 6, 8));

        assertThat(verifier.verify(42L, 5L, 7L).getFailure()).isEqualTo(VerificationFailure.PATIENT_MISMATCH);
    }

    @Test
    void doctorMismatchIsReported() {
        AppointmentVerifier verifier = verifierReturning(HttpStatus.OK, appointment("COMPLETED", 5, 8));

        AppointmentVerification result = verifier.verify(42L, 5L, 7L);

        assertThat(result.getFailure()).isEqualTo(VerificationFailure.DOCTOR_MISMATCH);
        assertThat(result.getFailure().getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void failedVerificationThrowsOnUnwrap() {
        AppointmentVerifier verifier = verifierReturning(HttpStatus.OK, appointment("SCHEDULED", 5, 7));

        AppointmentVerification result = verifier.verify(42L, 5L, 7L);

        assertThatThrownBy(result::orElseThrow)
                .isInstanceOf(AppointmentVerificationException.class)
                .hasMessageContaining("SCHEDULED")
                .extracting("errorCode").isEqualTo("APPOINTMENT_NOT_COMPLETED");
    }
}
