package com.clinic.prescription_service.service;

import com.clinic.prescription_service.config.ServiceEndpointsConfig;
import com.clinic.prescription_service.dto.response.AppointmentResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Objects;

import static com.clinic.prescription_service.util.Constants.APPOINTMENT_STATUS_COMPLETED;

/**
 * Checks a prescription candidate against the appointment it references.
 * <p>
 * The appointment is fetched synchronously and checked in order: it must exist, be
 * {@code COMPLETED}, and belong to the same patient and doctor. The first failing check
 * decides the result.
 */
@Service
@Slf4j
public class AppointmentVerifier {

    private final WebClient webClient;
    private final Duration timeout;

    public AppointmentVerifier(WebClient.Builder webClientBuilder, ServiceEndpointsConfig endpoints) {
        ServiceEndpointsConfig.Endpoint appointment = endpoints.getAppointment();
        this.webClient = webClientBuilder.clone()
                .baseUrl(appointment.getBaseUrl())
                .build();
        this.timeout = appointment.getTimeout();
        log.info("Appointment verifier initialized for {} (timeout: {})", appointment.getBaseUrl(), timeout);
    }

    public AppointmentVerification verify(Long appointmentId, Long patientId, Long doctorId) {
        AppointmentResponse appointment;
        try {
            appointment = webClient.get()
                    .uri("/appointments/{id}", appointmentId)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(AppointmentResponse.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException.NotFound e) {
            log.warn("Appointment {} not found", appointmentId);
            return AppointmentVerification.failed(VerificationFailure.APPOINTMENT_NOT_FOUND,
                    String.format("Appointment %d not found", appointmentId));
        } catch (WebClientResponseException e) {
            log.warn("Appointment service answered {} for appointment {}", e.getStatusCode(), appointmentId);
            return unavailable(appointmentId);
        } catch (RuntimeException e) {
            log.warn("Appointment service unreachable for appointment {}: {}", appointmentId, e.getMessage());
            return unavailable(appointmentId);
        }

        if (appointment == null) {
            log.warn("Appointment service returned an empty body for appointment {}", appointmentId);
            return unavailable(appointmentId);
        }

        return check(appointmentId, appointment, patientId, doctorId);
    }

    private AppointmentVerification check(Long appointmentId, AppointmentResponse appointment,
                                          Long patientId, Long doctorId) {
        if (!APPOINTMENT_STATUS_COMPLETED.equals(appointment.getStatus())) {
            return AppointmentVerification.failed(VerificationFailure.APPOINTMENT_NOT_COMPLETED,
                    String.format("Appointment %d must be %s to issue a prescription, current status: %s",
                            appointmentId, APPOINTMENT_STATUS_COMPLETED, appointment.getStatus()));
        }
        if (!Objects.equals(appointment.getPatientId(), patientId)) {
            return AppointmentVerification.failed(VerificationFailure.PATIENT_MISMATCH,
                    String.format("Patient mismatch for appointment %d: appointment patient is %s, request patient is %s",
                            appointmentId, appointment.getPatientId(), patientId));
        }
        if (!Objects.equals(appointment.getDoctorId(), doctorId)) {
            return AppointmentVerification.failed(VerificationFailure.DOCTOR_MISMATCH,
                    String.format("Doctor mismatch for appointment %d: appointment doctor is %s, request doctor is %s",
                            appointmentId, appointment.getDoctorId(), doctorId));
        }

        log.debug("Appointment {} verified for patient {} and doctor {}", appointmentId, patientId, doctorId);
        return AppointmentVerification.verified(appointment);
    }

    private AppointmentVerification unavailable(Long appointmentId) {
        return AppointmentVerification.failed(VerificationFailure.APPOINTMENT_SERVICE_UNAVAILABLE,
                String.format("Appointment service unavailable, could not verify appointment %d", appointmentId));
    }
}
