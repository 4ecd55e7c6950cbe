package com.clinic.prescription_service.service;

import com.clinic.prescription_service.config.AsyncConfig;
import com.clinic.prescription_service.config.ServiceEndpointsConfig;
import com.clinic.prescription_service.dto.request.NotificationRequest;
import com.clinic.prescription_service.dto.response.PrescriptionResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.clinic.prescription_service.config.CorrelationIdFilter.CORRELATION_ID_HEADER;
import static com.clinic.prescription_service.config.CorrelationIdFilter.CORRELATION_ID_KEY;
import static com.clinic.prescription_service.util.Constants.EVENT_PRESCRIPTION_CREATED;

/**
 * Best-effort delivery of events to the notification service. Runs on the notification
 * executor and never reports failure to the caller.
 */
@Service
@Slf4j
public class NotificationService {

    private final WebClient webClient;
    private final Duration timeout;

    public NotificationService(WebClient.Builder webClientBuilder, ServiceEndpointsConfig endpoints) {
        ServiceEndpointsConfig.Endpoint notification = endpoints.getNotification();
        this.webClient = webClientBuilder.clone()
                .baseUrl(notification.getBaseUrl())
                .build();
        this.timeout = notification.getTimeout();
    }

    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    public void notifyPrescriptionCreated(PrescriptionResponse prescription, String correlationId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("prescription_id", prescription.getPrescriptionId());
        data.put("appointment_id", prescription.getAppointmentId());
        data.put("patient_id", prescription.getPatientId());
        data.put("doctor_id", prescription.getDoctorId());
        data.put("medication", prescription.getMedication());

        send(EVENT_PRESCRIPTION_CREATED, data, correlationId);
    }

    void send(String eventType, Map<String, Object> data, String correlationId) {
        if (correlationId != null) {
            MDC.put(CORRELATION_ID_KEY, correlationId);
        }
        try {
            webClient.post()
                    .uri("/notifications")
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> {
                        if (correlationId != null) {
                            headers.set(CORRELATION_ID_HEADER, correlationId);
                        }
                    })
                    .bodyValue(NotificationRequest.builder().eventType(eventType).data(data).build())
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(timeout)
                    .block();
            log.debug("Notification {} sent", eventType);
        } catch (RuntimeException e) {
            log.warn("Failed to send notification {}: {}", eventType, e.getMessage());
        } finally {
            MDC.remove(CORRELATION_ID_KEY);
        }
    }
}
