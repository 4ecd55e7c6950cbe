package com.clinic.prescription_service.controller;

import com.clinic.prescription_service.dto.response.AppointmentResponse;
import com.clinic.prescription_service.repository.PrescriptionRepository;
import com.clinic.prescription_service.service.AppointmentVerification;
import com.clinic.prescription_service.service.AppointmentVerifier;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Runs the real notification client against a port nothing listens on.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestPropertySource(properties = {
        "services.notification.base-url=http://127.0.0.1:1",
        "services.notification.timeout=500ms"
})
class NotificationFailureIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private PrescriptionRepository prescriptionRepository;

    @MockBean
    private AppointmentVerifier appointmentVerifier;

    @Test
    void unreachableNotificationServiceDoesNotFailCreation() throws Exception {
        long before = prescriptionRepository.count();
        when(appointmentVerifier.verify(77L, 5L, 7L)).thenReturn(AppointmentVerification.verified(
                AppointmentResponse.builder().appointmentId(77L).patientId(5L).doctorId(7L).status("COMPLETED").build()));

        mockMvc.perform(post("/prescriptions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"appointment_id\": 77, \"patient_id\": 5, \"doctor_id\": 7, "
                                + "\"medication\": \"Metformin\", \"dosage\": \"850mg\", \"days\": 30}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.medication", is("Metformin")));

        assertThat(prescriptionRepository.count()).isEqualTo(before + 1);
    }
}
