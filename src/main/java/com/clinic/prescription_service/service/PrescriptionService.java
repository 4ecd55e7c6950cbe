package com.clinic.prescription_service.service;

import com.clinic.prescription_service.dto.request.PrescriptionRequest;
import com.clinic.prescription_service.dto.response.AppointmentResponse;
import com.clinic.prescription_service.dto.response.PrescriptionResponse;
import com.clinic.prescription_service.exception.ResourceNotFoundException;
import com.clinic.prescription_service.model.Prescription;
import com.clinic.prescription_service.repository.PrescriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class PrescriptionService {

    private final PrescriptionRepository prescriptionRepository;
    private final AppointmentVerifier appointmentVerifier;
    private final NotificationService notificationService;
    private final ModelMapper modelMapper;

    @Transactional(readOnly = true)
    public PrescriptionResponse getPrescriptionById(Long id) {
        Prescription prescription = prescriptionRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Prescription", "id", id));
        return mapToPrescriptionResponse(prescription);
    }

    @Transactional(readOnly = true)
    public List<PrescriptionResponse> getPrescriptions(int skip, int limit, Long patientId, Long appointmentId) {
        List<PrescriptionResponse> prescriptions = prescriptionRepository
                .findPrescriptionsByCriteria(patientId, appointmentId, skip, limit)
                .stream()
                .map(this::mapToPrescriptionResponse)
                .collect(Collectors.toList());

        long total = prescriptionRepository.countPrescriptionsByCriteria(patientId, appointmentId);
        log.info("Prescriptions retrieved: total={}, returned={}", total, prescriptions.size());
        return prescriptions;
    }

    /**
     * Verifies the referenced appointment, stores the prescription and fires the creation
     * notification. Nothing is written when verification fails. Not transactional: the
     * verification round-trip must not hold a database connection.
     */
    public PrescriptionResponse createPrescription(PrescriptionRequest request, String correlationId) {
        AppointmentResponse appointment = appointmentVerifier
                .verify(request.getAppointmentId(), request.getPatientId(), request.getDoctorId())
                .orElseThrow();

        log.info("Appointment {} verified (status: {})", request.getAppointmentId(), appointment.getStatus());

        Prescription prescription = Prescription.builder()
                .appointmentId(request.getAppointmentId())
                .patientId(request.getPatientId())
                .doctorId(request.getDoctorId())
                .medication(request.getMedication())
                .dosage(request.getDosage())
                .days(request.getDays())
                .build();

        Prescription savedPrescription = prescriptionRepository.save(prescription);
        log.info("Prescription created with ID: {} for appointment: {}",
                savedPrescription.getPrescriptionId(), savedPrescription.getAppointmentId());

        PrescriptionResponse response = mapToPrescriptionResponse(savedPrescription);
        try {
            notificationService.notifyPrescriptionCreated(response, correlationId);
        } catch (TaskRejectedException e) {
            log.warn("Notification for prescription {} dropped: {}", response.getPrescriptionId(), e.getMessage());
        }
        return response;
    }

    private PrescriptionResponse mapToPrescriptionResponse(Prescription prescription) {
        return modelMapper.map(prescription, PrescriptionResponse.class);
    }
}
