package com.clinic.prescription_service.repository;

import com.clinic.prescription_service.model.Prescription;

import java.util.List;

public interface PrescriptionRepositoryCustom {

    /**
     * Offset-based slice of prescriptions, newest first. Null filters are ignored.
     */
    List<Prescription> findPrescriptionsByCriteria(
            Long patientId,
            Long appointmentId,
            int skip,
            int limit
    );

    long countPrescriptionsByCriteria(Long patientId, Long appointmentId);
}
