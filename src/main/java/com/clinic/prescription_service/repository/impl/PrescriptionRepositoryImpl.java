package com.clinic.prescription_service.repository.impl;

import com.clinic.prescription_service.model.Prescription;
import com.clinic.prescription_service.repository.PrescriptionRepositoryCustom;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import jakarta.persistence.criteria.*;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

@Repository
public class PrescriptionRepositoryImpl implements PrescriptionRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<Prescription> findPrescriptionsByCriteria(
            Long patientId,
            Long appointmentId,
            int skip,
            int limit
    ) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Prescription> query = cb.createQuery(Prescription.class);
        Root<Prescription> prescription = query.from(Prescription.class);

        List<Predicate> predicates = buildPredicates(cb, prescription, patientId, appointmentId);
        if (!predicates.isEmpty()) {
            query.where(cb.and(predicates.toArray(new Predicate[0])));
        }

        // Newest first, later inserts win ties
        query.orderBy(cb.desc(prescription.get("issuedAt")), cb.desc(prescription.get("prescriptionId")));

        TypedQuery<Prescription> typedQuery = entityManager.createQuery(query);
        typedQuery.setFirstResult(skip);
        typedQuery.setMaxResults(limit);

        return typedQuery.getResultList();
    }

    @Override
    public long countPrescriptionsByCriteria(Long patientId, Long appointmentId) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Long> countQuery = cb.createQuery(Long.class);
        Root<Prescription> prescription = countQuery.from(Prescription.class);

        List<Predicate> predicates = buildPredicates(cb, prescription, patientId, appointmentId);
        countQuery.select(cb.count(prescription));
        if (!predicates.isEmpty()) {
            countQuery.where(cb.and(predicates.toArray(new Predicate[0])));
        }

        return entityManager.createQuery(countQuery).getSingleResult();
    }

    private List<Predicate> buildPredicates(CriteriaBuilder cb, Root<Prescription> prescription,
                                            Long patientId, Long appointmentId) {
        List<Predicate> predicates = new ArrayList<>();
        if (patientId != null) {
            predicates.add(cb.equal(prescription.get("patientId"), patientId));
        }
        if (appointmentId != null) {
            predicates.add(cb.equal(prescription.get("appointmentId"), appointmentId));
        }
        return predicates;
    }
}
