package com.chicu.airetrain.drift;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface IntakeAuditRepository extends JpaRepository<IntakeAuditEntity, Long> {

    List<IntakeAuditEntity> findTop50ByTargetIdOrderByCreatedAtDesc(String targetId);

    long countByTargetIdAndOutcome(String targetId, IntakeOutcome outcome);
}
