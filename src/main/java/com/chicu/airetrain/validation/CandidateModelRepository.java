package com.chicu.airetrain.validation;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CandidateModelRepository extends JpaRepository<CandidateModelEntity, Long> {

    List<CandidateModelEntity> findTop20ByTargetIdOrderByCreatedAtDesc(String targetId);
}
