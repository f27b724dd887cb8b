package com.chicu.airetrain.validation;

import com.chicu.airetrain.registry.CandidateModel;
import com.chicu.airetrain.registry.EvaluationMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class CandidateAuditService {

    private final CandidateModelRepository repo;

    @Transactional
    public CandidateModelEntity record(String targetId, CandidateModel candidate, String baselineRef,
                                       ValidationResult result, Instant at) {
        EvaluationMetrics m = candidate.metrics();
        EvaluationMetrics b = result.baselineMetrics();

        CandidateModelEntity e = CandidateModelEntity.builder()
                .candidateId(candidate.candidateId())
                .targetId(targetId)
                .jobRef(candidate.jobRef())
                .artifactRef(candidate.artifactRef())
                .baselineRef(baselineRef)
                .mae(m != null ? m.mae() : null)
                .rmse(m != null ? m.rmse() : null)
                .nSamples(m != null ? m.nSamples() : null)
                .baselineMae(b != null ? b.mae() : null)
                .delta(result.delta())
                .pValue(result.pValue())
                .decision(result.decision())
                .reason(result.reason())
                .createdAt(at)
                .build();

        return repo.save(e);
    }

    @Transactional(readOnly = true)
    public List<CandidateModelEntity> recent(String targetId) {
        return repo.findTop20ByTargetIdOrderByCreatedAtDesc(targetId);
    }
}
