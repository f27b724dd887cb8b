package com.chicu.airetrain.validation;

import com.chicu.airetrain.common.enums.RetrainReason;
import com.chicu.airetrain.common.enums.ValidationDecision;
import com.chicu.airetrain.config.RetrainProperties;
import com.chicu.airetrain.registry.CandidateModel;
import com.chicu.airetrain.registry.EvaluationMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Статистическое сравнение кандидата с текущим production baseline.
 *
 * PROMOTE только если одновременно:
 * <ul>
 *     <li>n_samples кандидата ≥ min-eval-samples;</li>
 *     <li>наборы sample id кандидата и baseline совпадают;</li>
 *     <li>парных сэмплов тоже ≥ min-eval-samples (заявленному n_samples не верим);</li>
 *     <li>delta = (baseline.mae − candidate.mae) / baseline.mae ≥ improvement-threshold;</li>
 *     <li>p-value парного теста &lt; significance-level.</li>
 * </ul>
 * Всё остальное REJECT, прод не трогаем.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValidationGate {

    private final RetrainProperties props;
    private final PairedSignificanceTest significanceTest;

    public ValidationResult evaluate(CandidateModel candidate, EvaluationMetrics baseline) {
        EvaluationMetrics cand = candidate.metrics();

        // 1) мало данных: отказ независимо от delta
        if (cand == null || cand.nSamples() < props.getMinEvalSamples()) {
            int n = cand == null ? 0 : cand.nSamples();
            log.info("🚫 GATE REJECT candidate={} insufficient eval data n={} min={}",
                    candidate.candidateId(), n, props.getMinEvalSamples());
            return reject(candidate, baseline, deltaOf(cand, baseline), null, RetrainReason.INSUFFICIENT_EVAL_DATA);
        }

        if (baseline == null) {
            log.warn("🚫 GATE REJECT candidate={} baseline metrics unavailable", candidate.candidateId());
            return reject(candidate, null, null, null, RetrainReason.BASELINE_UNAVAILABLE);
        }

        Double delta = deltaOf(cand, baseline);

        // 2) только один и тот же набор сэмплов
        Map<String, Double> ce = cand.sampleErrors();
        Map<String, Double> be = baseline.sampleErrors();
        if (ce.isEmpty() || !ce.keySet().equals(be.keySet())) {
            log.warn("🚫 GATE REJECT candidate={} eval set mismatch candidateSamples={} baselineSamples={}",
                    candidate.candidateId(), ce.size(), be.size());
            return reject(candidate, baseline, delta, null, RetrainReason.EVAL_SET_MISMATCH);
        }

        // 3) реальный размер парной выборки
        int paired = Math.min(cand.nSamples(), ce.size());
        if (paired < props.getMinEvalSamples()) {
            log.info("🚫 GATE REJECT candidate={} insufficient paired samples paired={} reported={} min={}",
                    candidate.candidateId(), paired, cand.nSamples(), props.getMinEvalSamples());
            return reject(candidate, baseline, delta, null, RetrainReason.INSUFFICIENT_EVAL_DATA);
        }

        // 4) парный тест по sample id
        List<String> ids = new ArrayList<>(ce.keySet());
        ids.sort(null);
        double[] c = new double[ids.size()];
        double[] b = new double[ids.size()];
        for (int i = 0; i < ids.size(); i++) {
            c[i] = ce.get(ids.get(i));
            b[i] = be.get(ids.get(i));
        }
        double p = significanceTest.pValue(c, b);

        boolean improved = delta != null && delta >= props.getImprovementThreshold();
        boolean significant = p < props.getSignificanceLevel();

        ValidationResult result = ValidationResult.builder()
                .candidateId(candidate.candidateId())
                .baselineMetrics(baseline)
                .delta(delta)
                .pValue(p)
                .decision(improved && significant ? ValidationDecision.PROMOTE : ValidationDecision.REJECT)
                .reason(improved && significant ? RetrainReason.VALIDATION_PASSED : RetrainReason.VALIDATION_REGRESSION)
                .build();

        log.info("{} GATE {} candidate={} mae={} baselineMae={} delta={} p={} threshold={} significance={}",
                result.promote() ? "✅" : "🚫",
                result.decision(),
                candidate.candidateId(),
                cand.mae(),
                baseline.mae(),
                delta,
                p,
                props.getImprovementThreshold(),
                props.getSignificanceLevel());

        return result;
    }

    /**
     * null, если baseline.mae не положительный (улучшение не определено).
     */
    private static Double deltaOf(EvaluationMetrics cand, EvaluationMetrics baseline) {
        if (cand == null || baseline == null) return null;
        if (!(baseline.mae() > 0.0) || Double.isNaN(cand.mae())) return null;
        return (baseline.mae() - cand.mae()) / baseline.mae();
    }

    private static ValidationResult reject(CandidateModel candidate, EvaluationMetrics baseline,
                                           Double delta, Double p, RetrainReason reason) {
        return ValidationResult.builder()
                .candidateId(candidate.candidateId())
                .baselineMetrics(baseline)
                .delta(delta)
                .pValue(p)
                .decision(ValidationDecision.REJECT)
                .reason(reason)
                .build();
    }
}
