package com.chicu.airetrain.validation;

/**
 * Парный тест значимости по ошибкам кандидата и baseline на одних и тех же сэмплах.
 */
@FunctionalInterface
public interface PairedSignificanceTest {

    /**
     * @param candidateErrors ошибки кандидата, i-й элемент: тот же sample, что и в baselineErrors
     * @return p-value в [0,1]
     */
    double pValue(double[] candidateErrors, double[] baselineErrors);
}
