package com.chicu.airetrain.drift;

import java.util.List;

/**
 * Битый drift payload. Поднимается до REST-слоя как 400 со списком нарушений.
 */
public class DriftEventValidationException extends IllegalArgumentException {

    private final List<String> violations;

    public DriftEventValidationException(List<String> violations) {
        super("Invalid drift event: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
