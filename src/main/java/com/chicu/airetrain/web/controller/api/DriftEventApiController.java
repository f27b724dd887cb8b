package com.chicu.airetrain.web.controller.api;

import com.chicu.airetrain.drift.DriftIntakeService;
import com.chicu.airetrain.drift.IntakeDecision;
import com.chicu.airetrain.web.dto.DriftEventPayload;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/drift-events")
public class DriftEventApiController {

    private final DriftIntakeService intakeService;

    @PostMapping
    public IntakeDecision ingest(@Valid @RequestBody DriftEventPayload payload) {
        return intakeService.ingest(payload.toEvent());
    }
}
