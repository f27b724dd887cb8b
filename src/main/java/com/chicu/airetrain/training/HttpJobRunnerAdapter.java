package com.chicu.airetrain.training;

import com.chicu.airetrain.common.enums.JobStatus;
import com.chicu.airetrain.common.http.JsonHttpClient;
import com.chicu.airetrain.config.ExternalServicesProperties;
import com.chicu.airetrain.training.dto.JobStatusResponseDto;
import com.chicu.airetrain.training.dto.SubmitJobRequestDto;
import com.chicu.airetrain.training.dto.SubmitJobResponseDto;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import java.util.Map;

@Slf4j
@Component
public class HttpJobRunnerAdapter implements JobRunnerAdapter {

    private final JsonHttpClient client;

    public HttpJobRunnerAdapter(OkHttpClient okHttpClient,
                                ObjectMapper objectMapper,
                                ExternalServicesProperties props) {
        this.client = new JsonHttpClient("Job runner", okHttpClient, objectMapper, props.getRunner());
    }

    @Override
    public String submit(String targetId, String datasetRef, String warmStartRef, String versionLabel) {
        SubmitJobRequestDto req = SubmitJobRequestDto.builder()
                .targetId(targetId)
                .datasetRef(datasetRef)
                .warmStartRef(warmStartRef)
                .versionLabel(versionLabel)
                .meta(Map.of("trigger", "drift"))
                .build();

        SubmitJobResponseDto resp = client.post(req, SubmitJobResponseDto.class, "jobs");
        if (resp.getJobId() == null || resp.getJobId().isBlank()) {
            throw new IllegalStateException("Job runner не вернул jobId: " + resp.getMessage());
        }

        log.info("🏋️ SUBMIT OK target={} externalJob={} dataset={} warmStart={} version={}",
                targetId, resp.getJobId(), datasetRef, warmStartRef, versionLabel);
        return resp.getJobId();
    }

    @Override
    public JobPollResult poll(String externalJobId) {
        JobStatusResponseDto resp = client.get(JobStatusResponseDto.class, "jobs", externalJobId)
                .orElseThrow(() -> new IllegalStateException("Job runner не знает job " + externalJobId));

        JobStatus status = JobStatus.parse(resp.getStatus());

        return JobPollResult.builder()
                .status(status)
                .metrics(status == JobStatus.SUCCEEDED && resp.getMetrics() != null ? resp.getMetrics().toMetrics() : null)
                .artifactRef(resp.getArtifactRef())
                .message(resp.getMessage())
                .build();
    }
}
