package com.chicu.airetrain.smoke;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class DriftApiSmokeTest {

    @LocalServerPort
    int port;

    private final TestRestTemplate rest = new TestRestTemplate();

    @Test
    @SuppressWarnings("unchecked")
    void actuatorHealthShouldReportRetrainComponent() {
        ResponseEntity<Map> resp = rest.getForEntity(url("/actuator/health"), Map.class);

        assertEquals(200, resp.getStatusCode().value());
        assertEquals("UP", resp.getBody().get("status"));

        Map<String, Object> components = (Map<String, Object>) resp.getBody().get("components");
        Map<String, Object> retrain = (Map<String, Object>) components.get("retrain");
        assertNotNull(retrain);
        assertEquals("UP", retrain.get("status"));
        Map<String, Object> details = (Map<String, Object>) retrain.get("details");
        assertEquals(2, details.get("slotCeiling"));
    }

    @Test
    void severeDriftShouldBeAcceptedAndTargetVisible() {
        Map<String, Object> event = Map.of(
                "targetId", "smoke-demand",
                "severity", 0.92,
                "detectedAt", "2026-03-14T09:30:00Z",
                "featureBreakdown", Map.of("price", 0.7));

        ResponseEntity<Map> resp = rest.postForEntity(url("/api/drift-events"), event, Map.class);

        assertEquals(200, resp.getStatusCode().value());
        assertNotNull(resp.getBody());
        assertEquals("ACCEPTED", resp.getBody().get("outcome"));
        assertNotNull(resp.getBody().get("requestId"));

        ResponseEntity<Map> status = rest.getForEntity(url("/api/targets/smoke-demand"), Map.class);
        assertEquals(200, status.getStatusCode().value());
        assertEquals("smoke-demand", status.getBody().get("targetId"));
    }

    @Test
    void lowSeverityShouldBeIgnored() {
        Map<String, Object> event = Map.of(
                "targetId", "smoke-calm",
                "severity", 0.2,
                "detectedAt", "2026-03-14T09:30:00Z");

        ResponseEntity<Map> resp = rest.postForEntity(url("/api/drift-events"), event, Map.class);

        assertEquals(200, resp.getStatusCode().value());
        assertEquals("IGNORED", resp.getBody().get("outcome"));
    }

    @Test
    void malformedEventShouldBeRejectedWith400() {
        Map<String, Object> event = Map.of("targetId", "", "severity", 1.7);

        ResponseEntity<Map> resp = rest.postForEntity(url("/api/drift-events"), event, Map.class);

        assertEquals(400, resp.getStatusCode().value());
        assertEquals(400, resp.getBody().get("code"));
        assertFalse(((List<?>) resp.getBody().get("violations")).isEmpty());
    }

    @Test
    void unknownTargetShouldBe404() {
        ResponseEntity<Map> resp = rest.getForEntity(url("/api/targets/never-seen"), Map.class);

        assertEquals(404, resp.getStatusCode().value());
    }

    private String url(String path) {
        return "http://localhost:" + port + path;
    }
}
