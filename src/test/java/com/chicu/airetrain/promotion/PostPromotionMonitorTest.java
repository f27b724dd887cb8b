package com.chicu.airetrain.promotion;

import com.chicu.airetrain.config.RetrainProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PostPromotionMonitorTest {

    @Mock private HealthCheckClient health;

    private final RetrainProperties props = new RetrainProperties();
    private PostPromotionMonitor monitor;

    @BeforeEach
    void setUp() {
        props.setRollbackGracePeriod(Duration.ofMillis(40));
        props.setHealthPollInterval(Duration.ofMillis(10));
        monitor = new PostPromotionMonitor(health, props);
    }

    @Test
    void healthyThroughoutGrace_shouldPassAfterAllPolls() {
        when(health.check("t")).thenReturn(true);

        assertTrue(monitor.watch("t"));
        verify(health, times(4)).check("t");
    }

    @Test
    void explicitFailure_shouldStopImmediately() {
        when(health.check("t")).thenReturn(true, false);

        assertFalse(monitor.watch("t"));
        verify(health, times(2)).check("t");
    }

    @Test
    void checkErrors_areInconclusiveAndPollingContinues() {
        when(health.check("t"))
                .thenThrow(new IllegalStateException("timeout"))
                .thenReturn(true);

        assertTrue(monitor.watch("t"));
        verify(health, times(4)).check("t");
    }

    @Test
    void failureAfterErrors_shouldStillTriggerRollback() {
        when(health.check("t"))
                .thenThrow(new IllegalStateException("timeout"))
                .thenReturn(false);

        assertFalse(monitor.watch("t"));
    }
}
