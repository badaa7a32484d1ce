package envmonitor.pipeline.service.orchestration;

import envmonitor.pipeline.service.detection.ModelRetrainer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.*;

@ExtendWith({MockitoExtension.class, OutputCaptureExtension.class})
class PipelineSchedulerTest {

    @Mock
    private PipelineOrchestrator orchestrator;
    @Mock
    private ModelRetrainer retrainer;

    @InjectMocks
    private PipelineScheduler scheduler;

    @Test
    void sweepDelegatesToOrchestrator() {
        when(orchestrator.sweepAlerts()).thenReturn(CompletableFuture.completedFuture(List.of()));

        scheduler.sweepAlerts();

        verify(orchestrator).sweepAlerts();
    }

    @Test
    void failingSweepDoesNotKillTheSchedulerThread() {
        when(orchestrator.sweepAlerts()).thenThrow(new IllegalStateException("lanes closed"));

        assertThatCode(() -> scheduler.sweepAlerts()).doesNotThrowAnyException();
    }

    @Test
    void asynchronousSweepFailureIsLogged(CapturedOutput output) {
        when(orchestrator.sweepAlerts())
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("lane 1 sweep exploded")));

        assertThatCode(() -> scheduler.sweepAlerts()).doesNotThrowAnyException();

        assertThat(output).contains("Alert sweep failed").contains("lane 1 sweep exploded");
    }

    @Test
    void retrainTickDelegatesToRetrainer() {
        when(retrainer.tick()).thenReturn(2);

        scheduler.retrainTick();

        verify(retrainer, times(1)).tick();
        verifyNoInteractions(orchestrator);
    }
}
