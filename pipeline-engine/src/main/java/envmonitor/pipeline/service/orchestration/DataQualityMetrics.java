package envmonitor.pipeline.service.orchestration;

import envmonitor.domain.dto.DataQualitySnapshot;
import envmonitor.domain.validation.RejectionReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Contadores de calidad de datos. Se publican en Micrometer (y por tanto en /actuator/metrics)
 * y se resumen en un {@link DataQualitySnapshot} para el dashboard.
 */
@Component
public class DataQualityMetrics {

    private final Counter accepted;
    private final Counter faults;
    private final Map<RejectionReason, Counter> rejected = new EnumMap<>(RejectionReason.class);

    public DataQualityMetrics(MeterRegistry registry) {
        this.accepted = registry.counter("envmonitor_readings_accepted_total");
        this.faults = registry.counter("envmonitor_processing_faults_total");
        for (RejectionReason reason : RejectionReason.values()) {
            rejected.put(reason, registry.counter("envmonitor_readings_rejected_total", "reason", reason.getTag()));
        }
    }

    public void recordAccepted() {
        accepted.increment();
    }

    public void recordRejected(RejectionReason reason) {
        rejected.get(reason).increment();
    }

    public void recordFault() {
        faults.increment();
    }

    public long rejectedCount(RejectionReason reason) {
        return (long) rejected.get(reason).count();
    }

    public DataQualitySnapshot snapshot(int trackedSensors, Instant now) {
        Map<String, Long> byReason = new LinkedHashMap<>();
        rejected.forEach((reason, counter) -> byReason.put(reason.getTag(), (long) counter.count()));
        return new DataQualitySnapshot((long) accepted.count(), byReason, (long) faults.count(), trackedSensors, now);
    }
}
