package envmonitor.pipeline.service.detection;

import envmonitor.config.PipelineConfig;
import envmonitor.domain.anomaly.AnomalyScore;
import envmonitor.domain.anomaly.Classification;
import envmonitor.pipeline.service.state.StreamState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static envmonitor.pipeline.support.Readings.temperature;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AnomalyDetectorTest {

    private final PipelineConfig config = PipelineConfig.defaults();
    private final AnomalyDetector detector = new AnomalyDetector(config, new FeatureExtractor(config));

    /**
     * Diez lecturas alternando 19 y 21: media 20, desviación muestral sqrt(10/9).
     */
    private static StreamState alternatingHistory() {
        StreamState state = StreamState.empty("temp-1", 100);
        for (int i = 1; i <= 10; i++) {
            state = state.update(temperature("temp-1", i % 2 == 0 ? 21.0 : 19.0, i));
        }
        return state;
    }

    @Test
    @DisplayName("Sin histórico suficiente la lectura es normal con puntuación 0")
    void insufficientHistoryIsNormal() {
        StreamState prior = StreamState.empty("temp-1", 100).update(temperature("temp-1", 20.0, 1));

        AnomalyScore score = detector.score(prior, new StubModel("g", 1, 1.0), temperature("temp-1", 99.0, 2));

        assertThat(score.classification()).isEqualTo(Classification.NORMAL);
        assertThat(score.combinedScore()).isZero();
        assertThat(score.modelScore()).isNull();
    }

    @Test
    @DisplayName("Salto brusco sin modelo: z-score crítico")
    void spikeIsCriticalWithoutModel() {
        AnomalyScore score = detector.score(alternatingHistory(), null, temperature("temp-1", 30.0, 11));

        assertThat(score.statisticalScore()).isCloseTo(10.0 / Math.sqrt(10.0 / 9.0), within(1e-9));
        assertThat(score.combinedScore()).isEqualTo(score.statisticalScore());
        assertThat(score.classification()).isEqualTo(Classification.CRITICAL);
        assertThat(score.modelVersion()).isNull();
    }

    @Test
    @DisplayName("Lectura en la media: normal")
    void valueAtMeanIsNormal() {
        AnomalyScore score = detector.score(alternatingHistory(), null, temperature("temp-1", 20.0, 11));

        assertThat(score.statisticalScore()).isZero();
        assertThat(score.classification()).isEqualTo(Classification.NORMAL);
    }

    @Test
    @DisplayName("Ventana constante: z-score 0 aunque el valor cambie")
    void constantWindowYieldsZeroStatisticalScore() {
        StreamState flat = StreamState.empty("temp-1", 100);
        for (int i = 1; i <= 10; i++) {
            flat = flat.update(temperature("temp-1", 20.0, i));
        }

        AnomalyScore score = detector.score(flat, null, temperature("temp-1", 25.0, 11));

        assertThat(score.statisticalScore()).isZero();
    }

    @Test
    @DisplayName("Con modelo: mezcla ponderada y versión del modelo en la puntuación")
    void blendsModelScore() {
        AnomalyScore score = detector.score(alternatingHistory(), new StubModel("g", 4, 0.9), temperature("temp-1", 20.0, 11));

        // 0.7 * 0 + 0.3 * (0.4 * 2 * 10)
        assertThat(score.combinedScore()).isCloseTo(2.4, within(1e-9));
        assertThat(score.modelScore()).isEqualTo(0.9);
        assertThat(score.modelVersion()).isEqualTo(4L);
        assertThat(score.classification()).isEqualTo(Classification.NORMAL);
    }

    @Test
    void combineIgnoresModelScoresBelowOneHalf() {
        assertThat(detector.combine(2.0, null)).isEqualTo(2.0);
        assertThat(detector.combine(2.0, 0.4)).isCloseTo(1.4, within(1e-12));
        assertThat(detector.combine(2.0, 0.9)).isCloseTo(3.8, within(1e-12));
    }

    @Test
    @DisplayName("Si el modelo falla se usa solo el z-score")
    void failingModelFallsBackToStatistical() {
        AnomalyModel throwing = new AnomalyModel() {
            @Override
            public double score(double[] features) {
                throw new IllegalStateException("boom");
            }

            @Override
            public String group() {
                return "g";
            }

            @Override
            public long version() {
                return 2;
            }

            @Override
            public Instant trainedAt() {
                return Instant.EPOCH;
            }

            @Override
            public int trainingSamples() {
                return 0;
            }
        };

        AnomalyScore score = detector.score(alternatingHistory(), throwing, temperature("temp-1", 30.0, 11));

        assertThat(score.modelScore()).isNull();
        assertThat(score.combinedScore()).isEqualTo(score.statisticalScore());
        assertThat(score.classification()).isEqualTo(Classification.CRITICAL);
    }
}
