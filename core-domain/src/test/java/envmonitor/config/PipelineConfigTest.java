package envmonitor.config;

import envmonitor.domain.anomaly.Classification;
import envmonitor.domain.exception.ConfigurationException;
import envmonitor.domain.sensors.SensorType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class PipelineConfigTest {

    @Test
    @DisplayName("Los valores por defecto son coherentes")
    void defaultsAreValid() {
        PipelineConfig config = PipelineConfig.defaults().validate();

        assertThat(config.windowCapacity()).isEqualTo(100);
        assertThat(config.minHistory()).isEqualTo(10);
        assertThat(config.limitsFor(SensorType.HUMIDITY).validMax()).isEqualTo(100.0);
        assertThat(config.alert().quietPeriod()).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("Umbral de aviso >= crítico se rechaza al validar")
    void warningMustBeBelowCritical() {
        PipelineConfig base = PipelineConfig.defaults();
        Map<SensorType, SensorTypeLimits> limits = new EnumMap<>(base.typeLimits());
        limits.put(SensorType.TEMPERATURE, limits.get(SensorType.TEMPERATURE).withWarningThreshold(6.0));

        assertThatThrownBy(() -> base.withTypeLimits(limits).validate())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("temperature");
    }

    @Test
    @DisplayName("Se acumulan todas las violaciones, no solo la primera")
    void collectsEveryViolation() {
        PipelineConfig broken = PipelineConfig.defaults()
                .withWindowCapacity(5)
                .withMinHistory(10)
                .withModelWeight(1.5);

        ConfigurationException ex = catchThrowableOfType(broken::validate, ConfigurationException.class);

        assertThat(ex.getViolations()).hasSize(2);
        assertThat(ex.getViolations()).anyMatch(v -> v.contains("minHistory"));
        assertThat(ex.getViolations()).anyMatch(v -> v.contains("modelWeight"));
    }

    @Test
    @DisplayName("Un rango de humedad fuera de [0,100] no es configurable")
    void humidityRangeMustStayInsidePhysicalDomain() {
        PipelineConfig base = PipelineConfig.defaults();
        Map<SensorType, SensorTypeLimits> limits = new EnumMap<>(base.typeLimits());
        limits.put(SensorType.HUMIDITY, limits.get(SensorType.HUMIDITY).withValidMax(120.0));

        assertThatThrownBy(() -> base.withTypeLimits(limits).validate())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("physical domain");
    }

    @Test
    @DisplayName("Un tipo sin límites configurados no se puede consultar")
    void missingLimitsFailFast() {
        PipelineConfig config = PipelineConfig.defaults().withTypeLimits(Map.of());

        assertThatThrownBy(() -> config.limitsFor(SensorType.AIR_QUALITY))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(config::validate).isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Clasificación por umbrales: los límites son inclusivos")
    void classifyUsesInclusiveThresholds() {
        SensorTypeLimits limits = new SensorTypeLimits(0, 100, 3.0, 5.0);

        assertThat(limits.classify(2.99)).isEqualTo(Classification.NORMAL);
        assertThat(limits.classify(3.0)).isEqualTo(Classification.WARNING);
        assertThat(limits.classify(5.0)).isEqualTo(Classification.CRITICAL);
        assertThat(limits.isPlausible(100.0)).isTrue();
        assertThat(limits.isPlausible(100.01)).isFalse();
    }
}
