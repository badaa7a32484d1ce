package envmonitor.pipeline.config;

import envmonitor.config.PipelineConfig;
import envmonitor.domain.exception.ConfigurationException;
import envmonitor.domain.sensors.SensorType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelinePropertiesTest {

    @Test
    @DisplayName("Sin propiedades se obtienen los valores por defecto")
    void emptyPropertiesYieldDefaults() {
        PipelineConfig config = new PipelineProperties().toConfig().validate();

        assertThat(config.windowCapacity()).isEqualTo(PipelineConfig.defaults().windowCapacity());
        assertThat(config.typeLimits()).isEqualTo(PipelineConfig.defaults().typeLimits());
    }

    @Test
    @DisplayName("Los límites por tipo se sobrescriben campo a campo")
    void typeOverridesArePartial() {
        PipelineProperties properties = new PipelineProperties();
        PipelineProperties.TypeLimits airQuality = new PipelineProperties.TypeLimits();
        airQuality.setMax(300.0);
        properties.getTypes().put("air_quality", airQuality);
        properties.getAlert().setQuietPeriod(Duration.ofMinutes(1));

        PipelineConfig config = properties.toConfig().validate();

        assertThat(config.limitsFor(SensorType.AIR_QUALITY).validMax()).isEqualTo(300.0);
        assertThat(config.limitsFor(SensorType.AIR_QUALITY).validMin()).isZero();
        assertThat(config.alert().quietPeriod()).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    @DisplayName("Tipo desconocido o umbrales incoherentes impiden arrancar")
    void invalidPropertiesFailFast() {
        PipelineProperties unknownType = new PipelineProperties();
        unknownType.getTypes().put("pressure", new PipelineProperties.TypeLimits());
        assertThatThrownBy(unknownType::toConfig).isInstanceOf(IllegalArgumentException.class);

        PipelineProperties inverted = new PipelineProperties();
        PipelineProperties.TypeLimits humidity = new PipelineProperties.TypeLimits();
        humidity.setWarn(5.0);
        humidity.setCritical(3.0);
        inverted.getTypes().put("humidity", humidity);
        assertThatThrownBy(() -> inverted.toConfig().validate()).isInstanceOf(ConfigurationException.class);
    }
}
