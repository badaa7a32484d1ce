package envmonitor.domain.sensors;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Tipos de sonda ambiental soportados por el pipeline.
 * <p>
 * Los límites de dominio ({@link #getDomainMin()}, {@link #getDomainMax()}) son propiedades
 * físicas del tipo de magnitud (una humedad relativa no puede salir de [0, 100]).
 * No confundir con los rangos de plausibilidad configurables, que viven en la configuración.
 */
@Getter
@RequiredArgsConstructor
public enum SensorType {

    TEMPERATURE("temperature", "ºC", Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY),
    HUMIDITY("humidity", "%", 0.0, 100.0),
    AIR_QUALITY("air_quality", "AQI", 0.0, Double.POSITIVE_INFINITY),

    // --- FALLBACK ---
    UNKNOWN("unknown", "-", Double.NaN, Double.NaN);

    private final String code;
    private final String unit;
    private final double domainMin;
    private final double domainMax;

    // Clave: CÓDIGO normalizado -> ENUM
    private static final Map<String, SensorType> BY_CODE = Collections.unmodifiableMap(
            Arrays.stream(values())
                    .collect(Collectors.toMap(
                            type -> type.code.toUpperCase(),
                            type -> type
                    ))
    );

    /**
     * Busca un SensorType por su código ("temperature", "HUMIDITY", "air_quality"...).
     * Acepta también el nombre del enum. Devuelve {@link #UNKNOWN} si no hay coincidencia.
     */
    public static SensorType fromString(String text) {
        if (text == null) return UNKNOWN;
        return BY_CODE.getOrDefault(text.trim().toUpperCase(), UNKNOWN);
    }

    /**
     * Devuelve la lista de todos los tipos válidos (excluyendo UNKNOWN)
     */
    public static List<SensorType> getValidTypes() {
        return Arrays.stream(values())
                .filter(t -> t != UNKNOWN)
                .collect(Collectors.toList());
    }
}
