package envmonitor.pipeline.service.state;

import envmonitor.domain.reading.Reading;

import java.time.Instant;
import java.util.Arrays;
import java.util.OptionalDouble;

/**
 * Estado del stream de un sensor: ventana deslizante acotada + media/varianza incrementales.
 * <p>
 * Inmutable. {@link #update(Reading)} devuelve un estado nuevo y no toca el anterior, de modo que
 * la actualización es una función pura de (estado previo, lectura). La ventana se guarda como un
 * buffer circular copiado en cada actualización (N es pequeño).
 * <p>
 * Media y varianza se mantienen con Welford deslizante: alta de la muestra nueva y baja de la más
 * antigua al desbordar. Cada {@code capacity} desalojos se recalculan en dos pasadas sobre la
 * ventana para acotar la deriva numérica. La varianza es muestral (n-1) y no está definida con
 * menos de dos muestras.
 */
public final class StreamState {

    private final String sensorId;
    private final double[] ring;
    private final int head;     // índice de la muestra más antigua
    private final int size;
    private final double mean;
    private final double m2;
    private final int evictionsSinceResync;
    private final Instant lastTimestamp;
    private final long lastSequenceNo;
    private final long acceptedCount;
    private final long modelVersion;

    private StreamState(String sensorId, double[] ring, int head, int size, double mean, double m2,
                        int evictionsSinceResync, Instant lastTimestamp, long lastSequenceNo,
                        long acceptedCount, long modelVersion) {
        this.sensorId = sensorId;
        this.ring = ring;
        this.head = head;
        this.size = size;
        this.mean = mean;
        this.m2 = m2;
        this.evictionsSinceResync = evictionsSinceResync;
        this.lastTimestamp = lastTimestamp;
        this.lastSequenceNo = lastSequenceNo;
        this.acceptedCount = acceptedCount;
        this.modelVersion = modelVersion;
    }

    /**
     * Estado inicial de un sensor no visto: ventana vacía, estadísticas sin definir.
     */
    public static StreamState empty(String sensorId, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        return new StreamState(sensorId, new double[capacity], 0, 0, 0.0, 0.0, 0, null, -1L, 0L, 0L);
    }

    /**
     * Aplica una lectura ya aceptada y devuelve el estado resultante.
     */
    public StreamState update(Reading reading) {
        double x = reading.requireValue();
        int capacity = ring.length;
        double[] next = Arrays.copyOf(ring, capacity);

        int n = size;
        double mu = mean;
        double s = m2;
        int h = head;
        int evictions = evictionsSinceResync;

        if (n == capacity) {
            // Baja de la muestra más antigua
            double y = next[h];
            h = (h + 1) % capacity;
            n--;
            if (n == 0) {
                mu = 0.0;
                s = 0.0;
            } else {
                double delta = y - mu;
                mu -= delta / n;
                s -= delta * (y - mu);
            }
            evictions++;
        }

        // Alta de la muestra nueva
        next[(h + n) % capacity] = x;
        n++;
        double delta = x - mu;
        mu += delta / n;
        s += delta * (x - mu);
        if (s < 0.0) s = 0.0;

        if (evictions >= capacity) {
            double[] exact = exactMoments(next, h, n);
            mu = exact[0];
            s = exact[1];
            evictions = 0;
        }

        Instant ts = reading.timestamp();
        if (lastTimestamp != null && ts.isBefore(lastTimestamp)) {
            ts = lastTimestamp; // nunca retrocede
        }

        return new StreamState(sensorId, next, h, n, mu, s, evictions, ts,
                reading.sequenceNo(), acceptedCount + 1, modelVersion);
    }

    public StreamState withModelVersion(long version) {
        if (version == modelVersion) return this;
        return new StreamState(sensorId, ring, head, size, mean, m2, evictionsSinceResync,
                lastTimestamp, lastSequenceNo, acceptedCount, version);
    }

    private static double[] exactMoments(double[] buf, int head, int n) {
        int capacity = buf.length;
        double sum = 0.0;
        for (int i = 0; i < n; i++) sum += buf[(head + i) % capacity];
        double mu = sum / n;
        double sq = 0.0;
        for (int i = 0; i < n; i++) {
            double d = buf[(head + i) % capacity] - mu;
            sq += d * d;
        }
        return new double[]{mu, sq};
    }

    public String getSensorId() {
        return sensorId;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return ring.length;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Media de la ventana; vacía si no hay muestras.
     */
    public OptionalDouble mean() {
        return size == 0 ? OptionalDouble.empty() : OptionalDouble.of(mean);
    }

    /**
     * Varianza muestral de la ventana; vacía con menos de dos muestras.
     */
    public OptionalDouble variance() {
        return size < 2 ? OptionalDouble.empty() : OptionalDouble.of(m2 / (size - 1));
    }

    public OptionalDouble stdDev() {
        OptionalDouble v = variance();
        return v.isPresent() ? OptionalDouble.of(Math.sqrt(v.getAsDouble())) : OptionalDouble.empty();
    }

    /**
     * Copia de la ventana, de la más antigua a la más reciente.
     */
    public double[] values() {
        return recent(size);
    }

    /**
     * Las {@code k} muestras más recientes (o menos si no hay tantas), en orden cronológico.
     */
    public double[] recent(int k) {
        int count = Math.min(Math.max(k, 0), size);
        double[] out = new double[count];
        int start = size - count;
        for (int i = 0; i < count; i++) {
            out[i] = ring[(head + start + i) % ring.length];
        }
        return out;
    }

    public Instant getLastTimestamp() {
        return lastTimestamp;
    }

    public long getLastSequenceNo() {
        return lastSequenceNo;
    }

    public long getAcceptedCount() {
        return acceptedCount;
    }

    public long getModelVersion() {
        return modelVersion;
    }

    /**
     * Marca de agua para el validador, o {@code null} si el sensor aún no tiene lecturas aceptadas.
     */
    public SensorWatermark watermark() {
        return lastTimestamp == null ? null : new SensorWatermark(lastSequenceNo, lastTimestamp);
    }

    @Override
    public String toString() {
        return "StreamState{" + sensorId + ", size=" + size + "/" + ring.length
                + ", mean=" + (size == 0 ? "n/a" : String.format("%.4f", mean))
                + ", lastSeq=" + lastSequenceNo + ", modelVersion=" + modelVersion + "}";
    }
}
