package com.autotax.observability;

import com.autotax.domain.enums.DealType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the calculation metrics:
 * <ul>
 *   <li><b>tax.calculations.count</b> (counter, tag {@code dealType}): completed calculations</li>
 *   <li><b>tax.calculations.degraded</b> (counter): calculations that fell back on a configuration gap</li>
 *   <li><b>tax.calculation.latency</b> (timer): engine time per calculation</li>
 * </ul>
 */
@Service
public class TaxMetricsService {

    private final Map<DealType, Counter> calculationCounters = new EnumMap<>(DealType.class);
    private final Counter degradedCounter;
    private final Timer latencyTimer;

    public TaxMetricsService(MeterRegistry meterRegistry) {
        for (DealType dealType : DealType.values()) {
            calculationCounters.put(
                    dealType,
                    Counter.builder("tax.calculations.count")
                            .description("Completed tax calculations")
                            .tag("dealType", dealType.name())
                            .register(meterRegistry));
        }

        this.degradedCounter = Counter.builder("tax.calculations.degraded")
                .description("Calculations that fell back on missing or unknown rule configuration")
                .register(meterRegistry);

        this.latencyTimer = Timer.builder("tax.calculation.latency")
                .description("Time spent in the calculation engine")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofMillis(100))
                .register(meterRegistry);
    }

    public void recordCalculation(DealType dealType, long elapsedNanos, boolean degraded) {
        calculationCounters.get(dealType).increment();
        latencyTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);
        if (degraded) {
            degradedCounter.increment();
        }
    }
}
