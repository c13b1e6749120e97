package com.planlens.core.risk;

import com.planlens.core.config.PlanlensProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic sequence for risk-factor traceability ids ({@code risk-1}, {@code risk-2}, ...).
 * Not used by any scoring rule; {@link #reset()} exists for deterministic tests.
 */
@Component
public class RiskFactorIdGenerator {

    private final AtomicLong counter = new AtomicLong();
    private final String prefix;

    @Autowired
    public RiskFactorIdGenerator(PlanlensProperties properties) {
        this(properties.getRiskIdPrefix());
    }

    public RiskFactorIdGenerator(String prefix) {
        this.prefix = prefix == null || prefix.isBlank() ? "risk" : prefix;
    }

    public RiskFactorIdGenerator() {
        this("risk");
    }

    public String nextId() {
        return prefix + "-" + counter.incrementAndGet();
    }

    public void reset() {
        counter.set(0);
    }
}
