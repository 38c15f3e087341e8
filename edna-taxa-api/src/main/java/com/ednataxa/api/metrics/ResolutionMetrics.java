package com.ednataxa.api.metrics;

import com.ednataxa.api.resolution.ResolutionPath;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

@Component
public class ResolutionMetrics {

    private final Map<ResolutionPath, Counter> pathCounters = new EnumMap<>(ResolutionPath.class);
    private final Counter resolved;
    private final Counter unresolved;
    private final Timer remoteLookups;
    private final Counter retries;

    public ResolutionMetrics(MeterRegistry meterRegistry) {
        for (ResolutionPath path : ResolutionPath.values()) {
            pathCounters.put(path, Counter.builder("taxonomy.resolution.keys")
                    .description("Lineage keys by the stage that produced their result")
                    .tag("path", path.name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry));
        }
        this.resolved = Counter.builder("taxonomy.resolution.outcome").tag("outcome", "resolved").register(meterRegistry);
        this.unresolved = Counter.builder("taxonomy.resolution.outcome").tag("outcome", "unresolved").register(meterRegistry);
        this.remoteLookups = Timer.builder("taxonomy.remote.lookup")
                .description("Wall time of backbone lookups for one lineage, retries included")
                .register(meterRegistry);
        this.retries = Counter.builder("taxonomy.remote.retries")
                .description("Backbone requests retried after a transient failure")
                .register(meterRegistry);
    }

    public void record(ResolutionPath path, boolean isResolved) {
        pathCounters.get(path).increment();
        (isResolved ? resolved : unresolved).increment();
    }

    public void recordRetry() {
        retries.increment();
    }

    public <T> T timeRemote(Supplier<T> lookup) {
        return remoteLookups.record(lookup);
    }
}
