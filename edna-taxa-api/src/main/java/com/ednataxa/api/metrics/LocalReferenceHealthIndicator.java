package com.ednataxa.api.metrics;

import com.ednataxa.api.reference.LocalReferenceIndex;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

@Component
public class LocalReferenceHealthIndicator implements HealthIndicator {

    private final LocalReferenceIndex index;

    public LocalReferenceHealthIndicator(LocalReferenceIndex index) {
        this.index = index;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        details.put("enabled", index.isEnabled());
        if (!index.isEnabled()) {
            return Health.up().withDetails(details).build();
        }
        details.put("location", index.location());
        details.put("entries", index.size());
        // an enabled dataset without a single usable row is as good as missing
        if (index.size() == 0) {
            return Health.down().withDetails(details).build();
        }
        return Health.up().withDetails(details).build();
    }
}
