package com.atrium.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.function.Supplier;

/**
 * Micrometer meters tagged with the owning service.
 * <p>
 * Lookups are cheap: Micrometer returns the registered meter for a name and tag set it has
 * seen, so callers resolve meters per operation instead of holding on to them. Tags are never
 * derived from organization names or slugs; those would make every tenant its own time series.
 */
public final class MetricFactory {

    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry    Spring Boot's registry in the service, a {@code SimpleMeterRegistry} in tests
     * @param serviceName value of the {@code service} tag
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * @param tags alternating key/value strings
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name).description(description).tags(tagged(tags)).register(registry);
    }

    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name).description(description).tags(tagged(tags)).register(registry);
    }

    public DistributionSummary distributionSummary(String name, String description, String... tags) {
        return DistributionSummary.builder(name).description(description).tags(tagged(tags)).register(registry);
    }

    /**
     * Runs {@code work} and records its duration whether it returns or throws.
     */
    public <T> T time(String name, String description, Supplier<T> work, String... tags) {
        Timer.Sample sample = Timer.start(registry);
        try {
            return work.get();
        } finally {
            sample.stop(timer(name, description, tags));
        }
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags tagged(String... pairs) {
        if (pairs.length % 2 != 0) {
            throw new IllegalArgumentException("tags must be key/value pairs, got " + pairs.length + " values");
        }
        return Tags.of(TAG_SERVICE, serviceName).and(pairs);
    }
}
