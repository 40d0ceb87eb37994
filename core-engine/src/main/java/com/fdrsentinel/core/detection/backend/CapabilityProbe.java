package com.fdrsentinel.core.detection.backend;

import java.util.Set;

/**
 * Reports which {@link Capability capabilities} are available. Tests inject a
 * fixed set instead of probing the classpath.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface CapabilityProbe {

    Set<Capability> probe();

    static CapabilityProbe of(Set<Capability> capabilities) {
        Set<Capability> fixed = Set.copyOf(capabilities);
        return () -> fixed;
    }

    static CapabilityProbe none() {
        return Set::of;
    }
}
