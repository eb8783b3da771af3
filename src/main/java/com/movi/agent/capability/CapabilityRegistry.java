package com.movi.agent.capability;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static name → capability mapping, built once from every Capability bean.
 *
 * Registration order is kept so the definitions sent to the reasoning service are stable
 * between calls.
 */
@Component
@Slf4j
public class CapabilityRegistry {

    private final Map<String, Capability> capabilities;

    public CapabilityRegistry(List<Capability> capabilityBeans) {
        Map<String, Capability> byName = new LinkedHashMap<>();
        capabilityBeans.forEach(capability -> {
            Capability previous = byName.put(capability.getName(), capability);
            if (previous != null) {
                throw new IllegalStateException("Duplicate capability name: " + capability.getName());
            }
            log.info("Registered capability: [{}]", capability.getName());
        });
        this.capabilities = Collections.unmodifiableMap(byName);
        log.info("Total capabilities registered: {}", capabilities.size());
    }

    public List<CapabilityDefinition> getAllDefinitions() {
        return capabilities.values().stream()
                .map(CapabilityDefinition::from)
                .toList();
    }

    public Optional<Capability> find(String name) {
        return Optional.ofNullable(capabilities.get(name));
    }

    public Collection<String> names() {
        return capabilities.keySet();
    }

    public boolean hasCapability(String name) {
        return capabilities.containsKey(name);
    }

    public int size() {
        return capabilities.size();
    }
}
