package com.awsmap.inventory.collector;

import com.awsmap.inventory.catalog.ServiceCatalog;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Registration table from service id to its {@link Collector}.
 *
 * <p>The table must match the {@link ServiceCatalog} exactly: a cataloged service without a collector, or a
 * collector for an uncataloged service, is a wiring error and fails construction.
 */
@Slf4j
public class CollectorRegistry {

    private final Map<String, Collector> collectors;

    public CollectorRegistry(ServiceCatalog catalog, Map<String, ? extends Collector> collectors) {
        Set<String> missing = new TreeSet<>(catalog.allServices());
        missing.removeAll(collectors.keySet());
        Set<String> uncataloged = new TreeSet<>(collectors.keySet());
        uncataloged.removeAll(catalog.allServices());
        if (!missing.isEmpty() || !uncataloged.isEmpty()) {
            throw new IllegalStateException("Catalog and collectors disagree: missing collectors=" + missing
                    + ", uncataloged collectors=" + uncataloged);
        }
        this.collectors = new TreeMap<>(collectors);
        log.info("Registered {} service collectors: {}.", this.collectors.size(), String.join(", ", this.collectors.keySet()));
    }

    public static CollectorRegistry fromBeans(ServiceCatalog catalog, Collection<? extends ServiceCollector> beans) {
        Map<String, ServiceCollector> byService = new LinkedHashMap<>();
        for (ServiceCollector bean : beans) {
            ServiceCollector previous = byService.putIfAbsent(bean.service(), bean);
            if (previous != null) {
                throw new IllegalStateException("Two collectors registered for service " + bean.service() + ": "
                        + previous.getClass().getSimpleName() + ", " + bean.getClass().getSimpleName());
            }
        }
        return new CollectorRegistry(catalog, byService);
    }

    public Optional<Collector> find(String service) {
        return Optional.ofNullable(collectors.get(service));
    }

    public Set<String> services() {
        return collectors.keySet();
    }
}
