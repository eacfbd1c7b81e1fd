package com.awsmap.inventory.collector;

/**
 * A {@link Collector} bound to the catalog key of the service it enumerates. Spring beans of this type
 * populate the {@link CollectorRegistry}.
 */
public interface ServiceCollector extends Collector {

    String service();
}
