package com.awsmap.config;

import com.awsmap.inventory.catalog.ServiceCatalog;
import com.awsmap.inventory.collector.CollectorRegistry;
import com.awsmap.inventory.collector.ServiceCollector;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ScanConfig {

    @Bean
    public ServiceCatalog serviceCatalog() {
        return ServiceCatalog.standard();
    }

    @Bean
    public CollectorRegistry collectorRegistry(ServiceCatalog serviceCatalog, List<ServiceCollector> collectors) {
        return CollectorRegistry.fromBeans(serviceCatalog, collectors);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService scanExecutor() {
        return Executors.newCachedThreadPool();
    }
}
