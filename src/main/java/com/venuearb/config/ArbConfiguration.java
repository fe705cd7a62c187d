package com.venuearb.config;

import com.venuearb.core.PathCatalog;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ArbConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Built once; an invalid path aborts startup.
     */
    @Bean
    public PathCatalog pathCatalog(ArbProperties properties) {
        return PathCatalog.build(properties.pairsByVenue());
    }

    @Bean(name = "scanExecutor", destroyMethod = "shutdown")
    public ExecutorService scanExecutor(ArbProperties properties) {
        return Executors.newFixedThreadPool(properties.scan().workerThreads(),
                new CustomizableThreadFactory("arb-scan-"));
    }
}
