package com.cityexplorer.backend.infrastructure.config;

import com.cityexplorer.backend.domain.FreshnessEvaluator;
import com.cityexplorer.backend.domain.ResourceRegistry;
import com.cityexplorer.backend.domain.model.ResourcePolicy;
import com.cityexplorer.backend.domain.port.out.RowStore;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class CacheEngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(CacheEngineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ResourceRegistry resourceRegistry(CacheConfig config) {
        for (String type : config.getTtl().keySet()) {
            if (ResourceRegistry.defaultPolicies().stream().noneMatch(p -> p.resourceType().equals(type))) {
                throw new IllegalStateException("TTL configured for unknown resource type: " + type);
            }
        }

        List<ResourcePolicy> policies = ResourceRegistry.defaultPolicies().stream()
                .map(policy -> {
                    Duration override = config.getTtl().get(policy.resourceType());
                    return override != null ? policy.withTtl(override) : policy;
                })
                .toList();

        policies.forEach(policy -> logger.info("Resource {} -> table {}, ttl {}",
                policy.resourceType(), policy.tableName(), policy.ttl()));
        return new ResourceRegistry(policies);
    }

    @Bean
    public FreshnessEvaluator freshnessEvaluator(RowStore rowStore, Clock clock) {
        return new FreshnessEvaluator(rowStore, clock);
    }

    @Bean(name = "asyncExecutor")
    public ThreadPoolTaskExecutor asyncExecutor(CacheConfig config) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getCorePoolSize());
        executor.setMaxPoolSize(config.getMaxPoolSize());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("cache-aside-");
        // Let in-flight inserts finish on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
