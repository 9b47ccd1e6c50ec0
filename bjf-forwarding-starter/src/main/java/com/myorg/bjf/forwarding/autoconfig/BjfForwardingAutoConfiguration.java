package com.myorg.bjf.forwarding.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.bjf.forwarding.BjfForwardingProperties;
import com.myorg.bjf.forwarding.BulkJobEventForwarder;
import com.myorg.bjf.forwarding.EventForwarder;
import com.myorg.bjf.forwarding.ForwardingKeys;
import com.myorg.bjf.forwarding.ForwardingMode;
import com.myorg.bjf.forwarding.ForwardingValidator;
import com.myorg.bjf.forwarding.SingleRecordEventForwarder;
import com.myorg.bjf.forwarding.coordinator.JobCoordinator;
import com.myorg.bjf.forwarding.coordinator.JobTtlPolicy;
import com.myorg.bjf.forwarding.directory.InMemoryJobDirectory;
import com.myorg.bjf.forwarding.directory.JobDirectory;
import com.myorg.bjf.forwarding.gateway.RestTemplateUpstreamGateway;
import com.myorg.bjf.forwarding.gateway.UpstreamCredentials;
import com.myorg.bjf.forwarding.gateway.UpstreamGateway;
import com.myorg.bjf.forwarding.lock.InMemoryKeyedLock;
import com.myorg.bjf.forwarding.lock.KeyedLock;
import com.myorg.bjf.forwarding.mapping.PayloadMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@AutoConfiguration(after = BjfForwardingRedisAutoConfiguration.class)
@EnableConfigurationProperties(BjfForwardingProperties.class)
public class BjfForwardingAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ForwardingKeys forwardingKeys(BjfForwardingProperties props) {
        return ForwardingKeys.of(props.getCredentials());
    }

    @Bean
    @ConditionalOnMissingBean
    public ForwardingValidator forwardingValidator(BjfForwardingProperties props) {
        return new ForwardingValidator(props.getCredentials());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobTtlPolicy jobTtlPolicy(BjfForwardingProperties props) {
        var job = props.getJob();
        return new JobTtlPolicy(job.getWindow(), job.getSafetyMargin(), Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public PayloadMapper payloadMapper(BjfForwardingProperties props, ObjectProvider<ObjectMapper> mapper) {
        return new PayloadMapper(mapper.getIfAvailable(ObjectMapper::new), props.isCollectContext(), Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public UpstreamGateway upstreamGateway(BjfForwardingProperties props, ObjectProvider<ObjectMapper> mapper) {
        var http = props.getHttp();
        RestTemplate rest = new RestTemplateBuilder()
                .rootUri(props.getEndpoint())
                .setConnectTimeout(http.getConnectTimeout())
                .setReadTimeout(http.getReadTimeout())
                .build();
        return new RestTemplateUpstreamGateway(
                rest,
                mapper.getIfAvailable(ObjectMapper::new),
                UpstreamCredentials.authorizationHeader(props.getCredentials()),
                props.getUserAgent()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public JobCoordinator jobCoordinator(KeyedLock lock, JobDirectory directory, UpstreamGateway gateway, JobTtlPolicy ttlPolicy) {
        return new JobCoordinator(lock, directory, gateway, ttlPolicy);
    }

    @Bean(name = "bjfForwardingExecutor", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "bjfForwardingExecutor")
    public ExecutorService bjfForwardingExecutor(BjfForwardingProperties props) {
        int threads = Math.max(1, props.getExecutor().getThreads());
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "bjf-forwarder-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    @ConditionalOnMissingBean
    public EventForwarder eventForwarder(BjfForwardingProperties props,
                                         ForwardingValidator validator,
                                         ForwardingKeys keys,
                                         PayloadMapper mapper,
                                         UpstreamGateway gateway,
                                         JobCoordinator coordinator,
                                         ExecutorService bjfForwardingExecutor) {
        ForwardingMode mode = props.getMode() == null ? ForwardingMode.BULK_JOB : props.getMode();
        log.info("Forwarding mode={} tenant={} endpoint={}", mode, keys.tenant(), props.getEndpoint());
        return switch (mode) {
            case BULK_JOB -> new BulkJobEventForwarder(validator, keys, mapper, gateway, coordinator, bjfForwardingExecutor);
            case SINGLE_RECORD -> new SingleRecordEventForwarder(validator, keys, mapper, gateway, coordinator, bjfForwardingExecutor);
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public SharedStateGuard sharedStateGuard(BjfForwardingProperties props, Environment env, ObjectProvider<KeyedLock> lock) {
        return new SharedStateGuard(props, env, lock);
    }

    // ---------------- lock / directory store ----------------

    /**
     * store=redis but Redis is not on the classpath -> fail fast.
     */
    @Configuration
    @ConditionalOnProperty(prefix = "bjf.forwarding", name = "store", havingValue = "redis")
    @ConditionalOnMissingClass("org.springframework.data.redis.connection.RedisConnectionFactory")
    static class MissingRedisDependencyFailFastConfig {
        @Bean
        public Object bjfFailFastRedisMissing() {
            throw new IllegalStateException(
                    "bjf.forwarding.store=redis but Redis is not on the classpath. " +
                            "Add spring-boot-starter-data-redis and configure spring.data.redis.*"
            );
        }
    }

    /**
     * store=memory, or store=auto without Redis -> process-local lock and directory.
     * Redis beans, when present, are registered first and win through @ConditionalOnMissingBean.
     */
    @Configuration
    @ConditionalOnExpression("'${bjf.forwarding.store:auto}'.toLowerCase() != 'redis'")
    static class MemoryFallbackStoreConfig {

        @Bean
        @ConditionalOnMissingBean(KeyedLock.class)
        public KeyedLock keyedLock(BjfForwardingProperties props) {
            var lock = props.getLock();
            return new InMemoryKeyedLock(props.getKeyPrefix(), lock.getLeaseTtl(), lock.getWaitTimeout(), lock.getPollInterval());
        }

        @Bean(destroyMethod = "close")
        @ConditionalOnMissingBean(JobDirectory.class)
        public JobDirectory jobDirectory(BjfForwardingProperties props) {
            var dir = props.getDirectory();
            return new InMemoryJobDirectory(props.getKeyPrefix(), dir.getMaxEntries(), dir.getCleanupInterval());
        }
    }
}
