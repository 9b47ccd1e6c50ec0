package com.myorg.bjf.forwarding.autoconfig;

import com.myorg.bjf.forwarding.BjfForwardingProperties;
import com.myorg.bjf.forwarding.directory.JobDirectory;
import com.myorg.bjf.forwarding.directory.RedisJobDirectory;
import com.myorg.bjf.forwarding.lock.KeyedLock;
import com.myorg.bjf.forwarding.lock.RedisKeyedLock;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.util.StringUtils;

/**
 * Redis-backed lock and job directory.
 *
 * <p>Kept apart from {@link BjfForwardingAutoConfiguration} so applications without the
 * Redis dependency can still use the starter with store=memory.
 */
@AutoConfiguration(after = RedisAutoConfiguration.class)
@EnableConfigurationProperties(BjfForwardingProperties.class)
@ConditionalOnClass(RedisConnectionFactory.class)
public class BjfForwardingRedisAutoConfiguration {

    /**
     * store=redis: Redis is mandatory, a missing connection factory fails startup.
     */
    @Configuration
    @ConditionalOnProperty(prefix = "bjf.forwarding", name = "store", havingValue = "redis")
    static class StrictRedisStoreConfig {

        @Bean
        @ConditionalOnMissingBean(StringRedisTemplate.class)
        public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory cf) {
            return new StringRedisTemplate(cf);
        }

        @Bean
        @ConditionalOnMissingBean(KeyedLock.class)
        public KeyedLock keyedLock(BjfForwardingProperties props, StringRedisTemplate redis) {
            requireRedisEnabled(props);
            return redisLock(props, redis);
        }

        @Bean
        @ConditionalOnMissingBean(JobDirectory.class)
        public JobDirectory jobDirectory(BjfForwardingProperties props, StringRedisTemplate redis) {
            requireRedisEnabled(props);
            return new RedisJobDirectory(redis, redisPrefix(props));
        }
    }

    /**
     * store=auto: use Redis when a RedisConnectionFactory bean exists.
     */
    @Configuration
    @ConditionalOnExpression("'${bjf.forwarding.store:auto}'.toLowerCase() == 'auto' "
            + "and '${bjf.forwarding.redis.enabled:true}'.toLowerCase() == 'true'")
    @ConditionalOnBean(RedisConnectionFactory.class)
    static class AutoRedisStoreConfig {

        @Bean
        @ConditionalOnMissingBean(StringRedisTemplate.class)
        public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory cf) {
            return new StringRedisTemplate(cf);
        }

        @Bean
        @ConditionalOnMissingBean(KeyedLock.class)
        public KeyedLock keyedLock(BjfForwardingProperties props, StringRedisTemplate redis) {
            return redisLock(props, redis);
        }

        @Bean
        @ConditionalOnMissingBean(JobDirectory.class)
        public JobDirectory jobDirectory(BjfForwardingProperties props, StringRedisTemplate redis) {
            return new RedisJobDirectory(redis, redisPrefix(props));
        }
    }

    private static KeyedLock redisLock(BjfForwardingProperties props, StringRedisTemplate redis) {
        var lock = props.getLock();
        return new RedisKeyedLock(redis, redisPrefix(props), lock.getLeaseTtl(), lock.getWaitTimeout(), lock.getPollInterval());
    }

    // redis.keyPrefix wins over the top-level keyPrefix
    static String redisPrefix(BjfForwardingProperties props) {
        var redis = props.getRedis();
        if (redis != null && StringUtils.hasText(redis.getKeyPrefix())) {
            return redis.getKeyPrefix();
        }
        return props.getKeyPrefix();
    }

    private static void requireRedisEnabled(BjfForwardingProperties props) {
        if (!props.getRedis().isEnabled()) {
            throw new IllegalStateException("bjf.forwarding.store=redis but bjf.forwarding.redis.enabled=false");
        }
    }
}
