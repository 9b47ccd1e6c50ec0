package com.myorg.bjf.observability;

import com.myorg.bjf.forwarding.EventForwarder;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

@AutoConfiguration(afterName = {
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
})
@ConditionalOnClass(EventForwarder.class)
@EnableConfigurationProperties(BjfObservabilityProperties.class)
public class BjfObservabilityAutoConfiguration {

    @Bean
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    public BjfMetrics bjfMetrics(MeterRegistry registry, Environment env, BjfObservabilityProperties props) {
        String app = env.getProperty("spring.application.name", "unknown-service");
        return new BjfMetrics(registry, app, props);
    }

    /**
     * Pre-register meters at startup so /actuator/metrics/<name> never returns 404.
     */
    @Bean
    public SmartLifecycle bjfMetricsPreRegisterLifecycle(
            BjfObservabilityProperties props,
            ObjectProvider<BjfMetrics> metricsProvider
    ) {
        return new SmartLifecycle() {
            private boolean running = false;

            @Override public void start() {
                if (props.isEnabled() && props.isMetricsEnabled()) {
                    BjfMetrics m = metricsProvider.getIfAvailable();
                    if (m != null) m.preRegisterBaseMeters();
                }
                running = true;
            }

            @Override public void stop() { running = false; }
            @Override public boolean isRunning() { return running; }
            @Override public int getPhase() { return Integer.MIN_VALUE; }
        };
    }

    @Bean
    public static BeanPostProcessor observingEventForwarderBpp(
            ObjectProvider<BjfObservabilityProperties> propsProvider,
            ObjectProvider<BjfMetrics> metricsProvider
    ) {
        return new BeanPostProcessor() {
            @Override
            public Object postProcessAfterInitialization(Object bean, String beanName) {
                if (!(bean instanceof EventForwarder forwarder)) return bean;
                if (bean instanceof ObservingEventForwarder) return bean;

                BjfObservabilityProperties props = propsProvider.getIfAvailable(BjfObservabilityProperties::new);
                if (!props.isEnabled()) return bean;
                return new ObservingEventForwarder(forwarder, props, metricsProvider.getIfAvailable());
            }
        };
    }
}
