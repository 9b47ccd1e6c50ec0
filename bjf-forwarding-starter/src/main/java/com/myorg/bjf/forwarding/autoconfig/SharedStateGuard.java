package com.myorg.bjf.forwarding.autoconfig;

import com.myorg.bjf.forwarding.BjfForwardingProperties;
import com.myorg.bjf.forwarding.lock.InMemoryKeyedLock;
import com.myorg.bjf.forwarding.lock.KeyedLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.Environment;

// Startup check: with store=auto and no Redis, locks and job records only hold inside this JVM.
// Several instances would then open parallel jobs and interleave writes for the same user.
@Slf4j
@RequiredArgsConstructor
public class SharedStateGuard implements ApplicationListener<ApplicationReadyEvent> {

    private final BjfForwardingProperties props;
    private final Environment env;
    private final ObjectProvider<KeyedLock> lock;

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        check();
    }

    void check() {
        if (!(lock.getIfAvailable() instanceof InMemoryKeyedLock)) return;

        String store = props.getStore() == null ? "auto" : props.getStore().toLowerCase();
        boolean isProd = isProd();

        if ("memory".equals(store)) {
            if (isProd) log.warn("bjf.forwarding.store=memory in a prod profile: locks and job records are per instance");
            return;
        }

        String msg = "bjf.forwarding.store=" + store + " but no Redis found, falling back to in-memory lock and job directory (single instance only).";
        if (props.isRequireRedis() || isProd) {
            throw new IllegalStateException(msg + " Refusing to start (prod profile or require-redis=true).");
        }
        log.warn(msg);
    }

    private boolean isProd() {
        for (String p : env.getActiveProfiles()) {
            if ("prod".equalsIgnoreCase(p) || "production".equalsIgnoreCase(p)) {
                return true;
            }
        }
        return false;
    }
}
