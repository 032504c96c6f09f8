package com.zplat.ipld.configuration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools for host fan-out. Deployment and dry-run workers are sized by
 * {@code ipld.worker-pool-size}; the launcher pool runs the per-run collectors so
 * callers never block.
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "deploymentExecutor", destroyMethod = "shutdown")
    public ExecutorService deploymentExecutor(@Value("${ipld.worker-pool-size:60}") int poolSize) {
        return Executors.newFixedThreadPool(poolSize, named("deploy-"));
    }

    @Bean(name = "dryRunExecutor", destroyMethod = "shutdown")
    public ExecutorService dryRunExecutor(@Value("${ipld.worker-pool-size:60}") int poolSize) {
        return Executors.newFixedThreadPool(poolSize, named("dryrun-"));
    }

    @Bean(name = "launcherExecutor", destroyMethod = "shutdown")
    public ExecutorService launcherExecutor() {
        return Executors.newCachedThreadPool(named("ipld-run-"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    static ThreadFactory named(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
