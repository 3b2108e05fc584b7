package tw.gc.struggle.engine.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure beans: clock, HTTP client and the three worker pools.
 *
 * <ul>
 *   <li>{@code sessionActorExecutor} runs session mailboxes (one drain at a time per session)</li>
 *   <li>{@code decisionExecutor} runs budgeted scoring + decision work</li>
 *   <li>{@code persistenceExecutor} runs fire-and-forget audit writes</li>
 * </ul>
 */
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(2))
                .setReadTimeout(Duration.ofSeconds(5))
                .build();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService sessionActorExecutor(EngineProperties properties) {
        return Executors.newFixedThreadPool(properties.getSession().getWorkerThreads(), namedThreads("session-actor"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService decisionExecutor(EngineProperties properties) {
        return Executors.newFixedThreadPool(properties.getSession().getDecisionThreads(), namedThreads("decision"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService persistenceExecutor() {
        return Executors.newFixedThreadPool(2, namedThreads("audit-writer"));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
