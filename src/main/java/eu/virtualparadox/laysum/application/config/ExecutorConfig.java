package eu.virtualparadox.laysum.application.config;

import eu.virtualparadox.laysum.application.executor.CapabilityExecutor;
import eu.virtualparadox.laysum.application.executor.SummaryExecutor;
import eu.virtualparadox.laysum.application.executor.VerificationExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public SummaryExecutor summaryExecutor() {
        SummaryExecutor executor = new SummaryExecutor();
        executor.setCorePoolSize(1);        // one document at a time
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("summary-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean
    public VerificationExecutor verificationExecutor(final ApplicationConfig config) {
        final int concurrency = Math.max(1, config.getVerifier().getConcurrency());
        VerificationExecutor executor = new VerificationExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("verify-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Runs the blocking capability calls so that callers can wait with a timeout.
     * Sized one above the verifier so the composer never queues behind sentence checks.
     */
    @Bean
    public CapabilityExecutor capabilityExecutor(final ApplicationConfig config) {
        final int threads = Math.max(1, config.getVerifier().getConcurrency()) + 1;
        CapabilityExecutor executor = new CapabilityExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("capability-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
