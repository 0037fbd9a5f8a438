package eu.virtualparadox.laysum.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

public class VerificationExecutor extends ThreadPoolTaskExecutor {
}
