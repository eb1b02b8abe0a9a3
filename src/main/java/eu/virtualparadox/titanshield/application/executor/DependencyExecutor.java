package eu.virtualparadox.titanshield.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Runs blocking calls to the embedding and LLM services so they can be abandoned on timeout.
 */
public class DependencyExecutor extends ThreadPoolTaskExecutor {
}
