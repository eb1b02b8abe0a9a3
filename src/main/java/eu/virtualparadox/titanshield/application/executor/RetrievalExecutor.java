package eu.virtualparadox.titanshield.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Runs the lexical and semantic legs of a hybrid search.
 */
public class RetrievalExecutor extends ThreadPoolTaskExecutor {
}
