package eu.virtualparadox.titanshield.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Runs whole questions of a prediction batch.
 */
public class QuestionExecutor extends ThreadPoolTaskExecutor {
}
