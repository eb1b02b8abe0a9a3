package eu.virtualparadox.titanshield.application.config;

import eu.virtualparadox.titanshield.application.executor.DependencyExecutor;
import eu.virtualparadox.titanshield.application.executor.QuestionExecutor;
import eu.virtualparadox.titanshield.application.executor.RetrievalExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public QuestionExecutor questionExecutor(final TitanShieldProperties props) {
        final int workers = Math.max(1, props.getPipeline().getMaxConcurrentQuestions());
        QuestionExecutor executor = new QuestionExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("question-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean
    public RetrievalExecutor retrievalExecutor(final TitanShieldProperties props) {
        // two legs per in-flight question
        final int workers = 2 * Math.max(1, props.getPipeline().getMaxConcurrentQuestions());
        RetrievalExecutor executor = new RetrievalExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("retrieval-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public DependencyExecutor dependencyExecutor(final TitanShieldProperties props) {
        // embedding and LLM calls; separate from the leg pool so a leg waiting on an embedding never starves it
        final int workers = 2 * Math.max(1, props.getPipeline().getMaxConcurrentQuestions());
        DependencyExecutor executor = new DependencyExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("dependency-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
