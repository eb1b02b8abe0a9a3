package eu.virtualparadox.titanshield.query.batch;

import eu.virtualparadox.titanshield.application.config.TitanShieldProperties;
import eu.virtualparadox.titanshield.application.executor.QuestionExecutor;
import eu.virtualparadox.titanshield.query.AnswerPipeline;
import eu.virtualparadox.titanshield.query.model.Prediction;
import eu.virtualparadox.titanshield.query.model.Question;
import eu.virtualparadox.titanshield.rag.llm.AnswerLetterParser;
import eu.virtualparadox.titanshield.resilience.Degradation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;

/**
 * Answers a list of questions concurrently. At most {@code max-concurrent-questions} questions are in flight;
 * predictions come back in input order.
 */
@Service
@Slf4j
public class BatchPredictionService {

    private final AnswerPipeline answerPipeline;
    private final AsyncTaskExecutor questionExecutor;
    private final Semaphore admission;

    @Autowired
    public BatchPredictionService(final AnswerPipeline answerPipeline,
                                  final QuestionExecutor questionExecutor,
                                  final TitanShieldProperties props) {
        this(answerPipeline, (AsyncTaskExecutor) questionExecutor, props.getPipeline().getMaxConcurrentQuestions());
    }

    public BatchPredictionService(final AnswerPipeline answerPipeline,
                                  final AsyncTaskExecutor questionExecutor,
                                  final int maxConcurrentQuestions) {
        this.answerPipeline = answerPipeline;
        this.questionExecutor = questionExecutor;
        this.admission = new Semaphore(Math.max(1, maxConcurrentQuestions));
    }

    public List<Prediction> predictAll(final List<Question> questions) throws InterruptedException {
        log.info("Predicting {} questions", questions.size());
        final List<Future<Prediction>> futures = new ArrayList<>(questions.size());
        for (final Question question : questions) {
            admission.acquire();
            try {
                futures.add(questionExecutor.submit(() -> {
                    try {
                        return answerPipeline.answer(question);
                    } finally {
                        admission.release();
                    }
                }));
            } catch (final RuntimeException e) {
                admission.release();
                throw e;
            }
        }

        final List<Prediction> predictions = new ArrayList<>(questions.size());
        for (int i = 0; i < futures.size(); i++) {
            predictions.add(await(questions.get(i), futures.get(i)));
        }
        return predictions;
    }

    private Prediction await(final Question question, final Future<Prediction> future) throws InterruptedException {
        try {
            return future.get();
        } catch (final ExecutionException e) {
            log.error("Question {} failed unexpectedly; answering A", question.id(), e.getCause());
            final String fallback = question.optionCount() == 0 ? null : AnswerLetterParser.letterOf(0);
            final Degradation flag = question.optionCount() == 0 ? Degradation.NO_OPTIONS : Degradation.ANSWER_DEFAULTED;
            return new Prediction(question.id(), fallback, Prediction.ROUTE_ERROR, Set.of(flag));
        }
    }
}
