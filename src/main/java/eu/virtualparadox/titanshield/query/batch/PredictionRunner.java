package eu.virtualparadox.titanshield.query.batch;

import eu.virtualparadox.titanshield.application.config.TitanShieldProperties;
import eu.virtualparadox.titanshield.query.model.Prediction;
import eu.virtualparadox.titanshield.query.model.Question;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Command-line batch run: {@code --titanshield.run.input=questions.json [--titanshield.run.output=predictions.json]
 * [--titanshield.run.submission=submission.csv]}. With gold answers in the input the metrics go next to the
 * predictions file.
 */
@Component
@ConditionalOnProperty(prefix = "titanshield.run", name = "input")
@RequiredArgsConstructor
@Slf4j
public class PredictionRunner implements ApplicationRunner {

    private final TitanShieldProperties props;
    private final PredictionFiles predictionFiles;
    private final BatchPredictionService batchPredictionService;

    @Override
    public void run(final ApplicationArguments args) throws Exception {
        final Path input = props.getRun().getInput();
        final Path output = props.getRun().getOutput();

        final List<Question> questions = predictionFiles.readQuestions(input);
        log.info("Loaded {} questions from {}", questions.size(), input);

        final long start = System.currentTimeMillis();
        final List<Prediction> predictions = batchPredictionService.predictAll(questions);
        predictionFiles.writePredictions(output, predictions);
        log.info("Wrote {} predictions to {} in {} ms", predictions.size(), output, System.currentTimeMillis() - start);

        final Path submission = props.getRun().getSubmission();
        if (submission != null) {
            predictionFiles.writeSubmission(submission, predictions);
            log.info("Wrote submission to {}", submission);
        }

        final PredictionEvaluator.Evaluation evaluation = PredictionEvaluator.evaluate(questions, predictions);
        if (evaluation.hasGold()) {
            log.info("Accuracy {}/{} ({})", evaluation.overall().correct(), evaluation.overall().total(),
                    String.format("%.2f%%", 100 * evaluation.overall().ratio()));
            evaluation.byRoute().forEach((route, acc) ->
                    log.info("  {}: {}/{} ({})", route, acc.correct(), acc.total(),
                            String.format("%.2f%%", 100 * acc.ratio())));
            final Path metrics = PredictionFiles.metricsPathFor(output);
            predictionFiles.writeMetrics(metrics, evaluation);
            log.info("Metrics saved to {}", metrics);
        }
    }
}
