package eu.virtualparadox.titanshield.query.batch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import eu.virtualparadox.titanshield.query.model.Prediction;
import eu.virtualparadox.titanshield.query.model.Question;
import eu.virtualparadox.titanshield.resilience.Degradation;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Reads question files and writes the run outputs: predictions and metrics as JSON, the submission as CSV.
 */
@Component
@RequiredArgsConstructor
public class PredictionFiles {

    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final CsvSchema SUBMISSION_SCHEMA = CSV_MAPPER.schemaFor(SubmissionRow.class).withHeader();

    private final ObjectMapper objectMapper;

    public List<Question> readQuestions(final Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return readQuestions(reader);
        }
    }

    public List<Question> readQuestions(final Reader reader) throws IOException {
        final List<QuestionRow> rows = objectMapper.readValue(reader, new TypeReference<List<QuestionRow>>() {
        });
        return rows.stream()
                .map(row -> {
                    if (row.qid() == null || row.qid().isBlank()) {
                        throw new IllegalArgumentException("Question without qid: " + row.question());
                    }
                    final String gold = row.answer() == null || row.answer().isBlank() ? null : row.answer().trim();
                    return new Question(row.qid(), row.question(), row.choices(), gold);
                })
                .toList();
    }

    public void writePredictions(final Path path, final List<Prediction> predictions) throws IOException {
        createParent(path);
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writePredictions(writer, predictions);
        }
    }

    public void writePredictions(final Writer writer, final List<Prediction> predictions) throws IOException {
        final List<PredictionRow> rows = predictions.stream()
                .map(p -> new PredictionRow(p.qid(), p.answer(), p.route(), new TreeSet<>(p.degradations())))
                .toList();
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(writer, rows);
    }

    /**
     * Writes the submission file: header {@code qid,answer}, one row per prediction, an empty answer when there is
     * no letter.
     */
    public void writeSubmission(final Path path, final List<Prediction> predictions) throws IOException {
        createParent(path);
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writeSubmission(writer, predictions);
        }
    }

    public void writeSubmission(final Writer writer, final List<Prediction> predictions) throws IOException {
        final List<SubmissionRow> rows = predictions.stream()
                .map(p -> new SubmissionRow(p.qid(), p.answer() == null ? "" : p.answer()))
                .toList();
        CSV_MAPPER.writer(SUBMISSION_SCHEMA).writeValue(writer, rows);
    }

    public void writeMetrics(final Path path, final PredictionEvaluator.Evaluation evaluation) throws IOException {
        createParent(path);
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writeMetrics(writer, evaluation);
        }
    }

    public void writeMetrics(final Writer writer, final PredictionEvaluator.Evaluation evaluation) throws IOException {
        final Map<String, AccuracyRow> byRoute = new TreeMap<>();
        evaluation.byRoute().forEach((route, accuracy) -> byRoute.put(route, AccuracyRow.of(accuracy)));
        objectMapper.writerWithDefaultPrettyPrinter()
                .writeValue(writer, new MetricsRow(AccuracyRow.of(evaluation.overall()), byRoute));
    }

    /**
     * Metrics file that sits next to a predictions file: {@code out.json} gives {@code out_metrics.json}.
     */
    public static Path metricsPathFor(final Path predictionsPath) {
        final String name = predictionsPath.getFileName().toString();
        final String base = name.endsWith(".json") ? name.substring(0, name.length() - ".json".length()) : name;
        return predictionsPath.resolveSibling(base + "_metrics.json");
    }

    private static void createParent(final Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record QuestionRow(String qid, String question, List<String> choices, String answer) {
    }

    record PredictionRow(String qid, String answer, String route, Set<Degradation> degradations) {
    }

    @JsonPropertyOrder({"qid", "answer"})
    record SubmissionRow(String qid, String answer) {
    }

    record AccuracyRow(int total, int correct, double accuracy) {

        static AccuracyRow of(final PredictionEvaluator.Accuracy accuracy) {
            return new AccuracyRow(accuracy.total(), accuracy.correct(), accuracy.ratio());
        }
    }

    record MetricsRow(AccuracyRow overall, Map<String, AccuracyRow> byRoute) {
    }
}
