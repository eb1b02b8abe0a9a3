package eu.virtualparadox.titanshield.query.batch;

import eu.virtualparadox.titanshield.query.model.Prediction;
import eu.virtualparadox.titanshield.query.model.Question;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Accuracy of predictions against the gold answers of their questions, overall and per route.
 * Questions without a gold answer are not counted.
 */
public final class PredictionEvaluator {

    private PredictionEvaluator() {
    }

    public static Evaluation evaluate(final List<Question> questions, final List<Prediction> predictions) {
        if (questions.size() != predictions.size()) {
            throw new IllegalArgumentException(
                    "Got " + predictions.size() + " predictions for " + questions.size() + " questions");
        }

        final Score overall = new Score();
        final Map<String, Score> byRoute = new TreeMap<>();
        for (int i = 0; i < questions.size(); i++) {
            final String gold = questions.get(i).answer();
            if (gold == null) {
                continue;
            }
            final Prediction prediction = predictions.get(i);
            final boolean correct = gold.equalsIgnoreCase(prediction.answer());
            overall.add(correct);
            byRoute.computeIfAbsent(prediction.route(), r -> new Score()).add(correct);
        }

        final Map<String, Accuracy> routes = new TreeMap<>();
        byRoute.forEach((route, score) -> routes.put(route, score.toAccuracy()));
        return new Evaluation(overall.toAccuracy(), Map.copyOf(routes));
    }

    public record Accuracy(int total, int correct) {

        public double ratio() {
            return total == 0 ? 0.0 : (double) correct / total;
        }
    }

    public record Evaluation(Accuracy overall, Map<String, Accuracy> byRoute) {

        public boolean hasGold() {
            return overall.total() > 0;
        }
    }

    private static final class Score {
        private int total;
        private int correct;

        void add(final boolean hit) {
            total++;
            if (hit) {
                correct++;
            }
        }

        Accuracy toAccuracy() {
            return new Accuracy(total, correct);
        }
    }
}
