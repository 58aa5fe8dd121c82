package triage.orchestrator.backend;

import triage.orchestrator.exception.InferenceException;
import triage.orchestrator.model.LabelScore;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Deterministic in-process classifier used when no remote model is configured.
 * Scores each label by how many of its words occur in the text (exact token or
 * prefix match) and normalises the raw scores with a softmax so they sum to 1.
 */
public final class KeywordOverlapBackend implements InferenceBackend {

    private static final Pattern SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final int MIN_PREFIX = 4;

    @Override
    public List<LabelScore> classify(String text, List<String> labels) throws InferenceException {
        if (text == null) {
            throw new InferenceException("text is null");
        }
        if (labels == null || labels.isEmpty()) {
            throw new InferenceException("no candidate labels");
        }

        Set<String> textTokens = tokens(text);
        double[] raw = new double[labels.size()];
        for (int i = 0; i < labels.size(); i++) {
            raw[i] = overlap(textTokens, tokens(labels.get(i)));
        }

        double[] probs = softmax(raw);
        List<LabelScore> scores = new ArrayList<>(labels.size());
        for (int i = 0; i < labels.size(); i++) {
            scores.add(new LabelScore(labels.get(i), probs[i]));
        }
        // stable sort keeps label order on ties
        return LabelScore.ranked(scores);
    }

    static Set<String> tokens(String s) {
        Set<String> out = new LinkedHashSet<>();
        for (String t : SPLIT.split(s.toLowerCase(Locale.ROOT))) {
            if (!t.isEmpty()) {
                out.add(t);
            }
        }
        return out;
    }

    private static double overlap(Set<String> text, Set<String> label) {
        double score = 0;
        for (String l : label) {
            if (text.contains(l)) {
                score += 1.0;
                continue;
            }
            for (String t : text) {
                if (l.length() >= MIN_PREFIX && t.length() >= MIN_PREFIX
                        && (t.startsWith(l) || l.startsWith(t))) {
                    score += 0.5;
                    break;
                }
            }
        }
        return score;
    }

    private static double[] softmax(double[] raw) {
        double max = Arrays.stream(raw).max().orElse(0);
        double[] exp = new double[raw.length];
        double sum = 0;
        for (int i = 0; i < raw.length; i++) {
            exp[i] = Math.exp(raw[i] - max);
            sum += exp[i];
        }
        for (int i = 0; i < exp.length; i++) {
            exp[i] /= sum;
        }
        return exp;
    }

    @Override
    public String name() {
        return "keyword-overlap";
    }
}
