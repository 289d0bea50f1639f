package com.intellibank.analysis.classification;

import java.util.Map;

import com.intellibank.analysis.classification.rules.KeywordHeuristics;
import com.intellibank.analysis.util.NormalizeUtil;

/**
 * Local backend: sums keyword weights per category over merchant and description, highest total
 * wins. Categories listed first win ties.
 */
public class KeywordScoringClassifierBackend implements ClassifierBackend {

    @Override
    public ClassifierVerdict classify(String merchantText, String description) {
        String text = NormalizeUtil.looseNormalize(
                (merchantText == null ? "" : merchantText) + " " + (description == null ? "" : description));
        if (text.isEmpty()) return ClassifierVerdict.none();

        Category best = null;
        double bestScore = 0.0;
        for (Map.Entry<Category, Map<String, Double>> e : KeywordHeuristics.CATEGORY_KEYWORD_WEIGHTS.entrySet()) {
            double total = 0.0;
            for (Map.Entry<String, Double> kw : e.getValue().entrySet()) {
                if (NormalizeUtil.containsWord(text, kw.getKey())) {
                    total += kw.getValue();
                }
            }
            if (total > bestScore) {
                bestScore = total;
                best = e.getKey();
            }
        }

        if (best == null) return ClassifierVerdict.none();
        return new ClassifierVerdict(best.label(), KeywordHeuristics.confidenceFromScore(bestScore));
    }
}
