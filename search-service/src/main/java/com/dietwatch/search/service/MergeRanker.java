package com.dietwatch.search.service;

import com.dietwatch.search.model.MergedResult;
import com.dietwatch.search.model.ResultSource;
import com.dietwatch.search.model.ScoredHit;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted fusion of min-max normalized keyword and vector scores.
 *
 * <p>Ordering is total: combined score (rounded to 1e-9) descending, then entities found by both
 * backends, then the more recent metadata date (missing dates last), then entity id.
 */
@Service
public class MergeRanker {

    private static final double SCORE_PRECISION = 1e9;

    private static final Comparator<MergedResult> ORDER = Comparator
            .comparingDouble(MergedResult::combinedScore).reversed()
            .thenComparing(result -> result.source() == ResultSource.BOTH ? 0 : 1)
            .thenComparing(MergedResult::date, Comparator.nullsLast(Comparator.<LocalDate>reverseOrder()))
            .thenComparing(MergedResult::entityId);

    private final double keywordWeight;
    private final double vectorWeight;

    public MergeRanker() {
        this(0.4, 0.6);
    }

    @Autowired
    public MergeRanker(
            @Value("${search.merge.keyword-weight:0.4}") double keywordWeight,
            @Value("${search.merge.vector-weight:0.6}") double vectorWeight
    ) {
        if (keywordWeight < 0 || vectorWeight < 0) {
            throw new IllegalArgumentException("merge weights must not be negative");
        }
        this.keywordWeight = keywordWeight;
        this.vectorWeight = vectorWeight;
    }

    /**
     * Merges both lists completely and returns the requested 1-based page.
     */
    public List<MergedResult> merge(List<ScoredHit> keyword, List<ScoredHit> vector, int page, int pageSize) {
        List<MergedResult> ranked = mergeAll(keyword, vector);
        int from = (int) Math.min((long) (page - 1) * pageSize, ranked.size());
        int to = (int) Math.min((long) from + pageSize, ranked.size());
        return new ArrayList<>(ranked.subList(from, to));
    }

    public List<MergedResult> mergeAll(List<ScoredHit> keyword, List<ScoredHit> vector) {
        Map<String, Signal> merged = new LinkedHashMap<>();

        Map<String, Double> keywordNormalized = normalize(keyword);
        for (Map.Entry<String, Double> entry : keywordNormalized.entrySet()) {
            Signal signal = merged.computeIfAbsent(entry.getKey(), Signal::new);
            signal.keywordScore = entry.getValue();
            signal.inKeyword = true;
        }
        Map<String, Double> vectorNormalized = normalize(vector);
        for (Map.Entry<String, Double> entry : vectorNormalized.entrySet()) {
            Signal signal = merged.computeIfAbsent(entry.getKey(), Signal::new);
            signal.vectorScore = entry.getValue();
            signal.inVector = true;
        }
        collectDates(keyword, merged);
        collectDates(vector, merged);

        List<MergedResult> ranked = new ArrayList<>(merged.size());
        for (Signal signal : merged.values()) {
            double combined = (keywordWeight * signal.keywordScore) + (vectorWeight * signal.vectorScore);
            ranked.add(new MergedResult(
                    signal.id,
                    round(combined),
                    source(signal),
                    signal.keywordScore,
                    signal.vectorScore,
                    signal.date
            ));
        }
        ranked.sort(ORDER);
        return ranked;
    }

    public double getKeywordWeight() {
        return keywordWeight;
    }

    public double getVectorWeight() {
        return vectorWeight;
    }

    /**
     * Min-max per list; an entity listed twice keeps its best score. A list whose scores are all equal
     * (including a single hit) normalizes to 1.0. Otherwise the lowest-scoring hit of each list maps to 0
     * and adds nothing to the weighted score.
     */
    public static Map<String, Double> normalize(List<ScoredHit> hits) {
        Map<String, Double> best = new LinkedHashMap<>();
        if (hits == null) {
            return best;
        }
        for (ScoredHit hit : hits) {
            if (hit == null || hit.entityId() == null || Double.isNaN(hit.score())) {
                continue;
            }
            best.merge(hit.entityId(), hit.score(), Math::max);
        }
        if (best.isEmpty()) {
            return best;
        }
        double min = best.values().stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        double max = best.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double range = max - min;
        best.replaceAll((id, score) -> range <= 0 ? 1.0 : (score - min) / range);
        return best;
    }

    private static void collectDates(List<ScoredHit> hits, Map<String, Signal> merged) {
        if (hits == null) {
            return;
        }
        for (ScoredHit hit : hits) {
            if (hit == null || hit.date() == null) {
                continue;
            }
            Signal signal = merged.get(hit.entityId());
            if (signal != null && signal.date == null) {
                signal.date = hit.date();
            }
        }
    }

    private static ResultSource source(Signal signal) {
        if (signal.inKeyword && signal.inVector) {
            return ResultSource.BOTH;
        }
        return signal.inKeyword ? ResultSource.KEYWORD : ResultSource.VECTOR;
    }

    private static double round(double score) {
        return Math.round(score * SCORE_PRECISION) / SCORE_PRECISION;
    }

    private static final class Signal {
        private final String id;
        private double keywordScore;
        private double vectorScore;
        private boolean inKeyword;
        private boolean inVector;
        private LocalDate date;

        private Signal(String id) {
            this.id = id;
        }
    }
}
