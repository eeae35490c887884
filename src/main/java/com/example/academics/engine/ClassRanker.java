package com.example.academics.engine;

import com.example.academics.engine.model.MarkOutcome;
import com.example.academics.engine.model.StudentResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Orders a cohort and assigns competition ranks (1, 1, 3).
 * <p>
 * Sort keys: total score descending, then average percentage descending (a missing average
 * sorts below every value), then student name ascending, then input order. Only total and
 * average decide whether two students share a rank; the name merely fixes the listing order.
 */
public class ClassRanker {

    private static final Comparator<MarkOutcome> AVERAGE_DESCENDING = (a, b) -> {
        boolean aMissing = a == null || a.isMissing();
        boolean bMissing = b == null || b.isMissing();
        if (aMissing || bMissing) {
            return Boolean.compare(aMissing, bMissing);
        }
        return Double.compare(b.percentage(), a.percentage());
    };

    private static final Comparator<StudentResult> ORDER =
            Comparator.comparingDouble(StudentResult::getTotalScore).reversed()
                    .thenComparing(StudentResult::getAveragePercentage, AVERAGE_DESCENDING)
                    .thenComparing(r -> r.getStudent().getName(),
                            Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER));

    public List<StudentResult> rank(List<StudentResult> results) {
        if (results == null || results.isEmpty()) {
            return List.of();
        }
        List<StudentResult> sorted = new ArrayList<>(results);
        sorted.sort(ORDER); // List.sort is stable: equal keys keep input order

        List<StudentResult> ranked = new ArrayList<>(sorted.size());
        int rank = 0;
        StudentResult previous = null;
        for (int i = 0; i < sorted.size(); i++) {
            StudentResult current = sorted.get(i);
            if (previous == null || !sameStanding(previous, current)) {
                rank = i + 1;
            }
            ranked.add(current.toBuilder().rank(rank).build());
            previous = current;
        }
        return List.copyOf(ranked);
    }

    /**
     * Ranked results down to the rank of the {@code limit}-th student; students tied at the cut-off are all kept.
     * Students without any mark are never listed.
     */
    public List<StudentResult> topPerformers(List<StudentResult> results, int limit) {
        if (limit <= 0 || results == null || results.isEmpty()) {
            return List.of();
        }
        List<StudentResult> ranked;
        if (results.stream().anyMatch(r -> r.getRank() == null)) {
            ranked = new ArrayList<>(rank(results));
        } else {
            ranked = new ArrayList<>(results);
            ranked.sort(Comparator.comparing(StudentResult::getRank));
        }
        ranked.removeIf(r -> !r.hasMarks());
        if (ranked.isEmpty()) {
            return List.of();
        }
        int cutOff = ranked.get(Math.min(limit, ranked.size()) - 1).getRank();
        return ranked.stream()
                .filter(r -> r.getRank() <= cutOff)
                .collect(Collectors.toUnmodifiableList());
    }

    private static boolean sameStanding(StudentResult a, StudentResult b) {
        return Double.compare(a.getTotalScore(), b.getTotalScore()) == 0
                && AVERAGE_DESCENDING.compare(a.getAveragePercentage(), b.getAveragePercentage()) == 0;
    }
}
