package com.example.academics.engine;

import com.example.academics.engine.model.Cohort;
import com.example.academics.engine.model.CohortSummary;
import com.example.academics.engine.model.MarkOutcome;
import com.example.academics.engine.model.StudentResult;
import com.example.academics.engine.model.Subject;
import com.example.academics.engine.model.SubjectStatistics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives class and grade-level statistics from per-student results.
 * <p>
 * Averages only count students who have a mark; nobody is zero-filled. A grade-level roll-up
 * is computed from the union of the streams' student results, never from the streams'
 * already-averaged summaries.
 */
public class CohortSummarizer {

    /** Stream name reported for students not assigned to a stream. */
    public static final String UNASSIGNED_STREAM = "Unassigned";

    private final GradingVocabulary vocabulary;
    private final AggregationSettings settings;

    public CohortSummarizer(GradingVocabulary vocabulary, AggregationSettings settings) {
        this.vocabulary = vocabulary;
        this.settings = settings;
    }

    public CohortSummarizer withSettings(AggregationSettings other) {
        return new CohortSummarizer(vocabulary, other);
    }

    public CohortSummary summarize(Cohort cohort, List<StudentResult> results, List<Subject> subjects) {
        String system = vocabulary.system(settings.getGradingSystem()).getCode();
        for (StudentResult r : results) {
            if (r.getGradingSystem() != null && !system.equals(r.getGradingSystem())) {
                throw new IllegalArgumentException("Result of student " + r.getStudent().getId()
                        + " was graded with " + r.getGradingSystem() + ", summary uses " + system);
            }
        }

        CohortSummary.CohortSummaryBuilder summary = CohortSummary.builder()
                .cohort(cohort)
                .gradingSystem(system)
                .studentCount(results.size());

        SubjectStatistics top = null;
        SubjectStatistics least = null;
        for (Subject subject : subjects) {
            SubjectStatistics stats = subjectStatistics(subject, results, system);
            summary.subjectStatistic(subject.getId(), stats);
            if (stats.getAverage().isMissing()) {
                continue;
            }
            double avg = stats.getAverage().percentage();
            if (top == null || avg > top.getAverage().percentage()) {
                top = stats;
            }
            if (least == null || avg < least.getAverage().percentage()) {
                least = stats;
            }
        }
        summary.topSubject(top).leastPerformingSubject(least);

        Map<String, Long> distribution = new LinkedHashMap<>();
        for (String label : vocabulary.labels(system)) {
            distribution.put(label, 0L);
        }
        List<Double> averages = new ArrayList<>();
        int passed = 0;
        for (StudentResult r : results) {
            if (!r.hasMarks()) {
                continue;
            }
            double avg = r.getAveragePercentage().percentage();
            averages.add(avg);
            distribution.merge(r.getOverallGrade().getLabel(), 1L, Long::sum);
            if (vocabulary.isPass(avg, system)) {
                passed++;
            }
        }
        summary.bandDistribution(distribution)
                .gradedCount(averages.size())
                .ungradedCount(results.size() - averages.size());

        MarkOutcome classAverage = mean(averages);
        summary.classAverage(classAverage);
        if (classAverage.isPresent()) {
            summary.meanGrade(vocabulary.gradeFor(classAverage.percentage(), system));
            summary.passRate(MarkOutcome.of(ScoreRounding.round(passed * 100.0 / averages.size())));
        } else {
            summary.passRate(MarkOutcome.missing());
        }

        if (cohort != null && cohort.isRollUp()) {
            summary.streamAverages(streamAverages(results));
        }
        return summary.build();
    }

    /**
     * Grade-level summary over several streams, recomputed from every stream's student results.
     */
    public CohortSummary rollUp(Cohort gradeCohort, List<List<StudentResult>> streams, List<Subject> subjects) {
        if (gradeCohort == null || !gradeCohort.isRollUp()) {
            throw new IllegalArgumentException("Roll-up needs a grade-level cohort without a stream");
        }
        List<StudentResult> union = new ArrayList<>();
        for (List<StudentResult> stream : streams) {
            union.addAll(stream);
        }
        return summarize(gradeCohort, union, subjects);
    }

    private SubjectStatistics subjectStatistics(Subject subject, List<StudentResult> results, String system) {
        List<Double> values = new ArrayList<>();
        for (StudentResult r : results) {
            MarkOutcome outcome = r.outcomeFor(subject.getId());
            if (outcome.isPresent()) {
                values.add(outcome.percentage());
            }
        }
        MarkOutcome average = mean(values);
        return SubjectStatistics.builder()
                .subjectId(subject.getId())
                .subjectName(subject.getName())
                .average(average)
                .highest(values.isEmpty() ? MarkOutcome.missing() : MarkOutcome.of(values.stream().mapToDouble(Double::doubleValue).max().getAsDouble()))
                .lowest(values.isEmpty() ? MarkOutcome.missing() : MarkOutcome.of(values.stream().mapToDouble(Double::doubleValue).min().getAsDouble()))
                .gradedCount(values.size())
                .grade(average.isPresent() ? vocabulary.gradeFor(average.percentage(), system) : null)
                .build();
    }

    private static Map<String, MarkOutcome> streamAverages(List<StudentResult> results) {
        Map<String, List<Double>> byStream = new TreeMap<>();
        for (StudentResult r : results) {
            String stream = r.getStudent().getStream() == null ? UNASSIGNED_STREAM : r.getStudent().getStream();
            List<Double> values = byStream.computeIfAbsent(stream, k -> new ArrayList<>());
            if (r.hasMarks()) {
                values.add(r.getAveragePercentage().percentage());
            }
        }
        Map<String, MarkOutcome> out = new LinkedHashMap<>();
        byStream.forEach((stream, values) -> out.put(stream, mean(values)));
        return out;
    }

    private static MarkOutcome mean(List<Double> values) {
        if (values.isEmpty()) {
            return MarkOutcome.missing();
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return MarkOutcome.of(ScoreRounding.round(sum / values.size()));
    }
}
