package com.example.academics.engine;

import com.example.academics.engine.model.GradeAward;
import com.example.academics.engine.model.MarkOutcome;
import com.example.academics.engine.model.MarkSnapshot;
import com.example.academics.engine.model.StudentRef;
import com.example.academics.engine.model.StudentResult;
import com.example.academics.engine.model.Subject;
import com.example.academics.engine.model.SubjectScore;

import java.util.ArrayList;
import java.util.List;

/**
 * Combines a student's subject percentages into totals, an average and an overall grade.
 * <p>
 * Subjects without any mark are excluded from the total, the average and the points, the same
 * way missing components are excluded inside a composite subject. A student with no mark at
 * all gets a missing average and no overall grade.
 */
public class StudentAggregator {

    private final MarkNormalizer normalizer;
    private final GradingVocabulary vocabulary;
    private final AggregationSettings settings;

    public StudentAggregator(MarkNormalizer normalizer, GradingVocabulary vocabulary, AggregationSettings settings) {
        this.normalizer = normalizer;
        this.vocabulary = vocabulary;
        this.settings = settings;
    }

    public AggregationSettings getSettings() {
        return settings;
    }

    /** Same collaborators, different settings (e.g. another grading system for a comparison report). */
    public StudentAggregator withSettings(AggregationSettings other) {
        return new StudentAggregator(normalizer, vocabulary, other);
    }

    public StudentResult aggregate(StudentRef student, String term, String assessmentType,
                                   List<Subject> subjects, MarkSnapshot marks) {
        String system = vocabulary.system(settings.getGradingSystem()).getCode();
        double scale = settings.subjectMaxScaleFor(assessmentType);

        StudentResult.StudentResultBuilder result = StudentResult.builder()
                .student(student)
                .term(term)
                .assessmentType(assessmentType)
                .gradingSystem(system);

        double total = 0;
        double percentageSum = 0;
        double points = 0;
        int graded = 0;

        for (Subject subject : subjects) {
            SubjectScore score = normalizer.normalizeDetailed(marks, student.getId(), subject, term, assessmentType);
            if (score.isMissing()) {
                result.subjectScore(subject.getId(), score);
                continue;
            }
            double pct = score.getOutcome().percentage();
            GradeAward award = vocabulary.gradeFor(pct, system);
            result.subjectScore(subject.getId(), score.toBuilder().grade(award).build());

            total += pct / 100.0 * scale;
            percentageSum += pct;
            points += award.getPoints();
            graded++;
        }

        if (graded == 0) {
            return result
                    .totalScore(0)
                    .totalPossible(0)
                    .averagePercentage(MarkOutcome.missing())
                    .totalPoints(0)
                    .build();
        }

        double average = ScoreRounding.round(percentageSum / graded);
        return result
                .totalScore(ScoreRounding.round(total))
                .totalPossible(graded * scale)
                .averagePercentage(MarkOutcome.of(average))
                .overallGrade(vocabulary.gradeFor(average, system))
                .totalPoints(points)
                .build();
    }

    public List<StudentResult> aggregateAll(List<StudentRef> students, String term, String assessmentType,
                                            List<Subject> subjects, MarkSnapshot marks) {
        List<StudentResult> out = new ArrayList<>(students.size());
        for (StudentRef student : students) {
            out.add(aggregate(student, term, assessmentType, subjects, marks));
        }
        return out;
    }
}
