package com.example.academics.engine.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Aggregated result of one student for one term and assessment.
 * {@code rank} is null until the result passes through the class ranker and is recomputed on every run.
 */
@Value
@Builder(toBuilder = true)
public class StudentResult {

    StudentRef student;

    String term;

    String assessmentType;

    String gradingSystem;

    /** subjectId -> score, in the order subjects were supplied. */
    @Singular
    Map<Long, SubjectScore> subjectScores;

    double totalScore;

    double totalPossible;

    MarkOutcome averagePercentage;

    /** Null when the student has no mark in any subject. */
    GradeAward overallGrade;

    double totalPoints;

    Integer rank;

    public boolean hasMarks() {
        return averagePercentage != null && averagePercentage.isPresent();
    }

    public MarkOutcome outcomeFor(Long subjectId) {
        SubjectScore score = subjectScores.get(subjectId);
        return score == null ? MarkOutcome.missing() : score.getOutcome();
    }
}
