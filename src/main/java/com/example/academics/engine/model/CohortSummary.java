package com.example.academics.engine.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Class or grade-level statistics derived from per-student results.
 */
@Value
@Builder
public class CohortSummary {

    Cohort cohort;

    String gradingSystem;

    int studentCount;

    int gradedCount;

    int ungradedCount;

    /** subjectId -> statistics, in subject order. */
    @Singular("subjectStatistic")
    Map<Long, SubjectStatistics> subjectStatistics;

    /** Overall-grade label -> number of students, every band of the system present in band order. */
    @Singular("bandCount")
    Map<String, Long> bandDistribution;

    MarkOutcome classAverage;

    GradeAward meanGrade;

    /** Share of graded students at or above the pass mark, in percent; missing when nobody is graded. */
    MarkOutcome passRate;

    SubjectStatistics topSubject;

    SubjectStatistics leastPerformingSubject;

    /** Stream -> average of its students; only filled for grade-level roll-ups. */
    @Singular("streamAverage")
    Map<String, MarkOutcome> streamAverages;
}
