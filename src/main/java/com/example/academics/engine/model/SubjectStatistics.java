package com.example.academics.engine.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SubjectStatistics {

    Long subjectId;

    String subjectName;

    MarkOutcome average;

    MarkOutcome highest;

    MarkOutcome lowest;

    /** Students with a mark in this subject. */
    int gradedCount;

    /** Grade of the class average; null when nobody has a mark. */
    GradeAward grade;
}
