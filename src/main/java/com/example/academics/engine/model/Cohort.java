package com.example.academics.engine.model;

import lombok.Value;

/**
 * Students sharing a grade, stream, term and assessment type.
 * A cohort without a stream is a grade-level roll-up across all streams.
 */
@Value
public class Cohort {

    String gradeLevel;

    String stream;

    String term;

    String assessmentType;

    public static Cohort ofClass(String gradeLevel, String stream, String term, String assessmentType) {
        return new Cohort(gradeLevel, stream, term, assessmentType);
    }

    public static Cohort ofGrade(String gradeLevel, String term, String assessmentType) {
        return new Cohort(gradeLevel, null, term, assessmentType);
    }

    public boolean isRollUp() {
        return stream == null;
    }
}
