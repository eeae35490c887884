package com.example.academics.engine;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Inputs that shape aggregation but do not come from marks: the grading system results are
 * reported in and the raw-mark scale totals are expressed on.
 */
@Value
@Builder(toBuilder = true)
public class AggregationSettings {

    public static final double DEFAULT_SUBJECT_MAX_SCALE = 100.0;

    String gradingSystem;

    @Builder.Default
    double defaultSubjectMaxScale = DEFAULT_SUBJECT_MAX_SCALE;

    /** assessment type -> marks per subject, for assessments not out of the default scale. */
    @Singular
    Map<String, Double> assessmentScales;

    public double subjectMaxScaleFor(String assessmentType) {
        Double scale = assessmentType == null ? null : assessmentScales.get(assessmentType);
        double value = scale != null ? scale : defaultSubjectMaxScale;
        if (!(value > 0)) {
            throw new IllegalStateException("Subject max scale for " + assessmentType + " must be positive, got " + value);
        }
        return value;
    }

    public static AggregationSettings forSystem(String gradingSystem) {
        return AggregationSettings.builder().gradingSystem(gradingSystem).build();
    }
}
