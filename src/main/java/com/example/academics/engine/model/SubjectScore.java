package com.example.academics.engine.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A student's normalized result in one subject.
 * For composite subjects the breakdown lists the components that had a mark and those that did not.
 */
@Value
@Builder(toBuilder = true)
public class SubjectScore {

    Long subjectId;

    String subjectName;

    MarkOutcome outcome;

    /** Null when the outcome is missing. */
    GradeAward grade;

    /** componentId -> percentage, only for components with a recorded mark. */
    @Singular
    Map<Long, Double> componentPercentages;

    @Singular
    List<Long> missingComponentIds;

    public boolean isMissing() {
        return outcome.isMissing();
    }
}
