package com.example.academics.engine.model;

import lombok.Builder;
import lombok.Value;

/**
 * One mark as entered by a teacher. {@code componentId} is null for marks on atomic subjects.
 */
@Value
@Builder
public class RawMark {

    Long studentId;

    Long subjectId;

    Long componentId;

    String term;

    String assessmentType;

    double rawScore;

    double maxRawScore;
}
