package com.example.academics.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One mark submitted by a teacher. {@code maxRawScore} may be left out to use the
 * component's (or the default subject) scale.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarkEntryRequest {

    private Long studentId;

    private Long subjectId;

    /** Required for composite subjects, must be empty for atomic ones. */
    private Long componentId;

    private String term;

    private String assessmentType;

    private Double rawScore;

    private Double maxRawScore;
}
