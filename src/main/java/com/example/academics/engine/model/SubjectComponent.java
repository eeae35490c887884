package com.example.academics.engine.model;

import lombok.Builder;
import lombok.Value;

/**
 * Independently graded part of a composite subject, e.g. Grammar within English.
 */
@Value
@Builder
public class SubjectComponent {

    Long id;

    String name;

    /** Short column header used on class sheets (GRAM, COMP). */
    String abbreviation;

    /** Share of the parent subject's percentage; siblings sum to 1.0. */
    double weight;

    /** Scale marks for this component are entered against. */
    double maxRawScore;
}
