package com.example.academics.engine.model;

import lombok.Value;

/**
 * One row of a grading table: every percentage at or above {@code lowerBound}
 * (and below the next band up) receives {@code label} and {@code points}.
 */
@Value
public class GradeBand {

    double lowerBound;

    String label;

    String description;

    double points;
}
