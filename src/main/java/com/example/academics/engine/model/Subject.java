package com.example.academics.engine.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A reported subject. Composite subjects own an ordered list of weighted components;
 * atomic subjects own none.
 */
@Value
@Builder
public class Subject {

    Long id;

    String name;

    String abbreviation;

    EducationLevel educationLevel;

    boolean composite;

    @Singular
    List<SubjectComponent> components;
}
