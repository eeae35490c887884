package com.example.academics.engine.model;

import lombok.Value;

/**
 * A component paired with the weight it carries in its subject.
 * The component is {@code null} for the single pseudo-component of an atomic subject.
 */
@Value
public class WeightedComponent {

    SubjectComponent component;

    double weight;

    public Long getComponentId() {
        return component == null ? null : component.getId();
    }
}
