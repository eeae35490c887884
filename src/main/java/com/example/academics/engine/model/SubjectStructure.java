package com.example.academics.engine.model;

import lombok.Value;

import java.util.List;

@Value
public class SubjectStructure {

    boolean composite;

    List<WeightedComponent> components;

    public static SubjectStructure atomic() {
        return new SubjectStructure(false, List.of());
    }

    public static SubjectStructure composite(List<WeightedComponent> components) {
        return new SubjectStructure(true, List.copyOf(components));
    }
}
