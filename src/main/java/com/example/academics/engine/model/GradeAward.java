package com.example.academics.engine.model;

import lombok.Value;

@Value
public class GradeAward {

    String label;

    String description;

    double points;

    String systemCode;
}
