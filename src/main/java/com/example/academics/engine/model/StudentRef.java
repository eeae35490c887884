package com.example.academics.engine.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StudentRef {

    Long id;

    String name;

    String admissionNumber;

    String stream;
}
