package com.example.academics.dto;

import com.example.academics.engine.model.Cohort;
import com.example.academics.engine.model.CohortSummary;
import com.example.academics.engine.model.StudentResult;
import com.example.academics.engine.model.Subject;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Class sheet of one stream: students in rank order plus the class statistics.
 */
@Value
@Builder
public class ClassReport {

    Cohort cohort;

    List<Subject> subjects;

    List<StudentResult> results;

    CohortSummary summary;
}
