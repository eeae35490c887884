package com.example.academics.dto;

import com.example.academics.engine.model.Cohort;
import com.example.academics.engine.model.CohortSummary;
import com.example.academics.engine.model.StudentResult;
import com.example.academics.engine.model.Subject;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Consolidated report of a whole grade. Students are ranked across all streams and the grade
 * summary is recomputed from every student's result.
 */
@Value
@Builder
public class GradeReport {

    Cohort cohort;

    List<Subject> subjects;

    List<StudentResult> results;

    CohortSummary summary;

    /** stream -> that stream's own summary */
    Map<String, CohortSummary> streamSummaries;

    List<StudentResult> topPerformers;
}
