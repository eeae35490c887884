package com.example.academics.dto;

import com.example.academics.engine.model.Cohort;
import com.example.academics.engine.model.MarkOutcome;
import com.example.academics.engine.model.StudentResult;
import com.example.academics.engine.model.Subject;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class StudentReportCard {

    Cohort cohort;

    List<Subject> subjects;

    StudentResult result;

    int classSize;

    MarkOutcome classAverage;
}
