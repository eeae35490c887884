package com.example.academics.controller;

import com.example.academics.dto.ClassReport;
import com.example.academics.dto.GradeReport;
import com.example.academics.dto.StudentReportCard;
import com.example.academics.service.PerformanceReportService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;

@Controller
@RequiredArgsConstructor
@RequestMapping("/reports")
public class ReportController {

    private final PerformanceReportService reportService;

    @GetMapping("/class")
    @ResponseBody
    public ClassReport classReport(@RequestParam String grade,
                                   @RequestParam String stream,
                                   @RequestParam String term,
                                   @RequestParam String assessmentType) {
        return reportService.classReport(grade, stream, term, assessmentType);
    }

    @GetMapping("/grade")
    @ResponseBody
    public GradeReport gradeReport(@RequestParam String grade,
                                   @RequestParam String term,
                                   @RequestParam String assessmentType) {
        return reportService.gradeReport(grade, term, assessmentType);
    }

    @GetMapping("/student/{id}")
    @ResponseBody
    public StudentReportCard studentReport(@PathVariable Long id,
                                           @RequestParam String term,
                                           @RequestParam String assessmentType) {
        return reportService.studentReport(id, term, assessmentType);
    }
}
