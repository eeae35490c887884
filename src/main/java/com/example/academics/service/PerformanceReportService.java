package com.example.academics.service;

import com.example.academics.config.AcademicsProperties;
import com.example.academics.dto.ClassReport;
import com.example.academics.dto.GradeReport;
import com.example.academics.dto.StudentReportCard;
import com.example.academics.engine.ClassRanker;
import com.example.academics.engine.CohortSummarizer;
import com.example.academics.engine.StudentAggregator;
import com.example.academics.engine.model.Cohort;
import com.example.academics.engine.model.CohortSummary;
import com.example.academics.engine.model.EducationLevel;
import com.example.academics.engine.model.MarkSnapshot;
import com.example.academics.engine.model.StudentRef;
import com.example.academics.engine.model.StudentResult;
import com.example.academics.engine.model.Subject;
import com.example.academics.engine.port.MarkSource;
import com.example.academics.engine.port.SubjectCatalog;
import com.example.academics.entities.Student;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Builds class, grade and student reports.
 * <p>
 * Each report reads its marks once into a {@link MarkSnapshot} inside a read-only transaction and
 * hands the snapshot to the engine; nothing computed here is stored. Engine errors (invalid
 * composite definitions, invalid mark scales) propagate to the caller unchanged.
 */
@Service
@RequiredArgsConstructor
public class PerformanceReportService {

    private final Logger log = LoggerFactory.getLogger(PerformanceReportService.class);

    private final StudentService studentService;
    private final SubjectCatalog subjectCatalog;
    private final MarkSource markSource;
    private final StudentAggregator aggregator;
    private final ClassRanker ranker;
    private final CohortSummarizer summarizer;
    private final AcademicsProperties properties;

    @Transactional(readOnly = true)
    public ClassReport classReport(String gradeLevel, String stream, String term, String assessmentType) {
        requireKnownPeriod(term, assessmentType);
        if (stream == null || stream.isBlank()) {
            throw new IllegalArgumentException("stream required for a class report");
        }
        List<Subject> subjects = subjectCatalog.subjectsFor(EducationLevel.forGrade(gradeLevel));
        List<Student> students = studentService.findClass(gradeLevel, stream);

        List<StudentResult> ranked = rankedResults(students, subjects, term, assessmentType);
        Cohort cohort = Cohort.ofClass(gradeLevel, stream, term, assessmentType);
        CohortSummary summary = summarizer.summarize(cohort, ranked, subjects);

        log.info("Class report {} {} {} {}: {} students, {} graded",
                gradeLevel, stream, term, assessmentType, summary.getStudentCount(), summary.getGradedCount());
        return ClassReport.builder()
                .cohort(cohort)
                .subjects(subjects)
                .results(ranked)
                .summary(summary)
                .build();
    }

    @Transactional(readOnly = true)
    public GradeReport gradeReport(String gradeLevel, String term, String assessmentType) {
        requireKnownPeriod(term, assessmentType);
        List<Subject> subjects = subjectCatalog.subjectsFor(EducationLevel.forGrade(gradeLevel));
        List<Student> students = studentService.findGrade(gradeLevel);

        MarkSnapshot marks = snapshot(students, term, assessmentType);
        List<StudentRef> refs = students.stream().map(StudentService::toRef).collect(Collectors.toList());
        List<StudentResult> results = aggregator.aggregateAll(refs, term, assessmentType, subjects, marks);

        // streams are ranked on their own; the grade ranking spans all of them
        Map<String, List<StudentResult>> byStream = new TreeMap<>();
        for (StudentResult r : results) {
            String stream = Objects.requireNonNullElse(r.getStudent().getStream(), CohortSummarizer.UNASSIGNED_STREAM);
            byStream.computeIfAbsent(stream, k -> new ArrayList<>()).add(r);
        }
        Map<String, CohortSummary> streamSummaries = new LinkedHashMap<>();
        List<List<StudentResult>> streams = new ArrayList<>();
        byStream.forEach((stream, streamResults) -> {
            List<StudentResult> rankedStream = ranker.rank(streamResults);
            streams.add(rankedStream);
            streamSummaries.put(stream, summarizer.summarize(
                    Cohort.ofClass(gradeLevel, stream, term, assessmentType), rankedStream, subjects));
        });

        Cohort cohort = Cohort.ofGrade(gradeLevel, term, assessmentType);
        List<StudentResult> ranked = ranker.rank(results);
        CohortSummary summary = summarizer.rollUp(cohort, streams, subjects);

        log.info("Grade report {} {} {}: {} streams, {} students, {} graded",
                gradeLevel, term, assessmentType, streams.size(), summary.getStudentCount(), summary.getGradedCount());
        return GradeReport.builder()
                .cohort(cohort)
                .subjects(subjects)
                .results(ranked)
                .summary(summary)
                .streamSummaries(streamSummaries)
                .topPerformers(ranker.topPerformers(ranked, properties.getTopPerformers()))
                .build();
    }

    /**
     * Report-card data for one student, ranked within their own class.
     */
    @Transactional(readOnly = true)
    public StudentReportCard studentReport(Long studentId, String term, String assessmentType) {
        Student student = studentService.findById(studentId)
                .orElseThrow(() -> new IllegalArgumentException("Student not found: " + studentId));
        if (student.getStream() == null) {
            throw new IllegalArgumentException("Student " + studentId + " is not assigned to a stream");
        }
        ClassReport classReport = classReport(student.getGradeLevel(), student.getStream(), term, assessmentType);
        StudentResult result = classReport.getResults().stream()
                .filter(r -> studentId.equals(r.getStudent().getId()))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Student " + studentId + " missing from own class report"));
        return StudentReportCard.builder()
                .cohort(classReport.getCohort())
                .subjects(classReport.getSubjects())
                .result(result)
                .classSize(classReport.getResults().size())
                .classAverage(classReport.getSummary().getClassAverage())
                .build();
    }

    private List<StudentResult> rankedResults(List<Student> students, List<Subject> subjects, String term, String assessmentType) {
        MarkSnapshot marks = snapshot(students, term, assessmentType);
        List<StudentRef> refs = students.stream().map(StudentService::toRef).collect(Collectors.toList());
        return ranker.rank(aggregator.aggregateAll(refs, term, assessmentType, subjects, marks));
    }

    private MarkSnapshot snapshot(List<Student> students, String term, String assessmentType) {
        List<Long> ids = students.stream().map(Student::getId).collect(Collectors.toList());
        MarkSnapshot snapshot = MarkSnapshot.of(markSource.fetchMarks(ids, term, assessmentType));
        log.debug("Loaded {} marks for {} students ({} {})", snapshot.size(), ids.size(), term, assessmentType);
        return snapshot;
    }

    private void requireKnownPeriod(String term, String assessmentType) {
        if (!properties.isKnownTerm(term)) {
            throw new IllegalArgumentException("Unknown term: " + term);
        }
        if (!properties.isKnownAssessmentType(assessmentType)) {
            throw new IllegalArgumentException("Unknown assessment type: " + assessmentType);
        }
    }
}
