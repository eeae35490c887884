package com.example.academics.service;

import com.example.academics.config.AcademicsProperties;
import com.example.academics.dto.MarkEntryRequest;
import com.example.academics.engine.MarkNormalizer;
import com.example.academics.engine.exception.InvalidMarkScaleException;
import com.example.academics.engine.model.EducationLevel;
import com.example.academics.entities.Mark;
import com.example.academics.entities.Student;
import com.example.academics.entities.SubjectComponentEntity;
import com.example.academics.entities.SubjectEntity;
import com.example.academics.repository.MarkRepository;
import com.example.academics.repository.SubjectRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Mark entry with create-or-update semantics:
 * - one mark per (student, subject, component, term, assessment type); entering it again replaces the old score.
 * - composite subjects take marks per component only; atomic subjects take none.
 * - invalid marks are rejected as they are, never clamped into range.
 */
@Service
@RequiredArgsConstructor
public class MarkEntryService {

    private final Logger log = LoggerFactory.getLogger(MarkEntryService.class);

    private final MarkRepository markRepository;
    private final SubjectRepository subjectRepository;
    private final StudentService studentService;
    private final AcademicsProperties properties;

    @Transactional
    public Mark recordMark(String enteredBy, MarkEntryRequest request) {
        if (request == null || request.getStudentId() == null || request.getSubjectId() == null || request.getRawScore() == null) {
            throw new IllegalArgumentException("studentId, subjectId and rawScore are required");
        }
        if (!properties.isKnownTerm(request.getTerm())) {
            throw new IllegalArgumentException("Unknown term: " + request.getTerm());
        }
        if (!properties.isKnownAssessmentType(request.getAssessmentType())) {
            throw new IllegalArgumentException("Unknown assessment type: " + request.getAssessmentType());
        }

        Student student = studentService.findById(request.getStudentId())
                .orElseThrow(() -> new IllegalArgumentException("Student not found: " + request.getStudentId()));
        SubjectEntity subject = subjectRepository.findById(request.getSubjectId())
                .orElseThrow(() -> new IllegalArgumentException("Subject not found: " + request.getSubjectId()));

        EducationLevel level = EducationLevel.forGrade(student.getGradeLevel());
        if (subject.getEducationLevel() != level) {
            throw new IllegalArgumentException("Subject " + subject.getName() + " is not offered in " + student.getGradeLevel());
        }

        SubjectComponentEntity component = resolveComponent(subject, request.getComponentId());
        double max = request.getMaxRawScore() != null ? request.getMaxRawScore()
                : component != null ? component.getMaxRawScore()
                : properties.getScale().getDefaultSubjectMax();
        if (max > properties.getMaxRawScoreLimit()) {
            throw new InvalidMarkScaleException("Maximum raw mark " + max + " exceeds limit of " + properties.getMaxRawScoreLimit());
        }
        // same range checks the engine applies when the mark is read back
        MarkNormalizer.percentage(request.getRawScore(), max);

        Long componentId = component == null ? null : component.getId();
        LocalDateTime now = LocalDateTime.now();
        Optional<Mark> existing = markRepository.findByStudentIdAndSubjectIdAndComponentKeyAndTermAndAssessmentType(
                student.getId(), subject.getId(), Mark.componentKeyOf(componentId), request.getTerm(), request.getAssessmentType());

        Mark mark;
        if (existing.isPresent()) {
            mark = existing.get();
            log.info("Updating mark id={} student={} subject={} component={}: {}/{} -> {}/{}",
                    mark.getId(), student.getId(), subject.getName(), componentId,
                    mark.getRawScore(), mark.getMaxRawScore(), request.getRawScore(), max);
            mark.setRawScore(request.getRawScore());
            mark.setMaxRawScore(max);
            mark.setEnteredBy(enteredBy);
            mark.setEnteredAt(now);
        } else {
            mark = Mark.builder()
                    .studentId(student.getId())
                    .subjectId(subject.getId())
                    .componentId(componentId)
                    .componentKey(Mark.componentKeyOf(componentId))
                    .term(request.getTerm())
                    .assessmentType(request.getAssessmentType())
                    .rawScore(request.getRawScore())
                    .maxRawScore(max)
                    .enteredBy(enteredBy)
                    .enteredAt(now)
                    .build();
            log.info("Recording mark student={} subject={} component={} {} {}: {}/{}",
                    student.getId(), subject.getName(), componentId,
                    request.getTerm(), request.getAssessmentType(), request.getRawScore(), max);
        }
        try {
            return markRepository.saveAndFlush(mark);
        } catch (DataIntegrityViolationException ex) {
            // a concurrent entry for the same key won the insert
            throw new IllegalArgumentException("Mark already recorded for student " + student.getId()
                    + ", " + subject.getName() + " (" + request.getTerm() + ", " + request.getAssessmentType() + "); retry to update it", ex);
        }
    }

    /**
     * Records a batch in one transaction: if any mark is rejected none of them is stored.
     */
    @Transactional
    public List<Mark> recordMarks(String enteredBy, List<MarkEntryRequest> requests) {
        if (requests == null || requests.isEmpty()) return List.of();
        List<Mark> saved = new ArrayList<>(requests.size());
        for (MarkEntryRequest r : requests) {
            saved.add(recordMark(enteredBy, r));
        }
        return saved;
    }

    @Transactional
    public void deleteMark(Long markId) {
        Mark mark = markRepository.findById(markId)
                .orElseThrow(() -> new IllegalArgumentException("Mark not found: " + markId));
        markRepository.delete(mark);
        log.info("Deleted mark id={} student={} subject={} component={}",
                mark.getId(), mark.getStudentId(), mark.getSubjectId(), mark.getComponentId());
    }

    private SubjectComponentEntity resolveComponent(SubjectEntity subject, Long componentId) {
        if (!subject.isComposite()) {
            if (componentId != null) {
                throw new IllegalArgumentException("Subject " + subject.getName() + " has no components");
            }
            return null;
        }
        if (componentId == null) {
            throw new IllegalArgumentException("Subject " + subject.getName() + " is composite: mark a component");
        }
        return subject.getComponents().stream()
                .filter(c -> componentId.equals(c.getId()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Component " + componentId + " does not belong to " + subject.getName()));
    }
}
