package com.example.academics.repository;

import com.example.academics.entities.Mark;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface MarkRepository extends JpaRepository<Mark, Long> {

    List<Mark> findByStudentIdInAndTermAndAssessmentType(Collection<Long> studentIds, String term, String assessmentType);

    // componentKey: see Mark.componentKeyOf
    Optional<Mark> findByStudentIdAndSubjectIdAndComponentKeyAndTermAndAssessmentType(
            Long studentId, Long subjectId, long componentKey, String term, String assessmentType);
}
