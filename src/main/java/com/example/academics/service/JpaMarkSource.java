package com.example.academics.service;

import com.example.academics.engine.model.RawMark;
import com.example.academics.engine.port.MarkSource;
import com.example.academics.entities.Mark;
import com.example.academics.repository.MarkRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class JpaMarkSource implements MarkSource {

    private final MarkRepository markRepository;

    @Override
    @Transactional(readOnly = true)
    public List<RawMark> fetchMarks(Collection<Long> studentIds, String term, String assessmentType) {
        if (studentIds == null || studentIds.isEmpty()) return List.of();
        return markRepository.findByStudentIdInAndTermAndAssessmentType(studentIds, term, assessmentType).stream()
                .map(JpaMarkSource::toRawMark)
                .collect(Collectors.toList());
    }

    static RawMark toRawMark(Mark m) {
        return RawMark.builder()
                .studentId(m.getStudentId())
                .subjectId(m.getSubjectId())
                .componentId(m.getComponentId())
                .term(m.getTerm())
                .assessmentType(m.getAssessmentType())
                .rawScore(m.getRawScore())
                .maxRawScore(m.getMaxRawScore())
                .build();
    }
}
