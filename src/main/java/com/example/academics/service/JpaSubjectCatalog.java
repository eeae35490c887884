package com.example.academics.service;

import com.example.academics.engine.model.EducationLevel;
import com.example.academics.engine.model.Subject;
import com.example.academics.engine.model.SubjectComponent;
import com.example.academics.engine.port.SubjectCatalog;
import com.example.academics.entities.SubjectComponentEntity;
import com.example.academics.entities.SubjectEntity;
import com.example.academics.repository.SubjectRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads subject structure from the database and hands the engine plain values.
 * Weights are passed through as stored; the engine's resolver decides whether they are valid.
 */
@Service
@RequiredArgsConstructor
public class JpaSubjectCatalog implements SubjectCatalog {

    private final SubjectRepository subjectRepository;

    @Override
    @Transactional(readOnly = true)
    public List<Subject> subjectsFor(EducationLevel level) {
        return subjectRepository.findByEducationLevelOrderByPositionAscNameAsc(level).stream()
                .map(JpaSubjectCatalog::toModel)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<Subject> allSubjects() {
        return subjectRepository.findAllByOrderByEducationLevelAscPositionAscNameAsc().stream()
                .map(JpaSubjectCatalog::toModel)
                .collect(Collectors.toList());
    }

    static Subject toModel(SubjectEntity entity) {
        Subject.SubjectBuilder b = Subject.builder()
                .id(entity.getId())
                .name(entity.getName())
                .abbreviation(entity.getAbbreviation())
                .educationLevel(entity.getEducationLevel())
                .composite(entity.isComposite());
        for (SubjectComponentEntity c : entity.getComponents()) {
            b.component(SubjectComponent.builder()
                    .id(c.getId())
                    .name(c.getName())
                    .abbreviation(c.getAbbreviation())
                    .weight(c.getWeight())
                    .maxRawScore(c.getMaxRawScore())
                    .build());
        }
        return b.build();
    }
}
