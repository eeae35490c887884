package com.example.academics.repository;

import com.example.academics.engine.model.EducationLevel;
import com.example.academics.entities.SubjectEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface SubjectRepository extends JpaRepository<SubjectEntity, Long> {

    List<SubjectEntity> findByEducationLevelOrderByPositionAscNameAsc(EducationLevel educationLevel);

    List<SubjectEntity> findAllByOrderByEducationLevelAscPositionAscNameAsc();

    Optional<SubjectEntity> findByNameAndEducationLevel(String name, EducationLevel educationLevel);
}
