package com.example.academics.repository;

import com.example.academics.entities.Student;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface StudentRepository extends JpaRepository<Student, Long> {

    List<Student> findByGradeLevelAndStreamOrderByLastNameAscFirstNameAsc(String gradeLevel, String stream);

    List<Student> findByGradeLevelOrderByStreamAscLastNameAscFirstNameAsc(String gradeLevel);

    Optional<Student> findByAdmissionNumber(String admissionNumber);
}
