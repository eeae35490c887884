package com.example.academics.service;

import com.example.academics.engine.model.StudentRef;
import com.example.academics.entities.Student;
import com.example.academics.repository.StudentRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class StudentService {

    private final Logger log = LoggerFactory.getLogger(StudentService.class);

    private final StudentRepository studentRepository;

    @Transactional
    public Student createStudent(String firstName, String lastName, String admissionNumber, String gradeLevel, String stream) {
        if (firstName == null || lastName == null || firstName.isBlank() || lastName.isBlank()) {
            throw new IllegalArgumentException("firstName/lastName required");
        }
        if (gradeLevel == null || gradeLevel.isBlank()) {
            throw new IllegalArgumentException("gradeLevel required");
        }
        if (admissionNumber != null && studentRepository.findByAdmissionNumber(admissionNumber.trim()).isPresent()) {
            throw new IllegalArgumentException("Admission number already in use: " + admissionNumber);
        }
        Student s = Student.builder()
                .firstName(firstName.trim())
                .lastName(lastName.trim())
                .admissionNumber(admissionNumber == null ? null : admissionNumber.trim())
                .gradeLevel(gradeLevel.trim())
                .stream(stream == null ? null : stream.trim())
                .createdAt(Instant.now())
                .updatedAt(Instant.now())
                .build();
        Student saved = studentRepository.save(s);
        log.info("Created student id={} name={} class={} {}", saved.getId(), saved.getFullName(), saved.getGradeLevel(), saved.getStream());
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<Student> findById(Long id) {
        return studentRepository.findById(id);
    }

    @Transactional(readOnly = true)
    public List<Student> findClass(String gradeLevel, String stream) {
        return studentRepository.findByGradeLevelAndStreamOrderByLastNameAscFirstNameAsc(gradeLevel, stream);
    }

    @Transactional(readOnly = true)
    public List<Student> findGrade(String gradeLevel) {
        return studentRepository.findByGradeLevelOrderByStreamAscLastNameAscFirstNameAsc(gradeLevel);
    }

    public static StudentRef toRef(Student s) {
        return StudentRef.builder()
                .id(s.getId())
                .name(s.getFullName())
                .admissionNumber(s.getAdmissionNumber())
                .stream(s.getStream())
                .build();
    }
}
