package com.example.academics.entities;

import jakarta.persistence.*;
import lombok.*;

import java.io.Serializable;
import java.time.Instant;

@Entity
@Table(name = "students", indexes = {
        @Index(name = "idx_student_class", columnList = "grade_level, stream"),
        @Index(name = "idx_student_admission", columnList = "admission_number")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Student implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "first_name", nullable = false, length = 120)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 120)
    private String lastName;

    // school-issued number printed on report cards
    @Column(name = "admission_number", length = 64, unique = true)
    private String admissionNumber;

    // "Grade 7", "PP1", ...
    @Column(name = "grade_level", nullable = false, length = 40)
    private String gradeLevel;

    // "A", "B", ... ; null until the student is assigned
    @Column(name = "stream", length = 40)
    private String stream;

    @Builder.Default
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Builder.Default
    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    public String getFullName() {
        return firstName + " " + lastName;
    }
}
