package com.example.academics.entities;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * A raw mark as entered by a teacher. Marks on composite subjects always name a component;
 * marks on atomic subjects leave {@code componentId} empty and store {@link #ATOMIC_COMPONENT_KEY}
 * as their component key, so the unique constraint also covers them.
 */
@Entity
@Table(name = "marks", indexes = {
        @Index(name = "idx_mark_lookup", columnList = "student_id, term, assessment_type")
}, uniqueConstraints = {
        @UniqueConstraint(columnNames = {"student_id", "subject_id", "component_key", "term", "assessment_type"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Mark {

    public static final long ATOMIC_COMPONENT_KEY = 0L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false)
    private Long studentId;

    @Column(name = "subject_id", nullable = false)
    private Long subjectId;

    @Column(name = "component_id")
    private Long componentId;

    // componentId, or ATOMIC_COMPONENT_KEY; never null
    @Column(name = "component_key", nullable = false)
    private long componentKey;

    @Column(nullable = false, length = 40)
    private String term;

    @Column(name = "assessment_type", nullable = false, length = 40)
    private String assessmentType;

    @Column(name = "raw_score", nullable = false)
    private double rawScore;

    @Column(name = "max_raw_score", nullable = false)
    private double maxRawScore;

    private String enteredBy;
    private LocalDateTime enteredAt;

    public static long componentKeyOf(Long componentId) {
        return componentId == null ? ATOMIC_COMPONENT_KEY : componentId;
    }

    @PrePersist
    @PreUpdate
    void syncComponentKey() {
        componentKey = componentKeyOf(componentId);
    }
}
