package com.example.academics.entities;

import com.example.academics.engine.model.EducationLevel;
import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Subject as offered at one education level. Composite subjects (English, Kiswahili) own their
 * components; marks are entered per component.
 */
@Entity
@Table(name = "subjects", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"name", "education_level"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SubjectEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 120)
    private String name;

    @Column(length = 16)
    private String abbreviation;

    @Enumerated(EnumType.STRING)
    @Column(name = "education_level", nullable = false, length = 32)
    private EducationLevel educationLevel;

    @Column(name = "is_composite", nullable = false)
    private boolean composite;

    // column order on class sheets
    @Column(name = "position")
    private Integer position;

    @Builder.Default
    @OneToMany(mappedBy = "subject", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @OrderBy("position ASC")
    private List<SubjectComponentEntity> components = new ArrayList<>();

    public void addComponent(SubjectComponentEntity component) {
        component.setSubject(this);
        if (component.getPosition() == null) {
            component.setPosition(components.size());
        }
        components.add(component);
    }
}
