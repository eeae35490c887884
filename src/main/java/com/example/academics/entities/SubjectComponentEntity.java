package com.example.academics.entities;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "subject_components")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = "subject")
public class SubjectComponentEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "subject_id")
    private SubjectEntity subject;

    @Column(nullable = false, length = 120)
    private String name;

    @Column(length = 16)
    private String abbreviation;

    // fraction of the parent subject, siblings sum to 1.0
    @Column(nullable = false)
    private double weight;

    @Column(name = "max_raw_score", nullable = false)
    private double maxRawScore;

    private Integer position;
}
