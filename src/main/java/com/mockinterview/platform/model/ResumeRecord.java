package com.mockinterview.platform.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "resumes")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResumeRecord {

    @Id
    @Column(name = "user_id", length = 100)
    private String userId;

    @Column(name = "years_of_experience", nullable = false)
    private Integer yearsOfExperience;

    @Convert(converter = ResumeDataConverter.class)
    @Column(nullable = false, columnDefinition = "TEXT")
    private ResumeData payload;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
