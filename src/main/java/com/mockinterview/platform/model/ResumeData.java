package com.mockinterview.platform.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured candidate background extracted from a resume.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResumeData {

    @NotBlank(message = "resume user_id must not be blank")
    private String userId;

    private String name;
    private String email;
    private String experienceLevel;

    @NotNull(message = "resume years_of_experience is required")
    @Min(value = 0, message = "resume years_of_experience must not be negative")
    @Max(value = 60, message = "resume years_of_experience must be at most 60")
    private Integer yearsOfExperience;

    @NotEmpty(message = "resume domain_expertise must list at least one domain")
    private List<@NotBlank(message = "resume domain_expertise entries must not be blank") String> domainExpertise;

    @Valid
    @Builder.Default
    private List<WorkExperience> workExperience = new ArrayList<>();

    @Builder.Default
    private List<Education> education = new ArrayList<>();

    @Builder.Default
    private List<String> skills = new ArrayList<>();

    private String rawText;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WorkExperience {
        private String company;
        private String title;
        private String duration;
        private String description;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Education {
        private String institution;
        private String degree;
        private String field;
        private String year;
    }
}
