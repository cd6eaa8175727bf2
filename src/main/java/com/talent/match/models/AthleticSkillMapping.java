package com.talent.match.models;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Administrator-curated equivalence between sport experience and a professional skill.
 * A null {@code position} applies to every position of the sport.
 */
@Entity
@Table(name = "athletic_skill_mappings")
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class AthleticSkillMapping {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "sport_name", nullable = false)
    private String sportName;

    @Column(name = "position")
    private String position;

    @Column(name = "professional_skill", nullable = false)
    private String professionalSkill;

    @Column(name = "transfer_strength", nullable = false, precision = 3, scale = 2)
    private BigDecimal transferStrength;

    @Column(name = "skill_category")
    private String skillCategory;

    @Column(name = "description")
    private String description;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}
