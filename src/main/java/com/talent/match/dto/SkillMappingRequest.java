package com.talent.match.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SkillMappingRequest {
    @NotBlank
    @Size(max = 100)
    private String sportName;

    @Size(max = 100)
    private String position;

    @NotBlank
    @Size(max = 200)
    private String professionalSkill;

    @NotNull
    @DecimalMin("0.00")
    @DecimalMax("1.00")
    private BigDecimal transferStrength;

    @Size(max = 100)
    private String skillCategory;

    private String description;
}
