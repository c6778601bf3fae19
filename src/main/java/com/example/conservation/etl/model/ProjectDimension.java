package com.example.conservation.etl.model;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.LocalDate;

@Data
@EqualsAndHashCode(callSuper = true)
public class ProjectDimension extends DimensionRecord {
    private String projectId;
    private String projectName;
    private String projectType;
    private String state;
    private String county;
    private String status;
    private String partnerOrganizations; // JSON array text
    private String description;
    private LocalDate startDate;
    private LocalDate endDate;

    @Override
    public EntityType getEntityType() {
        return EntityType.PROJECT;
    }

    @Override
    public String getNaturalKey() {
        return projectId;
    }
}
