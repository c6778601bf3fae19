package com.example.conservation.etl.conform;

import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.ProjectDimension;
import com.example.conservation.etl.model.StagedRecord;
import org.springframework.stereotype.Component;

@Component
public class ProjectConformer implements EntityConformer<ProjectDimension> {
    private final TypeCoercer coercer;

    public ProjectConformer(TypeCoercer coercer) {
        this.coercer = coercer;
    }

    @Override
    public EntityType getEntityType() {
        return EntityType.PROJECT;
    }

    @Override
    public ProjectDimension conform(StagedRecord staged, DimensionLookups lookups) {
        ProjectDimension project = new ProjectDimension();
        project.setProjectId(coercer.toText(staged, "project_id"));
        project.setProjectName(coercer.toText(staged, "project_name"));
        project.setProjectType(coercer.toText(staged, "project_type"));
        project.setState(coercer.toText(staged, "state"));
        project.setCounty(coercer.toText(staged, "county"));
        project.setStatus(coercer.toText(staged, "status"));
        project.setPartnerOrganizations(coercer.toJsonText(staged, "partner_organizations"));
        project.setDescription(coercer.toText(staged, "description"));
        project.setStartDate(coercer.toDate(staged, "start_date"));
        project.setEndDate(coercer.toDate(staged, "end_date"));
        return project;
    }
}
