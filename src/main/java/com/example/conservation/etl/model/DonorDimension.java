package com.example.conservation.etl.model;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.time.LocalDate;

@Data
@EqualsAndHashCode(callSuper = true)
public class DonorDimension extends DimensionRecord {
    private String donorId;
    private String firstName;
    private String lastName;
    private String email;
    private String phone;
    private String address;
    private String city;
    private String state;
    private String zipCode;
    private String donorType;       // Individual, Corporate, Foundation
    private LocalDate joinDate;
    private String membershipLevel; // Bronze, Silver, Gold, Platinum

    @Override
    public EntityType getEntityType() {
        return EntityType.DONOR;
    }

    @Override
    public String getNaturalKey() {
        return donorId;
    }
}
