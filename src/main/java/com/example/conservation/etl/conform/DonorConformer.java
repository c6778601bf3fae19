package com.example.conservation.etl.conform;

import com.example.conservation.etl.model.DonorDimension;
import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.StagedRecord;
import org.springframework.stereotype.Component;

@Component
public class DonorConformer implements EntityConformer<DonorDimension> {
    private final TypeCoercer coercer;

    public DonorConformer(TypeCoercer coercer) {
        this.coercer = coercer;
    }

    @Override
    public EntityType getEntityType() {
        return EntityType.DONOR;
    }

    @Override
    public DonorDimension conform(StagedRecord staged, DimensionLookups lookups) {
        DonorDimension donor = new DonorDimension();
        donor.setDonorId(coercer.toText(staged, "donor_id"));
        donor.setFirstName(coercer.toText(staged, "first_name"));
        donor.setLastName(coercer.toText(staged, "last_name"));
        donor.setEmail(coercer.toText(staged, "email"));
        donor.setPhone(coercer.toText(staged, "phone"));
        donor.setAddress(coercer.toText(staged, "address"));
        donor.setCity(coercer.toText(staged, "city"));
        donor.setState(coercer.toText(staged, "state"));
        donor.setZipCode(coercer.toText(staged, "zip_code"));
        donor.setDonorType(coercer.toText(staged, "donor_type"));
        donor.setJoinDate(coercer.toDate(staged, "join_date"));
        donor.setMembershipLevel(coercer.toText(staged, "membership_level"));
        return donor;
    }
}
