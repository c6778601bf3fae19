package com.example.conservation.etl.conform;

import com.example.conservation.etl.model.DonationFact;
import com.example.conservation.etl.model.EntityType;
import com.example.conservation.etl.model.StagedRecord;
import org.springframework.stereotype.Component;

@Component
public class DonationConformer implements EntityConformer<DonationFact> {
    private final TypeCoercer coercer;

    public DonationConformer(TypeCoercer coercer) {
        this.coercer = coercer;
    }

    @Override
    public EntityType getEntityType() {
        return EntityType.DONATION;
    }

    @Override
    public DonationFact conform(StagedRecord staged, DimensionLookups lookups) {
        DonationFact donation = new DonationFact();
        donation.setDonationId(coercer.toText(staged, "donation_id"));
        donation.setDonorId(coercer.toText(staged, "donor_id"));
        donation.setDonorKey(lookups.surrogateKey(EntityType.DONOR, donation.getDonorId()));
        donation.setCampaignId(coercer.toText(staged, "campaign_id"));
        donation.setCampaignKey(lookups.surrogateKey(EntityType.CAMPAIGN, donation.getCampaignId()));
        donation.setBusinessDate(coercer.toDate(staged, "donation_date"));
        donation.setAmount(coercer.toDecimal(staged, "amount"));
        donation.setPaymentMethod(coercer.toText(staged, "payment_method"));
        donation.setRecurring(coercer.toBoolean(staged, "is_recurring"));
        donation.setNotes(coercer.toText(staged, "notes"));
        return donation;
    }
}
