package com.geomonitor.gatewayservice.models;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores plan tiers by their wire value. A stored value that is not a known
 * tier is read back as FREE so that a corrupt row never grants a larger quota.
 */
@Slf4j
@Converter(autoApply = true)
public class PlanTierConverter implements AttributeConverter<PlanTier, String> {

    @Override
    public String convertToDatabaseColumn(PlanTier attribute) {
        return attribute != null ? attribute.getValue() : PlanTier.FREE.getValue();
    }

    @Override
    public PlanTier convertToEntityAttribute(String dbData) {
        return PlanTier.fromValue(dbData).orElseGet(() -> {
            log.warn("Unknown plan tier '{}' in storage, treating as {}", dbData, PlanTier.FREE.getValue());
            return PlanTier.FREE;
        });
    }
}
