package ca.nestsync.service;

import ca.nestsync.config.ReferenceDataInitializer;
import ca.nestsync.entity.CanadianTaxRate;
import ca.nestsync.entity.CanadianTaxRate.Province;

/**
 * Seeded tax rates, looked up by province.
 */
final class CanadianTaxRateFixtures {

    private CanadianTaxRateFixtures() {
    }

    static CanadianTaxRate seeded(Province province) {
        return ReferenceDataInitializer.defaultTaxRates().stream()
                .filter(rate -> rate.getProvince() == province)
                .findFirst()
                .orElseThrow();
    }
}
