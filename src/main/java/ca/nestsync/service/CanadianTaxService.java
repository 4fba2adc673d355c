package ca.nestsync.service;

import ca.nestsync.entity.CanadianTaxRate;
import ca.nestsync.entity.CanadianTaxRate.Province;
import ca.nestsync.entity.CanadianTaxRate.TaxType;
import ca.nestsync.entity.TaxBreakdown;
import ca.nestsync.repository.CanadianTaxRateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Canadian sales tax on subscription charges.
 *
 * Each component is rounded half-up to the cent on its own. QST is levied on
 * the subtotal plus GST.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CanadianTaxService {

    private final CanadianTaxRateRepository taxRateRepository;

    @Transactional(readOnly = true)
    public TaxBreakdown calculate(BigDecimal amount, Province province) {
        return calculate(amount, province, LocalDate.now(ZoneOffset.UTC));
    }

    /**
     * Tax on an amount at the rate in force on the given date. Without a rate
     * the amount is returned untaxed.
     *
     * @throws IllegalArgumentException if the amount is negative or the province missing
     */
    @Transactional(readOnly = true)
    public TaxBreakdown calculate(BigDecimal amount, Province province, LocalDate date) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Amount cannot be negative");
        }
        if (province == null) {
            throw new IllegalArgumentException("Province is required");
        }
        BigDecimal subtotal = cents(amount);

        List<CanadianTaxRate> rates = taxRateRepository.findEffective(province, date);
        if (rates.isEmpty()) {
            log.warn("No tax rate in force for {} on {}; charging no tax", province, date);
            return new TaxBreakdown(province, TaxType.GST, subtotal, zero(), zero(), zero(), zero(),
                    zero(), subtotal, BigDecimal.ZERO);
        }
        CanadianTaxRate rate = rates.get(0);

        BigDecimal gst = cents(subtotal.multiply(rate.getGstRate()));
        BigDecimal pst = cents(subtotal.multiply(rate.getPstRate()));
        BigDecimal hst = cents(subtotal.multiply(rate.getHstRate()));
        BigDecimal qst = cents(subtotal.add(gst).multiply(rate.getQstRate()));
        BigDecimal totalTax = gst.add(pst).add(hst).add(qst);

        log.debug("Tax for {} {} in {}: gst={}, pst={}, hst={}, qst={}",
                subtotal, rate.getTaxType(), province, gst, pst, hst, qst);
        return new TaxBreakdown(province, rate.getTaxType(), subtotal, gst, pst, hst, qst,
                totalTax, subtotal.add(totalTax), rate.getCombinedRate());
    }

    @Transactional(readOnly = true)
    public List<CanadianTaxRate> getTaxRates() {
        return taxRateRepository.findByIsActiveTrueOrderByProvinceAsc();
    }

    private static BigDecimal cents(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    private static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(2);
    }
}
