package ca.nestsync.entity;

import java.math.BigDecimal;

/**
 * Result of applying a province's sales tax to a subtotal. All amounts are CAD,
 * rounded to cents.
 */
public record TaxBreakdown(
        CanadianTaxRate.Province province,
        CanadianTaxRate.TaxType taxType,
        BigDecimal subtotal,
        BigDecimal gstAmount,
        BigDecimal pstAmount,
        BigDecimal hstAmount,
        BigDecimal qstAmount,
        BigDecimal totalTax,
        BigDecimal totalAmount,
        BigDecimal combinedRate
) {
}
