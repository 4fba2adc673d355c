package ca.nestsync.dto.response;

import java.math.BigDecimal;
import java.util.List;

/**
 * Spend over a period, priced at each pack's cost per unit. Amounts are CAD.
 */
public record CostAnalysis(
        BigDecimal totalCost,
        BigDecimal costPerChange,
        BigDecimal costPerDay,
        List<ProductCost> breakdownByProduct,
        String budgetRecommendation
) {

    public record ProductCost(String productType, int quantityUsed, BigDecimal totalCost, double percentageOfTotal) {
    }
}
