package ca.nestsync.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Stock outlook per inventory item from the last 30 days of consumption.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryInsights {

    private UUID childId;
    private List<ItemInsight> currentItems;
    private List<TrendPoint> consumptionTrends;
    private List<String> reorderAlerts;
    private List<String> costOptimizationTips;

    /**
     * @param daysRemaining null when nothing was drawn from the item in the window
     * @param costPerDay null when the pack has no cost or no consumption
     * @param efficiencyRating null when nothing was drawn from the item in the window
     */
    public record ItemInsight(UUID itemId, String productType, String brand, String size, int currentStock,
                              double dailyConsumptionRate, Double daysRemaining, String reorderRecommendation,
                              BigDecimal costPerDay, String efficiencyRating) {
    }
}
