package ca.nestsync.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Home screen summary for one child.
 *
 * Example:
 * <pre>
 * {
 *   "diapersLeft": 42,
 *   "daysRemaining": 5,
 *   "lastChange": "2 hours ago",
 *   "todayChanges": 4,
 *   "currentSize": "SIZE_2",
 *   "dailyUsage": 8
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardStats {

    private int diapersLeft;
    private int daysRemaining;
    private String lastChange;
    private int todayChanges;
    private String currentSize;
    private int dailyUsage;
}
