package ca.nestsync.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload shared by the analytics queries.
 *
 * {@code data} is null both on failure and when the period has no usage.
 *
 * @param <T> analytics result type
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsResponse<T> {

    private boolean success;
    private String message;
    private String error;
    private int dataPointsAnalyzed;
    private T data;

    public static <T> AnalyticsResponse<T> ok(T data, int dataPointsAnalyzed, String message) {
        return new AnalyticsResponse<>(true, message, null, dataPointsAnalyzed, data);
    }

    public static <T> AnalyticsResponse<T> empty(String message) {
        return new AnalyticsResponse<>(true, message, null, 0, null);
    }

    public static <T> AnalyticsResponse<T> failure(String error) {
        return new AnalyticsResponse<>(false, null, error, 0, null);
    }
}
