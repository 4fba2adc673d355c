package ca.nestsync.dto.response;

public record HourlyUsage(int hour, int count, double percentage, boolean peakHour) {
}
