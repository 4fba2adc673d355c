package ca.nestsync.dto.response;

import java.time.LocalDate;

public record TrendPoint(LocalDate date, int count, String label, Double changePercentage) {
}
