package ca.nestsync.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Partial inventory update; null fields are left unchanged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateInventoryItemInput {

    private String brand;
    private String productName;
    private String size;
    private Integer quantityRemaining;
    private BigDecimal costCad;
    private String expiryDate;
    private String storageLocation;
    private Boolean isOpened;
    private Integer qualityRating;
    private String notes;
}
