package ca.nestsync.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateInventoryItemInput {

    @NotNull(message = "Child is required")
    private UUID childId;

    @NotBlank(message = "Product type is required")
    private String productType;

    @NotBlank(message = "Brand is required")
    private String brand;

    private String productName;

    @NotBlank(message = "Size is required")
    private String size;

    @NotNull(message = "Quantity is required")
    private Integer quantityTotal;

    private BigDecimal costCad;
    private String purchaseDate;
    private String expiryDate;
    private String storageLocation;
    private String notes;
}
