package ca.nestsync.dto.response;

import ca.nestsync.entity.InventoryItem;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InventoryItemResponse {

    private boolean success;
    private String message;
    private String error;
    private InventoryItem item;

    public static InventoryItemResponse ok(InventoryItem item, String message) {
        return new InventoryItemResponse(true, message, null, item);
    }

    public static InventoryItemResponse failure(String error) {
        return new InventoryItemResponse(false, null, error, null);
    }
}
