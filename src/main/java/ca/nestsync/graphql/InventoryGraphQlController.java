package ca.nestsync.graphql;

import ca.nestsync.dto.request.CreateInventoryItemInput;
import ca.nestsync.dto.request.LogDiaperChangeInput;
import ca.nestsync.dto.request.UpdateInventoryItemInput;
import ca.nestsync.dto.response.Connection;
import ca.nestsync.dto.response.DashboardStats;
import ca.nestsync.dto.response.InventoryItemResponse;
import ca.nestsync.dto.response.MutationResponse;
import ca.nestsync.dto.response.UsageLogResponse;
import ca.nestsync.entity.InventoryItem;
import ca.nestsync.entity.UsageLog;
import ca.nestsync.entity.UsageLog.UsageType;
import ca.nestsync.entity.UserProfile;
import ca.nestsync.service.InventoryService;
import ca.nestsync.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.stereotype.Controller;

import java.util.UUID;

/**
 * Dashboard, stock and diaper-change logging.
 */
@Controller
@RequiredArgsConstructor
public class InventoryGraphQlController {

    private final InventoryService inventoryService;
    private final UserService userService;

    @QueryMapping
    public DashboardStats getDashboardStats(@Argument UUID childId) {
        return inventoryService.getDashboardStats(childId, userService.requireCurrentUser());
    }

    @QueryMapping
    public Connection<InventoryItem> getInventoryItems(@Argument UUID childId, @Argument String productType,
                                                       @Argument Integer limit, @Argument Integer offset) {
        return inventoryService.getInventoryItems(childId, userService.requireCurrentUser(), productType,
                limit != null ? limit : 50, offset != null ? offset : 0);
    }

    @QueryMapping
    public Connection<UsageLog> getUsageLogs(@Argument UUID childId, @Argument UsageType usageType,
                                             @Argument Integer daysBack, @Argument Integer limit,
                                             @Argument Integer offset) {
        return inventoryService.getUsageLogs(childId, userService.requireCurrentUser(), usageType,
                daysBack != null ? daysBack : 7, limit != null ? limit : 50, offset != null ? offset : 0);
    }

    @MutationMapping
    public UsageLogResponse logDiaperChange(@Argument @Valid LogDiaperChangeInput input) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(
                () -> UsageLogResponse.ok(inventoryService.logDiaperChange(input, user), "Diaper change logged successfully"),
                UsageLogResponse::failure);
    }

    @MutationMapping
    public InventoryItemResponse createInventoryItem(@Argument @Valid CreateInventoryItemInput input) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(
                () -> InventoryItemResponse.ok(inventoryService.createInventoryItem(input, user),
                        "Inventory item created successfully"),
                InventoryItemResponse::failure);
    }

    @MutationMapping
    public InventoryItemResponse updateInventoryItem(@Argument UUID id, @Argument @Valid UpdateInventoryItemInput input) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(
                () -> InventoryItemResponse.ok(inventoryService.updateInventoryItem(id, input, user),
                        "Inventory item updated successfully"),
                InventoryItemResponse::failure);
    }

    @MutationMapping
    public MutationResponse deleteInventoryItem(@Argument UUID id, @Argument String confirmationText) {
        UserProfile user = userService.requireCurrentUser();
        return MutationPayloads.guard(() -> {
            inventoryService.deleteInventoryItem(id, confirmationText, user);
            return MutationResponse.ok("Inventory item deleted successfully");
        }, MutationResponse::failure);
    }
}
