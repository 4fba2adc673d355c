package ca.nestsync.dto.request;

import ca.nestsync.entity.Family.FamilyType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateFamilyInput {

    @NotBlank(message = "Family name is required")
    @Size(max = 100)
    private String name;

    private String description;

    private FamilyType familyType = FamilyType.PERSONAL;
}
