package ca.nestsync.dto.request;

import ca.nestsync.entity.CanadianTaxRate.Province;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Input for a paid subscription. {@code paymentMethodId} is a Stripe
 * PaymentMethod id collected client-side.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubscribeInput {

    @NotBlank
    private String planId;

    @NotBlank
    private String paymentMethodId;

    @NotNull
    private Province province;
}
