package com.translogistics.router.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A delivery as the dispatch side knows it. It has no coordinates yet.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryRecord {

    @NotBlank
    private String shipmentId;

    private String destAddressLine1;

    private Double declaredWeightKg;
}
