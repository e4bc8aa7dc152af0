package com.lynkvertx.batteryopt.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotNull;

/**
 * Battery parameters as entered by the user.
 * Ranges are checked by the optimizer so the error names the violated constraint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatteryParametersDTO {

    @NotNull
    private Double capacityKwh;

    @NotNull
    private Double maxChargeKw;

    @NotNull
    private Double maxDischargeKw;

    /** Round-trip efficiency in (0, 1], applied on charging only */
    @NotNull
    private Double efficiency;

    @NotNull
    private Double initialEnergyKwh;

    /** Optional reserve (kWh), default 0 */
    private Double minEnergyKwh;

    /** Optional upper energy limit (kWh), default capacity */
    private Double maxEnergyKwh;

    /** Optional bounds on the energy left at the end of the horizon */
    private Double minFinalEnergyKwh;
    private Double maxFinalEnergyKwh;
}
