package com.podium.api.web.dto;

import com.podium.domain.account.Address;
import com.podium.domain.config.ProtocolConfig;
import com.podium.domain.curve.CurveWeights;
import com.podium.domain.fee.FeeSchedule;

public record ProtocolConfigResponse(
        Address admin,
        Address treasury,
        FeeSchedule fees,
        CurveWeights weights,
        long outpostPurchasePrice
) {
    public static ProtocolConfigResponse of(Address admin, ProtocolConfig c) {
        return new ProtocolConfigResponse(admin, c.treasury(), c.fees(), c.weights(), c.outpostPurchasePrice());
    }
}
