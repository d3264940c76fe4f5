package com.outreachagent.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.outreachagent.infrastructure.stage.TargetingRules;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TargetingRulesResponse(String status, String message, TargetingRules rules) {

    public static TargetingRulesResponse ok(TargetingRules rules) {
        return new TargetingRulesResponse("ok", null, rules);
    }

    public static TargetingRulesResponse updated(TargetingRules rules) {
        return new TargetingRulesResponse("ok", "Targeting rules updated", rules);
    }
}
