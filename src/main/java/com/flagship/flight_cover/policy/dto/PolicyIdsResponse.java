package com.flagship.flight_cover.policy.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

@Value
public class PolicyIdsResponse {

    @JsonProperty("policy_ids")
    List<Long> policyIds;
}
