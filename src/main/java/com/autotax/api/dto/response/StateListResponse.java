package com.autotax.api.dto.response;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** State codes with researched rules and those whose rules are still placeholders. */
@Value
@Builder
public class StateListResponse {
    List<String> implementedStates;
    List<String> stubStates;
}
