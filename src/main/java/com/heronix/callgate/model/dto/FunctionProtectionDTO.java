package com.heronix.callgate.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Protection flag of one operation of an integration.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FunctionProtectionDTO {

    /**
     * Self-identity of the integration (0x-prefixed, 40 hex chars).
     */
    private String identity;

    /**
     * Operation selector (0x-prefixed, 8 hex chars).
     */
    private String selector;

    /**
     * Whether calls to the operation must be approved by a security module.
     */
    private boolean enabled;
}
