package com.heronix.callgate.model.dto;

import java.util.List;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for an administrator status override.
 *
 * {@code identities} and {@code statuses} are parallel lists and must have the same length.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StatusOverrideRequestDTO {

    @NotEmpty(message = "Identities are required")
    private List<String> identities;

    /**
     * Status names, e.g. "REVOKED" or "REGISTERED".
     */
    @NotEmpty(message = "Statuses are required")
    private List<String> statuses;
}
