package com.heronix.callgate.model.dto;

import java.util.List;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for querying several protection flags at once.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FunctionQueryRequestDTO {

    /**
     * Selectors to look up, e.g. "0xaaaaaaaa".
     */
    @NotEmpty(message = "Selectors are required")
    private List<String> selectors;
}
