package com.github.tubetune.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Button press carrying an encoded {@link CallbackData} payload.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InboundCallback {

    @NotBlank
    private String ownerId;

    @NotBlank
    private String data;
}
