package com.github.tubetune.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Text typed by a user: a link or a search phrase.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InboundMessage {

    @NotBlank
    private String ownerId;

    private String text;
}
