package com.lifebutler.assistant.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for /api/assistant/ask.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AskRequest {
    @NotBlank(message = "Question is required")
    private String question;
}
