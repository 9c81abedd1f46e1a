package com.example.safespace.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ChatMessageRequest(
        @NotBlank(message = "Message must not be blank")
        @Size(max = 4096, message = "Message must be at most 4096 characters")
        String message
) {
}
