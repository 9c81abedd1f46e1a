package com.example.safespace.model;

import java.time.Instant;
import java.util.UUID;

/** Anonymous conversational context. Carries no identity data. */
public record ChatSession(UUID id, Instant createdAt) {
}
