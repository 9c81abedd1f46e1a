package com.example.safespace.generation;

public class GenerationNotConfiguredException extends GenerationException {

    public GenerationNotConfiguredException() {
        super("Generation API key not configured. Set OPENAI_API_KEY to enable generation.");
    }
}
