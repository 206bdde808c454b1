package com.gateprep.llm.provider;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Generation providers in failover priority order. Gemini is the primary; the
 * rest are single-shot backups.
 */
@Getter
@RequiredArgsConstructor
public enum LlmProvider {

    GEMINI(
        "Gemini",
        1,
        "https://generativelanguage.googleapis.com/v1beta",
        "gemini-2.0-flash"
    ),

    GROQ(
        "Groq",
        2,
        "https://api.groq.com/openai/v1",
        "llama-3.3-70b-versatile"
    ),

    OPENROUTER(
        "OpenRouter",
        3,
        "https://openrouter.ai/api/v1",
        "google/gemini-2.0-flash-exp:free"
    ),

    HUGGINGFACE(
        "HuggingFace",
        4,
        "https://api-inference.huggingface.co/models",
        "mistralai/Mistral-7B-Instruct-v0.3"
    );

    private final String displayName;
    private final int priority;
    private final String baseUrl;
    private final String defaultModel;
}
