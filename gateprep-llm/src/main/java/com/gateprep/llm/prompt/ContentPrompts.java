package com.gateprep.llm.prompt;

/**
 * Prompt templates. Each one embeds the exact JSON shape the response is
 * validated against, so field names here must stay in sync with the content
 * parser.
 */
public final class ContentPrompts {

    public static final String QUESTION_TEMPLATE = """
            Generate a multiple-choice question (MCQ) for the Civil Engineering GATE exam.
            %s
            Difficulty: %s - %s
            The question must require conceptual understanding or a standard calculation,
            and exactly one option must be correct.

            The output must be a JSON object with this exact structure:
            {
              "question": "The question text here (max 300 chars)",
              "options": ["Option 1", "Option 2", "Option 3", "Option 4"],
              "correct_option_id": 0,
              "explanation": "A clear explanation of the solution (max 200 chars).",
              "topic": "%s",
              "difficulty": "%s",
              "source": "Standard textbook, IS code or previous GATE paper this is based on",
              "visual_hint": "A short description of a diagram that would help, or an empty string"
            }
            Note: "options" must contain exactly 4 strings and "correct_option_id" must be an
            integer: 0 for the 1st option, 1 for the 2nd, 2 for the 3rd, 3 for the 4th.
            """;

    public static final String FACT_TEMPLATE = """
            Generate a high-value "Key Note" or "One-Liner" for Civil Engineering GATE preparation.
            %s
            It should be a key concept, an important IS Code provision (IS 456, IS 800 etc.),
            or a vital property of a material.

            The output must be a JSON object with this exact structure:
            {
              "fact": "The text of the fact.",
              "topic": "%s",
              "source": "IS code clause, textbook or standard it comes from",
              "visual_hint": "A short description of a diagram that would help, or an empty string"
            }
            """;

    public static final String FORMULA_TEMPLATE = """
            Generate a key Civil Engineering formula that is often asked in GATE.
            %s

            The output must be a JSON object with this exact structure:
            {
              "title": "Name of the formula",
              "formula": "The mathematical expression (plain text, e.g. Re = (rho * v * D) / mu)",
              "explanation": "Brief explanation of each term and when the formula applies.",
              "topic": "%s",
              "source": "Textbook or code the formula comes from",
              "visual_hint": "A short description of a diagram that would help, or an empty string"
            }
            """;

    public static final String LANGUAGE_TEMPLATE = """
            Generate a micro-lesson that teaches one useful everyday word in one of these
            languages: %s.
            Pick a word a beginner would use in daily conversation.

            The output must be a JSON object with this exact structure:
            {
              "language": "Name of the language",
              "word": "The word in its native script",
              "phonetic": "Pronunciation in Latin letters",
              "meaning": "English meaning",
              "usage": "A short example sentence with its translation",
              "tip": "A memory trick or cultural note"
            }
            """;

    public static final String SPECIFIC_TOPIC_TEMPLATE = "Topic: %s (%s). Stay strictly within this subject.";

    public static final String ANY_TOPIC_TEMPLATE =
            "Topic: pick any one of these subjects: %s. Use the matching code from this list: %s.";

    public static final String JSON_ONLY_FOOTER =
            "\nRespond with valid JSON only. No markdown, no code blocks, no text outside the JSON object.";

    public static final String EASY_GUIDANCE = "a straightforward question testing a definition or direct recall";
    public static final String MEDIUM_GUIDANCE = "a conceptual question or a single-step numerical problem";
    public static final String HARD_GUIDANCE = "a multi-step numerical problem or one needing deep conceptual reasoning";

    public static final String LANGUAGES = "Chinese, Japanese, Marathi, Telugu";

    private ContentPrompts() {}
}
