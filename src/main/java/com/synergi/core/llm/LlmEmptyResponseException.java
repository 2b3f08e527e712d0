package com.synergi.core.llm;

/**
 * The language model answered with no content. Planning and synthesis treat this like any
 * other collaborator failure and fall back to their rule-based paths.
 */
public class LlmEmptyResponseException extends RuntimeException {

    private final String expected;

    public LlmEmptyResponseException(String expected) {
        super("LLM returned empty content for " + expected);
        this.expected = expected;
    }

    /** What the call was asking for: a structured type name, or "text". */
    public String expected() {
        return expected;
    }
}
