package com.supportdesk.assistant.service.llm;

public interface LlmClient {

    /**
     * @throws LlmException when the text-generation service cannot be reached or answers with an error
     */
    LlmResponse generate(LlmRequest request);
}
