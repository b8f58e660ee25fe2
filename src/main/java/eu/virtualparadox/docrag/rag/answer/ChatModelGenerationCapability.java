package eu.virtualparadox.docrag.rag.answer;

import lombok.RequiredArgsConstructor;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;

/**
 * Adapts a Spring AI {@link ChatModel}. The prompt is sent as a single user message.
 */
@RequiredArgsConstructor
public final class ChatModelGenerationCapability implements GenerationCapability {

    private final ChatModel chatModel;

    @Override
    public String generate(final String prompt, final GenerationParams params) {
        final ChatOptions options = ChatOptions.builder()
                .temperature(params.temperature())
                .maxTokens(params.maxTokens())
                .build();

        final ChatResponse response = chatModel.call(new Prompt(new UserMessage(prompt), options));
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return null;
        }
        return response.getResult().getOutput().getText();
    }
}
