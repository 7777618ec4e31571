package com.dcruver.beliefgraph.nlp;

import com.dcruver.beliefgraph.exception.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Service for LLM calls using Ollama via Spring AI.
 */
@Service
@Slf4j
public class OllamaChatService {

    private final ChatModel chatModel;

    public OllamaChatService(ChatModel chatModel) {
        this.chatModel = chatModel;
        log.info("OllamaChatService initialized with ChatModel: {}", chatModel.getClass().getSimpleName());
    }

    /**
     * Generate a response from a simple prompt
     */
    public String chat(String userMessage) {
        return chat(null, userMessage);
    }

    /**
     * Generate a response with system and user messages.
     *
     * @throws ProviderException if the model call fails or produces no text
     */
    public String chat(String systemMessage, String userMessage) {
        List<Message> messages = new ArrayList<>();

        if (systemMessage != null && !systemMessage.isBlank()) {
            messages.add(new SystemMessage(systemMessage));
        }

        messages.add(new UserMessage(userMessage));

        ChatResponse response;
        try {
            response = chatModel.call(new Prompt(messages));
        } catch (RuntimeException e) {
            throw new ProviderException("Chat model call failed: " + e.getMessage(), e);
        }

        if (response == null || response.getResults().isEmpty() || response.getResult().getOutput() == null) {
            throw new ProviderException("Chat model returned no generations");
        }

        String text = response.getResult().getOutput().getText();
        if (text == null || text.isBlank()) {
            throw new ProviderException("Chat model returned an empty response");
        }
        return text;
    }
}
