package com.eainde.patientqa.provider;

import com.eainde.patientqa.memory.Message;
import com.eainde.patientqa.prompt.PromptPayload;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link LanguageModelProvider} over any LangChain4j {@link ChatModel}.
 *
 * <p>Mapping: system text → {@link SystemMessage}; history → alternating
 * {@link UserMessage}/{@link AiMessage}; question → final {@link UserMessage}.
 * Leading assistant turns are dropped because chat APIs expect the
 * conversation to open with the user.</p>
 */
public class ChatModelProvider implements LanguageModelProvider {

    private final String id;
    private final ChatModel chatModel;

    public ChatModelProvider(String id, ChatModel chatModel) {
        this.id = id;
        this.chatModel = chatModel;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String generate(PromptPayload prompt, GenerationOptions options) {
        GenerationOptions opts = options != null ? options : GenerationOptions.defaults();
        ChatRequest request = ChatRequest.builder()
                .messages(toChatMessages(prompt))
                .temperature(opts.temperature())
                .maxOutputTokens(opts.maxOutputTokens())
                .build();

        ChatResponse response;
        try {
            response = chatModel.chat(request);
        } catch (NonRetriableException e) {
            throw ProviderException.fatal("Model " + id + " rejected the request: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw ProviderException.retryable("Model " + id + " call failed: " + e.getMessage(), e);
        }

        String text = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
        if (text == null || text.isBlank()) {
            throw new ProviderException("Model " + id + " returned an empty completion", true);
        }
        return text;
    }

    static List<ChatMessage> toChatMessages(PromptPayload prompt) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(SystemMessage.from(prompt.systemText()));

        boolean seenUser = false;
        for (Message m : prompt.history()) {
            switch (m.role()) {
                case USER -> {
                    messages.add(UserMessage.from(m.text()));
                    seenUser = true;
                }
                case ASSISTANT -> {
                    if (seenUser) messages.add(AiMessage.from(m.text()));
                }
                default -> { }
            }
        }
        messages.add(UserMessage.from(prompt.question()));
        return messages;
    }
}
