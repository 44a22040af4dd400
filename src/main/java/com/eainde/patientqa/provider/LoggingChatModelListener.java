package com.eainde.patientqa.provider;

import dev.langchain4j.model.chat.listener.ChatModelErrorContext;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.listener.ChatModelRequestContext;
import dev.langchain4j.model.chat.listener.ChatModelResponseContext;
import dev.langchain4j.model.output.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs latency and token usage of every model call.
 */
public class LoggingChatModelListener implements ChatModelListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingChatModelListener.class);

    private static final String START_TIME = "startTime";

    private final String modelId;

    public LoggingChatModelListener(String modelId) {
        this.modelId = modelId;
    }

    @Override
    public void onRequest(ChatModelRequestContext requestContext) {
        log.debug("[{}] Sending request with {} messages", modelId, requestContext.chatRequest().messages().size());
        requestContext.attributes().put(START_TIME, System.currentTimeMillis());
    }

    @Override
    public void onResponse(ChatModelResponseContext responseContext) {
        Object start = responseContext.attributes().get(START_TIME);
        long duration = start instanceof Long ? System.currentTimeMillis() - (Long) start : -1;

        TokenUsage usage = responseContext.chatResponse().tokenUsage();
        if (usage != null) {
            log.info("[{}] Model responded in {}ms, tokens in={} out={} total={}", modelId, duration,
                    usage.inputTokenCount(), usage.outputTokenCount(), usage.totalTokenCount());
        } else {
            log.info("[{}] Model responded in {}ms", modelId, duration);
        }
    }

    @Override
    public void onError(ChatModelErrorContext errorContext) {
        log.warn("[{}] Model call failed: {}", modelId, errorContext.error().getMessage());
    }
}
