package com.tradeagent.orchestrator.reasoning;

import com.tradeagent.orchestrator.llm.ChatResponse;
import com.tradeagent.orchestrator.llm.ToolCall;
import com.tradeagent.orchestrator.reasoning.extract.ToolCallExtractionChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classifies a chat reply as a tool call, a final answer or plain text.
 *
 * <p>A native tool call wins (only the first is honoured). Otherwise the text goes through
 * the extraction chain; if nothing is recovered, explicit closing phrases or a JSON answer
 * carrying a {@code decision} make it final.
 */
public class ResponseParser {

    private static final Logger log = LoggerFactory.getLogger(ResponseParser.class);

    static final Pattern FINAL_MARKER = Pattern.compile(
        "final answer|analysis complete|conclusion:|recommendation:", Pattern.CASE_INSENSITIVE);
    static final Pattern DECISION_FIELD = Pattern.compile("\"decision\"\\s*:");

    private final ToolCallExtractionChain extractionChain;

    public ResponseParser(ToolCallExtractionChain extractionChain) {
        this.extractionChain = extractionChain;
    }

    public ParsedResponse parse(ChatResponse response, Set<String> toolNames) {
        String content = response.content();
        Double confidence = ConfidenceExtractor.extract(content);

        if (response.hasToolCalls()) {
            if (response.toolCalls().size() > 1) {
                log.warn("[ResponseParser] Several tools requested, executing only the first. tools={}",
                         response.toolCalls().stream().map(ToolCall::name).toList());
            }
            return ParsedResponse.toolCall(response.toolCalls().get(0), content, confidence);
        }

        Optional<ToolCall> recovered = extractionChain.extract(content, toolNames);
        if (recovered.isPresent()) {
            return ParsedResponse.toolCall(recovered.get(), content, confidence);
        }

        if (FINAL_MARKER.matcher(content).find() || DECISION_FIELD.matcher(content).find()) {
            return ParsedResponse.finalAnswer(content, confidence);
        }
        return ParsedResponse.text(content, confidence, response.finishReason());
    }
}
