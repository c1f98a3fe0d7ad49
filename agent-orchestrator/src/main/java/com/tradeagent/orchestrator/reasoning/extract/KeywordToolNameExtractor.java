package com.tradeagent.orchestrator.reasoning.extract;

import com.tradeagent.orchestrator.llm.ToolCall;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last resort: a short reply that names a registered tool ("I will check_market_conditions")
 * is treated as a call to it with no arguments. Long replies and replies that already read
 * as a conclusion are left alone.
 */
public class KeywordToolNameExtractor implements ToolCallExtractor {

    static final int MAX_REPLY_LENGTH = 200;

    private static final Pattern TOOL_LIKE =
        Pattern.compile("\\b((?:validate|check|get|detect|calculate|fetch|analyze)_[a-z0-9_]+)\\b");
    private static final Pattern CONCLUDING =
        Pattern.compile("final answer|analysis complete|conclusion:|recommendation:", Pattern.CASE_INSENSITIVE);

    @Override
    public Optional<ToolCall> extract(String content, Set<String> toolNames) {
        if (content == null || content.isBlank() || content.length() > MAX_REPLY_LENGTH) return Optional.empty();
        if (CONCLUDING.matcher(content).find()) return Optional.empty();

        Matcher m = TOOL_LIKE.matcher(content);
        while (m.find()) {
            String candidate = m.group(1);
            if (toolNames.contains(candidate)) {
                return Optional.of(ToolCall.of(candidate, Map.of()));
            }
        }
        return Optional.empty();
    }

    @Override
    public String name() {
        return "keyword";
    }
}
