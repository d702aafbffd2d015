package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.exception.AgentInternalException;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ModelResponse;

import java.util.List;

/**
 * Default implementation that appends immutable messages to the run state.
 */
public class DefaultHistoryWriter implements HistoryWriter {

    static final String RETRY_PROMPT_SUFFIX = "\n\nFix the errors and try again.";

    @Override
    public void appendHistory(RunState<?> state, List<Message> history) {
        if (history == null) {
            return;
        }
        for (Message message : history) {
            state.append(message);
        }
    }

    @Override
    public void appendUserPrompt(RunState<?> state, String prompt) {
        state.append(Message.user(prompt != null ? prompt : ""));
    }

    @Override
    public void appendAssistant(RunState<?> state, ModelResponse response) {
        state.append(Message.assistant(response.getContent(), response.getToolCalls()));
    }

    @Override
    public void appendToolResults(RunState<?> state, List<Message.ToolResultEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }
        List<Message> messages = state.getMessages();
        Message last = messages.isEmpty() ? null : messages.get(messages.size() - 1);
        if (last == null
                || (last.getRole() != Message.Role.ASSISTANT && last.getRole() != Message.Role.TOOL_RESULTS)) {
            throw new AgentInternalException("Tool results must follow the assistant message that requested them");
        }
        state.append(Message.toolResults(entries));
    }

    @Override
    public void appendRetryPrompt(RunState<?> state, String feedback) {
        state.append(Message.user("Validation feedback:\n" + feedback + RETRY_PROMPT_SUFFIX));
    }
}
