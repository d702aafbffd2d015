package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ModelResponse;

import java.util.List;

/**
 * Single point of mutation for the run transcript.
 *
 * <p>
 * RunLoop and its collaborators should not write messages directly.
 */
public interface HistoryWriter {

    void appendHistory(RunState<?> state, List<Message> history);

    void appendUserPrompt(RunState<?> state, String prompt);

    void appendAssistant(RunState<?> state, ModelResponse response);

    void appendToolResults(RunState<?> state, List<Message.ToolResultEntry> entries);

    void appendRetryPrompt(RunState<?> state, String feedback);
}
