package me.golemcore.agent.domain.system.router;

import me.golemcore.agent.domain.model.Message;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structural checks on a round of proposed tool calls. Any violation rejects
 * the whole round; nothing from it is executed.
 */
public final class ToolCallValidator {

    static final String CORRECTION_SUFFIX = "Your last attempt to call a tool failed, try again with the correct format, tools, and arguments.";

    private ToolCallValidator() {
    }

    public record Violation(Message.ToolCall call, String reason) {
    }

    public static List<Violation> validate(List<Message.ToolCall> calls, Collection<String> allowedTools,
            int maxParallelCalls) {
        List<Violation> violations = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        int accepted = 0;
        for (Message.ToolCall call : calls) {
            String name = call.getName();
            if (name == null || name.isBlank()) {
                violations.add(new Violation(call, "Tool call is missing a valid name"));
                continue;
            }
            if (!allowedTools.contains(name)) {
                violations.add(new Violation(call, "Tool \"" + name + "\" is not available"));
                continue;
            }
            String id = call.getId();
            if (id == null || id.isBlank()) {
                violations.add(new Violation(call, "Tool \"" + name + "\" is missing a valid id"));
                continue;
            }
            if (!seenIds.add(id)) {
                violations.add(new Violation(call, "Duplicate tool call \"" + name + "\" in the same round"));
                continue;
            }
            accepted++;
            if (accepted > maxParallelCalls) {
                violations.add(new Violation(call,
                        "Too many parallel tool calls: at most " + maxParallelCalls + " are allowed"));
            }
        }
        return violations;
    }

    public static String buildCorrectionMessage(List<Violation> violations) {
        String details = violations.stream()
                .map(violation -> {
                    String name = violation.call().getName() != null ? violation.call().getName() : "unknown_tool";
                    String id = violation.call().getId() != null ? violation.call().getId() : "missing_id";
                    return violation.reason() + " (tool=\"" + name + "\", id=\"" + id + "\")";
                })
                .collect(Collectors.joining("; "));
        return details + ". " + CORRECTION_SUFFIX;
    }
}
