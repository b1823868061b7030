package me.golemcore.agent.domain.system.router;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.ToolDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits registered tools into the ones the model may call and the ones that
 * are announced as misconfigured.
 */
public record ToolAvailability(Map<String, ToolComponent> ready, Map<String, String> unavailable) {

    public static ToolAvailability evaluate(List<ToolComponent> tools) {
        Map<String, ToolComponent> ready = new LinkedHashMap<>();
        Map<String, String> unavailable = new LinkedHashMap<>();
        for (ToolComponent tool : tools) {
            if (!tool.isEnabled()) {
                continue;
            }
            String reason = tool.getUnavailableReason();
            if (reason != null) {
                unavailable.put(tool.getToolName(), reason);
            } else {
                ready.put(tool.getToolName(), tool);
            }
        }
        return new ToolAvailability(ready, unavailable);
    }

    public List<ToolDefinition> definitions() {
        List<ToolDefinition> definitions = new ArrayList<>();
        ready.values().forEach(tool -> definitions.add(tool.getDefinition()));
        return definitions;
    }

    /**
     * System note listing callable tools and, when any, the misconfigured
     * ones with their reasons.
     */
    public String note(List<String> callableNames) {
        StringBuilder note = new StringBuilder("Available tools: ").append(String.join(", ", callableNames));
        if (!unavailable.isEmpty()) {
            List<String> parts = new ArrayList<>();
            unavailable.forEach((name, reason) -> parts.add(name + ": " + reason));
            note.append("\nUnavailable tools (configuration errors): ").append(String.join("; ", parts));
        }
        return note.toString();
    }
}
