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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable bookkeeping for a single router invocation: repeated round
 * signatures, per-tool failure streaks, the forced-respond reason and the
 * tools used so far. Never shared between turns.
 */
public class RouterTurnState {

    private final Map<String, Integer> signatureCounts = new HashMap<>();
    private final Map<String, Integer> failureStreaks = new LinkedHashMap<>();
    private final Map<String, String> lastErrors = new HashMap<>();
    private final Set<String> usedTools = new LinkedHashSet<>();
    private String forcedReason;

    /**
     * @return how many times this round signature has now been seen
     */
    public int recordSignature(String signature) {
        return signatureCounts.merge(signature, 1, Integer::sum);
    }

    /**
     * Updates the consecutive-failure streak of a tool.
     *
     * @return the streak after this outcome, 0 on success
     */
    public int recordToolOutcome(String toolName, boolean failed, String error) {
        usedTools.add(toolName);
        if (!failed) {
            failureStreaks.remove(toolName);
            lastErrors.remove(toolName);
            return 0;
        }
        if (error != null) {
            lastErrors.put(toolName, error);
        }
        return failureStreaks.merge(toolName, 1, Integer::sum);
    }

    /**
     * Sets the reason to stop calling tools. The first reason wins.
     */
    public void forceRespond(String reason) {
        if (forcedReason == null) {
            forcedReason = reason;
        }
    }

    public String getForcedReason() {
        return forcedReason;
    }

    public boolean isForced() {
        return forcedReason != null;
    }

    public List<String> getUsedTools() {
        return new ArrayList<>(usedTools);
    }

    public int getFailureStreak(String toolName) {
        return failureStreaks.getOrDefault(toolName, 0);
    }

    /**
     * Line listing tools with an open failure streak, or {@code null} when
     * none.
     */
    public String describeFailedTools() {
        if (failureStreaks.isEmpty()) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        failureStreaks.forEach((tool, failures) -> {
            StringBuilder part = new StringBuilder(tool).append(" (failures=").append(failures);
            String lastError = lastErrors.get(tool);
            if (lastError != null) {
                part.append(", last_error=").append(lastError);
            }
            parts.add(part.append(')').toString());
        });
        return "Failed tools: " + String.join(", ", parts);
    }
}
