package me.golemcore.converse.domain.agent;

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

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one {@link AgentEngine#run(String)}.
 */
@Value
@Builder
public class RunResult {

    public enum Termination {
        /** The model finished the task (terminate tool or plain reply). */
        FINISHED,
        /** The step cap was reached without finishing. */
        MAX_STEPS
    }

    Termination termination;
    int steps;
    int maxSteps;
    @Builder.Default
    List<String> stepSummaries = List.of();
    String finalReply;

    public boolean isFinished() {
        return termination == Termination.FINISHED;
    }

    /**
     * Human-readable transcript of the run: one {@code Step i: ...} line per
     * step, plus a termination line when the step cap was hit.
     */
    public String summary() {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < stepSummaries.size(); i++) {
            lines.add("Step " + (i + 1) + ": " + stepSummaries.get(i));
        }
        if (termination == Termination.MAX_STEPS) {
            lines.add("Terminated: Reached max steps (" + maxSteps + ")");
        }
        return lines.isEmpty() ? "No steps executed" : String.join("\n", lines);
    }
}
