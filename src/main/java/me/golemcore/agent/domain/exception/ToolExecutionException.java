package me.golemcore.agent.domain.exception;

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

/**
 * A tool could not be run at all. Unlike an error response from the tool,
 * this aborts the run.
 */
public class ToolExecutionException extends AgentException {

    private final String toolCallId;
    private final String toolName;

    public ToolExecutionException(String toolCallId, String toolName, Throwable cause) {
        super("tool " + toolName + " (" + toolCallId + ") failed: " + cause.getMessage(), cause);
        this.toolCallId = toolCallId;
        this.toolName = toolName;
    }

    public String getToolCallId() {
        return toolCallId;
    }

    public String getToolName() {
        return toolName;
    }
}
