package me.golemcore.agent.domain.model;

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

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered content of one model response (plus the tool results appended by
 * the loop), with typed accessors per variant.
 */
public record ResponseContent(List<Content> items) {

    public ResponseContent {
        items = items != null ? List.copyOf(items) : List.of();
    }

    public static ResponseContent empty() {
        return new ResponseContent(List.of());
    }

    public static ResponseContent of(List<Content> items) {
        return new ResponseContent(items);
    }

    /**
     * Returns the first text item, or an empty string when there is none.
     */
    public String getText() {
        return items.stream()
                .map(item -> item.as(TextContent.class))
                .flatMap(java.util.Optional::stream)
                .map(TextContent::getText)
                .findFirst()
                .orElse("");
    }

    public List<ReasoningContent> getReasoning() {
        return select(ReasoningContent.class);
    }

    /**
     * Concatenation of all reasoning items.
     */
    public String getReasoningText() {
        return getReasoning().stream().map(ReasoningContent::getText).collect(Collectors.joining());
    }

    public List<FileContent> getFiles() {
        return select(FileContent.class);
    }

    public List<SourceContent> getSources() {
        return select(SourceContent.class);
    }

    public List<ToolCallContent> getToolCalls() {
        return select(ToolCallContent.class);
    }

    public List<ToolResultContent> getToolResults() {
        return select(ToolResultContent.class);
    }

    public boolean hasType(ContentType type) {
        return items.stream().anyMatch(item -> item.getType() == type);
    }

    public int size() {
        return items.size();
    }

    private <T extends Content> List<T> select(Class<T> type) {
        return items.stream().filter(type::isInstance).map(type::cast).toList();
    }
}
