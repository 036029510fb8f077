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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A prompt message: a role plus an ordered list of parts. Messages are built
 * fresh for every step from the system prompt, the caller's conversation and
 * the response messages of earlier steps.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    private MessageRole role;

    @Builder.Default
    private List<MessagePart> content = new ArrayList<>();

    private Map<String, Object> providerOptions;

    public static Message system(String text) {
        return Message.builder()
                .role(MessageRole.SYSTEM)
                .content(new ArrayList<>(List.of(new MessagePart.TextPart(text))))
                .build();
    }

    public static Message user(String text) {
        return user(text, List.of());
    }

    /**
     * User message with the prompt text followed by the attached files.
     */
    public static Message user(String text, List<MessagePart.FilePart> files) {
        List<MessagePart> parts = new ArrayList<>();
        parts.add(new MessagePart.TextPart(text));
        if (files != null) {
            parts.addAll(files);
        }
        return Message.builder().role(MessageRole.USER).content(parts).build();
    }

    public static Message assistant(List<MessagePart> parts) {
        return Message.builder().role(MessageRole.ASSISTANT).content(new ArrayList<>(parts)).build();
    }

    public static Message tool(List<MessagePart> parts) {
        return Message.builder().role(MessageRole.TOOL).content(new ArrayList<>(parts)).build();
    }

    /**
     * Concatenated text of all text parts.
     */
    @JsonIgnore
    public String getText() {
        StringBuilder sb = new StringBuilder();
        for (MessagePart part : content) {
            part.as(MessagePart.TextPart.class).ifPresent(p -> sb.append(p.text()));
        }
        return sb.toString();
    }

    @JsonIgnore
    public boolean isSystemMessage() {
        return role == MessageRole.SYSTEM;
    }

    @JsonIgnore
    public boolean isUserMessage() {
        return role == MessageRole.USER;
    }

    @JsonIgnore
    public boolean isAssistantMessage() {
        return role == MessageRole.ASSISTANT;
    }

    @JsonIgnore
    public boolean isToolMessage() {
        return role == MessageRole.TOOL;
    }
}
