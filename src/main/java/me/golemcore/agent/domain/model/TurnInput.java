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

/**
 * Input that started a turn: external caller input, results of the previous
 * turn's tool calls, or nothing (a follow-up reasoning step).
 */
public record TurnInput(Kind kind, String text) {

    public enum Kind {
        USER, TOOL_RESULTS, NONE
    }

    public static TurnInput user(String text) {
        return new TurnInput(Kind.USER, text);
    }

    public static TurnInput toolResults(String summary) {
        return new TurnInput(Kind.TOOL_RESULTS, summary);
    }

    public static TurnInput none() {
        return new TurnInput(Kind.NONE, null);
    }
}
