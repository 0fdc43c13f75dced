package me.golemcore.converse.adapter.inbound.command;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.converse.domain.service.ConversationAgentService;
import me.golemcore.converse.domain.service.ConversationReply;
import me.golemcore.converse.infrastructure.config.AgentProperties;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * Interactive prompt on stdin/stdout. Each line is one user turn of a single
 * conversation; {@code exit}, {@code quit} or end of input stops the loop.
 *
 * <p>
 * Enabled by {@code agent.console.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "agent.console", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class ConsoleChatRunner implements CommandLineRunner {

    static final String PROMPT = "Enter your prompt: ";
    private static final Set<String> EXIT_COMMANDS = Set.of("exit", "quit");

    private final ConversationAgentService conversationService;
    private final AgentProperties properties;

    @Override
    public void run(String... args) throws IOException {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        chatLoop(in, System.out);
    }

    int chatLoop(BufferedReader in, PrintStream out) throws IOException {
        String key = properties.getConsole().getConversationKey();
        int turns = 0;
        while (true) {
            out.print(PROMPT);
            out.flush();
            String line = in.readLine();
            if (line == null || EXIT_COMMANDS.contains(line.trim().toLowerCase())) {
                break;
            }
            if (line.isBlank()) {
                log.warn("[Console] Empty prompt provided.");
                continue;
            }
            log.info("[Console] Processing your request...");
            ConversationReply reply = conversationService.chat(key, line);
            out.println(reply.getReply());
            turns++;
        }
        log.info("[Console] Session closed after {} turn(s)", turns);
        return turns;
    }
}
