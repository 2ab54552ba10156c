package me.golemcore.cognition;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Cognition.
 *
 * <p>
 * Runs the background cognition loop of a conversational agent: between
 * conversations the agent periodically asks a language model what to do next,
 * works through a small task queue, keeps its knowledge graph and journals
 * bounded, tracks trust per relationship and decides when to reach out to the
 * user on its own.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Scheduler          → CognitionScheduler
 * Domain Layer       → Decision, TaskQueue, ContactGate, Trust, Consolidation
 * Infrastructure     → LLM/Storage/Notification/Runtime Adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code bot.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CognitionApplication {

    public static void main(String[] args) {
        SpringApplication.run(CognitionApplication.class, args);
    }

}
