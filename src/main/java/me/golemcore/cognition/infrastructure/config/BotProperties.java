package me.golemcore.cognition.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties, bound from application.properties and
 * environment variables.
 *
 * <p>
 * All configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - model provider settings</li>
 * <li>{@link CognitionProperties} - background cycle cadence and context</li>
 * <li>{@link InvocationProperties}, {@link RateLimitProperties},
 * {@link CacheProperties} - model call policy</li>
 * <li>{@link TaskProperties}, {@link ContactProperties},
 * {@link TrustProperties} - decision follow-up tuning</li>
 * <li>{@link MemoryProperties} - consolidation retention and ceilings</li>
 * <li>{@link StorageProperties}, {@link HttpProperties},
 * {@link NotificationProperties} - infrastructure</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private LlmProperties llm = new LlmProperties();
    private CognitionProperties cognition = new CognitionProperties();
    private InvocationProperties invocation = new InvocationProperties();
    private RateLimitProperties rateLimit = new RateLimitProperties();
    private CacheProperties cache = new CacheProperties();
    private TaskProperties tasks = new TaskProperties();
    private ContactProperties contact = new ContactProperties();
    private TrustProperties trust = new TrustProperties();
    private MemoryProperties memory = new MemoryProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private NotificationProperties notification = new NotificationProperties();

    @Data
    public static class LlmProperties {
        /** {@code langchain4j} or {@code none}. */
        private String provider = "none";
        /** {@code openai} (any compatible endpoint) or {@code anthropic}. */
        private String apiType = "openai";
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private double temperature = 0.7;
        private int maxTokens = 1024;
    }

    @Data
    public static class CognitionProperties {
        private boolean enabled = true;
        private boolean autoStart = true;
        private Duration initialDelay = Duration.ofSeconds(5);
        private Duration interval = Duration.ofMinutes(15);
        private double memoryHighWaterMark = 0.85;
        private int recentConcepts = 10;
        private int pendingQuestions = 5;
        private int recentReflections = 3;
    }

    @Data
    public static class InvocationProperties {
        private Duration timeout = Duration.ofSeconds(30);
        private int maxRetries = 2;
        private Duration retryBackoff = Duration.ofSeconds(5);
    }

    @Data
    public static class RateLimitProperties {
        private Duration minInterval = Duration.ofSeconds(2);
        private int maxCallsPerMinute = 20;
        private Duration cooldown = Duration.ofSeconds(120);
    }

    @Data
    public static class CacheProperties {
        private int maxEntries = 1000;
        private Duration ephemeralTtl = Duration.ofHours(1);
        private Duration creativeTtl = Duration.ofHours(24);
    }

    @Data
    public static class TaskProperties {
        private int maxPending = 50;
    }

    @Data
    public static class ContactProperties {
        private int minQuestionPriority = 8;
        private int minMotivationIntensity = 7;
        private Duration sendTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class TrustProperties {
        private double impactWeight = 0.5;
        private int patternMinEvents = 3;
        private Duration healingThreshold = Duration.ofHours(1);
    }

    @Data
    public static class MemoryProperties {
        private Duration consolidationInterval = Duration.ofMinutes(30);
        private Duration logRetention = Duration.ofDays(7);
        private Duration episodeRetention = Duration.ofDays(30);
        private int minRelationStrength = 3;
        private int maxConcepts = 500;
        private int maxRelations = 1000;
        private int maxLogs = 1000;
        private int maxEpisodes = 200;
        private int maxReflections = 200;
        private int maxQuestions = 200;
        private int maxFinishedTasks = 200;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/cognition";
    }

    @Data
    public static class HttpProperties {
        private Duration connectTimeout = Duration.ofSeconds(3);
        private Duration readTimeout = Duration.ofSeconds(5);
        private Duration writeTimeout = Duration.ofSeconds(5);
        private int maxIdleConnections = 1;
        private Duration keepAlive = Duration.ofMinutes(1);
    }

    @Data
    public static class NotificationProperties {
        /** {@code log} or {@code webhook}. */
        private String channel = "log";
        private String webhookUrl;
    }
}
