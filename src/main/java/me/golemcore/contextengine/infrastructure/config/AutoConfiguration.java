package me.golemcore.contextengine.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.contextengine.domain.model.ContextSettings;
import me.golemcore.contextengine.domain.service.ContextSettingsService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared beans and startup logging.
 *
 * <p>
 * Provides the {@link Clock} used for every timestamp and the Jackson
 * {@link ObjectMapper} used by the workspace store, then logs the effective
 * configuration once the context is ready.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final ContextEngineProperties properties;
    private final ContextSettingsService contextSettingsService;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        ContextSettings settings = contextSettingsService.current();
        log.info("Context engine starting...");
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());
        log.info("Retrieval: defaultLimit={}, roleLimits={}", settings.getDefaultRetrievalLimit(),
                settings.getRoleLimits());
        log.info("Tokens: safetyMargin={}, defaultWindow={}", settings.getSafetyMargin(),
                settings.getDefaultContextWindow());
        log.info("Redaction: mode={}", settings.getRedactionMode());
        log.info("Patterns: ttlDays={}, injectionThreshold={}", settings.getPatternTtlDays(),
                settings.getInjectionThreshold());
    }
}
