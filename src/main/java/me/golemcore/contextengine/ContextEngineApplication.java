package me.golemcore.contextengine;

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
 * Main application class for the context engine.
 *
 * <p>
 * The context engine selects, ranks and budgets supporting material for the
 * worker roles of a multi-agent orchestrator, and learns error patterns and
 * strategies from their outcomes.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → ContextController, LearningController
 * Domain Layer       → ContextAssembler, ranker, zones, error patterns, consumption
 * Infrastructure     → Workspace store over local storage
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code context.*}
 * prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ContextEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContextEngineApplication.class, args);
    }

}
