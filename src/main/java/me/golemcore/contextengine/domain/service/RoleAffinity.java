package me.golemcore.contextengine.domain.service;

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

import me.golemcore.contextengine.domain.model.AgentRole;
import me.golemcore.contextengine.domain.model.ContextPackage;
import me.golemcore.contextengine.domain.model.PackageType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Static package-type to role affinity table. Every (type, role) pair has an
 * entry in [0, 1].
 */
public final class RoleAffinity {

    private static final double EXPLICIT_CONSUMER = 1.0;
    private static final double UNKNOWN_TYPE = 0.3;

    private static final Map<PackageType, Map<AgentRole, Double>> TABLE = new EnumMap<>(PackageType.class);

    static {
        row(PackageType.RESEARCH, 0.6, 0.8, 0.5, 0.9, 0.9, 0.4, 0.6);
        row(PackageType.FAILURES, 0.3, 0.2, 0.9, 1.0, 1.0, 0.8, 0.7);
        row(PackageType.DECISIONS, 0.8, 0.6, 0.5, 0.7, 0.8, 0.5, 0.9);
        row(PackageType.HANDOFF, 0.5, 0.4, 0.6, 0.9, 0.9, 0.9, 0.8);
        row(PackageType.INVESTIGATION, 0.3, 0.3, 1.0, 0.8, 0.9, 0.6, 0.7);
        row(PackageType.REQUIREMENTS, 0.9, 1.0, 0.4, 0.7, 0.7, 0.8, 0.6);
    }

    private RoleAffinity() {
    }

    // Column order follows AgentRole declaration order.
    private static void row(PackageType type, double projectManager, double requirementsEngineer,
            double investigator, double developer, double seniorEngineer, double qaExpert, double techLead) {
        Map<AgentRole, Double> row = new EnumMap<>(AgentRole.class);
        row.put(AgentRole.PROJECT_MANAGER, projectManager);
        row.put(AgentRole.REQUIREMENTS_ENGINEER, requirementsEngineer);
        row.put(AgentRole.INVESTIGATOR, investigator);
        row.put(AgentRole.DEVELOPER, developer);
        row.put(AgentRole.SENIOR_SOFTWARE_ENGINEER, seniorEngineer);
        row.put(AgentRole.QA_EXPERT, qaExpert);
        row.put(AgentRole.TECH_LEAD, techLead);
        TABLE.put(type, row);
    }

    public static double of(PackageType type, AgentRole role) {
        if (type == null || role == null) {
            return UNKNOWN_TYPE;
        }
        return TABLE.get(type).get(role);
    }

    /**
     * Affinity of a package for a role. Packages that name the role as an
     * explicit consumer get full affinity.
     */
    public static double of(ContextPackage contextPackage, AgentRole role) {
        if (role != null && contextPackage.getConsumerRoles() != null
                && contextPackage.getConsumerRoles().contains(role)) {
            return EXPLICIT_CONSUMER;
        }
        return of(contextPackage.getPackageType(), role);
    }
}
