package me.golemcore.contextengine.domain.model;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Priority of a context package. Weight is used directly by the ranker.
 */
public enum PackagePriority {

    CRITICAL(4), HIGH(3), MEDIUM(2), LOW(1);

    private final int weight;

    PackagePriority(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }

    /**
     * Raise this priority to at least {@code floor}. Never lowers it.
     */
    public PackagePriority escalateTo(PackagePriority floor) {
        if (floor == null || floor.weight <= weight) {
            return this;
        }
        return floor;
    }

    public boolean isAtLeast(PackagePriority other) {
        return other == null || weight >= other.weight;
    }

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PackagePriority fromJson(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return PackagePriority.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
