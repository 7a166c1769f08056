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

/**
 * Lower bounds of the four non-normal zones as usage fractions. NORMAL starts
 * at 0 and EMERGENCY ends at 1.
 */
public record ZoneBoundaries(double softWarning, double conservative, double wrapup, double emergency) {

    public static final ZoneBoundaries DEFAULTS = new ZoneBoundaries(0.60, 0.75, 0.85, 0.95);

    /**
     * Bands are contiguous only when the bounds are strictly ascending inside
     * (0, 1].
     */
    public boolean isValid() {
        return softWarning > 0.0
                && softWarning < conservative
                && conservative < wrapup
                && wrapup < emergency
                && emergency <= 1.0;
    }
}
