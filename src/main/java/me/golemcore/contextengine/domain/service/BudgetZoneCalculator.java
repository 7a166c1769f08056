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

import me.golemcore.contextengine.domain.model.BudgetZone;
import me.golemcore.contextengine.domain.model.ZoneBoundaries;
import org.springframework.stereotype.Component;

/**
 * Maps a token usage fraction to a {@link BudgetZone}. Stateless.
 */
@Component
public class BudgetZoneCalculator {

    public BudgetZone resolve(double usageFraction) {
        return resolve(usageFraction, ZoneBoundaries.DEFAULTS);
    }

    /**
     * NaN and negative fractions resolve to NORMAL, fractions above 1 to
     * EMERGENCY. Invalid boundaries are replaced by the defaults.
     */
    public BudgetZone resolve(double usageFraction, ZoneBoundaries boundaries) {
        ZoneBoundaries bounds = boundaries != null && boundaries.isValid() ? boundaries : ZoneBoundaries.DEFAULTS;
        if (Double.isNaN(usageFraction) || usageFraction < bounds.softWarning()) {
            return BudgetZone.NORMAL;
        }
        if (usageFraction < bounds.conservative()) {
            return BudgetZone.SOFT_WARNING;
        }
        if (usageFraction < bounds.wrapup()) {
            return BudgetZone.CONSERVATIVE;
        }
        if (usageFraction < bounds.emergency()) {
            return BudgetZone.WRAPUP;
        }
        return BudgetZone.EMERGENCY;
    }
}
