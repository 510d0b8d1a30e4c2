/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Kinetica.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.kinetica.common;

/**
 * Thrown at construction time when a configuration value cannot describe a working simulation: a non-positive pool
 * size, a negative cooldown, a size-tier table without a terminal tier.
 *
 * @author hal.hildebrand
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    /**
     * Fail with {@code message} unless {@code condition} holds.
     */
    public static void require(boolean condition, String message) {
        if (!condition) {
            throw new InvalidConfigurationException(message);
        }
    }

    /**
     * Require a finite value strictly greater than zero.
     */
    public static float requirePositive(float value, String name) {
        require(Float.isFinite(value) && value > 0.0f, name + " must be positive, was " + value);
        return value;
    }

    /**
     * Require a finite value greater than or equal to zero.
     */
    public static float requireNonNegative(float value, String name) {
        require(Float.isFinite(value) && value >= 0.0f, name + " must be non-negative, was " + value);
        return value;
    }
}
