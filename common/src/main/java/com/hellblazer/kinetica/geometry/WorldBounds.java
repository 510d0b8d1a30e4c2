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
package com.hellblazer.kinetica.geometry;

import com.hellblazer.kinetica.common.InvalidConfigurationException;

import javax.vecmath.Point2f;
import javax.vecmath.Vector2f;

/**
 * Toroidal world of {@code width × height}. Every coordinate lives in {@code [0, width) × [0, height)}; exiting one
 * edge re-enters the opposite edge at the same orthogonal coordinate.
 *
 * @author hal.hildebrand
 */
public record WorldBounds(float width, float height) {

    public WorldBounds {
        InvalidConfigurationException.requirePositive(width, "width");
        InvalidConfigurationException.requirePositive(height, "height");
    }

    /**
     * Wrap {@code p} in place, each axis independently.
     *
     * @return p
     */
    public Point2f wrap(Point2f p) {
        p.x = DeterministicMath.wrap(p.x, width);
        p.y = DeterministicMath.wrap(p.y, height);
        return p;
    }

    public boolean contains(Point2f p) {
        return p.x >= 0.0f && p.x < width && p.y >= 0.0f && p.y < height;
    }

    /**
     * Shortest displacement from {@code source} to {@code target} across the torus. Each component lies within
     * {@code [-extent/2, extent/2]}.
     */
    public Vector2f shortestVector(Point2f source, Point2f target) {
        return new Vector2f(shortestDelta(target.x - source.x, width), shortestDelta(target.y - source.y, height));
    }

    /**
     * Length of {@link #shortestVector(Point2f, Point2f)}.
     */
    public float toroidalDistance(Point2f source, Point2f target) {
        return DeterministicMath.length(shortestVector(source, target));
    }

    public Point2f center() {
        return new Point2f(width / 2.0f, height / 2.0f);
    }

    private static float shortestDelta(float delta, float extent) {
        float half = extent / 2.0f;
        if (delta > half) {
            return delta - extent;
        }
        if (delta < -half) {
            return delta + extent;
        }
        return delta;
    }
}
