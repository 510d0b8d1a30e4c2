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
package com.hellblazer.kinetica.simulation.entity;

import java.util.Objects;

/**
 * Caller-chosen identifier, used for ships. The same string doubles as the projectile owner id.
 *
 * @author hal.hildebrand
 */
public final class StringEntityID implements EntityID, Comparable<StringEntityID> {
    private final String id;

    public StringEntityID(String id) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id cannot be blank");
        }
    }

    public String getValue() {
        return id;
    }

    @Override
    public String toDebugString() {
        return "Ship[" + id + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StringEntityID that)) return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public int compareTo(StringEntityID other) {
        return id.compareTo(other.id);
    }

    @Override
    public String toString() {
        return id;
    }
}
