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

/**
 * Sequential long-based ID generator. One instance is shared by every subsystem of a simulation, so projectile
 * handles and fragment ids never collide and replays with the same seed issue the same ids in the same order.
 * <p>
 * Not thread-safe; simulations are confined to one thread.
 *
 * @author hal.hildebrand
 */
public class SequentialLongIDGenerator implements EntityIDGenerator<LongEntityID> {
    private final long startValue;
    private long       counter;

    public SequentialLongIDGenerator() {
        this(1L);
    }

    public SequentialLongIDGenerator(long startValue) {
        this.startValue = startValue;
        this.counter = startValue;
    }

    @Override
    public LongEntityID generateID() {
        return new LongEntityID(counter++);
    }

    /**
     * Get the next value without incrementing
     */
    public long getCurrentValue() {
        return counter;
    }

    @Override
    public void reset() {
        counter = startValue;
    }
}
