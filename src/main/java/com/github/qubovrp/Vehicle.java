package com.github.qubovrp;

import java.math.BigDecimal;

/**
 * A vehicle in the fleet.
 *
 * @param id       position in the fleet, starting with zero
 * @param capacity optional capacity; may be null. None of the current solvers enforce it.
 * @param color    display attribute; may be null
 */
public record Vehicle(int id, BigDecimal capacity, String color) {
    /**
     * Vehicle with no capacity or color.
     *
     * @param id position in the fleet
     */
    public Vehicle(int id) {
        this(id, null, null);
    }
}
