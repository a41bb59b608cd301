package com.optioncalc.domain.enums;

/**
 * Direction of the option position.
 * LONG = buyer (pays the premium), SHORT = seller (receives the premium).
 *
 * <p>The sign only applies to P&L and the position view. Theoretical prices and
 * Greeks always describe the instrument itself.
 */
public enum PositionType {
    LONG,
    SHORT;

    public int sign() {
        return this == LONG ? 1 : -1;
    }
}
