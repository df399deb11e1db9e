package com.tradesim.engine.fill;

import com.tradesim.core.model.LiquidityRole;

/**
 * Fillable quantity still available on one bar.
 *
 * Market (taker) fills draw from the full volume cap. Limit (maker) fills are further held to
 * half of the cap, and that half is shared
 * by all limit orders on the bar.
 */
public class BarLiquidity {

    private final double volumeCap;
    private final double makerCap;
    private double consumed;
    private double makerConsumed;

    private BarLiquidity(double volumeCap) {
        this.volumeCap = Math.max(0, volumeCap);
        this.makerCap = this.volumeCap / 2.0;
    }

    public static BarLiquidity of(double volumeCap) {
        return new BarLiquidity(volumeCap);
    }

    public double volumeCap() {
        return volumeCap;
    }

    public double consumed() {
        return consumed;
    }

    public double takerAvailable() {
        return Math.max(0, volumeCap - consumed);
    }

    public double makerAvailable() {
        return Math.max(0, Math.min(makerCap - makerConsumed, volumeCap - consumed));
    }

    public double available(LiquidityRole role) {
        return role == LiquidityRole.MAKER ? makerAvailable() : takerAvailable();
    }

    void consume(double quantity, LiquidityRole role) {
        consumed += quantity;
        if (role == LiquidityRole.MAKER) {
            makerConsumed += quantity;
        }
    }
}
