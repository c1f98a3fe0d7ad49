package com.tradeagent.common.model;

public enum Moneyness {
    ITM,
    ATM,
    OTM;

    /**
     * Classifies a strike against the at-the-money strike for the given option type.
     * A call below ATM (or a put above it) is in the money.
     */
    public static Moneyness classify(double strike, double atmStrike, OptionType type) {
        if (strike == atmStrike) return ATM;
        boolean below = strike < atmStrike;
        if (type == OptionType.CE) return below ? ITM : OTM;
        return below ? OTM : ITM;
    }
}
