package com.tradeagent.common.scoring;

import com.tradeagent.common.model.OptionCandidate;

/**
 * Pure additive score for one option contract. No model involvement, no I/O.
 *
 * <h3>Components</h3>
 * <pre>
 *   delta     +3.0 in [0.30, 0.50]   +2.0 in [0.20, 0.60]   +1.0 in [0.10, 0.70]
 *   gamma     +2.0 if &gt; 0.010        +1.0 if &gt; 0.005
 *   spread%   −2.0 if &gt; 2.0           −1.0 if &gt; 1.0           +0.5 if &lt; 0.5
 *   ivChange  +1.5 if &gt; 0.05          +1.0 if &gt; 0.02          −1.0 if &lt; −0.05
 *   oiChange  +1.5 if &gt; 0.10          +1.0 if &gt; 0.05
 *   theta     −1.0 if |theta| &gt; 10
 * </pre>
 * Delta is compared by absolute value so puts score like calls. The total is floored at 0.
 */
public final class StrikeScorer {

    private static final double THETA_RISK_LIMIT = 10.0;

    private StrikeScorer() {}

    public static double score(OptionCandidate candidate) {
        if (candidate == null) return 0.0;

        double score = 0.0;
        score += deltaScore(candidate.delta());
        score += gammaScore(candidate.gamma());
        score += spreadScore(candidate.spreadPct());
        score += ivScore(candidate.ivChange());
        score += oiScore(candidate.oiChange());
        score += thetaScore(candidate.theta());

        return Math.max(0.0, score);
    }

    static double deltaScore(Double delta) {
        if (delta == null) return 0.0;
        double d = Math.abs(delta);
        if (d >= 0.3 && d <= 0.5) return 3.0;
        if (d >= 0.2 && d <= 0.6) return 2.0;
        if (d >= 0.1 && d <= 0.7) return 1.0;
        return 0.0;
    }

    static double gammaScore(Double gamma) {
        if (gamma == null) return 0.0;
        if (gamma > 0.01)  return 2.0;
        if (gamma > 0.005) return 1.0;
        return 0.0;
    }

    static double spreadScore(double spreadPct) {
        if (spreadPct > 2.0) return -2.0;
        if (spreadPct > 1.0) return -1.0;
        if (spreadPct < 0.5) return 0.5;
        return 0.0;
    }

    static double ivScore(Double ivChange) {
        if (ivChange == null) return 0.0;
        if (ivChange > 0.05)  return 1.5;
        if (ivChange > 0.02)  return 1.0;
        if (ivChange < -0.05) return -1.0;
        return 0.0;
    }

    static double oiScore(Double oiChange) {
        if (oiChange == null) return 0.0;
        if (oiChange > 0.10) return 1.5;
        if (oiChange > 0.05) return 1.0;
        return 0.0;
    }

    static double thetaScore(Double theta) {
        if (theta == null) return 0.0;
        return Math.abs(theta) > THETA_RISK_LIMIT ? -1.0 : 0.0;
    }
}
