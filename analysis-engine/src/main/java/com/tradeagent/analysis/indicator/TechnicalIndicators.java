package com.tradeagent.analysis.indicator;

import com.tradeagent.common.model.Candle;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * Pure calculation utilities for technical indicators.
 * Inputs are ordered oldest-first (last element = most recent bar), as delivered by the broker.
 * Every function returns NaN when the series is too short.
 */
public final class TechnicalIndicators {

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    private TechnicalIndicators() {}

    // ── Simple Moving Average ────────────────────────────────────────────────

    /**
     * @param values  series, oldest-first
     * @param period  number of periods
     * @return SMA of the last {@code period} values, or NaN if insufficient data
     */
    public static double sma(List<Double> values, int period) {
        if (values == null || period <= 0 || values.size() < period) return Double.NaN;
        double sum = 0;
        for (int i = values.size() - period; i < values.size(); i++) sum += values.get(i);
        return sum / period;
    }

    // ── Exponential Moving Average ───────────────────────────────────────────

    /**
     * Seeds with the SMA of the first {@code period} values, then applies the
     * {@code 2 / (period + 1)} smoothing factor to the rest.
     *
     * @return most-recent EMA value, or NaN if insufficient data
     */
    public static double ema(List<Double> values, int period) {
        if (values == null || period <= 0 || values.size() < period) return Double.NaN;
        double k = 2.0 / (period + 1);
        double ema = 0;
        for (int i = 0; i < period; i++) ema += values.get(i);
        ema /= period;
        for (int i = period; i < values.size(); i++) {
            ema = values.get(i) * k + ema * (1 - k);
        }
        return ema;
    }

    // ── RSI ─────────────────────────────────────────────────────────────────

    /**
     * Computes RSI using Wilder's Smoothed Moving Average.
     * @return RSI value 0–100, or NaN if insufficient data
     */
    public static double rsi(List<Double> values, int period) {
        if (values == null || period <= 0 || values.size() < period + 1) return Double.NaN;
        int n = values.size();

        double avgGain = 0;
        double avgLoss = 0;
        for (int i = 1; i <= period; i++) {
            double change = values.get(i) - values.get(i - 1);
            if (change > 0) avgGain += change;
            else avgLoss += Math.abs(change);
        }
        avgGain /= period;
        avgLoss /= period;

        for (int i = period + 1; i < n; i++) {
            double change = values.get(i) - values.get(i - 1);
            avgGain = (avgGain * (period - 1) + Math.max(change, 0)) / period;
            avgLoss = (avgLoss * (period - 1) + Math.max(-change, 0)) / period;
        }

        if (avgLoss == 0) return 100.0;
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    // ── True range / ATR ────────────────────────────────────────────────────

    public static double trueRange(Candle current, Candle previous) {
        double hl = current.high() - current.low();
        if (previous == null) return hl;
        double hc = Math.abs(current.high() - previous.close());
        double lc = Math.abs(current.low() - previous.close());
        return Math.max(hl, Math.max(hc, lc));
    }

    /**
     * Wilder-smoothed Average True Range.
     * @return ATR, or NaN if fewer than {@code period + 1} candles
     */
    public static double atr(List<Candle> candles, int period) {
        if (candles == null || period <= 0 || candles.size() < period + 1) return Double.NaN;
        double atr = 0;
        for (int i = 1; i <= period; i++) atr += trueRange(candles.get(i), candles.get(i - 1));
        atr /= period;
        for (int i = period + 1; i < candles.size(); i++) {
            atr = (atr * (period - 1) + trueRange(candles.get(i), candles.get(i - 1))) / period;
        }
        return atr;
    }

    // ── Directional movement (ADX / DI) ─────────────────────────────────────

    /** ADX with the +DI / −DI it was derived from. */
    public record DirectionalIndex(double adx, double plusDi, double minusDi) {

        static final DirectionalIndex UNAVAILABLE = new DirectionalIndex(Double.NaN, Double.NaN, Double.NaN);

        public double diDiff() {
            return plusDi - minusDi;
        }
    }

    /**
     * Wilder's ADX. Needs at least {@code 2 * period + 1} candles.
     */
    public static DirectionalIndex directionalIndex(List<Candle> candles, int period) {
        if (candles == null || period <= 0 || candles.size() < 2 * period + 1) return DirectionalIndex.UNAVAILABLE;

        double smTr = 0, smPlus = 0, smMinus = 0;
        double adx = 0;
        double plusDi = 0, minusDi = 0;
        int dxCount = 0;

        for (int i = 1; i < candles.size(); i++) {
            Candle cur = candles.get(i);
            Candle prev = candles.get(i - 1);
            double up = cur.high() - prev.high();
            double down = prev.low() - cur.low();
            double plusDm = up > down && up > 0 ? up : 0;
            double minusDm = down > up && down > 0 ? down : 0;
            double tr = trueRange(cur, prev);

            if (i <= period) {
                smTr += tr;
                smPlus += plusDm;
                smMinus += minusDm;
                if (i < period) continue;
            } else {
                smTr = smTr - smTr / period + tr;
                smPlus = smPlus - smPlus / period + plusDm;
                smMinus = smMinus - smMinus / period + minusDm;
            }

            plusDi = smTr == 0 ? 0 : 100.0 * smPlus / smTr;
            minusDi = smTr == 0 ? 0 : 100.0 * smMinus / smTr;
            double diSum = plusDi + minusDi;
            double dx = diSum == 0 ? 0 : 100.0 * Math.abs(plusDi - minusDi) / diSum;

            dxCount++;
            if (dxCount <= period) {
                adx += dx;
                if (dxCount == period) adx /= period;
            } else {
                adx = (adx * (period - 1) + dx) / period;
            }
        }
        if (dxCount < period) return DirectionalIndex.UNAVAILABLE;
        return new DirectionalIndex(adx, plusDi, minusDi);
    }

    // ── VWAP ────────────────────────────────────────────────────────────────

    /**
     * Session VWAP over the candles of the most recent IST trading day.
     * Index candles carry no volume; in that case every bar gets equal weight.
     */
    public static double vwap(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) return Double.NaN;
        LocalDate session = candles.get(candles.size() - 1).timestamp().atZone(IST).toLocalDate();

        double pv = 0, volume = 0, typicalSum = 0;
        int bars = 0;
        for (int i = candles.size() - 1; i >= 0; i--) {
            Candle c = candles.get(i);
            if (!c.timestamp().atZone(IST).toLocalDate().equals(session)) break;
            double typical = (c.high() + c.low() + c.close()) / 3.0;
            pv += typical * c.volume();
            volume += c.volume();
            typicalSum += typical;
            bars++;
        }
        if (volume > 0) return pv / volume;
        return typicalSum / bars;
    }
}
