package com.tradeagent.common.session;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Pure stateless classifier mapping an {@link Instant} to a {@link SessionPhase} based on
 * NSE/BSE market hours (IST, UTC+5:30).
 *
 * <pre>
 *   OPEN    09:15 – 11:00
 *   MID     11:00 – 14:00
 *   CLOSE   14:00 – 15:30
 *   CLOSED  15:30 – 09:15 (next day), weekends
 * </pre>
 */
public final class TradingSessionClassifier {

    public static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    private static final LocalTime MARKET_OPEN  = LocalTime.of(9, 15);
    private static final LocalTime MID_START    = LocalTime.of(11, 0);
    private static final LocalTime CLOSE_START  = LocalTime.of(14, 0);
    private static final LocalTime MARKET_CLOSE = LocalTime.of(15, 30);

    private TradingSessionClassifier() {}

    public static SessionPhase classify(Instant now) {
        ZonedDateTime ist = now.atZone(IST);
        if (isWeekend(ist.toLocalDate())) return SessionPhase.CLOSED;

        LocalTime time = ist.toLocalTime();
        if (time.isBefore(MARKET_OPEN))  return SessionPhase.CLOSED;
        if (time.isBefore(MID_START))    return SessionPhase.OPEN;
        if (time.isBefore(CLOSE_START))  return SessionPhase.MID;
        if (time.isBefore(MARKET_CLOSE)) return SessionPhase.CLOSE;
        return SessionPhase.CLOSED;
    }

    /**
     * Most recent weekday on or before the IST date of {@code now}. Exchange holidays are
     * not modelled.
     */
    public static LocalDate lastTradingDate(Instant now) {
        LocalDate date = now.atZone(IST).toLocalDate();
        while (isWeekend(date)) {
            date = date.minusDays(1);
        }
        return date;
    }

    private static boolean isWeekend(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY;
    }
}
