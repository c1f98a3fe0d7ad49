package com.tradeagent.orchestrator.marketdata;

import com.tradeagent.common.exception.DataSourceException;
import com.tradeagent.common.model.Candle;
import com.tradeagent.common.model.OptionChain;
import com.tradeagent.common.model.Timeframe;

import java.time.LocalDate;
import java.util.List;

/**
 * Broker data collaborator of the gate pipeline. Both calls either return data or throw
 * {@link DataSourceException}; neither returns {@code null}.
 */
public interface MarketDataGateway {

    /** Candles for the index between the two trading dates (inclusive), oldest first. */
    List<Candle> fetchCandles(String symbol, Timeframe timeframe, LocalDate from, LocalDate to);

    /** Chain for the nearest expiry on or after today. */
    OptionChain fetchOptionChain(String symbol);
}
