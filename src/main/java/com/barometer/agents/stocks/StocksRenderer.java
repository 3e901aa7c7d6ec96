package com.barometer.agents.stocks;

import com.barometer.core.format.ByteFormat;
import com.barometer.core.format.Glyphs;
import com.barometer.core.format.Tooltip;
import com.barometer.core.model.Result;
import com.barometer.core.model.StatusClass;
import com.barometer.core.model.StatusRecord;
import com.barometer.core.model.Target;
import com.barometer.core.provider.Renderer;

import java.time.ZoneId;
import java.util.Locale;

/**
 * {@code <symbol> <price> <change> (<change %>)}; the toggle signal cycles through symbols.
 */
public class StocksRenderer implements Renderer<StockQuote> {

    private final ZoneId zone;

    public StocksRenderer(ZoneId zone) {
        this.zone = zone;
    }

    @Override
    public StatusRecord render(Result<StockQuote> result, int mode) {
        if (result instanceof Result.Failure<StockQuote> failure) {
            return Renderer.failure(failure);
        }
        var success = (Result.Success<StockQuote>) result;
        StockQuote quote = success.payload();

        String text = quote.symbol() + " " + ByteFormat.pad(quote.price())
                + " " + signed(quote.change()) + " (" + signed(quote.changePercent()) + "%)";
        String tooltip = Tooltip.builder()
                .heading("Company Info:")
                .row("Company", quote.name())
                .row("Symbol", quote.symbol())
                .row("Exchange", quote.exchange())
                .row("Currency", quote.currency())
                .heading("Key Stats:")
                .row("Price", ByteFormat.pad(quote.price()))
                .row("Previous Close", ByteFormat.pad(quote.previousClose()))
                .row("Day Range", ByteFormat.pad(quote.dayLow()) + " - " + ByteFormat.pad(quote.dayHigh()))
                .row("52 Week Range", ByteFormat.pad(quote.yearLow()) + " - " + ByteFormat.pad(quote.yearHigh()))
                .row("Volume", numerize(quote.volume()))
                .build(success.updatedAt(), zone);
        return new StatusRecord(Glyphs.prefix(Glyphs.GRAPH_LINE, text), StatusClass.SUCCESS, tooltip);
    }

    @Override
    public StatusRecord fetching(Target target) {
        String text = "Fetching stock quotes...";
        return new StatusRecord(Glyphs.prefix(Glyphs.TIMER, text), StatusClass.LOADING, text);
    }

    static String signed(double value) {
        return (value >= 0 ? "+" : "-") + ByteFormat.pad(Math.abs(value));
    }

    /** Grouped digits below a million, then M, B or T with two decimals. */
    static String numerize(long number) {
        long abs = Math.abs(number);
        if (abs < 1_000_000) {
            return String.format(Locale.ROOT, "%,d", number);
        }
        String sign = number < 0 ? "-" : "";
        if (abs >= 1_000_000_000_000L) {
            return sign + ByteFormat.pad(abs / 1e12) + "T";
        }
        if (abs >= 1_000_000_000) {
            return sign + ByteFormat.pad(abs / 1e9) + "B";
        }
        return sign + ByteFormat.pad(abs / 1e6) + "M";
    }
}
