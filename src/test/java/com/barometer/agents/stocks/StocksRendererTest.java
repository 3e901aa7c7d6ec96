package com.barometer.agents.stocks;

import com.barometer.core.format.Glyphs;
import com.barometer.core.model.Result;
import com.barometer.core.model.StatusClass;
import com.barometer.core.model.Target;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class StocksRendererTest {

    private final StocksRenderer renderer = new StocksRenderer(ZoneOffset.UTC);

    private static Result<StockQuote> quote(double price, double previousClose) {
        var quote = new StockQuote("AAPL", "Apple Inc.", "NasdaqGS", "USD",
                price, previousClose, 233.45, 229.1, 260.1, 164.08, 48_125_300L);
        return new Result.Success<>(quote, Instant.parse("2026-10-19T09:15:02Z"));
    }

    @Test
    @DisplayName("renders price with signed change and percentage")
    void gain() {
        var record = renderer.render(quote(231.78, 228.5), 0);

        assertEquals(Glyphs.prefix(Glyphs.GRAPH_LINE, "AAPL 231.78 +3.28 (+1.44%)"), record.text());
        assertEquals(StatusClass.SUCCESS, record.status());
    }

    @Test
    @DisplayName("losses carry a minus sign")
    void loss() {
        var record = renderer.render(quote(220.00, 228.50), 0);

        assertEquals(Glyphs.prefix(Glyphs.GRAPH_LINE, "AAPL 220.00 -8.50 (-3.72%)"), record.text());
    }

    @Test
    @DisplayName("the tooltip has company and key stats sections")
    void tooltip() {
        String tooltip = renderer.render(quote(231.78, 228.5), 0).tooltip();

        assertEquals(String.join("\n",
                "Company Info:",
                "  Company  : Apple Inc.",
                "  Symbol   : AAPL",
                "  Exchange : NasdaqGS",
                "  Currency : USD",
                "",
                "Key Stats:",
                "  Price          : 231.78",
                "  Previous Close : 228.50",
                "  Day Range      : 229.10 - 233.45",
                "  52 Week Range  : 164.08 - 260.10",
                "  Volume         : 48.13M",
                "",
                "Last updated 2026-10-19 09:15:02"), tooltip);
    }

    @Test
    @DisplayName("the first fetch announces stock quotes")
    void fetching() {
        var record = renderer.fetching(new Target("AAPL"));

        assertEquals(Glyphs.prefix(Glyphs.TIMER, "Fetching stock quotes..."), record.text());
        assertEquals(StatusClass.LOADING, record.status());
    }

    @Test
    @DisplayName("large numbers are abbreviated")
    void numerize() {
        assertEquals("999,999", StocksRenderer.numerize(999_999));
        assertEquals("2.50B", StocksRenderer.numerize(2_500_000_000L));
        assertEquals("3.10T", StocksRenderer.numerize(3_100_000_000_000L));
    }
}
