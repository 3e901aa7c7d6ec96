package com.barometer.agents.stocks;

/**
 * Latest quote of one symbol. Prices are in {@link #currency()}.
 *
 * @param previousClose close of the previous trading day, the base of the change figures
 * @param volume        shares traded today
 */
public record StockQuote(
    String symbol,
    String name,
    String exchange,
    String currency,
    double price,
    double previousClose,
    double dayHigh,
    double dayLow,
    double yearHigh,
    double yearLow,
    long volume
) {
    public double change() {
        return price - previousClose;
    }

    public double changePercent() {
        return previousClose == 0 ? 0 : change() / previousClose * 100;
    }
}
