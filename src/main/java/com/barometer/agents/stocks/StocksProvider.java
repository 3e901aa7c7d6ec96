package com.barometer.agents.stocks;

import com.barometer.core.model.Target;
import com.barometer.core.provider.PerTargetProvider;
import com.barometer.core.provider.ProviderException;

public class StocksProvider extends PerTargetProvider<StockQuote> {

    private final QuoteClient client;

    public StocksProvider(QuoteClient client) {
        this.client = client;
    }

    @Override
    protected StockQuote measure(Target target) throws ProviderException {
        return client.quote(target.name());
    }
}
