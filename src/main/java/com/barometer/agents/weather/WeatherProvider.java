package com.barometer.agents.weather;

import com.barometer.core.model.Target;
import com.barometer.core.provider.PerTargetProvider;
import com.barometer.core.provider.ProviderException;

public class WeatherProvider extends PerTargetProvider<WeatherReport> {

    private final WeatherClient client;

    public WeatherProvider(WeatherClient client) {
        this.client = client;
    }

    @Override
    protected WeatherReport measure(Target target) throws ProviderException {
        return client.forecast(target.name());
    }
}
