package com.barometer.agents.quakes;

import com.barometer.core.model.Target;
import com.barometer.core.provider.PerTargetProvider;
import com.barometer.core.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single target only names the agent; every fetch runs the same query.
 */
public class QuakesProvider extends PerTargetProvider<QuakeReport> {

    private static final Logger log = LoggerFactory.getLogger(QuakesProvider.class);

    private final QuakesClient client;
    private final QuakeQuery query;

    public QuakesProvider(QuakesClient client, QuakeQuery query) {
        this.client = client;
        this.query = query;
    }

    @Override
    protected QuakeReport measure(Target target) throws ProviderException {
        QuakeReport report = client.recent(query);
        log.info("{} earthquake(s) within {} km of {}", report.count(), Math.round(query.radiusKm()), report.location());
        return report;
    }
}
