package com.barometer.core.provider;

import com.barometer.core.logging.MdcContext;
import com.barometer.core.model.Result;
import com.barometer.core.model.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Base for providers that measure each target independently. A
 * {@link ProviderException} for one target becomes that target's failure
 * and the remaining targets are still measured.
 */
public abstract class PerTargetProvider<T> implements Provider<T> {

    private static final Logger log = LoggerFactory.getLogger(PerTargetProvider.class);

    @Override
    public List<Result<T>> fetch(List<Target> targets) {
        var results = new ArrayList<Result<T>>(targets.size());
        for (Target target : targets) {
            MdcContext.setTarget(target.name());
            try {
                results.add(Result.success(measure(target)));
            } catch (ProviderException e) {
                log.warn("Fetching {} failed: {}", target, e.getMessage());
                results.add(Result.failure(e.getMessage()));
            } finally {
                MdcContext.clearTarget();
            }
        }
        return results;
    }

    protected abstract T measure(Target target) throws ProviderException;
}
