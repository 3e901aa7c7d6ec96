package com.barometer.agents.updates;

import com.barometer.core.format.Glyphs;
import com.barometer.core.format.Tooltip;
import com.barometer.core.model.Result;
import com.barometer.core.model.StatusClass;
import com.barometer.core.model.StatusRecord;
import com.barometer.core.provider.Renderer;

import java.time.ZoneId;

/**
 * {@code <manager> <n> outdated packages}, with the package list in the tooltip.
 */
public class UpdatesRenderer implements Renderer<UpdateList> {

    static final int TOOLTIP_LIMIT = 25;

    private final ZoneId zone;

    public UpdatesRenderer(ZoneId zone) {
        this.zone = zone;
    }

    @Override
    public StatusRecord render(Result<UpdateList> result, int mode) {
        if (result instanceof Result.Failure<UpdateList> failure) {
            return Renderer.failure(failure);
        }
        var success = (Result.Success<UpdateList>) result;
        UpdateList updates = success.payload();

        String noun = updates.count() == 1 ? "package" : "packages";
        String text = updates.manager().displayName() + " " + updates.count() + " outdated " + noun;

        var tooltip = Tooltip.builder();
        if (updates.count() == 0) {
            tooltip.line("Everything is up to date");
        } else {
            int width = updates.packages().stream()
                    .limit(TOOLTIP_LIMIT)
                    .mapToInt(update -> update.name().length())
                    .max()
                    .orElse(0);
            updates.packages().stream()
                    .limit(TOOLTIP_LIMIT)
                    .forEach(update -> tooltip.line(
                            String.format("%-" + width + "s => %s", update.name(), update.version())));
            if (updates.count() > TOOLTIP_LIMIT) {
                tooltip.line("... and " + (updates.count() - TOOLTIP_LIMIT) + " more");
            }
        }
        StatusClass status = updates.count() > 0 ? StatusClass.WARNING : StatusClass.SUCCESS;
        return new StatusRecord(Glyphs.prefix(Glyphs.PACKAGE, text), status,
                tooltip.build(success.updatedAt(), zone));
    }
}
