package com.barometer.agents.network;

import com.barometer.core.format.ByteFormat;
import com.barometer.core.format.Glyphs;
import com.barometer.core.format.Tooltip;
import com.barometer.core.model.Result;
import com.barometer.core.model.StatusClass;
import com.barometer.core.model.StatusRecord;
import com.barometer.core.provider.Renderer;

import java.time.ZoneId;

public class NetworkRenderer implements Renderer<NetworkThroughput> {

    private final ZoneId zone;

    public NetworkRenderer(ZoneId zone) {
        this.zone = zone;
    }

    @Override
    public StatusRecord render(Result<NetworkThroughput> result, int mode) {
        if (result instanceof Result.Failure<NetworkThroughput> failure) {
            return StatusRecord.of(Glyphs.prefix(Glyphs.NETWORK_OFF, failure.error()), StatusClass.ERROR);
        }
        var success = (Result.Success<NetworkThroughput>) result;
        NetworkThroughput net = success.payload();

        String text = net.iface()
                + " down " + ByteFormat.rate(net.received())
                + " up " + ByteFormat.rate(net.transmitted());
        String tooltip = Tooltip.builder()
                .row("Interface", net.iface())
                .row("Type", net.wireless() ? "wireless" : "wired")
                .row("MAC Address", net.macAddress())
                .row("Received", ByteFormat.bytes(net.receivedTotal(), "auto"))
                .row("Transmitted", ByteFormat.bytes(net.transmittedTotal(), "auto"))
                .build(success.updatedAt(), zone);
        return new StatusRecord(Glyphs.prefix(Glyphs.NETWORK, text), StatusClass.SUCCESS, tooltip);
    }
}
