package com.barometer.core.health;

import com.barometer.core.provider.AvailabilityCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;

/**
 * Connectivity check: opens a TCP connection to a well-known resolver and closes it.
 */
@Component
public class NetworkReachability implements AvailabilityCheck {

    private static final Logger log = LoggerFactory.getLogger(NetworkReachability.class);

    private final ReachabilityProperties properties;

    public NetworkReachability(ReachabilityProperties properties) {
        this.properties = properties;
    }

    @Override
    public boolean isAvailable() {
        try (var socket = new Socket()) {
            socket.connect(new InetSocketAddress(properties.getHost(), properties.getPort()),
                    (int) properties.getTimeout().toMillis());
            return true;
        } catch (IOException e) {
            log.debug("{}:{} not reachable: {}", properties.getHost(), properties.getPort(), e.getMessage());
            return false;
        }
    }

    @Override
    public String unavailableMessage() {
        return "the network is unreachable";
    }
}
