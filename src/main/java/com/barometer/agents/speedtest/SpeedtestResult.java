package com.barometer.agents.speedtest;

/**
 * One speedtest-cli run. Speeds are in bits per second, ping in milliseconds.
 */
public record SpeedtestResult(
    double download,
    double upload,
    double ping,
    long bytesSent,
    long bytesReceived,
    Server server,
    Client client
) {
    /** Mean of download and upload, which picks the speedometer icon. */
    public double averageSpeed() {
        return (download + upload) / 2;
    }

    /**
     * @param host {@code hostname:port} of the test server
     */
    public record Server(String name, String country, String sponsor, String host, double latency) {

        public String hostname() {
            int colon = host.indexOf(':');
            return colon < 0 ? host : host.substring(0, colon);
        }
    }

    public record Client(String ip, String isp, String country) {}
}
