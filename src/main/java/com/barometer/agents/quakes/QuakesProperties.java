package com.barometer.agents.quakes;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "barometer.quakes")
public class QuakesProperties {

    /** Returns the public IP's location as {@code "loc": "lat,lon"}. */
    private String geolocationUrl = "https://ipinfo.io/json";
    private String feedUrl = "https://earthquake.usgs.gov/fdsnws/event/1/query";
    private Duration requestTimeout = Duration.ofSeconds(10);

    public String getGeolocationUrl() {
        return geolocationUrl;
    }

    public void setGeolocationUrl(String geolocationUrl) {
        this.geolocationUrl = geolocationUrl;
    }

    public String getFeedUrl() {
        return feedUrl;
    }

    public void setFeedUrl(String feedUrl) {
        this.feedUrl = feedUrl;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }
}
