package com.barometer.core.reactor;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "barometer")
public class ReactorProperties {

    private Reactor reactor = new Reactor();
    private Signals signals = new Signals();

    // -- Reactor accessors (delegate to nested) --
    public Duration getFetchTimeout() { return reactor.fetchTimeout; }

    // -- Signal accessors (delegate to nested) --
    public String getRefreshSignal() { return signals.refresh; }
    public String getToggleSignal() { return signals.toggle; }
    public List<String> getTerminateSignals() { return signals.terminate; }

    public Reactor getReactor() { return reactor; }
    public void setReactor(Reactor reactor) { this.reactor = reactor; }
    public Signals getSignals() { return signals; }
    public void setSignals(Signals signals) { this.signals = signals; }

    public static class Reactor {
        private Duration fetchTimeout = Duration.ofSeconds(30);

        public Duration getFetchTimeout() { return fetchTimeout; }
        public void setFetchTimeout(Duration fetchTimeout) { this.fetchTimeout = fetchTimeout; }
    }

    /**
     * Signal names without the {@code SIG} prefix, as understood by the JVM.
     */
    public static class Signals {
        private String refresh = "HUP";
        private String toggle = "USR1";
        private List<String> terminate = new ArrayList<>(List.of("TERM", "INT"));

        public String getRefresh() { return refresh; }
        public void setRefresh(String refresh) { this.refresh = refresh; }
        public String getToggle() { return toggle; }
        public void setToggle(String toggle) { this.toggle = toggle; }
        public List<String> getTerminate() { return terminate; }
        public void setTerminate(List<String> terminate) { this.terminate = terminate; }
    }
}
