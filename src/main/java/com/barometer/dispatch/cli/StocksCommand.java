package com.barometer.dispatch.cli;

import com.barometer.agents.stocks.QuoteClient;
import com.barometer.agents.stocks.StocksProperties;
import com.barometer.agents.stocks.StocksProvider;
import com.barometer.agents.stocks.StocksRenderer;
import com.barometer.core.agent.AgentDefinition;
import com.barometer.core.agent.AgentLauncher;
import com.barometer.core.agent.ConfigurationException;
import com.barometer.core.health.NetworkReachability;
import com.barometer.core.model.Target;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.regex.Pattern;

/**
 * CLI command: barometer stocks -s GOOG -s AAPL
 */
@Command(name = "stocks", mixinStandardHelpOptions = true,
        description = "Report the latest price and daily change of one or more stock symbols")
@Component
public class StocksCommand implements Callable<Integer> {

    static final long DEFAULT_INTERVAL_SECONDS = 900;
    static final List<String> DEFAULT_SYMBOLS = List.of("GOOG", "AAPL");

    private static final Pattern SYMBOL = Pattern.compile("[A-Z0-9.^=-]{1,20}");

    @Mixin
    AgentOptions options = new AgentOptions();

    @Option(names = {"-s", "--symbol"}, paramLabel = "<symbol>",
            description = "Ticker symbol; repeat to cycle through several (default: GOOG, AAPL)")
    List<String> symbols = new ArrayList<>();

    private final AgentLauncher launcher;
    private final StocksProperties properties;
    private final NetworkReachability reachability;
    private final ObjectMapper objectMapper;

    public StocksCommand(AgentLauncher launcher,
                         StocksProperties properties,
                         NetworkReachability reachability,
                         ObjectMapper objectMapper) {
        this.launcher = launcher;
        this.properties = properties;
        this.reachability = reachability;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        return launcher.launch("stocks", () -> {
            List<String> requested = symbols.isEmpty() ? DEFAULT_SYMBOLS : symbols;
            var normalized = new ArrayList<String>();
            for (String symbol : requested) {
                String upper = symbol.strip().toUpperCase(Locale.ROOT);
                if (!SYMBOL.matcher(upper).matches()) {
                    throw new ConfigurationException("stocks: invalid symbol '" + symbol + "'");
                }
                normalized.add(upper);
            }
            var client = new QuoteClient(properties, objectMapper);
            return AgentDefinition.of("stocks", Target.of(normalized),
                            new StocksProvider(client), new StocksRenderer(ZoneId.systemDefault()))
                    .withAvailability(reachability);
        }, options.toLaunchOptions(DEFAULT_INTERVAL_SECONDS));
    }
}
