package com.barometer.agents.speedtest;

import com.barometer.core.model.Result;
import com.barometer.core.model.Target;
import com.barometer.core.provider.ProviderException;
import com.barometer.core.system.CommandResult;
import com.barometer.core.system.CommandRunner;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SpeedtestProviderTest {

    private static final List<String> COMMAND = List.of("speedtest-cli", "--secure", "--json");
    private static final List<Target> TARGETS = List.of(new Target("speedtest"));

    private CommandRunner runner;
    private SpeedtestProvider provider;

    @BeforeEach
    void setUp() {
        runner = mock(CommandRunner.class);
        provider = new SpeedtestProvider(runner, COMMAND, new ObjectMapper());
    }

    private static String fixture() throws IOException {
        try (InputStream in = SpeedtestProviderTest.class.getResourceAsStream("/speedtest/result.json")) {
            assertNotNull(in, "missing fixture");
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private String error(List<Result<SpeedtestResult>> results) {
        return ((Result.Failure<SpeedtestResult>) results.get(0)).error();
    }

    @Test
    @DisplayName("parses speeds, byte counts, server and client")
    void parsesReport() throws Exception {
        when(runner.run(COMMAND)).thenReturn(new CommandResult(0, fixture(), ""));

        var result = (SpeedtestResult) assertInstanceOf(Result.Success.class, provider.fetch(TARGETS).get(0)).payload();

        assertEquals(293045112.7, result.download());
        assertEquals(41288051.2, result.upload());
        assertEquals(11.482, result.ping());
        assertEquals(51_904_512L, result.bytesSent());
        assertEquals(367_431_680L, result.bytesReceived());
        assertEquals("speedtest.example.net", result.server().hostname());
        assertEquals("Example Fiber", result.server().sponsor());
        assertEquals("Example Cable", result.client().isp());
        assertEquals("203.0.113.24", result.client().ip());
    }

    @Test
    @DisplayName("a failed run reports the first stderr line")
    void failedRun() throws ProviderException {
        when(runner.run(COMMAND)).thenReturn(new CommandResult(1, "",
                "ERROR: Unable to connect to servers to test latency.\ntrace"));

        assertEquals("ERROR: Unable to connect to servers to test latency.", error(provider.fetch(TARGETS)));
    }

    @Test
    @DisplayName("a failed run without stderr names the command")
    void failedRunWithoutStderr() throws ProviderException {
        when(runner.run(COMMAND)).thenReturn(new CommandResult(2, "", ""));

        assertEquals("failed to execute \"speedtest-cli --secure --json\"", error(provider.fetch(TARGETS)));
    }

    @Test
    @DisplayName("empty output and malformed JSON are failures")
    void emptyAndMalformed() throws ProviderException {
        when(runner.run(COMMAND)).thenReturn(new CommandResult(0, "", ""));
        assertEquals("empty results received", error(provider.fetch(TARGETS)));

        when(runner.run(COMMAND)).thenReturn(new CommandResult(0, "{not json", ""));
        assertEquals("failed to parse the JSON data", error(provider.fetch(TARGETS)));
    }

    @Test
    @DisplayName("no speed in either direction means every test failed")
    void noSpeeds() throws ProviderException {
        when(runner.run(COMMAND)).thenReturn(new CommandResult(0, "{\"download\": 0, \"upload\": 0}", ""));

        assertEquals("all tests failed", error(provider.fetch(TARGETS)));
    }

    @Test
    @DisplayName("a runner timeout becomes the failure")
    void timeout() throws ProviderException {
        when(runner.run(COMMAND)).thenThrow(new ProviderException("speedtest-cli timed out after 120s"));

        assertEquals("speedtest-cli timed out after 120s", error(provider.fetch(TARGETS)));
    }
}
