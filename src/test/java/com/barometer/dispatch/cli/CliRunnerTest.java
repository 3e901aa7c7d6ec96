package com.barometer.dispatch.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.junit.jupiter.api.Assertions.*;

class CliRunnerTest {

    @Test
    @DisplayName("keeps the command's exit code for Spring Boot")
    void keepsExitCode() {
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        var sink = new PrintStream(new ByteArrayOutputStream(), true);
        System.setOut(sink);
        System.setErr(sink);
        try {
            var runner = new CliRunner(new BarometerCommand(), CommandLine.defaultFactory());

            runner.run("--version");
            assertEquals(0, runner.getExitCode());

            runner.run("--no-such-option");
            assertEquals(2, runner.getExitCode());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }
}
