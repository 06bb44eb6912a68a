package com.chronoplan.dispatch.cli;

import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: chronoplan serve
 * <p>
 * Registered so {@code serve} shows up in usage help. The server itself is started by
 * {@link com.chronoplan.ChronoplanApplication}, which switches to a servlet context when it
 * sees the argument; this bean only announces the schedule endpoints once the port is bound.
 * The port follows {@code server.port}, e.g. {@code SERVER_PORT=9090 chronoplan serve}.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Serve the scheduling operations over HTTP under /api/v1/schedule")
@Component
public class ServeCommand implements Runnable {

    static final List<String> ENDPOINTS = List.of(
            "critical-path", "optimize", "conflicts", "capacity", "dependencies", "propagate", "dependency-stats");

    @Override
    public void run() {
        // Only reachable without a Spring context; the launcher intercepts "serve" otherwise
        ConsoleOutput.warn("The scheduling API starts only when Chronoplan is launched with 'serve'");
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        int port = event.getWebServer().getPort();
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Scheduling API listening on port " + port);
        ENDPOINTS.forEach(e -> System.out.println("  POST http://localhost:" + port + "/api/v1/schedule/" + e));
    }
}
