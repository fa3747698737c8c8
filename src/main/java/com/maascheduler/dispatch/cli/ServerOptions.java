package com.maascheduler.dispatch.cli;

import picocli.CommandLine.Option;

/**
 * Shared {@code --server} option for commands that talk to a running server.
 */
public class ServerOptions {

    @Option(names = {"--server", "-s"},
            description = "Server base URL (default: ${DEFAULT-VALUE}, or MAA_SERVER)",
            defaultValue = "${env:MAA_SERVER:-http://localhost:8080}")
    String serverUrl;

    public String serverUrl() {
        return serverUrl;
    }
}
