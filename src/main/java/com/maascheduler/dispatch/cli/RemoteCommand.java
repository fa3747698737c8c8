package com.maascheduler.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import picocli.CommandLine.Mixin;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpConnectTimeoutException;

/**
 * Base for commands that drive a running server through its REST API.
 */
abstract class RemoteCommand implements Runnable {

    @Mixin
    ServerOptions server = new ServerOptions();

    private final ObjectMapper objectMapper;

    protected RemoteCommand(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public final void run() {
        SchedulerApiClient client = new SchedulerApiClient(server.serverUrl(), objectMapper);
        try {
            execute(client);
        } catch (ConnectException | HttpConnectTimeoutException e) {
            ConsoleOutput.notRunning(client.baseUrl());
        } catch (SchedulerApiException e) {
            ConsoleOutput.error(e.getMessage() + " (HTTP " + e.statusCode() + ")");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Interrupted.");
        } catch (IOException e) {
            ConsoleOutput.error("Request failed: " + e.getMessage());
        }
    }

    protected abstract void execute(SchedulerApiClient client) throws IOException, InterruptedException;

    protected ObjectMapper objectMapper() {
        return objectMapper;
    }
}
