////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.jspls;

import org.eclipse.lsp4j.*;
import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.services.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.jspls.config.FormatSettings;
import com.tomaszrup.jspls.formatter.TagVocabulary;

import java.io.*;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.*;
import java.util.concurrent.Future;
import java.util.logging.Level;

public class JspLanguageServer implements LanguageServer, LanguageClientAware {

    private static final Logger logger = LoggerFactory.getLogger(JspLanguageServer.class);

    static final String SERVER_NAME = "JSP Language Server";
    static final int DEFAULT_TCP_PORT = 5008;

    public static void main(String[] args) throws IOException {
        // Log anything that escapes a thread instead of letting the process die
        // silently; the client only sees a broken pipe.
        Thread.setDefaultUncaughtExceptionHandler((thread, throwable) -> {
            System.err.println("[FATAL] Uncaught exception on thread " + thread.getName());
            throwable.printStackTrace(System.err);
            logger.error("Uncaught exception on thread {}: {}",
                    thread.getName(), throwable.getMessage(), throwable);
        });

        // "Unmatched cancel notification" warnings are expected when a
        // formatting request finishes before the client cancels it.
        java.util.logging.Logger.getLogger("org.eclipse.lsp4j.jsonrpc.RemoteEndpoint")
                .setLevel(Level.SEVERE);
        if (args.length > 0 && "--tcp".equals(args[0])) {
            int port = DEFAULT_TCP_PORT;
            if (args.length > 1) {
                try {
                    port = Integer.parseInt(args[1]);
                } catch (NumberFormatException e) {
                    logger.error("Invalid port number: {}", args[1]);
                    System.exit(1);
                }
            }

            try (ServerSocket serverSocket = new ServerSocket(port, 50, InetAddress.getLoopbackAddress())) {
                logger.info("{} listening on port {} (localhost only)", SERVER_NAME, port);
                try (Socket socket = serverSocket.accept()) {
                    logger.info("Client connected.");
                    startServer(socket.getInputStream(), socket.getOutputStream());
                }
            }
        } else {
            logger.info("{} starting in stdio mode.", SERVER_NAME);
            startServer(System.in, System.out);
        }
    }

    private static void startServer(InputStream in, OutputStream out) {
        // stdout carries JSON-RPC; stray prints must not corrupt it
        System.setOut(new PrintStream(System.err));

        JspLanguageServer server = new JspLanguageServer();
        Launcher<LanguageClient> launcher = Launcher.createLauncher(server, LanguageClient.class, in, out);
        server.connect(launcher.getRemoteProxy());

        // Keep the main thread alive until the connection closes.
        Future<Void> future = launcher.startListening();
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Language server listener interrupted");
        } catch (ExecutionException e) {
            logger.error("Language server listener terminated with error: {}",
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), e);
        }
    }

    private final JspServices jspServices;
    private volatile LanguageClient client;

    public JspLanguageServer() {
        this(new JspServices());
    }

    JspLanguageServer(JspServices jspServices) {
        this.jspServices = jspServices;
    }

    @Override
    public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
        // Apply log level before any other processing so all subsequent
        // log messages respect the configured level.
        InitializationOptionsParser.ParsedOptions options =
                InitializationOptionsParser.parse(params.getInitializationOptions());
        if (options != null && options.formatSettings != null) {
            jspServices.setFormatSettings(options.formatSettings);
        }
        FormatSettings settings = jspServices.getFormatSettings();

        ServerCapabilities serverCapabilities = new ServerCapabilities();
        serverCapabilities.setTextDocumentSync(TextDocumentSyncKind.Incremental);
        serverCapabilities.setDocumentFormattingProvider(settings.isEnabled());
        serverCapabilities.setDocumentRangeFormattingProvider(settings.isEnabled());

        InitializeResult initializeResult = new InitializeResult(serverCapabilities);
        initializeResult.setServerInfo(new ServerInfo(SERVER_NAME, getVersion()));
        logger.info("Initialized for {} with {}", params.getClientInfo() != null
                ? params.getClientInfo().getName() : "unknown client", settings);
        return CompletableFuture.completedFuture(initializeResult);
    }

    @Override
    public void initialized(InitializedParams params) {
        logProgress(SERVER_NAME + " ready (tag vocabulary v" + TagVocabulary.VERSION + ")");
    }

    @Override
    public CompletableFuture<Object> shutdown() {
        logger.info("Shutdown requested");
        return CompletableFuture.completedFuture(new Object());
    }

    @Override
    public void exit() {
        System.exit(0);
    }

    @Override
    public TextDocumentService getTextDocumentService() {
        return jspServices;
    }

    @Override
    public WorkspaceService getWorkspaceService() {
        return jspServices;
    }

    @Override
    public void connect(LanguageClient client) {
        this.client = client;
        jspServices.connect(client);
    }

    /** Send a progress log message to the client (visible in output channel). */
    private void logProgress(String message) {
        logger.info(message);
        LanguageClient current = client;
        if (current != null) {
            current.logMessage(new MessageParams(MessageType.Info, message));
        }
    }

    static String getVersion() {
        String version = JspLanguageServer.class.getPackage().getImplementationVersion();
        return version != null ? version : "dev";
    }
}
