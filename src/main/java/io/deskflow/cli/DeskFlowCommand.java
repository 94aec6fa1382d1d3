package io.deskflow.cli;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.deskflow.DeskFlowException;
import io.deskflow.config.DeskFlowConfig;
import io.deskflow.flow.FlowDocuments;
import io.deskflow.model.Flow;
import io.deskflow.model.RunRecord;
import io.deskflow.runtime.DeskFlowRuntime;
import io.deskflow.scheduler.CronScheduler;
import io.deskflow.scheduler.SystemEnvironmentSensor;
import io.deskflow.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "deskflow",
        mixinStandardHelpOptions = true,
        description = "DeskFlow desktop and web automation runtime",
        subcommands = {
                DeskFlowCommand.InitCommand.class,
                DeskFlowCommand.RunCommand.class,
                DeskFlowCommand.ActionsCommand.class,
                DeskFlowCommand.FlowViewCommand.class,
                DeskFlowCommand.FlowEditCommand.class,
                DeskFlowCommand.FlowPublishCommand.class,
                DeskFlowCommand.FlowApproveCommand.class,
                DeskFlowCommand.ScheduleCommand.class,
                DeskFlowCommand.StatsCommand.class,
                DeskFlowCommand.ServeWebCommand.class,
                DeskFlowCommand.LockStatusCommand.class,
                DeskFlowCommand.LockClearCommand.class
        }
)
public final class DeskFlowCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | run | actions | flow-view | flow-edit | flow-publish | flow-approve | schedule | stats | serve-web | lock-status | lock-clear");
    }

    DeskFlowRuntime runtime() {
        DeskFlowConfig config = DeskFlowConfig.fromRoot(root);
        // Read by logback.xml for the file appender; set before the first logger exists.
        System.setProperty("deskflow.logDir", config.logsRoot().toString());
        DeskFlowRuntime runtime = new DeskFlowRuntime(config);
        runtime.init();
        return runtime;
    }

    static int error(DeskFlowException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.reason());
        body.put("message", e.getMessage());
        System.out.println(Jsons.toJson(body));
        return 1;
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        DeskFlowCommand parent;

        @Override
        public Integer call() {
            DeskFlowRuntime runtime = parent.runtime();
            System.out.println("Initialized DeskFlow at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "run", description = "Run a flow by stored name or flow document path")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        DeskFlowCommand parent;

        @Parameters(index = "0", description = "Flow name or path to a flow .json file")
        String flow;

        @Option(names = {"--role"}, description = "Actor role checked against the flow's run roles")
        String role;

        @Option(names = {"--var"}, description = "Initial variable as key=value (repeatable)")
        List<String> vars = new ArrayList<>();

        @Override
        public Integer call() {
            DeskFlowRuntime runtime = parent.runtime();
            try {
                RunRecord record = runtime.run(flow, parseVars(vars), role);
                System.out.println(Jsons.toJson(record));
                return record.succeeded() ? 0 : 2;
            } catch (DeskFlowException e) {
                return error(e);
            }
        }
    }

    @Command(name = "actions", description = "List registered actions by category")
    static final class ActionsCommand implements Callable<Integer> {
        @ParentCommand
        DeskFlowCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().registry().listActions()));
            return 0;
        }
    }

    @Command(name = "flow-view", description = "Print a flow document")
    static final class FlowViewCommand implements Callable<Integer> {
        @ParentCommand
        DeskFlowCommand parent;

        @Parameters(index = "0", description = "Flow name or path")
        String flow;

        @Option(names = {"--role"}, description = "Actor role")
        String role;

        @Override
        public Integer call() {
            DeskFlowRuntime runtime = parent.runtime();
            try {
                Flow viewed = runtime.runner().viewFlow(runtime.loadFlow(flow), role);
                System.out.println(FlowDocuments.toJson(viewed));
                return 0;
            } catch (DeskFlowException e) {
                return error(e);
            }
        }
    }

    @Command(name = "flow-edit", description = "Edit flow metadata and save the working copy")
    static final class FlowEditCommand implements Callable<Integer> {
        @ParentCommand
        DeskFlowCommand parent;

        @Parameters(index = "0", description = "Flow name or path")
        String flow;

        @Option(names = {"--role"}, description = "Actor role")
        String role;

        @Option(names = {"--set-desc"}, required = true, description = "New flow description")
        String description;

        @Override
        public Integer call() {
            DeskFlowRuntime runtime = parent.runtime();
            try {
                Flow edited = runtime.runner().editFlow(runtime.loadFlow(flow), role, f -> f.withDescription(description));
                System.out.println(Jsons.toJson(runtime.flowStore().describe(edited.name())));
                return 0;
            } catch (DeskFlowException e) {
                return error(e);
            }
        }
    }

    @Command(name = "flow-publish", description = "Copy the working flow into the published area")
    static final class FlowPublishCommand implements Callable<Integer> {
        @ParentCommand
        DeskFlowCommand parent;

        @Parameters(index = "0", description = "Flow name or path")
        String flow;

        @Option(names = {"--role"}, description = "Actor role")
        String role;

        @Override
        public Integer call() {
            DeskFlowRuntime runtime = parent.runtime();
            try {
                Path published = runtime.runner().publishFlow(runtime.loadFlow(flow), role);
                System.out.println(Jsons.toJson(Map.of("published", published.toString())));
                return 0;
            } catch (DeskFlowException e) {
                return error(e);
            }
        }
    }

    @Command(name = "flow-approve", description = "Record an approval of the flow's current version")
    static final class FlowApproveCommand implements Callable<Integer> {
        @ParentCommand
        DeskFlowCommand parent;

        @Parameters(index = "0", description = "Flow name or path")
        String flow;

        @Option(names = {"--role"}, description = "Actor role")
        String role;

        @Override
        public Integer call() {
            DeskFlowRuntime runtime = parent.runtime();
            try {
                System.out.println(Jsons.toJson(runtime.runner().approveFlow(runtime.loadFlow(flow), role)));
                return 0;
            } catch (DeskFlowException e) {
                return error(e);
            }
        }
    }

    @Command(name = "schedule", description = "Run the cron loop for jobs configured in settings")
    static final class ScheduleCommand implements Callable<Integer> {
        @ParentCommand
        DeskFlowCommand parent;

        @Override
        public Integer call() throws Exception {
            DeskFlowRuntime runtime = parent.runtime();
            CronScheduler scheduler = runtime.buildScheduler(new SystemEnvironmentSensor());
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                scheduler.stop();
                stopped.countDown();
            }, "deskflow-shutdown-hook"));
            scheduler.start();
            System.out.println(Jsons.toJson(scheduler.jobs()));
            stopped.await();
            return 0;
        }
    }

    @Command(name = "stats", description = "Print run statistics")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        DeskFlowCommand parent;

        @Option(names = {"--format"}, defaultValue = "json", description = "Output format: json|html|prometheus")
        String format;

        @Override
        public Integer call() {
            DeskFlowRuntime runtime = parent.runtime();
            switch (format.toLowerCase(Locale.ROOT)) {
                case "json" -> System.out.println(Jsons.toJson(runtime.stats()));
                case "html" -> System.out.println(runtime.statsHtml());
                case "prometheus" -> System.out.print(runtime.metricsText());
                default -> {
                    System.out.println("{\"error\":\"unsupported format\"}");
                    return 1;
                }
            }
            return 0;
        }
    }

    @Command(name = "serve-web", description = "Serve jobs, flows, actions and statistics over HTTP")
    static final class ServeWebCommand implements Callable<Integer> {
        @ParentCommand
        DeskFlowCommand parent;

        @Option(names = {"--port"}, defaultValue = "8080", description = "Bind port")
        int port;

        @Option(names = {"--with-scheduler"}, defaultValue = "false",
                description = "Also run the configured jobs in this process")
        boolean withScheduler;

        @Override
        public Integer call() throws Exception {
            DeskFlowRuntime runtime = parent.runtime();
            CronScheduler scheduler = runtime.buildScheduler(new SystemEnvironmentSensor());
            if (withScheduler) {
                scheduler.start();
            }
            HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/api/jobs", exchange -> writeJson(exchange, scheduler.jobs(), 200));
            server.createContext("/api/flows", exchange -> {
                List<Map<String, Object>> flows = new ArrayList<>();
                for (String name : runtime.flowStore().list()) {
                    flows.add(runtime.flowStore().describe(name));
                }
                writeJson(exchange, flows, 200);
            });
            server.createContext("/api/actions", exchange -> writeJson(exchange, runtime.registry().listActions(), 200));
            server.createContext("/api/stats", exchange -> {
                String fmt = parseQuery(exchange.getRequestURI()).getOrDefault("format", "json");
                if ("html".equalsIgnoreCase(fmt)) {
                    writeText(exchange, runtime.statsHtml(), "text/html; charset=utf-8");
                } else if ("json".equalsIgnoreCase(fmt)) {
                    writeJson(exchange, runtime.stats(), 200);
                } else {
                    writeJson(exchange, Map.of("error", "unsupported_format", "format", fmt), 400);
                }
            });
            server.createContext("/metrics", exchange ->
                    writeText(exchange, runtime.metricsText(), "text/plain; version=0.0.4; charset=utf-8"));
            server.setExecutor(null);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                server.stop(0);
                scheduler.stop();
            }, "deskflow-web-shutdown"));
            server.start();
            System.out.println("Web server listening on http://127.0.0.1:" + port);
            Thread.currentThread().join();
            return 0;
        }
    }

    @Command(name = "lock-status", description = "Show run and job lock markers")
    static final class LockStatusCommand implements Callable<Integer> {
        @ParentCommand
        DeskFlowCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().lockStatus()));
            return 0;
        }
    }

    @Command(name = "lock-clear", description = "Remove a leftover lock marker")
    static final class LockClearCommand implements Callable<Integer> {
        @ParentCommand
        DeskFlowCommand parent;

        @Option(names = {"--path"}, description = "Lock marker path (defaults to the run lock)")
        String path;

        @Option(names = {"--force"}, defaultValue = "false", description = "Remove regardless of age")
        boolean force;

        @Option(names = {"--min-age-ms"}, defaultValue = "60000", description = "Minimum age without --force")
        long minAgeMs;

        @Override
        public Integer call() {
            DeskFlowRuntime runtime = parent.runtime();
            Path target = path == null || path.isBlank() ? runtime.config().runLockFile() : Path.of(path);
            boolean cleared = runtime.clearLock(target, force, minAgeMs);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("path", target.toString());
            out.put("cleared", cleared);
            System.out.println(Jsons.toJson(out));
            return cleared ? 0 : 1;
        }
    }

    static Map<String, Object> parseVars(List<String> raw) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (raw == null) {
            return out;
        }
        for (String pair : raw) {
            int idx = pair.indexOf('=');
            if (idx <= 0) {
                throw new DeskFlowException("invalid_params", "Expected key=value, got: " + pair);
            }
            out.put(pair.substring(0, idx).trim(), pair.substring(idx + 1));
        }
        return out;
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static void writeText(HttpExchange exchange, String body, String contentType) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static Map<String, String> parseQuery(URI uri) {
        Map<String, String> out = new LinkedHashMap<>();
        String query = uri.getRawQuery();
        if (query == null || query.isBlank()) {
            return out;
        }
        for (String pair : query.split("&")) {
            if (pair.isBlank()) {
                continue;
            }
            int idx = pair.indexOf('=');
            if (idx < 0) {
                out.put(URLDecoder.decode(pair, StandardCharsets.UTF_8), "");
            } else {
                out.put(URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8),
                        URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8));
            }
        }
        return out;
    }
}
