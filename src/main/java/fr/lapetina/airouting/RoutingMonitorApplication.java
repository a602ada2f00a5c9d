package fr.lapetina.airouting;

import fr.lapetina.airouting.api.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the AI provider router.
 */
public class RoutingMonitorApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RoutingMonitorApplication.class);

    private final RoutingMonitor monitor;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public RoutingMonitorApplication(String configPath) throws Exception {
        log.info("Starting AI provider router...");

        this.monitor = RoutingMonitor.create(configPath).start();
        this.httpServer = new HttpServer(monitor.getConfig().getServer(), monitor);

        log.info("AI provider router initialized");
    }

    public void start() {
        httpServer.start();
        log.info("AI provider router started on port {}", httpServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public RoutingMonitor getMonitor() {
        return monitor;
    }

    @Override
    public void close() {
        log.info("Shutting down AI provider router...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            monitor.close();
        } catch (Exception e) {
            log.warn("Error closing routing monitor", e);
        }

        log.info("AI provider router shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            RoutingMonitorApplication app = new RoutingMonitorApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start AI provider router", e);
            System.exit(1);
        }
    }
}
