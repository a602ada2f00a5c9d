package fr.lapetina.airouting.integration;

import fr.lapetina.airouting.RoutingMonitor;
import fr.lapetina.airouting.infrastructure.time.ManualTimeSource;

import java.util.Random;

/**
 * Test extension of RoutingMonitor running on a manual clock and a seeded random source.
 */
public final class TestRoutingMonitor extends RoutingMonitor {

    private final ManualTimeSource time;

    private TestRoutingMonitor(String configPath, ManualTimeSource time) {
        super(configPath, time, new Random(42));
        this.time = time;
    }

    /**
     * Creates a started monitor from the default test configuration.
     */
    public static TestRoutingMonitor create() {
        return create("test-config.yaml");
    }

    /**
     * Creates a started monitor from a custom configuration path.
     */
    public static TestRoutingMonitor create(String configPath) {
        TestRoutingMonitor monitor = new TestRoutingMonitor(configPath, new ManualTimeSource());
        monitor.start();
        return monitor;
    }

    public ManualTimeSource getTime() {
        return time;
    }
}
