package com.questrail.plcsim.protocol.telegram.runtime;

import com.questrail.plcsim.api.SimulatorEvent;
import com.questrail.plcsim.log.TelegramLog;
import com.questrail.plcsim.log.TsvLogExporter;
import com.questrail.plcsim.protocol.telegram.config.SimulatorConfig;
import com.questrail.plcsim.protocol.telegram.internal.time.SystemWallClock;
import com.questrail.plcsim.protocol.telegram.observability.Slf4jObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.concurrent.CountDownLatch;

/**
 * Headless entry point.
 *
 * <pre>
 *   java ... PlcSimLauncher host port [deviceId hostId]
 * </pre>
 *
 * <p>System properties:</p>
 * <ul>
 *   <li>{@code plcsim.autoLife}: auto-life interval in seconds; absent or 0 disables it</li>
 *   <li>{@code plcsim.autoConfirm}: {@code false} turns auto-confirm off</li>
 *   <li>{@code plcsim.exportDir}: if set, the telegram log is exported there on exit</li>
 * </ul>
 *
 * <p>Runs until the process is interrupted.</p>
 */
public final class PlcSimLauncher {
    private static final Logger log = LoggerFactory.getLogger(PlcSimLauncher.class);

    private PlcSimLauncher() {}

    public static void main(String[] args) throws InterruptedException {
        if (args.length != 2 && args.length != 4) {
            System.err.println("usage: PlcSimLauncher host port [deviceId hostId]");
            System.exit(2);
            return;
        }

        SimulatorConfig config = configure(args);
        PlcSimRuntime runtime = PlcSimRuntime.builder()
                .withConfig(config)
                .withObservabilitySink(new Slf4jObservabilitySink())
                .build();

        TelegramLog telegramLog = new TelegramLog();
        runtime.addListener(telegramLog);
        runtime.addListener(PlcSimLauncher::logEvent);

        CountDownLatch done = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            runtime.stop();
            exportIfRequested(telegramLog);
            done.countDown();
        }, "plcsim-shutdown"));

        runtime.start();
        runtime.connect(args[0], args[1]);
        done.await();
    }

    static SimulatorConfig configure(String[] args) {
        SimulatorConfig.Builder builder = SimulatorConfig.builder();
        if (args.length == 4) {
            builder.withDeviceId(args[2]).withHostId(args[3]);
        }

        long autoLifeSeconds = Long.getLong("plcsim.autoLife", 0L);
        if (autoLifeSeconds > 0) {
            builder.withAutoLife(true, Duration.ofSeconds(autoLifeSeconds));
        }
        if ("false".equalsIgnoreCase(System.getProperty("plcsim.autoConfirm"))) {
            builder.withAutoConfirm(false);
        }
        return builder.build();
    }

    private static void logEvent(SimulatorEvent event) {
        if (event instanceof SimulatorEvent.StatusChanged s) {
            log.info("Status: {}", s.status());
        }
        else if (event instanceof SimulatorEvent.TelegramReceived rx) {
            log.info("RX {} seq={} from {}: {}{}", rx.telegram().type().label(), rx.telegram().sequence(),
                    rx.telegram().source(), rx.telegram().payloadSummary(60), rx.recovered() ? " (recovered)" : "");
        }
        else if (event instanceof SimulatorEvent.TelegramSent tx) {
            log.info("TX {} seq={} to {}: {}", tx.telegram().type().label(), tx.telegram().sequence(),
                    tx.telegram().destination(), tx.telegram().payloadSummary(60));
        }
        else if (event instanceof SimulatorEvent.ErrorReported e) {
            log.warn("{}: {}", e.kind(), e.message());
        }
    }

    private static void exportIfRequested(TelegramLog telegramLog) {
        String dir = System.getProperty("plcsim.exportDir");
        if (dir == null || dir.isBlank()) {
            return;
        }
        TsvLogExporter exporter = new TsvLogExporter(SystemWallClock.INSTANCE, ZoneId.systemDefault());
        try {
            exporter.exportTo(telegramLog.snapshot(), Path.of(dir))
                    .ifPresentOrElse(
                            p -> log.info("Exported {} entries to {}", telegramLog.size(), p),
                            () -> log.info("Telegram log empty; nothing exported"));
        } catch (IOException e) {
            log.error("Export to {} failed", dir, e);
        }
    }
}
