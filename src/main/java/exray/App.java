package exray;

import exray.bridge.config.BridgeConfig;
import exray.bridge.server.BridgeNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.CountDownLatch;

/**
 * Bridge entry point.
 *
 * Usage: {@code java -jar exray-bridge.jar [config.ini]}. Without an argument
 * {@code exray.ini} in the working directory is used when present.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws Exception {
        Path iniFile = args.length > 0 ? Paths.get(args[0]) : Paths.get("exray.ini");
        BridgeConfig config = BridgeConfig.load(iniFile);
        int port = config.serverPort();

        log.info("Starting bridge on port {}...", port);
        if (!BridgeNettyServer.start(port, config)) {
            log.error("Bridge did not start");
            System.exit(1);
        }

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Application closing, stopping server...");
            BridgeNettyServer.stop();
            shutdown.countDown();
        }, "exray-shutdown"));
        shutdown.await();
    }
}
