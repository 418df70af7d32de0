package cz.vut.fit.resolverradar.analyzer;

import com.google.common.base.Ticker;
import cz.vut.fit.resolverradar.AnalyzerConfig;
import cz.vut.fit.resolverradar.analyzer.checks.CacheTtlProber;
import cz.vut.fit.resolverradar.analyzer.checks.TracerouteProbe;
import cz.vut.fit.resolverradar.analyzer.discovery.ResolverDiscovery;
import cz.vut.fit.resolverradar.analyzer.discovery.ResolverListLoader;
import cz.vut.fit.resolverradar.analyzer.discovery.SystemResolverDiscovery;
import cz.vut.fit.resolverradar.analyzer.host.SystemHostIdentity;
import cz.vut.fit.resolverradar.analyzer.probe.ProbeEngine;
import cz.vut.fit.resolverradar.analyzer.probe.UdpDnsTransport;
import cz.vut.fit.resolverradar.analyzer.storage.ResultStoreFactory;
import cz.vut.fit.resolverradar.analyzer.whois.CachedWhoisLookup;
import cz.vut.fit.resolverradar.analyzer.whois.RdapWhoisClient;
import org.apache.commons.cli.*;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The command-line entry point of the resolver analyzer.
 * <p>
 * Runs one analysis cycle over the resolvers from the input file, or repeats it with a fixed interval.
 * With {@code --whois-batch}, it only fills in the missing WHOIS data of already analyzed resolvers.
 */
public class AnalyzerRunner {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(AnalyzerRunner.class);

    public static final int EXIT_ARGUMENTS = 1;
    public static final int EXIT_CONFIGURATION = 2;
    public static final int EXIT_RESOLVER_LIST = 3;
    public static final int EXIT_INTERRUPTED = 130;

    private static final long SHUTDOWN_GRACE_MS = 5000;

    public static void main(String[] args) {
        final var options = makeOptions();
        final var cmd = parseCommandLine(args, options);
        if (cmd == null) return;

        final var properties = initProperties(cmd);
        if (properties == null) return;

        final AnalyzerSettings settings;
        final ResultStoreFactory storeFactory;
        try {
            settings = AnalyzerSettings.fromProperties(properties);
            storeFactory = ResultStoreFactory.fromSettings(settings);
        } catch (IllegalArgumentException e) {
            // Also covers NumberFormatException
            Logger.error("Invalid configuration: {}", e.getMessage());
            System.exit(EXIT_CONFIGURATION);
            return;
        }

        // Turn Ctrl-C into an interrupt of the analysis
        final var mainThread = Thread.currentThread();
        final var shuttingDown = new AtomicBoolean(false);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            shuttingDown.set(true);
            mainThread.interrupt();
            try {
                mainThread.join(SHUTDOWN_GRACE_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "system-shutdown-hook"));

        final var whois = new CachedWhoisLookup(new RdapWhoisClient(settings), settings);

        try {
            if (cmd.hasOption("whois-batch")) {
                runWhoisBatch(cmd, options, whois, storeFactory);
                return;
            }

            final var input = cmd.getOptionValue("input");
            if (input == null) {
                System.err.println("Missing required option: i");
                printHelpAndExit(options, EXIT_ARGUMENTS);
                return;
            }

            final List<String> resolvers;
            try {
                resolvers = ResolverListLoader.load(Path.of(input));
            } catch (IOException e) {
                Logger.error("Cannot load the resolver list: {}", e.getMessage());
                System.exit(EXIT_RESOLVER_LIST);
                return;
            }

            final var cycle = makeCycle(settings, storeFactory, whois);
            final var interval = parseSeconds(cmd, "loop", options);
            var cycleNumber = 1;
            while (true) {
                Logger.info("Starting cycle {}", cycleNumber);
                cycle.run(resolvers);

                if (interval == null || interval.isZero())
                    break;

                Logger.info("Next cycle in {} s", interval.toSeconds());
                Pacer.SLEEP.pause(interval);
                cycleNumber++;
            }
        } catch (InterruptedException e) {
            Logger.warn("Interrupted, exiting");
            // While the JVM is shutting down, System.exit would block
            if (!shuttingDown.get()) {
                System.exit(EXIT_INTERRUPTED);
            }
        }
    }

    /**
     * Creates the analysis cycle and all its collaborators.
     */
    static @NotNull AnalysisCycle makeCycle(@NotNull AnalyzerSettings settings,
                                            @NotNull ResultStoreFactory storeFactory,
                                            @NotNull CachedWhoisLookup whois) {
        final var engine = new ProbeEngine(new UdpDnsTransport(), settings);
        final var cacheTtlProber = new CacheTtlProber(engine, settings, Pacer.SLEEP);
        final var traceroute = settings.tracerouteEnabled() ? new TracerouteProbe(settings) : null;
        final var analyzer = new ResolverAnalyzer(engine, cacheTtlProber, traceroute, settings, settings.clock());
        final var discovery = settings.discoveryEnabled()
                ? new SystemResolverDiscovery()
                : ResolverDiscovery.none();

        return new AnalysisCycle(analyzer, storeFactory, whois, discovery, new SystemHostIdentity(settings),
                settings, Pacer.SLEEP, Ticker.systemTicker());
    }

    private static void runWhoisBatch(CommandLine cmd, Options options, CachedWhoisLookup whois,
                                      ResultStoreFactory storeFactory) throws InterruptedException {
        final int limit;
        try {
            limit = Integer.parseInt(cmd.getOptionValue("whois-batch"));
        } catch (NumberFormatException e) {
            System.err.println("Invalid batch size: " + cmd.getOptionValue("whois-batch"));
            printHelpAndExit(options, EXIT_ARGUMENTS);
            return;
        }

        try (var store = storeFactory.open()) {
            whois.backfill(store, limit);
        } catch (IOException e) {
            Logger.error("WHOIS backfill failed", e);
            System.exit(EXIT_CONFIGURATION);
        }
    }

    private static @Nullable Duration parseSeconds(CommandLine cmd, String option, Options options) {
        final var value = cmd.getOptionValue(option);
        if (value == null)
            return null;

        try {
            final var seconds = Double.parseDouble(value);
            if (seconds < 0)
                throw new NumberFormatException("negative");

            return Duration.ofMillis(Math.round(seconds * 1000));
        } catch (NumberFormatException e) {
            System.err.println("Invalid number of seconds for --" + option + ": " + value);
            printHelpAndExit(options, EXIT_ARGUMENTS);
            return null;
        }
    }

    /**
     * Parses the command line arguments.
     *
     * @return The parsed CommandLine instance, or null if parsing fails or help is requested.
     */
    @Nullable
    private static CommandLine parseCommandLine(String[] args, Options options) {
        final var parser = new DefaultParser();

        CommandLine cmd;
        try {
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            if (Arrays.stream(args).anyMatch(arg -> arg.equals("-h") || arg.equals("--help"))) {
                printHelpAndExit(options, 0);
                return null;
            }

            System.err.println(e.getMessage());
            printHelpAndExit(options, EXIT_ARGUMENTS);
            return null;
        }

        if (cmd.hasOption("h")) {
            printHelpAndExit(options, 0);
            return null;
        }
        return cmd;
    }

    @NotNull
    static Options makeOptions() {
        final var options = new Options();
        options.addOption("h", "help", false, "Print this help message");

        options.addOption(Option.builder("i")
                .longOpt("input")
                .desc("Path to the JSON file with the resolvers to analyze")
                .argName("file")
                .hasArg()
                .build());
        options.addOption(Option.builder("d")
                .longOpt("delay")
                .desc("Pause between two resolvers (seconds, default 0.1)")
                .argName("seconds")
                .hasArg()
                .build());
        options.addOption(Option.builder("l")
                .longOpt("loop")
                .desc("Repeat the analysis with this interval (seconds); run once if not set")
                .argName("seconds")
                .hasArg()
                .build());
        options.addOption(Option.builder()
                .longOpt("whois-batch")
                .desc("Only look up the missing WHOIS data for up to n analyzed resolvers")
                .argName("n")
                .hasArg()
                .build());
        options.addOption(Option.builder("p")
                .longOpt("properties")
                .desc("Path to a configuration file")
                .argName("path")
                .hasArg()
                .build());
        options.addOption(Option.builder("o")
                .longOpt("option")
                .desc("A properties key/value to add to the configuration")
                .argName("key=value")
                .hasArg()
                .build());

        return options;
    }

    /**
     * Initializes the properties from the file, the --option values and the --delay passed in the command line.
     *
     * @return The initialized Properties instance, or null if the file cannot be read.
     */
    @Nullable
    static Properties initProperties(CommandLine cmd) {
        final Properties props = new Properties();

        if (cmd.hasOption("properties")) {
            var path = cmd.getOptionValue("properties");
            try (var inStream = new FileInputStream(path)) {
                props.load(inStream);
            } catch (IOException e) {
                Logger.error("Failed to load properties: {}", e.getMessage());
                System.exit(EXIT_CONFIGURATION);
                return null;
            }
        }

        var cmdLineProperties = cmd.getOptionValues("option");
        if (cmdLineProperties != null) {
            for (var option : cmdLineProperties) {
                if (option.contains("=")) {
                    var parts = option.split("=", 2);
                    props.put(parts[0].trim(), parts[1]);
                } else {
                    Logger.warn("Ignoring invalid command-line option: {}", option);
                }
            }
        }

        final var delay = cmd.getOptionValue("delay");
        if (delay != null) {
            try {
                final var millis = Math.round(Double.parseDouble(delay) * 1000);
                props.put(AnalyzerConfig.RESOLVER_DELAY_MS_CONFIG, Long.toString(Math.max(0, millis)));
            } catch (NumberFormatException e) {
                Logger.error("Invalid delay: {}", delay);
                System.exit(EXIT_ARGUMENTS);
                return null;
            }
        }

        return props;
    }

    private static void printHelpAndExit(Options options, int exitCode) {
        final var formatter = new HelpFormatter();
        formatter.printHelp(119,
                "dns-analyzer -i <resolvers.json> [options]",
                "", options, "");
        System.exit(exitCode);
    }
}
