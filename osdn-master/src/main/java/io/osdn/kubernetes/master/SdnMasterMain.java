/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.osdn.kubernetes.master;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.ServiceLoader;
import java.util.function.IntSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpServer;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import io.prometheus.metrics.exporter.httpserver.MetricsHandler;

import io.osdn.kubernetes.master.config.ConfigParser;
import io.osdn.kubernetes.master.config.MasterNetworkConfig;
import io.osdn.kubernetes.master.management.HostPort;
import io.osdn.kubernetes.master.management.UnsupportedHttpMethodFilter;
import io.osdn.kubernetes.master.network.HostNetworks;
import io.osdn.tag.VisibleForTesting;

/**
 * The {@code main} method entrypoint for the SDN master
 */
public class SdnMasterMain {

    private static final Logger LOGGER = LoggerFactory.getLogger(SdnMasterMain.class);
    static final String CONFIG_VAR_NAME = "SDN_MASTER_CONFIG";
    private static final String BIND_ADDRESS_VAR_NAME = "BIND_ADDRESS";
    private static final int DEFAULT_MANAGEMENT_PORT = 8080;
    static final String HTTP_PATH_LIVEZ = "/livez";
    static final String HTTP_PATH_METRICS = "/metrics";

    private final KubernetesClient kubeClient;
    private final SdnMaster master;
    private final HttpServer managementServer;
    private volatile boolean bootstrapped;

    public SdnMasterMain() throws IOException {
        this(new KubernetesClientBuilder().build(), createHttpServer(), loadDownstreamBootstrapProvider(), HostNetworks.system());
    }

    @VisibleForTesting
    SdnMasterMain(KubernetesClient kubeClient,
                  HttpServer managementServer,
                  DownstreamBootstrapProvider downstream,
                  HostNetworks hostNetworks) {
        configurePrometheusMetrics(managementServer);
        this.kubeClient = kubeClient;
        this.managementServer = managementServer;
        this.master = new SdnMaster(kubeClient, hostNetworks, downstream);
    }

    public static void main(String[] args) {
        try {
            MasterNetworkConfig config = new ConfigParser().parseConfiguration(configPath(args, System.getenv()));
            SdnMasterMain main = new SdnMasterMain();
            Runtime.getRuntime().addShutdownHook(new Thread(main::stop, "sdn-master-shutdown"));
            main.start(config);
        }
        catch (Exception e) {
            LOGGER.error("SDN master has thrown exception during startup. Will now exit.", e);
            System.exit(1);
        }
    }

    /**
     * Starts the management server, then reconciles the cluster network and bootstraps the downstream
     * subsystems. Returns once that has completed successfully.
     */
    void start(MasterNetworkConfig config) {
        addHttpGetHandler("/", () -> 404);
        managementServer.start();
        addHttpGetHandler(HTTP_PATH_LIVEZ, this::livezStatusCode);
        Optional<ReconcileOutcome> outcome = master.start(config);
        if (outcome.isEmpty()) {
            LOGGER.info("Network plugin \"{}\" is not managed by the SDN master, stopping", config.networkPluginName());
            stop();
            return;
        }
        bootstrapped = true;
        LOGGER.atInfo().setMessage("SDN master started (cluster network reconciliation: {})")
                .addArgument(outcome::get)
                .log();
    }

    void stop() {
        managementServer.stop(0);
        kubeClient.close();
        LOGGER.info("SDN master stopped.");
    }

    @VisibleForTesting
    SdnMaster master() {
        return master;
    }

    private void addHttpGetHandler(
                                   String path,
                                   IntSupplier statusCodeSupplier) {
        managementServer.createContext(path, exchange -> {
            try (exchange) {
                exchange.sendResponseHeaders(statusCodeSupplier.getAsInt(), -1);
            }
        }).getFilters().add(UnsupportedHttpMethodFilter.INSTANCE);
    }

    @VisibleForTesting
    int livezStatusCode() {
        int sc = bootstrapped ? 200 : 503;
        (sc != 200 ? LOGGER.atWarn() : LOGGER.atDebug()).log("Responding {} to GET {}", sc, HTTP_PATH_LIVEZ);
        return sc;
    }

    private void configurePrometheusMetrics(HttpServer managementServer) {
        final PrometheusMeterRegistry prometheusMeterRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        final HttpContext metricsContext = managementServer.createContext(HTTP_PATH_METRICS,
                new MetricsHandler(prometheusMeterRegistry.getPrometheusRegistry()));
        metricsContext.getFilters().add(UnsupportedHttpMethodFilter.INSTANCE);
        Metrics.globalRegistry.add(prometheusMeterRegistry);
    }

    @VisibleForTesting
    static Path configPath(String[] args, Map<String, String> envVars) {
        if (args.length > 0) {
            return Path.of(args[0]);
        }
        String fromEnv = envVars.get(CONFIG_VAR_NAME);
        if (fromEnv == null || fromEnv.isBlank()) {
            throw new IllegalArgumentException("No configuration file given: pass its path as the first argument or set " + CONFIG_VAR_NAME);
        }
        return Path.of(fromEnv);
    }

    @VisibleForTesting
    static DownstreamBootstrapProvider loadDownstreamBootstrapProvider() {
        List<DownstreamBootstrapProvider> providers = ServiceLoader.load(DownstreamBootstrapProvider.class).stream()
                .map(ServiceLoader.Provider::get)
                .toList();
        if (providers.size() != 1) {
            throw new IllegalStateException("Expected exactly one " + DownstreamBootstrapProvider.class.getName() + " implementation, found "
                    + providers.stream().map(p -> p.getClass().getName()).toList());
        }
        return providers.get(0);
    }

    @VisibleForTesting
    static HttpServer createHttpServer() throws IOException {
        final Properties systemProps = System.getProperties();
        if (!systemProps.containsKey("sun.net.httpserver.maxReqTime")) {
            System.setProperty("sun.net.httpserver.maxReqTime", "60");
        }

        if (!systemProps.containsKey("sun.net.httpserver.maxRspTime")) {
            System.setProperty("sun.net.httpserver.maxRspTime", "120");
        }

        return HttpServer.create(getBindAddress(), 0);
    }

    @VisibleForTesting
    static InetSocketAddress getBindAddress() {
        final Map<String, String> envVars = System.getenv();
        final String bindAddress = envVars.getOrDefault(BIND_ADDRESS_VAR_NAME, "0.0.0.0:" + DEFAULT_MANAGEMENT_PORT);
        String bindToInterface;
        int bindToPort;
        if (bindAddress.contains(":")) {
            final HostPort parse = HostPort.parse(bindAddress);
            bindToInterface = parse.host();
            bindToPort = parse.port();
        }
        else if (!bindAddress.isEmpty()) {
            LOGGER.warn("{} env var is set but does not contain `:` assuming hostname only and binding to default port ({})",
                    BIND_ADDRESS_VAR_NAME,
                    DEFAULT_MANAGEMENT_PORT);
            bindToInterface = bindAddress;
            bindToPort = DEFAULT_MANAGEMENT_PORT;
        }
        else {
            bindToInterface = "0.0.0.0";
            bindToPort = DEFAULT_MANAGEMENT_PORT;
        }

        LOGGER.info("Starting management server on: {}:{}", bindToInterface, bindToPort);
        return new InetSocketAddress(bindToInterface, bindToPort);
    }
}
