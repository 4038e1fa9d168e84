package com.statusbridge.provisioner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.statusbridge.statuspage.CachetStatusPageClient;
import com.statusbridge.statuspage.StatusPageClient;
import com.statusbridge.statuspage.StatusPageClientSettings;
import com.statusbridge.statuspage.StatusPageException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Command-line entry point: reads the targets and groups files and provisions the status page.
 */
@Command(
        name = "statusbridge-provisioner",
        description = "Create status page components and groups from Prometheus target configuration",
        mixinStandardHelpOptions = true,
        version = "statusbridge-provisioner 1.0.0",
        exitCodeOnInvalidInput = ProvisionerCli.EXIT_INVALID_INPUT)
public class ProvisionerCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ProvisionerCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_INVALID_INPUT = 1;
    public static final int EXIT_BACKEND_FAILURE = 2;

    static class ModeOptions {

        @Option(names = "--reset",
                description = "Delete components and groups the configuration does not name, then create")
        boolean reset;

        @Option(names = "--just-delete", description = "Only delete every component and component group")
        boolean justDelete;

        @Option(names = "--just-create", description = "Only create missing components and groups (the default)")
        boolean justCreate;

        ProvisioningMode mode() {
            if (reset) {
                return ProvisioningMode.RESET;
            }
            return justDelete ? ProvisioningMode.DELETE_ALL : ProvisioningMode.SYNC;
        }
    }

    @Option(names = {"-f", "--file"}, required = true,
            description = "Prometheus YAML file with a prometheus_targets section")
    Path targetsFile;

    @Option(names = {"-g", "--groups"}, defaultValue = "config.json",
            description = "JSON file with the groups_configuration mapping (default: ${DEFAULT-VALUE})")
    Path groupsFile;

    @Option(names = "--api-url", defaultValue = "${env:STATUSPAGE_API_URL}",
            description = "Status page API root (default: $STATUSPAGE_API_URL)")
    String apiUrl;

    @Option(names = "--api-token", defaultValue = "${env:STATUSPAGE_API_TOKEN}",
            description = "Status page API token (default: $STATUSPAGE_API_TOKEN)")
    String apiToken;

    @Option(names = "--delay", defaultValue = "0",
            description = "Milliseconds to wait after each create or delete call (default: ${DEFAULT-VALUE})")
    long delayMillis;

    @ArgGroup(exclusive = true, multiplicity = "0..1")
    ModeOptions modeOptions;

    private final Function<StatusPageClientSettings, StatusPageClient> clientFactory;
    private final ObjectMapper objectMapper;

    public ProvisionerCli() {
        this(CachetStatusPageClient::create);
    }

    ProvisionerCli(Function<StatusPageClientSettings, StatusPageClient> clientFactory) {
        this.clientFactory = clientFactory;
        this.objectMapper = new ObjectMapper();
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new ProvisionerCli()).execute(args));
    }

    ProvisioningMode mode() {
        return modeOptions == null ? ProvisioningMode.SYNC : modeOptions.mode();
    }

    @Override
    public Integer call() {
        ProvisioningMode mode = mode();
        if (delayMillis < 0) {
            log.error("--delay must not be negative");
            return EXIT_INVALID_INPUT;
        }
        StatusPageClientSettings settings;
        try {
            settings = settings();
        } catch (IllegalArgumentException e) {
            log.error("Invalid status page connection settings: {}", e.getMessage());
            return EXIT_INVALID_INPUT;
        }

        ProvisioningPlan plan;
        try {
            plan = mode.creates() ? loadPlan() : ProvisioningPlan.of(List.of(), Map.of());
        } catch (InvalidProvisioningInputException e) {
            log.error(e.getMessage());
            return EXIT_INVALID_INPUT;
        }
        if (mode == ProvisioningMode.SYNC && plan.isEmpty()) {
            log.warn("No targets with status_page_alert enabled in {}; nothing to provision", targetsFile);
            return EXIT_OK;
        }

        log.info("Provisioning {} in {} mode", settings.baseUrl(), mode);
        try {
            ProvisioningReport report = new Provisioner(clientFactory.apply(settings), Duration.ofMillis(delayMillis))
                    .run(plan, mode);
            if (report.hasFailures()) {
                log.error("{} backend call(s) failed: {}", report.failures().size(), report.failures());
                return EXIT_BACKEND_FAILURE;
            }
            return EXIT_OK;
        } catch (StatusPageException e) {
            log.error("Status page call {} failed: {}", e.operation(), e.getMessage());
            return EXIT_BACKEND_FAILURE;
        }
    }

    private StatusPageClientSettings settings() {
        if (apiUrl == null || apiUrl.isBlank()) {
            throw new IllegalArgumentException("--api-url or STATUSPAGE_API_URL must be set");
        }
        if (apiToken == null || apiToken.isBlank()) {
            throw new IllegalArgumentException("--api-token or STATUSPAGE_API_TOKEN must be set");
        }
        return StatusPageClientSettings.of(URI.create(apiUrl.strip()), apiToken.strip());
    }

    private ProvisioningPlan loadPlan() {
        List<MonitoredTarget> targets = new PrometheusTargetsReader().read(targetsFile);
        Map<String, String> serviceToGroup = new GroupsConfigurationReader(objectMapper).read(groupsFile);
        log.info("Read {} target(s) from {} and {} service-to-group mapping(s) from {}",
                targets.size(), targetsFile, serviceToGroup.size(), groupsFile);
        return ProvisioningPlan.of(targets, serviceToGroup);
    }
}
