package com.sparrowlogic.reachability.cli;

import com.sparrowlogic.reachability.config.ReachabilityProperties;
import com.sparrowlogic.reachability.exception.CidrParseException;
import com.sparrowlogic.reachability.exception.ResourceLookupException;
import com.sparrowlogic.reachability.model.PortRange;
import com.sparrowlogic.reachability.model.ResourceDescriptor;
import com.sparrowlogic.reachability.service.ConnectivityCheckService;
import com.sparrowlogic.reachability.service.ResourceLookupFacade;
import com.sparrowlogic.reachability.service.ResourceLookupFacade.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;

import java.io.PrintStream;
import java.util.List;
import java.util.Set;

// --fromLambda=NAME|--fromECS=[CLUSTER:]SERVICE --toRDS=NAME [--port=PORT]
@Component
public class ReachabilityCommand implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ReachabilityCommand.class);

    static final String FROM_LAMBDA = "fromLambda";
    static final String FROM_ECS = "fromECS";
    static final String TO_RDS = "toRDS";
    static final String PORT = "port";

    private static final Set<String> OPTIONS = Set.of(FROM_LAMBDA, FROM_ECS, TO_RDS, PORT);

    private final ResourceLookupFacade lookups;
    private final ConnectivityCheckService checkService;
    private final ReachabilityProperties properties;
    private final PrintStream out;

    private ExitCode exitCode = ExitCode.SUCCESS;

    @Autowired
    public ReachabilityCommand(ResourceLookupFacade lookups, ConnectivityCheckService checkService,
                               ReachabilityProperties properties) {
        this(lookups, checkService, properties, System.out);
    }

    ReachabilityCommand(ResourceLookupFacade lookups, ConnectivityCheckService checkService,
                        ReachabilityProperties properties, PrintStream out) {
        this.lookups = lookups;
        this.checkService = checkService;
        this.properties = properties;
        this.out = out;
    }

    public static boolean isCommandLineInvocation(String[] args) {
        for (var arg : args) {
            for (var option : OPTIONS) {
                if (arg.equals("--" + option) || arg.startsWith("--" + option + "=")) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (OPTIONS.stream().noneMatch(args::containsOption)) {
            return;
        }
        exitCode = execute(args);
    }

    ExitCode execute(ApplicationArguments args) {
        var lambdaName = single(args, FROM_LAMBDA);
        var ecsName = single(args, FROM_ECS);
        var databaseName = single(args, TO_RDS);
        if ((lambdaName == null) == (ecsName == null) || databaseName == null) {
            out.println("usage: --fromLambda=NAME|--fromECS=[CLUSTER:]SERVICE --toRDS=NAME [--port=PORT]");
            return ExitCode.INVALID_ARGS;
        }

        int port;
        try {
            var portValue = single(args, PORT);
            port = portValue != null ? Integer.parseInt(portValue) : properties.defaultPort();
        } catch (NumberFormatException e) {
            out.println("invalid port: " + e.getMessage());
            return ExitCode.INVALID_ARGS;
        }
        if (!PortRange.all().contains(port)) {
            out.println("invalid port: " + port + " is outside 0-65535");
            return ExitCode.INVALID_ARGS;
        }

        out.println("loading service information");
        ResourceDescriptor source;
        ResourceDescriptor destination;
        try {
            source = lambdaName != null
                ? lookups.lookupSource(SourceType.LAMBDA, lambdaName)
                : lookups.lookupSource(SourceType.ECS, ecsName);
            destination = lookups.lookupDatabase(databaseName);
        } catch (ResourceLookupException | CidrParseException | SdkException e) {
            log.error("Resource lookup failed", e);
            out.println(e.getMessage());
            return ExitCode.LOOKUP_FAILED;
        }

        out.println("checking VPC connectivity");
        try {
            var report = checkService.check(source, destination, port);
            var lines = report.lines();
            out.println("* " + lines.get(0));
            if (report.sameVpc()) {
                out.println("checking security groups");
                print(lines.subList(1, lines.size()));
            }
            return report.reachable() ? ExitCode.SUCCESS : ExitCode.NOT_REACHABLE;
        } catch (ResourceLookupException | CidrParseException | SdkException e) {
            log.error("Security group check failed", e);
            out.println(e.getMessage());
            return ExitCode.LOOKUP_FAILED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode.code();
    }

    private void print(List<String> lines) {
        lines.forEach(line -> out.println("* " + line));
    }

    private static String single(ApplicationArguments args, String option) {
        var values = args.getOptionValues(option);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }
}
