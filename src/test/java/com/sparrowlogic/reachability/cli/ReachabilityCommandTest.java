package com.sparrowlogic.reachability.cli;

import com.sparrowlogic.reachability.config.ReachabilityProperties;
import com.sparrowlogic.reachability.exception.CidrParseException;
import com.sparrowlogic.reachability.exception.ResourceLookupException;
import com.sparrowlogic.reachability.model.ConnectivityReport;
import com.sparrowlogic.reachability.model.Evaluation;
import com.sparrowlogic.reachability.model.ResourceDescriptor;
import com.sparrowlogic.reachability.service.ConnectivityCheckService;
import com.sparrowlogic.reachability.service.ResourceLookupFacade;
import com.sparrowlogic.reachability.service.ResourceLookupFacade.SourceType;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ReachabilityCommandTest {

    private final ResourceLookupFacade lookups = mock(ResourceLookupFacade.class);
    private final ConnectivityCheckService checkService = mock(ConnectivityCheckService.class);
    private final ReachabilityProperties properties =
        new ReachabilityProperties(new ReachabilityProperties.Aws(null, "us-east-1"), 5432);
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final ReachabilityCommand command = new ReachabilityCommand(lookups, checkService, properties,
        new PrintStream(buffer, true, StandardCharsets.UTF_8));

    private final ResourceDescriptor source = new ResourceDescriptor("lambda", "orders-handler", "vpc-1",
        List.of("subnet-a"), List.of("sg-12345"), "172.31.0.0/20", null);
    private final ResourceDescriptor destination = new ResourceDescriptor("RDS", "orders-db", "vpc-1",
        List.of("subnet-b"), List.of("sg-67890"), "172.31.128.0/20", 5432);

    private ExitCode run(String... args) {
        return command.execute(new DefaultApplicationArguments(args));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void shouldExitZeroWhenReachable() {
        var evaluation = new Evaluation();
        evaluation.markSuccess("sg-67890 has group-based rule sgr-1 that allows sg-12345 on port 5432");
        when(lookups.lookupSource(SourceType.LAMBDA, "orders-handler")).thenReturn(source);
        when(lookups.lookupDatabase("orders-db")).thenReturn(destination);
        when(checkService.check(source, destination, 5432))
            .thenReturn(new ConnectivityReport(source, destination, 5432, true, evaluation));

        var exit = run("--fromLambda=orders-handler", "--toRDS=orders-db");

        assertEquals(ExitCode.SUCCESS, exit);
        assertTrue(output().contains("* in same VPC"));
        assertTrue(output().contains("* sg-67890 has group-based rule sgr-1 that allows sg-12345 on port 5432"));
    }

    @Test
    void shouldExitThreeWhenInconclusive() {
        var evaluation = new Evaluation();
        evaluation.addContext("sg-67890 has cidr-based rule sgr-2 that allows 172.31.0.0/20 but not on port 3306");
        when(lookups.lookupSource(SourceType.ECS, "prod:api")).thenReturn(source);
        when(lookups.lookupDatabase("orders-db")).thenReturn(destination);
        when(checkService.check(source, destination, 3306))
            .thenReturn(new ConnectivityReport(source, destination, 3306, true, evaluation));

        var exit = run("--fromECS=prod:api", "--toRDS=orders-db", "--port=3306");

        assertEquals(ExitCode.NOT_REACHABLE, exit);
        assertEquals(3, exit.code());
        assertTrue(output().contains("but not on port 3306"));
    }

    @Test
    void shouldExitThreeForDifferentVpcs() {
        when(lookups.lookupSource(SourceType.LAMBDA, "orders-handler")).thenReturn(source);
        when(lookups.lookupDatabase("orders-db")).thenReturn(destination);
        when(checkService.check(source, destination, 5432))
            .thenReturn(new ConnectivityReport(source, destination, 5432, false, null));

        var exit = run("--fromLambda=orders-handler", "--toRDS=orders-db");

        assertEquals(ExitCode.NOT_REACHABLE, exit);
        assertTrue(output().contains("* not in same VPC"));
        assertFalse(output().contains("checking security groups"));
    }

    @Test
    void shouldExitTwoOnLookupFailure() {
        when(lookups.lookupSource(SourceType.LAMBDA, "missing"))
            .thenThrow(new ResourceLookupException("unable to find Lambda function missing"));

        var exit = run("--fromLambda=missing", "--toRDS=orders-db");

        assertEquals(ExitCode.LOOKUP_FAILED, exit);
        assertTrue(output().contains("unable to find Lambda function missing"));
        verify(checkService, never()).check(any(), any(), anyInt());
    }

    @Test
    void shouldExitTwoWhenResourceAddressIsUnreadable() {
        when(lookups.lookupSource(SourceType.LAMBDA, "orders-handler"))
            .thenThrow(new CidrParseException("172.31.0.0/99", "prefix length out of range"));

        var exit = run("--fromLambda=orders-handler", "--toRDS=orders-db");

        assertEquals(ExitCode.LOOKUP_FAILED, exit);
        verifyNoInteractions(checkService);
    }

    @Test
    void shouldRejectPortOutsideValidRange() {
        assertEquals(ExitCode.INVALID_ARGS, run("--fromLambda=a", "--toRDS=orders-db", "--port=70000"));
        assertEquals(ExitCode.INVALID_ARGS, run("--fromLambda=a", "--toRDS=orders-db", "--port=-5"));
        assertTrue(output().contains("invalid port: 70000 is outside 0-65535"));
        verifyNoInteractions(lookups);
    }

    @Test
    void shouldRejectMissingOrConflictingSources() {
        assertEquals(ExitCode.INVALID_ARGS, run("--toRDS=orders-db"));
        assertEquals(ExitCode.INVALID_ARGS, run("--fromLambda=a", "--fromECS=b", "--toRDS=orders-db"));
        assertEquals(ExitCode.INVALID_ARGS, run("--fromLambda=a"));
        assertEquals(ExitCode.INVALID_ARGS, run("--fromLambda=a", "--toRDS=orders-db", "--port=pg"));
        verifyNoInteractions(lookups);
    }

    @Test
    void shouldDetectCommandLineInvocation() {
        assertTrue(ReachabilityCommand.isCommandLineInvocation(new String[] {"--toRDS=orders-db"}));
        assertFalse(ReachabilityCommand.isCommandLineInvocation(new String[] {"--server.port=9090"}));
        assertFalse(ReachabilityCommand.isCommandLineInvocation(new String[0]));
    }
}
