package com.sparrowlogic.reachability.service;

import com.sparrowlogic.reachability.model.ConnectivityReport;
import com.sparrowlogic.reachability.model.ResourceDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ConnectivityCheckService {

    private static final Logger log = LoggerFactory.getLogger(ConnectivityCheckService.class);

    private final SecurityGroupLookupService securityGroupLookupService;
    private final ReachabilityEvaluator evaluator;

    public ConnectivityCheckService(SecurityGroupLookupService securityGroupLookupService,
                                    ReachabilityEvaluator evaluator) {
        this.securityGroupLookupService = securityGroupLookupService;
        this.evaluator = evaluator;
    }

    public ConnectivityReport check(ResourceDescriptor source, ResourceDescriptor destination, int port) {
        log.info("Checking {} -> {} port {}", source.displayName(), destination.displayName(), port);

        // Peering, transit gateways and NAT are not followed: different VPCs are unreachable.
        if (source.vpcId() == null || !source.vpcId().equals(destination.vpcId())) {
            log.warn("{} is in {} but {} is in {}", source.displayName(), source.vpcId(),
                destination.displayName(), destination.vpcId());
            return new ConnectivityReport(source, destination, port, false, null);
        }

        var sourceRules = securityGroupLookupService.lookup(source.securityGroupIds());
        var destinationRules = securityGroupLookupService.lookup(destination.securityGroupIds());
        var evaluation = evaluator.canConnect(source.cidr(), destination.cidr(), port, sourceRules, destinationRules);

        var report = new ConnectivityReport(source, destination, port, true, evaluation);
        log.info("Verdict for {} -> {} port {}: {}", source.displayName(), destination.displayName(), port,
            report.verdict());
        return report;
    }
}
