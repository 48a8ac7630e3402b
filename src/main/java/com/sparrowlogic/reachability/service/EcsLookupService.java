package com.sparrowlogic.reachability.service;

import com.sparrowlogic.reachability.exception.ResourceLookupException;
import com.sparrowlogic.reachability.model.ResourceDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.ecs.EcsClient;
import software.amazon.awssdk.services.ecs.model.DescribeServicesRequest;
import software.amazon.awssdk.services.ecs.model.EcsException;

import java.util.regex.Pattern;

@Service
public class EcsLookupService {

    private static final Logger log = LoggerFactory.getLogger(EcsLookupService.class);

    static final String RESOURCE_TYPE = "ECS";

    private static final Pattern SERVICE_SPEC = Pattern.compile("(?:(?<cluster>[^:]+):)?(?<service>.+)");

    private final EcsClient ecsClient;
    private final VpcLookupService vpcLookupService;

    public EcsLookupService(EcsClient ecsClient, VpcLookupService vpcLookupService) {
        this.ecsClient = ecsClient;
        this.vpcLookupService = vpcLookupService;
    }

    public ResourceDescriptor lookupSource(String serviceSpec) {
        var matcher = serviceSpec != null ? SERVICE_SPEC.matcher(serviceSpec) : null;
        if (matcher == null || !matcher.matches()) {
            throw new ResourceLookupException("unable to parse ECS service specification: " + serviceSpec);
        }
        var cluster = matcher.group("cluster");
        var serviceName = matcher.group("service");
        log.info("Retrieving ECS service {} in cluster {}", serviceName, cluster != null ? cluster : "default");

        var request = DescribeServicesRequest.builder().services(serviceName);
        if (cluster != null) {
            request.cluster(cluster);
        }

        software.amazon.awssdk.services.ecs.model.Service service;
        try {
            var services = ecsClient.describeServices(request.build()).services();
            if (services.isEmpty()) {
                throw new ResourceLookupException("unable to find service " + serviceSpec);
            }
            service = services.get(0);
        } catch (EcsException e) {
            throw new ResourceLookupException("unable to describe ECS service " + serviceSpec + ": "
                + e.getMessage(), e);
        }

        var network = service.networkConfiguration();
        if (network == null || network.awsvpcConfiguration() == null) {
            throw new ResourceLookupException("service " + serviceSpec + " does not use awsvpc networking");
        }
        var subnetIds = network.awsvpcConfiguration().subnets();
        if (subnetIds.isEmpty()) {
            throw new ResourceLookupException("service " + serviceSpec + " has no subnets");
        }
        var vpc = vpcLookupService.lookupBySubnet(subnetIds.get(0));
        return ResourceDescriptor.source(RESOURCE_TYPE, service.serviceName(), vpc,
            subnetIds, network.awsvpcConfiguration().securityGroups());
    }
}
