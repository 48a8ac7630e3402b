package com.sparrowlogic.reachability.service;

import com.sparrowlogic.reachability.exception.ResourceLookupException;
import com.sparrowlogic.reachability.model.LookupResult;
import com.sparrowlogic.reachability.model.ResourceDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.rds.model.DBCluster;
import software.amazon.awssdk.services.rds.model.DBInstance;
import software.amazon.awssdk.services.rds.model.DbClusterNotFoundException;
import software.amazon.awssdk.services.rds.model.DbInstanceNotFoundException;
import software.amazon.awssdk.services.rds.model.DescribeDbClustersRequest;
import software.amazon.awssdk.services.rds.model.DescribeDbInstancesRequest;
import software.amazon.awssdk.services.rds.model.RdsException;

// A cluster name resolves to the cluster's writer instance.
@Service
public class RdsLookupService {

    private static final Logger log = LoggerFactory.getLogger(RdsLookupService.class);

    static final String RESOURCE_TYPE = "RDS";

    private final RdsClient rdsClient;
    private final VpcLookupService vpcLookupService;

    public RdsLookupService(RdsClient rdsClient, VpcLookupService vpcLookupService) {
        this.rdsClient = rdsClient;
        this.vpcLookupService = vpcLookupService;
    }

    public ResourceDescriptor lookupDestination(String name) {
        var result = findInstance(name).orElse(() -> {
            log.warn("No RDS instance named {}, trying clusters", name);
            return findClusterWriter(name);
        });
        if (result instanceof LookupResult.Found<ResourceDescriptor> found) {
            return found.value();
        }
        throw new ResourceLookupException("failed to find RDS instance/cluster with name " + name);
    }

    public LookupResult<ResourceDescriptor> findInstance(String instanceId) {
        log.info("Retrieving RDS instance {}", instanceId);
        try {
            var instances = rdsClient.describeDBInstances(
                DescribeDbInstancesRequest.builder().dbInstanceIdentifier(instanceId).build()).dbInstances();
            if (instances.isEmpty()) {
                return LookupResult.notFound("no instance " + instanceId);
            }
            return LookupResult.found(toDescriptor(instanceId, instances.get(0)));
        } catch (DbInstanceNotFoundException e) {
            return LookupResult.notFound("no instance " + instanceId);
        } catch (RdsException e) {
            throw new ResourceLookupException("unable to describe RDS instance " + instanceId + ": "
                + e.getMessage(), e);
        }
    }

    public LookupResult<ResourceDescriptor> findClusterWriter(String clusterId) {
        log.info("Retrieving RDS cluster {}", clusterId);
        DBCluster cluster;
        try {
            var clusters = rdsClient.describeDBClusters(
                DescribeDbClustersRequest.builder().dbClusterIdentifier(clusterId).build()).dbClusters();
            if (clusters.isEmpty()) {
                return LookupResult.notFound("no cluster " + clusterId);
            }
            cluster = clusters.get(0);
        } catch (DbClusterNotFoundException e) {
            return LookupResult.notFound("no cluster " + clusterId);
        } catch (RdsException e) {
            throw new ResourceLookupException("unable to describe RDS cluster " + clusterId + ": "
                + e.getMessage(), e);
        }

        var writer = cluster.dbClusterMembers().stream()
            .filter(member -> Boolean.TRUE.equals(member.isClusterWriter()))
            .findFirst()
            .orElseThrow(() -> new ResourceLookupException("cluster " + clusterId + " has no writer instance"));
        return findInstance(writer.dbInstanceIdentifier());
    }

    private ResourceDescriptor toDescriptor(String name, DBInstance instance) {
        var subnetGroup = instance.dbSubnetGroup();
        if (subnetGroup == null) {
            throw new ResourceLookupException("RDS instance " + name + " is not in a VPC");
        }
        var vpc = vpcLookupService.lookup(subnetGroup.vpcId());
        var subnetIds = subnetGroup.subnets().stream()
            .filter(sn -> "Active".equals(sn.subnetStatus()))
            .map(sn -> sn.subnetIdentifier())
            .toList();
        var securityGroupIds = instance.vpcSecurityGroups().stream()
            .filter(sg -> "active".equals(sg.status()))
            .map(sg -> sg.vpcSecurityGroupId())
            .toList();
        var port = instance.endpoint() != null ? instance.endpoint().port() : null;
        return ResourceDescriptor.destination(RESOURCE_TYPE, name, vpc, subnetIds, securityGroupIds, port);
    }
}
