package com.sparrowlogic.reachability.service;

import com.sparrowlogic.reachability.exception.CidrParseException;
import com.sparrowlogic.reachability.exception.ResourceLookupException;
import com.sparrowlogic.reachability.model.AddressBlock;
import com.sparrowlogic.reachability.model.Vpc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeRouteTablesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeSubnetsRequest;
import software.amazon.awssdk.services.ec2.model.DescribeVpcsRequest;
import software.amazon.awssdk.services.ec2.model.Ec2Exception;
import software.amazon.awssdk.services.ec2.model.Filter;
import software.amazon.awssdk.services.ec2.model.RouteTable;
import software.amazon.awssdk.services.ec2.model.Subnet;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class VpcLookupService {

    private static final Logger log = LoggerFactory.getLogger(VpcLookupService.class);

    private final Ec2Client ec2Client;

    public VpcLookupService(Ec2Client ec2Client) {
        this.ec2Client = ec2Client;
    }

    public Vpc lookup(String vpcId) {
        if (vpcId == null || vpcId.isBlank()) {
            throw new ResourceLookupException("no VPC id given");
        }
        log.info("Retrieving VPC {}", vpcId);
        try {
            var vpcs = ec2Client.describeVpcs(DescribeVpcsRequest.builder().vpcIds(vpcId).build()).vpcs();
            if (vpcs.isEmpty()) {
                throw new ResourceLookupException("unable to find VPC " + vpcId);
            }
            var routeTables = describeRouteTablesBySubnet(vpcId);
            return new Vpc(vpcId, describeSubnets(vpcId, routeTables));
        } catch (Ec2Exception e) {
            throw new ResourceLookupException("unable to describe VPC " + vpcId + ": "
                + e.getMessage(), e);
        }
    }

    public Vpc lookupBySubnet(String subnetId) {
        log.info("Retrieving VPC for subnet {}", subnetId);
        String vpcId;
        try {
            var subnets = ec2Client.describeSubnets(DescribeSubnetsRequest.builder().subnetIds(subnetId).build()).subnets();
            if (subnets.isEmpty()) {
                throw new ResourceLookupException("unable to find subnet " + subnetId);
            }
            vpcId = subnets.get(0).vpcId();
        } catch (Ec2Exception e) {
            throw new ResourceLookupException("unable to describe subnet " + subnetId + ": "
                + e.getMessage(), e);
        }
        return lookup(vpcId);
    }

    private Map<String, Vpc.Subnet> describeSubnets(String vpcId, Map<String, RouteInfo> routeTables) {
        var subnets = ec2Client.describeSubnets(DescribeSubnetsRequest.builder().filters(vpcFilter(vpcId)).build())
            .subnets().stream()
            .sorted(Comparator.comparingLong(VpcLookupService::addressOrder))
            .toList();

        var result = new LinkedHashMap<String, Vpc.Subnet>();
        subnets.forEach(subnet -> {
            var route = routeTables.get(subnet.subnetId());
            result.put(subnet.subnetId(), new Vpc.Subnet(
                vpcId,
                subnet.subnetId(),
                subnet.cidrBlock(),
                subnet.availabilityZone(),
                route != null ? route.routeTableId() : null,
                route != null ? route.gateway() : null
            ));
        });
        return result;
    }

    private Map<String, RouteInfo> describeRouteTablesBySubnet(String vpcId) {
        var result = new HashMap<String, RouteInfo>();
        ec2Client.describeRouteTables(DescribeRouteTablesRequest.builder().filters(vpcFilter(vpcId)).build())
            .routeTables()
            .forEach(rt -> {
                var info = new RouteInfo(rt.routeTableId(), defaultGateway(rt));
                rt.associations().forEach(assoc -> {
                    if (assoc.subnetId() != null && assoc.associationState() != null
                        && "associated".equals(assoc.associationState().stateAsString())) {
                        result.put(assoc.subnetId(), info);
                    }
                });
            });
        return result;
    }

    // IPv6-only subnets have no IPv4 block and sort after all others.
    private static long addressOrder(Subnet subnet) {
        if (subnet.cidrBlock() == null) {
            return Long.MAX_VALUE;
        }
        try {
            return Integer.toUnsignedLong(AddressBlock.parse(subnet.cidrBlock()).network());
        } catch (CidrParseException e) {
            throw new ResourceLookupException("subnet " + subnet.subnetId() + " has an unreadable CIDR block", e);
        }
    }

    private static String defaultGateway(RouteTable routeTable) {
        String gateway = null;
        for (var route : routeTable.routes()) {
            if ("0.0.0.0/0".equals(route.destinationCidrBlock())) {
                gateway = route.gatewayId() != null ? route.gatewayId() : route.natGatewayId();
            }
        }
        return gateway;
    }

    private static Filter vpcFilter(String vpcId) {
        return Filter.builder().name("vpc-id").values(vpcId).build();
    }

    private record RouteInfo(String routeTableId, String gateway) {}
}
