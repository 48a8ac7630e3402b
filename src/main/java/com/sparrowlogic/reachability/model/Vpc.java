package com.sparrowlogic.reachability.model;

import com.sparrowlogic.reachability.exception.ResourceLookupException;

import java.util.Map;

public record Vpc(String vpcId, Map<String, Subnet> subnets) {

    public record Subnet(
        String vpcId,
        String subnetId,
        String cidr,
        String availabilityZone,
        String routeTableId,
        String gateway
    ) {}

    public String cidrOf(String subnetId) {
        var subnet = subnets.get(subnetId);
        if (subnet == null) {
            throw new ResourceLookupException("subnet " + subnetId + " is not part of " + vpcId);
        }
        if (subnet.cidr() == null) {
            throw new ResourceLookupException("subnet " + subnetId + " has no IPv4 CIDR block");
        }
        return subnet.cidr();
    }
}
