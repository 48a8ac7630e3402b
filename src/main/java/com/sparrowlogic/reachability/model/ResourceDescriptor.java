package com.sparrowlogic.reachability.model;

import com.sparrowlogic.reachability.exception.ResourceLookupException;

import java.util.List;

public record ResourceDescriptor(
    String resourceType,
    String resourceName,
    String vpcId,
    List<String> subnetIds,
    List<String> securityGroupIds,
    String cidr,
    Integer port
) {

    public static ResourceDescriptor source(String resourceType, String resourceName, Vpc vpc,
                                            List<String> subnetIds, List<String> securityGroupIds) {
        return new ResourceDescriptor(resourceType, resourceName, vpc.vpcId(), List.copyOf(subnetIds),
            List.copyOf(securityGroupIds), placement(resourceType, resourceName, vpc, subnetIds), null);
    }

    public static ResourceDescriptor destination(String resourceType, String resourceName, Vpc vpc,
                                                 List<String> subnetIds, List<String> securityGroupIds, Integer port) {
        return new ResourceDescriptor(resourceType, resourceName, vpc.vpcId(), List.copyOf(subnetIds),
            List.copyOf(securityGroupIds), placement(resourceType, resourceName, vpc, subnetIds), port);
    }

    // The first subnet stands in for the whole resource.
    private static String placement(String resourceType, String resourceName, Vpc vpc, List<String> subnetIds) {
        if (subnetIds.isEmpty()) {
            throw new ResourceLookupException(resourceType + " " + resourceName + " has no usable subnets");
        }
        return vpc.cidrOf(subnetIds.get(0));
    }

    public String displayName() {
        return resourceType + " " + resourceName;
    }
}
