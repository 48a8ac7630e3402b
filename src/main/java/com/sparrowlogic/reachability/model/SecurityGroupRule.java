package com.sparrowlogic.reachability.model;

// cidrIpv4 is the destination of an egress rule and the source of an ingress rule.
public record SecurityGroupRule(
    RuleKind kind,
    String groupId,
    String groupName,
    String ruleId,
    String protocol,
    PortRange portRange,
    AddressBlock cidrIpv4,
    String cidrIpv6,
    String referencedGroupId
) {

    public static SecurityGroupRule egress(String groupId, String groupName, String ruleId, String protocol,
                                           PortRange portRange, AddressBlock destination, String destinationIpv6) {
        return new SecurityGroupRule(RuleKind.EGRESS, groupId, groupName, ruleId, protocol, portRange,
            destination, destinationIpv6, null);
    }

    public static SecurityGroupRule ingress(String groupId, String groupName, String ruleId, String protocol,
                                            PortRange portRange, String sourceGroupId, AddressBlock source,
                                            String sourceIpv6) {
        return new SecurityGroupRule(RuleKind.INGRESS, groupId, groupName, ruleId, protocol, portRange,
            source, sourceIpv6, sourceGroupId);
    }

    public boolean allowsPort(int port) {
        return portRange.contains(port);
    }
}
