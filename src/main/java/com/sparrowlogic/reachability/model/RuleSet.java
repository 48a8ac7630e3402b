package com.sparrowlogic.reachability.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

// Not thread-safe: populate once, then only read.
public class RuleSet {

    private final Set<String> groupIds = new LinkedHashSet<>();
    private final List<SecurityGroupRule> egressRules = new ArrayList<>();
    private final List<SecurityGroupRule> ingressRules = new ArrayList<>();

    public RuleSet addEgressRule(String groupId, String groupName, String ruleId, String protocol,
                                 int fromPort, int toPort, String cidrIpv4, String cidrIpv6) {
        return addRule(SecurityGroupRule.egress(groupId, groupName, ruleId, protocol,
            PortRange.of(fromPort, toPort), toBlock(cidrIpv4), cidrIpv6));
    }

    public RuleSet addIngressRule(String groupId, String groupName, String ruleId, String protocol,
                                  int fromPort, int toPort, String sourceGroupId, String sourceCidrIpv4,
                                  String sourceCidrIpv6) {
        return addRule(SecurityGroupRule.ingress(groupId, groupName, ruleId, protocol,
            PortRange.of(fromPort, toPort), sourceGroupId, toBlock(sourceCidrIpv4), sourceCidrIpv6));
    }

    public RuleSet addRule(SecurityGroupRule rule) {
        groupIds.add(rule.groupId());
        switch (rule.kind()) {
            case EGRESS -> egressRules.add(rule);
            case INGRESS -> ingressRules.add(rule);
        }
        return this;
    }

    public Set<String> groupIds() {
        return Collections.unmodifiableSet(groupIds);
    }

    public List<SecurityGroupRule> egressRules() {
        return Collections.unmodifiableList(egressRules);
    }

    public List<SecurityGroupRule> ingressRules() {
        return Collections.unmodifiableList(ingressRules);
    }

    public boolean isEmpty() {
        return egressRules.isEmpty() && ingressRules.isEmpty();
    }

    private static AddressBlock toBlock(String cidr) {
        return cidr != null ? AddressBlock.parse(cidr) : null;
    }

    @Override
    public String toString() {
        return "RuleSet" + groupIds + "[egress=" + egressRules.size() + ", ingress=" + ingressRules.size() + "]";
    }
}
