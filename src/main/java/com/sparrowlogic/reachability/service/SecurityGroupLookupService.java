package com.sparrowlogic.reachability.service;

import com.sparrowlogic.reachability.exception.ResourceLookupException;
import com.sparrowlogic.reachability.model.AddressBlock;
import com.sparrowlogic.reachability.model.PortRange;
import com.sparrowlogic.reachability.model.RuleSet;
import com.sparrowlogic.reachability.model.SecurityGroupRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeSecurityGroupRulesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeSecurityGroupsRequest;
import software.amazon.awssdk.services.ec2.model.Ec2Exception;
import software.amazon.awssdk.services.ec2.model.Filter;

import java.util.List;

@Service
public class SecurityGroupLookupService {

    private static final Logger log = LoggerFactory.getLogger(SecurityGroupLookupService.class);

    private final Ec2Client ec2Client;

    public SecurityGroupLookupService(Ec2Client ec2Client) {
        this.ec2Client = ec2Client;
    }

    public RuleSet lookup(List<String> securityGroupIds) {
        var result = new RuleSet();
        if (securityGroupIds == null || securityGroupIds.isEmpty()) {
            return result;
        }
        log.info("Retrieving rules for security groups {}", securityGroupIds);

        List<software.amazon.awssdk.services.ec2.model.SecurityGroup> groups;
        try {
            groups = ec2Client.describeSecurityGroups(
                DescribeSecurityGroupsRequest.builder().groupIds(securityGroupIds).build()).securityGroups();
        } catch (Ec2Exception e) {
            throw new ResourceLookupException("unable to describe security groups " + securityGroupIds
                + ": " + e.getMessage(), e);
        }

        // A group with no rules adds nothing, not even its id.
        groups.forEach(sg -> retrieveRules(sg.groupId(), sg.groupName(), result));
        return result;
    }

    private void retrieveRules(String groupId, String groupName, RuleSet result) {
        String nextToken = null;
        do {
            var response = ec2Client.describeSecurityGroupRules(DescribeSecurityGroupRulesRequest.builder()
                .filters(Filter.builder().name("group-id").values(groupId).build())
                .nextToken(nextToken)
                .build());

            response.securityGroupRules().forEach(sgr -> {
                var ports = PortRange.of(
                    sgr.fromPort() != null ? sgr.fromPort() : -1,
                    sgr.toPort() != null ? sgr.toPort() : -1);
                var cidrIpv4 = sgr.cidrIpv4() != null ? AddressBlock.parse(sgr.cidrIpv4()) : null;

                if (Boolean.TRUE.equals(sgr.isEgress())) {
                    result.addRule(SecurityGroupRule.egress(groupId, groupName, sgr.securityGroupRuleId(),
                        sgr.ipProtocol(), ports, cidrIpv4, sgr.cidrIpv6()));
                } else {
                    var referenced = sgr.referencedGroupInfo() != null ? sgr.referencedGroupInfo().groupId() : null;
                    result.addRule(SecurityGroupRule.ingress(groupId, groupName, sgr.securityGroupRuleId(),
                        sgr.ipProtocol(), ports, referenced, cidrIpv4, sgr.cidrIpv6()));
                }
            });
            nextToken = response.nextToken();
        } while (nextToken != null && !nextToken.isEmpty());
    }
}
