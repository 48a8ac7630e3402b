package com.sparrowlogic.reachability.service;

import com.sparrowlogic.reachability.model.AddressBlock;
import com.sparrowlogic.reachability.model.Evaluation;
import com.sparrowlogic.reachability.model.RuleSet;
import com.sparrowlogic.reachability.model.SecurityGroupRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Decides from security group rules alone whether a source can open a connection to a
 * destination port. No traffic is sent and no provider calls are made.
 *
 * <p>The source must first be allowed to send: some egress rule has to cover the destination
 * block and port, otherwise the evaluation fails outright. Then some ingress rule of the
 * destination has to admit one of the source's groups, or a block containing the source's
 * block, on that port. When several paths would work, the first one found is reported.
 * Protocols are not compared.
 */
@Service
public class ReachabilityEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ReachabilityEvaluator.class);

    public Evaluation canConnect(String sourceCidr, String destinationCidr, int destinationPort,
                                 RuleSet sourceRules, RuleSet destinationRules) {
        var sourceBlock = AddressBlock.parse(sourceCidr);
        var destinationBlock = AddressBlock.parse(destinationCidr);
        var evaluation = new Evaluation();

        if (!checkEgress(destinationCidr, destinationBlock, destinationPort, sourceRules, evaluation)) {
            evaluation.markFailure("no egress rule allows connections to " + destinationCidr + " port " + destinationPort);
            return evaluation;
        }
        checkIngress(sourceCidr, sourceBlock, destinationPort, sourceRules, destinationRules, evaluation);
        return evaluation;
    }

    private boolean checkEgress(String destinationCidr, AddressBlock destinationBlock, int port,
                                RuleSet sourceRules, Evaluation evaluation) {
        for (var rule : sourceRules.egressRules()) {
            if (rule.cidrIpv4() == null || !rule.cidrIpv4().contains(destinationBlock)) {
                continue;
            }
            if (rule.allowsPort(port)) {
                log.debug("egress rule {} of {} allows {} port {}", rule.ruleId(), rule.groupId(), destinationCidr, port);
                return true;
            }
            evaluation.addContext("egress rule " + rule.ruleId() + " allows " + destinationCidr + " but not port " + port);
        }
        return false;
    }

    private void checkIngress(String sourceCidr, AddressBlock sourceBlock, int port, RuleSet sourceRules,
                              RuleSet destinationRules, Evaluation evaluation) {
        for (var sourceGroupId : sourceRules.groupIds()) {
            for (var rule : destinationRules.ingressRules()) {
                if (checkIngressRule(rule, sourceGroupId, sourceCidr, sourceBlock, port, evaluation)) {
                    return;
                }
            }
        }
        log.debug("no ingress rule of {} admits {} on port {}", destinationRules.groupIds(), sourceCidr, port);
    }

    private boolean checkIngressRule(SecurityGroupRule rule, String sourceGroupId, String sourceCidr,
                                     AddressBlock sourceBlock, int port, Evaluation evaluation) {
        if (sourceGroupId.equals(rule.referencedGroupId())) {
            if (rule.allowsPort(port)) {
                evaluation.markSuccess(rule.groupId() + " has group-based rule " + rule.ruleId()
                    + " that allows " + sourceGroupId + " on port " + port);
                return true;
            }
            evaluation.addContext(rule.groupId() + " has group-based rule " + rule.ruleId()
                + " that allows " + sourceGroupId + " but not on port " + port);
        }
        if (rule.cidrIpv4() != null && rule.cidrIpv4().contains(sourceBlock)) {
            if (rule.allowsPort(port)) {
                evaluation.markSuccess(rule.groupId() + " has cidr-based rule " + rule.ruleId()
                    + " that allows " + sourceCidr + " on port " + port);
                return true;
            }
            evaluation.addContext(rule.groupId() + " has cidr-based rule " + rule.ruleId()
                + " that allows " + sourceCidr + " but not on port " + port);
        }
        return false;
    }
}
