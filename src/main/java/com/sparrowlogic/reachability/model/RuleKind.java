package com.sparrowlogic.reachability.model;

public enum RuleKind {
    EGRESS,
    INGRESS
}
