package com.sparrowlogic.reachability.service;

import com.sparrowlogic.reachability.exception.ResourceLookupException;
import com.sparrowlogic.reachability.model.ResourceDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.lambda.model.FunctionConfiguration;
import software.amazon.awssdk.services.lambda.model.GetFunctionRequest;
import software.amazon.awssdk.services.lambda.model.LambdaException;
import software.amazon.awssdk.services.lambda.model.ResourceNotFoundException;

@Service
public class LambdaLookupService {

    private static final Logger log = LoggerFactory.getLogger(LambdaLookupService.class);

    static final String RESOURCE_TYPE = "lambda";

    private final LambdaClient lambdaClient;
    private final VpcLookupService vpcLookupService;

    public LambdaLookupService(LambdaClient lambdaClient, VpcLookupService vpcLookupService) {
        this.lambdaClient = lambdaClient;
        this.vpcLookupService = vpcLookupService;
    }

    public ResourceDescriptor lookupSource(String functionName) {
        log.info("Retrieving Lambda function {}", functionName);
        var configuration = getFunction(functionName);

        var vpcConfig = configuration.vpcConfig();
        if (vpcConfig == null || vpcConfig.vpcId() == null || vpcConfig.vpcId().isBlank()) {
            throw new ResourceLookupException("this tool does not currently support Lambdas that don't run in a VPC");
        }
        var vpc = vpcLookupService.lookup(vpcConfig.vpcId());
        return ResourceDescriptor.source(RESOURCE_TYPE, configuration.functionName(), vpc,
            vpcConfig.subnetIds(), vpcConfig.securityGroupIds());
    }

    private FunctionConfiguration getFunction(String functionName) {
        try {
            return lambdaClient.getFunction(GetFunctionRequest.builder().functionName(functionName).build())
                .configuration();
        } catch (ResourceNotFoundException e) {
            throw new ResourceLookupException("unable to find Lambda function " + functionName, e);
        } catch (LambdaException e) {
            throw new ResourceLookupException("unable to describe Lambda function " + functionName + ": "
                + e.getMessage(), e);
        }
    }
}
