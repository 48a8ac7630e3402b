package com.sparrowlogic.reachability.service;

import com.sparrowlogic.reachability.model.ResourceDescriptor;
import org.springframework.stereotype.Service;

import java.util.Locale;

@Service
public class ResourceLookupFacade {

    private final LambdaLookupService lambdaLookupService;
    private final EcsLookupService ecsLookupService;
    private final RdsLookupService rdsLookupService;

    public ResourceLookupFacade(LambdaLookupService lambdaLookupService, EcsLookupService ecsLookupService,
                                RdsLookupService rdsLookupService) {
        this.lambdaLookupService = lambdaLookupService;
        this.ecsLookupService = ecsLookupService;
        this.rdsLookupService = rdsLookupService;
    }

    public ResourceDescriptor lookupSource(SourceType type, String name) {
        return switch (type) {
            case LAMBDA -> lambdaLookupService.lookupSource(name);
            case ECS -> ecsLookupService.lookupSource(name);
        };
    }

    public ResourceDescriptor lookupDatabase(String name) {
        return rdsLookupService.lookupDestination(name);
    }

    public enum SourceType {
        LAMBDA,
        ECS;

        public static SourceType parse(String value) {
            if (value != null) {
                for (var type : values()) {
                    if (type.name().equals(value.trim().toUpperCase(Locale.ROOT))) {
                        return type;
                    }
                }
            }
            throw new IllegalArgumentException("unsupported source type: " + value);
        }
    }
}
