package com.riskcast.backend.service.router;

import com.riskcast.backend.config.RouterProperties;
import com.riskcast.backend.model.ModelType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RoutingPolicy {

    public enum Route {
        SHORT_ONLY,
        LONG_ONLY,
        LONG_WITH_FALLBACK,
        BLEND
    }

    private final RouterProperties properties;

    public Route route(ModelType modelType, int horizon) {
        return switch (modelType) {
            case MODEL_A -> Route.SHORT_ONLY;
            case MODEL_B -> Route.LONG_ONLY;
            case ENSEMBLE -> Route.BLEND;
            case AUTO -> autoRoute(horizon);
        };
    }

    private Route autoRoute(int horizon) {
        if (horizon <= properties.getShortHorizonMaxMonths()) {
            return Route.SHORT_ONLY;
        }
        if (horizon >= properties.getLongHorizonMinMonths()) {
            return properties.isBlendLongHorizons() ? Route.BLEND : Route.LONG_WITH_FALLBACK;
        }
        return Route.BLEND;
    }
}
