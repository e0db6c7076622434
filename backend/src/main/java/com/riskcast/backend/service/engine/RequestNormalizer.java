package com.riskcast.backend.service.engine;

import com.riskcast.backend.config.RouterProperties;
import com.riskcast.backend.exception.ValidationInputException;
import com.riskcast.backend.model.RiskAssessmentRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

@Component
@RequiredArgsConstructor
public class RequestNormalizer {

    private final RouterProperties routerProperties;

    /**
     * Validates the request and returns its canonical form: trimmed fields, lower-case industry and email,
     * upper-case country code, horizons de-duplicated and sorted.
     *
     * @throws ValidationInputException when the request cannot be scored
     */
    public RiskAssessmentRequest normalize(RiskAssessmentRequest request) {
        if (request == null) {
            throw new ValidationInputException("Request body is required");
        }
        String businessName = trimToNull(request.businessName());
        if (businessName == null) {
            throw new ValidationInputException("businessName is required");
        }
        String industry = trimToNull(request.industry());
        if (industry == null) {
            throw new ValidationInputException("industry is required");
        }
        String country = trimToNull(request.country());
        if (country == null || country.length() != 2 || !country.chars().allMatch(Character::isLetter)) {
            throw new ValidationInputException("country must be a two-letter ISO code");
        }
        List<Integer> horizons = normalizeHorizons(request.predictionHorizons());

        return request.toBuilder()
                .businessName(businessName)
                .businessAddress(trimToNull(request.businessAddress()))
                .industry(industry.toLowerCase(Locale.ROOT).replace(' ', '_'))
                .country(country.toUpperCase(Locale.ROOT))
                .phone(trimToNull(request.phone()))
                .email(lowerOrNull(request.email()))
                .website(lowerOrNull(request.website()))
                .predictionHorizons(horizons)
                .build();
    }

    private List<Integer> normalizeHorizons(List<Integer> requested) {
        if (requested.isEmpty()) {
            throw new ValidationInputException("At least one prediction horizon is required");
        }
        Set<Integer> unique = new TreeSet<>();
        for (Integer horizon : requested) {
            if (horizon == null) {
                throw new ValidationInputException("Prediction horizons must not contain null");
            }
            if (!routerProperties.getSupportedHorizons().contains(horizon)) {
                throw new ValidationInputException("Unsupported prediction horizon " + horizon + " months");
            }
            unique.add(horizon);
        }
        if (unique.size() > routerProperties.getMaxHorizonsPerRequest()) {
            throw new ValidationInputException("At most " + routerProperties.getMaxHorizonsPerRequest()
                    + " prediction horizons are allowed per request");
        }
        return List.copyOf(unique);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String lowerOrNull(String value) {
        String trimmed = trimToNull(value);
        return trimmed == null ? null : trimmed.toLowerCase(Locale.ROOT);
    }
}
