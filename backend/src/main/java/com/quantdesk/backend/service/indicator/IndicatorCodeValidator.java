package com.quantdesk.backend.service.indicator;

import com.quantdesk.backend.config.IndicatorProperties;
import com.quantdesk.backend.exception.BadRequestException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Structural checks on indicator source before it is stored: the entry point must be defined and
 * no blocked construct may appear. This is a gate on obviously unsafe input, not a sandbox.
 */
@Component
@RequiredArgsConstructor
public class IndicatorCodeValidator {

    private final IndicatorProperties properties;

    public void validate(String sourceCode) {
        IndicatorProperties.Validation validation = properties.getValidation();
        if (sourceCode == null || !sourceCode.contains(validation.getEntryPoint())) {
            throw new BadRequestException("Code must define a calculate(data) function");
        }
        for (IndicatorProperties.BlockedPattern blocked : validation.getBlockedPatterns()) {
            if (Pattern.compile(blocked.getRegex()).matcher(sourceCode).find()) {
                throw new BadRequestException("Dangerous pattern not allowed: " + blocked.getLabel());
            }
        }
    }
}
