package io.generativeai.json.jackson;

import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.DeserializationProblemHandler;

/**
 * Maps enum values this client does not know to the enum's {@code UNKNOWN} constant, when it has one.
 */
final class UnknownEnumValueHandler extends DeserializationProblemHandler {

    static final String UNKNOWN = "UNKNOWN";

    @Override
    public Object handleWeirdStringValue(DeserializationContext ctxt, Class<?> targetType, String valueToConvert, String failureMsg) {
        if (targetType.isEnum()) {
            for (Object constant : targetType.getEnumConstants()) {
                if (UNKNOWN.equals(((Enum<?>) constant).name())) {
                    return constant;
                }
            }
        }
        return NOT_HANDLED;
    }
}
