package io.generativeai.json.jackson;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;

/**
 * Naming strategy that renames properties through {@link WireNames}.
 */
public final class WireNamingStrategy extends PropertyNamingStrategies.NamingBase {

    private static final long serialVersionUID = 1L;

    @Override
    public String translate(String propertyName) {
        return propertyName == null ? null : WireNames.toWire(propertyName);
    }
}
