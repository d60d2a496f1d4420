package io.generativeai.json.jackson;

import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import io.generativeai.core.content.Part;

/**
 * Registers the hand-written {@link Part} codec.
 */
public final class GenerativeAIModule extends SimpleModule {

    private static final long serialVersionUID = 1L;

    public GenerativeAIModule() {
        super("generativeai", Version.unknownVersion());
        addSerializer(Part.class, new PartSerializer());
        addDeserializer(Part.class, new PartDeserializer());
    }
}
