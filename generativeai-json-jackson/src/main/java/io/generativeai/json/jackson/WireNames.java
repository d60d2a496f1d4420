package io.generativeai.json.jackson;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Java component name to wire key table.
 *
 * <p>Names not listed travel unchanged. The table is used in both directions: {@link WireNamingStrategy}
 * applies it to every record, and {@link PartDeserializer} uses {@link #fromWire(String)} so the camelCase keys
 * the service sends back ({@code inlineData}, {@code mimeType}) are understood as well.
 */
public final class WireNames {
    private WireNames() {}

    private static final Map<String, String> TO_WIRE;
    private static final Map<String, String> FROM_WIRE;

    static {
        Map<String, String> m = new LinkedHashMap<>();
        // GenerateContentRequest / CountTokensRequest
        m.put("safetySettings", "safety_settings");
        m.put("generationConfig", "generation_config");
        m.put("toolConfig", "tool_config");
        m.put("systemInstruction", "system_instruction");
        // Tool / ToolConfig
        m.put("functionDeclarations", "function_declarations");
        m.put("functionCallingConfig", "function_calling_config");
        m.put("allowedFunctionNames", "allowed_function_names");
        // GenerationConfig
        m.put("topK", "top_k");
        m.put("topP", "top_p");
        m.put("candidateCount", "candidate_count");
        m.put("maxOutputTokens", "max_output_tokens");
        m.put("stopSequences", "stop_sequences");
        m.put("responseMimeType", "response_mime_type");
        m.put("presencePenalty", "presence_penalty");
        m.put("frequencyPenalty", "frequency_penalty");
        m.put("responseSchema", "response_schema");
        // Part variants and their payloads
        m.put("inlineData", "inline_data");
        m.put("fileData", "file_data");
        m.put("mimeType", "mime_type");
        m.put("fileUri", "file_uri");
        // Java keywords and reserved characters
        m.put("enumValues", "enum");
        m.put("typeUrl", "@type");

        Map<String, String> reverse = new HashMap<>();
        for (Map.Entry<String, String> e : m.entrySet()) {
            if (reverse.put(e.getValue(), e.getKey()) != null) {
                throw new IllegalStateException("duplicate wire name: " + e.getValue());
            }
        }
        TO_WIRE = Collections.unmodifiableMap(m);
        FROM_WIRE = Collections.unmodifiableMap(reverse);
    }

    /** Wire key for a Java component name. */
    public static String toWire(String javaName) {
        return TO_WIRE.getOrDefault(javaName, javaName);
    }

    /** Java component name for a wire key; camelCase keys map to themselves. */
    public static String fromWire(String wireName) {
        return FROM_WIRE.getOrDefault(wireName, wireName);
    }

    static Map<String, String> table() {
        return TO_WIRE;
    }
}
