package io.generativeai.json.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.generativeai.core.content.FileDataPart;
import io.generativeai.core.content.FunctionCall;
import io.generativeai.core.content.FunctionCallPart;
import io.generativeai.core.content.FunctionResponse;
import io.generativeai.core.content.FunctionResponsePart;
import io.generativeai.core.content.InlineDataPart;
import io.generativeai.core.content.Part;
import io.generativeai.core.content.TextPart;

import java.io.IOException;
import java.util.Iterator;
import java.util.Set;

/**
 * Reads a {@link Part}, selecting the variant from the single variant key present.
 *
 * <p>Keys outside the variant set are ignored; zero or several variant keys are an input mismatch.
 */
final class PartDeserializer extends StdDeserializer<Part> {

    private static final long serialVersionUID = 1L;

    static final String TEXT = "text";
    static final String INLINE_DATA = "inlineData";
    static final String FILE_DATA = "fileData";
    static final String FUNCTION_CALL = "functionCall";
    static final String FUNCTION_RESPONSE = "functionResponse";

    private static final Set<String> VARIANTS = Set.of(TEXT, INLINE_DATA, FILE_DATA, FUNCTION_CALL, FUNCTION_RESPONSE);

    PartDeserializer() {
        super(Part.class);
    }

    @Override
    public Part deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = ctxt.readTree(p);
        if (node == null || !node.isObject()) {
            return ctxt.reportInputMismatch(Part.class, "part must be a JSON object");
        }

        String variant = null;
        String variantKey = null;
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String key = names.next();
            String canonical = WireNames.fromWire(key);
            if (!VARIANTS.contains(canonical)) continue;
            if (variant != null) {
                return ctxt.reportInputMismatch(Part.class, "part has more than one variant: %s and %s", variantKey, key);
            }
            variant = canonical;
            variantKey = key;
        }
        if (variant == null) {
            return ctxt.reportInputMismatch(Part.class, "part has no known variant among keys %s", fieldNames(node));
        }

        JsonNode value = node.get(variantKey);
        switch (variant) {
            case TEXT:
                if (!value.isTextual()) {
                    return ctxt.reportInputMismatch(Part.class, "text must be a string");
                }
                return new TextPart(value.textValue());
            case INLINE_DATA:
                return new InlineDataPart(requiredText(value, "mimeType", ctxt), requiredText(value, "data", ctxt));
            case FILE_DATA:
                return new FileDataPart(requiredText(value, "mimeType", ctxt), requiredText(value, "fileUri", ctxt));
            case FUNCTION_CALL:
                return new FunctionCallPart(ctxt.readTreeAsValue(value, FunctionCall.class));
            case FUNCTION_RESPONSE:
                return new FunctionResponsePart(ctxt.readTreeAsValue(value, FunctionResponse.class));
            default:
                return ctxt.reportInputMismatch(Part.class, "unsupported part variant: %s", variant);
        }
    }

    private static String requiredText(JsonNode obj, String javaName, DeserializationContext ctxt) throws IOException {
        if (obj == null || !obj.isObject()) {
            return ctxt.reportInputMismatch(Part.class, "expected an object holding '%s'", javaName);
        }
        JsonNode v = obj.get(WireNames.toWire(javaName));
        if (v == null) v = obj.get(javaName);
        if (v == null || !v.isTextual()) {
            return ctxt.reportInputMismatch(Part.class, "missing required string '%s'", javaName);
        }
        return v.textValue();
    }

    private static String fieldNames(JsonNode node) {
        StringBuilder sb = new StringBuilder("[");
        Iterator<String> it = node.fieldNames();
        while (it.hasNext()) {
            sb.append(it.next());
            if (it.hasNext()) sb.append(", ");
        }
        return sb.append(']').toString();
    }
}
