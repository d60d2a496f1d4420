package io.generativeai.json.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.generativeai.core.content.FileDataPart;
import io.generativeai.core.content.FunctionCallPart;
import io.generativeai.core.content.FunctionResponsePart;
import io.generativeai.core.content.InlineDataPart;
import io.generativeai.core.content.Part;
import io.generativeai.core.content.TextPart;

import java.io.IOException;

/**
 * Writes a {@link Part} as an object with exactly one variant key.
 */
final class PartSerializer extends StdSerializer<Part> {

    private static final long serialVersionUID = 1L;

    PartSerializer() {
        super(Part.class);
    }

    @Override
    public void serialize(Part part, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        if (part instanceof TextPart) {
            gen.writeStringField(PartDeserializer.TEXT, ((TextPart) part).text());
        } else if (part instanceof InlineDataPart) {
            InlineDataPart inline = (InlineDataPart) part;
            gen.writeObjectFieldStart(WireNames.toWire(PartDeserializer.INLINE_DATA));
            gen.writeStringField(WireNames.toWire("mimeType"), inline.mimeType());
            gen.writeStringField("data", inline.data());
            gen.writeEndObject();
        } else if (part instanceof FileDataPart) {
            FileDataPart file = (FileDataPart) part;
            gen.writeObjectFieldStart(WireNames.toWire(PartDeserializer.FILE_DATA));
            gen.writeStringField(WireNames.toWire("mimeType"), file.mimeType());
            gen.writeStringField(WireNames.toWire("fileUri"), file.fileUri());
            gen.writeEndObject();
        } else if (part instanceof FunctionCallPart) {
            gen.writeFieldName(WireNames.toWire(PartDeserializer.FUNCTION_CALL));
            provider.defaultSerializeValue(((FunctionCallPart) part).functionCall(), gen);
        } else if (part instanceof FunctionResponsePart) {
            gen.writeFieldName(WireNames.toWire(PartDeserializer.FUNCTION_RESPONSE));
            provider.defaultSerializeValue(((FunctionResponsePart) part).functionResponse(), gen);
        } else {
            throw JsonMappingException.from(gen, "unsupported part type: " + part.getClass().getName());
        }
        gen.writeEndObject();
    }
}
