package io.github.cyfko.wilkinson.jackson.serializer;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.github.cyfko.wilkinson.core.model.Transformation;

import java.io.IOException;
import java.util.Map;

public class TransformationSerializer extends StdSerializer<Transformation> {

    public TransformationSerializer() {
        super(Transformation.class);
    }

    @Override
    public void serialize(Transformation transformation, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("function", transformation.function());
        gen.writeObjectFieldStart("parameters");
        for (Map.Entry<String, Object> parameter : transformation.parameters().entrySet()) {
            gen.writeFieldName(parameter.getKey());
            provider.defaultSerializeValue(parameter.getValue(), gen);
        }
        gen.writeEndObject();
        Json.writeStrings(gen, "generates_columns", transformation.generatesColumns());
        gen.writeEndObject();
    }
}
