package io.github.cyfko.wilkinson.jackson.serializer;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.github.cyfko.wilkinson.core.model.AuxiliaryParameter;

import java.io.IOException;

public class AuxiliaryParameterSerializer extends StdSerializer<AuxiliaryParameter> {

    public AuxiliaryParameterSerializer() {
        super(AuxiliaryParameter.class);
    }

    @Override
    public void serialize(AuxiliaryParameter parameter, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("parameter", parameter.parameter());
        gen.writeBooleanField("has_intercept", parameter.hasIntercept());
        Json.writeStrings(gen, "column_names", parameter.columnNames());
        Json.writeStrings(gen, "generated_columns", parameter.generatedColumns());
        gen.writeEndObject();
    }
}
