package io.github.cyfko.wilkinson.jackson.serializer;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.github.cyfko.wilkinson.core.model.RandomEffectInfo;
import io.github.cyfko.wilkinson.core.model.Transformation;
import io.github.cyfko.wilkinson.core.model.Variable;
import io.github.cyfko.wilkinson.core.model.VariableRole;

import java.io.IOException;

/**
 * Writes a {@link Variable} as {@code {id, name, role, roles, generated_columns,
 * transformations, interactions, random_effects}}.
 *
 * @since 1.0.0
 */
public class VariableSerializer extends StdSerializer<Variable> {

    public VariableSerializer() {
        super(Variable.class);
    }

    @Override
    public void serialize(Variable variable, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeNumberField("id", variable.id());
        gen.writeStringField("name", variable.name());
        gen.writeStringField("role", variable.role().label());
        gen.writeArrayFieldStart("roles");
        for (VariableRole role : variable.roles()) {
            gen.writeString(role.label());
        }
        gen.writeEndArray();
        Json.writeStrings(gen, "generated_columns", variable.generatedColumns());

        gen.writeArrayFieldStart("transformations");
        for (Transformation transformation : variable.transformations()) {
            provider.defaultSerializeValue(transformation, gen);
        }
        gen.writeEndArray();

        Json.writeStrings(gen, "interactions", variable.interactions());

        gen.writeArrayFieldStart("random_effects");
        for (RandomEffectInfo info : variable.randomEffects()) {
            provider.defaultSerializeValue(info, gen);
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }
}
