package io.github.cyfko.wilkinson.jackson.serializer;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.github.cyfko.wilkinson.core.model.AuxiliaryParameter;
import io.github.cyfko.wilkinson.core.model.FormulaMetaData;
import io.github.cyfko.wilkinson.core.model.Variable;

import java.io.IOException;
import java.util.Map;

/**
 * Writes {@link FormulaMetaData} with the snake_case field names of the output contract.
 * {@code all_generated_columns_formula_order} is an object keyed by the 1-based position
 * ({@code "1": "y"}), in position order.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FormulaMetaDataSerializer extends StdSerializer<FormulaMetaData> {

    public FormulaMetaDataSerializer() {
        super(FormulaMetaData.class);
    }

    @Override
    public void serialize(FormulaMetaData meta, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("formula", meta.formula());
        gen.writeBooleanField("has_intercept", meta.hasIntercept());
        gen.writeStringField("family", meta.family().familyName());
        gen.writeBooleanField("is_random_effects_model", meta.isRandomEffectsModel());
        gen.writeBooleanField("has_uncorrelated_slopes_and_intercepts", meta.hasUncorrelatedSlopesAndIntercepts());
        gen.writeNumberField("response_variable_count", meta.responseVariableCount());
        Json.writeStrings(gen, "column_names", meta.columnNames());

        gen.writeArrayFieldStart("variables");
        for (Variable variable : meta.variables()) {
            provider.defaultSerializeValue(variable, gen);
        }
        gen.writeEndArray();

        Json.writeStrings(gen, "all_generated_columns", meta.allGeneratedColumns());

        gen.writeObjectFieldStart("all_generated_columns_formula_order");
        for (Map.Entry<Integer, String> entry : meta.allGeneratedColumnsFormulaOrder().entrySet()) {
            gen.writeStringField(String.valueOf(entry.getKey()), entry.getValue());
        }
        gen.writeEndObject();

        gen.writeArrayFieldStart("auxiliary_parameters");
        for (AuxiliaryParameter parameter : meta.auxiliaryParameters()) {
            provider.defaultSerializeValue(parameter, gen);
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }
}
