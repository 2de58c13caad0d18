package io.github.cyfko.wilkinson.jackson.serializer;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.github.cyfko.wilkinson.core.ast.CorrelationKind;
import io.github.cyfko.wilkinson.core.model.RandomEffectInfo;

import java.io.IOException;
import java.util.Map;

/**
 * Writes a {@link RandomEffectInfo}. {@code variables} is only written for grouping records,
 * {@code correlation_id} only for cross-parameter terms and {@code grouping_options} only when
 * {@code gr(...)} options were given.
 *
 * @since 1.0.0
 */
public class RandomEffectInfoSerializer extends StdSerializer<RandomEffectInfo> {

    public RandomEffectInfoSerializer() {
        super(RandomEffectInfo.class);
    }

    @Override
    public void serialize(RandomEffectInfo info, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("kind", info.kind().label());
        gen.writeStringField("grouping_variable", info.groupingVariable());
        gen.writeStringField("correlation", correlationLabel(info.correlation()));
        if (info.correlationId() != null) {
            gen.writeStringField("correlation_id", info.correlationId());
        }
        gen.writeBooleanField("correlated", info.correlated());
        gen.writeBooleanField("has_intercept", info.hasIntercept());
        gen.writeBooleanField("includes_interactions", info.includesInteractions());
        if (info.kind() == RandomEffectInfo.Kind.GROUPING) {
            Json.writeStrings(gen, "variables", info.variables());
        }
        if (!info.groupingOptions().isEmpty()) {
            gen.writeObjectFieldStart("grouping_options");
            for (Map.Entry<String, Object> option : info.groupingOptions().entrySet()) {
                gen.writeFieldName(option.getKey());
                provider.defaultSerializeValue(option.getValue(), gen);
            }
            gen.writeEndObject();
        }
        gen.writeEndObject();
    }

    static String correlationLabel(CorrelationKind kind) {
        switch (kind) {
            case UNCORRELATED:
                return "Uncorrelated";
            case CROSS_PARAMETER:
                return "CrossParameter";
            default:
                return "Correlated";
        }
    }
}
