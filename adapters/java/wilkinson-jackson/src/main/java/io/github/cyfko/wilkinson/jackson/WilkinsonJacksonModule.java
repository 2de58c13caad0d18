package io.github.cyfko.wilkinson.jackson;

import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import io.github.cyfko.wilkinson.core.exception.FormulaBuildException;
import io.github.cyfko.wilkinson.core.exception.FormulaSyntaxException;
import io.github.cyfko.wilkinson.core.lexer.Token;
import io.github.cyfko.wilkinson.core.model.AuxiliaryParameter;
import io.github.cyfko.wilkinson.core.model.FormulaMetaData;
import io.github.cyfko.wilkinson.core.model.RandomEffectInfo;
import io.github.cyfko.wilkinson.core.model.Transformation;
import io.github.cyfko.wilkinson.core.model.Variable;
import io.github.cyfko.wilkinson.jackson.serializer.AuxiliaryParameterSerializer;
import io.github.cyfko.wilkinson.jackson.serializer.FormulaErrorSerializer;
import io.github.cyfko.wilkinson.jackson.serializer.FormulaMetaDataSerializer;
import io.github.cyfko.wilkinson.jackson.serializer.RandomEffectInfoSerializer;
import io.github.cyfko.wilkinson.jackson.serializer.TokenSerializer;
import io.github.cyfko.wilkinson.jackson.serializer.TransformationSerializer;
import io.github.cyfko.wilkinson.jackson.serializer.VariableSerializer;

/**
 * Jackson module rendering the formula model with its stable snake_case field names.
 *
 * <pre>{@code
 * ObjectMapper mapper = new ObjectMapper().registerModule(new WilkinsonJacksonModule());
 * String json = mapper.writeValueAsString(Formulas.parseFormula("y ~ x"));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class WilkinsonJacksonModule extends SimpleModule {

    public WilkinsonJacksonModule() {
        super("WilkinsonJacksonModule", new Version(1, 0, 0, null, "io.github.cyfko", "wilkinson-jackson"));
        FormulaErrorSerializer errors = new FormulaErrorSerializer();
        addSerializer(FormulaMetaData.class, new FormulaMetaDataSerializer());
        addSerializer(Variable.class, new VariableSerializer());
        addSerializer(Transformation.class, new TransformationSerializer());
        addSerializer(RandomEffectInfo.class, new RandomEffectInfoSerializer());
        addSerializer(AuxiliaryParameter.class, new AuxiliaryParameterSerializer());
        addSerializer(Token.class, new TokenSerializer());
        addSerializer(FormulaSyntaxException.class, errors);
        addSerializer(FormulaBuildException.class, errors);
    }
}
