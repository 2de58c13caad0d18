package io.github.cyfko.wilkinson.jackson.serializer;

import com.fasterxml.jackson.core.JsonGenerator;

import java.io.IOException;
import java.util.List;

final class Json {

    private Json() {
    }

    static void writeStrings(JsonGenerator gen, String field, List<String> values) throws IOException {
        gen.writeArrayFieldStart(field);
        for (String value : values) {
            gen.writeString(value);
        }
        gen.writeEndArray();
    }
}
