package com.challenges.lsparse.schema;

import com.challenges.lsparse.schema.NodeSchema.SingleEntrySchema;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Writes an attribute or hash entry as {@code {key: value}}.
 */
final class SingleEntrySerializer extends StdSerializer<SingleEntrySchema> {
    SingleEntrySerializer() {
        super(SingleEntrySchema.class);
    }

    @Override
    public void serialize(SingleEntrySchema entry, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeFieldName(entry.key());
        provider.defaultSerializeValue(entry.value(), gen);
        gen.writeEndObject();
    }
}
