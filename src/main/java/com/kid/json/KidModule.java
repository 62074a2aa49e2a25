package com.kid.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.Deserializers;
import com.fasterxml.jackson.databind.jsontype.TypeDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.type.ReferenceType;
import com.kid.InvalidKidException;
import com.kid.Kid;

import java.io.IOException;
import java.util.Optional;

/**
 * Jackson module mapping {@link Kid} to and from its 16-character string.
 *
 * {@link Kid#NIL} is written as JSON {@code null} and JSON {@code null} reads
 * back as {@link Kid#NIL}. {@code Optional<Kid>} keeps absence explicit: JSON
 * {@code null} or a missing property reads as {@link Optional#empty()}.
 * Register this module after {@code Jdk8Module} so its {@code Optional<Kid>}
 * handling wins.
 */
public class KidModule extends SimpleModule {

    public KidModule() {
        super("KidModule");
        addSerializer(Kid.class, new KidSerializer());
        addDeserializer(Kid.class, new KidDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);
        context.addDeserializers(new OptionalKidDeserializers());
    }

    private static Kid readKid(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (!p.hasToken(JsonToken.VALUE_STRING)) {
            return (Kid) ctxt.handleUnexpectedToken(Kid.class, p);
        }
        String text = p.getText();
        try {
            return Kid.fromString(text);
        } catch (InvalidKidException e) {
            throw ctxt.weirdStringException(text, Kid.class, e.getMessage());
        }
    }

    private static class KidSerializer extends JsonSerializer<Kid> {
        @Override
        public void serialize(Kid value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            if (value.isNil()) {
                gen.writeNull();
                return;
            }
            gen.writeString(value.toString());
        }

        @Override
        public boolean isEmpty(SerializerProvider provider, Kid value) {
            return value == null || value.isNil();
        }

        @Override
        public Class<Kid> handledType() {
            return Kid.class;
        }
    }

    private static class KidDeserializer extends JsonDeserializer<Kid> {
        @Override
        public Kid deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return readKid(p, ctxt);
        }

        @Override
        public Kid getNullValue(DeserializationContext ctxt) {
            return Kid.NIL;
        }
    }

    private static class OptionalKidDeserializer extends JsonDeserializer<Optional<Kid>> {
        @Override
        public Optional<Kid> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return Optional.of(readKid(p, ctxt));
        }

        @Override
        public Optional<Kid> getNullValue(DeserializationContext ctxt) {
            return Optional.empty();
        }

        @Override
        public Object getAbsentValue(DeserializationContext ctxt) {
            return Optional.empty();
        }
    }

    /**
     * Supplies the {@code Optional<Kid>} deserializer, so that JSON null is
     * not wrapped into {@code Optional[NIL]}.
     */
    private static class OptionalKidDeserializers extends Deserializers.Base {
        @Override
        public JsonDeserializer<?> findReferenceDeserializer(ReferenceType refType,
                                                             DeserializationConfig config,
                                                             BeanDescription beanDesc,
                                                             TypeDeserializer contentTypeDeserializer,
                                                             JsonDeserializer<?> contentDeserializer) {
            if (refType.hasRawClass(Optional.class) && refType.getContentType().hasRawClass(Kid.class)) {
                return new OptionalKidDeserializer();
            }
            return null;
        }
    }
}
