package com.pixeltrack.ingest.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.deser.BeanDeserializerBase;
import com.fasterxml.jackson.databind.deser.BeanDeserializerModifier;
import com.fasterxml.jackson.databind.deser.std.DelegatingDeserializer;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.type.CollectionType;
import com.fasterxml.jackson.databind.type.MapType;

import java.io.IOException;

/**
 * Binds pixel payload fields by shape instead of failing the whole object.
 *
 * <p>A field whose JSON shape does not fit its Java type binds as null. Strings
 * accept any scalar. {@code Double} and {@code Long} accept numbers and numeric
 * text. Maps, lists and nested objects accept only their own container shape.
 * The untouched value stays available in the raw payload.
 */
public class LenientPayloadModule extends SimpleModule {

    public LenientPayloadModule() {
        super("LenientPayloadModule");
        addDeserializer(String.class, new TextDeserializer());
        addDeserializer(Double.class, new DecimalDeserializer());
        addDeserializer(Long.class, new WholeNumberDeserializer());
        setDeserializerModifier(new ShapeGuardModifier());
    }

    private static Object skip(JsonParser p) throws IOException {
        p.skipChildren();
        return null;
    }

    static final class TextDeserializer extends StdScalarDeserializer<String> {

        TextDeserializer() {
            super(String.class);
        }

        @Override
        public String deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonToken token = p.currentToken();
            if (token != null && token.isScalarValue()) {
                return p.getValueAsString();
            }
            skip(p);
            return null;
        }
    }

    static final class DecimalDeserializer extends StdScalarDeserializer<Double> {

        DecimalDeserializer() {
            super(Double.class);
        }

        @Override
        public Double deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() != null && p.currentToken().isNumeric()) {
                return p.getDoubleValue();
            }
            if (p.hasToken(JsonToken.VALUE_STRING)) {
                return PayloadValues.parseDecimal(p.getText());
            }
            skip(p);
            return null;
        }
    }

    static final class WholeNumberDeserializer extends StdScalarDeserializer<Long> {

        WholeNumberDeserializer() {
            super(Long.class);
        }

        @Override
        public Long deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.hasToken(JsonToken.VALUE_NUMBER_INT) && p.getNumberType() != JsonParser.NumberType.BIG_INTEGER) {
                return p.getLongValue();
            }
            if (p.hasToken(JsonToken.VALUE_NUMBER_INT) || p.hasToken(JsonToken.VALUE_NUMBER_FLOAT)) {
                return PayloadValues.wholeNumber(p.getDoubleValue());
            }
            if (p.hasToken(JsonToken.VALUE_STRING)) {
                return PayloadValues.wholeNumber(PayloadValues.parseDecimal(p.getText()));
            }
            skip(p);
            return null;
        }
    }

    /**
     * Wraps object, map and collection deserializers so a mismatched shape
     * binds as null.
     */
    static final class ShapeGuardModifier extends BeanDeserializerModifier {

        @Override
        public JsonDeserializer<?> modifyDeserializer(DeserializationConfig config, BeanDescription beanDesc,
                                                      JsonDeserializer<?> deserializer) {
            return deserializer instanceof BeanDeserializerBase
                    ? new ShapeGuard(deserializer, JsonToken.START_OBJECT)
                    : deserializer;
        }

        @Override
        public JsonDeserializer<?> modifyMapDeserializer(DeserializationConfig config, MapType type,
                                                         BeanDescription beanDesc, JsonDeserializer<?> deserializer) {
            return new ShapeGuard(deserializer, JsonToken.START_OBJECT);
        }

        @Override
        public JsonDeserializer<?> modifyCollectionDeserializer(DeserializationConfig config, CollectionType type,
                                                                BeanDescription beanDesc,
                                                                JsonDeserializer<?> deserializer) {
            return new ShapeGuard(deserializer, JsonToken.START_ARRAY);
        }
    }

    static final class ShapeGuard extends DelegatingDeserializer {

        private final JsonToken opening;

        ShapeGuard(JsonDeserializer<?> delegate, JsonToken opening) {
            super(delegate);
            this.opening = opening;
        }

        @Override
        protected JsonDeserializer<?> newDelegatingInstance(JsonDeserializer<?> newDelegatee) {
            return new ShapeGuard(newDelegatee, opening);
        }

        @Override
        public Object deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return fits(p) ? super.deserialize(p, ctxt) : skip(p);
        }

        private boolean fits(JsonParser p) {
            if (opening == JsonToken.START_OBJECT) {
                // bean deserializers may be entered after the opening brace
                return p.hasToken(JsonToken.START_OBJECT)
                        || p.hasToken(JsonToken.FIELD_NAME)
                        || p.hasToken(JsonToken.END_OBJECT);
            }
            return p.hasToken(opening);
        }
    }
}
