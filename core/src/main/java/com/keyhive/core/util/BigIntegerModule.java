package com.keyhive.core.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;

import java.io.IOException;
import java.math.BigInteger;

/**
 * Jackson codec writing {@link BigInteger} as a decimal string.
 * <p>
 * Reading accepts a decimal string or an integral JSON number. Floating-point
 * tokens are rejected: a double cannot carry a key count of this magnitude.
 * </p>
 */
public class BigIntegerModule extends SimpleModule {

    public BigIntegerModule() {
        super("keyhive-big-integer");
        addSerializer(BigInteger.class, ToStringSerializer.instance);
        addDeserializer(BigInteger.class, new DecimalStringDeserializer());
    }

    static final class DecimalStringDeserializer extends StdScalarDeserializer<BigInteger> {

        DecimalStringDeserializer() {
            super(BigInteger.class);
        }

        @Override
        public BigInteger deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonToken token = p.currentToken();
            if (token == JsonToken.VALUE_NUMBER_INT) {
                return p.getBigIntegerValue();
            }
            if (token == JsonToken.VALUE_STRING) {
                String text = p.getText().trim();
                try {
                    return new BigInteger(text);
                } catch (NumberFormatException e) {
                    return (BigInteger) ctxt.handleWeirdStringValue(BigInteger.class, text,
                        "not a decimal integer");
                }
            }
            return (BigInteger) ctxt.handleUnexpectedToken(BigInteger.class, p);
        }
    }
}
