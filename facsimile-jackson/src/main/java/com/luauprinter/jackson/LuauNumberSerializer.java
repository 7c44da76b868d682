package com.luauprinter.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/**
 * Writes Luau numbers. Integral values that a double holds exactly are
 * written without a fraction; infinities and NaN, which JSON cannot express
 * as numbers, are written as the strings Jackson reads back into doubles.
 */
public class LuauNumberSerializer extends JsonSerializer<Double> {

    private static final double MAX_SAFE_INTEGER = 9007199254740992.0;

    @Override
    public void serialize(Double value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        double d = value;
        if (Double.isNaN(d)) {
            gen.writeString("NaN");
        } else if (Double.isInfinite(d)) {
            gen.writeString(d > 0 ? "Infinity" : "-Infinity");
        } else if (d == Math.floor(d) && Math.abs(d) <= MAX_SAFE_INTEGER && !isNegativeZero(d)) {
            gen.writeNumber((long) d);
        } else {
            gen.writeNumber(d);
        }
    }

    private static boolean isNegativeZero(double d) {
        return d == 0.0 && Double.doubleToRawLongBits(d) != 0L;
    }
}
