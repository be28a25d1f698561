package eu.virtualparadox.ctxstore.catalog.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Stores a dense vector as little-endian float bytes.
 */
@Converter
public class FloatArrayConverter implements AttributeConverter<float[], byte[]> {

    @Override
    public byte[] convertToDatabaseColumn(final float[] attribute) {
        if (attribute == null) {
            return null;
        }
        final ByteBuffer buffer = ByteBuffer.allocate(attribute.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        buffer.asFloatBuffer().put(attribute);
        return buffer.array();
    }

    @Override
    public float[] convertToEntityAttribute(final byte[] dbData) {
        if (dbData == null) {
            return null;
        }
        final float[] out = new float[dbData.length / Float.BYTES];
        ByteBuffer.wrap(dbData).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer().get(out);
        return out;
    }
}
