package com.clarity.serving.service.cache;

import com.clarity.serving.config.ServingProperties;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.zip.CRC32C;

/**
 * Cache key for an actigraphy request.
 *
 * Built from the user id, the sample count, a few leading and trailing values and a CRC32C
 * over every value, then hashed with SHA-256. Cheap to compute and not meant to be secure.
 */
@Component
public class FingerprintGenerator {

    private final int sampleSize;

    @Autowired
    public FingerprintGenerator(ServingProperties properties) {
        this(properties.getCache().getFingerprintSampleSize());
    }

    public FingerprintGenerator(int sampleSize) {
        this.sampleSize = sampleSize;
    }

    public String generate(String userId, float[] values) {
        StringBuilder key = new StringBuilder()
                .append(userId)
                .append('_')
                .append(values.length);

        if (values.length > 0) {
            key.append('_');
            appendValues(key, values, 0, Math.min(sampleSize, values.length));
            key.append('_');
            appendValues(key, values, Math.max(0, values.length - sampleSize), values.length);
            key.append('_').append(Long.toHexString(checksum(values)));
        }

        return DigestUtils.sha256Hex(key.toString());
    }

    private static void appendValues(StringBuilder key, float[] values, int from, int to) {
        for (int i = from; i < to; i++) {
            if (i > from) {
                key.append(',');
            }
            key.append(Integer.toHexString(Float.floatToIntBits(values[i])));
        }
    }

    private static long checksum(float[] values) {
        CRC32C crc = new CRC32C();
        for (float value : values) {
            int bits = Float.floatToIntBits(value);
            crc.update(bits >>> 24);
            crc.update(bits >>> 16);
            crc.update(bits >>> 8);
            crc.update(bits);
        }
        return crc.getValue();
    }
}
