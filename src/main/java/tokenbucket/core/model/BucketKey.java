package tokenbucket.core.model;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Opaque, immutable identifier of a token bucket.
 *
 * Keys are compared by content. A String key is stored as its UTF-8 bytes,
 * so {@code BucketKey.of("a")} and {@code BucketKey.of("a".getBytes(UTF_8))}
 * name the same bucket. Strings that are not well-formed UTF-16 (an unpaired
 * surrogate) have no UTF-8 form and are rejected rather than replaced, so two
 * distinct strings never share a bucket.
 *
 * Factories reject invalid input with a plain {@link IllegalArgumentException};
 * the limiter's String and byte[] overloads check keys first and report them
 * with its own exception types.
 */
public final class BucketKey {

    private final byte[] bytes;
    private final int hash;

    private BucketKey(byte[] bytes) {
        if (bytes.length == 0) {
            throw new IllegalArgumentException("key cannot be empty");
        }
        this.bytes = bytes;
        this.hash = Arrays.hashCode(bytes);
    }

    /**
     * @throws IllegalArgumentException if key is null, empty or contains an unpaired surrogate
     */
    public static BucketKey of(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return new BucketKey(encode(key));
    }

    public static BucketKey of(byte[] key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return new BucketKey(key.clone());
    }

    private static byte[] encode(String key) {
        CharsetEncoder encoder = StandardCharsets.UTF_8.newEncoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            ByteBuffer encoded = encoder.encode(CharBuffer.wrap(key));
            byte[] bytes = new byte[encoded.remaining()];
            encoded.get(bytes);
            return bytes;
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("key is not well-formed UTF-16 (unpaired surrogate)", e);
        }
    }

    /**
     * @return a copy of the key bytes
     */
    public byte[] toBytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BucketKey)) return false;
        BucketKey other = (BucketKey) o;
        return hash == other.hash && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
