package ru.mail.polis.maglev.hash;

import com.google.common.hash.Funnel;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hasher;

import javax.annotation.Nonnull;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;

import static com.google.common.base.Preconditions.checkPositionIndexes;
import static com.google.common.base.Preconditions.checkState;

/**
 * Base for hashers that consume a plain byte stream.
 * Multi-byte primitives are written little-endian, like Guava's own hashers.
 */
abstract class LittleEndianHasher implements Hasher {
    private boolean done;

    protected abstract void update(byte b);

    protected void update(byte[] bytes, int off, int len) {
        for (int i = off; i < off + len; i++) {
            update(bytes[i]);
        }
    }

    @Nonnull
    protected abstract HashCode makeHash();

    private void updateLittleEndian(long value, int bytes) {
        for (int i = 0; i < bytes; i++) {
            update((byte) (value >>> (i * Byte.SIZE)));
        }
    }

    private void ensureOpen() {
        checkState(!done, "hash() has already been called on this hasher");
    }

    @Override
    public Hasher putByte(byte b) {
        ensureOpen();
        update(b);
        return this;
    }

    @Override
    public Hasher putBytes(byte[] bytes) {
        return putBytes(bytes, 0, bytes.length);
    }

    @Override
    public Hasher putBytes(byte[] bytes, int off, int len) {
        checkPositionIndexes(off, off + len, bytes.length);
        ensureOpen();
        update(bytes, off, len);
        return this;
    }

    @Override
    public Hasher putBytes(ByteBuffer bytes) {
        ensureOpen();
        if (bytes.hasArray()) {
            update(bytes.array(), bytes.arrayOffset() + bytes.position(), bytes.remaining());
            bytes.position(bytes.limit());
        } else {
            while (bytes.hasRemaining()) {
                update(bytes.get());
            }
        }
        return this;
    }

    @Override
    public Hasher putShort(short s) {
        ensureOpen();
        updateLittleEndian(s, Short.BYTES);
        return this;
    }

    @Override
    public Hasher putInt(int i) {
        ensureOpen();
        updateLittleEndian(i, Integer.BYTES);
        return this;
    }

    @Override
    public Hasher putLong(long l) {
        ensureOpen();
        updateLittleEndian(l, Long.BYTES);
        return this;
    }

    @Override
    public Hasher putFloat(float f) {
        return putInt(Float.floatToRawIntBits(f));
    }

    @Override
    public Hasher putDouble(double d) {
        return putLong(Double.doubleToRawLongBits(d));
    }

    @Override
    public Hasher putBoolean(boolean b) {
        return putByte(b ? (byte) 1 : (byte) 0);
    }

    @Override
    public Hasher putChar(char c) {
        ensureOpen();
        updateLittleEndian(c, Character.BYTES);
        return this;
    }

    @Override
    public Hasher putUnencodedChars(CharSequence charSequence) {
        for (int i = 0; i < charSequence.length(); i++) {
            putChar(charSequence.charAt(i));
        }
        return this;
    }

    @Override
    public Hasher putString(CharSequence charSequence, Charset charset) {
        return putBytes(charSequence.toString().getBytes(charset));
    }

    @Override
    public <T> Hasher putObject(T instance, Funnel<? super T> funnel) {
        funnel.funnel(instance, this);
        return this;
    }

    @Override
    public HashCode hash() {
        ensureOpen();
        done = true;
        return makeHash();
    }

    /**
     * @deprecated returns the identity hash code, use {@link #hash()} for the digest.
     */
    @Override
    @Deprecated
    public int hashCode() {
        return super.hashCode();
    }
}
