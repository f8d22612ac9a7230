package com.obsinity.tracing.utils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/** Correlation ids (UUIDv7), name-derived source ids, and hex helpers. */
public final class TracingIdGenerator {
	private static final SecureRandom RNG = new SecureRandom();

	/** Namespace salt for name-derived source ids (482C2DB2-C390-47C8-87F8-1A15BFC130FB). */
	private static final byte[] NAMESPACE = {
		(byte) 0x48, (byte) 0x2C, (byte) 0x2D, (byte) 0xB2, (byte) 0xC3, (byte) 0x90, (byte) 0x47, (byte) 0xC8,
		(byte) 0x87, (byte) 0xF8, (byte) 0x1A, (byte) 0x15, (byte) 0xBF, (byte) 0xC1, (byte) 0x30, (byte) 0xFB
	};

	public static UUID generate() {
		long millis = Instant.now().toEpochMilli();             // 48 bits
		long msb = (millis & 0xFFFFFFFFFFFFL) << 16;            // timestamp << 16
		msb |= 0x7000L;                                         // version 7 in bits 12..15
		msb |= (RNG.nextLong() & 0x0FFFL);                      // 12-bit rand_a

		long lsb = RNG.nextLong();
		lsb = (lsb & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L; // set variant 10xx

		return new UUID(msb, lsb);
	}

	/**
	 * Stable id for an event source name: SHA-1 over the namespace salt followed by the upper-cased name in UTF-16BE,
	 * truncated to 16 bytes with the version nibble set to 5. The first three groups are read little-endian so the
	 * textual form matches what trace consumers compute for the same name.
	 */
	public static UUID fromName(String name) {
		final byte[] nameBytes = name.toUpperCase(Locale.ROOT).getBytes(StandardCharsets.UTF_16BE);
		final byte[] hash;
		try {
			MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
			sha1.update(NAMESPACE);
			sha1.update(nameBytes);
			hash = sha1.digest();
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-1 not available", e);
		}

		hash[7] = (byte) ((hash[7] & 0x0F) | 0x50);

		long msb = 0;
		for (int i : new int[] {3, 2, 1, 0, 5, 4, 7, 6}) {
			msb = (msb << 8) | (hash[i] & 0xFF);
		}
		long lsb = 0;
		for (int i = 8; i < 16; i++) {
			lsb = (lsb << 8) | (hash[i] & 0xFF);
		}
		return new UUID(msb, lsb);
	}

	private TracingIdGenerator() {}
}
