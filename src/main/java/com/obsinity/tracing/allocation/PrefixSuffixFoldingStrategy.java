package com.obsinity.tracing.allocation;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Strips a leading {@code begin}/{@code end} and a trailing {@code async} (any case), and uses the result only when
 * the contract also has a method of that name. {@code beginUpload}, {@code endUpload}, {@code uploadAsync} and
 * {@code upload} thus share one bit; {@code beginning} stays on its own.
 */
public class PrefixSuffixFoldingStrategy implements KeywordFoldingStrategy {

	private static final Pattern AFFIXES = Pattern.compile("(^(begin|end))|(async$)", Pattern.CASE_INSENSITIVE);

	@Override
	public String fold(String methodName, Set<String> contractMethodNames) {
		final String stripped = AFFIXES.matcher(methodName).replaceAll("");
		if (stripped.isEmpty() || stripped.equals(methodName)) return methodName;
		return contractMethodNames.contains(stripped.toLowerCase(Locale.ROOT)) ? stripped : methodName;
	}
}
