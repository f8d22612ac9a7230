package com.obsinity.tracing.allocation;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.ReflectionUtils;

import lombok.RequiredArgsConstructor;

import com.obsinity.tracing.configuration.TracingProperties;
import com.obsinity.tracing.contract.ContractDescription;
import com.obsinity.tracing.contract.ContractSettings;
import com.obsinity.tracing.exceptions.TracingConfigurationException;
import com.obsinity.tracing.model.MethodDescriptor;

/**
 * Assigns event ids and keyword bits.
 *
 * <p>Explicit ids must be positive and unique. The rest are handed out from {@code max(explicit) + 1}: declared
 * events first, in declaration order, then generated complements (completion before fault, method by method).
 *
 * <p>Without a keyword table, each distinct folded method name gets the next free bit, up to {@value #MAX_KEYWORD_BITS}
 * bits. Complements share the bit of the method they complement.
 */
@Component
@RequiredArgsConstructor
public class IdentifierAllocator {

	private static final Logger log = LoggerFactory.getLogger(IdentifierAllocator.class);

	/** Bits available to automatic keywords; the upper bits are reserved by event backends. */
	public static final int MAX_KEYWORD_BITS = 44;

	private final KeywordFoldingStrategy foldingStrategy;
	private final TracingProperties properties;

	public Allocation allocate(final ContractDescription description) {
		final String contract = description.contract().getName();
		final ContractSettings settings = description.settings();

		/* ---- ids ---- */
		final Map<Integer, String> explicit = new HashMap<>();
		for (MethodDescriptor d : description.declared()) {
			if (d.eventId() == 0) continue;
			if (d.eventId() < 0) {
				throw new TracingConfigurationException(contract + "#" + d.name(), "Event id must be positive");
			}
			final String previous = explicit.putIfAbsent(d.eventId(), d.eventName());
			if (previous != null) {
				throw new TracingConfigurationException(contract + "#" + d.name(),
						"Event id " + d.eventId() + " is used by both " + previous + " and " + d.eventName());
			}
		}
		int cursor = explicit.keySet().stream().mapToInt(Integer::intValue).max().orElse(0) + 1;

		final List<MethodDescriptor> declared = new ArrayList<>();
		for (MethodDescriptor d : description.declared()) {
			declared.add(d.eventId() > 0 ? d : d.withEventId(cursor++));
		}

		/* ---- keywords ---- */
		final Map<String, Long> keywordTable = new LinkedHashMap<>();
		if (settings.keywordTable() != null) {
			keywordTable.putAll(constants(settings.keywordTable(), long.class, Long.class));
			for (int i = 0; i < declared.size(); i++) {
				final MethodDescriptor d = declared.get(i);
				if (d.keywords() != 0) continue;
				final Long bits = lookup(keywordTable, d.name());
				if (bits != null) declared.set(i, d.withKeywords(bits));
			}
		} else if (settings.autoKeywords() || properties.isForceAutoKeywords()) {
			final Set<String> names = description.declared().stream()
					.map(d -> d.name().toLowerCase(Locale.ROOT))
					.collect(Collectors.toSet());
			final Map<String, Long> byKey = new LinkedHashMap<>();
			for (int i = 0; i < declared.size(); i++) {
				final MethodDescriptor d = declared.get(i);
				if (d.keywords() != 0) continue;
				final String key = foldingStrategy.fold(d.name(), names);
				final String lowered = key.toLowerCase(Locale.ROOT);
				Long bit = byKey.get(lowered);
				if (bit == null) {
					if (byKey.size() >= MAX_KEYWORD_BITS) {
						throw new TracingConfigurationException(contract,
								"Too many automatic keywords (more than " + MAX_KEYWORD_BITS
										+ "); fold method names or declare a keyword table");
					}
					bit = 1L << byKey.size();
					byKey.put(lowered, bit);
					keywordTable.put(key, bit);
				}
				declared.set(i, d.withKeywords(bit));
			}
		}

		/* ---- complements ---- */
		final Map<Method, MethodDescriptor> callsByMethod = new HashMap<>();
		declared.forEach(d -> callsByMethod.putIfAbsent(d.method(), d));
		final List<MethodDescriptor> complements = new ArrayList<>();
		for (MethodDescriptor c : description.complements()) {
			final MethodDescriptor call = callsByMethod.get(c.method());
			final long keywords = call != null ? call.keywords() : c.keywords();
			complements.add(c.withKeywords(keywords).withEventId(cursor++));
		}

		if (log.isDebugEnabled()) {
			declared.forEach(d -> log.debug("{} #{} {} keywords=0x{}", description.identity().name(), d.eventId(),
					d.eventName(), Long.toHexString(d.keywords())));
			complements.forEach(d -> log.debug("{} #{} {} keywords=0x{}", description.identity().name(),
					d.eventId(), d.eventName(), Long.toHexString(d.keywords())));
		}

		return new Allocation(
				declared,
				complements,
				keywordTable,
				constants(settings.taskTable(), int.class, Integer.class),
				constants(settings.opcodeTable(), int.class, Integer.class));
	}

	/** Public static final fields of {@code table} of the given type, by name. */
	@SuppressWarnings("unchecked")
	static <T> Map<String, T> constants(Class<?> table, Class<?> primitive, Class<T> boxed) {
		final Map<String, T> out = new LinkedHashMap<>();
		if (table == null) return out;
		for (Field f : table.getDeclaredFields()) {
			final int mod = f.getModifiers();
			if (!Modifier.isPublic(mod) || !Modifier.isStatic(mod) || !Modifier.isFinal(mod)) continue;
			if (f.getType() != primitive && f.getType() != boxed) continue;
			out.put(f.getName(), (T) ReflectionUtils.getField(f, null));
		}
		return out;
	}

	private static Long lookup(Map<String, Long> table, String name) {
		for (Map.Entry<String, Long> e : table.entrySet()) {
			if (e.getKey().equalsIgnoreCase(name)) return e.getValue();
		}
		return null;
	}
}
