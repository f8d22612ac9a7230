package com.obsinity.tracing.contract;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.asm.ClassReader;
import org.springframework.asm.ClassVisitor;
import org.springframework.asm.MethodVisitor;
import org.springframework.asm.SpringAsmInfo;
import org.springframework.asm.Type;
import org.springframework.util.ClassUtils;

/**
 * Declared methods of a type in source order. {@link Class#getDeclaredMethods()} guarantees no order, so the order is
 * read from the class file; when the bytes are not reachable, reflection order is used.
 */
final class DeclarationOrder {

	private static final Logger log = LoggerFactory.getLogger(DeclarationOrder.class);

	private DeclarationOrder() {}

	static List<Method> declaredMethods(Class<?> type) {
		final List<Method> methods = new ArrayList<>(Arrays.asList(type.getDeclaredMethods()));
		final Map<String, Integer> order = readOrder(type);
		if (order.isEmpty()) return methods;
		methods.sort(Comparator.comparingInt(m -> order.getOrDefault(key(m), Integer.MAX_VALUE)));
		return methods;
	}

	private static Map<String, Integer> readOrder(Class<?> type) {
		final ClassLoader loader = type.getClassLoader() != null ? type.getClassLoader() : ClassUtils.getDefaultClassLoader();
		final String resource = ClassUtils.convertClassNameToResourcePath(type.getName()) + ClassUtils.CLASS_FILE_SUFFIX;
		if (loader == null) return Map.of();

		try (InputStream in = loader.getResourceAsStream(resource)) {
			if (in == null) {
				log.debug("No class file for {}; using reflection order", type.getName());
				return Map.of();
			}
			final Map<String, Integer> order = new HashMap<>();
			new ClassReader(in).accept(new ClassVisitor(SpringAsmInfo.ASM_VERSION) {
				@Override
				public MethodVisitor visitMethod(
						int access, String name, String descriptor, String signature, String[] exceptions) {
					order.putIfAbsent(name + descriptor, order.size());
					return null;
				}
			}, ClassReader.SKIP_CODE | ClassReader.SKIP_DEBUG | ClassReader.SKIP_FRAMES);
			return order;
		} catch (IOException | RuntimeException e) {
			log.debug("Could not read class file of {}; using reflection order", type.getName(), e);
			return Map.of();
		}
	}

	private static String key(Method m) {
		return m.getName() + Type.getMethodDescriptor(m);
	}
}
