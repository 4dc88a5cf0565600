package org.pycatalyst.compiler.frontend.irgen.ported;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of the ported library functions, keyed by source name.
 */
public final class PortedFunctionRegistry {

	private final Map<String, IPortedFunction> byName = new HashMap<>();

	private PortedFunctionRegistry() {}

	/**
	 * Registers a function under its own name, replacing any previous registration.
	 * @param function The function.
	 */
	public void register(IPortedFunction function) {
		byName.put(function.name(), function);
	}

	public Optional<IPortedFunction> get(String name) {
		return Optional.ofNullable(byName.get(name));
	}

	/**
	 * @return An empty registry.
	 */
	public static PortedFunctionRegistry initialize() {
		return new PortedFunctionRegistry();
	}

	/**
	 * @return A registry holding {@code print}, {@code sqrt}, {@code pow}, {@code log} and {@code len}.
	 */
	public static PortedFunctionRegistry initializeWithDefaults() {
		PortedFunctionRegistry reg = initialize();
		reg.register(new PrintFunction());
		reg.register(new SqrtFunction());
		reg.register(new PowFunction());
		reg.register(new LogFunction());
		reg.register(new LenFunction());
		return reg;
	}
}
