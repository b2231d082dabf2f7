package org.springaicommunity.github.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Maps provider identifiers to factories and hands out one provider instance per
 * identifier.
 *
 * <p>
 * Providers are created on first lookup, from settings taken from the supplier at that
 * moment, and the same instance is returned afterwards. Example:
 *
 * <pre>
 * {@code
 * ProviderRegistry registry = ProviderRegistry.discover(ProviderSettings::fromEnvironment);
 * GitHubProvider github = registry.lookup("github", GitHubProvider.class);
 * }
 * </pre>
 */
public class ProviderRegistry {

	private static final Logger logger = LoggerFactory.getLogger(ProviderRegistry.class);

	private final Supplier<ProviderSettings> settings;

	private final ConcurrentMap<String, ProviderFactory> factories = new ConcurrentHashMap<>();

	private final ConcurrentMap<String, Object> providers = new ConcurrentHashMap<>();

	public ProviderRegistry(Supplier<ProviderSettings> settings) {
		this.settings = settings;
	}

	/**
	 * Create a registry holding the built-in {@code github} and {@code github-async}
	 * providers.
	 * @param settings supplier of provider settings
	 * @return the registry
	 */
	public static ProviderRegistry withDefaults(Supplier<ProviderSettings> settings) {
		return new ProviderRegistry(settings).register(new GitHubProviderFactory())
			.register(new AsyncGitHubProviderFactory());
	}

	/**
	 * Create a registry holding every {@link ProviderFactory} found on the class path.
	 * The built-in providers are declared there too.
	 * @param settings supplier of provider settings
	 * @return the registry
	 */
	public static ProviderRegistry discover(Supplier<ProviderSettings> settings) {
		ProviderRegistry registry = new ProviderRegistry(settings);
		for (ProviderFactory factory : ServiceLoader.load(ProviderFactory.class)) {
			registry.register(factory);
		}
		logger.debug("Discovered providers: {}", registry.identifiers());
		return registry;
	}

	/**
	 * Register a factory, replacing any factory with the same identifier.
	 * @param factory the factory
	 * @return this registry
	 */
	public ProviderRegistry register(ProviderFactory factory) {
		factories.put(factory.name(), factory);
		return this;
	}

	/**
	 * Look up a provider, creating it on first use.
	 * @param identifier provider identifier
	 * @return the provider
	 * @throws ConfigurationException if no factory is registered under the identifier, or
	 * the settings name no usable credential
	 */
	public Object lookup(String identifier) {
		ProviderFactory factory = factories.get(identifier);
		if (factory == null) {
			throw new ConfigurationException(
					"Unknown provider '" + identifier + "', registered providers: " + identifiers());
		}
		return providers.computeIfAbsent(identifier, id -> {
			logger.debug("Creating provider {}", id);
			return factory.create(settings.get());
		});
	}

	/**
	 * Look up a provider of a known type.
	 * @param identifier provider identifier
	 * @param type expected provider type
	 * @param <T> provider type
	 * @return the provider
	 * @throws ConfigurationException if the identifier is unknown or names a provider of
	 * another type
	 */
	public <T> T lookup(String identifier, Class<T> type) {
		Object provider = lookup(identifier);
		if (!type.isInstance(provider)) {
			throw new ConfigurationException("Provider '" + identifier + "' is a " + provider.getClass().getName()
					+ ", not a " + type.getName());
		}
		return type.cast(provider);
	}

	public Set<String> identifiers() {
		return new TreeSet<>(factories.keySet());
	}

	Map<String, Object> createdProviders() {
		return Map.copyOf(providers);
	}

}
