package org.springaicommunity.github.provider;

/**
 * Creates a provider for a registry identifier. Implementations are registered on a
 * {@link ProviderRegistry} directly or discovered through
 * {@link java.util.ServiceLoader}, and need a public no-argument constructor for the
 * latter.
 */
public interface ProviderFactory {

	/**
	 * Registry identifier, such as {@code github}.
	 * @return identifier
	 */
	String name();

	/**
	 * Create a provider.
	 * @param settings provider settings
	 * @return the provider instance
	 * @throws ConfigurationException if the settings name no usable credential
	 */
	Object create(ProviderSettings settings);

}
