package org.springaicommunity.github.provider;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Architecture tests using ArchUnit to enforce dependency rules and layering.
 *
 * <h3>Interfaces (Contracts)</h3>
 * <ul>
 * <li>{@link GitHubClient} - HTTP operations for GitHub API</li>
 * <li>{@link ProviderFactory} - Registry entries</li>
 * </ul>
 *
 * <h3>Dependency Rules</h3> <pre>
 *   Caches, exchange, dispatchers → GitHubClient (NOT GitHubHttpClient)
 *   Blocking path ↛ async path, and the reverse
 *   Only GitHubProviderConfig touches Spring
 * </pre>
 */
@AnalyzeClasses(packages = "org.springaicommunity.github.provider",
		importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

	// ========== Interface Dependency Rules ==========

	@ArchTest
	static final ArchRule token_and_dispatch_classes_should_depend_on_client_interface = noClasses().that()
		.haveSimpleNameEndingWith("Dispatcher")
		.or()
		.haveSimpleNameEndingWith("TokenCache")
		.or()
		.haveSimpleName("InstallationTokenExchange")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubHttpClient")
		.because("Token handling and dispatch should depend on the GitHubClient interface");

	@ArchTest
	static final ArchRule http_clients_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("HttpClient")
		.should()
		.implement(GitHubClient.class)
		.because("All *HttpClient classes should implement the GitHubClient interface");

	@ArchTest
	static final ArchRule factories_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("ProviderFactory")
		.and()
		.doNotHaveSimpleName("ProviderFactory")
		.should()
		.implement(ProviderFactory.class)
		.because("Registry entries are discovered as ProviderFactory services");

	// ========== Execution Model Rules ==========

	@ArchTest
	static final ArchRule blocking_facade_should_not_use_async_path = noClasses().that()
		.haveSimpleName("GitHubProvider")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameStartingWith("Async")
		.because("A facade commits to one execution model");

	@ArchTest
	static final ArchRule async_facade_should_not_use_blocking_path = noClasses().that()
		.haveSimpleName("AsyncGitHubProvider")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("InstallationTokenCache")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("GraphQLDispatcher")
		.because("A facade commits to one execution model");

	// ========== Model Independence ==========

	@ArchTest
	static final ArchRule models_should_not_depend_on_transport = noClasses().that()
		.haveSimpleNameStartingWith("GraphQL")
		.and()
		.haveSimpleNameNotEndingWith("Dispatcher")
		.and()
		.haveSimpleNameNotEndingWith("Codec")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Client")
		.because("GraphQL model types should be pure data");

	// ========== Framework Rules ==========

	@ArchTest
	static final ArchRule only_config_should_use_spring = noClasses().that()
		.doNotHaveSimpleName("GitHubProviderConfig")
		.should()
		.dependOnClassesThat()
		.resideInAPackage("org.springframework..")
		.because("The provider must work without Spring; only GitHubProviderConfig integrates it");

	@ArchTest
	static final ArchRule only_minter_should_use_jose = noClasses().that()
		.doNotHaveSimpleName("AppJwtMinter")
		.should()
		.dependOnClassesThat()
		.resideInAPackage("com.nimbusds..")
		.because("JWT signing is confined to AppJwtMinter");

}
