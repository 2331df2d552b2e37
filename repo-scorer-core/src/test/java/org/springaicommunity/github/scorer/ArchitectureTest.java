package org.springaicommunity.github.scorer;

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
 * <li>{@link GitHubClient} - GraphQL transport</li>
 * <li>{@link GraphQLService} - query execution and response parsing</li>
 * </ul>
 *
 * <h3>Dependency Rules</h3> <pre>
 *   Services, classifier, scorer → GraphQLService (NOT the HTTP transport)
 *   Models → nothing that performs I/O
 * </pre>
 */
@AnalyzeClasses(packages = "org.springaicommunity.github.scorer", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

	// ========== Interface Dependency Rules ==========

	@ArchTest
	static final ArchRule github_services_should_depend_on_client_interface = noClasses().that()
		.haveSimpleNameEndingWith("Service")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubHttpClient")
		.because("Services should depend on GitHubClient interface, not the concrete GitHubHttpClient");

	@ArchTest
	static final ArchRule scoring_should_not_depend_on_graphql_implementation = noClasses().that()
		.haveSimpleNameEndingWith("CollectionService")
		.or()
		.haveSimpleName("RepositoryCountService")
		.or()
		.haveSimpleName("UserSignificanceClassifier")
		.or()
		.haveSimpleName("EngagementScorer")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubGraphQLService")
		.because("Scoring components should depend on the GraphQLService interface");

	@ArchTest
	static final ArchRule github_clients_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("HttpClient")
		.should()
		.implement(GitHubClient.class)
		.because("HTTP clients should implement the GitHubClient interface");

	// ========== Layering Rules ==========

	@ArchTest
	static final ArchRule models_should_not_depend_on_services = noClasses().that()
		.haveSimpleNameEndingWith("Result")
		.or()
		.haveSimpleNameEndingWith("Counts")
		.or()
		.haveSimpleNameEndingWith("Profile")
		.or()
		.haveSimpleNameEndingWith("Id")
		.or()
		.haveSimpleNameEndingWith("Configuration")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Service")
		.because("Data models should be independent of service layer");

	@ArchTest
	static final ArchRule utilities_should_not_depend_on_services = noClasses().that()
		.haveSimpleNameEndingWith("Utils")
		.or()
		.haveSimpleNameEndingWith("Factory")
		.or()
		.haveSimpleName("ArgumentParser")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Service")
		.because("Utilities and parsers should not depend on services");

	@ArchTest
	static final ArchRule services_should_not_depend_on_scorer = noClasses().that()
		.haveSimpleNameEndingWith("Service")
		.or()
		.haveSimpleName("UserSignificanceClassifier")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("EngagementScorer")
		.because("The scorer orchestrates services, not the other way round");

}
