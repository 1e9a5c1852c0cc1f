package org.example.depscan;

import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.Component;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;
import org.apache.maven.project.MavenProject;
import org.eclipse.aether.RepositorySystem;
import org.eclipse.aether.RepositorySystemSession;
import org.example.depscan.analysis.AnalysisReport;
import org.example.depscan.analysis.DependencyAnalyzer;
import org.example.depscan.analysis.DependencyRollup;
import org.example.depscan.config.ConfigurationValidator;
import org.example.depscan.config.EnvironmentConfigurationLoader;
import org.example.depscan.config.TraversalConfiguration;
import org.example.depscan.exception.ConfigurationException;
import org.example.depscan.exception.ResolutionException;
import org.example.depscan.model.DependencyNode;
import org.example.depscan.model.ProcessingMetrics;
import org.example.depscan.resolver.DependencyResolver;
import org.example.depscan.resolver.MavenDependencyResolver;
import org.example.depscan.traversal.IterativeDependencyTraverser;

import java.util.List;

/**
 * Analyses the project's resolved dependency graph: enumerates every
 * package, reports circular dependencies and rolls up transitive
 * dependency counts per direct dependency.
 *
 * Usage: mvn depscan:analyze
 */
@Mojo(name = "analyze", requiresProject = true, threadSafe = true)
public class AnalyzeDependenciesMojo extends AbstractMojo {

    // ========== Traversal Limits ==========
    // Unset parameters keep the value from the environment (or the default).

    /**
     * Maximum traversal depth (1-200).
     */
    @Parameter(property = "depscan.maxDepth")
    private Integer maxDepth;

    /**
     * Maximum number of nodes processed (100-500000).
     */
    @Parameter(property = "depscan.maxNodes")
    private Integer maxNodes;

    /**
     * Maximum processing time in milliseconds (60000-3600000).
     */
    @Parameter(property = "depscan.maxProcessingTimeMs")
    private Long maxProcessingTimeMs;

    /**
     * Number of circular references after which the traversal stops.
     */
    @Parameter(property = "depscan.maxCircularRefs")
    private Integer maxCircularRefs;

    /**
     * Iteration cap of each per-dependency transitive rollup.
     */
    @Parameter(property = "depscan.maxTransitiveNodes")
    private Integer maxTransitiveNodes;

    // ========== Behaviour ==========

    /**
     * Whether to fail the build when the graph cannot be resolved.
     */
    @Parameter(property = "depscan.failOnError", defaultValue = "false")
    private boolean failOnError;

    /**
     * Whether to fail the build when circular dependencies are found.
     */
    @Parameter(property = "depscan.failOnCycles", defaultValue = "false")
    private boolean failOnCycles;

    /**
     * Skips the analysis.
     */
    @Parameter(property = "depscan.skip", defaultValue = "false")
    private boolean skip;

    // ========== Maven Injected Components ==========

    @Parameter(defaultValue = "${project}", readonly = true, required = true)
    private MavenProject project;

    @Component
    private RepositorySystem repositorySystem;

    @Parameter(defaultValue = "${repositorySystemSession}", readonly = true)
    private RepositorySystemSession repositorySystemSession;

    // ========== Execution ==========

    @Override
    public void execute() throws MojoExecutionException, MojoFailureException {
        if (skip) {
            getLog().info("Dependency analysis skipped");
            return;
        }

        logBanner();

        TraversalConfiguration config;
        try {
            config = buildConfiguration();
        } catch (ConfigurationException e) {
            // Configuration errors always fail the build (ignore failOnError)
            logError("Configuration validation failed", e);
            throw new MojoExecutionException("Traversal configuration is invalid: " + e.getMessage(), e);
        }

        logConfigurationSummary(config);

        AnalysisReport report;
        try {
            DependencyResolver resolver = new MavenDependencyResolver(project, repositorySystem, repositorySystemSession);
            report = analyze(resolver, config);
        } catch (Exception e) {
            handleError(e);
            return;
        }

        logReport(report);

        if (failOnCycles && report.hasCycles()) {
            throw new MojoFailureException("Circular dependencies detected: " + report.getDetectedCycles().size());
        }

        logSuccess();
    }

    /**
     * Loads the configuration from the environment, applies plugin parameters and validates it.
     */
    TraversalConfiguration buildConfiguration() throws ConfigurationException {
        TraversalConfiguration.Builder builder = new EnvironmentConfigurationLoader().loadUnvalidated().toBuilder();

        if (maxDepth != null) {
            builder.maxDepth(maxDepth);
        }
        if (maxNodes != null) {
            builder.maxNodes(maxNodes);
        }
        if (maxProcessingTimeMs != null) {
            builder.maxProcessingTimeMs(maxProcessingTimeMs);
        }
        if (maxCircularRefs != null) {
            builder.maxCircularRefs(maxCircularRefs);
        }
        if (maxTransitiveNodes != null) {
            builder.maxTransitiveNodes(maxTransitiveNodes);
        }

        TraversalConfiguration config = builder.build();
        new ConfigurationValidator().validateOrThrow(config);
        getLog().debug("Configuration validated successfully");
        return config;
    }

    /**
     * Resolves the graph and runs the analysis.
     */
    AnalysisReport analyze(DependencyResolver resolver, TraversalConfiguration config) throws ResolutionException {
        getLog().info("Resolving dependencies...");
        List<DependencyNode> roots = resolver.resolve();
        getLog().info("Resolved " + roots.size() + " direct dependencies");

        getLog().info("Analysing dependency graph...");
        DependencyAnalyzer analyzer = new DependencyAnalyzer(new IterativeDependencyTraverser(config));
        return analyzer.analyze(roots);
    }

    /**
     * Handles errors based on failOnError flag.
     */
    private void handleError(Exception e) throws MojoExecutionException {
        logError("Analysis failed", e);

        if (failOnError) {
            throw new MojoExecutionException("Dependency analysis failed: " + e.getMessage(), e);
        } else {
            getLog().warn("Analysis failed but continuing build (failOnError=false)");
        }
    }

    // ========== Setters ==========

    void setMaxDepth(Integer maxDepth) {
        this.maxDepth = maxDepth;
    }

    void setMaxNodes(Integer maxNodes) {
        this.maxNodes = maxNodes;
    }

    void setMaxProcessingTimeMs(Long maxProcessingTimeMs) {
        this.maxProcessingTimeMs = maxProcessingTimeMs;
    }

    void setMaxCircularRefs(Integer maxCircularRefs) {
        this.maxCircularRefs = maxCircularRefs;
    }

    void setMaxTransitiveNodes(Integer maxTransitiveNodes) {
        this.maxTransitiveNodes = maxTransitiveNodes;
    }

    void setFailOnError(boolean failOnError) {
        this.failOnError = failOnError;
    }

    void setFailOnCycles(boolean failOnCycles) {
        this.failOnCycles = failOnCycles;
    }

    void setSkip(boolean skip) {
        this.skip = skip;
    }

    void setProject(MavenProject project) {
        this.project = project;
    }

    void setRepositorySystem(RepositorySystem repositorySystem) {
        this.repositorySystem = repositorySystem;
    }

    void setRepositorySystemSession(RepositorySystemSession repositorySystemSession) {
        this.repositorySystemSession = repositorySystemSession;
    }

    // ========== Logging ==========

    private void logBanner() {
        getLog().info("============================================================");
        getLog().info("Depscan Maven Plugin - Dependency Analysis");
        getLog().info("============================================================");
    }

    private void logConfigurationSummary(TraversalConfiguration config) {
        getLog().info("Configuration:");
        getLog().info("  Max depth: " + config.getMaxDepth());
        getLog().info("  Max nodes: " + config.getMaxNodes());
        getLog().info("  Max processing time: " + config.getMaxProcessingTimeMs() + "ms");
        getLog().info("  Max circular references: " + config.getMaxCircularRefs());
        getLog().info("  Memory thresholds: warning " + config.getMemoryWarningMB() +
                      "MB, critical " + config.getMemoryCriticalMB() + "MB");
        getLog().info("  Fail on error: " + failOnError);
        getLog().info("  Fail on cycles: " + failOnCycles);
        getLog().info("============================================================");
    }

    private void logReport(AnalysisReport report) {
        ProcessingMetrics metrics = report.getMetrics();

        getLog().info("============================================================");
        getLog().info("Analysis Results:");
        getLog().info("  Unique packages: " + metrics.getUniquePackages());
        getLog().info("  Nodes visited: " + metrics.getTotalNodes());
        getLog().info("  Max depth: " + metrics.getMaxDepth());
        getLog().info("  Circular references: " + metrics.getCircularReferences());
        getLog().info("  Transitive dependencies: " + report.getTotalTransitiveCount());
        getLog().info("  Vulnerable transitive: " + report.getTotalVulnerableCount());
        getLog().info("  Outdated transitive: " + report.getTotalOutdatedCount());
        getLog().info("  Max transitive depth: " + report.getMaxTransitiveDepth());
        getLog().info("  Execution time: " + metrics.getProcessingTimeMs() + "ms");

        if (metrics.isTruncated()) {
            getLog().warn("  Traversal truncated (" + metrics.getTerminationReason() +
                          "), results are partial");
        }
        if (metrics.getWarningsCount() > 0) {
            getLog().warn("  Warnings: " + metrics.getWarningsCount());
        }

        for (String cycle : report.getDetectedCycles()) {
            getLog().warn("  Cycle: " + cycle);
        }

        if (getLog().isDebugEnabled()) {
            for (DependencyRollup rollup : report.getRollups()) {
                getLog().debug("  " + rollup);
            }
        }
        getLog().info("============================================================");
    }

    private void logSuccess() {
        getLog().info("============================================================");
        getLog().info("Analysis completed successfully");
        getLog().info("============================================================");
    }

    private void logError(String message, Exception e) {
        getLog().error("============================================================");
        getLog().error("Depscan Analysis Failed: " + message);
        getLog().error("============================================================");
        getLog().error("Error: " + e.getMessage());
        if (getLog().isDebugEnabled()) {
            getLog().debug("Stack trace:", e);
        }
        getLog().error("============================================================");
    }
}
