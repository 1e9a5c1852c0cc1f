package org.example.depscan.resolver;

import org.example.depscan.exception.ResolutionException;
import org.example.depscan.model.DependencyNode;

import java.util.List;

/**
 * Interface for dependency resolvers.
 */
public interface DependencyResolver {

    /**
     * Resolves the dependency graph of the current project.
     *
     * @return the direct dependencies; transitive ones hang below them and
     *         nodes with the same {@code name@version} are shared instances
     * @throws ResolutionException if resolution fails
     */
    List<DependencyNode> resolve() throws ResolutionException;
}
