package org.example.depscan.resolver;

import org.apache.maven.project.MavenProject;
import org.eclipse.aether.RepositorySystem;
import org.eclipse.aether.RepositorySystemSession;
import org.eclipse.aether.artifact.Artifact;
import org.eclipse.aether.artifact.DefaultArtifact;
import org.eclipse.aether.collection.CollectRequest;
import org.eclipse.aether.collection.CollectResult;
import org.eclipse.aether.collection.DependencyCollectionException;
import org.eclipse.aether.graph.Dependency;
import org.example.depscan.exception.ResolutionException;
import org.example.depscan.model.DependencyNode;
import org.example.depscan.model.PackageCoordinate;
import org.example.depscan.model.PackageStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves the project's dependency graph with the Maven Resolver (Aether) API.
 *
 * <p>Packages are named {@code groupId:artifactId}. The collected tree is
 * converted with an explicit stack; nodes that share a key become one
 * shared {@link DependencyNode}, which turns repeated subtrees into
 * diamonds. Nodes the resolver omitted for a version conflict are left out.</p>
 */
public class MavenDependencyResolver implements DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(MavenDependencyResolver.class);

    private static final String CONFLICT_WINNER = "conflict.winner";

    private final MavenProject project;
    private final RepositorySystem repositorySystem;
    private final RepositorySystemSession session;

    public MavenDependencyResolver(MavenProject project,
                                   RepositorySystem repositorySystem,
                                   RepositorySystemSession session) {
        this.project = project;
        this.repositorySystem = repositorySystem;
        this.session = session;
    }

    @Override
    public List<DependencyNode> resolve() throws ResolutionException {
        log.info("Resolving dependencies for {}:{}:{}",
                project.getGroupId(), project.getArtifactId(), project.getVersion());

        try {
            CollectRequest collectRequest = new CollectRequest();
            collectRequest.setRoot(new Dependency(
                    new DefaultArtifact(
                            project.getGroupId(),
                            project.getArtifactId(),
                            project.getPackaging(),
                            project.getVersion()
                    ), null
            ));

            for (org.apache.maven.model.Dependency dep : project.getDependencies()) {
                collectRequest.addDependency(new Dependency(
                        new DefaultArtifact(
                                dep.getGroupId(),
                                dep.getArtifactId(),
                                dep.getClassifier(),
                                dep.getType() != null ? dep.getType() : "jar",
                                dep.getVersion()
                        ),
                        dep.getScope(),
                        dep.isOptional()
                ));
            }

            collectRequest.setRepositories(project.getRemoteProjectRepositories());

            CollectResult collectResult = repositorySystem.collectDependencies(session, collectRequest);
            if (!collectResult.getCycles().isEmpty()) {
                log.debug("Resolver reported {} cycle(s)", collectResult.getCycles().size());
            }

            List<DependencyNode> roots = convert(collectResult.getRoot());
            log.info("Resolved {} direct dependencies", roots.size());
            return roots;

        } catch (DependencyCollectionException e) {
            throw new ResolutionException("Failed to collect dependencies: " + e.getMessage(), e);
        }
    }

    /**
     * Converts the resolver's tree below {@code root} into shared dependency nodes.
     */
    List<DependencyNode> convert(org.eclipse.aether.graph.DependencyNode root) {
        List<DependencyNode> roots = new ArrayList<>();
        if (root == null) {
            return roots;
        }

        Map<String, DependencyNode> nodesByKey = new HashMap<>();
        Set<String> rootKeys = new HashSet<>();
        Deque<PendingNode> stack = new ArrayDeque<>();
        List<org.eclipse.aether.graph.DependencyNode> directChildren = root.getChildren();
        for (int i = directChildren.size() - 1; i >= 0; i--) {
            stack.push(new PendingNode(directChildren.get(i), null, 1));
        }

        while (!stack.isEmpty()) {
            PendingNode pending = stack.pop();
            Dependency dep = pending.source.getDependency();
            if (dep == null) {
                continue;
            }
            if (isOmittedForConflict(pending.source)) {
                log.debug("Conflict detected: {} (omitted)", dep.getArtifact());
                continue;
            }

            Artifact artifact = dep.getArtifact();
            String name = artifact.getGroupId() + ":" + artifact.getArtifactId();
            String key = PackageCoordinate.keyOf(name, artifact.getVersion());

            DependencyNode node = nodesByKey.get(key);
            boolean firstSeen = node == null;
            if (firstSeen) {
                node = new DependencyNode(name, artifact.getVersion(), PackageStatus.CLEAN,
                        dep.getScope() != null && !dep.getScope().isEmpty() ? dep.getScope() : "compile",
                        pending.depth);
                nodesByKey.put(key, node);
            }

            if (pending.parent == null) {
                if (rootKeys.add(key)) {
                    roots.add(node);
                }
            } else {
                pending.parent.addDependencyIfAbsent(node);
            }

            if (firstSeen) {
                List<org.eclipse.aether.graph.DependencyNode> children = pending.source.getChildren();
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(new PendingNode(children.get(i), node, pending.depth + 1));
                }
            }
        }

        log.debug("Converted {} distinct packages", nodesByKey.size());
        return roots;
    }

    /**
     * Checks if a node was omitted due to a version conflict.
     */
    private boolean isOmittedForConflict(org.eclipse.aether.graph.DependencyNode node) {
        Map<?, ?> data = node.getData();
        return data != null && data.get(CONFLICT_WINNER) != null;
    }

    private static final class PendingNode {
        private final org.eclipse.aether.graph.DependencyNode source;
        private final DependencyNode parent;
        private final int depth;

        private PendingNode(org.eclipse.aether.graph.DependencyNode source, DependencyNode parent, int depth) {
            this.source = source;
            this.parent = parent;
            this.depth = depth;
        }
    }
}
