package org.pragmatica.sentinel.engine;

import io.vavr.control.Either;
import org.pragmatica.sentinel.shared.SentinelError;
import org.pragmatica.sentinel.rule.LintRule;
import org.pragmatica.sentinel.rule.Violation;
import org.pragmatica.sentinel.rule.ViolationCollector;
import org.pragmatica.sentinel.traversal.RegionTracker;
import org.pragmatica.sentinel.traversal.TreeWalker;
import org.pragmatica.sentinel.tree.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hosts any number of rules on a single walk of each tree.
 *
 * Every traversal gets its own {@link RegionTracker} and {@link ViolationCollector}, so one engine
 * instance can analyze independent trees from several threads at once.
 */
public final class RuleEngine {
    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final List<LintRule> rules;
    private final TreeWalker walker;

    private RuleEngine(List<LintRule> rules, EngineConfig config) {
        this.rules = List.copyOf(rules);
        this.walker = TreeWalker.treeWalker(config.maxDepth());
    }

    public static RuleEngine ruleEngine(List<LintRule> rules) {
        return new RuleEngine(rules, EngineConfig.defaultConfig());
    }

    public static RuleEngine ruleEngine(List<LintRule> rules, EngineConfig config) {
        return new RuleEngine(rules, config);
    }

    public List<LintRule> rules() {
        return rules;
    }

    /**
     * Run all rules over one tree.
     *
     * @return violations in traversal order, or the traversal error
     */
    public Either<SentinelError, List<Violation>> analyze(Node root) {
        var collector = ViolationCollector.violationCollector();

        return walker.traverse(root,
                               RegionTracker.regionTracker(),
                               (node, context) -> rules.forEach(rule -> rule.evaluate(node, context)
                                                                            .peek(collector::record)))
                     .map(visited -> collector.drain())
                     .peek(violations -> log.debug("{} violation(s) in tree of {} nodes",
                                                   violations.size(),
                                                   root.size()));
    }

    /**
     * Analyze independent trees on the given executor.
     *
     * Results are concatenated in the order of {@code roots}. Order between violations of different
     * trees carries no meaning beyond that. The first failing tree fails the whole call, and tasks
     * still pending or running at that point are cancelled.
     */
    public Either<SentinelError, List<Violation>> analyzeAll(List<Node> roots, ExecutorService executor) {
        var futures = new ArrayList<Future<Either<SentinelError, List<Violation>>>>(roots.size());

        try {
            for (var root : roots) {
                futures.add(executor.submit(() -> analyze(root)));
            }

            var combined = new ArrayList<Violation>();

            for (var future : futures) {
                var result = await(future);

                if (result.isLeft()) {
                    return result;
                }
                combined.addAll(result.get());
            }
            return Either.right(List.copyOf(combined));
        } catch (RejectedExecutionException e) {
            return Either.left(SentinelError.unexpected("Executor rejected analysis task: " + e.getMessage()));
        } finally {
            // No-op for completed tasks
            futures.forEach(future -> future.cancel(true));
        }
    }

    private static Either<SentinelError, List<Violation>> await(Future<Either<SentinelError, List<Violation>>> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Either.left(SentinelError.unexpected("Interrupted while waiting for analysis"));
        } catch (ExecutionException e) {
            return Either.left(SentinelError.unexpected(e.getCause()));
        }
    }
}
