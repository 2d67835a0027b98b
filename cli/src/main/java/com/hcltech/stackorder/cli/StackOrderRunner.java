package com.hcltech.stackorder.cli;

import com.hcltech.stackorder.common.errorsor.ErrorsOr;
import com.hcltech.stackorder.config.discovery.StackDirectoryFinder;
import com.hcltech.stackorder.config.loader.StackConfigLoader;
import com.hcltech.stackorder.config.loader.StackDefinition;
import com.hcltech.stackorder.dag.CycleDetectedException;
import com.hcltech.stackorder.dag.DirectoryProbe;
import com.hcltech.stackorder.dag.GraphObserver;
import com.hcltech.stackorder.dag.OrderedStack;
import com.hcltech.stackorder.dag.StackGraph;
import com.hcltech.stackorder.dag.Topo;
import com.hcltech.stackorder.dag.UnknownDependencyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Discover, load, build, validate, order. Any failure ends the run without a partial plan.
 */
public final class StackOrderRunner {
    private static final Logger log = LoggerFactory.getLogger(StackOrderRunner.class);

    private final StackConfigLoader loader;

    public StackOrderRunner() {
        this(new StackConfigLoader());
    }

    public StackOrderRunner(StackConfigLoader loader) {
        this.loader = loader;
    }

    public ErrorsOr<List<OrderedStack>> run(RunSettings settings) {
        Path base = settings.baseDirectory().toAbsolutePath().normalize();
        return StackDirectoryFinder.find(base, settings.maxDepth())
                .flatMap(files -> loader.loadAll(base, files))
                .flatMap(definitions -> order(base, definitions, settings));
    }

    private ErrorsOr<List<OrderedStack>> order(Path base, List<StackDefinition> definitions, RunSettings settings) {
        DotGraphObserver dot = settings.draw() ? new DotGraphObserver() : null;
        StackGraph graph = new StackGraph(base, DirectoryProbe.filesystem(), dot == null ? GraphObserver.NONE : dot);
        try {
            for (StackDefinition d : definitions) {
                graph.insert(d.stackId(), d.dependencies(), d.config());
            }
            log.info("Built graph of {} stacks from {} files", graph.size(), definitions.size());
            if (dot != null) writeDot(settings.dotFile(), dot);
            return ErrorsOr.lift(Topo.validateAndOrder(graph, settings.sortOrder()));
        } catch (UnknownDependencyException e) {
            return ErrorsOr.error(e.getMessage() + "/" + StackDirectoryFinder.FILE_NAME);
        } catch (CycleDetectedException e) {
            return ErrorsOr.error(e.getMessage());
        } catch (IOException e) {
            return ErrorsOr.error("Failed to write DOT file: {0}: {1}", e);
        }
    }

    private static void writeDot(Path dotFile, DotGraphObserver dot) throws IOException {
        Path parent = dotFile.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(dotFile, dot.toDot());
        log.info("Wrote dependency graph to {}", dotFile);
    }
}
