package org.ppvariant.cli.commands;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.Callable;

import org.ppvariant.cli.CommandLineInterface;
import org.ppvariant.compiler.VariantAnalyzer;
import org.ppvariant.compiler.api.CompilationException;
import org.ppvariant.compiler.frontend.io.SourceLoader;
import org.ppvariant.compiler.frontend.preprocessor.flow.ConditionalBlock;
import org.ppvariant.compiler.frontend.preprocessor.flow.FlowGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that prints the conditional flow graph of a source file as JSON.
 */
@Command(
    name = "flow-graph",
    mixinStandardHelpOptions = true,
    description = "Print the conditional flow graph of a source file as JSON"
)
public class FlowGraphCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FlowGraphCommand.class);

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    @Option(names = {"-f", "--file"}, required = true, description = "Source file to analyze")
    private String file;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        try {
            var config = parent.getConfig();
            SourceLoader.LoadResult source = SourceLoader.load(file);
            FlowGraph graph = new VariantAnalyzer(config.getInt("ppvariant.flow.max-macros"))
                    .analyze(source.content(), source.logicalName())
                    .graph();
            out.println(gson.toJson(toJson(source.logicalName(), graph)));
            out.flush();
            return 0;
        } catch (CompilationException e) {
            log.error("Analysis of {} failed", file);
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Could not read {}: {}", file, e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (ConfigException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            log.error("Cannot process {}: {}", file, e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    static JsonObject toJson(String fileName, FlowGraph graph) {
        JsonObject root = new JsonObject();
        root.addProperty("file", fileName);
        root.addProperty("tokens", graph.size());

        JsonObject macros = new JsonObject();
        for (Map.Entry<String, Integer> entry : graph.macros().entrySet()) {
            macros.addProperty(entry.getKey(), entry.getValue());
        }
        root.add("macros", macros);

        JsonArray blocks = new JsonArray();
        for (ConditionalBlock block : graph.blocks()) {
            JsonObject b = new JsonObject();
            b.addProperty("open", block.openIndex());
            b.addProperty("negated", block.negated());
            JsonArray elsifs = new JsonArray();
            block.elsifIndices().forEach(elsifs::add);
            b.add("elsif", elsifs);
            if (block.hasElse()) {
                b.addProperty("else", block.elseIndex());
            }
            b.addProperty("endif", block.endifIndex());
            blocks.add(b);
        }
        root.add("blocks", blocks);

        JsonArray edges = new JsonArray();
        for (int i = 0; i < graph.size(); i++) {
            JsonObject edge = new JsonObject();
            edge.addProperty("from", i);
            edge.addProperty("token", graph.token(i).text());
            JsonArray to = new JsonArray();
            for (int successor : graph.successors(i)) {
                to.add(successor);
            }
            edge.add("to", to);
            edges.add(edge);
        }
        root.add("edges", edges);
        return root;
    }
}
