package org.ppvariant.cli.commands;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;

import org.ppvariant.cli.CommandLineInterface;
import org.ppvariant.cli.output.OutputFormat;
import org.ppvariant.cli.output.VariantSink;
import org.ppvariant.cli.output.VariantWriter;
import org.ppvariant.compiler.VariantAnalyzer;
import org.ppvariant.compiler.api.CompilationException;
import org.ppvariant.compiler.frontend.io.SourceLoader;
import org.ppvariant.compiler.frontend.preprocessor.flow.FlowTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that prints every preprocessing variant of a source file.
 * <p>
 * Options not given on the command line fall back to {@code ppvariant.output.*} in the
 * configuration.
 */
@Command(
    name = "variants",
    mixinStandardHelpOptions = true,
    description = "Print every preprocessing variant of a source file"
)
public class VariantsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(VariantsCommand.class);

    @Option(names = {"-f", "--file"}, required = true, description = "Source file to analyze")
    private String file;

    @Option(names = {"-l", "--limit"}, description = "Stop after this many variants (0 = unlimited)")
    private Integer limit;

    @Option(names = {"--format"}, description = "Output format: text or json")
    private String format;

    @Option(names = {"-o", "--output"}, description = "Write variants to this file instead of stdout")
    private File outputFile;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        try {
            Config config = parent.getConfig();
            int maxVariants = limit != null ? limit : config.getInt("ppvariant.output.limit");
            OutputFormat outputFormat = OutputFormat.parse(
                    format != null ? format : config.getString("ppvariant.output.format"));
            String separator = config.getString("ppvariant.output.separator");

            SourceLoader.LoadResult source = SourceLoader.load(file);
            FlowTree tree = new VariantAnalyzer(config.getInt("ppvariant.flow.max-macros"))
                    .analyze(source.content(), source.logicalName());

            long stackSize = config.getBytes("ppvariant.traversal.stack-size");
            int count;
            if (outputFile != null) {
                try (Writer fileWriter = Files.newBufferedWriter(outputFile.toPath(), StandardCharsets.UTF_8)) {
                    count = writeVariants(tree, outputFormat.createWriter(fileWriter, separator),
                            source.logicalName(), maxVariants, stackSize);
                }
                out.printf("Wrote %d variant(s) to %s%n", count, outputFile.getAbsolutePath());
            } else {
                count = writeVariants(tree, outputFormat.createWriter(new BufferedWriter(out), separator),
                        source.logicalName(), maxVariants, stackSize);
            }
            out.flush();
            log.info("Generated {} variant(s) of {}", count, source.logicalName());
            return 0;
        } catch (CompilationException e) {
            log.error("Analysis of {} failed", file);
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException | UncheckedIOException e) {
            log.error("I/O error while processing {}: {}", file, e.getMessage());
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

    private int writeVariants(FlowTree tree, VariantWriter writer, String fileName,
                              int maxVariants, long stackSize) throws IOException {
        VariantSink sink = new VariantSink(writer, maxVariants);
        writer.begin(fileName);
        runWithStack(() -> tree.generateVariants(sink), stackSize);
        writer.end(sink.getWritten());
        return sink.getWritten();
    }

    /**
     * Runs the enumeration on a dedicated thread, because recursion depth grows with the
     * length of the source.
     */
    private static void runWithStack(Runnable traversal, long stackSize) {
        FutureTask<Void> task = new FutureTask<>(traversal, null);
        Thread worker = new Thread(null, task, "variant-traversal", stackSize);
        worker.start();
        try {
            task.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.interrupt();
            throw new IllegalStateException("Interrupted while enumerating variants", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Variant enumeration failed", cause);
        }
    }
}
