package im.arun.outline.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.outline.config.ConfigLoader;
import im.arun.outline.config.OutlineConfig;
import im.arun.outline.model.OutlineResult;
import im.arun.outline.service.OutlineService;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Command-line interface for the page outline engine using Picocli.
 */
@Command(
    name = "page-outline",
    description = "Compress accessibility-tree page snapshots into short outlines that keep every ref",
    mixinStandardHelpOptions = true,
    version = "page-outline 1.0"
)
public class OutlineCLI implements Callable<Integer> {

    static final String STDIN = "-";

    enum Mode { outline, raw }

    enum Format { text, json }

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "0..*", paramLabel = "SNAPSHOT", description = "Snapshot files to compress ('-' or none reads stdin)")
    private List<String> inputs = new ArrayList<>();

    @Option(names = {"--max-lines"}, description = "Line budget for the rendered outline")
    private Integer maxLines;

    @Option(names = {"--min-group-size"}, description = "Smallest run of similar siblings that gets folded")
    private Integer minGroupSize;

    @Option(names = {"--max-tokens"}, description = "Token cap used by raw mode")
    private Integer maxTokens;

    @Option(names = {"--mode"}, description = "outline or raw (${COMPLETION-CANDIDATES})", defaultValue = "outline")
    private Mode mode;

    @Option(names = {"--format"}, description = "text or json (${COMPLETION-CANDIDATES})", defaultValue = "text")
    private Format format;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--output"}, description = "Write the result to this file instead of stdout")
    private String outputPath;

    private final OutlineService service;

    public OutlineCLI() {
        this(new OutlineService());
    }

    OutlineCLI(OutlineService service) {
        this.service = service;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            OutlineConfig config = new ConfigLoader(configPath).load(userOptions());
            config.validate();

            List<String> sources = inputs.isEmpty() ? List.of(STDIN) : inputs;
            List<OutlineResult> results = processAll(sources, config);

            String rendered = format == Format.json ? toJson(results) : toText(results);
            if (outputPath != null) {
                Files.writeString(Paths.get(outputPath), rendered, StandardCharsets.UTF_8);
                err.println("Output written to: " + outputPath);
            } else {
                out.println(rendered);
            }
            out.flush();
            return 0;
        } catch (IOException | UncheckedIOException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            err.println("Error: " + cause.getMessage());
            return 1;
        }
    }

    private List<OutlineResult> processAll(List<String> sources, OutlineConfig config) throws IOException {
        List<String> snapshots = new ArrayList<>(sources.size());
        for (String source : sources) {
            snapshots.add(read(source));
        }

        ExecutorService executor = newWorkerPool(sources.size());
        try {
            List<CompletableFuture<OutlineResult>> futures = new ArrayList<>();
            for (int i = 0; i < sources.size(); i++) {
                String source = sources.get(i);
                String snapshot = snapshots.get(i);
                futures.add(CompletableFuture.supplyAsync(() -> process(source, snapshot, config), executor));
            }
            return futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());
        } finally {
            executor.shutdown();
        }
    }

    /**
     * Bounded pool of daemon threads, one per snapshot up to the processor count.
     */
    private static ExecutorService newWorkerPool(int tasks) {
        int poolSize = Math.max(1, Math.min(tasks, Runtime.getRuntime().availableProcessors()));
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(poolSize, runnable -> {
            Thread thread = new Thread(runnable, "outline-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    private OutlineResult process(String source, String snapshot, OutlineConfig config) {
        if (mode == Mode.raw) {
            String limited = service.limitRaw(snapshot, config);
            return OutlineResult.builder()
                .source(source)
                .body(limited)
                .originalLines((int) snapshot.lines().count())
                .renderedLines((int) limited.lines().count())
                .build();
        }
        OutlineResult result = service.generateResult(snapshot, config);
        result.setSource(source);
        return result;
    }

    private Map<String, Object> userOptions() {
        Map<String, Object> options = new HashMap<>();
        if (maxLines != null) options.put("maxLines", maxLines);
        if (minGroupSize != null) options.put("minGroupSize", minGroupSize);
        if (maxTokens != null) options.put("maxTokens", maxTokens);
        return options;
    }

    private String read(String source) throws IOException {
        if (STDIN.equals(source)) {
            return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        }
        Path path = Paths.get(source);
        if (!Files.exists(path)) {
            throw new IOException("Snapshot file not found: " + source);
        }
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    private String toText(List<OutlineResult> results) {
        List<String> blocks = new ArrayList<>();
        for (OutlineResult result : results) {
            String block = mode == Mode.raw ? result.getBody() : result.toText();
            if (results.size() > 1) {
                block = "==> " + result.getSource() + " <==\n" + block;
            }
            blocks.add(block);
        }
        return String.join("\n\n", blocks);
    }

    private String toJson(List<OutlineResult> results) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        Object payload = results.size() == 1 ? results.get(0) : results;
        return mapper.writeValueAsString(payload);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new OutlineCLI()).execute(args);
        System.exit(exitCode);
    }
}
