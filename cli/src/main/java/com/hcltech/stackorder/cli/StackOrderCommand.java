package com.hcltech.stackorder.cli;

import com.hcltech.stackorder.common.IEnvGetter;
import com.hcltech.stackorder.common.codec.Codec;
import com.hcltech.stackorder.common.errorsor.ErrorsOr;
import com.hcltech.stackorder.config.discovery.StackDirectoryFinder;
import com.hcltech.stackorder.dag.OrderedStack;
import com.hcltech.stackorder.dag.SortOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "stack-order",
    mixinStandardHelpOptions = true,
    version = "stack-order 1.0",
    description = "Prints the order in which stacks must be applied, based on each stack's dependencies.json.",
    footer = {
        "",
        "Environment:",
        "  LOG_LEVEL             log level on stderr (default ERROR)",
        "  STACK_ORDER_BASE_DIR  base directory when --base-dir is not given"
    }
)
public class StackOrderCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(StackOrderCommand.class);

    public static final String BASE_DIR_ENV = "STACK_ORDER_BASE_DIR";
    public static final String DEFAULT_DOT_FILE = "dependencies.dot";

    @Spec
    private CommandSpec spec;

    @Option(names = {"-b", "--base-dir"}, description = "Directory holding the stacks (default: $" + BASE_DIR_ENV + " or the working directory)")
    private Path baseDir;

    @Option(names = {"--max-depth"}, defaultValue = "" + StackDirectoryFinder.DEFAULT_MAX_DEPTH,
            description = "How many levels below the base directory stacks may live (default: ${DEFAULT-VALUE})")
    private int maxDepth;

    @Option(names = {"-r", "--reverse"}, description = "Print the destroy order instead of the apply order")
    private boolean reverse;

    @Option(names = {"-d", "--draw"}, description = "Also write the dependency graph in DOT format")
    private boolean draw;

    @Option(names = {"--dot-file"}, description = "DOT output file (default: <base-dir>/" + DEFAULT_DOT_FILE + ")")
    private Path dotFile;

    @Option(names = {"--names-only"}, description = "Print only the ordered directory names")
    private boolean namesOnly;

    private final IEnvGetter env;
    private final StackOrderRunner runner;

    public StackOrderCommand() {
        this(IEnvGetter.env, new StackOrderRunner());
    }

    public StackOrderCommand(IEnvGetter env, StackOrderRunner runner) {
        this.env = env;
        this.runner = runner;
    }

    @Override
    public Integer call() {
        LoggingConfigurator.configure(env);
        RunSettings settings = settings();
        log.debug("Running with {}", settings);

        ErrorsOr<String> rendered = runner.run(settings).flatMap(this::render);
        if (rendered.isError()) {
            PrintWriter err = spec.commandLine().getErr();
            for (String e : rendered.getErrors()) {
                log.error(e);
                err.println(e);
            }
            err.flush();
            return 1;
        }
        PrintWriter out = spec.commandLine().getOut();
        out.println(rendered.valueOrThrow());
        out.flush();
        return 0;
    }

    RunSettings settings() {
        Path base = baseDir != null ? baseDir : Path.of(IEnvGetter.getStringOr(env, BASE_DIR_ENV, "."));
        Path dot = draw ? (dotFile != null ? dotFile : base.resolve(DEFAULT_DOT_FILE)) : null;
        return new RunSettings(base, maxDepth, reverse ? SortOrder.REVERSE : SortOrder.FORWARD, dot);
    }

    private ErrorsOr<String> render(List<OrderedStack> plan) {
        Object payload = namesOnly
                ? plan.stream().map(OrderedStack::directory).toList()
                : plan.stream().map(OrderedStackJson::from).toList();
        return Codec.json().encode(payload);
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * The same configuration as the entry point. Tests use the overload to inject an environment.
     */
    public static CommandLine createCommandLine() {
        return createCommandLine(IEnvGetter.env);
    }

    public static CommandLine createCommandLine(IEnvGetter env) {
        CommandLine commandLine = new CommandLine(new StackOrderCommand(env, new StackOrderRunner()));
        commandLine.setCommandName("stack-order");
        return commandLine;
    }
}
