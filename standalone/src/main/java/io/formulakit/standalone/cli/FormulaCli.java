package io.formulakit.standalone.cli;

import io.formulakit.core.catalog.FormulaCatalog;
import io.formulakit.core.engine.FormulaRegistry;
import io.formulakit.core.engine.FormulaRunner;
import io.formulakit.core.error.FormulaCatalogException;
import io.formulakit.core.error.FormulaEvalException;
import io.formulakit.core.error.FormulaParseException;
import io.formulakit.core.model.Binding;
import io.formulakit.core.model.Formula;
import io.formulakit.core.parser.FormulaParser;
import io.formulakit.core.random.SeededRandomProvider;
import io.formulakit.core.random.ThreadLocalRandomProvider;
import io.formulakit.core.spi.FormulaListener;
import io.formulakit.core.spi.RandomProvider;
import io.formulakit.standalone.config.CliConfig;
import io.formulakit.standalone.config.ConfigLoadException;
import io.formulakit.standalone.config.ConfigLoader;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.function.BiConsumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line front end over a formula catalog.
 *
 * <pre>
 * formulakit [--config file] list
 * formulakit [--config file] inputs &lt;id&gt;
 * formulakit [--config file] eval &lt;id&gt; [name=value ...]
 * formulakit [--config file] expr "&lt;expression&gt;" [name=value ...]
 * formulakit [--config file] check "&lt;expression&gt;"
 * </pre>
 *
 * Results go to standard output, diagnostics to standard error. Exit codes: {@link #EXIT_OK},
 * {@link #EXIT_FAILURE} for parse and evaluation failures, {@link #EXIT_USAGE} for usage and
 * configuration errors.
 */
public final class FormulaCli {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    static final String BUNDLED_CATALOG = "/catalog/examples.json";

    static final String USAGE = String.join(
            System.lineSeparator(),
            "Usage: formulakit [--config <file>] <command>",
            "Commands:",
            "  list                                  list catalog formulas",
            "  inputs <id>                           print the inputs a formula requires",
            "  eval <id> [name=value ...]            evaluate a catalog formula",
            "  expr \"<expression>\" [name=value ...]  evaluate an ad-hoc expression",
            "  check \"<expression>\"                  validate an expression");

    private static final Logger LOG = LoggerFactory.getLogger(FormulaCli.class);

    private final PrintStream out;
    private final PrintStream err;
    private final Function<String, String> envLookup;
    private final BiConsumer<String, String> loggingSetup;

    /** Creates a CLI that leaves the logging setup untouched. */
    public FormulaCli(PrintStream out, PrintStream err, Function<String, String> envLookup) {
        this(out, err, envLookup, (format, level) -> {});
    }

    /**
     * @param loggingSetup receives {@code logging.format} and {@code logging.level} once the
     *                     configuration is loaded
     */
    public FormulaCli(
            PrintStream out,
            PrintStream err,
            Function<String, String> envLookup,
            BiConsumer<String, String> loggingSetup) {
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.err = Objects.requireNonNull(err, "err must not be null");
        this.envLookup = Objects.requireNonNull(envLookup, "envLookup must not be null");
        this.loggingSetup = Objects.requireNonNull(loggingSetup, "loggingSetup must not be null");
    }

    /**
     * Runs one command.
     *
     * @return the process exit code
     */
    public int run(String... args) {
        List<String> remaining = new ArrayList<>(Arrays.asList(args));
        try {
            String configPath = extractConfigPath(remaining);
            if (remaining.isEmpty()) {
                throw new UsageException("Missing command");
            }
            String command = remaining.remove(0);
            CliConfig config = ConfigLoader.resolve(configPath, envLookup);
            loggingSetup.accept(config.loggingFormat(), config.loggingLevel());
            LOG.debug("cli.start command={} config={}", command, config);

            switch (command) {
                case "list":
                    requireArgs(command, remaining, 0);
                    return list(config);
                case "inputs":
                    requireArgs(command, remaining, 1);
                    return inputs(config, remaining.get(0));
                case "eval":
                    requireAtLeast(command, remaining, 1);
                    return eval(config, remaining.get(0), parseBindings(remaining.subList(1, remaining.size())));
                case "expr":
                    requireAtLeast(command, remaining, 1);
                    return expr(config, remaining.get(0), parseBindings(remaining.subList(1, remaining.size())));
                case "check":
                    requireArgs(command, remaining, 1);
                    return check(config, remaining.get(0));
                default:
                    throw new UsageException("Unknown command '" + command + "'");
            }
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        } catch (ConfigLoadException | FormulaCatalogException e) {
            LOG.debug("cli.setup_failed", e);
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    private int list(CliConfig config) {
        FormulaRegistry registry = loadRegistry(config, FormulaListener.NOOP);
        for (String id : registry.ids()) {
            out.println(id + "\t" + collapse(registry.expression(id).orElse("")));
        }
        return EXIT_OK;
    }

    private int inputs(CliConfig config, String id) {
        FormulaRegistry registry = loadRegistry(config, FormulaListener.NOOP);
        if (!registry.contains(id)) {
            err.println("Error: Formula '" + id + "' not found");
            return EXIT_FAILURE;
        }
        new TreeSet<>(registry.requiredInputs(id)).forEach(out::println);
        return EXIT_OK;
    }

    private int eval(CliConfig config, String id, Map<String, Double> inputs) {
        List<String> failures = new ArrayList<>();
        FormulaRegistry registry = loadRegistry(config, new FormulaListener() {
            @Override
            public void onEvaluationFailed(EvaluationFailedEvent event) {
                failures.add(event.errorDetail());
            }
        });
        FormulaRunner runner = new FormulaRunner(registry);
        runner.setInputPooling(config.inputPooling());

        Binding[] bindings = inputs.entrySet().stream()
                .map(entry -> Binding.of(entry.getKey(), entry.getValue()))
                .toArray(Binding[]::new);
        double result = runner.evaluate(id, bindings);
        if (!failures.isEmpty()) {
            failures.forEach(detail -> err.println("Error: " + detail));
            return EXIT_FAILURE;
        }
        out.println(result);
        return EXIT_OK;
    }

    private int expr(CliConfig config, String expression, Map<String, Double> inputs) {
        try {
            Formula formula = parser(config).parse(expression);
            out.println(formula.evaluate(inputs));
            return EXIT_OK;
        } catch (FormulaParseException | FormulaEvalException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int check(CliConfig config, String expression) {
        try {
            Formula formula = parser(config).parse(expression);
            out.println("OK");
            out.println("inputs: " + String.join(", ", new TreeSet<>(formula.requiredInputs())));
            out.println("locals: " + String.join(", ", new TreeSet<>(formula.localVariables())));
            return EXIT_OK;
        } catch (FormulaParseException e) {
            err.println(e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private FormulaRegistry loadRegistry(CliConfig config, FormulaListener listener) {
        FormulaRegistry registry = new FormulaRegistry(parser(config), listener);
        FormulaCatalog catalog = new FormulaCatalog(registry);
        if (config.catalog() != null) {
            catalog.loadFile(Path.of(config.catalog()));
        } else {
            try (InputStream in = FormulaCli.class.getResourceAsStream(BUNDLED_CATALOG)) {
                if (in == null) {
                    throw new FormulaCatalogException("Bundled catalog missing", BUNDLED_CATALOG);
                }
                catalog.loadStream(in, BUNDLED_CATALOG);
            } catch (IOException e) {
                throw new FormulaCatalogException("Failed to read bundled catalog", e, BUNDLED_CATALOG);
            }
        }
        return registry;
    }

    private static FormulaParser parser(CliConfig config) {
        RandomProvider random = config.randomSeed() != null
                ? new SeededRandomProvider(config.randomSeed())
                : ThreadLocalRandomProvider.INSTANCE;
        return new FormulaParser(random);
    }

    private static String extractConfigPath(List<String> args) {
        int index = args.indexOf("--config");
        if (index < 0) {
            return null;
        }
        if (index + 1 >= args.size()) {
            throw new UsageException("--config requires a file path argument");
        }
        String path = args.get(index + 1);
        args.subList(index, index + 2).clear();
        return path;
    }

    static Map<String, Double> parseBindings(List<String> args) {
        Map<String, Double> bindings = new LinkedHashMap<>();
        for (String arg : args) {
            int eq = arg.indexOf('=');
            if (eq <= 0) {
                throw new UsageException("Expected name=value but got '" + arg + "'");
            }
            String name = arg.substring(0, eq).trim();
            String value = arg.substring(eq + 1).trim();
            try {
                bindings.put(name, Double.parseDouble(value));
            } catch (NumberFormatException e) {
                throw new UsageException("Invalid number '" + value + "' for input '" + name + "'");
            }
        }
        return bindings;
    }

    private static void requireArgs(String command, List<String> args, int count) {
        if (args.size() != count) {
            throw new UsageException("'" + command + "' takes " + count + " argument(s)");
        }
    }

    private static void requireAtLeast(String command, List<String> args, int count) {
        if (args.size() < count) {
            throw new UsageException("'" + command + "' requires at least " + count + " argument(s)");
        }
    }

    private static String collapse(String expression) {
        return expression.replaceAll("\\s*\\n\\s*", " ");
    }
}
