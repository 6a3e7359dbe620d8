package io.formulakit.standalone;

import io.formulakit.standalone.cli.FormulaCli;
import io.formulakit.standalone.config.LogbackConfigurator;

/**
 * Entry point for the {@code formulakit} command-line runner. Delegates to {@link FormulaCli} and
 * exits with its status code.
 */
public final class StandaloneMain {

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code --config formulakit.yaml eval damage
     *             baseDamage=10 strength=5})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        FormulaCli cli = new FormulaCli(System.out, System.err, System::getenv, LogbackConfigurator::configure);
        System.exit(cli.run(args));
    }
}
