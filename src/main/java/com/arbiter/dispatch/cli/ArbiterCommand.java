package com.arbiter.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Arbiter.
 */
@Command(
        name = "arbiter",
        mixinStandardHelpOptions = true,
        version = "Arbiter 0.1.0",
        description = "Governed decision engine: advisory claim triage with a mandatory human gate",
        subcommands = {
                EvaluateCommand.class,
                ChainCommand.class,
                VerifyCommand.class,
                PolicyCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ArbiterCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
