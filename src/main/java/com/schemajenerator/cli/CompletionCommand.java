package com.schemajenerator.cli;

import java.util.concurrent.Callable;

import picocli.AutoComplete;
import picocli.CommandLine;

/**
 * Prints a completion script for the root command. The generated script loads
 * {@code bashcompinit} itself when sourced from zsh, so both shells get the same text.
 */
@CommandLine.Command(name = "completion", description = "Print a shell completion script", mixinStandardHelpOptions = true)
public class CompletionCommand implements Callable<Integer> {

    enum Shell { bash, zsh }

    @CommandLine.Parameters(index = "0", arity = "0..1", defaultValue = "bash", paramLabel = "SHELL",
            description = "Target shell: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private Shell shell;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        CommandLine root = spec.parent().commandLine();
        String script = AutoComplete.bash(root.getCommandName(), root);
        System.out.print(script);
        return 0;
    }
}
