package io.repoinsight;

import io.repoinsight.cli.AnalyzeCommand;
import io.repoinsight.cli.PatternsCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * CLI entry point for the repo-insight tool.
 */
@Command(
        name = "repo-insight",
        mixinStandardHelpOptions = true,
        version = "repo-insight 1.0.0",
        description = "Dependency-graph analysis with learned, self-tuning confidence scores.",
        subcommands = {
                AnalyzeCommand.class,
                PatternsCommand.class,
                CommandLine.HelpCommand.class
        },
        footer = {
                "",
                "Examples:",
                "  repo-insight analyze deps.json",
                "  repo-insight analyze deps.json --output-format json --output-file report.json",
                "  repo-insight analyze deps.json --changed src/utils/date.ts --fail-on high",
                "  repo-insight patterns --detector enhanced-db --sort success-rate --desc --limit 10",
                "  repo-insight patterns --cleanup --stats"
        }
)
public class RepoInsightCli implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(System.out);
        return 0;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new RepoInsightCli()).execute(args));
    }
}
