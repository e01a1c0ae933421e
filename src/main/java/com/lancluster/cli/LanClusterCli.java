package com.lancluster.cli;

import ch.qos.logback.classic.Level;
import com.lancluster.cli.commands.HostCommand;
import com.lancluster.cli.commands.JoinCommand;
import com.lancluster.cli.commands.KeygenCommand;
import com.lancluster.cli.commands.VersionCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * LanCluster CLI - main entry point and command dispatcher.
 *
 * <pre>
 * lancluster host --key-file cluster.key
 * lancluster join --host 192.168.1.100 --key ABC12345 --key-file cluster.key
 * </pre>
 */
@Command(
    name = "lancluster",
    description = "LanCluster - distributed task execution across LAN machines",
    version = "LanCluster v1.0-SNAPSHOT",
    mixinStandardHelpOptions = true,
    subcommands = {
        HostCommand.class,
        JoinCommand.class,
        KeygenCommand.class,
        VersionCommand.class
    }
)
public class LanClusterCli implements Callable<Integer> {

    @Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose output (DEBUG logging)"
    )
    private boolean verbose;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Parses and executes without exiting the JVM.
     *
     * @return the process exit code
     */
    public static int run(String... args) {
        LanClusterCli cli = new LanClusterCli();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            if (cli.verbose) {
                enableDebugLogging();
            }
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine.execute(args);
    }

    @Override
    public Integer call() {
        // No subcommand: show usage
        new CommandLine(this).usage(System.out);
        return 0;
    }

    public boolean isVerbose() {
        return verbose;
    }

    private static void enableDebugLogging() {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
        }
    }
}
