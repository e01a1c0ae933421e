package com.lancluster.cli.commands;

import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * Prints version information about LanCluster and its components.
 */
@Command(name = "version", description = "Show version information")
public class VersionCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println("LanCluster - distributed task execution");
        System.out.println();
        System.out.println("Version: 1.0-SNAPSHOT");
        System.out.println("Java: " + System.getProperty("java.version"));
        System.out.println("OS: " + System.getProperty("os.name") + " " + System.getProperty("os.version"));
        System.out.println();
        System.out.println("Components:");
        System.out.println("  - Transport: TCP, AES-256-GCM frames");
        System.out.println("  - Encoding: Jackson JSON");
        System.out.println("  - CLI: Picocli 4.7.5");
        System.out.println("  - Logging: SLF4J + Logback");
        System.out.println();
        return 0;
    }
}
