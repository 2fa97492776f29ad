package com.gridfeed.loader;

import com.gridfeed.loader.cli.BuildCommand;
import com.gridfeed.loader.cli.RunCommand;
import com.gridfeed.loader.cli.SplitCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "gridfeed",
        description = "Turn an energy-system model workbook into GraphQL mutations",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        subcommands = {
                SplitCommand.class,
                BuildCommand.class,
                RunCommand.class
        }
)
public class GridfeedCli implements Runnable {

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GridfeedCli()).execute(args);
        System.exit(exitCode);
    }
}
