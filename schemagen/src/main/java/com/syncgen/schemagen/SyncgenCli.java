package com.syncgen.schemagen;

import com.syncgen.schemagen.cli.DiscoverCommand;
import com.syncgen.schemagen.cli.GenerateCommand;
import com.syncgen.schemagen.cli.IntrospectCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "syncgen",
        description = "Generate client sync schemas and mutation modules from a PostgreSQL database",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        subcommands = {
                IntrospectCommand.class,
                GenerateCommand.class,
                DiscoverCommand.class
        }
)
public class SyncgenCli implements Runnable {

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SyncgenCli()).execute(args);
        System.exit(exitCode);
    }
}
