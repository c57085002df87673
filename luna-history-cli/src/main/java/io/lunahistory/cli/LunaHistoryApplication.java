package io.lunahistory.cli;

import java.time.Clock;
import picocli.CommandLine;

public final class LunaHistoryApplication {

    private LunaHistoryApplication() {
    }

    public static void main(String[] args) {
        System.exit(commandLine(new CliContext(System.getenv(), Clock.systemUTC())).execute(args));
    }

    static CommandLine commandLine(CliContext context) {
        CommandLine commandLine = new CommandLine(new LunaHistoryCliCommand());
        commandLine.addSubcommand("serve", new ServeCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        return commandLine;
    }
}
