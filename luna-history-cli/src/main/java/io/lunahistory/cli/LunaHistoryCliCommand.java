package io.lunahistory.cli;

import picocli.CommandLine.Command;

@Command(
    name = "luna-history",
    mixinStandardHelpOptions = true,
    version = "luna-history 0.1.0",
    description = "Conversation history and memory notes for MCP clients"
)
public final class LunaHistoryCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
