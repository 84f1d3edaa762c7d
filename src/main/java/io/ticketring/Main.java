package io.ticketring;

import io.ticketring.cli.TicketRingCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = TicketRingCommand.commandLine().execute(args);
        System.exit(code);
    }
}
