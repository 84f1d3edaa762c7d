package io.ticketring.cli;

import io.ticketring.error.TicketRingException;
import io.ticketring.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.IExecutionExceptionHandler;
import picocli.CommandLine.ParseResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Prints domain failures as a JSON object on stderr instead of a stack trace.
 */
final class CliErrorHandler implements IExecutionExceptionHandler {
    static final int EXIT_ERROR = 1;

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, ParseResult parseResult) throws Exception {
        if (!(ex instanceof TicketRingException failure)) {
            throw ex;
        }
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("error_code", failure.code().name());
        view.put("error", failure.getMessage());
        if (failure.slot() != null) {
            view.put("slot", failure.slot().documentName());
        }
        commandLine.getErr().println(Jsons.toJson(view));
        return EXIT_ERROR;
    }
}
